/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.operator;

import java.util.Collection;
import java.util.Map;

import javax.measure.Unit;

import gov.sandia.eqgen.language.DimensionMismatchException;
import gov.sandia.eqgen.language.EvaluationException;
import gov.sandia.eqgen.language.Operator;
import gov.sandia.eqgen.language.OperatorBinary;
import gov.sandia.eqgen.language.Renderer;
import gov.sandia.eqgen.language.UnitValue;
import tech.units.indriya.AbstractUnit;

public class Power extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "**";
            }

            public Operator createInstance ()
            {
                return new Power ();
            }
        };
    }

    public Associativity associativity ()
    {
        return Associativity.RIGHT_TO_LEFT;
    }

    public int precedence ()
    {
        return 2;
    }

    /**
        A dimensioned base requires a constant exponent, so the resulting unit is known.
    **/
    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        Unit<?> u0 = operand0.determineUnit (units);
        Unit<?> u1 = operand1.determineUnit (units);
        if (! UnitValue.isDimensionless (u1))
        {
            throw new DimensionMismatchException ("Exponent in \"" + render () + "\" must be dimensionless", u1, AbstractUnit.ONE);
        }
        if (UnitValue.isDimensionless (u0))
        {
            unit = AbstractUnit.ONE;
            return unit;
        }
        if (! operand1.isScalar ()) throw new EvaluationException ("Exponent of a quantity with units must be constant: " + render ());
        unit = UnitValue.power (u0, operand1.getDouble ());
        if (unit == null) throw new EvaluationException ("Can't raise unit " + UnitValue.format (u0) + " to power " + operand1.render ());
        return unit;
    }

    public int degree (Collection<String> variables)
    {
        int d0 = operand0.degree (variables);
        int d1 = operand1.degree (variables);
        if (d0 == INDEPENDENT  &&  d1 == INDEPENDENT) return INDEPENDENT;
        if (d1 == INDEPENDENT  &&  operand1.isScalar ())
        {
            double p = operand1.getDouble ();
            if (p == 0) return INDEPENDENT;
            if (p == 1) return d0;
        }
        return NONLINEAR;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        render (renderer, "**");
    }

    public String toString ()
    {
        return "**";
    }
}
