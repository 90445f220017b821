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
import gov.sandia.eqgen.language.Operator;
import gov.sandia.eqgen.language.OperatorUnary;
import tech.units.indriya.AbstractUnit;

public class NOT extends OperatorUnary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "not";
            }

            public Operator createInstance ()
            {
                return new NOT ();
            }
        };
    }

    /**
        Binds more loosely than comparison but more tightly than "and".
    **/
    public int precedence ()
    {
        return 7;
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        operand.determineUnit (units);
        unit = AbstractUnit.ONE;
        return unit;
    }

    public int degree (Collection<String> variables)
    {
        if (operand.degree (variables) == INDEPENDENT) return INDEPENDENT;
        return NONLINEAR;
    }

    public String toString ()
    {
        return "not ";
    }
}
