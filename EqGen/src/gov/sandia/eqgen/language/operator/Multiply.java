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
import gov.sandia.eqgen.language.OperatorBinary;

public class Multiply extends OperatorBinary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "*";
            }

            public Operator createInstance ()
            {
                return new Multiply ();
            }
        };
    }

    public int precedence ()
    {
        return 4;
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        Unit<?> u0 = operand0.determineUnit (units);
        Unit<?> u1 = operand1.determineUnit (units);
        unit = u0.multiply (u1);
        return unit;
    }

    public int degree (Collection<String> variables)
    {
        return Math.min (NONLINEAR, operand0.degree (variables) + operand1.degree (variables));
    }

    public String toString ()
    {
        return "*";
    }
}
