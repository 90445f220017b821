/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.operator;

import java.util.Map;

import javax.measure.Unit;

import gov.sandia.eqgen.language.DimensionMismatchException;
import gov.sandia.eqgen.language.Operator;
import gov.sandia.eqgen.language.OperatorUnary;

public class Negate extends OperatorUnary
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "UM";  // unary minus
            }

            public Operator createInstance ()
            {
                return new Negate ();
            }
        };
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        unit = operand.determineUnit (units);
        return unit;
    }

    public double getDouble ()
    {
        return - operand.getDouble ();
    }

    public boolean isScalar ()
    {
        return operand.isScalar ();
    }

    public String toString ()
    {
        return "-";
    }
}
