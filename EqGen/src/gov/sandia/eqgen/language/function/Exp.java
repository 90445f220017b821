/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.function;

import java.util.Map;

import javax.measure.Unit;

import gov.sandia.eqgen.language.DimensionMismatchException;
import gov.sandia.eqgen.language.Function;
import gov.sandia.eqgen.language.Operator;

public class Exp extends Function
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "exp";
            }

            public Operator createInstance ()
            {
                return new Exp ();
            }
        };
    }

    public Exp ()
    {
        super ("exp");
    }

    public int arity ()
    {
        return 1;
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        return determineUnitDimensionless (units);
    }
}
