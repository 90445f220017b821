/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.operator;

import gov.sandia.eqgen.language.Operator;

public class AND extends OperatorLogical
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "and";
            }

            public Operator createInstance ()
            {
                return new AND ();
            }
        };
    }

    public int precedence ()
    {
        return 8;
    }

    public String toString ()
    {
        return "and";
    }
}
