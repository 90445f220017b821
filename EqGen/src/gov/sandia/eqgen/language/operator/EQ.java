/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.operator;

import gov.sandia.eqgen.language.Operator;

public class EQ extends Comparison
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "==";
            }

            public Operator createInstance ()
            {
                return new EQ ();
            }
        };
    }

    public String toString ()
    {
        return "==";
    }
}
