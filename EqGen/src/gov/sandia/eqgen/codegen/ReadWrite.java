/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import java.util.Set;
import java.util.TreeSet;

/**
    Array-resident variables touched by a statement sequence.
**/
public class ReadWrite
{
    public Set<String> read  = new TreeSet<String> ();
    public Set<String> write = new TreeSet<String> ();

    public String toString ()
    {
        return "read=" + read + " write=" + write;
    }
}
