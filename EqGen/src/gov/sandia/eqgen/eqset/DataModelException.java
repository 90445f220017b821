/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

@SuppressWarnings("serial")
public class DataModelException extends RuntimeException
{
    public DataModelException (String message)
    {
        super (message);
    }

    public DataModelException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
