/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

/**
    A declared name breaks one of the rules enforced by IdentifierCheck.
**/
@SuppressWarnings("serial")
public class InvalidIdentifierException extends DataModelException
{
    public String identifier;

    public InvalidIdentifierException (String identifier, String message)
    {
        super (message);
        this.identifier = identifier;
    }
}
