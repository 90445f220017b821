/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.io.PrintStream;

/**
    Syntax error in equation text or in an expression.
    Carries enough position information to point at the offending character.
**/
@SuppressWarnings("serial")
public class ParseException extends Exception
{
    public String line       = "";  // text of the offending line
    public int    lineNumber = -1;  // 1-based; -1 if unknown
    public int    column     = -1;  // 0-based position within line; -1 if unknown

    public ParseException (String message)
    {
        super (message);
    }

    public ParseException (String message, String line, int column)
    {
        super (message);
        this.line   = line;
        this.column = column;
    }

    public ParseException (String message, String line, int lineNumber, int column)
    {
        super (message);
        this.line       = line;
        this.lineNumber = lineNumber;
        this.column     = column;
    }

    public String getMessage ()
    {
        String message = super.getMessage ();
        if (lineNumber < 0) return message;
        return message + " (line " + lineNumber + ", column " + (column + 1) + ")";
    }

    public void print (PrintStream ps)
    {
        ps.println (getMessage ());
        ps.println (line);
        for (int i = 0; i < column; i++) ps.print (" ");
        ps.println ("^");
    }
}
