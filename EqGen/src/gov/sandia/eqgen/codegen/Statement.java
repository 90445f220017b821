/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
    A single assignment in abstract form, for translation by a Language.
    The operator is "=", an in-place form such as "+=", or ":=" which declares
    a temporary local to the generated code.
**/
public class Statement
{
    public static final String DECLARE = ":=";

    protected static final Pattern identifier = Pattern.compile ("(?<![A-Za-z0-9_.])[A-Za-z_][A-Za-z0-9_]*");

    public final String  var;
    public final String  op;
    public final String  expr;
    public final boolean inplace;  // The target's old value is read, so the target counts as an input.

    public Statement (String var, String op, String expr)
    {
        this (var, op, expr, op.length () == 2  &&  op.charAt (1) == '='  &&  "+-*/".indexOf (op.charAt (0)) >= 0);
    }

    public Statement (String var, String op, String expr, boolean inplace)
    {
        this.var     = var;
        this.op      = op;
        this.expr    = expr;
        this.inplace = inplace;
    }

    public boolean isDeclaration ()
    {
        return op.equals (DECLARE);
    }

    /**
        @return Every word in the right-hand side that could name a variable, in order of appearance.
    **/
    public Set<String> getIdentifiers ()
    {
        Set<String> result = new LinkedHashSet<String> ();
        Matcher m = identifier.matcher (expr);
        while (m.find ()) result.add (m.group ());
        return result;
    }

    public String toString ()
    {
        return var + " " + op + " " + expr;
    }
}
