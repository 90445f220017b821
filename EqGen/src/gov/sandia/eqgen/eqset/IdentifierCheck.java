/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import gov.sandia.eqgen.language.CodeString;

/**
    A rule that every declared name must satisfy.
    Equations applies a list of these, normally DEFAULTS or withDefaults(extra).
**/
public abstract class IdentifierCheck
{
    /**
        @throws InvalidIdentifierException if the identifier breaks this rule.
    **/
    public abstract void check (String identifier);

    public static final Set<String> keywords = new HashSet<String> (Arrays.asList
    (
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp", "super",
        "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void", "volatile", "while",
        "true", "false", "null",
        "and", "or", "not"  // word operators of the expression language
    ));

    public static final IdentifierCheck GRAMMAR = new IdentifierCheck ()
    {
        public void check (String identifier)
        {
            if (! identifier.matches ("[A-Za-z_][A-Za-z0-9_]*"))
            {
                throw new InvalidIdentifierException (identifier, "\"" + identifier + "\" is not a valid variable name.");
            }
        }
    };

    public static final IdentifierCheck KEYWORD = new IdentifierCheck ()
    {
        public void check (String identifier)
        {
            if (keywords.contains (identifier))
            {
                throw new InvalidIdentifierException (identifier, "\"" + identifier + "\" is a keyword and cannot be used as a variable.");
            }
        }
    };

    public static final IdentifierCheck UNDERSCORE = new IdentifierCheck ()
    {
        public void check (String identifier)
        {
            if (identifier.startsWith ("_"))
            {
                throw new InvalidIdentifierException (identifier, "Variable \"" + identifier + "\" starts with an underscore, this is only allowed for variables used internally.");
            }
        }
    };

    public static final IdentifierCheck SPECIAL = new IdentifierCheck ()
    {
        public void check (String identifier)
        {
            if (CodeString.specialNames.contains (identifier))
            {
                throw new InvalidIdentifierException (identifier, "\"" + identifier + "\" has a special meaning in equations and cannot be used as a variable name.");
            }
        }
    };

    public static final List<IdentifierCheck> DEFAULTS = Collections.unmodifiableList (Arrays.asList (GRAMMAR, KEYWORD, UNDERSCORE, SPECIAL));

    /**
        @return The default checks followed by the given ones.
    **/
    public static List<IdentifierCheck> withDefaults (IdentifierCheck... extra)
    {
        List<IdentifierCheck> result = new ArrayList<IdentifierCheck> (DEFAULTS);
        result.addAll (Arrays.asList (extra));
        return validate (result);
    }

    /**
        Ensures that every entry can actually be run.
        @return The same list, for chaining.
        @throws IllegalArgumentException if the list or any entry is null.
    **/
    public static List<IdentifierCheck> validate (List<IdentifierCheck> checks)
    {
        if (checks == null) throw new IllegalArgumentException ("List of identifier checks is null");
        for (int i = 0; i < checks.size (); i++)
        {
            if (checks.get (i) == null) throw new IllegalArgumentException ("Identifier check " + i + " is null");
        }
        return checks;
    }

    public static void checkAll (String identifier, List<IdentifierCheck> checks)
    {
        for (IdentifierCheck c : checks) c.check (identifier);
    }
}
