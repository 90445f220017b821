/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class IdentifierCheckTest
{
    public void assertRejected (IdentifierCheck check, String identifier)
    {
        try
        {
            check.check (identifier);
            fail ("Should reject " + identifier);
        }
        catch (InvalidIdentifierException e)
        {
            assertEquals (identifier, e.identifier);
        }
    }

    @Test
    public void testDefaults ()
    {
        for (String ok : new String[] {"v", "V_rest", "g2", "tau_m", "dt2", "xi_1"})
        {
            IdentifierCheck.checkAll (ok, IdentifierCheck.DEFAULTS);
        }
        assertRejected (IdentifierCheck.GRAMMAR,    "2x");
        assertRejected (IdentifierCheck.GRAMMAR,    "a.b");
        assertRejected (IdentifierCheck.KEYWORD,    "class");
        assertRejected (IdentifierCheck.KEYWORD,    "and");
        assertRejected (IdentifierCheck.KEYWORD,    "true");
        assertRejected (IdentifierCheck.UNDERSCORE, "_v");
        assertRejected (IdentifierCheck.SPECIAL,    "t");
        assertRejected (IdentifierCheck.SPECIAL,    "dt");
        assertRejected (IdentifierCheck.SPECIAL,    "xi");
    }

    @Test
    public void testWithDefaults ()
    {
        IdentifierCheck shortNames = new IdentifierCheck ()
        {
            public void check (String identifier)
            {
                if (identifier.length () > 3) throw new InvalidIdentifierException (identifier, identifier + " is too long");
            }
        };
        List<IdentifierCheck> checks = IdentifierCheck.withDefaults (shortNames);
        assertEquals (5, checks.size ());
        assertSame (shortNames, checks.get (4));
        IdentifierCheck.checkAll ("abc", checks);
        try
        {
            IdentifierCheck.checkAll ("abcd", checks);
            fail ("Custom check should apply");
        }
        catch (InvalidIdentifierException e)
        {
        }
    }

    @Test
    public void testValidate ()
    {
        try
        {
            IdentifierCheck.validate (null);
            fail ("null list");
        }
        catch (IllegalArgumentException e)
        {
        }

        List<IdentifierCheck> checks = new ArrayList<IdentifierCheck> (Arrays.asList (IdentifierCheck.GRAMMAR));
        checks.add (null);
        try
        {
            IdentifierCheck.validate (checks);
            fail ("null entry");
        }
        catch (IllegalArgumentException e)
        {
        }
    }
}
