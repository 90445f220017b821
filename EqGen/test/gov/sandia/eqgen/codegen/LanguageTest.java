/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.junit.Test;

import gov.sandia.eqgen.db.MNode;
import gov.sandia.eqgen.db.MVolatile;

public class LanguageTest
{
    @Test
    public void testInlineSlot ()
    {
        Language c = Language.get ("c");
        CodeBlock result = c.applyTemplate (new CodeBlock ("x"), new CodeBlock ("begin %CODE% end"));
        assertTrue (result.isSingle ());
        assertEquals ("begin x end", result.get ());

        // A placeholder without matching code is left alone.
        result = c.applyTemplate (new CodeBlock ("y"), new CodeBlock ("%A% and %CODE%"));
        assertEquals ("%A% and y", result.get ());
    }

    @Test
    public void testSlotMap ()
    {
        Map<String,String> template = new LinkedHashMap<String,String> ();
        template.put ("main",    "    void f ()\n    {\n        %CODE%\n    }");
        template.put ("support", "%SUPPORT%");
        Map<String,String> code = new LinkedHashMap<String,String> ();
        code.put ("%CODE%",    "x = 1;\ny = 2;");
        code.put ("%SUPPORT%", "double g (double a);");

        CodeBlock result = Language.get ("c").applyTemplate (new CodeBlock (code), new CodeBlock (template));
        assertFalse (result.isSingle ());
        assertEquals (Arrays.asList ("main", "support"), new ArrayList<String> (result.getSlots ().keySet ()));
        assertEquals ("void f ()\n{\n    x = 1;\n    y = 2;\n}", result.get ("main"));
        assertEquals ("double g (double a);",                      result.get ("support"));
    }

    @Test
    public void testIndentation ()
    {
        assertEquals ("a\n  b\n\nc",   Language.deindent ("    a\n      b\n\n    c"));
        assertEquals ("a\nb",          Language.deindent ("a\nb"));
        assertEquals ("  a\n\n  b",    Language.indent ("a\n\nb", "  "));
        assertEquals ("if (x)\n{\n    y;\n    z;\n}", Language.applyCodeTemplate ("  y;\n  z;", "if (x)\n{\n    %CODE%\n}", Language.CODE));
    }

    @Test
    public void testReadWrite ()
    {
        Map<String,Specifier> specifiers = new LinkedHashMap<String,Specifier> ();
        specifiers.put ("x", new ArrayVariable ("_array_x", "_idx"));
        specifiers.put ("y", new ArrayVariable ("_array_y", "_idx"));
        specifiers.put ("z", new ArrayVariable ("_array_z", "_idx"));
        specifiers.put ("w", new ArrayVariable ("_array_w", "_idx"));
        specifiers.put ("f", new UserFunction ()
        {
            public void onCompile (Map<String,Object> namespace, Language language, String var)
            {
            }
        });

        List<Statement> statements = new ArrayList<Statement> ();
        statements.add (new Statement ("x", "=", "x + y"));
        ReadWrite rw = Language.get ("c").arrayReadWrite (statements, specifiers);
        assertEquals (new TreeSet<String> (Arrays.asList ("x", "y")), rw.read);
        assertEquals (new TreeSet<String> (Arrays.asList ("x")),      rw.write);

        // In-place update reads its target. Function names are not array variables.
        statements.add (new Statement ("z", "*=", "f(2)"));
        rw = Language.get ("c").arrayReadWrite (statements, specifiers);
        assertEquals (new TreeSet<String> (Arrays.asList ("x", "y", "z")), rw.read);
        assertEquals (new TreeSet<String> (Arrays.asList ("x", "z")),      rw.write);
    }

    @Test
    public void testSettings ()
    {
        Language c = Language.get ("c");
        assertEquals ("double",   c.setting ("type", "float"));
        assertEquals ("fallback", c.setting ("missing", "fallback"));
        assertEquals ("_neuron_idx", c.templateName ("index", "i"));

        MNode settings = new MVolatile ();
        settings.set ("wide", "indent");
        c = Language.get ("c", settings);
        assertEquals (7, c.setting ("indent", 7));
        assertEquals (3, c.setting ("missing", 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownLanguage ()
    {
        Language.get ("fortran");
    }

    @Test
    public void testStatement ()
    {
        Statement s = new Statement ("v", "=", "a.b + c_1 * 2e3 + f(x)");
        assertEquals (Arrays.asList ("a", "c_1", "f", "x"), new ArrayList<String> (s.getIdentifiers ()));
        assertFalse (s.inplace);
        assertFalse (s.isDeclaration ());
        assertTrue  (new Statement ("v", "-=", "1").inplace);
        assertFalse (new Statement ("v", Statement.DECLARE, "1").inplace);
        assertTrue  (new Statement ("v", Statement.DECLARE, "1").isDeclaration ());
        assertTrue  (new Statement ("v", "=", "1", true).inplace);
    }

    @Test
    public void testCodeBlock ()
    {
        CodeBlock single = new CodeBlock ("x");
        assertEquals ("x", single.asSlots ("%CODE%").get ("%CODE%"));
        assertTrue (single.getSlots ().isEmpty ());
        assertEquals (new CodeBlock ("x"), single);

        Map<String,String> slots = new LinkedHashMap<String,String> ();
        slots.put ("a", "1");
        CodeBlock multi = new CodeBlock (slots);
        slots.put ("b", "2");  // later changes don't leak in
        assertEquals (1, multi.getSlots ().size ());
        try
        {
            multi.get ();
            fail ("get() on a slotted block");
        }
        catch (IllegalStateException e)
        {
        }
    }
}
