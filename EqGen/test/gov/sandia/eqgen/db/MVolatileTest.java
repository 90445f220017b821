/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.db;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class MVolatileTest
{
    @Test
    public void testPaths ()
    {
        MNode root = new MVolatile ();
        root.set ("double", "Backend", "c", "type");
        assertEquals ("double", root.get ("Backend", "c", "type"));
        assertEquals ("",       root.get ("Backend", "python", "numpy"));
        assertEquals ("_np",    root.getOrDefault ("_np", "Backend", "python", "numpy"));
        assertNull (root.child ("Backend", "python"));
        assertFalse (root.data ("Backend"));
        assertTrue  (root.data ("Backend", "c", "type"));
        assertEquals ("c", root.child ("Backend", "c").key ());
        assertEquals ("Backend", root.child ("Backend", "c").parent ().key ());
        assertTrue (root.childOrEmpty ("missing").isEmpty ());
    }

    @Test
    public void testTypedGetters ()
    {
        MNode root = new MVolatile ();
        root.set ("4",    "indent");
        root.set ("x",    "bad");
        root.set ("1",    "flag");
        root.set ("2.5",  "scale");
        assertEquals (4,    root.getOrDefault (0,     "indent"));
        assertEquals (7,    root.getOrDefault (7,     "bad"));
        assertEquals (true, root.getOrDefault (false, "flag"));
        assertEquals (2.5,  root.getOrDefault (0.0,   "scale"), 0);
    }

    @Test
    public void testKeyOrder ()
    {
        MNode root = new MVolatile ();
        for (String key : new String[] {"b", "10", "a", "9"}) root.set ("", key);
        List<String> keys = new ArrayList<String> ();
        for (MNode c : root) keys.add (c.key ());
        assertEquals (Arrays.asList ("9", "10", "a", "b"), keys);
    }

    @Test
    public void testMerge ()
    {
        MNode a = new MVolatile ();
        a.set ("1", "x");
        a.set ("2", "y");
        MNode b = new MVolatile ();
        b.set ("3", "y");
        b.set ("4", "z", "w");
        a.merge (b);
        assertEquals ("1", a.get ("x"));
        assertEquals ("3", a.get ("y"));
        assertEquals ("4", a.get ("z", "w"));
    }

    @Test
    public void testSchema () throws Exception
    {
        String text = "# comment\n"
                    + "Backend\n"
                    + " c\n"
                    + "  type:double\n"
                    + "  header:|\n"
                    + "   int x;\n"
                    + "   int y;\n"
                    + "Template\n"
                    + " index:_neuron_idx\n";
        MNode root = new MVolatile ();
        Schema.read (root, new StringReader (text));
        assertEquals ("double", root.get ("Backend", "c", "type"));
        assertEquals ("int x;\nint y;", root.get ("Backend", "c", "header"));
        assertEquals ("_neuron_idx", root.get ("Template", "index"));

        StringWriter writer = new StringWriter ();
        Schema.write (root, writer);
        MNode copy = new MVolatile ();
        Schema.read (copy, new StringReader (writer.toString ()));
        assertEquals (root.toString (), copy.toString ());
        assertEquals ("int x;\nint y;", copy.get ("Backend", "c", "header"));
    }

    @Test
    public void testDefaults ()
    {
        assertEquals ("double", AppData.state.get ("Backend", "c", "type"));
        assertEquals ("_num_neurons", AppData.state.get ("Template", "size"));
        assertEquals ("constant", AppData.state.get ("Flags", "parameter"));
    }
}
