/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
    Generated code or a template. Either a single string, or a set of named slots
    each holding a string. Immutable.
**/
public class CodeBlock
{
    protected String             single;  // null if this block has slots
    protected Map<String,String> slots;   // null if this block is a single string

    public CodeBlock (String code)
    {
        single = code;
    }

    public CodeBlock (Map<String,String> slots)
    {
        this.slots = Collections.unmodifiableMap (new LinkedHashMap<String,String> (slots));
    }

    public boolean isSingle ()
    {
        return single != null;
    }

    /**
        @return The code of a single-string block.
        @throws IllegalStateException if this block has slots.
    **/
    public String get ()
    {
        if (single == null) throw new IllegalStateException ("Code block has slots " + slots.keySet () + " rather than a single string");
        return single;
    }

    /**
        @return Text of the given slot, or null if there is no such slot.
    **/
    public String get (String slot)
    {
        if (slots == null) return null;
        return slots.get (slot);
    }

    public Map<String,String> getSlots ()
    {
        if (slots == null) return Collections.emptyMap ();
        return slots;
    }

    /**
        Views this block as slots, filing a single string under the given key.
    **/
    public Map<String,String> asSlots (String key)
    {
        if (slots != null) return slots;
        Map<String,String> result = new LinkedHashMap<String,String> ();
        result.put (key, single);
        return result;
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof CodeBlock)) return false;
        CodeBlock that = (CodeBlock) o;
        if (single != null) return single.equals (that.single);
        return that.slots != null  &&  slots.equals (that.slots);
    }

    public int hashCode ()
    {
        if (single != null) return single.hashCode ();
        return slots.hashCode ();
    }

    public String toString ()
    {
        if (single != null) return single;
        StringBuilder result = new StringBuilder ();
        for (Map.Entry<String,String> e : slots.entrySet ())
        {
            result.append (e.getKey () + ":\n" + e.getValue () + "\n");
        }
        return result.toString ();
    }
}
