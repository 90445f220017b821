/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.db;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
    A hierarchical key-value tree used for settings.
    Keys are strings. Each node may hold a value, and may have any number of children.
    A node whose value is null is "undefined", which behaves like "" for the get*() functions.
    This base class stores nothing. See MVolatile for the in-memory implementation.
**/
public class MNode implements Iterable<MNode>
{
    public String key ()
    {
        return "";
    }

    public MNode parent ()
    {
        return null;
    }

    /**
        Returns the direct child with the given key, or null if it doesn't exist.
        Subclasses override this to expose their storage.
    **/
    protected MNode getChild (String key)
    {
        return null;
    }

    /**
        Returns a child node from arbitrary depth, or null if any part of the path doesn't exist.
        If no keys are given, returns this node.
    **/
    public synchronized MNode child (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) return null;
            result = c;
        }
        return result;
    }

    /**
        Retrieves a child node from arbitrary depth, creating any missing nodes along the way.
    **/
    public synchronized MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) c = result.set (null, key);
            result = c;
        }
        return result;
    }

    /**
        For iterating over a sub-node that might not exist.
        The returned node is detached from any tree when the path is missing.
    **/
    public MNode childOrEmpty (String... keys)
    {
        MNode result = child (keys);
        if (result == null) return new MNode ();
        return result;
    }

    public int size ()
    {
        return 0;
    }

    public boolean isEmpty ()
    {
        return size () == 0;
    }

    /**
        @return true if this node holds a value (even "").
    **/
    public boolean data ()
    {
        return false;
    }

    public boolean data (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return false;
        return c.data ();
    }

    public String get ()
    {
        return getOrDefault ("");
    }

    /**
        Returns the value at the given path, or "" if the node does not exist.
    **/
    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.get ();
    }

    /**
        Returns this node's value, or the default if undefined or "".
        The only getter a subclass needs to override.
    **/
    public String getOrDefault (String defaultValue)
    {
        return defaultValue;
    }

    public String getOrDefault (String defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        return value;
    }

    public boolean getOrDefault (boolean defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        if (value.equals ("1")) return true;
        return Boolean.parseBoolean (value);
    }

    public int getOrDefault (int defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Integer.parseInt (value);
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    public double getOrDefault (double defaultValue, String... keys)
    {
        String value = get (keys).trim ();
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Double.parseDouble (value);
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    /**
        Sets this node's own value. null makes the node undefined.
    **/
    public void set (String value)
    {
    }

    /**
        Sets the value of a direct child, creating it if needed.
        @return The child node that received the value.
    **/
    public MNode set (String value, String key)
    {
        return new MNode ();
    }

    /**
        Sets a value at arbitrary depth, creating intermediate nodes as needed.
    **/
    public synchronized MNode set (String value, String... keys)
    {
        MNode result = childOrCreate (keys);
        result.set (value);
        return result;
    }

    /**
        Deep copies the given tree into this one. Existing values are replaced only where
        the source has a defined value. Nodes missing from the source are left alone.
    **/
    public synchronized void merge (MNode that)
    {
        if (that.data ()) set (that.get ());
        for (MNode thatChild : that)
        {
            MNode c = childOrCreate (thatChild.key ());
            c.merge (thatChild);
        }
    }

    public Iterator<MNode> iterator ()
    {
        return new IteratorWrapper (new ArrayList<String> ());
    }

    /**
        Iterates over a snapshot of child keys, so the tree may be modified during iteration.
    **/
    public class IteratorWrapper implements Iterator<MNode>
    {
        protected Iterator<String> iterator;

        public IteratorWrapper (List<String> keys)
        {
            iterator = keys.iterator ();
        }

        public boolean hasNext ()
        {
            return iterator.hasNext ();
        }

        public MNode next ()
        {
            return getChild (iterator.next ());
        }
    }

    /**
        Collation order for keys: numbers before strings, numbers by value, strings lexically.
    **/
    public static int compare (String A, String B)
    {
        if (A.equals (B)) return 0;

        Double Avalue = null;
        Double Bvalue = null;
        try {Avalue = Double.valueOf (A);}
        catch (NumberFormatException e) {Avalue = null;}
        try {Bvalue = Double.valueOf (B);}
        catch (NumberFormatException e) {Bvalue = null;}

        if (Avalue == null)
        {
            if (Bvalue == null) return A.compareTo (B);
            return 1;
        }
        if (Bvalue == null) return -1;
        return Double.compare (Avalue, Bvalue);
    }

    public static Comparator<String> comparator = new Comparator<String> ()
    {
        public int compare (String A, String B)
        {
            return MNode.compare (A, B);
        }
    };

    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        Schema.write (this, writer);
        return writer.toString ();
    }
}
