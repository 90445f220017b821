/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.db;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
    In-memory MNode. Nothing is persisted.
**/
public class MVolatile extends MNode
{
    protected String                     name;
    protected String                     value;
    protected MNode                      parent;
    protected NavigableMap<String,MNode> children;

    public MVolatile ()
    {
    }

    public MVolatile (String value, String name)
    {
        this.name  = name;
        this.value = value;
    }

    public MVolatile (String value, String name, MNode parent)
    {
        this.name   = name;
        this.value  = value;
        this.parent = parent;
    }

    public String key ()
    {
        if (name == null) return "";
        return name;
    }

    public MNode parent ()
    {
        return parent;
    }

    protected synchronized MNode getChild (String key)
    {
        if (children == null) return null;
        return children.get (key);
    }

    public synchronized int size ()
    {
        if (children == null) return 0;
        return children.size ();
    }

    public synchronized boolean data ()
    {
        return value != null;
    }

    public synchronized String getOrDefault (String defaultValue)
    {
        if (value == null  ||  value.isEmpty ()) return defaultValue;
        return value;
    }

    public synchronized void set (String value)
    {
        this.value = value;
    }

    public synchronized MNode set (String value, String key)
    {
        if (children == null) children = new TreeMap<String,MNode> (comparator);
        MNode result = children.get (key);
        if (result == null)
        {
            result = new MVolatile (value, key, this);
            children.put (key, result);
            return result;
        }
        result.set (value);
        return result;
    }

    public synchronized Iterator<MNode> iterator ()
    {
        if (children == null) return super.iterator ();
        return new IteratorWrapper (new ArrayList<String> (children.keySet ()));
    }
}
