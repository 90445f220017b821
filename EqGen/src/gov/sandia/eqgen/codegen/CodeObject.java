/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
    Generated code bound to a namespace. Goes through three phases:
    construction, then compile() exactly once, then any number of invoke().
**/
public abstract class CodeObject
{
    public interface CompileHook
    {
        public void run (Map<String,Object> namespace);
    }

    protected CodeBlock          code;
    protected List<CompileHook>  hooks;
    protected Map<String,Object> namespace;  // null until compiled

    public CodeObject (CodeBlock code, List<CompileHook> hooks)
    {
        this.code = code;
        if (hooks == null) this.hooks = Collections.emptyList ();
        else               this.hooks = hooks;
    }

    public CodeBlock getCode ()
    {
        return code;
    }

    public boolean isCompiled ()
    {
        return namespace != null;
    }

    public Map<String,Object> getNamespace ()
    {
        return namespace;
    }

    /**
        Binds the namespace, then runs each hook against it in order.
        The namespace belongs to this object afterwards. The caller should not modify it.
    **/
    public void compile (Map<String,Object> namespace)
    {
        if (this.namespace != null) throw new IllegalStateException ("Code object is already compiled");
        if (namespace == null) throw new IllegalArgumentException ("Namespace is null");
        this.namespace = namespace;
        for (CompileHook h : hooks) h.run (namespace);
    }

    /**
        Runs the code. The bindings are overlaid on a copy of the compiled namespace,
        so they affect only this call.
    **/
    public Object invoke (Map<String,Object> bindings)
    {
        if (namespace == null) throw new IllegalStateException ("Code object must be compiled before it is invoked");
        Map<String,Object> local = new HashMap<String,Object> (namespace);
        if (bindings != null) local.putAll (bindings);
        return run (local);
    }

    protected abstract Object run (Map<String,Object> namespace);
}
