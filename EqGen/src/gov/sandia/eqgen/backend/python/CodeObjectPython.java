/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.python;

import java.util.List;
import java.util.Map;

import gov.sandia.eqgen.codegen.CodeBlock;
import gov.sandia.eqgen.codegen.CodeObject;

/**
    Holds generated Python source. Executing it belongs to the simulation runtime.
**/
public class CodeObjectPython extends CodeObject
{
    public CodeObjectPython (CodeBlock code, List<CompileHook> hooks)
    {
        super (code, hooks);
    }

    protected Object run (Map<String,Object> namespace)
    {
        throw new UnsupportedOperationException ("Generated Python code must be executed by the simulation runtime");
    }
}
