/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.c;

import java.util.List;
import java.util.Map;

import gov.sandia.eqgen.codegen.CodeBlock;
import gov.sandia.eqgen.codegen.CodeObject;

/**
    Holds generated C source. Building and running it belongs to the simulation runtime.
**/
public class CodeObjectC extends CodeObject
{
    public CodeObjectC (CodeBlock code, List<CompileHook> hooks)
    {
        super (code, hooks);
    }

    protected Object run (Map<String,Object> namespace)
    {
        throw new UnsupportedOperationException ("Generated C code must be built and run by the simulation runtime");
    }
}
