/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import java.util.Map;

/**
    A function supplied by the caller rather than the target language.
    When a code object is compiled, the function gets a chance to install whatever
    it needs into the namespace.
**/
public abstract class UserFunction extends Specifier
{
    public abstract void onCompile (Map<String,Object> namespace, Language language, String var);
}
