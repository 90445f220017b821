/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import gov.sandia.eqgen.codegen.ArrayVariable;
import gov.sandia.eqgen.codegen.CodeBlock;
import gov.sandia.eqgen.codegen.CodeObject;
import gov.sandia.eqgen.codegen.Language;
import gov.sandia.eqgen.codegen.ReadWrite;
import gov.sandia.eqgen.codegen.Specifier;
import gov.sandia.eqgen.codegen.Statement;
import gov.sandia.eqgen.db.MNode;
import gov.sandia.eqgen.language.ParseException;
import gov.sandia.eqgen.language.Renderer;

/**
    Generates vectorized Python over numpy arrays. Instead of looping, the index
    variable holds every selected position at once.
**/
public class LanguagePython extends Language
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "python";
            }

            public Language createInstance (MNode settings)
            {
                return new LanguagePython (settings);
            }
        };
    }

    public LanguagePython (MNode settings)
    {
        super (settings);
    }

    public String name ()
    {
        return "python";
    }

    public String numpy ()
    {
        return setting ("numpy", "_numpy");
    }

    public Renderer createRenderer ()
    {
        return new RendererPython (numpy ());
    }

    public String translateStatement (Statement statement) throws ParseException
    {
        String expression = translateExpression (statement.expr);
        if (statement.isDeclaration ()) return statement.var + " = " + expression;
        return statement.var + " " + statement.op + " " + expression;
    }

    public CodeBlock translateStatementSequence (List<Statement> statements, Map<String,Specifier> specifiers) throws ParseException
    {
        ReadWrite rw = arrayReadWrite (statements, specifiers);
        List<String> lines = new ArrayList<String> ();
        for (String var : rw.read)
        {
            ArrayVariable av = (ArrayVariable) specifiers.get (var);
            lines.add (var + " = " + av.array + "[" + av.index + "]");
        }
        for (Statement s : statements) lines.add (translateStatement (s));
        for (String var : rw.write)
        {
            ArrayVariable av = (ArrayVariable) specifiers.get (var);
            lines.add (av.array + "[" + av.index + "] = " + var);
        }
        return new CodeBlock (String.join ("\n", lines));
    }

    public CodeObject codeObject (CodeBlock code, Map<String,Specifier> specifiers)
    {
        return new CodeObjectPython (code, compileMethods (specifiers));
    }

    public CodeBlock templateIterateAll (String index, String size)
    {
        return new CodeBlock (index + " = " + numpy () + ".arange(" + size + ")\n" + CODE);
    }

    public CodeBlock templateIterateIndexArray (String index, String array, String size)
    {
        return new CodeBlock (index + " = " + array + "[:" + size + "]\n" + CODE);
    }
}
