/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.c;

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
    Generates C. Array-resident variables are copied into locals at the top of the
    loop body and written back at the bottom.
**/
public class LanguageC extends Language
{
    public static Factory factory ()
    {
        return new Factory ()
        {
            public String name ()
            {
                return "c";
            }

            public Language createInstance (MNode settings)
            {
                return new LanguageC (settings);
            }
        };
    }

    public LanguageC (MNode settings)
    {
        super (settings);
    }

    public String name ()
    {
        return "c";
    }

    public Renderer createRenderer ()
    {
        return new RendererC ();
    }

    /**
        Scalar type for locals, unless the array variable says otherwise.
    **/
    public String type (ArrayVariable av)
    {
        if (av != null  &&  av.dtype != null) return av.dtype;
        return setting ("type", "double");
    }

    public String indent ()
    {
        int count = setting ("indent", 4);
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < count; i++) result.append (' ');
        return result.toString ();
    }

    public String translateStatement (Statement statement) throws ParseException
    {
        String expression = translateExpression (statement.expr);
        if (statement.isDeclaration ()) return type (null) + " " + statement.var + " = " + expression + ";";
        return statement.var + " " + statement.op + " " + expression + ";";
    }

    public CodeBlock translateStatementSequence (List<Statement> statements, Map<String,Specifier> specifiers) throws ParseException
    {
        ReadWrite rw = arrayReadWrite (statements, specifiers);
        List<String> lines = new ArrayList<String> ();

        for (String var : rw.read)
        {
            ArrayVariable av = (ArrayVariable) specifiers.get (var);
            String qualifier = rw.write.contains (var) ? "" : "const ";
            lines.add (qualifier + type (av) + " " + var + " = " + av.array + "[" + av.index + "];");
        }
        for (String var : rw.write)
        {
            if (rw.read.contains (var)) continue;
            lines.add (type ((ArrayVariable) specifiers.get (var)) + " " + var + ";");
        }

        for (Statement s : statements) lines.add (translateStatement (s));

        for (String var : rw.write)
        {
            ArrayVariable av = (ArrayVariable) specifiers.get (var);
            lines.add (av.array + "[" + av.index + "] = " + var + ";");
        }
        return new CodeBlock (String.join ("\n", lines));
    }

    public CodeObject codeObject (CodeBlock code, Map<String,Specifier> specifiers)
    {
        return new CodeObjectC (code, compileMethods (specifiers));
    }

    public CodeBlock templateIterateAll (String index, String size)
    {
        String pad = indent ();
        return new CodeBlock
        (
              "for (int " + index + " = 0; " + index + " < " + size + "; " + index + "++)\n"
            + "{\n"
            + pad + CODE + "\n"
            + "}"
        );
    }

    public CodeBlock templateIterateIndexArray (String index, String array, String size)
    {
        String pad = indent ();
        String i   = "_index" + array;
        return new CodeBlock
        (
              "for (int " + i + " = 0; " + i + " < " + size + "; " + i + "++)\n"
            + "{\n"
            + pad + "const int " + index + " = " + array + "[" + i + "];\n"
            + pad + CODE + "\n"
            + "}"
        );
    }

    /**
        Runs the code for every neuron, and records the index of each one whose condition is true.
    **/
    public CodeBlock templateThreshold ()
    {
        String index     = templateName ("index",     "_neuron_idx");
        String size      = templateName ("size",      "_num_neurons");
        String spikes    = templateName ("spikes",    "_spikes");
        String numSpikes = templateName ("numSpikes", "_num_spikes");
        String condition = templateName ("condition", "_cond");
        String pad = indent ();
        return new CodeBlock
        (
              numSpikes + " = 0;\n"
            + "for (int " + index + " = 0; " + index + " < " + size + "; " + index + "++)\n"
            + "{\n"
            + pad + CODE + "\n"
            + pad + "if (" + condition + ") " + spikes + "[" + numSpikes + "++] = " + index + ";\n"
            + "}"
        );
    }
}
