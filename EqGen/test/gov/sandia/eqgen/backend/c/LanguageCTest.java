/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.c;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import gov.sandia.eqgen.codegen.ArrayVariable;
import gov.sandia.eqgen.codegen.CodeBlock;
import gov.sandia.eqgen.codegen.CodeObject;
import gov.sandia.eqgen.codegen.Language;
import gov.sandia.eqgen.codegen.Specifier;
import gov.sandia.eqgen.codegen.Statement;
import gov.sandia.eqgen.codegen.UserFunction;
import gov.sandia.eqgen.db.MNode;
import gov.sandia.eqgen.db.MVolatile;

public class LanguageCTest
{
    protected Map<String,Specifier> neuronArrays ()
    {
        Map<String,Specifier> result = new LinkedHashMap<String,Specifier> ();
        result.put ("V", new ArrayVariable ("_array_V", "_neuron_idx"));
        result.put ("I", new ArrayVariable ("_array_I", "_neuron_idx"));
        result.put ("g", new ArrayVariable ("_array_g", "_neuron_idx", "float"));
        return result;
    }

    @Test
    public void testRegistry ()
    {
        assertTrue (Language.get ("c") instanceof LanguageC);
    }

    @Test
    public void testExpressions () throws Exception
    {
        Language c = new LanguageC (null);
        assertEquals ("a + b * 2.0",       c.translateExpression ("a + b * 2"));
        assertEquals ("pow (x, 2.0)",      c.translateExpression ("x ** 2"));
        assertEquals ("fabs (v)",          c.translateExpression ("abs(v)"));
        assertEquals ("exp (-v / tau)",    c.translateExpression ("exp(-v/tau)"));
        assertEquals ("a < b && !(c)",     c.translateExpression ("a < b and not c"));
        assertEquals ("1.5 / x",           c.translateExpression ("1.5 / x"));
    }

    @Test
    public void testStatements () throws Exception
    {
        Language c = new LanguageC (null);
        assertEquals ("double v = a + 1.0;", c.translateStatement (new Statement ("v", Statement.DECLARE, "a + 1")));
        assertEquals ("V += dt * I;",        c.translateStatement (new Statement ("V", "+=", "dt * I")));
    }

    @Test
    public void testStatementSequence () throws Exception
    {
        Language c = new LanguageC (null);
        List<Statement> statements = new ArrayList<Statement> ();
        statements.add (new Statement ("V", "+=", "dt * I"));
        statements.add (new Statement ("g", "=", "0"));
        CodeBlock block = c.translateStatementSequence (statements, neuronArrays ());
        assertEquals
        (
              "const double I = _array_I[_neuron_idx];\n"
            + "double V = _array_V[_neuron_idx];\n"
            + "float g;\n"
            + "V += dt * I;\n"
            + "g = 0.0;\n"
            + "_array_V[_neuron_idx] = V;\n"
            + "_array_g[_neuron_idx] = g;",
            block.get ()
        );
    }

    @Test
    public void testStateUpdate () throws Exception
    {
        Language c = new LanguageC (null);
        CodeBlock code = new CodeBlock ("a = 1;\nb = 2;");
        CodeBlock result = c.applyTemplate (code, c.templateStateUpdate ());
        assertEquals
        (
              "for (int _neuron_idx = 0; _neuron_idx < _num_neurons; _neuron_idx++)\n"
            + "{\n"
            + "    a = 1;\n"
            + "    b = 2;\n"
            + "}",
            result.get ()
        );
    }

    @Test
    public void testReset ()
    {
        Language c = new LanguageC (null);
        assertEquals
        (
              "for (int _index_spikes = 0; _index_spikes < _num_spikes; _index_spikes++)\n"
            + "{\n"
            + "    const int _neuron_idx = _spikes[_index_spikes];\n"
            + "    %CODE%\n"
            + "}",
            c.templateReset ().get ()
        );
    }

    @Test
    public void testThreshold ()
    {
        Language c = new LanguageC (null);
        assertEquals
        (
              "_num_spikes = 0;\n"
            + "for (int _neuron_idx = 0; _neuron_idx < _num_neurons; _neuron_idx++)\n"
            + "{\n"
            + "    %CODE%\n"
            + "    if (_cond) _spikes[_num_spikes++] = _neuron_idx;\n"
            + "}",
            c.templateThreshold ().get ()
        );
    }

    @Test
    public void testSettings () throws Exception
    {
        MNode settings = new MVolatile ();
        settings.set ("float", "type");
        settings.set ("2",     "indent");
        settings.set ("i",     "Template", "index");
        settings.set ("n",     "Template", "size");
        Language c = Language.get ("c", settings);

        assertEquals ("float x = y;", c.translateStatement (new Statement ("x", Statement.DECLARE, "y")));
        assertEquals ("for (int i = 0; i < n; i++)\n{\n  %CODE%\n}", c.templateStateUpdate ().get ());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testSynapses ()
    {
        new LanguageC (null).templateSynapses ();
    }

    @Test
    public void testCodeObject ()
    {
        Language c = new LanguageC (null);
        Map<String,Specifier> specifiers = neuronArrays ();
        specifiers.put ("rand", new UserFunction ()
        {
            public void onCompile (Map<String,Object> namespace, Language language, String var)
            {
                namespace.put (var, language.name () + "_" + var);
            }
        });
        CodeObject co = c.codeObject (new CodeBlock ("V = rand ();"), specifiers);
        assertTrue (co instanceof CodeObjectC);

        Map<String,Object> namespace = new HashMap<String,Object> ();
        co.compile (namespace);
        assertEquals ("c_rand", namespace.get ("rand"));
        assertTrue (co.isCompiled ());

        try
        {
            co.invoke (null);
            fail ("Generated C is not executable in-process");
        }
        catch (UnsupportedOperationException e)
        {
        }
    }
}
