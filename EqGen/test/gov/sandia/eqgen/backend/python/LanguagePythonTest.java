/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.python;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import gov.sandia.eqgen.codegen.ArrayVariable;
import gov.sandia.eqgen.codegen.CodeBlock;
import gov.sandia.eqgen.codegen.Language;
import gov.sandia.eqgen.codegen.Specifier;
import gov.sandia.eqgen.codegen.Statement;
import gov.sandia.eqgen.db.MNode;
import gov.sandia.eqgen.db.MVolatile;

public class LanguagePythonTest
{
    @Test
    public void testExpressions () throws Exception
    {
        Language python = Language.get ("python");
        assertTrue (python instanceof LanguagePython);
        assertEquals ("_numpy.logical_and(a, _numpy.logical_not(b))", python.translateExpression ("a and not b"));
        assertEquals ("_numpy.logical_or(a > 1, b)",                   python.translateExpression ("a > 1 or b"));
        assertEquals ("_numpy.exp(-v / tau)",                          python.translateExpression ("exp(-v/tau)"));
        assertEquals ("f(x) + x**2",                                   python.translateExpression ("f(x) + x^2"));
    }

    @Test
    public void testNumpyAlias () throws Exception
    {
        MNode settings = new MVolatile ();
        settings.set ("np", "numpy");
        Language python = new LanguagePython (settings);
        assertEquals ("np.sqrt(x)",       python.translateExpression ("sqrt(x)"));
        assertEquals ("i = np.arange(n)\n%CODE%", python.templateIterateAll ("i", "n").get ());
    }

    @Test
    public void testStatementSequence () throws Exception
    {
        Language python = new LanguagePython (null);
        Map<String,Specifier> specifiers = new LinkedHashMap<String,Specifier> ();
        specifiers.put ("V", new ArrayVariable ("_array_V", "_neuron_idx"));
        specifiers.put ("I", new ArrayVariable ("_array_I", "_neuron_idx"));

        List<Statement> statements = new ArrayList<Statement> ();
        statements.add (new Statement ("_d", Statement.DECLARE, "dt * I"));
        statements.add (new Statement ("V", "+=", "_d"));
        CodeBlock block = python.translateStatementSequence (statements, specifiers);
        assertEquals
        (
              "I = _array_I[_neuron_idx]\n"
            + "V = _array_V[_neuron_idx]\n"
            + "_d = dt * I\n"
            + "V += _d\n"
            + "_array_V[_neuron_idx] = V",
            block.get ()
        );
    }

    @Test
    public void testReset () throws Exception
    {
        Language python = new LanguagePython (null);
        CodeBlock result = python.applyTemplate (new CodeBlock ("V = Vr"), python.templateReset ());
        assertEquals ("_neuron_idx = _spikes[:_num_spikes]\nV = Vr", result.get ());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testThreshold ()
    {
        new LanguagePython (null).templateThreshold ();
    }
}
