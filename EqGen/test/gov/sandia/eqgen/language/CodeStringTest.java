/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import javax.measure.Unit;

import org.junit.Test;

import tech.units.indriya.AbstractUnit;
import tech.units.indriya.unit.Units;

public class CodeStringTest
{
    @Test
    public void testIdentifiers () throws Exception
    {
        CodeString c = new CodeString ("  v + I * R + pi + sin(v)  ");
        assertEquals ("v + I * R + pi + sin(v)", c.getCode ());
        assertEquals (Arrays.asList ("v", "I", "R", "pi"), new ArrayList<String> (c.getIdentifiers ()));
    }

    @Test
    public void testResolve () throws Exception
    {
        Map<String,Object> namespace = new HashMap<String,Object> ();
        namespace.put ("a", 2.0);
        namespace.put ("v", 5.0);  // hidden by the model variable
        Expression e = CodeString.factory (namespace, false).create ("a * mV + pi + t + v");

        Map<String,Object> resolved = e.resolve (Collections.singleton ("v"));
        assertEquals (Arrays.asList ("a", "mV", "pi"), new ArrayList<String> (resolved.keySet ()));
        assertEquals (2.0, resolved.get ("a"));
        assertEquals (new UnitValue (Math.PI, AbstractUnit.ONE), resolved.get ("pi"));
        UnitValue mV = (UnitValue) resolved.get ("mV");
        assertEquals (1, mV.value, 0);
        assertTrue (UnitValue.sameDimension (Units.VOLT, mV.unit));
    }

    @Test
    public void testExhaustiveNamespace () throws Exception
    {
        Map<String,Object> namespace = new HashMap<String,Object> ();
        namespace.put ("a", 2.0);
        Expression e = CodeString.factory (namespace, true).create ("a * mV");
        try
        {
            e.resolve (Collections.<String>emptySet ());
            fail ("mV is not in the namespace");
        }
        catch (EvaluationException x)
        {
        }

        // A namespace entry takes precedence over a unit of the same name.
        namespace.put ("mV", 3.0);
        assertEquals (3.0, CodeString.factory (namespace, false).create ("mV").resolve (Collections.<String>emptySet ()).get ("mV"));
    }

    @Test
    public void testUnresolved () throws Exception
    {
        try
        {
            new CodeString ("q + 1").resolve (Collections.<String>emptySet ());
            fail ("q is undefined");
        }
        catch (EvaluationException e)
        {
            assertTrue (e.getMessage ().contains ("\"q\""));
        }
    }

    @Test
    public void testCheckUnits () throws Exception
    {
        Map<String,Unit<?>> units = new HashMap<String,Unit<?>> ();
        units.put ("v",   Units.VOLT);
        units.put ("tau", Units.SECOND);
        Expression e = new CodeString ("-v / tau");
        e.checkUnits (Units.VOLT.divide (Units.SECOND), units);
        try
        {
            e.checkUnits (Units.VOLT, units);
            fail ("Rate is not a voltage");
        }
        catch (DimensionMismatchException x)
        {
            assertTrue (UnitValue.sameDimension (Units.VOLT, x.unit1));
        }
    }

    @Test
    public void testStochasticSplit () throws Exception
    {
        StochasticSplit s = new CodeString ("-V/tau + sigma*xi/sqrt(tau)").splitStochastic ();
        assertEquals ("-V / tau",               s.deterministic.getCode ());
        assertEquals ("sigma * xi / sqrt(tau)", s.stochastic.getCode ());

        s = new CodeString ("a - xi*b").splitStochastic ();
        assertEquals ("a",          s.deterministic.getCode ());
        assertEquals ("-(xi * b)",  s.stochastic.getCode ());

        s = new CodeString ("xi").splitStochastic ();
        assertEquals ("0",  s.deterministic.getCode ());
        assertEquals ("xi", s.stochastic.getCode ());

        // noise inside a scaled sum
        s = new CodeString ("(v + xi*s)/tau").splitStochastic ();
        assertEquals ("v / tau",      s.deterministic.getCode ());
        assertEquals ("xi * s / tau", s.stochastic.getCode ());

        s = new CodeString ("2*(v - xi*s)").splitStochastic ();
        assertEquals ("2 * v",            s.deterministic.getCode ());
        assertEquals ("-(2 * (xi * s))",  s.stochastic.getCode ());

        s = new CodeString ("(a + xi) * b").splitStochastic ();
        assertEquals ("a * b",  s.deterministic.getCode ());
        assertEquals ("xi * b", s.stochastic.getCode ());

        Expression plain = new CodeString ("-V/tau");
        s = plain.splitStochastic ();
        assertSame (plain, s.deterministic);
        assertNull (s.stochastic);

        for (String code : new String[] {"xi*xi", "sin(xi)", "1/xi", "xi * (a + xi)", "(v + xi)/xi"})
        {
            try
            {
                new CodeString (code).splitStochastic ();
                fail ("Not linear in xi: " + code);
            }
            catch (EvaluationException e)
            {
            }
        }
    }

    @Test
    public void testReplaceAndEquality () throws Exception
    {
        Map<String,Object> namespace = new HashMap<String,Object> ();
        namespace.put ("k", 1.0);
        Expression e = new CodeString ("k * x", namespace, true);
        Expression r = e.replaceCode ("k * (x + 1)");
        assertEquals ("k * (x + 1)", r.getCode ());
        assertEquals (1.0, r.resolve (Collections.singleton ("x")).get ("k"));

        assertEquals (new CodeString ("a+b"), new CodeString ("a + b"));
        assertFalse  (new CodeString ("a+b").equals (new CodeString ("b + a")));
        assertEquals (new CodeString ("a+b").hashCode (), new CodeString ("(a) + b").hashCode ());
        assertEquals ("a + b", new CodeString ("(a)+(b)").render ());
    }
}
