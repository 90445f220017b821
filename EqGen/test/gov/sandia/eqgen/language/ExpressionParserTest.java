/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import javax.measure.Unit;

import org.junit.Test;

import gov.sandia.eqgen.language.function.Sine;
import gov.sandia.eqgen.language.operator.Negate;
import gov.sandia.eqgen.language.operator.Power;
import tech.units.indriya.AbstractUnit;
import tech.units.indriya.unit.Units;

public class ExpressionParserTest
{
    public void assertRender (String expected, String expression) throws ParseException
    {
        assertEquals (expected, Operator.parse (expression).render ());
    }

    public void assertParseError (String expression, int column)
    {
        try
        {
            Operator.parse (expression);
            fail ("Should not parse: " + expression);
        }
        catch (ParseException e)
        {
            if (column >= 0) assertEquals (column, e.column);
        }
    }

    @Test
    public void testPrecedence () throws Exception
    {
        assertRender ("a + b * c",       "a+b*c");
        assertRender ("(a + b) * c",     "(a + b) * c");
        assertRender ("a - b - c",       "a - b - c");
        assertRender ("a - (b - c)",     "a - (b - c)");
        assertRender ("a / (b * c)",     "a / (b * c)");
        assertRender ("2**3**2",         "2 ** 3 ** 2");
        assertRender ("(2**3)**2",       "(2 ^ 3) ^ 2");
        assertRender ("x**(-1)",         "x ** -1");
        assertRender ("-(-x)",           "--x");
        assertRender ("a < b and c",     "(a < b) and c");
        assertRender ("not a < b",       "not (a < b)");
        assertRender ("(a or b) and c",  "(a or b) and c");
        assertRender ("a or b and c",    "a or (b and c)");
    }

    @Test
    public void testTreeShape () throws Exception
    {
        // Unary minus binds more loosely than power.
        Operator op = Operator.parse ("-x ** 2");
        assertTrue (op instanceof Negate);
        assertTrue (((Negate) op).operand instanceof Power);
        assertEquals ("-x**2", op.render ());

        // Rendering parses back to the same tree.
        for (String e : new String[] {"-V/tau + sigma*xi/sqrt(tau)", "a - (b + c) * -d", "not (a or b) and c >= 2e-3"})
        {
            Operator first = Operator.parse (e);
            assertEquals (first, Operator.parse (first.render ()));
        }
    }

    @Test
    public void testNumbers () throws Exception
    {
        assertEquals (0.001, Operator.parse ("1e-3").getDouble (), 0);
        assertEquals (0.5,   Operator.parse (".5").getDouble (),   0);
        assertEquals (-2,    Operator.parse ("-2").getDouble (),   0);
        assertTrue   (Operator.parse ("12").isScalar ());
        assertFalse  (Operator.parse ("x").isScalar ());
        assertTrue   (((Constant) Operator.parse ("12")).isInteger ());
        assertFalse  (((Constant) Operator.parse ("1.0")).isInteger ());
        assertRender ("2.50e3", "2.50e3");
    }

    @Test
    public void testFunctions () throws Exception
    {
        Operator op = Operator.parse ("sin(x)");
        assertTrue (op instanceof Sine);

        op = Operator.parse ("foo(x, y + 1)");
        assertEquals (Function.class, op.getClass ());
        assertEquals ("foo", ((Function) op).name);
        assertEquals (2, ((Function) op).operands.length);
        assertEquals ("foo(x, y + 1)", op.render ());

        op = Operator.parse ("rand()");
        assertEquals (0, ((Function) op).operands.length);
    }

    @Test
    public void testErrors ()
    {
        assertParseError ("",            0);
        assertParseError ("a +",         3);
        assertParseError ("(a + b",      6);
        assertParseError ("a < b < c",   6);
        assertParseError ("3 @ 4",       2);
        assertParseError ("sin(x, y)",   0);
        assertParseError ("a and",       5);
        assertParseError ("or b",        0);
        assertParseError ("f(a b)",      4);
        assertParseError ("a ** ",       5);
    }

    @Test
    public void testDegree () throws Exception
    {
        assertEquals (Operator.AFFINE,      Operator.parse ("a*V + b").degree ("V"));
        assertEquals (Operator.AFFINE,      Operator.parse ("V/tau").degree ("V"));
        assertEquals (Operator.AFFINE,      Operator.parse ("V**1").degree ("V"));
        assertEquals (Operator.INDEPENDENT, Operator.parse ("V**0").degree ("V"));
        assertEquals (Operator.INDEPENDENT, Operator.parse ("exp(a)").degree ("V"));
        assertEquals (Operator.NONLINEAR,   Operator.parse ("V*V").degree ("V"));
        assertEquals (Operator.NONLINEAR,   Operator.parse ("tau/V").degree ("V"));
        assertEquals (Operator.NONLINEAR,   Operator.parse ("V/V").degree ("V"));  // structural, no cancellation
        assertEquals (Operator.NONLINEAR,   Operator.parse ("sin(V)").degree ("V"));
        assertEquals (Operator.NONLINEAR,   Operator.parse ("V**2").degree ("V"));
        assertEquals (Operator.NONLINEAR,   Operator.parse ("V > 0").degree ("V"));

        // Jointly, a product of two variables is not linear.
        assertEquals (Operator.AFFINE,    Operator.parse ("V*w").degree ("V"));
        assertEquals (Operator.NONLINEAR, Operator.parse ("V*w").degree (Arrays.asList ("V", "w")));
    }

    @Test
    public void testContains () throws Exception
    {
        Operator op = Operator.parse ("a + sin(b * xi)");
        assertTrue  (op.contains ("xi"));
        assertTrue  (op.contains ("a"));
        assertFalse (op.contains ("sin"));
        assertFalse (op.contains ("x"));
    }

    @Test
    public void testUnits () throws Exception
    {
        Map<String,Unit<?>> units = new HashMap<String,Unit<?>> ();
        units.put ("V",   Units.VOLT);
        units.put ("tau", Units.SECOND);
        units.put ("a",   AbstractUnit.ONE);

        assertTrue (UnitValue.sameDimension (Units.VOLT.divide (Units.SECOND), Operator.parse ("V / tau").determineUnit (units)));
        assertTrue (UnitValue.sameDimension (Units.VOLT,                      Operator.parse ("V + 3 * mV").determineUnit (units)));
        assertTrue (UnitValue.sameDimension (Units.VOLT.pow (2),              Operator.parse ("V ** 2").determineUnit (units)));
        assertTrue (UnitValue.sameDimension (Units.VOLT,                      Operator.parse ("sqrt(V * V)").determineUnit (units)));
        assertTrue (UnitValue.sameDimension (Units.VOLT,                      Operator.parse ("abs(-V)").determineUnit (units)));
        assertTrue (UnitValue.isDimensionless (Operator.parse ("exp(-tau / ms) * pi").determineUnit (units)));
        assertTrue (UnitValue.isDimensionless (Operator.parse ("V > 2*mV and a < 1").determineUnit (units)));
        assertTrue (UnitValue.isDimensionless (Operator.parse ("a ** a").determineUnit (units)));

        String[] mismatched = {"V + tau", "exp(V)", "V < tau", "V ** V"};
        for (String e : mismatched)
        {
            try
            {
                Operator.parse (e).determineUnit (units);
                fail ("Units should not agree: " + e);
            }
            catch (DimensionMismatchException x)
            {
            }
        }

        String[] undetermined = {"V ** a", "foo(V)", "V * q"};
        for (String e : undetermined)
        {
            try
            {
                Operator.parse (e).determineUnit (units);
                fail ("Unit should be undetermined: " + e);
            }
            catch (EvaluationException x)
            {
            }
        }
    }
}
