/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.measure.Unit;

import org.apache.log4j.Logger;

import gov.sandia.eqgen.language.operator.Add;
import gov.sandia.eqgen.language.operator.Divide;
import gov.sandia.eqgen.language.operator.Multiply;
import gov.sandia.eqgen.language.operator.Negate;
import gov.sandia.eqgen.language.operator.Subtract;

/**
    Default Expression: source text together with its parsed operator tree.
    Identifiers that are not defined by the model are looked up first in an explicit
    namespace supplied by the caller, then (unless the namespace is declared exhaustive)
    among unit names and mathematical constants.
**/
public class CodeString implements Expression
{
    private static final Logger logger = Logger.getLogger (CodeString.class);

    public static final String      XI           = "xi";
    public static final Set<String> specialNames = Collections.unmodifiableSet (new HashSet<String> (Arrays.asList ("t", "dt", XI)));

    protected String             code;
    protected Operator           operator;
    protected Map<String,Object> namespace;
    protected boolean            exhaustive;
    protected Set<String>        identifiers;

    public CodeString (String code) throws ParseException
    {
        this (code, new HashMap<String,Object> (), false);
    }

    public CodeString (String code, Map<String,Object> namespace, boolean exhaustive) throws ParseException
    {
        this.code       = code.trim ();
        this.namespace  = namespace;
        this.exhaustive = exhaustive;
        operator = Operator.parse (this.code);
    }

    public CodeString (Operator operator, Map<String,Object> namespace, boolean exhaustive)
    {
        this.operator   = operator;
        this.namespace  = namespace;
        this.exhaustive = exhaustive;
        code = operator.render ();
    }

    public static Expression.Factory factory ()
    {
        return factory (new HashMap<String,Object> (), false);
    }

    /**
        @param namespace External values available to expressions. Shared, not copied.
        @param exhaustive true if namespace is the only source of external values. false to fall back on unit names and constants.
    **/
    public static Expression.Factory factory (final Map<String,Object> namespace, final boolean exhaustive)
    {
        return new Expression.Factory ()
        {
            public Expression create (String code) throws ParseException
            {
                return new CodeString (code, namespace, exhaustive);
            }
        };
    }

    public String getCode ()
    {
        return code;
    }

    public Operator getOperator ()
    {
        return operator;
    }

    public Set<String> getIdentifiers ()
    {
        if (identifiers != null) return identifiers;
        final Set<String> result = new LinkedHashSet<String> ();
        operator.visit (new Visitor ()
        {
            public boolean visit (Operator op)
            {
                if (op instanceof AccessVariable) result.add (((AccessVariable) op).name);
                return true;
            }
        });
        identifiers = Collections.unmodifiableSet (result);
        return identifiers;
    }

    public Map<String,Object> resolve (Collection<String> internal)
    {
        Map<String,Object> result = new LinkedHashMap<String,Object> ();
        for (String name : getIdentifiers ())
        {
            if (specialNames.contains (name)  ||  internal.contains (name))
            {
                if (namespace.containsKey (name))
                {
                    logger.warn ("Model variable \"" + name + "\" hides the value supplied in the namespace, which will be ignored");
                }
                continue;
            }
            if (namespace.containsKey (name))
            {
                if (! exhaustive  &&  UnitValue.named (name) != null)
                {
                    logger.warn ("Namespace entry \"" + name + "\" hides the unit or constant of the same name");
                }
                result.put (name, namespace.get (name));
                continue;
            }
            if (! exhaustive)
            {
                UnitValue value = UnitValue.named (name);
                if (value != null)
                {
                    result.put (name, value);
                    continue;
                }
            }
            throw new EvaluationException ("The identifier \"" + name + "\" in \"" + code + "\" could not be resolved");
        }
        return result;
    }

    public Unit<?> getUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        return operator.determineUnit (units);
    }

    public void checkUnits (Unit<?> expected, Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        Unit<?> actual = getUnit (units);
        if (! UnitValue.sameDimension (actual, expected))
        {
            throw new DimensionMismatchException ("Expression \"" + code + "\" does not have the expected unit", actual, expected);
        }
    }

    public boolean checkLinearity (String variable)
    {
        return operator.degree (variable) <= Operator.AFFINE;
    }

    public StochasticSplit splitStochastic ()
    {
        if (! getIdentifiers ().contains (XI)) return new StochasticSplit (this, null);

        List<Operator> deterministic = new ArrayList<Operator> ();
        List<Boolean>  deterministicNegative = new ArrayList<Boolean> ();
        List<Operator> stochastic = new ArrayList<Operator> ();
        List<Boolean>  stochasticNegative = new ArrayList<Boolean> ();

        List<Operator> terms    = new ArrayList<Operator> ();
        List<Boolean>  negative = new ArrayList<Boolean> ();
        flattenSum (operator, false, terms, negative);
        for (int i = 0; i < terms.size (); i++)
        {
            Operator term = terms.get (i);
            if (! term.contains (XI))
            {
                deterministic.add (term);
                deterministicNegative.add (negative.get (i));
            }
            else if (isFactor (term, XI)  &&  term.degree (XI) <= Operator.AFFINE)
            {
                stochastic.add (term);
                stochasticNegative.add (negative.get (i));
            }
            else
            {
                throw new EvaluationException ("Expression \"" + code + "\" is not linear in the stochastic variable: " + term.render ());
            }
        }

        Operator d;
        if (deterministic.isEmpty ()) d = new Constant (0);
        else                          d = sum (deterministic, deterministicNegative);
        Operator s = sum (stochastic, stochasticNegative);
        return new StochasticSplit (new CodeString (d, namespace, exhaustive), new CodeString (s, namespace, exhaustive));
    }

    /**
        Breaks a tree into its top-level terms, tracking the sign each one carries.
        A product or quotient whose xi-bearing side is itself a sum is distributed over that sum,
        so each resulting term carries the other factor.
    **/
    protected static void flattenSum (Operator op, boolean negate, List<Operator> terms, List<Boolean> negative)
    {
        if (op instanceof Multiply  &&  op.contains (XI))
        {
            Multiply m = (Multiply) op;
            boolean left = m.operand0.contains (XI);
            if (left == m.operand1.contains (XI))  // xi on both sides, so leave it for the caller to reject
            {
                terms.add (op);
                negative.add (negate);
                return;
            }
            int start = terms.size ();
            if (left) flattenSum (m.operand0, negate, terms, negative);
            else      flattenSum (m.operand1, negate, terms, negative);
            for (int i = start; i < terms.size (); i++)
            {
                Multiply scaled = new Multiply ();
                if (left) scaled.setOperands (terms.get (i), m.operand1);
                else      scaled.setOperands (m.operand0, terms.get (i));
                terms.set (i, scaled);
            }
        }
        else if (op instanceof Divide  &&  op.contains (XI)  &&  ! ((Divide) op).operand1.contains (XI))
        {
            Divide d = (Divide) op;
            int start = terms.size ();
            flattenSum (d.operand0, negate, terms, negative);
            for (int i = start; i < terms.size (); i++)
            {
                Divide scaled = new Divide ();
                scaled.setOperands (terms.get (i), d.operand1);
                terms.set (i, scaled);
            }
        }
        else if (op instanceof Add)
        {
            Add a = (Add) op;
            flattenSum (a.operand0, negate, terms, negative);
            flattenSum (a.operand1, negate, terms, negative);
        }
        else if (op instanceof Subtract)
        {
            Subtract s = (Subtract) op;
            flattenSum (s.operand0,   negate, terms, negative);
            flattenSum (s.operand1, ! negate, terms, negative);
        }
        else if (op instanceof Negate)
        {
            flattenSum (((Negate) op).operand, ! negate, terms, negative);
        }
        else
        {
            terms.add (op);
            negative.add (negate);
        }
    }

    /**
        @return true if the named variable appears exactly once, as a multiplicative factor of op.
    **/
    protected static boolean isFactor (Operator op, String name)
    {
        if (op instanceof AccessVariable) return ((AccessVariable) op).name.equals (name);
        if (op instanceof Negate) return isFactor (((Negate) op).operand, name);
        if (op instanceof Multiply)
        {
            Multiply m = (Multiply) op;
            if (isFactor (m.operand0, name)) return ! m.operand1.contains (name);
            if (isFactor (m.operand1, name)) return ! m.operand0.contains (name);
            return false;
        }
        if (op instanceof Divide)
        {
            Divide d = (Divide) op;
            return isFactor (d.operand0, name)  &&  ! d.operand1.contains (name);
        }
        return false;
    }

    protected static Operator sum (List<Operator> terms, List<Boolean> negative)
    {
        Operator result = terms.get (0);
        if (negative.get (0))
        {
            Negate n = new Negate ();
            n.setOperand (result);
            result = n;
        }
        for (int i = 1; i < terms.size (); i++)
        {
            OperatorBinary b;
            if (negative.get (i)) b = new Subtract ();
            else                  b = new Add ();
            b.setOperands (result, terms.get (i));
            result = b;
        }
        return result;
    }

    public Expression replaceCode (String code) throws ParseException
    {
        return new CodeString (code, namespace, exhaustive);
    }

    public String render ()
    {
        return operator.render ();
    }

    public void render (Renderer renderer)
    {
        operator.render (renderer);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof CodeString)) return false;
        return operator.equals (((CodeString) that).operator);
    }

    public int hashCode ()
    {
        return operator.hashCode ();
    }

    public String toString ()
    {
        return code;
    }
}
