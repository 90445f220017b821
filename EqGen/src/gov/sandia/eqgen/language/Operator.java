/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import gov.sandia.eqgen.language.function.AbsoluteValue;
import gov.sandia.eqgen.language.function.Cosine;
import gov.sandia.eqgen.language.function.Exp;
import gov.sandia.eqgen.language.function.Log;
import gov.sandia.eqgen.language.function.Sine;
import gov.sandia.eqgen.language.function.SquareRoot;
import gov.sandia.eqgen.language.function.Tangent;
import gov.sandia.eqgen.language.operator.AND;
import gov.sandia.eqgen.language.operator.Add;
import gov.sandia.eqgen.language.operator.Divide;
import gov.sandia.eqgen.language.operator.EQ;
import gov.sandia.eqgen.language.operator.GE;
import gov.sandia.eqgen.language.operator.GT;
import gov.sandia.eqgen.language.operator.LE;
import gov.sandia.eqgen.language.operator.LT;
import gov.sandia.eqgen.language.operator.Multiply;
import gov.sandia.eqgen.language.operator.NE;
import gov.sandia.eqgen.language.operator.NOT;
import gov.sandia.eqgen.language.operator.Negate;
import gov.sandia.eqgen.language.operator.OR;
import gov.sandia.eqgen.language.operator.Power;
import gov.sandia.eqgen.language.operator.Subtract;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import javax.measure.Unit;

/**
    Base class of the abstract syntax tree for the expression language.
    Trees are built by ExpressionParser and are not modified afterwards,
    so subtrees may be shared between expressions.
**/
public class Operator
{
    public Unit<?> unit;  // Physical dimensions of the output of this operator. Null until determineUnit() runs.

    /**
        Result of degree(). Ordered so that the larger value dominates when combining operands.
    **/
    public static final int INDEPENDENT = 0;
    public static final int AFFINE      = 1;
    public static final int NONLINEAR   = 2;

    public interface Factory
    {
        public String   name ();  ///< Unique string for searching in the table of registered operators.
        public Operator createInstance ();
    }

    public enum Associativity
    {
        LEFT_TO_RIGHT,
        RIGHT_TO_LEFT
    }

    public Associativity associativity ()
    {
        return Associativity.LEFT_TO_RIGHT;
    }

    /**
        Binding strength. Smaller numbers bind more tightly. Atoms are 1.
    **/
    public int precedence ()
    {
        return 1;
    }

    public void visit (Visitor visitor)
    {
        visitor.visit (this);
    }

    /**
        Sets the unit field from the units of operands, and returns it.
        @param units Maps each variable name to its unit. Names not found here are
        looked up as unit names or mathematical constants.
        @throws DimensionMismatchException if two operands that must agree do not.
    **/
    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        throw new EvaluationException ("Can't determine unit of " + render ());
    }

    /**
        Determines how this expression depends on the given variables, considered together.
        For example, V*w is NONLINEAR with respect to {V,w}, even though it is affine in each separately.
    **/
    public int degree (Collection<String> variables)
    {
        return INDEPENDENT;
    }

    public int degree (String variable)
    {
        return degree (Collections.singleton (variable));
    }

    /**
        Determines whether the named variable is referenced anywhere in this tree.
    **/
    public boolean contains (final String name)
    {
        class ContainsVisitor extends Visitor
        {
            public boolean found;
            public boolean visit (Operator op)
            {
                if (found) return false;
                if (op instanceof AccessVariable  &&  ((AccessVariable) op).name.equals (name))
                {
                    found = true;
                    return false;
                }
                return true;
            }
        }
        ContainsVisitor cv = new ContainsVisitor ();
        visit (cv);
        return cv.found;
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.result.append (toString ());
    }

    /**
        Extracts the value of a numeric constant, including a negated one.
        Returns NaN if this is not constant.
    **/
    public double getDouble ()
    {
        return Double.NaN;
    }

    public boolean isScalar ()
    {
        return false;
    }

    public String toString ()
    {
        return "unknown";
    }


    // Static interface ------------------------------------------------------

    public static TreeMap<String,Factory> operators = new TreeMap<String,Factory> ();

    public static void register (Factory f)
    {
        operators.put (f.name (), f);
    }

    static
    {
        // Functions
        register (AbsoluteValue.factory ());
        register (Cosine       .factory ());
        register (Exp          .factory ());
        register (Log          .factory ());
        register (Sine         .factory ());
        register (SquareRoot   .factory ());
        register (Tangent      .factory ());

        // Operators
        register (Add     .factory ());
        register (AND     .factory ());
        register (Divide  .factory ());
        register (EQ      .factory ());
        register (GE      .factory ());
        register (GT      .factory ());
        register (LE      .factory ());
        register (LT      .factory ());
        register (Multiply.factory ());
        register (NE      .factory ());
        register (Negate  .factory ());
        register (NOT     .factory ());
        register (OR      .factory ());
        register (Power   .factory ());
        register (Subtract.factory ());
    }

    public static Operator parse (String line) throws ParseException
    {
        return new ExpressionParser (line).parse ();
    }

    /**
        Creates a registered operator by name, or null if the name is not registered.
    **/
    public static Operator create (String name)
    {
        Factory f = operators.get (name);
        if (f == null) return null;
        return f.createInstance ();
    }
}
