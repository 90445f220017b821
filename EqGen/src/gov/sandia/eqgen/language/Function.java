/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

import javax.measure.Unit;

import tech.units.indriya.AbstractUnit;

/**
    A call f(a, b, ...). Registered functions subclass this to supply their unit rules.
    A call to an unregistered name produces an instance of this class directly, which
    renders faithfully but can't be unit-checked.
**/
public class Function extends Operator
{
    public String     name;
    public Operator[] operands = new Operator[0];  // always non-null, even if there are no arguments

    public Function ()
    {
    }

    public Function (String name)
    {
        this.name = name;
    }

    /**
        @return Number of arguments this function requires, or -1 if any number is accepted.
    **/
    public int arity ()
    {
        return -1;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Operator op : operands) op.visit (visitor);
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        throw new EvaluationException ("Unknown function " + name + "()");
    }

    /**
        Utility for transcendental functions: the argument must be dimensionless, and so is the result.
    **/
    public Unit<?> determineUnitDimensionless (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        Unit<?> u = operands[0].determineUnit (units);
        if (! UnitValue.isDimensionless (u))
        {
            throw new DimensionMismatchException ("Argument of " + name + "() must be dimensionless", u, AbstractUnit.ONE);
        }
        unit = AbstractUnit.ONE;
        return unit;
    }

    /**
        A function of anything that depends on the variables is treated as nonlinear.
    **/
    public int degree (Collection<String> variables)
    {
        for (Operator op : operands)
        {
            if (op.degree (variables) != INDEPENDENT) return NONLINEAR;
        }
        return INDEPENDENT;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        render (renderer, name);
    }

    public void render (Renderer renderer, String functionName)
    {
        renderer.result.append (functionName + "(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) renderer.result.append (", ");
            operands[i].render (renderer);
        }
        renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Function)) return false;
        Function f = (Function) that;
        return name.equals (f.name)  &&  Arrays.equals (operands, f.operands);
    }

    public int hashCode ()
    {
        return name.hashCode () ^ Arrays.hashCode (operands);
    }

    public String toString ()
    {
        return name;
    }
}
