/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.Collection;
import java.util.Map;

import javax.measure.Unit;

public class OperatorBinary extends Operator
{
    public Operator operand0;
    public Operator operand1;

    public void setOperands (Operator operand0, Operator operand1)
    {
        this.operand0 = operand0;
        this.operand1 = operand1;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand0.visit (visitor);
        operand1.visit (visitor);
    }

    /**
        Default rule for operators whose operands must share a dimension, such as + and comparisons.
        The result carries the unit of the left operand.
    **/
    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        Unit<?> u0 = operand0.determineUnit (units);
        Unit<?> u1 = operand1.determineUnit (units);
        if (! UnitValue.sameDimension (u0, u1))
        {
            throw new DimensionMismatchException ("Operands of " + toString () + " in \"" + render () + "\" have different units", u0, u1);
        }
        unit = u0;
        return unit;
    }

    public int degree (Collection<String> variables)
    {
        return Math.max (operand0.degree (variables), operand1.degree (variables));
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        render (renderer, " " + toString () + " ");
    }

    public void render (Renderer renderer, String middle)
    {
        // Left-hand child
        boolean needParens =    precedence () < operand0.precedence ()   // read "<" as "comes before" rather than "less"
                             ||    precedence () == operand0.precedence ()
                                && associativity () == Associativity.RIGHT_TO_LEFT;
        if (needParens) renderer.result.append ("(");
        operand0.render (renderer);
        if (needParens) renderer.result.append (")");

        renderer.result.append (middle);

        // Right-hand child
        needParens =    precedence () < operand1.precedence ()
                     ||    precedence () == operand1.precedence ()
                        && associativity () == Associativity.LEFT_TO_RIGHT;
        if (needParens) renderer.result.append ("(");
        operand1.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        OperatorBinary o = (OperatorBinary) that;
        return operand0.equals (o.operand0)  &&  operand1.equals (o.operand1);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ (31 * operand0.hashCode () + operand1.hashCode ());
    }
}
