/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.Collection;

public class OperatorUnary extends Operator
{
    public Operator operand;

    public void setOperand (Operator operand)
    {
        this.operand = operand;
    }

    public int precedence ()
    {
        return 3;
    }

    public Associativity associativity ()
    {
        return Associativity.RIGHT_TO_LEFT;
    }

    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        operand.visit (visitor);
    }

    public int degree (Collection<String> variables)
    {
        return operand.degree (variables);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        render (renderer, toString ());
    }

    public void render (Renderer renderer, String prefix)
    {
        renderer.result.append (prefix);
        boolean needParens = precedence () <= operand.precedence ();  // "--x" would be misread by C
        if (needParens) renderer.result.append ("(");
        operand.render (renderer);
        if (needParens) renderer.result.append (")");
    }

    public boolean equals (Object that)
    {
        if (that == null  ||  that.getClass () != getClass ()) return false;
        return operand.equals (((OperatorUnary) that).operand);
    }

    public int hashCode ()
    {
        return getClass ().hashCode () ^ operand.hashCode ();
    }
}
