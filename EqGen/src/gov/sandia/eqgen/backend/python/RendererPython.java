/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.python;

import gov.sandia.eqgen.language.Function;
import gov.sandia.eqgen.language.Operator;
import gov.sandia.eqgen.language.Renderer;
import gov.sandia.eqgen.language.operator.AND;
import gov.sandia.eqgen.language.operator.NOT;
import gov.sandia.eqgen.language.operator.OR;

/**
    Renders vectorized numpy code. Logical operators become element-wise numpy calls,
    because "and" and "or" don't work on arrays.
**/
public class RendererPython extends Renderer
{
    public String numpy;  // module alias

    public RendererPython (String numpy)
    {
        this.numpy = numpy;
    }

    public boolean render (Operator op)
    {
        if (op instanceof AND)
        {
            AND a = (AND) op;
            call ("logical_and", a.operand0, a.operand1);
            return true;
        }
        if (op instanceof OR)
        {
            OR o = (OR) op;
            call ("logical_or", o.operand0, o.operand1);
            return true;
        }
        if (op instanceof NOT)
        {
            call ("logical_not", ((NOT) op).operand);
            return true;
        }
        if (op instanceof Function)
        {
            Function f = (Function) op;
            if (Operator.operators.containsKey (f.name)) f.render (this, numpy + "." + f.name);
            else                                         f.render (this, f.name);  // supplied by caller
            return true;
        }
        return false;
    }

    protected void call (String function, Operator... operands)
    {
        result.append (numpy + "." + function + "(");
        for (int i = 0; i < operands.length; i++)
        {
            if (i > 0) result.append (", ");
            operands[i].render (this);
        }
        result.append (")");
    }
}
