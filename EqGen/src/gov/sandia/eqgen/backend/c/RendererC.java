/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.backend.c;

import gov.sandia.eqgen.language.Constant;
import gov.sandia.eqgen.language.Function;
import gov.sandia.eqgen.language.Operator;
import gov.sandia.eqgen.language.Renderer;
import gov.sandia.eqgen.language.function.AbsoluteValue;
import gov.sandia.eqgen.language.operator.AND;
import gov.sandia.eqgen.language.operator.NOT;
import gov.sandia.eqgen.language.operator.OR;
import gov.sandia.eqgen.language.operator.Power;

public class RendererC extends Renderer
{
    public boolean render (Operator op)
    {
        if (op instanceof Constant)
        {
            // Keep arithmetic in floating point, since 1/2 is 0 for C integers.
            Constant c = (Constant) op;
            if (c.isInteger ()) result.append (c.text + ".0");
            else                result.append (c.text);
            return true;
        }
        if (op instanceof Power)
        {
            Power p = (Power) op;
            result.append ("pow (");
            p.operand0.render (this);
            result.append (", ");
            p.operand1.render (this);
            result.append (")");
            return true;
        }
        if (op instanceof AND)
        {
            ((AND) op).render (this, " && ");
            return true;
        }
        if (op instanceof OR)
        {
            ((OR) op).render (this, " || ");
            return true;
        }
        if (op instanceof NOT)
        {
            // ! binds more tightly in C than "not" does here, so always enclose the operand.
            result.append ("!(");
            ((NOT) op).operand.render (this);
            result.append (")");
            return true;
        }
        if (op instanceof Function)
        {
            Function f = (Function) op;
            String name = f.name;
            if (f instanceof AbsoluteValue) name = "fabs";
            f.render (this, name + " ");
            return true;
        }
        return false;
    }
}
