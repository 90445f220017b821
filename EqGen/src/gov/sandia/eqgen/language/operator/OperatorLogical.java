/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.operator;

import java.util.Collection;
import java.util.Map;

import javax.measure.Unit;

import gov.sandia.eqgen.language.DimensionMismatchException;
import gov.sandia.eqgen.language.OperatorBinary;
import tech.units.indriya.AbstractUnit;

/**
    Base for binary operators that produce a truth value (0 or 1).
    Their output is dimensionless, and anything that depends on a variable through them is nonlinear.
**/
public class OperatorLogical extends OperatorBinary
{
    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        operand0.determineUnit (units);
        operand1.determineUnit (units);
        unit = AbstractUnit.ONE;
        return unit;
    }

    public int degree (Collection<String> variables)
    {
        if (super.degree (variables) == INDEPENDENT) return INDEPENDENT;
        return NONLINEAR;
    }
}
