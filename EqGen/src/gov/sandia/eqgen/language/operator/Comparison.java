/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language.operator;

import java.util.Map;

import javax.measure.Unit;

import gov.sandia.eqgen.language.DimensionMismatchException;
import gov.sandia.eqgen.language.UnitValue;
import tech.units.indriya.AbstractUnit;

/**
    Comparisons do not chain. Both sides must share a dimension.
**/
public class Comparison extends OperatorLogical
{
    public int precedence ()
    {
        return 6;
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units) throws DimensionMismatchException
    {
        Unit<?> u0 = operand0.determineUnit (units);
        Unit<?> u1 = operand1.determineUnit (units);
        if (! UnitValue.sameDimension (u0, u1))
        {
            throw new DimensionMismatchException ("Comparison \"" + render () + "\" between different units", u0, u1);
        }
        unit = AbstractUnit.ONE;
        return unit;
    }
}
