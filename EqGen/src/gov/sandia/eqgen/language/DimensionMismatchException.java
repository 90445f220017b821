/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import javax.measure.Unit;

/**
    Two quantities that must share physical dimensions do not.
    Both offending units travel with the exception.
**/
@SuppressWarnings("serial")
public class DimensionMismatchException extends Exception
{
    public Unit<?> unit0;
    public Unit<?> unit1;

    public DimensionMismatchException (String description, Unit<?> unit0, Unit<?> unit1)
    {
        super (description + " (" + UnitValue.format (unit0) + " versus " + UnitValue.format (unit1) + ")");
        this.unit0 = unit0;
        this.unit1 = unit1;
    }

    /**
        Wraps an existing mismatch with more context, keeping both units.
    **/
    public DimensionMismatchException (String description, DimensionMismatchException cause)
    {
        super (description + ": " + cause.getMessage (), cause);
        unit0 = cause.unit0;
        unit1 = cause.unit1;
    }
}
