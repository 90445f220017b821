/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.Map;

import javax.measure.Unit;

import tech.units.indriya.AbstractUnit;

/**
    A numeric literal. Numbers in expressions are dimensionless; units enter
    through identifiers such as mV.
**/
public class Constant extends Operator
{
    public double value;
    public String text;  // as written in the source, for faithful rendering

    public Constant (double value)
    {
        this.value = value;
        if (value == Math.rint (value)  &&  Math.abs (value) < 1e15) text = String.valueOf ((long) value);
        else                                                          text = String.valueOf (value);
    }

    public Constant (double value, String text)
    {
        this.value = value;
        this.text  = text;
    }

    public Unit<?> determineUnit (Map<String,Unit<?>> units)
    {
        unit = AbstractUnit.ONE;
        return unit;
    }

    public double getDouble ()
    {
        return value;
    }

    public boolean isScalar ()
    {
        return true;
    }

    /**
        @return true if the literal was written without a fractional part or exponent.
    **/
    public boolean isInteger ()
    {
        for (int i = 0; i < text.length (); i++)
        {
            if (! Character.isDigit (text.charAt (i))) return false;
        }
        return true;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        return value == ((Constant) that).value;
    }

    public int hashCode ()
    {
        return Double.hashCode (value);
    }

    public String toString ()
    {
        return text;
    }
}
