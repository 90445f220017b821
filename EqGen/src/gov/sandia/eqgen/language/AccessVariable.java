/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.Collection;
import java.util.Map;

import javax.measure.Unit;

import tech.units.indriya.AbstractUnit;

public class AccessVariable extends Operator
{
    public String name;
    public int    columnBegin;  // Position of first character in source line.

    public AccessVariable (String name)
    {
        this.name = name;
    }

    public AccessVariable (String name, int columnBegin)
    {
        this.name        = name;
        this.columnBegin = columnBegin;
    }

    /**
        Variables come from the table. Anything else must be a unit name (which carries
        its own unit) or a dimensionless constant like pi.
    **/
    public Unit<?> determineUnit (Map<String,Unit<?>> units)
    {
        unit = units.get (name);
        if (unit != null) return unit;
        if (UnitValue.constants.containsKey (name))
        {
            unit = AbstractUnit.ONE;
            return unit;
        }
        unit = UnitValue.lookup (name);
        if (unit == null) throw new EvaluationException ("Unknown identifier: " + name);
        return unit;
    }

    public int degree (Collection<String> variables)
    {
        if (variables.contains (name)) return AFFINE;
        return INDEPENDENT;
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof AccessVariable)) return false;
        return name.equals (((AccessVariable) that).name);
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }

    public String toString ()
    {
        return name;
    }
}
