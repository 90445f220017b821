/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import javax.measure.Unit;

import gov.sandia.eqgen.language.Expression;
import gov.sandia.eqgen.language.ParseException;
import gov.sandia.eqgen.language.UnitValue;

/**
    One line of an equation set: a parameter, a static equation or a differential equation.
    Immutable. The update order is not stored here, but in the Equations that holds this record.
**/
public class SingleEquation
{
    public enum Kind
    {
        PARAMETER    ("parameter",             "parameter"),
        STATIC       ("static equation",       "static"),
        DIFFERENTIAL ("differential equation", "differential");

        public final String description;
        public final String key;  // as used in settings, for example Flags.static

        Kind (String description, String key)
        {
            this.description = description;
            this.key         = key;
        }

        public String toString ()
        {
            return description;
        }
    }

    public static final int UNSORTED = -1;

    protected final Kind         kind;
    protected final String       name;
    protected final String       unitText;
    protected final Unit<?>      unit;
    protected final Expression   expression;  // null iff kind is PARAMETER
    protected final List<String> flags;

    public SingleEquation (Kind kind, String name, String unitText, Unit<?> unit, Expression expression, List<String> flags)
    {
        if ((kind == Kind.PARAMETER) != (expression == null))
        {
            throw new IllegalArgumentException ("A " + kind + " must " + (expression == null ? "have" : "not have") + " an expression: " + name);
        }
        this.kind       = kind;
        this.name       = name;
        this.unitText   = unitText.trim ();
        this.unit       = unit;
        this.expression = expression;
        if (flags == null) this.flags = Collections.emptyList ();
        else               this.flags = Collections.unmodifiableList (new ArrayList<String> (flags));
    }

    /**
        Convenience form that parses the unit text.
    **/
    public SingleEquation (Kind kind, String name, String unitText, Expression expression, List<String> flags) throws ParseException
    {
        this (kind, name, unitText, UnitValue.parseUnit (unitText), expression, flags);
    }

    public Kind getKind ()
    {
        return kind;
    }

    public String getName ()
    {
        return name;
    }

    public Unit<?> getUnit ()
    {
        return unit;
    }

    public String getUnitText ()
    {
        return unitText;
    }

    public Expression getExpression ()
    {
        return expression;
    }

    public List<String> getFlags ()
    {
        return flags;
    }

    public boolean hasFlag (String flag)
    {
        return flags.contains (flag);
    }

    public Set<String> getIdentifiers ()
    {
        if (expression == null) return Collections.emptySet ();
        return expression.getIdentifiers ();
    }

    /**
        @return A new record which differs from this one only in its expression.
    **/
    public SingleEquation replaceCode (String code) throws ParseException
    {
        if (expression == null) throw new DataModelException ("Parameter \"" + name + "\" has no expression to replace");
        return new SingleEquation (kind, name, unitText, unit, expression.replaceCode (code), flags);
    }

    /**
        Renders in the same form the parser reads.
    **/
    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        if (kind == Kind.DIFFERENTIAL) result.append ("d" + name + "/dt");
        else                           result.append (name);
        if (expression != null) result.append (" = " + expression.getCode ());
        result.append (" : " + unitText);
        if (! flags.isEmpty ()) result.append (" (" + String.join (", ", flags) + ")");
        return result.toString ();
    }
}
