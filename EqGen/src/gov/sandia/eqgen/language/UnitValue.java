/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import javax.measure.MetricPrefix;
import javax.measure.Prefix;
import javax.measure.Unit;

import tech.units.indriya.AbstractUnit;
import tech.units.indriya.unit.Units;

/**
    A number with physical units. Also the home of the unit-token parser
    and the small amount of dimension algebra the equation model needs.
**/
public class UnitValue
{
    public double  value;
    public Unit<?> unit;

    public static final Unit<?> seconds = Units.SECOND;

    /**
        Names accepted in unit tokens and as unit identifiers inside expressions.
        Any of these may carry a single-letter metric prefix (mV, nS, msecond, kohm).
    **/
    public static final Map<String,Unit<?>> namedUnits = new HashMap<String,Unit<?>> ();
    public static final Map<String,Prefix>  prefixes   = new HashMap<String,Prefix> ();
    public static final Map<String,Double>  constants  = new HashMap<String,Double> ();

    static
    {
        addUnit (Units.VOLT,     "V",   "volt");
        addUnit (Units.AMPERE,   "A",   "amp", "ampere");
        addUnit (Units.SECOND,   "s",   "second");
        addUnit (Units.SIEMENS,  "S",   "siemens");
        addUnit (Units.FARAD,    "F",   "farad");
        addUnit (Units.OHM,      "ohm");
        addUnit (Units.HERTZ,    "Hz",  "hertz");
        addUnit (Units.METRE,    "m",   "metre", "meter");
        addUnit (Units.GRAM,     "g",   "gram");
        addUnit (Units.KILOGRAM, "kg",  "kilogram");
        addUnit (Units.MOLE,     "mol", "mole");
        addUnit (Units.KELVIN,   "K",   "kelvin");
        addUnit (Units.COULOMB,  "C",   "coulomb");
        addUnit (Units.JOULE,    "J",   "joule");
        addUnit (Units.WATT,     "W",   "watt");
        addUnit (Units.NEWTON,   "N",   "newton");
        addUnit (Units.PASCAL,   "Pa",  "pascal");
        addUnit (Units.HENRY,    "H",   "henry");
        addUnit (Units.WEBER,    "Wb",  "weber");
        addUnit (Units.TESLA,    "T",   "tesla");
        addUnit (Units.LITRE,    "l",   "L", "litre", "liter");
        addUnit (Units.RADIAN,   "rad", "radian");

        prefixes.put ("f", MetricPrefix.FEMTO);
        prefixes.put ("p", MetricPrefix.PICO);
        prefixes.put ("n", MetricPrefix.NANO);
        prefixes.put ("u", MetricPrefix.MICRO);
        prefixes.put ("µ", MetricPrefix.MICRO);
        prefixes.put ("m", MetricPrefix.MILLI);
        prefixes.put ("c", MetricPrefix.CENTI);
        prefixes.put ("k", MetricPrefix.KILO);
        prefixes.put ("M", MetricPrefix.MEGA);
        prefixes.put ("G", MetricPrefix.GIGA);

        constants.put ("pi", Math.PI);
        constants.put ("e",  Math.E);
    }

    protected static void addUnit (Unit<?> unit, String... names)
    {
        for (String n : names) namedUnits.put (n, unit);
    }

    public UnitValue (double value, Unit<?> unit)
    {
        this.value = value;
        this.unit  = unit;
    }

    /**
        Finds a single named unit, optionally with a metric prefix.
        @return null if the name is not a unit.
    **/
    public static Unit<?> lookup (String name)
    {
        Unit<?> result = namedUnits.get (name);
        if (result != null) return result;
        if (name.length () < 2) return null;
        Prefix prefix = prefixes.get (name.substring (0, 1));
        if (prefix == null) return null;
        Unit<?> base = namedUnits.get (name.substring (1));
        if (base == null  ||  base == Units.KILOGRAM) return null;
        return base.prefix (prefix);
    }

    /**
        Resolves an identifier from the default namespace: either a unit name (value 1 in that unit)
        or a dimensionless mathematical constant.
        @return null if the identifier has no default meaning.
    **/
    public static UnitValue named (String name)
    {
        Double c = constants.get (name);
        if (c != null) return new UnitValue (c, AbstractUnit.ONE);
        Unit<?> u = lookup (name);
        if (u != null) return new UnitValue (1, u);
        return null;
    }

    /**
        Parses a unit token such as "volt", "mV/ms", "siemens/meter**2", "second**-0.5" or "1".
        Factors are separated by * or /, and each factor may carry an exponent written ** or ^.
    **/
    public static Unit<?> parseUnit (String token) throws ParseException
    {
        String text = token.trim ();
        if (text.isEmpty ()) throw new ParseException ("Missing unit", token, 0);

        Unit<?> result = AbstractUnit.ONE;
        boolean divide = false;
        int length = text.length ();
        int i = 0;
        while (true)
        {
            while (i < length  &&  text.charAt (i) == ' ') i++;
            if (i >= length) throw new ParseException ("Unit ends with an operator", text, i);

            // factor
            int start = i;
            Unit<?> factor;
            char c = text.charAt (i);
            if (Character.isDigit (c))
            {
                while (i < length  &&  (Character.isDigit (text.charAt (i))  ||  text.charAt (i) == '.')) i++;
                String number = text.substring (start, i);
                if (Double.parseDouble (number) != 1) throw new ParseException ("Only 1 may appear as a number in a unit", text, start);
                factor = AbstractUnit.ONE;
            }
            else if (Character.isLetter (c))
            {
                while (i < length  &&  Character.isLetter (text.charAt (i))) i++;
                String name = text.substring (start, i);
                if (name.equals ("one")) factor = AbstractUnit.ONE;
                else                     factor = lookup (name);
                if (factor == null) throw new ParseException ("Unknown unit \"" + name + "\"", text, start);
            }
            else
            {
                throw new ParseException ("Unexpected character in unit", text, i);
            }

            // exponent
            while (i < length  &&  text.charAt (i) == ' ') i++;
            int powerLength = 0;
            if      (text.startsWith ("**", i)) powerLength = 2;
            else if (text.startsWith ("^",  i)) powerLength = 1;
            if (powerLength > 0)
            {
                i += powerLength;
                while (i < length  &&  text.charAt (i) == ' ') i++;
                start = i;
                if (i < length  &&  (text.charAt (i) == '-'  ||  text.charAt (i) == '+')) i++;
                while (i < length  &&  (Character.isDigit (text.charAt (i))  ||  text.charAt (i) == '.')) i++;
                double exponent;
                try
                {
                    exponent = Double.parseDouble (text.substring (start, i));
                }
                catch (NumberFormatException e)
                {
                    throw new ParseException ("Bad exponent in unit", text, start);
                }
                factor = power (factor, exponent);
                if (factor == null) throw new ParseException ("Unsupported exponent in unit", text, start);
            }

            if (divide) result = result.divide (factor);
            else        result = result.multiply (factor);

            while (i < length  &&  text.charAt (i) == ' ') i++;
            if (i >= length) break;
            c = text.charAt (i);
            if      (c == '*') divide = false;
            else if (c == '/') divide = true;
            else throw new ParseException ("Expected * or / in unit", text, i);
            i++;
        }
        return result;
    }

    /**
        Raises a unit to a rational power with small denominator.
        @return null if the exponent can't be represented.
    **/
    public static Unit<?> power (Unit<?> unit, double exponent)
    {
        for (int root = 1; root <= 6; root++)
        {
            double scaled = exponent * root;
            long   pow    = Math.round (scaled);
            if (Math.abs (scaled - pow) > 1e-9) continue;
            Unit<?> result = unit.pow ((int) pow);
            if (root > 1) result = result.root (root);
            return result;
        }
        return null;
    }

    public static boolean sameDimension (Unit<?> a, Unit<?> b)
    {
        return a.getDimension ().equals (b.getDimension ());
    }

    public static boolean isDimensionless (Unit<?> unit)
    {
        return sameDimension (unit, AbstractUnit.ONE);
    }

    public static String format (Unit<?> unit)
    {
        if (unit == null) return "unknown";
        if (unit.equals (AbstractUnit.ONE)) return "1";
        return unit.toString ();
    }

    public boolean equals (Object o)
    {
        if (! (o instanceof UnitValue)) return false;
        UnitValue that = (UnitValue) o;
        return value == that.value  &&  Objects.equals (unit, that.unit);
    }

    public int hashCode ()
    {
        return Objects.hash (value, unit);
    }

    public String toString ()
    {
        if (unit == null  ||  unit.equals (AbstractUnit.ONE)) return String.valueOf (value);
        return value + " " + format (unit);
    }
}
