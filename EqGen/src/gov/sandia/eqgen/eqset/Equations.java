/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.measure.Unit;

import org.apache.log4j.Logger;

import gov.sandia.eqgen.db.MNode;
import gov.sandia.eqgen.eqset.SingleEquation.Kind;
import gov.sandia.eqgen.language.CodeString;
import gov.sandia.eqgen.language.DimensionMismatchException;
import gov.sandia.eqgen.language.Expression;
import gov.sandia.eqgen.language.ParseException;
import gov.sandia.eqgen.language.UnitValue;
import tech.units.indriya.AbstractUnit;

/**
    A validated set of equations describing one model.
    Construction parses (or accepts) the equations, checks identifiers, enforces the
    rules for the stochastic symbol xi, sorts static equations by dependency, and checks units.
    The result is immutable. Changes such as replace() produce a new instance.
**/
public class Equations implements Iterable<SingleEquation>
{
    private static final Logger logger = Logger.getLogger (Equations.class);

    public static final Unit<?> xiUnit = UnitValue.seconds.root (2).inverse ();

    protected Map<String,SingleEquation>  equations;  // in declaration order
    protected Map<SingleEquation,Integer> order;      // update order, keyed by identity
    protected List<SingleEquation>        ordered;
    protected Expression.Factory          factory;
    protected List<IdentifierCheck>       checks;
    protected Map<String,Expression>      substituted;  // lazily computed

    public Equations (String text) throws ParseException, DimensionMismatchException
    {
        this (text, CodeString.factory (), IdentifierCheck.DEFAULTS);
    }

    /**
        @param namespace External values for identifiers that are neither model variables nor unit names.
    **/
    public Equations (String text, Map<String,Object> namespace) throws ParseException, DimensionMismatchException
    {
        this (text, CodeString.factory (namespace, false), IdentifierCheck.DEFAULTS);
    }

    public Equations (String text, List<IdentifierCheck> checks) throws ParseException, DimensionMismatchException
    {
        this (text, CodeString.factory (), checks);
    }

    public Equations (String text, Expression.Factory factory, List<IdentifierCheck> checks) throws ParseException, DimensionMismatchException
    {
        this.factory = factory;
        this.checks  = IdentifierCheck.validate (checks);
        equations = Collections.unmodifiableMap (new EquationParser (factory).parse (text));
        build ();
    }

    public Equations (Collection<SingleEquation> list) throws ParseException, DimensionMismatchException
    {
        this (list, CodeString.factory (), IdentifierCheck.DEFAULTS);
    }

    public Equations (Collection<SingleEquation> list, Expression.Factory factory, List<IdentifierCheck> checks) throws ParseException, DimensionMismatchException
    {
        this.factory = factory;
        this.checks  = IdentifierCheck.validate (checks);
        Map<String,SingleEquation> map = new LinkedHashMap<String,SingleEquation> ();
        for (SingleEquation e : list)
        {
            if (map.put (e.getName (), e) != null) throw new ParseException ("Duplicate definition of variable \"" + e.getName () + "\"");
        }
        equations = Collections.unmodifiableMap (map);
        build ();
    }

    protected void build () throws ParseException, DimensionMismatchException
    {
        for (String name : equations.keySet ()) IdentifierCheck.checkAll (name, checks);
        checkStochastic ();
        sortStatic ();
        checkUnits ();
    }

    /**
        xi may appear in one differential equation at most, and nowhere else.
    **/
    protected void checkStochastic () throws ParseException
    {
        String usesXi = null;
        for (SingleEquation e : equations.values ())
        {
            if (! e.getIdentifiers ().contains (CodeString.XI)) continue;
            if (e.getKind () != Kind.DIFFERENTIAL)
            {
                throw new ParseException ("The equation defining \"" + e.getName () + "\" contains the symbol \"xi\", which is used outside a differential equation");
            }
            if (usesXi != null)
            {
                throw new ParseException ("The equation defining \"" + e.getName () + "\" contains the symbol \"xi\", but it is already used in the equation defining \"" + usesXi + "\"");
            }
            usesXi = e.getName ();
        }
    }

    /**
        Assigns update order. Static equations are sorted so that each comes after every static
        equation it refers to. When several are ready at once, declaration order decides.
        All differential equations share the next order, and all parameters the one after that.
    **/
    protected void sortStatic ()
    {
        final Map<String,Integer> index = new HashMap<String,Integer> ();
        List<String> statics = new ArrayList<String> ();
        for (SingleEquation e : equations.values ())
        {
            index.put (e.getName (), index.size ());
            if (e.getKind () == Kind.STATIC) statics.add (e.getName ());
        }

        // Build dependency graph among static equations.
        Map<String,Integer>     remaining  = new HashMap<String,Integer> ();  // count of unresolved dependencies
        Map<String,Set<String>> dependents = new HashMap<String,Set<String>> ();
        for (String name : statics)
        {
            int count = 0;
            for (String id : equations.get (name).getIdentifiers ())
            {
                SingleEquation target = equations.get (id);
                if (target == null  ||  target.getKind () != Kind.STATIC) continue;
                count++;
                Set<String> d = dependents.get (id);
                if (d == null)
                {
                    d = new HashSet<String> ();
                    dependents.put (id, d);
                }
                d.add (name);
            }
            remaining.put (name, count);
        }

        // Kahn's algorithm
        PriorityQueue<String> ready = new PriorityQueue<String> (Math.max (1, statics.size ()), new Comparator<String> ()
        {
            public int compare (String a, String b)
            {
                return index.get (a) - index.get (b);
            }
        });
        for (String name : statics) if (remaining.get (name) == 0) ready.add (name);

        order = new IdentityHashMap<SingleEquation,Integer> ();
        int k = 0;
        while (! ready.isEmpty ())
        {
            String name = ready.remove ();
            order.put (equations.get (name), k++);
            Set<String> d = dependents.get (name);
            if (d == null) continue;
            for (String m : d)
            {
                int count = remaining.get (m) - 1;
                remaining.put (m, count);
                if (count == 0) ready.add (m);
            }
        }

        if (k < statics.size ())
        {
            List<String> cycle = new ArrayList<String> ();
            for (String name : statics) if (remaining.get (name) > 0) cycle.add (name);
            throw new DataModelLoopException (cycle);
        }

        for (SingleEquation e : equations.values ())
        {
            if      (e.getKind () == Kind.DIFFERENTIAL) order.put (e, k);
            else if (e.getKind () == Kind.PARAMETER)    order.put (e, k + 1);
        }

        // Stable sort keeps declaration order among equal update orders.
        ordered = new ArrayList<SingleEquation> (equations.values ());
        Collections.sort (ordered, new Comparator<SingleEquation> ()
        {
            public int compare (SingleEquation a, SingleEquation b)
            {
                return order.get (a) - order.get (b);
            }
        });
        ordered = Collections.unmodifiableList (ordered);

        if (logger.isDebugEnabled ())
        {
            StringBuilder message = new StringBuilder ("Update order:");
            for (SingleEquation e : ordered) message.append (" " + e.getName () + "=" + order.get (e));
            logger.debug (message);
        }
    }

    /**
        Checks every expression against the unit declared for its variable.
        A differential equation's expression gives a rate, so it must match unit/second.
        External values found in the namespace contribute their own units.
    **/
    public void checkUnits () throws DimensionMismatchException
    {
        Map<String,Unit<?>> units = getUnits ();
        Set<String> variables = getVariables ();
        for (SingleEquation e : equations.values ())
        {
            if (e.getKind () == Kind.PARAMETER) continue;

            Map<String,Unit<?>> table = new HashMap<String,Unit<?>> (units);
            for (Entry<String,Object> r : e.getExpression ().resolve (variables).entrySet ())
            {
                Object value = r.getValue ();
                if      (value instanceof UnitValue) table.put (r.getKey (), ((UnitValue) value).unit);
                else if (value instanceof Number)    table.put (r.getKey (), AbstractUnit.ONE);
            }

            Unit<?> expected = e.getUnit ();
            if (e.getKind () == Kind.DIFFERENTIAL) expected = expected.divide (UnitValue.seconds);
            try
            {
                e.getExpression ().checkUnits (expected, table);
            }
            catch (DimensionMismatchException x)
            {
                String kind = e.getKind () == Kind.DIFFERENTIAL ? "Differential" : "Static";
                throw new DimensionMismatchException (kind + " equation defining \"" + e.getName () + "\" does not use consistent units", x);
            }
        }
    }

    /**
        Ensures each equation carries only flags permitted for its kind.
        @param allowed A kind that is absent, or maps to an empty collection, permits no flags at all.
    **/
    public void checkFlags (Map<Kind,? extends Collection<String>> allowed)
    {
        for (SingleEquation e : equations.values ())
        {
            Kind kind = e.getKind ();
            for (String flag : e.getFlags ())
            {
                Collection<String> permitted = allowed.get (kind);
                if (permitted == null  ||  permitted.isEmpty ())
                {
                    throw new DataModelException ("Equations of type \"" + kind + "\" cannot have any flags.");
                }
                if (! permitted.contains (flag))
                {
                    throw new DataModelException ("Equations of type \"" + kind + "\" cannot have a flag \"" + flag + "\", only the following flags are allowed: " + new TreeSet<String> (permitted));
                }
            }
        }
    }

    /**
        Reads the whitelist from settings, where each child is named by Kind.key and holds
        a comma-separated list of flags. For example, AppData.state.child ("Flags").
    **/
    public void checkFlags (MNode settings)
    {
        Map<Kind,List<String>> allowed = new HashMap<Kind,List<String>> ();
        for (Kind kind : Kind.values ())
        {
            MNode c = settings.child (kind.key);
            if (c == null) continue;
            List<String> flags = new ArrayList<String> ();
            for (String f : c.get ().split (","))
            {
                f = f.trim ();
                if (! f.isEmpty ()) flags.add (f);
            }
            allowed.put (kind, flags);
        }
        checkFlags (allowed);
    }

    /**
        Collects the external values referenced by all expressions.
        @throws Error if one name resolves to different values in different expressions.
        That can only happen if the expression implementation is broken.
    **/
    public Map<String,Object> resolve ()
    {
        Map<String,Object> result = new LinkedHashMap<String,Object> ();
        Set<String> variables = getVariables ();
        for (SingleEquation e : equations.values ())
        {
            if (e.getExpression () == null) continue;
            for (Entry<String,Object> r : e.getExpression ().resolve (variables).entrySet ())
            {
                String key   = r.getKey ();
                Object value = r.getValue ();
                if (result.containsKey (key))
                {
                    Object previous = result.get (key);
                    if (previous == null ? value != null : ! previous.equals (value))
                    {
                        throw new Error ("Identifier \"" + key + "\" resolved to two different values: " + previous + " and " + value);
                    }
                }
                else
                {
                    result.put (key, value);
                }
            }
        }
        return result;
    }

    /**
        For each differential equation, its expression with all static equations substituted in.
        The substitution is by whole identifier, and each substituted expression is parenthesized.
    **/
    public Map<String,Expression> getSubstitutedExpressions ()
    {
        if (substituted != null) return substituted;

        Map<String,Expression> result       = new LinkedHashMap<String,Expression> ();
        Map<String,String>     replacements = new LinkedHashMap<String,String> ();
        Set<String>            names        = getNames ();
        for (SingleEquation e : ordered)
        {
            if (e.getExpression () == null) continue;
            String code = substitute (e.getExpression ().getCode (), replacements);
            if (e.getKind () == Kind.STATIC)
            {
                replacements.put (e.getName (), "(" + code + ")");
                continue;
            }

            Expression expression;
            try
            {
                expression = e.getExpression ().replaceCode (code);
            }
            catch (ParseException x)
            {
                throw new Error ("Substituted expression for \"" + e.getName () + "\" does not parse: " + code, x);
            }
            expression.resolve (names);
            logger.debug ("Substituted " + e.getName () + ": " + code);
            result.put (e.getName (), expression);
        }
        substituted = Collections.unmodifiableMap (result);
        return substituted;
    }

    /**
        Replaces each whole identifier that has an entry in replacements.
    **/
    public static String substitute (String code, Map<String,String> replacements)
    {
        for (Entry<String,String> r : replacements.entrySet ())
        {
            Pattern p = Pattern.compile ("(?<![A-Za-z0-9_])" + Pattern.quote (r.getKey ()) + "(?![A-Za-z0-9_])");
            code = p.matcher (code).replaceAll (Matcher.quoteReplacement (r.getValue ()));
        }
        return code;
    }

    public boolean isLinear ()
    {
        return isLinear (false);
    }

    /**
        Each equation need only be linear in its own variable.
    **/
    public boolean isConditionallyLinear ()
    {
        return isLinear (true);
    }

    protected boolean isLinear (boolean conditional)
    {
        Set<String> differentials = getDifferentialNames ();
        for (Entry<String,Expression> s : getSubstitutedExpressions ().entrySet ())
        {
            Expression expression = s.getValue ();
            Set<String> identifiers = expression.getIdentifiers ();
            if (identifiers.contains ("t")) return false;
            for (String id : identifiers)
            {
                SingleEquation e = equations.get (id);
                if (e != null  &&  e.getKind () == Kind.PARAMETER  &&  ! e.hasFlag ("constant")) return false;
            }
            if (conditional)
            {
                if (! expression.checkLinearity (s.getKey ())) return false;
            }
            else
            {
                for (String d : differentials)
                {
                    if (! expression.checkLinearity (d)) return false;
                }
            }
        }
        return true;
    }

    /**
        @return A new set in which the named equation has the given expression text.
    **/
    public Equations replace (String name, String code) throws ParseException, DimensionMismatchException
    {
        SingleEquation target = equations.get (name);
        if (target == null) throw new DataModelException ("No equation defines \"" + name + "\"");
        List<SingleEquation> list = new ArrayList<SingleEquation> ();
        for (SingleEquation e : equations.values ())
        {
            if (e == target) list.add (e.replaceCode (code));
            else             list.add (e);
        }
        return new Equations (list, factory, checks);
    }

    // Views -----------------------------------------------------------------

    public SingleEquation get (String name)
    {
        return equations.get (name);
    }

    public int size ()
    {
        return equations.size ();
    }

    public Iterator<SingleEquation> iterator ()
    {
        return equations.values ().iterator ();
    }

    /**
        @return Equations by update order, with declaration order among equals.
    **/
    public List<SingleEquation> getOrdered ()
    {
        return ordered;
    }

    public int getUpdateOrder (SingleEquation e)
    {
        Integer result = order.get (e);
        if (result == null) return SingleEquation.UNSORTED;
        return result;
    }

    public int getUpdateOrder (String name)
    {
        SingleEquation e = equations.get (name);
        if (e == null) return SingleEquation.UNSORTED;
        return getUpdateOrder (e);
    }

    public Set<String> getNames ()
    {
        return equations.keySet ();
    }

    protected Set<String> getNames (Kind... kinds)
    {
        List<Kind> k = Arrays.asList (kinds);
        Set<String> result = new LinkedHashSet<String> ();
        for (SingleEquation e : equations.values ())
        {
            if (k.contains (e.getKind ())) result.add (e.getName ());
        }
        return Collections.unmodifiableSet (result);
    }

    public Set<String> getParameterNames ()
    {
        return getNames (Kind.PARAMETER);
    }

    public Set<String> getStaticNames ()
    {
        return getNames (Kind.STATIC);
    }

    public Set<String> getDifferentialNames ()
    {
        return getNames (Kind.DIFFERENTIAL);
    }

    /**
        Static and differential together, that is, everything that has an expression.
    **/
    public Set<String> getEquationNames ()
    {
        return getNames (Kind.STATIC, Kind.DIFFERENTIAL);
    }

    /**
        @return Unit of every variable, including the special names t, dt and xi.
    **/
    public Map<String,Unit<?>> getUnits ()
    {
        Map<String,Unit<?>> result = new LinkedHashMap<String,Unit<?>> ();
        for (SingleEquation e : equations.values ()) result.put (e.getName (), e.getUnit ());
        result.put ("t",  UnitValue.seconds);
        result.put ("dt", UnitValue.seconds);
        result.put (CodeString.XI, xiUnit);
        return result;
    }

    public Set<String> getVariables ()
    {
        return Collections.unmodifiableSet (getUnits ().keySet ());
    }

    public Map<String,Expression> getDifferentialExpressions ()
    {
        return getExpressions (Kind.DIFFERENTIAL);
    }

    public Map<String,Expression> getEquationExpressions ()
    {
        return getExpressions (Kind.STATIC, Kind.DIFFERENTIAL);
    }

    protected Map<String,Expression> getExpressions (Kind... kinds)
    {
        List<Kind> k = Arrays.asList (kinds);
        Map<String,Expression> result = new LinkedHashMap<String,Expression> ();
        for (SingleEquation e : ordered)
        {
            if (k.contains (e.getKind ())) result.put (e.getName (), e.getExpression ());
        }
        return result;
    }

    /**
        One equation per line in update order, in the same form the parser reads.
    **/
    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        for (SingleEquation e : ordered)
        {
            if (result.length () > 0) result.append ("\n");
            result.append (e.toString ());
        }
        return result.toString ();
    }
}
