/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

import javax.measure.Unit;

/**
    The symbolic right-hand side of an equation, as the equation model sees it.
    Implementations are immutable. A change of text produces a new instance.
**/
public interface Expression
{
    /**
        Creates expressions from text. The equation model receives one of these at construction,
        so it never depends on a particular implementation.
    **/
    public interface Factory
    {
        public Expression create (String code) throws ParseException;
    }

    public String getCode ();

    /**
        @return Names of free variables in order of first appearance. Function names are excluded.
    **/
    public Set<String> getIdentifiers ();

    /**
        Binds every identifier that is not internal to a value from the external namespace.
        @param internal Names defined by the model itself, which need no external value.
        @throws EvaluationException if an identifier can't be found.
    **/
    public Map<String,Object> resolve (Collection<String> internal);

    public Unit<?> getUnit (Map<String,Unit<?>> units) throws DimensionMismatchException;

    /**
        @throws DimensionMismatchException if the expression's unit does not share the dimension of expected.
    **/
    public void checkUnits (Unit<?> expected, Map<String,Unit<?>> units) throws DimensionMismatchException;

    /**
        @return true if the expression is affine in the given variable (including when the variable is absent).
    **/
    public boolean checkLinearity (String variable);

    /**
        Separates the deterministic part from the part multiplying the stochastic symbol xi.
        Products and quotients of sums are distributed where needed, so (v + xi*s)/tau splits cleanly.
        @throws EvaluationException if the expression is not linear in xi.
    **/
    public StochasticSplit splitStochastic ();

    public Expression replaceCode (String code) throws ParseException;
}
