/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

/**
    Result of Expression.splitStochastic().
**/
public class StochasticSplit
{
    public Expression deterministic;
    public Expression stochastic;     // null if the expression does not contain xi

    public StochasticSplit (Expression deterministic, Expression stochastic)
    {
        this.deterministic = deterministic;
        this.stochastic    = stochastic;
    }
}
