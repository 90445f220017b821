/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

/**
    A variable stored in an array, one element per neuron.
    Generated code loads it into a local before use and stores it back after assignment.
    The local takes the name this specifier is registered under.
**/
public class ArrayVariable extends Specifier
{
    public String array;  // name of the array holding all values
    public String index;  // expression selecting this element
    public String dtype;  // element type, or null for the backend default

    public ArrayVariable (String array, String index)
    {
        this (array, index, null);
    }

    public ArrayVariable (String array, String index, String dtype)
    {
        this.array = array;
        this.index = index;
        this.dtype = dtype;
    }

    public String toString ()
    {
        return array + "[" + index + "]";
    }
}
