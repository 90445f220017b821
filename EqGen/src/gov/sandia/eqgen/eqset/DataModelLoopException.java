/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

import java.util.Collections;
import java.util.List;

/**
    Static equations depend on each other in a cycle, so no update order exists.
**/
@SuppressWarnings("serial")
public class DataModelLoopException extends DataModelException
{
    public List<String> names;  // every static equation left unsorted, in declaration order

    public DataModelLoopException (List<String> names)
    {
        super ("Cannot resolve dependencies between static equations, dependencies contain a cycle: " + String.join (", ", names));
        this.names = Collections.unmodifiableList (names);
    }
}
