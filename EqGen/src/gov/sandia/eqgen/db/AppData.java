/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.db;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;

/**
    Process-wide settings. The tree is loaded once from the "defaults" resource
    next to this class. Callers may adjust it before building any models, but
    nothing here is locked against concurrent modification during a build.
**/
public class AppData
{
    private static final Logger logger = Logger.getLogger (AppData.class);

    public static final MNode state = new MVolatile ();

    static
    {
        try (InputStream stream = AppData.class.getResourceAsStream ("defaults"))
        {
            if (stream == null)
            {
                logger.warn ("Default settings resource is missing; starting with an empty tree.");
            }
            else
            {
                try (Reader reader = new InputStreamReader (stream, StandardCharsets.UTF_8))
                {
                    Schema.read (state, reader);
                }
            }
        }
        catch (IOException e)
        {
            throw new UncheckedIOException ("Failed to load default settings", e);
        }
    }
}
