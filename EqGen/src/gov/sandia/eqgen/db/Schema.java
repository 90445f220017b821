/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
    Text serialization for MNode trees. Each line holds key:value, and
    indentation (one space per level) gives the nesting. A key without a colon
    makes an undefined node. A value of "|" starts a block of text which
    continues over the following lines that are indented deeper than the key.
    Lines that are empty or start with # are skipped.
**/
public class Schema
{
    public static class LineReader
    {
        protected BufferedReader reader;
        public    String         line;        // null at end of stream
        public    int            whitespaces; // count of leading spaces in line; -1 at end of stream

        public LineReader (Reader reader) throws IOException
        {
            if (reader instanceof BufferedReader) this.reader = (BufferedReader) reader;
            else                                  this.reader = new BufferedReader (reader);
            getNextLine ();
        }

        public void getNextLine () throws IOException
        {
            while (true)
            {
                line = reader.readLine ();
                if (line == null)
                {
                    whitespaces = -1;
                    return;
                }
                String trimmed = line.trim ();
                if (trimmed.isEmpty ()  ||  trimmed.startsWith ("#")) continue;
                whitespaces = 0;
                while (whitespaces < line.length ()  &&  line.charAt (whitespaces) == ' ') whitespaces++;
                return;
            }
        }
    }

    public static void read (MNode node, Reader reader) throws IOException
    {
        LineReader lines = new LineReader (reader);
        read (node, lines, lines.whitespaces);
    }

    public static void read (MNode node, LineReader reader, int whitespaces) throws IOException
    {
        while (reader.line != null)
        {
            String line  = reader.line.trim ();
            String key   = line;
            String value = null;
            int colon = line.indexOf (':');
            if (colon >= 0)
            {
                key   = line.substring (0, colon).trim ();
                value = line.substring (colon + 1).trim ();
            }

            if (value != null  &&  value.equals ("|"))
            {
                StringBuilder block = new StringBuilder ();
                reader.getNextLine ();
                int blockIndent = reader.whitespaces;
                if (blockIndent > whitespaces)
                {
                    while (reader.line != null  &&  reader.whitespaces >= blockIndent)
                    {
                        if (block.length () > 0) block.append ("\n");
                        block.append (reader.line.substring (blockIndent));
                        reader.getNextLine ();
                    }
                }
                value = block.toString ();
            }
            else
            {
                reader.getNextLine ();
            }

            MNode child = node.set (value, key);
            if (reader.whitespaces > whitespaces) read (child, reader, reader.whitespaces);
            if (reader.whitespaces < whitespaces) return;
        }
    }

    /**
        Writes the children of the given node. The node's own key and value are not written,
        since the root of a document has no key.
    **/
    public static void write (MNode node, Writer writer)
    {
        try
        {
            for (MNode c : node) write (c, writer, "");
        }
        catch (IOException e)
        {
            throw new UncheckedIOException (e);
        }
    }

    public static void write (MNode node, Writer writer, String indent) throws IOException
    {
        String key = node.key ();
        if (! node.data ())
        {
            writer.write (indent + key + "\n");
        }
        else
        {
            String value = node.get ();
            if (value.contains ("\n"))
            {
                String blockIndent = indent + " ";
                value = "|\n" + blockIndent + value.replace ("\n", "\n" + blockIndent);
            }
            writer.write (indent + key + ":" + value + "\n");
        }
        for (MNode c : node) write (c, writer, indent + " ");
    }
}
