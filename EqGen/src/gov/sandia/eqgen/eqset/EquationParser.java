/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.eqset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.measure.Unit;

import org.apache.log4j.Logger;

import gov.sandia.eqgen.eqset.SingleEquation.Kind;
import gov.sandia.eqgen.language.Expression;
import gov.sandia.eqgen.language.ExpressionParser;
import gov.sandia.eqgen.language.ParseException;
import gov.sandia.eqgen.language.UnitValue;

/**
    Reads equation text. Each entry takes one of three forms:
    <pre>
    name : unit (flags)
    name = expression : unit (flags)
    dname/dt = expression : unit (flags)
    </pre>
    The flag list is optional. A # starts a comment that runs to the end of the line.
    An expression may continue over several lines, up to the colon that introduces its unit.
**/
public class EquationParser
{
    private static final Logger logger = Logger.getLogger (EquationParser.class);

    protected static final Pattern flagList = Pattern.compile ("\\(\\s*([A-Za-z_-]+(?:\\s*,\\s*[A-Za-z_-]+)*)\\s*\\)\\s*");

    protected Expression.Factory factory;

    public EquationParser (Expression.Factory factory)
    {
        this.factory = factory;
    }

    /**
        @return Equations keyed by variable name, in order of declaration.
    **/
    public Map<String,SingleEquation> parse (String text) throws ParseException
    {
        Map<String,SingleEquation> result = new LinkedHashMap<String,SingleEquation> ();
        String[] lines = text.split ("\r?\n", -1);
        int i = 0;
        while (i < lines.length)
        {
            String line = stripComment (lines[i]);
            if (line.trim ().isEmpty ())
            {
                i++;
                continue;
            }

            String raw        = lines[i];
            int    lineNumber = i + 1;
            int    length     = line.length ();

            // Left-hand side
            int pos       = skipSpace (line, 0);
            int nameStart = pos;
            if (! ExpressionParser.isIdentifierStart (line.charAt (pos))) throw new ParseException ("Expected a variable name", raw, lineNumber, pos);
            while (pos < length  &&  ExpressionParser.isIdentifierPart (line.charAt (pos))) pos++;
            String name = line.substring (nameStart, pos);
            pos = skipSpace (line, pos);
            if (pos >= length) throw new ParseException ("Expected \":\", \"=\" or \"/dt =\" after \"" + name + "\"", raw, lineNumber, pos);

            Kind kind;
            char c = line.charAt (pos);
            if      (c == ':') kind = Kind.PARAMETER;
            else if (c == '=') kind = Kind.STATIC;
            else if (c == '/'  &&  name.length () > 1  &&  name.startsWith ("d"))
            {
                pos = skipSpace (line, pos + 1);
                if (! line.startsWith ("dt", pos)  ||  pos + 2 < length  &&  ExpressionParser.isIdentifierPart (line.charAt (pos + 2)))
                {
                    throw new ParseException ("Expected \"dt\"", raw, lineNumber, pos);
                }
                pos = skipSpace (line, pos + 2);
                if (pos >= length  ||  line.charAt (pos) != '=') throw new ParseException ("Expected \"=\"", raw, lineNumber, pos);
                kind = Kind.DIFFERENTIAL;
                name = name.substring (1);
                nameStart++;
            }
            else
            {
                throw new ParseException ("Expected \":\", \"=\" or \"/dt =\" after \"" + name + "\"", raw, lineNumber, pos);
            }
            pos++;  // past the : or =

            if (result.containsKey (name)) throw new ParseException ("Duplicate definition of variable \"" + name + "\"", raw, lineNumber, nameStart);

            // Expression
            Expression expression = null;
            if (kind != Kind.PARAMETER)
            {
                int           expressionColumn = skipSpace (line, pos);
                boolean       multiline        = false;
                StringBuilder code             = new StringBuilder ();
                while (true)
                {
                    int colon = line.indexOf (':', pos);
                    if (colon >= 0)
                    {
                        code.append (line, pos, colon);
                        pos = colon + 1;
                        break;
                    }
                    code.append (line.substring (pos)).append (' ');
                    multiline = true;
                    i++;
                    if (i >= lines.length) throw new ParseException ("Missing \":\" and unit after the expression for \"" + name + "\"", raw, lineNumber, expressionColumn);
                    line = stripComment (lines[i]);
                    pos  = 0;
                }

                String written = code.toString ();
                String collapsed = written.replaceAll ("\\s+", " ").trim ();
                if (collapsed.isEmpty ()) throw new ParseException ("Missing expression for \"" + name + "\"", raw, lineNumber, expressionColumn);
                try
                {
                    expression = factory.create (collapsed);
                }
                catch (ParseException e)
                {
                    int column = expressionColumn;
                    if (! multiline  &&  e.column >= 0  &&  written.trim ().equals (collapsed)) column += e.column;
                    throw new ParseException ("Invalid expression for \"" + name + "\": " + e.getMessage (), raw, lineNumber, column);
                }
            }

            // Unit and flags, on whichever line the expression ended
            String unitLine   = lines[i];
            String rest       = line.substring (pos);
            int    paren      = rest.indexOf ('(');
            int    unitColumn = skipSpace (line, pos);
            String unitText   = rest;
            if (paren >= 0) unitText = rest.substring (0, paren);
            if (unitText.trim ().isEmpty ()) throw new ParseException ("Missing unit for \"" + name + "\"", unitLine, i + 1, unitColumn);
            Unit<?> unit;
            try
            {
                unit = UnitValue.parseUnit (unitText);
            }
            catch (ParseException e)
            {
                throw new ParseException (e.getMessage (), unitLine, i + 1, unitColumn + Math.max (e.column, 0));
            }

            List<String> flags = new ArrayList<String> ();
            if (paren >= 0)
            {
                Matcher m = flagList.matcher (rest.substring (paren));
                if (! m.matches ()) throw new ParseException ("Malformed flag list", unitLine, i + 1, pos + paren);
                for (String f : m.group (1).split (",")) flags.add (f.trim ());
            }

            result.put (name, new SingleEquation (kind, name, unitText, unit, expression, flags));
            i++;
        }
        logger.debug ("Parsed " + result.size () + " equations");
        return result;
    }

    public static String stripComment (String line)
    {
        int index = line.indexOf ('#');
        if (index < 0) return line;
        return line.substring (0, index);
    }

    protected static int skipSpace (String line, int pos)
    {
        while (pos < line.length ()  &&  Character.isWhitespace (line.charAt (pos))) pos++;
        return pos;
    }
}
