/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.language;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.eqgen.language.operator.NOT;
import gov.sandia.eqgen.language.operator.Negate;

/**
    Recursive-descent parser for the expression language. Grammar, loosest first:
    <pre>
    or         := and ("or" and)*
    and        := not ("and" not)*
    not        := "not" not | comparison
    comparison := additive (("<" | "<=" | ">" | ">=" | "==" | "!=") additive)?
    additive   := multiply (("+" | "-") multiply)*
    multiply   := unary (("*" | "/") unary)*
    unary      := ("-" | "+") unary | power
    power      := primary (("**" | "^") unary)?
    primary    := number | identifier | identifier "(" arguments? ")" | "(" or ")"
    </pre>
**/
public class ExpressionParser
{
    protected String text;
    protected int    position;

    public static final String[] comparisons = {"<=", ">=", "==", "!=", "<", ">"};

    public ExpressionParser (String text)
    {
        this.text = text;
    }

    public Operator parse () throws ParseException
    {
        skipSpace ();
        if (atEnd ()) throw new ParseException ("Empty expression", text, position);
        Operator result = parseOr ();
        skipSpace ();
        if (! atEnd ()) throw new ParseException ("Unexpected character '" + text.charAt (position) + "'", text, position);
        return result;
    }

    protected Operator parseOr () throws ParseException
    {
        Operator result = parseAnd ();
        while (matchWord ("or")) result = binary ("or", result, parseAnd ());
        return result;
    }

    protected Operator parseAnd () throws ParseException
    {
        Operator result = parseNot ();
        while (matchWord ("and")) result = binary ("and", result, parseNot ());
        return result;
    }

    protected Operator parseNot () throws ParseException
    {
        if (matchWord ("not"))
        {
            NOT result = new NOT ();
            result.setOperand (parseNot ());
            return result;
        }
        return parseComparison ();
    }

    protected Operator parseComparison () throws ParseException
    {
        Operator result = parseAdditive ();
        String op = matchComparison ();
        if (op == null) return result;
        result = binary (op, result, parseAdditive ());
        skipSpace ();
        int start = position;
        if (matchComparison () != null) throw new ParseException ("Comparisons can't be chained", text, start);
        return result;
    }

    protected Operator parseAdditive () throws ParseException
    {
        Operator result = parseMultiplicative ();
        while (true)
        {
            skipSpace ();
            if (atEnd ()) return result;
            char c = text.charAt (position);
            if (c != '+'  &&  c != '-') return result;
            position++;
            result = binary (String.valueOf (c), result, parseMultiplicative ());
        }
    }

    protected Operator parseMultiplicative () throws ParseException
    {
        Operator result = parseUnary ();
        while (true)
        {
            skipSpace ();
            if (atEnd ()) return result;
            char c = text.charAt (position);
            if (c != '*'  &&  c != '/') return result;
            if (text.startsWith ("**", position)) return result;  // only reachable with a dangling power, which parsePrimary() will report
            position++;
            result = binary (String.valueOf (c), result, parseUnary ());
        }
    }

    protected Operator parseUnary () throws ParseException
    {
        skipSpace ();
        if (atEnd ()) throw new ParseException ("Expression ends unexpectedly", text, position);
        char c = text.charAt (position);
        if (c == '-')
        {
            position++;
            Negate result = new Negate ();
            result.setOperand (parseUnary ());
            return result;
        }
        if (c == '+')
        {
            position++;
            return parseUnary ();
        }
        return parsePower ();
    }

    protected Operator parsePower () throws ParseException
    {
        Operator base = parsePrimary ();
        skipSpace ();
        String op = null;
        if      (text.startsWith ("**", position)) op = "**";
        else if (text.startsWith ("^",  position)) op = "^";
        if (op == null) return base;
        position += op.length ();
        return binary ("**", base, parseUnary ());
    }

    protected Operator parsePrimary () throws ParseException
    {
        skipSpace ();
        if (atEnd ()) throw new ParseException ("Expression ends unexpectedly", text, position);
        int  start = position;
        char c     = text.charAt (position);

        if (c == '(')
        {
            position++;
            Operator result = parseOr ();
            skipSpace ();
            if (atEnd ()  ||  text.charAt (position) != ')') throw new ParseException ("Missing close parenthesis", text, position);
            position++;
            return result;
        }

        if (Character.isDigit (c)  ||  c == '.') return parseNumber ();

        if (isIdentifierStart (c))
        {
            while (! atEnd ()  &&  isIdentifierPart (text.charAt (position))) position++;
            String name = text.substring (start, position);
            if (name.equals ("and")  ||  name.equals ("or")  ||  name.equals ("not"))
            {
                throw new ParseException ("Unexpected keyword \"" + name + "\"", text, start);
            }

            skipSpace ();
            if (atEnd ()  ||  text.charAt (position) != '(') return new AccessVariable (name, start);

            // function call
            position++;
            List<Operator> arguments = new ArrayList<Operator> ();
            skipSpace ();
            if (! atEnd ()  &&  text.charAt (position) == ')')
            {
                position++;
            }
            else
            {
                while (true)
                {
                    arguments.add (parseOr ());
                    skipSpace ();
                    if (atEnd ()) throw new ParseException ("Missing close parenthesis", text, position);
                    c = text.charAt (position++);
                    if (c == ')') break;
                    if (c != ',') throw new ParseException ("Expected , or ) in argument list", text, position - 1);
                }
            }

            Function f;
            Operator registered = Operator.create (name);
            if (registered instanceof Function) f = (Function) registered;
            else                                f = new Function (name);
            f.operands = arguments.toArray (new Operator[arguments.size ()]);
            int arity = f.arity ();
            if (arity >= 0  &&  arity != f.operands.length)
            {
                throw new ParseException (name + "() takes " + arity + " argument(s), but " + f.operands.length + " were given", text, start);
            }
            return f;
        }

        throw new ParseException ("Unexpected character '" + c + "'", text, start);
    }

    protected Operator parseNumber () throws ParseException
    {
        int start = position;
        while (! atEnd ()  &&  Character.isDigit (text.charAt (position))) position++;
        if (! atEnd ()  &&  text.charAt (position) == '.')
        {
            position++;
            while (! atEnd ()  &&  Character.isDigit (text.charAt (position))) position++;
        }
        if (! atEnd ()  &&  (text.charAt (position) == 'e'  ||  text.charAt (position) == 'E'))
        {
            int mark = position++;
            if (! atEnd ()  &&  (text.charAt (position) == '+'  ||  text.charAt (position) == '-')) position++;
            if (atEnd ()  ||  ! Character.isDigit (text.charAt (position)))
            {
                position = mark;  // not an exponent after all, so let the caller deal with the letter
            }
            else
            {
                while (! atEnd ()  &&  Character.isDigit (text.charAt (position))) position++;
            }
        }
        String number = text.substring (start, position);
        try
        {
            return new Constant (Double.parseDouble (number), number);
        }
        catch (NumberFormatException e)
        {
            throw new ParseException ("Malformed number \"" + number + "\"", text, start);
        }
    }

    protected Operator binary (String name, Operator operand0, Operator operand1)
    {
        OperatorBinary result = (OperatorBinary) Operator.create (name);
        result.setOperands (operand0, operand1);
        return result;
    }

    protected String matchComparison ()
    {
        skipSpace ();
        for (String c : comparisons)
        {
            if (text.startsWith (c, position))
            {
                position += c.length ();
                return c;
            }
        }
        return null;
    }

    /**
        Consumes the given keyword if it appears next as a whole word.
    **/
    protected boolean matchWord (String word)
    {
        skipSpace ();
        if (! text.startsWith (word, position)) return false;
        int end = position + word.length ();
        if (end < text.length ()  &&  isIdentifierPart (text.charAt (end))) return false;
        position = end;
        return true;
    }

    protected void skipSpace ()
    {
        while (! atEnd ()  &&  Character.isWhitespace (text.charAt (position))) position++;
    }

    protected boolean atEnd ()
    {
        return position >= text.length ();
    }

    public static boolean isIdentifierStart (char c)
    {
        return c == '_'  ||  (c >= 'A'  &&  c <= 'Z')  ||  (c >= 'a'  &&  c <= 'z');
    }

    public static boolean isIdentifierPart (char c)
    {
        return isIdentifierStart (c)  ||  (c >= '0'  &&  c <= '9');
    }
}
