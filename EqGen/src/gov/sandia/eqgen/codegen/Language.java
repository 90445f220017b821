/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.eqgen.codegen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import gov.sandia.eqgen.backend.c.LanguageC;
import gov.sandia.eqgen.backend.python.LanguagePython;
import gov.sandia.eqgen.db.AppData;
import gov.sandia.eqgen.db.MNode;
import gov.sandia.eqgen.db.MVolatile;
import gov.sandia.eqgen.language.Operator;
import gov.sandia.eqgen.language.ParseException;
import gov.sandia.eqgen.language.Renderer;

/**
    A target language for generated code. Subclasses translate expressions and statements,
    and supply templates with named slots (such as %CODE%) where translated code gets inserted.
    Instances hold only read-only settings, so one may be shared freely.
**/
public abstract class Language
{
    private static final Logger logger = Logger.getLogger (Language.class);

    public static final String MAIN = "%MAIN%";  // slot name for a single-string template
    public static final String CODE = "%CODE%";  // slot name for single-string code

    protected MNode settings;

    public interface Factory
    {
        public String   name ();
        public Language createInstance (MNode settings);
    }

    /**
        @param settings Overrides for this backend. Anything missing comes from AppData.state under Backend.{name}.
        May be null.
    **/
    public Language (MNode settings)
    {
        if (settings == null) settings = new MVolatile ();
        this.settings = settings;
    }

    public abstract String name ();

    public String setting (String key, String defaultValue)
    {
        String result = settings.get (key);
        if (! result.isEmpty ()) return result;
        return AppData.state.getOrDefault (defaultValue, "Backend", name (), key);
    }

    public int setting (String key, int defaultValue)
    {
        String value = setting (key, "");
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Integer.parseInt (value.trim ());
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Setting " + name () + "." + key + " is not an integer: " + value);
            return defaultValue;
        }
    }

    /**
        Names used by the standard templates, such as the loop index.
    **/
    public String templateName (String key, String defaultValue)
    {
        String result = settings.get ("Template", key);
        if (! result.isEmpty ()) return result;
        return AppData.state.getOrDefault (defaultValue, "Template", key);
    }

    // Translation -----------------------------------------------------------

    /**
        @return A renderer that produces expressions in this language.
    **/
    public abstract Renderer createRenderer ();

    public String translateExpression (String expression) throws ParseException
    {
        Operator op = Operator.parse (expression);
        Renderer renderer = createRenderer ();
        op.render (renderer);
        return renderer.result.toString ();
    }

    public abstract String translateStatement (Statement statement) throws ParseException;

    /**
        Translates a block of statements, including whatever declarations, loads from arrays
        and stores back to arrays the statements need.
        @return Either a single string, which belongs in the %CODE% slot, or code for several slots.
    **/
    public abstract CodeBlock translateStatementSequence (List<Statement> statements, Map<String,Specifier> specifiers) throws ParseException;

    public abstract CodeObject codeObject (CodeBlock code, Map<String,Specifier> specifiers);

    /**
        One hook per UserFunction, which lets the function prepare the namespace at compile time.
    **/
    public List<CodeObject.CompileHook> compileMethods (Map<String,Specifier> specifiers)
    {
        List<CodeObject.CompileHook> result = new ArrayList<CodeObject.CompileHook> ();
        for (Entry<String,Specifier> e : specifiers.entrySet ())
        {
            if (! (e.getValue () instanceof UserFunction)) continue;
            final UserFunction function = (UserFunction) e.getValue ();
            final String       var      = e.getKey ();
            result.add (new CodeObject.CompileHook ()
            {
                public void run (Map<String,Object> namespace)
                {
                    function.onCompile (namespace, Language.this, var);
                }
            });
        }
        return result;
    }

    /**
        Determines which array-resident variables the statements read and which they write.
        A variable is read if it appears on a right-hand side, or is the target of an in-place statement.
    **/
    public ReadWrite arrayReadWrite (List<Statement> statements, Map<String,Specifier> specifiers)
    {
        Set<String> read  = new HashSet<String> ();
        Set<String> write = new HashSet<String> ();
        for (Statement s : statements)
        {
            read.addAll (s.getIdentifiers ());
            if (s.inplace) read.add (s.var);
            write.add (s.var);
        }

        ReadWrite result = new ReadWrite ();
        for (Entry<String,Specifier> e : specifiers.entrySet ())
        {
            if (! (e.getValue () instanceof ArrayVariable)) continue;
            String name = e.getKey ();
            if (read .contains (name)) result.read .add (name);
            if (write.contains (name)) result.write.add (name);
        }
        return result;
    }

    // Templates -------------------------------------------------------------

    /**
        @return A template in which index runs over 0 to size-1.
    **/
    public abstract CodeBlock templateIterateAll (String index, String size);

    /**
        @return A template in which index runs over the first size values stored in array.
    **/
    public abstract CodeBlock templateIterateIndexArray (String index, String array, String size);

    public CodeBlock templateStateUpdate ()
    {
        return templateIterateAll (templateName ("index", "_neuron_idx"), templateName ("size", "_num_neurons"));
    }

    public CodeBlock templateReset ()
    {
        return templateIterateIndexArray (templateName ("index", "_neuron_idx"), templateName ("spikes", "_spikes"), templateName ("numSpikes", "_num_spikes"));
    }

    public CodeBlock templateThreshold ()
    {
        throw new UnsupportedOperationException ("Threshold template not implemented for language " + name ());
    }

    public CodeBlock templateSynapses ()
    {
        throw new UnsupportedOperationException ("Synapses template not implemented for language " + name ());
    }

    /**
        Inserts code into a template. A single-string code block fills the %CODE% slot.
        A single-string template is treated as the slot %MAIN%.
        Each template slot is first de-indented, then every placeholder found in it is replaced.
        Placeholders with no corresponding code stay as they are.
        @return A block with the same shape as the template.
    **/
    public CodeBlock applyTemplate (CodeBlock code, CodeBlock template)
    {
        Map<String,String> sections = code.asSlots (CODE);
        Map<String,String> output   = new LinkedHashMap<String,String> ();
        for (Entry<String,String> t : template.asSlots (MAIN).entrySet ())
        {
            String text = deindent (t.getValue ());
            for (Entry<String,String> s : sections.entrySet ()) text = applyCodeTemplate (s.getValue (), text, s.getKey ());
            output.put (t.getKey (), text);
            if (logger.isDebugEnabled ()) logger.debug ("Slot " + t.getKey () + ": " + text.length () + " characters");
        }
        if (template.isSingle ()) return new CodeBlock (output.get (MAIN));
        return new CodeBlock (output);
    }

    /**
        Replaces placeholder in template. Where the placeholder is alone on its line,
        the code takes its place with each line indented to match. Elsewhere it is replaced inline.
    **/
    public static String applyCodeTemplate (String code, String template, String placeholder)
    {
        String[] lines  = template.split ("\n", -1);
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < lines.length; i++)
        {
            if (i > 0) result.append ("\n");
            String line = lines[i];
            if (line.trim ().equals (placeholder))
            {
                String indent = line.substring (0, line.indexOf (placeholder));
                result.append (indent (deindent (code), indent));
            }
            else
            {
                result.append (line.replace (placeholder, code));
            }
        }
        return result.toString ();
    }

    /**
        Removes the whitespace prefix shared by all non-blank lines.
    **/
    public static String deindent (String text)
    {
        String[] lines = text.split ("\n", -1);
        int common = Integer.MAX_VALUE;
        for (String line : lines)
        {
            if (line.trim ().isEmpty ()) continue;
            int count = 0;
            while (count < line.length ()  &&  (line.charAt (count) == ' '  ||  line.charAt (count) == '\t')) count++;
            common = Math.min (common, count);
        }
        if (common == 0  ||  common == Integer.MAX_VALUE) return text;

        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < lines.length; i++)
        {
            if (i > 0) result.append ("\n");
            String line = lines[i];
            if (line.trim ().isEmpty ()) continue;
            result.append (line.substring (common));
        }
        return result.toString ();
    }

    /**
        Prefixes every non-blank line.
    **/
    public static String indent (String text, String prefix)
    {
        String[] lines = text.split ("\n", -1);
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < lines.length; i++)
        {
            if (i > 0) result.append ("\n");
            if (! lines[i].trim ().isEmpty ()) result.append (prefix + lines[i]);
        }
        return result.toString ();
    }

    // Static interface ------------------------------------------------------

    public static TreeMap<String,Factory> languages = new TreeMap<String,Factory> ();

    public static void register (Factory f)
    {
        languages.put (f.name (), f);
    }

    static
    {
        register (LanguageC     .factory ());
        register (LanguagePython.factory ());
    }

    public static Language get (String name)
    {
        return get (name, null);
    }

    /**
        Selects a backend by explicit name.
        @throws IllegalArgumentException if no backend has that name.
    **/
    public static Language get (String name, MNode settings)
    {
        Factory f = languages.get (name);
        if (f == null) throw new IllegalArgumentException ("Unknown language \"" + name + "\". Available: " + languages.keySet ());
        return f.createInstance (settings);
    }
}
