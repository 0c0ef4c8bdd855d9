package com.viffx.Bnf.Grammar;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads grammars from text files.
 * <p>
 * Each rule is opened by a {@code priority N =>} header and may continue over the following
 * lines until the next header:
 * <pre>
 *   # arithmetic
 *   priority 0 =&gt; &lt;digit&gt; ::= "1" | "2" | "3"
 *   priority 1 =&gt; &lt;product&gt; ::= &lt;digit&gt; "*" &lt;digit&gt;
 *                | &lt;product&gt; "*" &lt;product&gt;
 * </pre>
 * Blank lines and lines whose first non-blank character is {@code #} are ignored.
 * Files carry no compile functions; register them on the loaded grammar.
 */
public final class GrammarLoader {
    private static final Logger log = LogManager.getLogger(GrammarLoader.class);
    private static final Pattern HEADER = Pattern.compile("^\\s*priority\\s+(\\S+)\\s*=>(.*)$");

    // ====== PARSING STATE ====== //
    private final String source;
    private final Grammar grammar = new Grammar();
    private StringBuilder currentRule;
    private int priority;
    private int ruleLine;

    private GrammarLoader(String source) {
        this.source = source;
    }

    // ====== PUBLIC API ====== //
    public static Grammar load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    /**
     * Loads a grammar from the class path.
     *
     * @param name resource name, for example {@code grammars/arithmetic.bnf}
     * @throws FileNotFoundException if no such resource exists
     */
    public static Grammar loadResource(String name) throws IOException {
        InputStream in = GrammarLoader.class.getClassLoader().getResourceAsStream(name);
        if (in == null) throw new FileNotFoundException("grammar resource not found: " + name);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, name);
        }
    }

    /**
     * Reads a grammar from {@code reader}. The reader is not closed.
     *
     * @param reader the grammar text
     * @param source a name for the input, used in error messages
     * @throws IOException if reading fails, or a header or rule is malformed
     */
    public static Grammar load(Reader reader, String source) throws IOException {
        BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        GrammarLoader loader = new GrammarLoader(source);
        loader.parse(buffered);
        log.info("loaded {} rules from {}", loader.grammar.symbols().size(), source);
        return loader.grammar;
    }

    // ====== PARSING METHODS ====== //
    private void parse(BufferedReader reader) throws IOException {
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#")) continue;

            Matcher header = HEADER.matcher(line);
            if (header.matches()) {
                finishRule();
                priority = parsePriority(header.group(1), lineNumber, line);
                currentRule = new StringBuilder(header.group(2));
                ruleLine = lineNumber;
                continue;
            }

            if (currentRule == null) {
                throw new IOException(errorContext(lineNumber, line) + "expected 'priority N =>' before any rule text");
            }
            currentRule.append('\n').append(line);
        }
        finishRule();
    }

    private int parsePriority(String value, int lineNumber, String line) throws IOException {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) throw new IOException(errorContext(lineNumber, line) + "priority cannot be negative: " + value);
            return parsed;
        } catch (NumberFormatException e) {
            throw new IOException(errorContext(lineNumber, line) + "illegal priority: " + value, e);
        }
    }

    private void finishRule() throws IOException {
        if (currentRule == null) return;
        String rule = currentRule.toString();
        try {
            grammar.addSymbolFromRule(rule, priority);
        } catch (MalformedRuleException e) {
            throw new IOException(errorContext(ruleLine, rule) + e.getMessage(), e);
        }
        currentRule = null;
    }

    // ====== ERROR REPORTING ====== //
    private String errorContext(int lineNumber, String text) {
        return "\n\tERROR: " + source + ":" + lineNumber +
                "\n\tCONTEXT: " + text.strip() + "\n\t";
    }
}
