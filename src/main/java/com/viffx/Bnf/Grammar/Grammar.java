package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Compiler.Compiler;
import com.viffx.Bnf.Compiler.Symbolizer;
import com.viffx.Bnf.Tokens.NonTerminalToken;
import com.viffx.Bnf.Tokens.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A set of prioritized rules plus the functions that compile their nodes.
 * <p>
 * Rules with a higher priority are tried first in every pass of symbolization, which is
 * how, for example, products are grouped before sums. The same name may be registered
 * more than once; every registration is applied on its own.
 * <pre>
 *   Grammar grammar = Grammar.builder()
 *           .rule(0, "&lt;digit&gt; ::= \"1\" | \"2\" | \"3\"")
 *           .rule(0, "&lt;number&gt; ::= &lt;digit&gt; | &lt;number&gt; &lt;number&gt;")
 *           .build();
 *   List&lt;Token&gt; tokens = grammar.symbolize("12");
 * </pre>
 */
public class Grammar {
    private static final Logger log = LogManager.getLogger(Grammar.class);

    // ====== INSTANCE FIELDS ====== //
    private final List<PrioritizedSymbol> symbols = new ArrayList<>();
    private final Map<String, CompileFunction> compileFunctions = new HashMap<>();
    private int passLimit = 0;

    // ====== CONSTRUCTORS ====== //
    public Grammar() {}

    @NotNull
    @Contract(" -> new")
    public static GrammarBuilder builder() {
        return new GrammarBuilder();
    }

    /**
     * Loads a grammar file; see {@link GrammarLoader} for the format.
     */
    @NotNull
    @Contract("_ -> new")
    public static Grammar load(Path path) throws IOException {
        return GrammarLoader.load(path);
    }

    // ====== PUBLIC API ====== //

    // Rules

    /**
     * Registers a symbol. No check is made against symbols already registered under the same name.
     *
     * @param symbol the symbol to add
     * @param priority a non-negative priority, higher is applied first
     * @throws IllegalArgumentException if {@code priority} is negative
     */
    public void addSymbol(GrammarSymbol symbol, int priority) {
        symbols.add(new PrioritizedSymbol(symbol, priority));
    }

    /**
     * Parses {@code rule} and registers the resulting symbol.
     *
     * @param rule rule text such as {@code <digit> ::= "1" | "2"}
     * @param priority a non-negative priority, higher is applied first
     * @throws MalformedRuleException if {@code rule} is not valid rule text
     */
    public void addSymbolFromRule(String rule, int priority) {
        addSymbol(GrammarSymbol.fromRule(rule), priority);
    }

    /**
     * Returns whether a symbol named {@code name} (without angle brackets) is registered.
     */
    public boolean containsSymbol(String name) {
        return symbols.stream().anyMatch(entry -> entry.symbol().name().equals(name));
    }

    /**
     * Returns the registered symbols in declaration order.
     */
    public List<PrioritizedSymbol> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    // Symbolization

    /**
     * Turns {@code text} into a sequence of root tokens, collapsing runs of tokens into
     * labeled nodes until no rule matches anywhere.
     * <p>
     * For the rules
     * <pre>
     *   priority 0 =&gt; &lt;expression&gt; ::= &lt;digit&gt; &lt;operator&gt; &lt;digit&gt; | &lt;expression&gt; &lt;operator&gt; &lt;expression&gt;
     *   priority 0 =&gt; &lt;digit&gt; ::= "1" | "2" | "3" | "4" | "5"
     *   priority 0 =&gt; &lt;operator&gt; ::= "+" | "-" | "*" | "/"
     * </pre>
     * the text {@code 2*4} becomes a single {@code <expression>} root over a {@code <digit>},
     * an {@code <operator>} and another {@code <digit>}.
     *
     * @param text the input
     * @return the root tokens; their text, concatenated, is {@code text}
     * @throws com.viffx.Bnf.Compiler.SymbolizationLimitException if a pass limit is set and exceeded
     */
    public List<Token> symbolize(String text) {
        return new Symbolizer(symbols, passLimit).symbolize(text);
    }

    /**
     * Returns whether {@code text} symbolizes into exactly one root token.
     */
    public boolean hasSingleRoot(String text) {
        return symbolize(text).size() == 1;
    }

    /**
     * Caps the number of fixpoint passes {@link #symbolize(String)} may run; {@code 0} removes the cap.
     *
     * @return this grammar
     */
    public Grammar withPassLimit(int passLimit) {
        if (passLimit < 0) throw new IllegalArgumentException("passLimit cannot be negative: " + passLimit);
        this.passLimit = passLimit;
        return this;
    }

    public int passLimit() {
        return passLimit;
    }

    // Compilation

    /**
     * Registers the function that compiles nodes labeled {@code name}, replacing any earlier one.
     */
    public void addCompileFunction(String name, CompileFunction function) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(function, "function cannot be null");
        if (compileFunctions.put(name, function) != null) {
            log.debug("compile function for <{}> replaced", name);
        }
    }

    public Optional<CompileFunction> compileFunction(String name) {
        return Optional.ofNullable(compileFunctions.get(name));
    }

    /**
     * Symbolizes {@code text} and compiles the root tokens; see {@link Compiler}.
     */
    public String compile(String text) {
        return new Compiler(this).compile(text);
    }

    /**
     * Compiles one node with the function registered for its label.
     *
     * @return the compiled text, or empty if no function is registered for the label
     */
    public Optional<String> compileToken(NonTerminalToken token) {
        return new Compiler(this).compileToken(token);
    }

    // ====== OBJECT METHODS ====== //

    // Rules only, compile functions have no meaningful equality
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Grammar grammar = (Grammar) o;
        return symbols.equals(grammar.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (PrioritizedSymbol entry : symbols) {
            builder.append("priority ").append(entry.priority())
                    .append(" => ").append(entry.symbol())
                    .append('\n');
        }
        return builder.toString();
    }

    // ====== INTERNAL DATA TYPES ====== //
    public record PrioritizedSymbol(GrammarSymbol symbol, int priority) {
        public PrioritizedSymbol {
            Objects.requireNonNull(symbol, "symbol cannot be null");
            if (priority < 0) throw new IllegalArgumentException("priority cannot be negative: " + priority);
        }
    }
}
