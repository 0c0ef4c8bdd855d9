package com.viffx.Bnf.Grammar;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles a {@link Grammar} from an ordered list of {@code (priority, rule, optional compile function)} entries.
 * <pre>
 *   Grammar grammar = Grammar.builder()
 *           .rule(1, "&lt;product&gt; ::= &lt;digit&gt; \"*\" &lt;digit&gt;", (token, g) -&gt; "product")
 *           .rule(0, "&lt;digit&gt; ::= \"1\" | \"2\"")
 *           .build();
 * </pre>
 * Every rule is parsed by {@link #build()}; a malformed one aborts the whole build.
 */
public class GrammarBuilder {
    private final List<Entry> entries = new ArrayList<>();

    public GrammarBuilder rule(int priority, String rule) {
        return rule(priority, rule, null);
    }

    public GrammarBuilder rule(int priority, String rule, @Nullable CompileFunction function) {
        entries.add(new Entry(priority, rule, function));
        return this;
    }

    /**
     * Builds the grammar. Functions are registered under the name of their rule, in entry order.
     *
     * @throws MalformedRuleException if any rule is malformed
     * @throws IllegalArgumentException if any priority is negative
     */
    @NotNull
    public Grammar build() {
        Grammar grammar = new Grammar();
        for (Entry entry : entries) {
            GrammarSymbol symbol = GrammarSymbol.fromRule(entry.rule());
            if (entry.function() != null) {
                grammar.addCompileFunction(symbol.name(), entry.function());
            }
            grammar.addSymbol(symbol, entry.priority());
        }
        return grammar;
    }

    public record Entry(int priority, String rule, @Nullable CompileFunction function) {
        public Entry {
            Objects.requireNonNull(rule, "rule cannot be null");
        }
    }
}
