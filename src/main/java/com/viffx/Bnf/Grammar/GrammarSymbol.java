package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Symbols.NonTerminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A labeled rule of a grammar, {@code <name> ::= expression}.
 * <p>
 * Its choices are split at query time into recursive ones, which reference {@code name}
 * itself, and non-recursive ones. Recursive choices that describe "arrays" must merge the
 * symbol with itself: write {@code <number> ::= <digit> | <number> <number>}, because once
 * every {@code <digit>} became a {@code <number>} a choice like {@code <number> <digit>}
 * has nothing left to match.
 */
public final class GrammarSymbol {
    private final String name;
    private final Expression expression;

    public GrammarSymbol(String name, Expression expression) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.expression = new Expression(Objects.requireNonNull(expression, "expression cannot be null"));
    }

    /**
     * Parses rule text of the form {@code <name> ::= "a" <b> | <c>}.
     *
     * @throws MalformedRuleException if the rule text is not valid
     */
    @NotNull
    @Contract("_ -> new")
    public static GrammarSymbol fromRule(String rule) {
        return RuleParser.parse(rule);
    }

    public String name() {
        return name;
    }

    public NonTerminal type() {
        return new NonTerminal(name);
    }

    public List<Choice> expression() {
        return Collections.unmodifiableList(expression);
    }

    public List<Choice> recursiveChoices() {
        return expression.recursiveChoices(name);
    }

    public List<Choice> nonRecursiveChoices() {
        return expression.nonRecursiveChoices(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GrammarSymbol that = (GrammarSymbol) o;
        return name.equals(that.name) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression);
    }

    // Prints valid rule text, so the result parses back into an equal symbol
    @Override
    public String toString() {
        return "<" + name + "> ::= " + expression;
    }
}
