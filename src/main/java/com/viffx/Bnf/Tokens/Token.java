package com.viffx.Bnf.Tokens;

import com.viffx.Bnf.Symbols.Symbol;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * A node of the token tree built by symbolization.
 * <p>
 * A token is either a {@link TerminalToken}, a leaf holding literal text, or a
 * {@link NonTerminalToken}, a labeled node owning an ordered list of child tokens.
 * Concatenating the text of every leaf below a token, left to right, always gives back
 * the exact input text the token was built from.
 */
public sealed interface Token permits TerminalToken, NonTerminalToken {

    @NotNull
    @Contract("_ -> new")
    static TerminalToken terminal(String value) {
        return new TerminalToken(value);
    }

    @NotNull
    @Contract("_, _ -> new")
    static NonTerminalToken nonTerminal(String name, List<Token> children) {
        return new NonTerminalToken(name, children);
    }

    /**
     * Returns the label of a node, or the text of a leaf.
     */
    String symbol();

    boolean isTerminal();

    /**
     * Returns the concatenated text of all leaves reachable from this token.
     */
    String terminals();

    /**
     * Resolves a path relative to this token.
     *
     * @param index the path of child offsets to follow
     * @return the descendant at {@code index}, or empty if the path is empty or leads nowhere
     */
    Optional<Token> get(TokenIndex index);

    /**
     * Returns the single-offset paths of this token's children, or empty for a leaf.
     */
    Optional<List<TokenIndex>> childIndexes();

    default boolean is(Symbol symbol) {
        return symbol.matches(this);
    }

    default Optional<TerminalToken> asTerminal() {
        return this instanceof TerminalToken terminal ? Optional.of(terminal) : Optional.empty();
    }

    default Optional<NonTerminalToken> asNonTerminal() {
        return this instanceof NonTerminalToken node ? Optional.of(node) : Optional.empty();
    }
}
