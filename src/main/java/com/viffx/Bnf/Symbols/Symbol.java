package com.viffx.Bnf.Symbols;

import com.viffx.Bnf.Tokens.Token;

/**
 * A reference to a grammar symbol, used both inside rule choices and to query token trees.
 * <p>
 * A {@link Terminal} names an exact piece of text, a {@link NonTerminal} names a label
 * (the text between the angle brackets, without them). Matching a symbol against a
 * {@link Token} compares only text or label, never the children of a node.
 */
public sealed interface Symbol permits Terminal, NonTerminal {
    String value();

    /**
     * Returns whether {@code token} carries this symbol's text (for a terminal) or label
     * (for a non-terminal).
     *
     * @param token the token to compare against
     * @return {@code true} if the token is of this symbol
     */
    boolean matches(Token token);
}
