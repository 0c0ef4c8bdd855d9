package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Tokens.NonTerminalToken;

/**
 * Turns a node of one label into output text.
 * <p>
 * The grammar is passed along so the function can compile children itself through
 * {@link Grammar#compileToken(NonTerminalToken)}; nothing below the node is compiled otherwise.
 */
@FunctionalInterface
public interface CompileFunction {
    String compile(NonTerminalToken token, Grammar grammar);
}
