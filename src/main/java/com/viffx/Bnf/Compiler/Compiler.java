package com.viffx.Bnf.Compiler;

import com.viffx.Bnf.Grammar.Grammar;
import com.viffx.Bnf.Tokens.NonTerminalToken;
import com.viffx.Bnf.Tokens.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds symbolized text back into a string with the compile functions of a {@link Grammar}.
 * <p>
 * Only the root tokens are compiled. A root node whose label has a compile function is
 * replaced by that function's result; any other root keeps its original text. The
 * functions decide for themselves whether to compile the children of their node, for
 * example with {@link Grammar#compileToken(NonTerminalToken)}.
 */
public class Compiler {
    private final Grammar grammar;

    public Compiler(Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
    }

    public String compile(String text) {
        return compile(grammar.symbolize(text));
    }

    public String compile(List<Token> roots) {
        StringBuilder builder = new StringBuilder();
        for (Token token : roots) {
            builder.append(compile(token));
        }
        return builder.toString();
    }

    /**
     * Compiles one token, falling back to its original text when no function applies.
     */
    public String compile(Token token) {
        if (token instanceof NonTerminalToken node) {
            return compileToken(node).orElseGet(node::terminals);
        }
        return token.terminals();
    }

    /**
     * Runs the compile function registered for the label of {@code token}.
     *
     * @return the function's result, or empty if none is registered
     */
    public Optional<String> compileToken(NonTerminalToken token) {
        return grammar.compileFunction(token.name())
                .map(function -> function.compile(token, grammar));
    }
}
