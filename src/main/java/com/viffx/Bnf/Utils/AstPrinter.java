package com.viffx.Bnf.Utils;

import com.viffx.Bnf.Tokens.NonTerminalToken;
import com.viffx.Bnf.Tokens.Token;

import java.util.List;
import java.util.Stack;

public final class AstPrinter {
    private AstPrinter() {}

    // Renders each root token and its descendants, one token per line, indented by depth with tabs
    public static String toString(List<Token> roots) {
        StringBuilder builder = new StringBuilder();
        Stack<Integer> depthStack = new Stack<>();
        Stack<Token> tokenStack = new Stack<>();
        for (int i = roots.size() - 1; i >= 0; i--) {
            depthStack.push(0);
            tokenStack.push(roots.get(i));
        }
        while (!tokenStack.isEmpty()) {
            int depth = depthStack.pop();
            Token token = tokenStack.pop();
            builder.append("\t".repeat(depth));
            if (token instanceof NonTerminalToken node) {
                builder.append('<').append(node.name()).append('>').append('\n');
                // push in reverse so the leftmost child is printed first
                List<Token> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    depthStack.push(depth + 1);
                    tokenStack.push(children.get(i));
                }
            } else {
                builder.append(token).append('\n');
            }
        }
        return builder.toString();
    }
}
