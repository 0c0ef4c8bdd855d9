package com.viffx.Bnf.Symbols;

import com.viffx.Bnf.Tokens.NonTerminalToken;
import com.viffx.Bnf.Tokens.Token;

import java.util.Objects;

public record NonTerminal(String value) implements Symbol {
    public NonTerminal {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public boolean matches(Token token) {
        return token instanceof NonTerminalToken node && node.name().equals(value);
    }

    @Override
    public String toString() {
        return "<" + value + ">";
    }
}
