package com.viffx.Bnf.Symbols;

import com.viffx.Bnf.Tokens.TerminalToken;
import com.viffx.Bnf.Tokens.Token;

import java.util.Objects;

public record Terminal(String value) implements Symbol {
    public Terminal {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public boolean matches(Token token) {
        return token instanceof TerminalToken terminal && terminal.value().equals(value);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
