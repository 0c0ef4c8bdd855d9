package com.viffx.Bnf.Tokens;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record TerminalToken(String value) implements Token {
    public TerminalToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String symbol() {
        return value;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public String terminals() {
        return value;
    }

    @Override
    public Optional<Token> get(TokenIndex index) {
        return Optional.empty();
    }

    @Override
    public Optional<List<TokenIndex>> childIndexes() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "\"" + value.replaceAll("\n", "\\\\n") + "\"";
    }
}
