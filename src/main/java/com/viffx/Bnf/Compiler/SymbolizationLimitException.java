package com.viffx.Bnf.Compiler;

/**
 * Thrown when symbolization needs more passes than the configured limit allows, or when,
 * under such a limit, a recursive choice keeps matching its own output.
 */
public class SymbolizationLimitException extends IllegalStateException {
    private final int passLimit;

    public SymbolizationLimitException(int passLimit, int remainingTokens) {
        this("symbolization did not settle within " + passLimit + " passes (" + remainingTokens + " tokens left)", passLimit);
    }

    public SymbolizationLimitException(String message, int passLimit) {
        super(message);
        this.passLimit = passLimit;
    }

    public int passLimit() {
        return passLimit;
    }
}
