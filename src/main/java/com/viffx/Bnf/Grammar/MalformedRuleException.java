package com.viffx.Bnf.Grammar;

/**
 * Thrown when rule text such as {@code <digit> ::= "1" | "2"} cannot be parsed.
 */
public class MalformedRuleException extends IllegalArgumentException {
    public MalformedRuleException(String message) {
        super(message);
    }
}
