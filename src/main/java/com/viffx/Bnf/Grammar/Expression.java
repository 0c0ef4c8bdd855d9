package com.viffx.Bnf.Grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The right hand side of a rule: its choices, in declaration order.
 */
public class Expression extends ArrayList<Choice> {
    public Expression() {}

    public Expression(Collection<? extends Choice> choices) {
        super(choices);
    }

    public static Expression of(Choice... choices) {
        return new Expression(Arrays.asList(choices));
    }

    // Choices that reference the non-terminal name, i.e. that can only match once a token of that label exists
    public List<Choice> recursiveChoices(String name) {
        return stream().filter(choice -> choice.references(name)).toList();
    }

    public List<Choice> nonRecursiveChoices(String name) {
        return stream().filter(choice -> !choice.references(name)).toList();
    }

    @Override
    public String toString() {
        return stream().map(Choice::toString).collect(Collectors.joining(" | "));
    }
}
