package com.viffx.Bnf.Grammar;

import com.viffx.Bnf.Symbols.NonTerminal;
import com.viffx.Bnf.Symbols.Symbol;
import com.viffx.Bnf.Tokens.Token;
import com.viffx.Bnf.Utils.Range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One alternative of a rule: an ordered sequence of symbol references that a contiguous
 * window of tokens must equal, element by element, to be collapsed.
 */
public class Choice extends ArrayList<Symbol> {
    public Choice() {}

    public Choice(Collection<? extends Symbol> symbols) {
        super(symbols);
    }

    public static Choice of(Symbol... symbols) {
        return new Choice(Arrays.asList(symbols));
    }

    /**
     * Returns whether this choice refers to the non-terminal {@code name}.
     */
    public boolean references(String name) {
        return contains(new NonTerminal(name));
    }

    public boolean matches(List<Token> window) {
        if (window.size() != size()) return false;
        for (int i = 0; i < size(); i++) {
            if (!get(i).matches(window.get(i))) return false;
        }
        return true;
    }

    /**
     * Slides a window of this choice's length over {@code sequence} and returns the range of
     * every window that matches, left to right. Matches may overlap.
     *
     * @param sequence the tokens to scan
     * @return the ranges of all matching windows
     */
    public List<Range> matchRanges(List<Token> sequence) {
        List<Range> ranges = new ArrayList<>();
        if (isEmpty()) return ranges;

        for (int start = 0; start + size() <= sequence.size(); start++) {
            if (matches(sequence.subList(start, start + size()))) {
                ranges.add(new Range(start, start + size()));
            }
        }
        return ranges;
    }

    @Override
    public String toString() {
        return stream().map(Symbol::toString).collect(Collectors.joining(" "));
    }
}
