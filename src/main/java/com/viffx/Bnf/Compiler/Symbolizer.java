package com.viffx.Bnf.Compiler;

import com.viffx.Bnf.Grammar.Choice;
import com.viffx.Bnf.Grammar.Grammar.PrioritizedSymbol;
import com.viffx.Bnf.Grammar.GrammarSymbol;
import com.viffx.Bnf.Tokens.NonTerminalToken;
import com.viffx.Bnf.Tokens.TerminalToken;
import com.viffx.Bnf.Tokens.Token;
import com.viffx.Bnf.Utils.Range;
import com.viffx.Bnf.Utils.RangeReplacer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collapses a character sequence into labeled tokens until a fixpoint is reached.
 * <p>
 * The input starts out as one {@link TerminalToken} per code point. Every pass walks the
 * symbols from the highest priority down and, for each one, replaces all windows of the
 * sequence that match one of its choices with a node labeled by the symbol. Passes repeat
 * until one of them finds no match at all.
 * <p>
 * One instance may be reused; each call to {@link #symbolize(String)} works on its own sequence.
 */
public class Symbolizer {
    private static final Logger log = LogManager.getLogger(Symbolizer.class);

    // ====== INSTANCE FIELDS ====== //
    private final List<GrammarSymbol> ordered;
    private final int passLimit;

    // ====== CONSTRUCTORS ====== //
    public Symbolizer(List<PrioritizedSymbol> symbols) {
        this(symbols, 0);
    }

    /**
     * @param symbols the symbols to apply, in declaration order
     * @param passLimit the maximum number of passes, the last unproductive one included; {@code 0} for no limit
     */
    public Symbolizer(List<PrioritizedSymbol> symbols, int passLimit) {
        if (passLimit < 0) throw new IllegalArgumentException("passLimit cannot be negative: " + passLimit);
        this.ordered = order(symbols);
        this.passLimit = passLimit;
    }

    // ====== PUBLIC API ====== //

    /**
     * Returns the order symbols are applied in within a pass.
     * <p>
     * Symbols are sorted by ascending priority (stable) and the whole list is then reversed.
     * Higher priorities therefore come first, and symbols sharing a priority run in reverse
     * declaration order.
     */
    public static List<GrammarSymbol> order(List<PrioritizedSymbol> symbols) {
        List<PrioritizedSymbol> sorted = new ArrayList<>(symbols);
        sorted.sort(Comparator.comparingInt(PrioritizedSymbol::priority));
        Collections.reverse(sorted);
        return sorted.stream().map(PrioritizedSymbol::symbol).toList();
    }

    /**
     * Symbolizes {@code text}.
     *
     * @return the root tokens left once no symbol matches anywhere
     * @throws SymbolizationLimitException if a pass limit is set and the fixpoint is not reached in time
     */
    public List<Token> symbolize(String text) {
        List<Token> sequence = characterize(text);

        int pass = 0;
        boolean productive;
        do {
            if (passLimit > 0 && pass >= passLimit) throw new SymbolizationLimitException(passLimit, sequence.size());
            pass++;

            productive = false;
            for (GrammarSymbol symbol : ordered) {
                if (matchesAnywhere(symbol, sequence)) productive = true;
                collapse(symbol, sequence);
            }
            log.debug("pass {}: {} tokens left", pass, sequence.size());
        } while (productive);

        return sequence;
    }

    /**
     * Applies one symbol to {@code sequence}, in place.
     * <p>
     * First every window matching a non-recursive choice is collapsed. Then windows matching
     * recursive choices are collapsed over and over, until none is left. Where candidate
     * windows overlap, the leftmost wins.
     * <p>
     * With a pass limit set, a recursive choice that keeps matching for more rounds than the
     * sequence had tokens, like {@code <a> ::= <a>}, aborts the collapse.
     *
     * @param symbol the symbol to collapse into
     * @param sequence the tokens to modify
     */
    public void collapse(GrammarSymbol symbol, List<Token> sequence) {
        replace(symbol, symbol.nonRecursiveChoices(), sequence);

        List<Choice> recursive = symbol.recursiveChoices();
        if (recursive.isEmpty()) return;

        // every productive round shrinks the sequence unless a choice is a lone self reference
        int maxRounds = sequence.size();
        int rounds = 0;
        while (replace(symbol, recursive, sequence) > 0) {
            rounds++;
            if (passLimit > 0 && rounds > maxRounds) {
                throw new SymbolizationLimitException(
                        "<" + symbol.name() + "> kept matching itself for " + rounds + " rounds", passLimit);
            }
        }
    }

    /**
     * Returns whether any choice of {@code symbol} matches a window of {@code sequence}.
     */
    public static boolean matchesAnywhere(GrammarSymbol symbol, List<Token> sequence) {
        return !matchRanges(symbol.expression(), sequence).isEmpty();
    }

    /**
     * Returns the ranges of all windows matching any of {@code choices}, choice by choice
     * and left to right within a choice. Ranges may overlap or repeat.
     */
    public static List<Range> matchRanges(List<Choice> choices, List<Token> sequence) {
        List<Range> ranges = new ArrayList<>();
        for (Choice choice : choices) {
            ranges.addAll(choice.matchRanges(sequence));
        }
        return ranges;
    }

    /**
     * Splits {@code text} into one terminal token per code point.
     */
    public static List<Token> characterize(String text) {
        return text.codePoints()
                .mapToObj(codePoint -> (Token) new TerminalToken(new String(Character.toChars(codePoint))))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    // ====== HELPERS ====== //
    private static int replace(GrammarSymbol symbol, List<Choice> choices, List<Token> sequence) {
        if (choices.isEmpty()) return 0;

        List<Range> ranges = RangeReplacer.selectDisjoint(matchRanges(choices, sequence));
        if (ranges.isEmpty()) return 0;

        log.trace("collapsing {} into <{}>", ranges, symbol.name());
        RangeReplacer.replaceRanges(sequence, ranges, children -> new NonTerminalToken(symbol.name(), children));
        return ranges.size();
    }
}
