package com.viffx.Bnf.Tokens;

import java.util.ArrayList;
import java.util.List;

/**
 * A path of child offsets addressing a descendant relative to a {@link NonTerminalToken}.
 * <p>
 * {@code [2, 0]} means "the first child of the third child". An empty path addresses
 * nothing: resolving it always yields an empty result.
 *
 * @param offsets the child offsets, outermost first
 */
public record TokenIndex(List<Integer> offsets) {
    public static final TokenIndex EMPTY = new TokenIndex(List.of());

    public TokenIndex {
        offsets = List.copyOf(offsets);
    }

    public static TokenIndex of(int... offsets) {
        List<Integer> list = new ArrayList<>(offsets.length);
        for (int offset : offsets) {
            list.add(offset);
        }
        return new TokenIndex(list);
    }

    public boolean isEmpty() {
        return offsets.isEmpty();
    }

    public int depth() {
        return offsets.size();
    }

    /**
     * Returns the first offset of the path.
     *
     * @throws IndexOutOfBoundsException if the path is empty
     */
    public int head() {
        return offsets.get(0);
    }

    /**
     * Returns the path without its first offset, relative to the child {@link #head()} points at.
     */
    public TokenIndex tail() {
        if (offsets.size() <= 1) return EMPTY;
        return new TokenIndex(offsets.subList(1, offsets.size()));
    }

    /**
     * Returns a path one level deeper, addressing child {@code offset} of this path's target.
     */
    public TokenIndex child(int offset) {
        List<Integer> list = new ArrayList<>(offsets);
        list.add(offset);
        return new TokenIndex(list);
    }

    @Override
    public String toString() {
        return offsets.toString();
    }
}
