package com.viffx.Bnf.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Collapses index ranges of a list into single elements, in place.
 * <p>
 * Ranges are replaced rightmost first, so removing and inserting at a later range never
 * shifts the indices of an earlier range that is still waiting to be replaced.
 */
public final class RangeReplacer {
    private RangeReplacer() {}

    /**
     * Replaces every range of {@code list} with the single element {@code reducer} builds
     * from the elements the range covered.
     * <p>
     * All ranges are checked before the list is touched, so a rejected call leaves it unchanged.
     *
     * @param list the list to modify
     * @param ranges pairwise disjoint, non-empty ranges inside {@code list}, in any order
     * @param reducer turns the removed sub-list (in original order) into its replacement
     * @throws IllegalArgumentException if a range is empty or two ranges overlap
     * @throws IndexOutOfBoundsException if a range ends past the end of {@code list}
     */
    public static <E> void replaceRanges(List<E> list, Collection<Range> ranges, Function<List<E>, E> reducer) {
        Objects.requireNonNull(list, "list cannot be null");
        Objects.requireNonNull(reducer, "reducer cannot be null");

        List<Range> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingInt(Range::start));

        for (int i = 0; i < sorted.size(); i++) {
            Range range = sorted.get(i);
            if (range.isEmpty()) {
                throw new IllegalArgumentException("cannot replace the empty range " + range);
            }
            if (range.end() > list.size()) {
                throwIndexOutOfBoundsException(range.end(), list.size());
            }
            // sorted by start, so checking the neighbour catches every overlap
            if (i > 0 && sorted.get(i - 1).overlaps(range)) {
                throw new IllegalArgumentException("overlapping ranges " + sorted.get(i - 1) + " and " + range);
            }
        }

        for (int i = sorted.size() - 1; i >= 0; i--) {
            replaceRange(list, sorted.get(i), reducer);
        }
    }

    /**
     * Picks a pairwise disjoint subset of {@code candidates}.
     * <p>
     * Candidates are ordered by start (stable, so among equal starts the one listed first
     * comes first), then taken left to right, skipping any that overlap a range already taken.
     *
     * @param candidates possibly overlapping ranges
     * @return disjoint ranges, ordered by start
     */
    public static List<Range> selectDisjoint(Collection<Range> candidates) {
        List<Range> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(Range::start));

        List<Range> selected = new ArrayList<>();
        int end = 0;
        for (Range range : sorted) {
            if (range.isEmpty() || range.start() < end) continue;
            selected.add(range);
            end = range.end();
        }
        return selected;
    }

    private static <E> void replaceRange(List<E> list, Range range, Function<List<E>, E> reducer) {
        List<E> window = list.subList(range.start(), range.end());
        List<E> removed = new ArrayList<>(window);
        window.clear();
        list.add(range.start(), reducer.apply(removed));
    }

    private static void throwIndexOutOfBoundsException(int index, int size) {
        throw new IndexOutOfBoundsException(
                String.format("Index %d out of bounds for length %d",
                        index,
                        size
                )
        );
    }
}
