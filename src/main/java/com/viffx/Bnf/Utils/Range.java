package com.viffx.Bnf.Utils;

/**
 * A half-open index range {@code [start, end)} into a list.
 *
 * @param start first index covered (inclusive)
 * @param end index after the last one covered (exclusive)
 */
public record Range(int start, int end) {
    public Range {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean overlaps(Range other) {
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
