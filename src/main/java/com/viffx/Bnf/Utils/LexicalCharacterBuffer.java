package com.viffx.Bnf.Utils;

import java.util.Objects;

/**
 * Provides a cursor over a piece of text for hand-written lexers, with controlled
 * advancement and a two-character view of the current position for error messages.
 *
 * <p>EOF is reported by {@link #eof()}; past the end {@link #crntChar()}
 * returns {@link #EOF_CHAR}.
 */
public class LexicalCharacterBuffer {
    public static final char EOF_CHAR = (char) -1;

    // ====== INSTANCE FIELDS ====== //

    /**
     * Text being lexed.
     * */
    private final CharSequence source;

    /**
     * Index of the current character in {@link #source}.
     * */
    private int position = 0;

    // ====== CONSTRUCTORS ====== //
    public LexicalCharacterBuffer(CharSequence source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    // ====== PUBLIC API METHODS ====== //
    public final boolean eof() {
        return position >= source.length();
    }

    public final char crntChar() {
        return charAt(position);
    }

    /**
     * Advances by one character.
     *
     * @return the newly current character after advancing
     * @throws IllegalStateException if the end of the input has already been reached
     */
    public final char nextChar() {
        if (eof()) throw new IllegalStateException("Reached the end of the input.");

        position++;

        return crntChar();
    }

    /**
     * Returns the index of the current character.
     */
    public final int position() {
        return position;
    }

    /**
     * Returns the source text between two positions.
     */
    public final String slice(int from, int to) {
        return source.subSequence(from, to).toString();
    }

    // ====== DEBUG INFO ====== //
    /**
     * Returns a human-readable representation of the current and next character,
     * useful in error messages.
     *
     * @return a string showing the current and next characters
     */
    public String buffer() {
        String[] chars = new String[2];
        for (int i = 0; i < 2; i++) {
            char c = charAt(position + i);
            chars[i] = switch (c) {
                case '\b' -> "\\b";
                case '\t' -> "\\t";
                case '\n' -> "\\n";
                case '\f' -> "\\f";
                case '\r' -> "\\r";
                case EOF_CHAR -> "EOF";
                default -> String.valueOf(c);
            };
        }
        return String.format("['%s','%s']",chars[0],chars[1]);
    }

    private char charAt(int index) {
        return index < source.length() ? source.charAt(index) : EOF_CHAR;
    }
}
