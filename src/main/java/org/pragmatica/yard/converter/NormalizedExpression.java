package org.pragmatica.yard.converter;

import org.pragmatica.yard.tree.SourceLocation;
import org.pragmatica.yard.tree.SourceSpan;

/**
 * Expression text with whitespace removed. Every kept character remembers where it sits in the
 * raw input, so errors can point at the text the caller wrote.
 */
public final class NormalizedExpression {
    private final String source;
    private final String text;
    private final int[] offsets;
    private final int[] lines;
    private final int[] columns;

    NormalizedExpression(String source, String text, int[] offsets, int[] lines, int[] columns) {
        this.source = source;
        this.text = text;
        this.offsets = offsets;
        this.lines = lines;
        this.columns = columns;
    }

    /**
     * Raw input as given by the caller.
     */
    public String source() {
        return source;
    }

    /**
     * Input without whitespace.
     */
    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public char charAt(int index) {
        return text.charAt(index);
    }

    /**
     * Normalized text from {@code index} to the end.
     */
    public String remaining(int index) {
        return text.substring(index);
    }

    /**
     * Offset in the raw input of the character at normalized {@code index}.
     */
    public int sourceOffset(int index) {
        return offsets[index];
    }

    /**
     * Location in the raw input of the character at normalized {@code index}.
     */
    public SourceLocation location(int index) {
        return SourceLocation.at(lines[index], columns[index], offsets[index]);
    }

    /**
     * Raw-input span from the character at {@code first} through the character at {@code last}.
     */
    public SourceSpan span(int first, int last) {
        return SourceSpan.of(location(first), SourceLocation.at(lines[last], columns[last] + 1, offsets[last] + 1));
    }

    @Override
    public String toString() {
        return text;
    }
}
