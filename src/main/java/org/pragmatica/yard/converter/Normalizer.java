package org.pragmatica.yard.converter;

/**
 * Strips whitespace from raw expression text.
 */
public final class Normalizer {
    private Normalizer() {}

    /**
     * Single pass over the input; raw offset, line and column of every kept character are
     * recorded on the way.
     */
    public static NormalizedExpression normalize(String input) {
        var text = new StringBuilder(input.length());
        var offsets = new int[input.length()];
        var lines = new int[input.length()];
        var columns = new int[input.length()];
        int kept = 0;
        int line = 1;
        int column = 1;
        for (int i = 0; i < input.length(); i++ ) {
            char c = input.charAt(i);
            if (!Character.isWhitespace(c)) {
                text.append(c);
                offsets[kept] = i;
                lines[kept] = line;
                columns[kept] = column;
                kept++ ;
            }
            if (c == '\n') {
                line++ ;
                column = 1;
            }else {
                column++ ;
            }
        }
        return new NormalizedExpression(input, text.toString(), offsets, lines, columns);
    }
}
