package org.pragmatica.yard.error;

import io.vavr.control.Option;
import org.pragmatica.yard.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style report of a conversion error.
 *
 * <p>Example output:
 * <pre>
 * error[E0001]: unexpected character 'x'
 *  --> 1:3
 *   |
 * 1 | 1+x*2
 *   |   ^ expected a digit, '.', a parenthesis or an operator
 *   |
 * </pre>
 *
 * @param code    error code, e.g. {@code E0001}
 * @param message primary error message
 * @param span    region of the expression the error points at, none for errors not tied to text
 * @param label   text printed after the underline
 * @param notes   additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    Option<SourceSpan> span,
    String label,
    List<String> notes
) {
    public static Diagnostic error(String code, String message, Option<SourceSpan> span) {
        return new Diagnostic(code, message, span, "", List.of());
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(code, message, span, label, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, label, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format against the raw expression the error was reported for.
     */
    public String format(String source) {
        var sb = new StringBuilder();

        // Header: error[E0001]: message
        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        if (span.isDefined()) {
            appendSource(sb, source, span.get());
        }

        for (var note : notes) {
            sb.append("  = ").append(note).append("\n");
        }
        return sb.toString();
    }

    private void appendSource(StringBuilder sb, String source, SourceSpan where) {
        var start = where.start();
        var lines = source.split("\n", -1);
        if (start.line() < 1 || start.line() > lines.length) {
            return;
        }

        var lineContent = lines[start.line() - 1];
        var lineNumber = String.valueOf(start.line());
        var gutter = " ".repeat(lineNumber.length());

        sb.append(gutter).append("--> ").append(start).append("\n");
        sb.append(gutter).append(" |\n");
        sb.append(lineNumber).append(" | ").append(lineContent).append("\n");

        // Underline stops at the end of the first line
        int underlineLength = Math.max(1, Math.min(where.length(), lineContent.length() - start.column() + 1));
        sb.append(gutter).append(" | ")
          .append(" ".repeat(start.column() - 1))
          .append("^".repeat(underlineLength));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        sb.append("\n");
        sb.append(gutter).append(" |\n");
    }

    /**
     * Single-line form: {@code 1:3: error[E0001]: message}.
     */
    public String formatSimple() {
        var where = span.map(s -> s.start() + ": ")
                        .getOrElse("");
        return where + "error[" + code + "]: " + message;
    }
}
