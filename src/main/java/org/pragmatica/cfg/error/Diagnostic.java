package org.pragmatica.cfg.error;

import org.pragmatica.cfg.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a problem located in grammar notation text.
 *
 * <p>Example output:
 * <pre>
 * error: expected '->' after nonterminal
 *   --> grammar:2:3
 *    |
 *  2 | T int | ( E )
 *    |   ^^^ found 'int'
 *    |
 * </pre>
 *
 * @param message  primary message
 * @param span     where the problem was found
 * @param label    text printed next to the underline, may be empty
 * @param notes    trailing notes
 */
public record Diagnostic(
 String message,
 SourceSpan span,
 String label,
 List<String> notes) {

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, "", List.of());
    }

    public static Diagnostic from(GrammarError.MalformedNotation malformed) {
        return error(malformed.reason(), malformed.span());
    }

    public Diagnostic withLabel(String label) {
        return new Diagnostic(message, span, label, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, label, newNotes);
    }

    /**
     * Format against the source text the span refers to.
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var loc = span.start();

        sb.append("error: ")
          .append(message)
          .append('\n');
        sb.append("  --> ")
          .append(filename)
          .append(':')
          .append(loc.line())
          .append(':')
          .append(loc.column())
          .append('\n');

        int gutterWidth = String.valueOf(loc.line())
                                .length();
        var gutter = " ".repeat(gutterWidth + 1);
        sb.append(gutter)
          .append("|\n");
        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var content = lines[loc.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(content)
              .append('\n');
            int width = span.end()
                            .line() == loc.line()
                        ? Math.max(1, span.length())
                        : Math.max(1, content.length() - loc.column() + 1);
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(loc.column() - 1))
              .append("^".repeat(width));
            if (!label.isEmpty()) {
                sb.append(' ')
                  .append(label);
            }
            sb.append('\n');
        }
        sb.append(gutter)
          .append("|\n");
        for (var note : notes) {
            sb.append(gutter)
              .append("= ")
              .append(note)
              .append('\n');
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code grammar:2:3: error: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return filename + ":" + loc.line() + ":" + loc.column() + ": error: " + message;
    }
}
