package org.pragmatica.rsx.error;

import org.pragmatica.rsx.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error[RSX002]: wrong close tag found
 *   --> page.rsx:1:13
 *    |
 *  1 | &lt;div&gt;&lt;open&gt;&lt;/close&gt;&lt;/div&gt;
 *    |      ----   ^^^^^ close tag `close` does not match
 *    |      |
 *    = help: expected `&lt;/open&gt;`
 * </pre>
 *
 * @param severity Error severity level
 * @param kind     Diagnostic category
 * @param message  Primary error message
 * @param span     Source span where error occurred
 * @param labels   Additional labeled spans for context
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    DiagnosticKind kind,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    /**
     * Error severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(DiagnosticKind kind, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, kind, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(DiagnosticKind kind, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, kind, message, span, List.of(), List.of());
    }

    /**
     * Add a primary label.
     */
    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(severity, kind, this.message, span, List.copyOf(newLabels), notes);
    }

    /**
     * Add a secondary label at a different span.
     */
    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(severity, kind, this.message, span, List.copyOf(newLabels), notes);
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, kind, message, span, labels, List.copyOf(newNotes));
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Secondary spans with their labels, in insertion order.
     */
    public List<Label> secondaryLabels() {
        return labels.stream()
                     .filter(label -> !label.primary())
                     .toList();
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();

        // Header: error[RSX001]: message
        sb.append(severity.display())
          .append("[")
          .append(kind.code())
          .append("]: ")
          .append(message)
          .append("\n");

        // Location: --> filename:line:column
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename);
        }
        if (!span.isKnown()) {
            sb.append("\n");
            appendNotes(sb, 1);
            return sb.toString();
        }
        if (filename != null) {
            sb.append(":");
        }
        var loc = span.start();
        sb.append(loc.line())
          .append(":")
          .append(loc.column())
          .append("\n");

        var lines = source.split("\n", -1);
        int minLine = span.start()
                          .line();
        int maxLine = span.end()
                          .line();
        for (var label : labels) {
            if (label.span()
                     .isKnown()) {
                minLine = Math.min(minLine,
                                   label.span()
                                        .start()
                                        .line());
                maxLine = Math.max(maxLine,
                                   label.span()
                                        .end()
                                        .line());
            }
        }

        int gutterWidth = String.valueOf(maxLine)
                                .length();

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = lines[lineNum - 1];
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);

            sb.append(lineNumStr)
              .append(" | ")
              .append(lineContent)
              .append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" | ");
                sb.append(formatUnderlines(lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        appendNotes(sb, gutterWidth + 1);

        return sb.toString();
    }

    private void appendNotes(StringBuilder sb, int indent) {
        for (var note : notes) {
            sb.append(" ".repeat(indent))
              .append("= ")
              .append(note)
              .append("\n");
        }
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();

        if (span.start()
                .line() <= lineNum && span.end()
                                          .line() >= lineNum && labels.stream()
                                                                      .noneMatch(Label::primary)) {
            result.add(Label.primary(span, ""));
        }

        for (var label : labels) {
            var labelSpan = label.span();
            if (labelSpan.isKnown() && labelSpan.start()
                                                .line() <= lineNum && labelSpan.end()
                                                                               .line() >= lineNum) {
                result.add(label);
            }
        }

        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
                               .sorted((a, b) -> Integer.compare(a.span()
                                                                  .start()
                                                                  .column(),
                                                                 b.span()
                                                                  .start()
                                                                  .column()))
                               .toList();

        for (var label : sorted) {
            int startCol = label.span()
                                .start()
                                .line() == lineNum
                           ? label.span()
                                  .start()
                                  .column()
                           : 1;
            int endCol = label.span()
                              .end()
                              .line() == lineNum
                         ? label.span()
                                .end()
                                .column()
                         : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            char underlineChar = label.primary() ? '^' : '-';
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(underlineChar)
                            .repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message()
                      .isEmpty()) {
                sb.append(" ")
                  .append(label.message());
                currentCol += label.message()
                                   .length() + 1;
            }
        }

        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return String.format("%s:%s: %s[%s]: %s",
                             "input", span.start(), severity.display(), kind.code(), message);
    }
}
