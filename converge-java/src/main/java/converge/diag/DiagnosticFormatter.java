package converge.diag;

/**
 * Renders a diagnostic against its source text:
 * <pre>
 * error[ParseError]: expected ']', found ':'
 *   --> line 2, col 10
 *    |
 *  2 | layer A[1: LIF
 *    |          ^
 * </pre>
 */
public final class DiagnosticFormatter {
    private DiagnosticFormatter() {}

    public static String format(String source, Diagnostic d) {
        Span span = d.span();
        int start = Math.min(span.start(), source.length());

        int lineStart = source.lastIndexOf('\n', start - 1) + 1;
        int lineEnd = source.indexOf('\n', start);
        if (lineEnd < 0) lineEnd = source.length();
        String line = source.substring(lineStart, lineEnd);
        if (line.endsWith("\r")) line = line.substring(0, line.length() - 1);

        // caret run is clipped to the first line of the span
        int col = start - lineStart + 1;
        int carets = Math.max(1, Math.min(span.length(), lineEnd - start));

        String gutter = Integer.toString(span.line());
        String pad = " ".repeat(gutter.length());

        StringBuilder sb = new StringBuilder();
        sb.append("error[").append(d.kind().label()).append("]: ").append(d.message()).append('\n');
        sb.append(pad).append("--> line ").append(span.line()).append(", col ").append(col).append('\n');
        sb.append(pad).append(" |\n");
        sb.append(gutter).append(" | ").append(line).append('\n');
        sb.append(pad).append(" | ").append(" ".repeat(col - 1)).append("^".repeat(carets)).append('\n');
        return sb.toString();
    }
}
