package converge.diag;

/**
 * Half-open character range {@code [start, end)} in the source text, plus the
 * 1-based line and column of {@code start}.
 */
public record Span(int start, int end, int line, int column) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /** Smallest span covering both {@code this} and {@code other}. */
    public Span to(Span other) {
        if (other.start < start) return other.to(this);
        return new Span(start, Math.max(end, other.end), line, column);
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
