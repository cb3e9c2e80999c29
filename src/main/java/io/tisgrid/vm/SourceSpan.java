package io.tisgrid.vm;

/** Half-open character range {@code [start, end)} in the source text. */
public final class SourceSpan {
    private final int start;
    private final int end;

    public SourceSpan(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Bad span: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public int start() { return start; }

    public int end() { return end; }

    public int length() { return end - start; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan other = (SourceSpan) o;
        return start == other.start && end == other.end;
    }

    @Override public int hashCode() { return 31 * start + end; }

    @Override public String toString() { return "[" + start + ", " + end + ")"; }
}
