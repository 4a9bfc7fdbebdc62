package ai.codegraft.api;

/** An inclusive, 1-based range of source lines. {@code end < start} denotes an empty range. */
public record LineRange(int start, int end) implements Comparable<LineRange> {

    public LineRange {
        if (start < 1) {
            throw new IllegalArgumentException("Line numbers are 1-based, got start=" + start);
        }
    }

    public boolean isEmpty() {
        return end < start;
    }

    public boolean overlaps(LineRange other) {
        return !isEmpty() && !other.isEmpty() && start <= other.end && other.start <= end;
    }

    @Override
    public int compareTo(LineRange o) {
        int c = Integer.compare(start, o.start);
        return c != 0 ? c : Integer.compare(end, o.end);
    }
}
