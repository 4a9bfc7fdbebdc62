package ai.codegraft.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Line ranges of a class that are kept verbatim when only some of its methods are extracted: the class header,
 * its docstring and its dunder methods. Ranges are kept sorted by start line and never overlap.
 */
public final class ClassSkeleton {
    private final TreeSet<LineRange> ranges = new TreeSet<>();

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Adds a range. Returns false when the range is empty, already present, or overlaps a range that is already
     * part of the skeleton.
     */
    public boolean add(LineRange range) {
        if (range.isEmpty() || ranges.contains(range)) {
            return false;
        }
        for (var existing : ranges) {
            if (existing.overlaps(range)) {
                return false;
            }
        }
        return ranges.add(range);
    }

    public boolean remove(LineRange range) {
        return ranges.remove(range);
    }

    public List<LineRange> ranges() {
        return Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    @Override
    public String toString() {
        return "ClassSkeleton" + ranges;
    }
}
