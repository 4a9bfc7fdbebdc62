package ai.codegraft.parse;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replacement of the UTF-8 byte range [startByte, endByte) of a source text. Pure insertions have
 * {@code startByte == endByte}; deletions have an empty replacement.
 */
public record SourceEdit(int startByte, int endByte, String replacement) {

    public SourceEdit {
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("Invalid edit range [" + startByte + ", " + endByte + ")");
        }
    }

    public static SourceEdit insert(int at, String text) {
        return new SourceEdit(at, at, text);
    }

    public static SourceEdit delete(int startByte, int endByte) {
        return new SourceEdit(startByte, endByte, "");
    }

    /**
     * Applies all edits at once. Insertions at the same offset keep their list order. Bytes outside every edit are
     * copied verbatim.
     *
     * @throws IllegalArgumentException when two edits overlap or an edit lies outside the text
     */
    public static String applyAll(SourceContent content, List<SourceEdit> edits) {
        var sorted = new ArrayList<>(edits);
        // List.sort is stable, so same-offset insertions keep their relative order
        sorted.sort(Comparator.comparingInt(SourceEdit::startByte).thenComparingInt(SourceEdit::endByte));

        byte[] bytes = content.utf8Bytes();
        var out = new ByteArrayOutputStream(bytes.length + 64);
        int cursor = 0;
        for (var edit : sorted) {
            if (edit.startByte < cursor) {
                throw new IllegalArgumentException("Overlapping edit at byte " + edit.startByte);
            }
            if (edit.endByte > bytes.length) {
                throw new IllegalArgumentException(
                        "Edit ends at byte " + edit.endByte + " past text length " + bytes.length);
            }
            out.write(bytes, cursor, edit.startByte - cursor);
            byte[] replacement = edit.replacement.getBytes(StandardCharsets.UTF_8);
            out.write(replacement, 0, replacement.length);
            cursor = edit.endByte;
        }
        out.write(bytes, cursor, bytes.length - cursor);
        return out.toString(StandardCharsets.UTF_8);
    }
}
