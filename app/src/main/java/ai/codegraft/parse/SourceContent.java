package ai.codegraft.parse;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Provides safe substring extraction by UTF-8 byte offsets and a
 * line index, since tree-sitter reports positions as byte offsets and 0-based rows.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;
    private final int byteLength;
    // byte offset at which each line starts; a trailing newline opens one more (empty) line
    private final int[] lineStarts;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.byteLength = utf8Bytes.length;
        this.lineStarts = computeLineStarts(utf8Bytes);
    }

    /**
     * Creates a SourceContent wrapper for the provided source text.
     */
    public static SourceContent of(String src) {
        return new SourceContent(src, src.getBytes(StandardCharsets.UTF_8));
    }

    private static int[] computeLineStarts(byte[] bytes) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets [startByte, endByte).
     *
     * <p>Out-of-range requests are clamped or answered with the empty string, and logged.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    byteLength,
                    startByte,
                    endByte);
            return "";
        }

        if (startByte >= byteLength) {
            if (startByte > byteLength) {
                log.warn("Start byte offset {} exceeds source byte length {}", startByte, byteLength);
            }
            return "";
        }

        if (endByte > byteLength) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, byteLength);
            endByte = byteLength;
        }

        int len = endByte - startByte;
        if (len == 0) return "";

        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    /**
     * Extracts the source text covered by a node.
     */
    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    /** Byte offset of the start of the given 0-based row; rows past the end map to the byte length. */
    public int rowStartByte(int row) {
        if (row < 0) return 0;
        if (row >= lineStarts.length) return byteLength;
        return lineStarts[row];
    }

    /** Byte offset just past the terminator of the given 0-based row. */
    public int rowEndByte(int row) {
        return rowStartByte(row + 1);
    }

    /**
     * Text of the 1-based inclusive line range, terminators included. Empty ranges yield the empty string.
     */
    public String lines(int startLine, int endLine) {
        if (endLine < startLine) {
            return "";
        }
        return substringFromBytes(rowStartByte(startLine - 1), rowEndByte(endLine - 1));
    }

    /** The newline convention of the text: {@code \r\n} when any line ends that way, otherwise {@code \n}. */
    public String newline() {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    public boolean endsWithNewline() {
        return byteLength > 0 && utf8Bytes[byteLength - 1] == '\n';
    }

    public String text() {
        return text;
    }

    public byte[] utf8Bytes() {
        return utf8Bytes;
    }

    public int byteLength() {
        return byteLength;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (SourceContent) obj;
        return Objects.equals(this.text, that.text) && Arrays.equals(this.utf8Bytes, that.utf8Bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, Arrays.hashCode(utf8Bytes));
    }

    @Override
    public String toString() {
        return "SourceContent[" + "text=" + text + ", " + "byteLength=" + byteLength + ']';
    }
}
