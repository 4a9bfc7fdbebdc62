package ai.codegraft.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SourceEditTest {

    @Test
    public void testEditsApplyAtByteOffsets() {
        // "é" takes two bytes, so char and byte offsets differ after it
        var content = SourceContent.of("s = 'é'\nx = 1\n");
        int xStart = "s = 'é'\n".getBytes(StandardCharsets.UTF_8).length;
        var result = SourceEdit.applyAll(content, List.of(new SourceEdit(xStart, xStart + 1, "y")));
        assertEquals("s = 'é'\ny = 1\n", result);
    }

    @Test
    public void testEditsAreAppliedInOffsetOrder() {
        var content = SourceContent.of("abc");
        var result = SourceEdit.applyAll(
                content, List.of(SourceEdit.insert(3, "!"), SourceEdit.delete(0, 1), SourceEdit.insert(1, "-")));
        assertEquals("-bc!", result);
    }

    @Test
    public void testInsertionsAtSameOffsetKeepListOrder() {
        var content = SourceContent.of("x");
        var result = SourceEdit.applyAll(content, List.of(SourceEdit.insert(0, "a"), SourceEdit.insert(0, "b")));
        assertEquals("abx", result);
    }

    @Test
    public void testOverlappingEditsRejected() {
        var content = SourceContent.of("abcdef");
        assertThrows(
                IllegalArgumentException.class,
                () -> SourceEdit.applyAll(content, List.of(SourceEdit.delete(0, 3), SourceEdit.delete(2, 4))));
    }

    @Test
    public void testEditPastEndRejected() {
        var content = SourceContent.of("abc");
        assertThrows(
                IllegalArgumentException.class, () -> SourceEdit.applyAll(content, List.of(SourceEdit.delete(1, 9))));
    }

    @Test
    public void testInvalidRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SourceEdit(5, 2, ""));
    }
}
