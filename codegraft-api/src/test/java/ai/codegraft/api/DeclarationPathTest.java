package ai.codegraft.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class DeclarationPathTest {

    @Test
    public void testMethodPath() {
        var path = DeclarationPath.of("Foo", "bar");
        assertTrue(path.isMethod());
        assertEquals("Foo", path.first());
        assertEquals("bar", path.last());
        assertEquals(Optional.of("Foo"), path.className());
        assertEquals("Foo.bar", path.toString());
    }

    @Test
    public void testTopLevelPath() {
        var path = DeclarationPath.of("compute");
        assertFalse(path.isMethod());
        assertTrue(path.className().isEmpty());
    }

    @Test
    public void testThreeSegmentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DeclarationPath.of("Foo", "bar", "baz"));
    }

    @Test
    public void testBlankSegmentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DeclarationPath.of("Foo", " "));
    }

    @Test
    public void testTargetFunctionConversion() {
        assertEquals(Optional.of(DeclarationPath.of("f")), TargetFunction.topLevel("f").toDeclarationPath());
        assertEquals(
                Optional.of(DeclarationPath.of("Foo", "bar")),
                TargetFunction.method("Foo", "bar").toDeclarationPath());
        assertTrue(TargetFunction.ofPath("Foo", "bar", "baz").toDeclarationPath().isEmpty());

        var inner = new TargetFunction("inner", List.of(FunctionParent.ofFunction("outer")));
        assertTrue(inner.toDeclarationPath().isEmpty(), "Inner functions have no declaration path");
        assertEquals("outer.inner", inner.qualifiedName());
    }
}
