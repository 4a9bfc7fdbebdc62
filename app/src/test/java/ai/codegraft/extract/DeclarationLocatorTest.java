package ai.codegraft.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.codegraft.GraftException;
import ai.codegraft.StructuralMismatchException;
import ai.codegraft.api.DeclarationPath;
import ai.codegraft.api.DunderMethod;
import ai.codegraft.api.LineRange;
import ai.codegraft.parse.ProgramUnit;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class DeclarationLocatorTest {

    private static final String SOURCE =
            """
            def first():
                return 1

            def first():
                return 2

            @dataclass
            class Point:
                x: int = 0

                @staticmethod
                def __hash__():
                    return 0

                def move(self):
                    pass
            """;

    private final DeclarationLocator locator = new DeclarationLocator();

    @Test
    public void testFirstMatchWins() throws GraftException {
        var unit = ProgramUnit.parse(SOURCE);
        var located = locator.locate(unit, DeclarationPath.of("first")).orElseThrow();
        assertEquals(new LineRange(1, 2), located.lines());
        assertTrue(located.enclosingClassName().isEmpty());
    }

    @Test
    public void testMethodSkeletonRanges() throws GraftException {
        var unit = ProgramUnit.parse(SOURCE);
        var located = locator.locate(unit, DeclarationPath.of("Point", "move")).orElseThrow();

        assertEquals(new LineRange(15, 16), located.lines());
        assertEquals("Point", located.enclosingClass());
        // header is the class line; the dunder range starts at its decorator
        assertEquals(List.of(new LineRange(8, 8), new LineRange(11, 13)), located.skeletonRanges());
        assertEquals(Set.of(new DunderMethod("Point", "__hash__")), located.contextualDunders());
    }

    @Test
    public void testClassAttributeIsNotAMethodTarget() throws GraftException {
        var unit = ProgramUnit.parse(SOURCE);
        assertTrue(locator.locate(unit, DeclarationPath.of("Point", "x")).isEmpty());
    }

    @Test
    public void testMethodPathThroughFunctionIsStructuralMismatch() throws GraftException {
        var unit = ProgramUnit.parse(SOURCE);
        assertThrows(StructuralMismatchException.class, () -> locator.locate(unit, DeclarationPath.of("first", "x")));
    }

    @Test
    public void testMissingDeclaration() throws GraftException {
        var unit = ProgramUnit.parse(SOURCE);
        assertTrue(locator.locate(unit, DeclarationPath.of("nothing")).isEmpty());
    }
}
