package ai.codegraft.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.codegraft.FailureKind;
import ai.codegraft.ParseFailureException;
import ai.codegraft.api.LineRange;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ProgramUnitTest {

    private static final String SOURCE =
            """
            import os

            @cache
            def compute(x):
                return x * 2

            class Foo:
                pass
            """;

    @Test
    public void testUntouchedUnitPrintsItsSource() throws ParseFailureException {
        var unit = ProgramUnit.parse(SOURCE);
        assertEquals(SOURCE, unit.text());
        assertEquals(3, unit.topLevelStatements().size());
    }

    @Test
    public void testSyntaxErrorReportsLine() {
        var e = assertThrows(ParseFailureException.class, () -> ProgramUnit.parse("x = 1\ndef broken(:\n    pass\n"));
        assertEquals(FailureKind.PARSE_FAILURE, e.kind());
        assertTrue(e.line() >= 1, "Error line should be reported, was " + e.line());
    }

    @Test
    public void testTryParseSwallowsFailure() {
        assertTrue(ProgramUnit.tryParse("def (", "test").isEmpty());
        assertTrue(ProgramUnit.tryParse("x = 1\n", "test").isPresent());
    }

    @Test
    public void testDecoratedDefinitionLinesIncludeDecorator() throws ParseFailureException {
        var unit = ProgramUnit.parse(SOURCE);
        var decorated = unit.topLevelStatements().get(1);
        assertEquals(new LineRange(3, 5), unit.lineRange(decorated));
        assertEquals("@cache\ndef compute(x):\n    return x * 2\n", unit.linesOf(decorated));
    }

    @Test
    public void testEditReparses() throws ParseFailureException {
        var unit = ProgramUnit.parse(SOURCE);
        var firstImport = unit.topLevelStatements().get(0);
        var edited = unit.edit(List.of(SourceEdit.insert(unit.lineEndByte(firstImport), "import sys\n")));
        assertTrue(edited.text().startsWith("import os\nimport sys\n\n@cache"));
        assertEquals(4, edited.topLevelStatements().size());
        assertEquals(SOURCE, unit.text(), "The original unit must not change");
    }

    @Test
    public void testEmptyEditListReturnsSameUnit() throws ParseFailureException {
        var unit = ProgramUnit.parse(SOURCE);
        assertSame(unit, unit.edit(List.of()));
    }

    @Test
    public void testEditThatBreaksSyntaxFails() throws ParseFailureException {
        var unit = ProgramUnit.parse("x = 1\n");
        assertThrows(ParseFailureException.class, () -> unit.edit(List.of(SourceEdit.insert(0, "def ("))));
    }

    @Test
    public void testBodyStartSkipsDocstringAndLeadingComments() throws ParseFailureException {
        var unit = ProgramUnit.parse("# header\n\"\"\"Doc.\"\"\"\nx = 1\n");
        assertEquals("# header\n\"\"\"Doc.\"\"\"\n".length(), unit.bodyStartByte());

        var withoutDocstring = ProgramUnit.parse("# header\nx = 1\n");
        assertEquals("# header\n".length(), withoutDocstring.bodyStartByte());
    }

    @Test
    public void testIndentationOfMethod() throws ParseFailureException {
        var unit = ProgramUnit.parse("class A:\n    def f(self):\n        pass\n");
        var method = PythonSyntax.statements(PythonSyntax.body(unit.topLevelStatements().get(0)).orElseThrow())
                .get(0);
        assertEquals("    ", unit.indentationOf(method));
        assertEquals(2, unit.startLine(method));
        assertEquals(3, unit.endLine(method));
    }

    @Test
    public void testCrlfNewlineDetected() throws ParseFailureException {
        assertEquals("\r\n", ProgramUnit.parse("x = 1\r\ny = 2\r\n").newline());
        assertEquals("\n", ProgramUnit.parse("x = 1\n").newline());
    }
}
