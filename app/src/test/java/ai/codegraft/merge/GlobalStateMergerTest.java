package ai.codegraft.merge;

import static ai.codegraft.testutil.AssertionHelperUtil.countLines;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

public class GlobalStateMergerTest {

    private final GlobalStateMerger merger = new GlobalStateMerger();

    @Test
    public void testNewBindingAppendedAfterOneBlankLine() {
        var destination = """
                def fetch():
                    return TIMEOUT
                """;
        var merged = merger.merge("TIMEOUT = 30\n", destination);
        assertEquals("""
                def fetch():
                    return TIMEOUT

                TIMEOUT = 30
                """, merged);
    }

    @Test
    public void testExistingBindingReplacedInPlace() {
        var destination = """
                import os

                TIMEOUT = 10

                def fetch():
                    return TIMEOUT
                """;
        var merged = merger.merge("TIMEOUT = 30\n", destination);
        assertEquals("""
                import os

                TIMEOUT = 30

                def fetch():
                    return TIMEOUT
                """, merged);
    }

    @Test
    public void testIdenticalBindingsLeaveDestinationByteIdentical() {
        var destination = "import os\n\nA = 1\nB: int = 2\n\ndef f():\n    return A + B\n";
        assertSame(destination, merger.merge("A = 1\nB: int = 2\n", destination));
    }

    @Test
    public void testUntargetedStatementsKeepOrderAndNoDuplicates() {
        var destination = "A = 1\nB = 2\nC = 3\n";
        var merged = merger.merge("C = 30\nD = 4\nA = 10\n", destination);
        assertEquals("A = 10\nB = 2\nC = 30\n\nD = 4\n", merged);
        assertEquals(1, countLines(merged, "A = 10"));
    }

    @Test
    public void testLastAssignmentInNewCodeWins() {
        assertEquals("X = 2\n", merger.merge("X = 1\nX = 2\n", "X = 0\n"));
    }

    @Test
    public void testChainedAssignmentAppendedOnce() {
        var merged = merger.merge("a = b = 5\n", "x = 1\n");
        assertEquals("x = 1\n\na = b = 5\n", merged);
    }

    @Test
    public void testReplacementKeepsDestinationAnnotation() {
        assertEquals("TIMEOUT: int = 30\n", merger.merge("TIMEOUT = 30\n", "TIMEOUT: int = 10\n"));
    }

    @Test
    public void testBareAnnotationDoesNotClearDestinationValue() {
        var destination = """
                TIMEOUT = 10

                def f():
                    return TIMEOUT
                """;
        assertEquals(destination, merger.merge("TIMEOUT: int\n", destination));
    }

    @Test
    public void testChainedDestinationAssignmentKeepsEveryName() {
        var merged = merger.merge("b = 5\n", "a = b = 0\nprint(a)\n");
        assertEquals("a = b = 0\nprint(a)\n\nb = 5\n", merged);
    }

    @Test
    public void testImportGuardTakenWholeWithBranchesIntact() {
        var newCode = """
                try:
                    import numpy
                    HAS_NUMPY = True
                except ImportError:
                    HAS_NUMPY = False
                """;
        var merged = merger.merge(newCode, "import os\n");
        assertEquals("""
                import os
                try:
                    import numpy
                    HAS_NUMPY = True
                except ImportError:
                    HAS_NUMPY = False
                """, merged);
    }

    @Test
    public void testAssignmentsInsideCompoundStatementsAreNotRewritten() {
        var merged = merger.merge("X = 2\n", "with lock:\n    X = 1\n");
        assertEquals("with lock:\n    X = 1\n\nX = 2\n", merged);
    }

    @Test
    public void testTrailingCommentSurvivesReplacement() {
        assertEquals("TIMEOUT = 30  # seconds\n", merger.merge("TIMEOUT = 30\n", "TIMEOUT = 10  # seconds\n"));
    }

    @Test
    public void testFreeStatementsGoAfterLastImport() {
        var destination = """
                import os
                import sys

                def f():
                    pass
                """;
        var newCode = """
                import logging
                logging.basicConfig()
                X = 1
                """;
        var merged = merger.merge(newCode, destination);
        assertEquals("""
                import os
                import sys
                logging.basicConfig()

                def f():
                    pass

                X = 1
                """, merged);
    }

    @Test
    public void testRemergeIsIdempotent() {
        var destination = "import os\n\ndef f():\n    pass\n";
        var newCode = "import logging\nlogging.basicConfig()\nX = 1\n";
        var once = merger.merge(newCode, destination);
        assertEquals(once, merger.merge(newCode, once));
    }

    // With no imports to anchor on, free statements go below a leading module docstring instead of at the very top
    // of the file, so the docstring stays the module's first statement.
    @Test
    public void testFreeStatementsWithoutImportsGoAfterDocstringNotAtTop() {
        var destination = "\"\"\"Module docs.\"\"\"\nx = 1\n";
        var merged = merger.merge("setup()\n", destination);
        assertEquals("\"\"\"Module docs.\"\"\"\nsetup()\nx = 1\n", merged);
    }

    @Test
    public void testLoopTakenWhole() {
        var newCode = "for name in NAMES:\n    register(name)\n";
        var merged = merger.merge(newCode, "import registry\n");
        assertEquals("import registry\nfor name in NAMES:\n    register(name)\n", merged);
    }

    // Assignments under an if are not treated as global state, even at module level. A platform-specific
    // constant defined this way is therefore not merged.
    @Test
    public void testConditionalAssignmentsAreNotMerged() {
        var newCode = """
                if sys.platform == "win32":
                    LEVEL = 1
                else:
                    LEVEL = 2
                """;
        var destination = "LEVEL = 0\n";
        assertEquals(destination, merger.merge(newCode, destination));
    }

    @Test
    public void testNestedAssignmentsAreNotTouched() {
        var destination = "def f():\n    X = 1\n    return X\n";
        var merged = merger.merge("X = 2\n", destination);
        assertEquals("def f():\n    X = 1\n    return X\n\nX = 2\n", merged);
    }

    @Test
    public void testDestinationWithoutTrailingNewline() {
        assertEquals("x = 1\n\nY = 2\n", merger.merge("Y = 2\n", "x = 1"));
    }

    @Test
    public void testCrlfDestinationKeepsCrlf() {
        var merged = merger.merge("Y = 2\n", "import os\r\n\r\nx = 1\r\n");
        assertEquals("import os\r\n\r\nx = 1\r\n\r\nY = 2\r\n", merged);
    }

    @Test
    public void testUnparseableInputsReturnDestination() {
        var destination = "x = 1\n";
        assertSame(destination, merger.merge("def broken(:\n", destination));

        var brokenDestination = "def broken(:\n    pass\n";
        assertSame(brokenDestination, merger.merge("X = 1\n", brokenDestination));
    }
}
