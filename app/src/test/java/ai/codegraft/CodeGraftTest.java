package ai.codegraft;

import static ai.codegraft.testutil.AssertionHelperUtil.assertCodeContains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.codegraft.api.MergeRequest;
import ai.codegraft.api.PreexistingSymbol;
import ai.codegraft.api.TargetFunction;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class CodeGraftTest {

    private static final Path ROOT = Path.of("/project");
    private static final Path FILE = ROOT.resolve("pkg/stats.py");

    private static final String DESTINATION =
            """
            import os

            TIMEOUT = 10


            def helper():
                return 1


            def compute(x):
                return sum(x) + helper()
            """;

    private final CodeGraft graft = new CodeGraft(GraftSettings.defaults());

    @Test
    public void testMergeRunsAllStages() {
        var optimized = """
                import math

                TIMEOUT = 30


                def compute(x):
                    return math.fsum(x) + helper()
                """;
        var merged = graft.mergeOptimizedCode(
                MergeRequest.inPlace(optimized, DESTINATION, FILE, ROOT, List.of(TargetFunction.topLevel("compute"))));

        assertEquals(
                """
                import os
                import math

                TIMEOUT = 30


                def helper():
                    return 1


                def compute(x):
                    return math.fsum(x) + helper()
                """,
                merged);
    }

    @Test
    public void testOptimizeRoundTrip() {
        var merged = graft.optimize(
                DESTINATION,
                FILE,
                ROOT,
                List.of(TargetFunction.topLevel("compute")),
                snippet -> Optional.of("import math\n\n\n" + snippet.replace("sum(x)", "math.fsum(x)")));

        assertCodeContains(merged, "import os\nimport math\n");
        assertCodeContains(merged, "    return math.fsum(x) + helper()");
        assertCodeContains(merged, "TIMEOUT = 10");
    }

    @Test
    public void testOptimizerWithoutReplyLeavesDestination() {
        var merged = graft.optimize(
                DESTINATION, FILE, ROOT, List.of(TargetFunction.topLevel("compute")), snippet -> Optional.empty());
        assertSame(DESTINATION, merged);
    }

    @Test
    public void testUnsupportedTargetLeavesDestination() {
        var merged = graft.optimize(
                DESTINATION,
                FILE,
                ROOT,
                List.of(TargetFunction.ofPath("Foo", "bar", "baz")),
                snippet -> {
                    throw new AssertionError("optimizer must not be called");
                });
        assertSame(DESTINATION, merged);
    }

    @Test
    public void testBrokenDestinationComesBackUnchanged() {
        var destination = "def compute(x:\n    return x\n";
        var merged = graft.mergeOptimizedCode(MergeRequest.inPlace(
                "import math\nX = 1\ndef compute(x):\n    return x\n",
                destination,
                FILE,
                ROOT,
                List.of(TargetFunction.topLevel("compute"))));
        assertSame(destination, merged);
    }

    @Test
    public void testCrlfDestinationStaysCrlf() {
        var destination = DESTINATION.replace("\n", "\r\n");
        var optimized = "import math\n\nLIMIT = 5\n\ndef compute(x):\n    return math.fsum(x) + helper()\n";
        var merged = graft.mergeOptimizedCode(
                MergeRequest.inPlace(optimized, destination, FILE, ROOT, List.of(TargetFunction.topLevel("compute"))));

        assertTrue(merged.contains("math.fsum"));
        assertTrue(merged.contains("LIMIT = 5\r\n"));
        assertFalse(merged.replace("\r\n", "").contains("\n"), "Every inserted line should end with CRLF");
    }

    @Test
    public void testPreexistingSymbols() {
        assertEquals(
                Set.of(PreexistingSymbol.topLevel("helper"), PreexistingSymbol.topLevel("compute")),
                graft.preexistingSymbols(DESTINATION));
    }

    @Test
    public void testGlobalsCanBeDisabled() {
        var settings = new GraftSettings(true, false, true, true, true);
        assertSame(DESTINATION, new CodeGraft(settings).mergeGlobals("TIMEOUT = 30\n", DESTINATION));
    }
}
