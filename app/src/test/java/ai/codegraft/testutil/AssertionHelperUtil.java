package ai.codegraft.testutil;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Assertions over Python source text.
 */
public final class AssertionHelperUtil {

    private AssertionHelperUtil() {}

    /**
     * Provides a line-ending agnostic string equality assertion.
     */
    public static void assertCodeEquals(String expected, String actual) {
        assertCodeEquals(expected, actual, null);
    }

    /**
     * Provides a line-ending agnostic string equality assertion.
     */
    public static void assertCodeEquals(String expected, String actual, @Nullable String message) {
        var cleanExpected = normalizeLineEndings(expected);
        var cleanActual = normalizeLineEndings(actual);
        if (message == null) {
            assertEquals(cleanExpected, cleanActual);
        } else {
            assertEquals(cleanExpected, cleanActual, message);
        }
    }

    /**
     * Provides a line-ending agnostic string substring assertion.
     */
    public static void assertCodeContains(String fullContent, String substring) {
        assertCodeContains(fullContent, substring, null);
    }

    public static void assertCodeContains(String fullContent, String substring, @Nullable String message) {
        var cleanFullContent = normalizeLineEndings(fullContent);
        var cleanSubstring = normalizeLineEndings(substring);
        assertTrue(
                cleanFullContent.contains(cleanSubstring),
                Objects.requireNonNullElseGet(message, () -> "Expected code containing " + substring));
    }

    public static void assertCodeDoesNotContain(String fullContent, String substring) {
        assertFalse(
                normalizeLineEndings(fullContent).contains(normalizeLineEndings(substring)),
                "Expected code not containing " + substring);
    }

    /**
     * Number of lines of {@code fullContent} equal to {@code line} once surrounding whitespace is stripped.
     */
    public static int countLines(String fullContent, String line) {
        int count = 0;
        for (var ln : fullContent.replaceAll("\\R", "\n").split("\n", -1)) {
            if (ln.strip().equals(line.strip())) {
                count++;
            }
        }
        return count;
    }

    /**
     * Finds the indent of the first line in fullContent whose text equals targetLine ignoring leading whitespace.
     * Returns -1 if no such line is found.
     */
    public static int findIndentOfLineIgnoringLeadingWhitespace(String fullContent, String targetLine) {
        var lines = fullContent.replaceAll("\\R", "\n").split("\n", -1);
        var target = targetLine.stripLeading();
        for (var ln : lines) {
            if (ln.stripLeading().equals(target)) {
                return ln.length() - ln.stripLeading().length();
            }
        }
        return -1;
    }

    private static String normalizeLineEndings(String content) {
        return content.replaceAll("\\R", "\n").strip();
    }
}
