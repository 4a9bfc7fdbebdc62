package ai.codegraft.parse;

/** Line terminator helpers for text spliced into an existing file. */
public final class Newlines {

    private Newlines() {}

    /** Rewrites every line terminator of {@code text} to {@code newline}. */
    public static String convert(String text, String newline) {
        var normalized = text.replace("\r\n", "\n");
        return "\n".equals(newline) ? normalized : normalized.replace("\n", newline);
    }

    /** Appends {@code newline} unless the text already ends with a line terminator. */
    public static String terminate(String text, String newline) {
        return text.isEmpty() || text.endsWith("\n") ? text : text + newline;
    }

    /** True when the text ends with an empty line, i.e. two consecutive terminators. */
    public static boolean endsWithBlankLine(String text) {
        var normalized = text.replace("\r\n", "\n");
        return normalized.endsWith("\n\n") || normalized.equals("\n");
    }
}
