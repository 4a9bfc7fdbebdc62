package ai.codegraft.api;

/** A special method found next to an extracted method, e.g. {@code ("Foo", "__eq__")}. */
public record DunderMethod(String className, String methodName) {

    /** Double-underscore bracketed ASCII names longer than four characters, e.g. {@code __repr__}. */
    public static boolean isDunderName(String name) {
        return name.length() > 4
                && name.startsWith("__")
                && name.endsWith("__")
                && name.chars().allMatch(c -> c < 128);
    }
}
