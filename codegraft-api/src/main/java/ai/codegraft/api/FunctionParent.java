package ai.codegraft.api;

/** One enclosing scope of a target function, outermost first. */
public record FunctionParent(String name, Kind kind) {

    public enum Kind {
        CLASS,
        FUNCTION
    }

    public static FunctionParent ofClass(String name) {
        return new FunctionParent(name, Kind.CLASS);
    }

    public static FunctionParent ofFunction(String name) {
        return new FunctionParent(name, Kind.FUNCTION);
    }
}
