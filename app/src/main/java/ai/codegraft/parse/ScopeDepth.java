package ai.codegraft.parse;

/**
 * How deeply a statement is nested: {@code scope} counts enclosing functions and classes, {@code conditional} counts
 * enclosing {@code if}/{@code elif}/{@code else} blocks. Other compound statements do not change the depth.
 */
public record ScopeDepth(int scope, int conditional) {
    public static final ScopeDepth MODULE = new ScopeDepth(0, 0);

    public ScopeDepth enterScope() {
        return new ScopeDepth(scope + 1, conditional);
    }

    public ScopeDepth enterConditional() {
        return new ScopeDepth(scope, conditional + 1);
    }

    /** Executed unconditionally when the module is imported. */
    public boolean isModuleLevel() {
        return scope == 0 && conditional == 0;
    }
}
