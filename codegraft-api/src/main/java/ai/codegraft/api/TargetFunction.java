package ai.codegraft.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A function selected for optimization, described by its own name and the chain of scopes that enclose it.
 *
 * <p>Only top-level functions and methods of top-level classes map to a {@link DeclarationPath}; everything else
 * (inner functions, nested classes) is reported as unsupported by {@link #toDeclarationPath()}.
 */
public record TargetFunction(String functionName, List<FunctionParent> parents) {

    public TargetFunction {
        parents = List.copyOf(parents);
    }

    public static TargetFunction topLevel(String functionName) {
        return new TargetFunction(functionName, List.of());
    }

    public static TargetFunction method(String className, String methodName) {
        return new TargetFunction(methodName, List.of(FunctionParent.ofClass(className)));
    }

    /** Builds a target from dotted segments, treating every segment but the last as an enclosing class. */
    public static TargetFunction ofPath(String... segments) {
        if (segments.length == 0) {
            throw new IllegalArgumentException("At least one segment is required");
        }
        var parents = new ArrayList<FunctionParent>();
        for (var name : Arrays.asList(segments).subList(0, segments.length - 1)) {
            parents.add(FunctionParent.ofClass(name));
        }
        return new TargetFunction(segments[segments.length - 1], parents);
    }

    public Optional<FunctionParent> enclosingClass() {
        if (parents.size() == 1 && parents.get(0).kind() == FunctionParent.Kind.CLASS) {
            return Optional.of(parents.get(0));
        }
        return Optional.empty();
    }

    public Optional<DeclarationPath> toDeclarationPath() {
        if (parents.isEmpty()) {
            return Optional.of(DeclarationPath.of(functionName));
        }
        return enclosingClass().map(parent -> DeclarationPath.of(parent.name(), functionName));
    }

    public String qualifiedName() {
        var sb = new StringBuilder();
        for (var parent : parents) {
            sb.append(parent.name()).append('.');
        }
        return sb.append(functionName).toString();
    }
}
