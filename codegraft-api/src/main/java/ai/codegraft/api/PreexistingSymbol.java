package ai.codegraft.api;

import org.jetbrains.annotations.Nullable;

/** A function, class or method a file already defines; {@code owningClass} is null for top-level symbols. */
public record PreexistingSymbol(String name, @Nullable String owningClass) {

    public static PreexistingSymbol topLevel(String name) {
        return new PreexistingSymbol(name, null);
    }

    public static PreexistingSymbol member(String owningClass, String name) {
        return new PreexistingSymbol(name, owningClass);
    }

    public boolean isTopLevel() {
        return owningClass == null;
    }
}
