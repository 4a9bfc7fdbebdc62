package ai.codegraft.api;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * One import entry, either {@code import module [as alias]} or {@code from module import object [as alias]}.
 * Two requirements are equivalent iff module, object and alias all match.
 */
public record ImportRequirement(String module, @Nullable String object, @Nullable String alias) {
    public static final String FUTURE_MODULE = "__future__";
    public static final String STAR = "*";

    public ImportRequirement {
        if (module.isBlank()) {
            throw new IllegalArgumentException("Import module must not be blank");
        }
    }

    public static ImportRequirement module(String module) {
        return new ImportRequirement(module, null, null);
    }

    public static ImportRequirement aliasedModule(String module, String alias) {
        return new ImportRequirement(module, null, alias);
    }

    public static ImportRequirement object(String module, String object) {
        return new ImportRequirement(module, object, null);
    }

    public static ImportRequirement aliasedObject(String module, String object, String alias) {
        return new ImportRequirement(module, object, alias);
    }

    public boolean isFromImport() {
        return object != null;
    }

    public boolean isStar() {
        return STAR.equals(object);
    }

    public boolean isFuture() {
        return FUTURE_MODULE.equals(module);
    }

    public Optional<String> objectName() {
        return Optional.ofNullable(object);
    }

    public Optional<String> aliasName() {
        return Optional.ofNullable(alias);
    }

    /** {@code module.object} for from-imports, the module itself otherwise. */
    public String fullyQualifiedName() {
        return object == null ? module : module + "." + object;
    }

    /**
     * The name this import introduces into the importing module. For {@code import a.b} that is {@code a}.
     */
    public String boundName() {
        if (alias != null) {
            return alias;
        }
        if (object != null) {
            return object;
        }
        int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

    /** Renders the requirement as a single Python import statement, without a line terminator. */
    public String render() {
        var aliasSuffix = alias == null ? "" : " as " + alias;
        if (object == null) {
            return "import " + module + aliasSuffix;
        }
        return "from " + module + " import " + object + aliasSuffix;
    }

    @Override
    public String toString() {
        return render();
    }
}
