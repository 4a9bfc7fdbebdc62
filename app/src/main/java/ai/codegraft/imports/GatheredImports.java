package ai.codegraft.imports;

import ai.codegraft.api.ImportRequirement;
import java.util.List;

/**
 * The imports a file declares, split the way they are reconciled: plain module imports, from-imports of named
 * objects, aliased module imports and aliased from-imports. Each list is duplicate-free and in source order.
 */
public record GatheredImports(
        List<ImportRequirement> moduleImports,
        List<ImportRequirement> objectImports,
        List<ImportRequirement> moduleAliases,
        List<ImportRequirement> objectAliases) {

    public GatheredImports {
        moduleImports = List.copyOf(moduleImports);
        objectImports = List.copyOf(objectImports);
        moduleAliases = List.copyOf(moduleAliases);
        objectAliases = List.copyOf(objectAliases);
    }

    public boolean isEmpty() {
        return moduleImports.isEmpty() && objectImports.isEmpty() && moduleAliases.isEmpty() && objectAliases.isEmpty();
    }
}
