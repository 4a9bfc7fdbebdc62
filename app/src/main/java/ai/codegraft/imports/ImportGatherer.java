package ai.codegraft.imports;

import ai.codegraft.api.ImportRequirement;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import ai.codegraft.parse.ScopeWalker;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Gathers the imports a file executes unconditionally at module level. Imports local to a function or class, or
 * guarded by an {@code if}, are not gathered: hoisting them would change when (or whether) they run.
 */
public final class ImportGatherer {

    private ImportGatherer() {}

    public static GatheredImports gather(ProgramUnit unit, ModuleIdentity identity) {
        Set<ImportRequirement> modules = new LinkedHashSet<>();
        Set<ImportRequirement> objects = new LinkedHashSet<>();
        Set<ImportRequirement> moduleAliases = new LinkedHashSet<>();
        Set<ImportRequirement> objectAliases = new LinkedHashSet<>();

        ScopeWalker.walk(unit, (statement, depth) -> {
            if (!depth.isModuleLevel() || !PythonSyntax.isImport(statement)) {
                return;
            }
            for (var entry : ImportStatements.entries(unit, statement, identity)) {
                var requirement = entry.requirement();
                if (requirement.isFromImport()) {
                    (requirement.alias() == null ? objects : objectAliases).add(requirement);
                } else {
                    (requirement.alias() == null ? modules : moduleAliases).add(requirement);
                }
            }
        });
        return new GatheredImports(
                new ArrayList<>(modules),
                new ArrayList<>(objects),
                new ArrayList<>(moduleAliases),
                new ArrayList<>(objectAliases));
    }
}
