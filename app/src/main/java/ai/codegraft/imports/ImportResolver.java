package ai.codegraft.imports;

import ai.codegraft.FailureKind;
import ai.codegraft.GraftException;
import ai.codegraft.GraftSettings;
import ai.codegraft.api.ImportRequirement;
import ai.codegraft.extract.PreexistingSymbolScanner;
import ai.codegraft.parse.ProgramUnit;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reconciles the imports of a destination file with those of the code merged into it. Every import the new code
 * declares is added to the destination, then every such import the destination does not read is dropped again. The
 * call is all or nothing: on any failure the destination comes back unchanged.
 */
public final class ImportResolver {
    private static final Logger log = LogManager.getLogger(ImportResolver.class);

    private final GraftSettings settings;
    private final PreexistingSymbolScanner symbolScanner = new PreexistingSymbolScanner();

    public ImportResolver() {
        this(GraftSettings.defaults());
    }

    public ImportResolver(GraftSettings settings) {
        this.settings = settings;
    }

    /**
     * @param newCode the code whose imports are wanted
     * @param destinationCode the file receiving them
     * @param sourcePath file {@code newCode} belongs to, for its relative imports
     * @param destinationPath file {@code destinationCode} belongs to
     * @param projectRoot root of the dotted module namespace
     * @param helperFqns {@code module.name} of helpers the destination already has inlined; never imported
     */
    public String reconcile(
            String newCode,
            String destinationCode,
            Path sourcePath,
            Path destinationPath,
            Path projectRoot,
            Set<String> helperFqns) {
        if (!settings.importsEnabled()) {
            return destinationCode;
        }
        ProgramUnit result;
        try {
            result = reconcile(
                    newCode,
                    destinationCode,
                    ModuleIdentity.of(projectRoot, sourcePath),
                    ModuleIdentity.of(projectRoot, destinationPath),
                    helperFqns);
        } catch (GraftException e) {
            log.warn("{} while reconciling imports of {}: {}", e.kind(), destinationPath, e.getMessage());
            return destinationCode;
        } catch (RuntimeException e) {
            log.warn("{} while reconciling imports of {}", FailureKind.IMPORT_RECONCILIATION_FAILURE, destinationPath, e);
            return destinationCode;
        }

        var merged = result.text();
        if (merged.equals(destinationCode)) {
            return destinationCode;
        }
        return settings.stripLeadingNewlines() ? stripLeadingNewlines(merged) : merged;
    }

    ProgramUnit reconcile(
            String newCode,
            String destinationCode,
            ModuleIdentity sourceIdentity,
            ModuleIdentity destinationIdentity,
            Set<String> helperFqns)
            throws GraftException {
        var newUnit = ProgramUnit.parse(DirectiveNormalizer.normalize(newCode));
        var destination = ProgramUnit.parse(destinationCode);

        var gathered = ImportGatherer.gather(newUnit, sourceIdentity);
        var localNames = PreexistingSymbolScanner.topLevelNames(symbolScanner.scan(destination));
        var requirements = selectRequirements(gathered, destinationIdentity, helperFqns, localNames);
        log.debug("Reconciling {} import(s) into {}", requirements.size(), destinationIdentity.name());

        var current = destination;
        for (var requirement : requirements) {
            current = ImportEditor.ensurePresent(current, requirement, destinationIdentity);
        }
        for (var requirement : requirements) {
            current = ImportEditor.pruneIfUnused(current, requirement, destinationIdentity);
        }
        return current;
    }

    /** The gathered imports worth adding: plain module imports first, then from-imports, then aliased forms. */
    static List<ImportRequirement> selectRequirements(
            GatheredImports gathered, ModuleIdentity destination, Set<String> helperFqns, Set<String> localNames) {
        var selected = new ArrayList<ImportRequirement>(gathered.moduleImports());
        for (var requirement : gathered.objectImports()) {
            if (isWanted(requirement, destination, helperFqns, localNames)) {
                selected.add(requirement);
            }
        }
        for (var requirement : gathered.moduleAliases()) {
            if (!helperFqns.contains(requirement.fullyQualifiedName())
                    && !localNames.contains(requirement.boundName())) {
                selected.add(requirement);
            }
        }
        for (var requirement : gathered.objectAliases()) {
            if (isWanted(requirement, destination, helperFqns, localNames)) {
                selected.add(requirement);
            }
        }
        return selected;
    }

    private static boolean isWanted(
            ImportRequirement requirement, ModuleIdentity destination, Set<String> helperFqns, Set<String> localNames) {
        if (helperFqns.contains(requirement.fullyQualifiedName())) {
            log.debug("Skipping {}: already inlined as a helper", requirement);
            return false;
        }
        if (requirement.module().equals(destination.name())) {
            log.debug("Skipping {}: the destination's own module", requirement);
            return false;
        }
        if (!requirement.isFuture() && localNames.contains(requirement.boundName())) {
            log.debug("Skipping {}: the destination defines {}", requirement, requirement.boundName());
            return false;
        }
        return true;
    }

    private static String stripLeadingNewlines(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == '\n' || text.charAt(i) == '\r')) {
            i++;
        }
        return text.substring(i);
    }
}
