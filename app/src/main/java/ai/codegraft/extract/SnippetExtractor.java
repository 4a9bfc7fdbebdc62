package ai.codegraft.extract;

import ai.codegraft.FailureKind;
import ai.codegraft.ParseFailureException;
import ai.codegraft.StructuralMismatchException;
import ai.codegraft.api.ClassSkeleton;
import ai.codegraft.api.DeclarationPath;
import ai.codegraft.api.DunderMethod;
import ai.codegraft.api.ExtractionResult;
import ai.codegraft.api.FunctionParent;
import ai.codegraft.api.LineRange;
import ai.codegraft.api.TargetFunction;
import ai.codegraft.parse.ProgramUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cuts the literal source of one function, or of several methods of one class, out of a file, together with the
 * class skeleton they need. The result must parse on its own before it is handed to an optimizer.
 */
public final class SnippetExtractor {
    private static final Logger log = LogManager.getLogger(SnippetExtractor.class);

    private final DeclarationLocator locator;

    public SnippetExtractor() {
        this(new DeclarationLocator());
    }

    public SnippetExtractor(DeclarationLocator locator) {
        this.locator = locator;
    }

    /**
     * Extracts the snippet for {@code targets}, which are either a single top-level function or methods of one
     * top-level class.
     */
    public ExtractionResult extract(String sourceCode, List<TargetFunction> targets) {
        List<DeclarationPath> paths;
        try {
            paths = toPaths(targets);
        } catch (StructuralMismatchException e) {
            log.warn("{} extracting {}: {}", e.kind(), targets, e.getMessage());
            return ExtractionResult.empty();
        }

        ProgramUnit unit;
        try {
            unit = ProgramUnit.parse(sourceCode);
        } catch (ParseFailureException e) {
            log.warn("{} extracting {} at line {}: {}", e.kind(), targets, e.line(), e.getMessage());
            return ExtractionResult.empty();
        }

        return extract(unit, paths);
    }

    /** Extracts from an already parsed unit. Paths of different classes yield an empty result. */
    public ExtractionResult extract(ProgramUnit unit, List<DeclarationPath> paths) {
        if (!shareOneClass(paths)) {
            log.warn("{} extracting {}: targets must share one enclosing class", FailureKind.STRUCTURAL_MISMATCH, paths);
            return ExtractionResult.empty();
        }

        var skeleton = new ClassSkeleton();
        Set<DunderMethod> dunders = new LinkedHashSet<>();
        List<LineRange> targetRanges = new ArrayList<>();
        for (var path : paths) {
            try {
                var located = locator.locate(unit, path);
                if (located.isEmpty()) {
                    log.debug("Declaration {} not found, skipping", path);
                    continue;
                }
                var declaration = located.get();
                declaration.skeletonRanges().forEach(skeleton::add);
                dunders.addAll(declaration.contextualDunders());
                targetRanges.add(declaration.lines());
            } catch (StructuralMismatchException e) {
                log.warn("{} locating {}: {}", e.kind(), path, e.getMessage());
            }
        }
        if (targetRanges.isEmpty()) {
            log.warn("{} extracting {}: no declaration resolved", FailureKind.STRUCTURAL_MISMATCH, paths);
            return ExtractionResult.empty();
        }

        // a dunder that is itself requested is emitted once, as a target
        targetRanges.forEach(skeleton::remove);
        var content = unit.content();
        var snippet = new StringBuilder();
        for (var range : skeleton.ranges()) {
            snippet.append(content.lines(range.start(), range.end()));
        }
        for (var range : targetRanges) {
            snippet.append(content.lines(range.start(), range.end()));
        }

        var code = snippet.toString();
        try {
            ProgramUnit.parse(code);
        } catch (ParseFailureException e) {
            log.warn(
                    "{} for {} at snippet line {}: {}",
                    FailureKind.POST_EXTRACTION_VALIDATION_FAILURE,
                    paths,
                    e.line(),
                    e.getMessage());
            return ExtractionResult.empty();
        }
        return ExtractionResult.of(code, dunders);
    }

    public static List<DeclarationPath> toPaths(List<TargetFunction> targets) throws StructuralMismatchException {
        if (targets.isEmpty()) {
            throw new StructuralMismatchException("no targets given");
        }
        var paths = new ArrayList<DeclarationPath>();
        for (var target : targets) {
            if (target.parents().size() > 1) {
                throw new StructuralMismatchException(
                        "more than one level of nesting is not supported: " + target.qualifiedName());
            }
            if (!target.parents().isEmpty() && target.parents().get(0).kind() != FunctionParent.Kind.CLASS) {
                throw new StructuralMismatchException("inner functions are not supported: " + target.qualifiedName());
            }
            paths.add(target.toDeclarationPath()
                    .orElseThrow(() -> new StructuralMismatchException("unsupported target " + target.qualifiedName())));
        }
        return paths;
    }

    /** A single path, or several methods of the same class. */
    private static boolean shareOneClass(List<DeclarationPath> paths) {
        if (paths.isEmpty()) {
            return false;
        }
        if (paths.size() == 1) {
            return true;
        }
        var owner = paths.get(0).className();
        return owner.isPresent() && paths.stream().allMatch(p -> p.className().equals(owner));
    }
}
