package ai.codegraft;

import ai.codegraft.api.CandidateOptimizer;
import ai.codegraft.api.ExtractionResult;
import ai.codegraft.api.MergeProvider;
import ai.codegraft.api.MergeRequest;
import ai.codegraft.api.PreexistingSymbol;
import ai.codegraft.api.SnippetProvider;
import ai.codegraft.api.TargetFunction;
import ai.codegraft.extract.PreexistingSymbolScanner;
import ai.codegraft.extract.SnippetExtractor;
import ai.codegraft.imports.DirectiveNormalizer;
import ai.codegraft.imports.ImportResolver;
import ai.codegraft.merge.DeclarationReplacer;
import ai.codegraft.merge.GlobalStateMerger;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the engine: cuts snippets out of Python files and folds rewritten snippets back in.
 *
 * <p>A merge runs four stages in a fixed order: the optimized code's {@code __future__} imports are normalized, the
 * rewritten declarations replace their originals, module-level state is merged, and imports are reconciled last.
 * Every stage returns its input when it fails, so a failing stage never discards the work of an earlier one.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class CodeGraft implements SnippetProvider, MergeProvider {
    private static final Logger log = LogManager.getLogger(CodeGraft.class);

    private final GraftSettings settings;
    private final SnippetExtractor extractor;
    private final PreexistingSymbolScanner symbolScanner;
    private final DeclarationReplacer replacer;
    private final GlobalStateMerger globalStateMerger;
    private final ImportResolver importResolver;

    public CodeGraft() {
        this(GraftSettings.load());
    }

    public CodeGraft(GraftSettings settings) {
        this.settings = settings;
        this.extractor = new SnippetExtractor();
        this.symbolScanner = new PreexistingSymbolScanner();
        this.replacer = new DeclarationReplacer(settings);
        this.globalStateMerger = new GlobalStateMerger(settings);
        this.importResolver = new ImportResolver(settings);
    }

    @Override
    public ExtractionResult extract(String sourceCode, List<TargetFunction> targets) {
        return extractor.extract(sourceCode, targets);
    }

    @Override
    public Set<PreexistingSymbol> preexistingSymbols(String sourceCode) {
        return symbolScanner.scan(sourceCode);
    }

    @Override
    public String mergeOptimizedCode(MergeRequest request) {
        var optimized = DirectiveNormalizer.normalize(request.optimizedCode());
        var merged = replacer.replace(optimized, request.destinationCode(), request.targets());
        merged = mergeGlobals(optimized, merged);
        merged = reconcileImports(
                optimized,
                merged,
                request.sourcePath(),
                request.destinationPath(),
                request.projectRoot(),
                request.helperFqns());
        if (merged.equals(request.destinationCode())) {
            log.debug("Merge into {} changed nothing", request.destinationPath());
        }
        return merged;
    }

    @Override
    public String mergeGlobals(String newCode, String destinationCode) {
        if (!settings.globalsEnabled()) {
            return destinationCode;
        }
        return globalStateMerger.merge(newCode, destinationCode);
    }

    @Override
    public String reconcileImports(
            String newCode,
            String destinationCode,
            Path sourcePath,
            Path destinationPath,
            Path projectRoot,
            Set<String> helperFqns) {
        return importResolver.reconcile(newCode, destinationCode, sourcePath, destinationPath, projectRoot, helperFqns);
    }

    /**
     * Extracts the targets from {@code destinationCode}, hands the snippet to {@code optimizer} and merges its reply
     * back. The destination comes back unchanged when extraction is not applicable or the optimizer has no reply.
     */
    public String optimize(
            String destinationCode,
            Path destinationPath,
            Path projectRoot,
            List<TargetFunction> targets,
            CandidateOptimizer optimizer) {
        var extraction = extract(destinationCode, targets);
        if (extraction.isEmpty()) {
            log.info("No snippet for {} in {}, skipping", targets, destinationPath);
            return destinationCode;
        }
        var reply = optimizer.optimize(extraction.snippetText().orElseThrow());
        if (reply.isEmpty()) {
            log.info("Optimizer returned no candidate for {}", targets);
            return destinationCode;
        }
        return mergeOptimizedCode(
                MergeRequest.inPlace(reply.get(), destinationCode, destinationPath, projectRoot, targets));
    }
}
