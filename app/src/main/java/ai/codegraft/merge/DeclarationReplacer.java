package ai.codegraft.merge;

import ai.codegraft.GraftException;
import ai.codegraft.GraftSettings;
import ai.codegraft.api.DeclarationPath;
import ai.codegraft.api.PreexistingSymbol;
import ai.codegraft.api.TargetFunction;
import ai.codegraft.extract.DeclarationLocator;
import ai.codegraft.extract.LocatedDeclaration;
import ai.codegraft.extract.PreexistingSymbolScanner;
import ai.codegraft.extract.SnippetExtractor;
import ai.codegraft.parse.Newlines;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import ai.codegraft.parse.SourceEdit;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Puts rewritten declarations back into the file they were cut from. Each target's definition in the rewritten
 * snippet replaces the destination's definition line for line, re-indented to the destination's indentation. Helper
 * functions and classes the snippet introduces are inserted in front of the rewritten code; new methods of the
 * target class go after the last rewritten method.
 */
public final class DeclarationReplacer {
    private static final Logger log = LogManager.getLogger(DeclarationReplacer.class);
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private final DeclarationLocator locator;
    private final PreexistingSymbolScanner symbolScanner = new PreexistingSymbolScanner();
    private final boolean insertNewHelpers;

    public DeclarationReplacer() {
        this(GraftSettings.defaults());
    }

    public DeclarationReplacer(GraftSettings settings) {
        this.locator = new DeclarationLocator();
        this.insertNewHelpers = settings.insertNewHelpers();
    }

    /** Returns the destination with the targets rewritten, or unchanged when nothing could be replaced. */
    public String replace(String optimizedCode, String destinationCode, List<TargetFunction> targets) {
        try {
            var optimized = ProgramUnit.parse(optimizedCode);
            var destination = ProgramUnit.parse(destinationCode);
            return replace(optimized, destination, SnippetExtractor.toPaths(targets)).text();
        } catch (GraftException e) {
            log.warn("{} replacing {}: {}", e.kind(), targets, e.getMessage());
            return destinationCode;
        }
    }

    public ProgramUnit replace(ProgramUnit optimized, ProgramUnit destination, List<DeclarationPath> paths)
            throws GraftException {
        var newline = destination.newline();
        List<SourceEdit> edits = new ArrayList<>();
        List<LocatedDeclaration> replaced = new ArrayList<>();

        for (var path : paths) {
            var source = locator.locate(optimized, path);
            var target = locator.locate(destination, path);
            if (source.isEmpty() || target.isEmpty()) {
                log.debug("{} missing from {}, not replaced", path, source.isEmpty() ? "optimized code" : "destination");
                continue;
            }
            var text = reindent(
                    optimized.linesOf(source.get().node()),
                    optimized.indentationOf(source.get().node()),
                    destination.indentationOf(target.get().node()));
            var node = target.get().node();
            edits.add(new SourceEdit(
                    destination.lineStartByte(node),
                    destination.lineEndByte(node),
                    Newlines.terminate(Newlines.convert(text, newline), newline)));
            replaced.add(target.get());
        }
        if (replaced.isEmpty()) {
            log.debug("Nothing to replace for {}", paths);
            return destination;
        }

        if (insertNewHelpers) {
            var existing = symbolScanner.scan(destination);
            helperInsertion(optimized, destination, replaced, existing).ifPresent(edits::add);
            methodInsertion(optimized, destination, replaced, existing).ifPresent(edits::add);
        }
        return destination.edit(edits);
    }

    /** New top-level functions and classes, each followed by a blank line, in front of the first rewritten code. */
    private Optional<SourceEdit> helperInsertion(
            ProgramUnit optimized,
            ProgramUnit destination,
            List<LocatedDeclaration> replaced,
            Set<PreexistingSymbol> existing) throws GraftException {
        var known = PreexistingSymbolScanner.topLevelNames(existing);
        var newline = destination.newline();
        var block = new StringBuilder();
        for (var statement : optimized.topLevelStatements()) {
            var name = PythonSyntax.definitionName(statement, optimized);
            if (name.isEmpty() || known.contains(name.get())) {
                continue;
            }
            log.debug("Inserting new helper {}", name.get());
            block.append(Newlines.terminate(Newlines.convert(optimized.linesOf(statement), newline), newline))
                    .append(newline);
        }
        if (block.isEmpty()) {
            return Optional.empty();
        }
        var anchor = anchorOf(destination, replaced.get(0));
        for (var declaration : replaced) {
            var candidate = anchorOf(destination, declaration);
            if (candidate.getStartByte() < anchor.getStartByte()) {
                anchor = candidate;
            }
        }
        return Optional.of(SourceEdit.insert(destination.lineStartByte(anchor), block.toString()));
    }

    /** Methods of the target class the destination class lacks, after the last rewritten method. */
    private Optional<SourceEdit> methodInsertion(
            ProgramUnit optimized,
            ProgramUnit destination,
            List<LocatedDeclaration> replaced,
            Set<PreexistingSymbol> existing) throws GraftException {
        LocatedDeclaration last = null;
        for (var declaration : replaced) {
            if (declaration.enclosingClass() != null
                    && (last == null || declaration.node().getStartByte() > last.node().getStartByte())) {
                last = declaration;
            }
        }
        if (last == null) {
            return Optional.empty();
        }
        var className = last.enclosingClass();
        var optimizedClass = locator.locate(optimized, DeclarationPath.of(className)).map(LocatedDeclaration::node);
        if (optimizedClass.isEmpty() || !PythonSyntax.isClass(optimizedClass.get())) {
            return Optional.empty();
        }

        var newline = destination.newline();
        var indent = destination.indentationOf(last.node());
        var block = new StringBuilder();
        var members = PythonSyntax.body(optimizedClass.get()).map(PythonSyntax::statements).orElse(List.of());
        for (var member : members) {
            var name = PythonSyntax.definitionName(member, optimized);
            if (!PythonSyntax.isFunction(member)
                    || name.isEmpty()
                    || existing.contains(PreexistingSymbol.member(className, name.get()))) {
                continue;
            }
            log.debug("Inserting new method {}.{}", className, name.get());
            var text = reindent(optimized.linesOf(member), optimized.indentationOf(member), indent);
            block.append(newline).append(Newlines.terminate(Newlines.convert(text, newline), newline));
        }
        if (block.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SourceEdit.insert(destination.lineEndByte(last.node()), block.toString()));
    }

    /** The top-level statement that holds the declaration: itself, or its class for a method. */
    private TSNode anchorOf(ProgramUnit destination, LocatedDeclaration declaration) throws GraftException {
        if (declaration.enclosingClass() == null) {
            return declaration.node();
        }
        return locator.locate(destination, DeclarationPath.of(declaration.enclosingClass()))
                .map(LocatedDeclaration::node)
                .orElse(declaration.node());
    }

    /** Moves every line indented with {@code from} to {@code to}; blank lines and lines indented less stay as they are. */
    static String reindent(String text, String from, String to) {
        if (from.equals(to)) {
            return text;
        }
        var lines = new ArrayList<String>();
        for (var line : LINE_SPLITTER.split(text)) {
            lines.add(!line.isBlank() && line.startsWith(from) ? to + line.substring(from.length()) : line);
        }
        return String.join("\n", lines);
    }
}
