package ai.codegraft.merge;

import static ai.codegraft.parse.PythonNodeTypes.FIELD_RIGHT;

import ai.codegraft.GraftSettings;
import ai.codegraft.ParseFailureException;
import ai.codegraft.parse.AstTraversalUtils;
import ai.codegraft.parse.Newlines;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import ai.codegraft.parse.SourceEdit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Reconciles module-level state of a rewritten file ("new") into the file it is merged into ("destination").
 *
 * <p>Free statements of the new file go into the destination right after its last import. Bindings of the new file
 * replace the value of destination assignments of the same name in place; names the destination lacks are appended
 * at the end of the module. Only top-level assignment statements count as bindings: anything inside a function,
 * class, conditional or other compound statement is left alone.
 */
public final class GlobalStateMerger {
    private static final Logger log = LogManager.getLogger(GlobalStateMerger.class);

    private final boolean dedupeStatements;

    public GlobalStateMerger() {
        this(GraftSettings.defaults());
    }

    public GlobalStateMerger(GraftSettings settings) {
        this.dedupeStatements = settings.dedupeGlobalStatements();
    }

    /**
     * Merges the globals of {@code newCode} into {@code destinationCode}. If either text fails to parse, the
     * destination is returned unchanged.
     */
    public String merge(String newCode, String destinationCode) {
        ProgramUnit newUnit;
        try {
            newUnit = ProgramUnit.parse(newCode);
        } catch (ParseFailureException e) {
            log.warn("{} in new code at line {}, globals not merged", e.kind(), e.line());
            return destinationCode;
        }
        try {
            var destination = ProgramUnit.parse(destinationCode);
            var withStatements = insertFreeStatements(newUnit, destination);
            return mergeBindings(newUnit, withStatements).text();
        } catch (ParseFailureException e) {
            log.warn("{} in destination at line {}, globals not merged", e.kind(), e.line());
            return destinationCode;
        }
    }

    /** Inserts the new file's free statements as one block after the destination's last import. */
    public ProgramUnit insertFreeStatements(ProgramUnit newUnit, ProgramUnit destination)
            throws ParseFailureException {
        var statements = GlobalStatementCollector.collect(newUnit);
        if (dedupeStatements) {
            Set<String> existing = destination.topLevelStatements().stream()
                    .map(n -> destination.textOf(n).strip())
                    .collect(Collectors.toCollection(HashSet::new));
            statements = statements.stream()
                    .filter(s -> existing.add(s.strip()))
                    .collect(Collectors.toList());
        }
        if (statements.isEmpty()) {
            return destination;
        }

        var newline = destination.newline();
        var block = new StringBuilder();
        for (var statement : statements) {
            block.append(Newlines.terminate(Newlines.convert(statement, newline), newline));
        }

        var lastImport = lastTopLevelImport(destination);
        int at;
        if (lastImport != null) {
            at = destination.lineEndByte(lastImport);
        } else {
            at = destination.bodyStartByte();
        }
        var prefix = destination.needsLineBreakAt(at) ? newline : "";
        log.debug("Inserting {} global statement(s) at byte {}", statements.size(), at);
        return destination.edit(List.of(SourceEdit.insert(at, prefix + block)));
    }

    /**
     * Gives destination assignments whose single target the new file also binds the new right-hand side, then
     * appends the remaining new bindings in their original order, after one blank line. Only the destination's own
     * top-level statements are rewritten; chained assignments and bare annotations there are never matched.
     */
    public ProgramUnit mergeBindings(ProgramUnit newUnit, ProgramUnit destination) throws ParseFailureException {
        var registry = GlobalBindingCollector.collect(newUnit);
        if (registry.isEmpty()) {
            return destination;
        }

        var newline = destination.newline();
        Set<String> processed = new HashSet<>();
        List<SourceEdit> edits = new ArrayList<>();
        for (var statement : destination.topLevelStatements()) {
            var assignment = PythonSyntax.assignment(statement);
            if (assignment.isEmpty()) {
                continue;
            }
            var name = PythonSyntax.singleTargetName(assignment.get(), destination);
            var value = AstTraversalUtils.field(assignment.get(), FIELD_RIGHT);
            if (name.isEmpty() || value.isEmpty() || !registry.containsKey(name.get())) {
                continue;
            }
            processed.add(name.get());
            var replacement = Newlines.convert(registry.get(name.get()).valueText(), newline);
            if (!destination.textOf(value.get()).equals(replacement)) {
                edits.add(new SourceEdit(value.get().getStartByte(), value.get().getEndByte(), replacement));
            }
        }

        var appended = new StringBuilder();
        for (var binding : registry.values()) {
            if (processed.contains(binding.name())) {
                continue;
            }
            processed.addAll(binding.boundNames());
            appended.append(Newlines.convert(binding.assignmentText(), newline)).append(newline);
        }
        if (!appended.isEmpty()) {
            log.debug("Appending new global bindings: {}", appended);
            edits.add(SourceEdit.insert(destination.content().byteLength(), separatorFor(destination) + appended));
        }
        return destination.edit(edits);
    }

    private static String separatorFor(ProgramUnit destination) {
        var text = destination.text();
        var newline = destination.newline();
        if (text.isEmpty()) {
            return "";
        }
        if (!text.endsWith("\n")) {
            return newline + newline;
        }
        return Newlines.endsWithBlankLine(text) ? "" : newline;
    }

    static @Nullable TSNode lastTopLevelImport(ProgramUnit unit) {
        TSNode last = null;
        for (var statement : unit.topLevelStatements()) {
            if (PythonSyntax.isImport(statement)) {
                last = statement;
            }
        }
        return last;
    }
}
