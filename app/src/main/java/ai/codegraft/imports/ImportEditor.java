package ai.codegraft.imports;

import static ai.codegraft.parse.PythonNodeTypes.FUTURE_IMPORT_STATEMENT;
import static ai.codegraft.parse.PythonNodeTypes.IMPORT_FROM_STATEMENT;

import ai.codegraft.ImportReconciliationException;
import ai.codegraft.ParseFailureException;
import ai.codegraft.api.ImportRequirement;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import ai.codegraft.parse.SourceEdit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * The two primitive import edits on a file: make sure an import is there, and drop an import nobody reads. Both look
 * at top-level imports only and return a new unit; the unit passed in is returned as is when nothing changes.
 */
public final class ImportEditor {
    private static final Logger log = LogManager.getLogger(ImportEditor.class);

    private ImportEditor() {}

    /**
     * Adds {@code requirement} unless an equivalent import, or a star import of the same module, already exists. A
     * from-import joins an existing {@code from module import ...} statement when there is one; otherwise a new
     * statement goes after the leading import block. {@code __future__} imports go before every other import.
     *
     * @param identity the module the unit is, used to resolve its relative imports
     */
    public static ProgramUnit ensurePresent(ProgramUnit unit, ImportRequirement requirement, ModuleIdentity identity)
            throws ImportReconciliationException {
        var entries = ImportStatements.topLevelEntries(unit, identity);
        for (var entry : entries) {
            var existing = entry.requirement();
            if (existing.equals(requirement)) {
                return unit;
            }
            if (requirement.isFromImport() && existing.isStar() && existing.module().equals(requirement.module())) {
                return unit;
            }
        }

        var newline = unit.newline();
        if (requirement.isFromImport() && !requirement.isStar()) {
            var joinable = joinableFromImport(entries, requirement.module());
            if (joinable != null) {
                var lastName = joinable.siblings().get(joinable.siblings().size() - 1);
                var addition = ", " + requirement.objectName().orElseThrow()
                        + requirement.aliasName().map(a -> " as " + a).orElse("");
                log.debug("Joining {} into existing import at line {}", requirement, unit.startLine(joinable.statement()));
                return apply(unit, List.of(SourceEdit.insert(lastName.getEndByte(), addition)));
            }
        }

        int at = requirement.isFuture() ? futureInsertionOffset(unit) : importInsertionOffset(unit);
        var prefix = unit.needsLineBreakAt(at) ? newline : "";
        log.debug("Adding {} at byte {}", requirement, at);
        return apply(unit, List.of(SourceEdit.insert(at, prefix + requirement.render() + newline)));
    }

    /**
     * Removes every top-level entry equivalent to {@code requirement} when the name it binds is read nowhere in the
     * file. A dotted {@code import a.b} counts as read only through an {@code a.b} attribute chain. Star and
     * {@code __future__} imports are kept.
     */
    public static ProgramUnit pruneIfUnused(ProgramUnit unit, ImportRequirement requirement, ModuleIdentity identity)
            throws ImportReconciliationException {
        if (requirement.isStar() || requirement.isFuture()) {
            return unit;
        }
        var usage = NameUsageIndex.of(unit);
        boolean used = !requirement.isFromImport() && requirement.alias() == null
                ? usage.isChainUsed(requirement.module())
                : usage.isUsed(requirement.boundName());
        if (used) {
            return unit;
        }

        // one entry per round: removing two entries of the same statement in one pass could produce overlapping edits
        var current = unit;
        while (true) {
            var entry = firstMatching(current, requirement, identity);
            if (entry == null) {
                return current;
            }
            var edit = entry.isOnlyEntry() ? removeStatement(current, entry.statement()) : removeEntry(entry);
            log.debug("Removing unused {} at line {}", requirement, current.startLine(entry.node()));
            current = apply(current, List.of(edit));
        }
    }

    /**
     * The edit that deletes a whole statement. A statement alone on its lines takes its lines (and any trailing
     * comment) with it; one sharing a line through {@code ;} takes its separator instead.
     */
    public static SourceEdit removeStatement(ProgramUnit unit, TSNode statement) {
        byte[] bytes = unit.content().utf8Bytes();
        int start = statement.getStartByte();
        int end = statement.getEndByte();
        int lineStart = unit.lineStartByte(statement);

        boolean blankBefore = true;
        for (int i = lineStart; i < start; i++) {
            if (!isBlank(bytes[i])) {
                blankBefore = false;
                break;
            }
        }
        int after = end;
        while (after < bytes.length && isBlank(bytes[after])) {
            after++;
        }
        boolean blankAfter =
                after >= bytes.length || bytes[after] == '\n' || bytes[after] == '\r' || bytes[after] == '#';
        if (blankBefore && blankAfter) {
            return SourceEdit.delete(lineStart, unit.lineEndByte(statement));
        }
        if (after < bytes.length && bytes[after] == ';') {
            int next = after + 1;
            while (next < bytes.length && isBlank(bytes[next])) {
                next++;
            }
            return SourceEdit.delete(start, next);
        }
        int before = start;
        while (before > lineStart && isBlank(bytes[before - 1])) {
            before--;
        }
        if (before > lineStart && bytes[before - 1] == ';') {
            return SourceEdit.delete(before - 1, end);
        }
        return SourceEdit.delete(start, end);
    }

    /** Deletes one entry of a multi-entry statement together with the comma that separates it from a neighbour. */
    static SourceEdit removeEntry(ImportEntry entry) {
        var siblings = entry.siblings();
        int index = entry.index();
        if (index > 0) {
            return SourceEdit.delete(siblings.get(index - 1).getEndByte(), entry.node().getEndByte());
        }
        return SourceEdit.delete(entry.node().getStartByte(), siblings.get(1).getStartByte());
    }

    private static @Nullable ImportEntry firstMatching(
            ProgramUnit unit, ImportRequirement requirement, ModuleIdentity identity) {
        for (var entry : ImportStatements.topLevelEntries(unit, identity)) {
            if (entry.requirement().equals(requirement)) {
                return entry;
            }
        }
        return null;
    }

    private static @Nullable ImportEntry joinableFromImport(List<ImportEntry> entries, String module) {
        Set<Integer> starred = new HashSet<>();
        for (var entry : entries) {
            if (entry.requirement().isStar()) {
                starred.add(entry.statement().getStartByte());
            }
        }
        for (var entry : entries) {
            var type = entry.statement().getType();
            boolean fromStatement = IMPORT_FROM_STATEMENT.equals(type) || FUTURE_IMPORT_STATEMENT.equals(type);
            if (fromStatement
                    && entry.requirement().module().equals(module)
                    && !starred.contains(entry.statement().getStartByte())) {
                return entry;
            }
        }
        return null;
    }

    /** After the last import of the leading import block, or at the top of the body when the file has none. */
    private static int importInsertionOffset(ProgramUnit unit) {
        TSNode lastLeading = null;
        var statements = unit.topLevelStatements();
        for (int i = 0; i < statements.size(); i++) {
            var statement = statements.get(i);
            if (i == 0 && PythonSyntax.isDocstring(statement)) {
                continue;
            }
            if (!PythonSyntax.isImport(statement)) {
                break;
            }
            lastLeading = statement;
        }
        return lastLeading == null ? unit.bodyStartByte() : unit.lineEndByte(lastLeading);
    }

    private static int futureInsertionOffset(ProgramUnit unit) {
        TSNode lastFuture = null;
        for (var statement : unit.topLevelStatements()) {
            if (PythonSyntax.isFutureImport(statement)) {
                lastFuture = statement;
            }
        }
        return lastFuture == null ? unit.bodyStartByte() : unit.lineEndByte(lastFuture);
    }

    private static ProgramUnit apply(ProgramUnit unit, List<SourceEdit> edits) throws ImportReconciliationException {
        try {
            return unit.edit(edits);
        } catch (ParseFailureException | IllegalArgumentException e) {
            throw new ImportReconciliationException("Import edit left the file unparseable: " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(byte b) {
        return b == ' ' || b == '\t';
    }
}
