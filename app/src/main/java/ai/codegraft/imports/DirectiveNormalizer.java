package ai.codegraft.imports;

import static ai.codegraft.parse.PythonNodeTypes.ALIASED_IMPORT;

import ai.codegraft.ParseFailureException;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import ai.codegraft.parse.SourceEdit;
import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drops aliased names from {@code from __future__ import ...} statements, which some interpreters reject. Unaliased
 * names stay; a statement left with no names is removed.
 */
public final class DirectiveNormalizer {
    private static final Logger log = LogManager.getLogger(DirectiveNormalizer.class);
    private static final Joiner NAME_JOINER = Joiner.on(", ");

    private DirectiveNormalizer() {}

    /** Returns the text with aliased future names removed; unparseable text comes back unchanged. */
    public static String normalize(String text) {
        var parsed = ProgramUnit.tryParse(text, "directive normalization");
        if (parsed.isEmpty()) {
            return text;
        }
        var unit = parsed.get();

        List<SourceEdit> edits = new ArrayList<>();
        for (var statement : unit.topLevelStatements()) {
            if (!PythonSyntax.isFutureImport(statement)) {
                continue;
            }
            var names = ImportStatements.nameNodes(statement);
            var kept = names.stream()
                    .filter(n -> !ALIASED_IMPORT.equals(n.getType()))
                    .map(unit::textOf)
                    .toList();
            if (kept.size() == names.size()) {
                continue;
            }
            log.debug(
                    "Dropping {} aliased __future__ name(s) at line {}",
                    names.size() - kept.size(),
                    unit.startLine(statement));
            if (kept.isEmpty()) {
                edits.add(ImportEditor.removeStatement(unit, statement));
            } else {
                edits.add(new SourceEdit(
                        statement.getStartByte(),
                        statement.getEndByte(),
                        "from __future__ import " + NAME_JOINER.join(kept)));
            }
        }
        if (edits.isEmpty()) {
            return text;
        }
        try {
            return unit.edit(edits).text();
        } catch (ParseFailureException e) {
            log.warn("{} after normalizing __future__ imports at line {}, text left as is", e.kind(), e.line());
            return text;
        }
    }
}
