package ai.codegraft.extract;

import ai.codegraft.api.PreexistingSymbol;
import ai.codegraft.parse.ProgramUnit;
import ai.codegraft.parse.PythonSyntax;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Lists the functions, classes and class methods a file already defines. */
public final class PreexistingSymbolScanner {

    /** Scans source text; unparseable text defines nothing. */
    public Set<PreexistingSymbol> scan(String sourceCode) {
        return ProgramUnit.tryParse(sourceCode, "preexisting symbol scan").map(this::scan).orElse(Set.of());
    }

    public Set<PreexistingSymbol> scan(ProgramUnit unit) {
        Set<PreexistingSymbol> symbols = new LinkedHashSet<>();
        for (var node : unit.topLevelStatements()) {
            var name = PythonSyntax.definitionName(node, unit);
            if (name.isEmpty()) {
                continue;
            }
            symbols.add(PreexistingSymbol.topLevel(name.get()));
            if (!PythonSyntax.isClass(node)) {
                continue;
            }
            var members = PythonSyntax.body(node).map(PythonSyntax::statements).orElse(List.of());
            for (var member : members) {
                if (PythonSyntax.isFunction(member)) {
                    PythonSyntax.definitionName(member, unit)
                            .ifPresent(m -> symbols.add(PreexistingSymbol.member(name.get(), m)));
                }
            }
        }
        return symbols;
    }

    /** Names of the top-level functions and classes only. */
    public static Set<String> topLevelNames(Set<PreexistingSymbol> symbols) {
        Set<String> names = new LinkedHashSet<>();
        for (var symbol : symbols) {
            if (symbol.isTopLevel()) {
                names.add(symbol.name());
            }
        }
        return names;
    }
}
