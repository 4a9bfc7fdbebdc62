package ai.codegraft.imports;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.codegraft.ParseFailureException;
import ai.codegraft.api.ImportRequirement;
import ai.codegraft.parse.ProgramUnit;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ImportGathererTest {

    @Test
    public void testGathersUnconditionalModuleLevelImports() throws ParseFailureException {
        var unit = ProgramUnit.parse(
                """
                import os
                import numpy as np
                from typing import List, Dict as D
                from .sibling import helper
                from __future__ import annotations

                if TYPE_CHECKING:
                    from x import Y

                try:
                    import ujson
                except ImportError:
                    ujson = None

                def f():
                    import json
                """);
        var identity = ModuleIdentity.of(Path.of("/root"), Path.of("/root/pkg/mod.py"));

        var gathered = ImportGatherer.gather(unit, identity);

        assertEquals(List.of(ImportRequirement.module("os"), ImportRequirement.module("ujson")), gathered.moduleImports());
        assertEquals(List.of(ImportRequirement.aliasedModule("numpy", "np")), gathered.moduleAliases());
        assertEquals(
                List.of(
                        ImportRequirement.object("typing", "List"),
                        ImportRequirement.object("pkg.sibling", "helper"),
                        ImportRequirement.object("__future__", "annotations")),
                gathered.objectImports());
        assertEquals(List.of(ImportRequirement.aliasedObject("typing", "Dict", "D")), gathered.objectAliases());
    }

    @Test
    public void testDuplicatesCollapse() throws ParseFailureException {
        var unit = ProgramUnit.parse("import os\nimport os\nfrom a import b\nfrom a import b\n");
        var gathered = ImportGatherer.gather(unit, new ModuleIdentity("mod", ""));
        assertEquals(1, gathered.moduleImports().size());
        assertEquals(1, gathered.objectImports().size());
    }
}
