package ai.codegraft.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Everything needed to fold a rewritten snippet back into its destination file.
 *
 * @param optimizedCode rewritten snippet text, expected to parse on its own
 * @param destinationCode current text of the destination file
 * @param sourcePath path the rewritten snippet is attributed to, used to resolve its relative imports
 * @param destinationPath path of the destination file
 * @param projectRoot root against which dotted module names are computed
 * @param targets the declarations the snippet rewrites
 * @param helperFqns fully-qualified names of helpers already inlined in the destination; never imported
 */
public record MergeRequest(
        String optimizedCode,
        String destinationCode,
        Path sourcePath,
        Path destinationPath,
        Path projectRoot,
        List<TargetFunction> targets,
        Set<String> helperFqns) {

    public MergeRequest {
        targets = List.copyOf(targets);
        helperFqns = Set.copyOf(helperFqns);
    }

    /** A request where the snippet is attributed to the destination file itself. */
    public static MergeRequest inPlace(
            String optimizedCode, String destinationCode, Path destinationPath, Path projectRoot,
            List<TargetFunction> targets) {
        return new MergeRequest(
                optimizedCode, destinationCode, destinationPath, destinationPath, projectRoot, targets, Set.of());
    }
}
