package ai.codegraft.imports;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * The dotted module name of a Python file and the package its relative imports are resolved against. An
 * {@code __init__.py} file names its package, and is its own package.
 *
 * @param name fully-qualified module name, e.g. {@code pkg.sub.mod}
 * @param packageName package used for relative imports, e.g. {@code pkg.sub}
 */
public record ModuleIdentity(String name, String packageName) {
    private static final Splitter DOT_SPLITTER = Splitter.on('.').omitEmptyStrings();
    private static final Joiner DOT_JOINER = Joiner.on('.');

    /** Computes the identity of {@code file} relative to {@code projectRoot}. */
    public static ModuleIdentity of(Path projectRoot, Path file) {
        var root = projectRoot.toAbsolutePath().normalize();
        var absolute = file.isAbsolute() ? file.normalize() : root.resolve(file).normalize();
        var relative = absolute.startsWith(root) ? root.relativize(absolute) : absolute.getFileName();

        List<String> parts = StreamSupport.stream(relative.spliterator(), false)
                .map(Path::toString)
                .collect(Collectors.toCollection(ArrayList::new));
        if (parts.isEmpty()) {
            return new ModuleIdentity("", "");
        }
        var last = parts.remove(parts.size() - 1);
        if (last.endsWith(".py")) {
            last = last.substring(0, last.length() - 3);
        }

        if (last.equals("__init__")) {
            var pkg = DOT_JOINER.join(parts);
            return new ModuleIdentity(pkg, pkg);
        }
        var pkg = DOT_JOINER.join(parts);
        return new ModuleIdentity(pkg.isEmpty() ? last : pkg + "." + last, pkg);
    }

    /**
     * Resolves a relative module reference such as {@code .sibling} or {@code ..} to an absolute module name. One dot
     * is the current package, each further dot goes up one level.
     *
     * @return the absolute name, or empty when the reference climbs above the project root
     */
    public Optional<String> resolveRelative(String relativeText) {
        int dotCount = 0;
        while (dotCount < relativeText.length() && relativeText.charAt(dotCount) == '.') {
            dotCount++;
        }
        if (dotCount == 0) {
            return Optional.of(relativeText);
        }
        var relativeModule = relativeText.substring(dotCount).strip();

        List<String> packageParts = new ArrayList<>(DOT_SPLITTER.splitToList(packageName));
        int levelsUp = dotCount - 1;
        if (levelsUp > packageParts.size()) {
            return Optional.empty();
        }
        var target = new ArrayList<>(packageParts.subList(0, packageParts.size() - levelsUp));
        if (!relativeModule.isEmpty()) {
            target.addAll(DOT_SPLITTER.splitToList(relativeModule));
        }
        if (target.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(DOT_JOINER.join(target));
    }
}
