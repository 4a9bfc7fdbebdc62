package ai.codegraft;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Switches for the merge pipeline. Values come from an optional {@code codegraft.properties} on the classpath and
 * can be overridden per key with a system property of the same name.
 */
public record GraftSettings(
        boolean importsEnabled,
        boolean globalsEnabled,
        boolean dedupeGlobalStatements,
        boolean insertNewHelpers,
        boolean stripLeadingNewlines) {
    private static final Logger logger = LogManager.getLogger(GraftSettings.class);

    static final String RESOURCE_NAME = "codegraft.properties";
    public static final String IMPORTS_ENABLED = "codegraft.imports.enabled";
    public static final String GLOBALS_ENABLED = "codegraft.globals.enabled";
    public static final String DEDUPE_STATEMENTS = "codegraft.globals.dedupeStatements";
    public static final String INSERT_NEW_HELPERS = "codegraft.replace.insertNewHelpers";
    public static final String STRIP_LEADING_NEWLINES = "codegraft.imports.stripLeadingNewlines";

    public static GraftSettings defaults() {
        return new GraftSettings(true, true, true, true, true);
    }

    /** Loads {@value #RESOURCE_NAME} from the classpath, then applies system property overrides. */
    public static GraftSettings load() {
        var props = new Properties();
        try (InputStream in = GraftSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            logger.error("Failed to load {}: {}", RESOURCE_NAME, e.getMessage());
        }
        return fromProperties(props);
    }

    public static GraftSettings fromProperties(Properties props) {
        return new GraftSettings(
                flag(props, IMPORTS_ENABLED),
                flag(props, GLOBALS_ENABLED),
                flag(props, DEDUPE_STATEMENTS),
                flag(props, INSERT_NEW_HELPERS),
                flag(props, STRIP_LEADING_NEWLINES));
    }

    private static boolean flag(Properties props, String key) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) {
            v = props.getProperty(key);
        }
        if (v == null || v.isBlank()) return true;
        return Boolean.parseBoolean(v.trim());
    }
}
