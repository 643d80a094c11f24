package work.flowscript.exporter.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.flowscript.exporter.shared.DurationParser;

/**
 * Reads the {@code [export]} table of a TOML file on top of a base configuration.
 *
 * <pre>
 * [export]
 * indent = 4            # or a string such as "\t"
 * browser = "firefox"
 * headless = true
 * timeout = "15s"       # or milliseconds as an integer
 * timestamp = false
 * </pre>
 */
public final class ExportConfigurationLoader {
    public static final String TABLE = "export";

    private ExportConfigurationLoader() {}

    public static ExportConfiguration load(Path path) {
        return load(path, ExportConfiguration.defaults());
    }

    public static ExportConfiguration load(Path path, ExportConfiguration base) {
        try {
            return apply(parse(Files.readString(path), path.toString()), base);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
    }

    public static ExportConfiguration parse(String toml, ExportConfiguration base) {
        return apply(parse(toml, "<inline>"), base);
    }

    private static TomlParseResult parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + origin + ": " + errors);
        }
        return result;
    }

    private static ExportConfiguration apply(TomlParseResult result, ExportConfiguration base) {
        TomlTable table = result.getTable(TABLE);
        if (table == null || table.isEmpty()) {
            return base;
        }
        var builder = base.toBuilder();
        if (table.contains("indent")) {
            if (table.isLong("indent")) {
                builder.indentWidth(Math.toIntExact(table.getLong("indent")));
            } else if (table.isString("indent")) {
                builder.indentUnit(table.getString("indent"));
            } else {
                throw new IllegalArgumentException("'indent' must be an integer or a string");
            }
        }
        if (table.isString("browser")) {
            builder.browser(table.getString("browser"));
        }
        if (table.isBoolean("headless")) {
            builder.headless(table.getBoolean("headless"));
        }
        if (table.contains("timeout")) {
            builder.defaultTimeout(timeout(table));
        }
        if (table.isBoolean("timestamp") && !table.getBoolean("timestamp")) {
            builder.withoutTimestamp();
        }
        return builder.build();
    }

    private static Duration timeout(TomlTable table) {
        if (table.isLong("timeout")) {
            return Duration.ofMillis(table.getLong("timeout"));
        }
        if (table.isString("timeout")) {
            return DurationParser.parse(table.getString("timeout"))
                .orElseThrow(() -> new IllegalArgumentException("'timeout' must not be blank"));
        }
        throw new IllegalArgumentException("'timeout' must be an integer or a duration string");
    }
}
