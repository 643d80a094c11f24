package work.flowscript.exporter.compiler;

import java.util.Collections;
import java.util.Map;
import work.flowscript.exporter.expr.ExpressionResolver;

/**
 * Lenient accessors over a node's free-form configuration map. Missing or mistyped keys fall
 * back to the supplied default instead of failing.
 */
public final class NodeConfig {
    private final Map<String, Object> data;

    public NodeConfig(Map<String, Object> data) {
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(data);
    }

    public Object raw(String key) {
        return data.get(key);
    }

    public boolean has(String key) {
        Object value = data.get(key);
        return value != null && !String.valueOf(value).isBlank();
    }

    public String string(String key, String fallback) {
        Object value = data.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    public boolean bool(String key, boolean fallback) {
        Object value = data.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str) {
            var trimmed = str.trim();
            if ("true".equalsIgnoreCase(trimmed)) return true;
            if ("false".equalsIgnoreCase(trimmed)) return false;
        }
        return fallback;
    }

    public long number(String key, long fallback) {
        Object value = data.get(key);
        if (value instanceof Number num) {
            return num.longValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Long.parseLong(str.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public double decimal(String key, double fallback) {
        Object value = data.get(key);
        if (value instanceof Number num) {
            return num.doubleValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Double.parseDouble(str.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    /**
     * Python expression for a user-facing field, resolving {@code {name}} tokens.
     */
    public String expr(String key, Object fallback) {
        Object value = data.get(key);
        return ExpressionResolver.resolve(value == null ? fallback : value);
    }
}
