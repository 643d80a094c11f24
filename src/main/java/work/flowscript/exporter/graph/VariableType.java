package work.flowscript.exporter.graph;

import java.util.Locale;

/**
 * Declared type of a workflow variable.
 */
public enum VariableType {
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    public static VariableType from(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        try {
            return VariableType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported variable type: " + value);
        }
    }
}
