package work.flowscript.exporter.expr;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders Java values as Python source literals.
 */
public final class PythonLiterals {
    private PythonLiterals() {}

    public static String string(String value) {
        if (value == null) {
            return "\"\"";
        }
        var out = new StringBuilder(value.length() + 2).append('"');
        escapeInto(out, value, '"', false);
        return out.append('"').toString();
    }

    public static String bool(boolean value) {
        return value ? "True" : "False";
    }

    public static String value(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof String str) {
            return string(str);
        }
        if (value instanceof Boolean bool) {
            return bool(bool);
        }
        if (value instanceof Number number) {
            return number(number);
        }
        if (value instanceof Map<?, ?> map) {
            var joiner = new StringJoiner(", ", "{", "}");
            for (var entry : map.entrySet()) {
                joiner.add(string(String.valueOf(entry.getKey())) + ": " + value(entry.getValue()));
            }
            return joiner.toString();
        }
        if (value instanceof Collection<?> list) {
            var joiner = new StringJoiner(", ", "[", "]");
            for (var item : list) {
                joiner.add(value(item));
            }
            return joiner.toString();
        }
        return string(String.valueOf(value));
    }

    public static String number(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return "float(\"nan\")";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "float(\"inf\")" : "-float(\"inf\")";
            }
            return Double.toString(d);
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return number.toString();
    }

    /**
     * Body of a single-quoted f-string literal fragment: quotes escaped and braces doubled.
     */
    static String fStringFragment(String text) {
        var out = new StringBuilder(text.length());
        escapeInto(out, text, '\'', true);
        return out.toString();
    }

    private static void escapeInto(StringBuilder out, String value, char quote, boolean doubleBraces) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '{', '}' -> {
                    out.append(c);
                    if (doubleBraces) out.append(c);
                }
                default -> {
                    if (c == quote) {
                        out.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
    }
}
