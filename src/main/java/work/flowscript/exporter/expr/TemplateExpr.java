package work.flowscript.exporter.expr;

import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a configuration string: literal text, a variable lookup, or a concatenation.
 */
public interface TemplateExpr {
    record Literal(String text) implements TemplateExpr {
        public Literal {
            text = text == null ? "" : text;
        }
    }

    /**
     * @param rawName the name as written between braces
     * @param key the sanitized key used in the generated variable store
     */
    record Lookup(String rawName, String key) implements TemplateExpr {
        public Lookup {
            Objects.requireNonNull(rawName, "rawName");
            Objects.requireNonNull(key, "key");
        }
    }

    record Concat(List<TemplateExpr> parts) implements TemplateExpr {
        public Concat {
            parts = List.copyOf(parts);
        }
    }
}
