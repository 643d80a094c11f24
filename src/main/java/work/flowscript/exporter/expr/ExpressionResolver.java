package work.flowscript.exporter.expr;

/**
 * Rewrites configuration values into Python expressions over the generated {@code variables} store.
 *
 * <ul>
 *   <li>no token: a literal</li>
 *   <li>exactly one token: {@code variables.get("name", "")}</li>
 *   <li>tokens mixed with text: an f-string with one lookup per token</li>
 * </ul>
 */
public final class ExpressionResolver {
    public static final String STORE = "variables";

    private ExpressionResolver() {}

    public static String resolve(Object value) {
        if (value == null) {
            return "\"\"";
        }
        if (!(value instanceof String str)) {
            return PythonLiterals.value(value);
        }
        return render(TemplateParser.parse(str));
    }

    public static String render(TemplateExpr expr) {
        if (expr instanceof TemplateExpr.Literal literal) {
            return PythonLiterals.string(literal.text());
        }
        if (expr instanceof TemplateExpr.Lookup lookup) {
            return lookupKey(lookup.key());
        }
        var concat = (TemplateExpr.Concat) expr;
        var out = new StringBuilder("f'");
        for (var part : concat.parts()) {
            if (part instanceof TemplateExpr.Lookup lookup) {
                out.append('{').append(lookupKey(lookup.key())).append('}');
            } else if (part instanceof TemplateExpr.Literal literal) {
                out.append(PythonLiterals.fStringFragment(literal.text()));
            }
        }
        return out.append('\'').toString();
    }

    /**
     * Treats {@code code} as Python source and replaces each token with a lookup.
     */
    public static String code(String code) {
        var expr = TemplateParser.parse(code);
        if (expr instanceof TemplateExpr.Literal literal) {
            return literal.text();
        }
        if (expr instanceof TemplateExpr.Lookup lookup) {
            return lookupKey(lookup.key());
        }
        var out = new StringBuilder();
        for (var part : ((TemplateExpr.Concat) expr).parts()) {
            if (part instanceof TemplateExpr.Lookup lookup) {
                out.append(lookupKey(lookup.key()));
            } else if (part instanceof TemplateExpr.Literal literal) {
                out.append(literal.text());
            }
        }
        return out.toString();
    }

    /**
     * Lookup of a user-named variable with an empty-string default.
     */
    public static String lookup(String rawName) {
        return lookupKey(key(rawName));
    }

    public static String lookup(String rawName, String defaultExpression) {
        return STORE + ".get(\"" + key(rawName) + "\", " + defaultExpression + ")";
    }

    /**
     * Assignment target for a user-named variable.
     */
    public static String slot(String rawName) {
        return STORE + "[\"" + key(rawName) + "\"]";
    }

    public static String key(String rawName) {
        return IdentifierSanitizer.variable(rawName);
    }

    private static String lookupKey(String key) {
        return STORE + ".get(\"" + key + "\", \"\")";
    }
}
