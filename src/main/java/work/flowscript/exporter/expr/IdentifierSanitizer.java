package work.flowscript.exporter.expr;

import java.text.Normalizer;
import java.util.Set;

/**
 * Turns user-chosen names into identifiers that are valid in the generated Python script.
 * Every operation is deterministic and idempotent.
 */
public final class IdentifierSanitizer {
    public static final String FALLBACK_VARIABLE = "unnamed_var";
    public static final String FALLBACK_FUNCTION = "unnamed_subflow";
    static final String VARIABLE_PREFIX = "var_";
    static final String FUNCTION_PREFIX = "subflow_";
    /**
     * Reserved for generated locals; user-named values never use the prefix.
     */
    public static final String LOCAL_PREFIX = "_v_";

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
        "try", "while", "with", "yield"
    );

    private IdentifierSanitizer() {}

    /**
     * Variable names keep ASCII letters, digits, underscores and those Unicode letters Python
     * accepts in identifiers. Input is NFKC-normalized first, as Python does with identifiers.
     */
    public static String variable(String raw) {
        if (raw == null || raw.isEmpty()) {
            return FALLBACK_VARIABLE;
        }
        var normalized = Normalizer.normalize(raw, Normalizer.Form.NFKC);
        var out = new StringBuilder(normalized.length());
        normalized.codePoints().forEach(cp -> {
            if (isAsciiWordChar(cp) || isIdentifierLetter(cp)) {
                out.appendCodePoint(cp);
            } else {
                out.append('_');
            }
        });
        var sanitized = out.toString();
        if (Character.isDigit(sanitized.charAt(0)) || PYTHON_KEYWORDS.contains(sanitized)) {
            sanitized = VARIABLE_PREFIX + sanitized;
        }
        return sanitized;
    }

    /**
     * Function-name fragments are restricted to ASCII.
     */
    public static String function(String raw) {
        if (raw == null || raw.isEmpty()) {
            return FALLBACK_FUNCTION;
        }
        var out = new StringBuilder(raw.length());
        raw.codePoints().forEach(cp -> out.append(isAsciiWordChar(cp) ? (char) cp : '_'));
        var sanitized = out.toString();
        if (Character.isDigit(sanitized.charAt(0))) {
            sanitized = FUNCTION_PREFIX + sanitized;
        }
        return sanitized;
    }

    /**
     * Name for a Python local holding a user-named value. The reserved prefix keeps it clear of
     * the script globals, builtins and keywords; the rest is ASCII.
     */
    public static String local(String raw) {
        if (raw == null || raw.isEmpty()) {
            return LOCAL_PREFIX + FALLBACK_VARIABLE;
        }
        var out = new StringBuilder(LOCAL_PREFIX);
        raw.codePoints().forEach(cp -> {
            if (isAsciiWordChar(cp)) {
                out.append((char) cp);
            } else if (Character.isLetterOrDigit(cp)) {
                out.append('u').append(Integer.toHexString(cp));
            } else {
                out.append('_');
            }
        });
        return out.toString();
    }

    public static boolean isIdentifier(String candidate) {
        if (candidate == null || candidate.isEmpty() || PYTHON_KEYWORDS.contains(candidate)) {
            return false;
        }
        if (!Normalizer.isNormalized(candidate, Normalizer.Form.NFKC)) {
            return false;
        }
        int first = candidate.codePointAt(0);
        if (!(first == '_' || (first < 0x80 ? Character.isLetter(first) : isIdentifierLetter(first)))) {
            return false;
        }
        return candidate.codePoints().allMatch(cp -> isAsciiWordChar(cp) || isIdentifierLetter(cp));
    }

    /**
     * Non-ASCII letter that is a valid identifier start and survives NFKC on its own. Rejects
     * compatibility characters such as U+037A that Python would rewrite.
     */
    private static boolean isIdentifierLetter(int cp) {
        // U+2E2F is a letter but Pattern_Syntax, so never an identifier start
        if (cp < 0x80 || cp == 0x2E2F || !Character.isLetter(cp) || !Character.isUnicodeIdentifierStart(cp)) {
            return false;
        }
        return Normalizer.isNormalized(new String(Character.toChars(cp)), Normalizer.Form.NFKC);
    }

    private static boolean isAsciiWordChar(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || (cp >= '0' && cp <= '9') || cp == '_';
    }
}
