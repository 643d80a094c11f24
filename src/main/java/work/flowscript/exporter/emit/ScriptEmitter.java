package work.flowscript.exporter.emit;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Indentation-aware line buffer. Lines go to the current {@link ScriptSection}; {@link #render()}
 * joins the sections in enum order regardless of the order they were written in.
 */
public final class ScriptEmitter {
    public static final String DEFAULT_INDENT = "    ";

    private final String indentUnit;
    private final Map<ScriptSection, List<String>> sections = new EnumMap<>(ScriptSection.class);
    private ScriptSection current = ScriptSection.HEADER;
    private int indentLevel;

    public ScriptEmitter() {
        this(DEFAULT_INDENT);
    }

    public ScriptEmitter(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
        for (var section : ScriptSection.values()) {
            sections.put(section, new ArrayList<>());
        }
    }

    /**
     * Switches the target section; indentation restarts at zero.
     */
    public ScriptEmitter section(ScriptSection section) {
        this.current = Objects.requireNonNull(section, "section");
        this.indentLevel = 0;
        return this;
    }

    public ScriptEmitter line(String text) {
        if (text == null || text.isEmpty()) {
            return blank();
        }
        sections.get(current).add(indentUnit.repeat(indentLevel) + text);
        return this;
    }

    public ScriptEmitter blank() {
        sections.get(current).add("");
        return this;
    }

    /**
     * Single-line comment; embedded line breaks are folded into spaces.
     */
    public ScriptEmitter comment(String text) {
        var flat = text == null ? "" : text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        return line("# " + flat);
    }

    public void withIndent(Runnable body) {
        indentLevel++;
        try {
            body.run();
        } finally {
            indentLevel--;
        }
    }

    /**
     * Writes {@code header} and an indented body; a body that produced no statement gets {@code pass}.
     */
    public void block(String header, Runnable body) {
        line(header);
        withIndent(() -> {
            int mark = mark();
            try {
                body.run();
            } finally {
                if (!hasStatementSince(mark)) {
                    line("pass");
                }
            }
        });
    }

    public int indentLevel() {
        return indentLevel;
    }

    /**
     * Position in the current section, usable with {@link #hasStatementSince(int)}.
     */
    public int mark() {
        return sections.get(current).size();
    }

    /**
     * Whether any non-blank, non-comment line was written to the current section after {@code mark}.
     */
    public boolean hasStatementSince(int mark) {
        var lines = sections.get(current);
        for (int i = mark; i < lines.size(); i++) {
            var trimmed = lines.get(i).strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return true;
            }
        }
        return false;
    }

    public List<String> lines(ScriptSection section) {
        return List.copyOf(sections.get(section));
    }

    public String render() {
        var all = new ArrayList<String>();
        for (var section : ScriptSection.values()) {
            all.addAll(sections.get(section));
        }
        return String.join("\n", all) + "\n";
    }
}
