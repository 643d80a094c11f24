package work.flowscript.exporter.emit;

/**
 * Fixed order of the generated script's parts.
 */
public enum ScriptSection {
    HEADER,
    VARIABLES,
    SUBFLOWS,
    MAIN,
    ENTRY_POINT
}
