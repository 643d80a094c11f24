package work.flowscript.exporter.cli;

import picocli.CommandLine;

/**
 * Reports the innermost cause of a failed export as one line. Stack traces only with
 * {@code -Dflowscript.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "flowscript.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText("flowscript-export: " + describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        } else {
            err.println("(rerun with -D" + DEBUG_PROPERTY + "=true for the stack trace)");
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        var outer = ex.getMessage();
        var inner = root.getMessage();
        if (inner == null || inner.isBlank()) {
            return outer == null || outer.isBlank() ? root.getClass().getSimpleName() : outer;
        }
        if (root == ex || outer == null || outer.isBlank()) {
            return inner;
        }
        return outer.contains(inner) ? outer : outer + ": " + inner;
    }
}
