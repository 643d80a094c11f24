package work.flowscript.exporter.flow;

import java.util.List;
import java.util.Map;
import work.flowscript.exporter.compiler.ExportContext;
import work.flowscript.exporter.compiler.ExportDiagnostic;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.NodeConfig;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.IdentifierSanitizer;

/**
 * Control-flow generators. These are the only generators that recurse into regions of the graph.
 */
public final class FlowGenerators {
    public static final String[] TRUE_HANDLES = {"true", "condition-true"};
    public static final String[] FALSE_HANDLES = {"false", "condition-false"};
    public static final String[] BODY_HANDLES = {"loop", "loop-body"};
    public static final String[] DONE_HANDLES = {"done", "loop-done"};

    private static final Map<String, String> COMPARISONS = Map.of(
        "equals", "==",
        "not_equals", "!=",
        "greater", ">",
        "less", "<",
        "greater_equal", ">=",
        "less_equal", "<="
    );

    private FlowGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register("condition", FlowGenerators::condition, "if/else over a variable comparison or expression");
        registry.register("loop", FlowGenerators::loop, "count, range or while loop");
        registry.register("foreach", FlowGenerators::foreach, "iterate over a list variable");
        registry.register("break_loop", FlowGenerators::breakLoop, "leave the enclosing loop");
        registry.register("continue_loop", FlowGenerators::continueLoop, "skip to the next iteration");
        registry.register("subflow", FlowGenerators::subflow, "call a named sub-procedure");
        return registry;
    }

    private static void condition(ExportContext ctx, NodeConfig config, String nodeId) {
        var graph = ctx.graph();
        var emitter = ctx.emitter();
        var trueTargets = graph.firstTargets(nodeId, TRUE_HANDLES);
        var falseTargets = graph.firstTargets(nodeId, FALSE_HANDLES);
        // both regions must be known before either is generated
        var trueScope = ctx.collectScope(trueTargets, falseTargets);
        var falseScope = ctx.collectScope(falseTargets, trueTargets);

        emitter.block("if " + conditionExpression(config) + ":", () -> ctx.generateScope(trueScope));
        if (!falseScope.isEmpty()) {
            emitter.block("else:", () -> ctx.generateScope(falseScope));
        }
    }

    static String conditionExpression(NodeConfig config) {
        if ("expression".equals(config.string("conditionMode", "variable"))) {
            // a line break would end the if header early
            var expression = config.string("expression", "").replaceAll("\\s*[\\r\\n]+\\s*", " ").strip();
            return expression.isEmpty() ? "True" : ExpressionResolver.code(expression);
        }
        var variable = ExpressionResolver.lookup(config.string("variableName", ""));
        var compare = config.expr("compareValue", "");
        var operator = config.string("operator", "equals");
        return switch (operator) {
            case "is_empty" -> "str(" + variable + ") == \"\"";
            case "is_not_empty" -> "str(" + variable + ") != \"\"";
            case "is_true" -> "bool(" + variable + ")";
            case "is_false" -> "not bool(" + variable + ")";
            case "contains" -> "str(" + compare + ") in str(" + variable + ")";
            case "not_contains" -> "str(" + compare + ") not in str(" + variable + ")";
            case "starts_with" -> "str(" + variable + ").startswith(str(" + compare + "))";
            case "ends_with" -> "str(" + variable + ").endswith(str(" + compare + "))";
            case "greater", "less", "greater_equal", "less_equal" ->
                "float(" + variable + " or 0) " + COMPARISONS.get(operator) + " float(" + compare + " or 0)";
            default -> "str(" + variable + ") " + COMPARISONS.getOrDefault(operator, "==") + " str(" + compare + ")";
        };
    }

    private static void loop(ExportContext ctx, NodeConfig config, String nodeId) {
        var mode = config.string("loopMode", "count");
        var indexVariable = config.string("indexVariable", "loop_index");
        var indexName = IdentifierSanitizer.local(indexVariable);
        var header = switch (mode) {
            case "range" -> "for " + indexName + " in range(int(" + config.expr("startValue", 0) + "), int("
                + config.expr("endValue", 10) + ") + 1, int(" + config.expr("stepValue", 1) + ")):";
            case "while" -> "while " + ExpressionResolver.lookup(config.string("conditionVariable", ""), "False") + ":";
            default -> "for " + indexName + " in range(int(" + config.expr("loopCount", 1) + ")):";
        };
        var counted = !"while".equals(mode);
        generateLoop(ctx, nodeId, header, () -> {
            if (counted) {
                ctx.emitter().line(ExpressionResolver.slot(indexVariable) + " = " + indexName);
            }
        });
    }

    private static void foreach(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var itemVariable = config.string("itemVariable", "item");
        var indexVariable = config.string("indexVariable", "index");
        var itemName = IdentifierSanitizer.local(itemVariable);
        var indexName = IdentifierSanitizer.local(indexVariable);
        emitter.line("_foreach_list = " + ExpressionResolver.lookup(config.string("sourceVariable", ""), "[]"));
        emitter.block("if not isinstance(_foreach_list, list):", () -> emitter.line("_foreach_list = [_foreach_list]"));
        var header = "for " + indexName + ", " + itemName + " in enumerate(_foreach_list):";
        generateLoop(ctx, nodeId, header, () -> {
            emitter.line(ExpressionResolver.slot(itemVariable) + " = " + itemName);
            emitter.line(ExpressionResolver.slot(indexVariable) + " = " + indexName);
        });
    }

    /**
     * Loop body is the region behind the body handle, minus anything reachable through the exit
     * handle. Exit targets are left to the enclosing schedule.
     */
    private static void generateLoop(ExportContext ctx, String nodeId, String header, Runnable prologue) {
        var graph = ctx.graph();
        List<String> bodyTargets = graph.firstTargets(nodeId, BODY_HANDLES);
        List<String> doneTargets = graph.firstTargets(nodeId, DONE_HANDLES);
        var body = ctx.collectScope(bodyTargets, doneTargets);
        ctx.emitter().block(header, () -> {
            prologue.run();
            ctx.withinLoop(() -> ctx.generateScope(body));
        });
    }

    private static void breakLoop(ExportContext ctx, NodeConfig config, String nodeId) {
        loopControl(ctx, nodeId, "break");
    }

    private static void continueLoop(ExportContext ctx, NodeConfig config, String nodeId) {
        loopControl(ctx, nodeId, "continue");
    }

    private static void loopControl(ExportContext ctx, String nodeId, String statement) {
        if (ctx.inLoop()) {
            ctx.emitter().line(statement);
            return;
        }
        ctx.emitter().comment("WARNING: \"" + statement + "\" outside of a loop was skipped");
        ctx.emitter().line("pass");
        ctx.report(ExportDiagnostic.warn(
            ExportDiagnostic.LOOP_CONTROL_OUTSIDE_LOOP,
            "'" + statement + "' is not inside a loop body",
            nodeId
        ));
    }

    private static void subflow(ExportContext ctx, NodeConfig config, String nodeId) {
        var name = config.string("subflowName", "");
        if (!name.isEmpty() && ctx.subflows().contains(name)) {
            ctx.emitter().line("await " + functionName(name) + "()");
            return;
        }
        ctx.emitter().comment("WARNING: subflow \"" + name + "\" not found");
        ctx.emitter().line("pass");
        ctx.report(ExportDiagnostic.warn(
            ExportDiagnostic.MISSING_SUBFLOW,
            "Subflow '" + name + "' is not defined in this workflow",
            nodeId
        ));
    }

    /**
     * Name of the generated function backing a sub-procedure.
     */
    public static String functionName(String subflowName) {
        return "subflow_" + IdentifierSanitizer.function(subflowName);
    }
}
