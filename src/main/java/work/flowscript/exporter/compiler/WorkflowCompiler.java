package work.flowscript.exporter.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowscript.exporter.api.ExportConfiguration;
import work.flowscript.exporter.emit.ScriptEmitter;
import work.flowscript.exporter.emit.ScriptSection;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.PythonLiterals;
import work.flowscript.exporter.flow.FlowGenerators;
import work.flowscript.exporter.graph.GraphIndex;
import work.flowscript.exporter.graph.SubflowExtractor;
import work.flowscript.exporter.graph.SubflowTable;
import work.flowscript.exporter.graph.Workflow;
import work.flowscript.exporter.graph.WorkflowVariable;

/**
 * Turns a workflow graph into one async Playwright script.
 *
 * <p>Stateless between calls: indices, the processed set, the emitter and diagnostics are created
 * per {@link #compile(Workflow)}, so one compiler may serve concurrent callers.
 */
public final class WorkflowCompiler {
    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String GLOBALS = "global variables, page, context, browser";

    private final GeneratorRegistry registry;
    private final ExportConfiguration configuration;

    public WorkflowCompiler() {
        this(DefaultGenerators.create(), ExportConfiguration.defaults());
    }

    public WorkflowCompiler(GeneratorRegistry registry, ExportConfiguration configuration) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public GeneratorRegistry registry() {
        return registry;
    }

    public CompiledScript compile(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow");
        log.debug("Compiling '{}' ({} nodes, {} edges)", workflow.name(), workflow.nodes().size(), workflow.edges().size());
        var graph = GraphIndex.build(workflow);
        var subflows = SubflowExtractor.extract(graph);
        var emitter = new ScriptEmitter(configuration.indentUnit());
        var ctx = new ExportContext(graph, subflows, registry, emitter, configuration);
        reportStructure(ctx, graph, subflows);

        emitHeader(emitter, workflow.name());
        emitVariables(emitter, workflow.variables());
        emitSubflows(ctx, subflows);
        emitMain(ctx, subflows.mainFlow(graph));
        emitEntryPoint(emitter);

        var script = new CompiledScript(emitter.render(), workflow.scriptFileName(), ctx.diagnostics());
        log.debug("Compiled '{}' with {} diagnostic(s)", workflow.name(), script.diagnostics().size());
        return script;
    }

    private void reportStructure(ExportContext ctx, GraphIndex graph, SubflowTable subflows) {
        for (var edge : graph.droppedEdges()) {
            ctx.report(ExportDiagnostic.info(
                ExportDiagnostic.DANGLING_EDGE,
                "Edge " + edge.id() + " references a missing node and was dropped",
                null
            ));
        }
        for (var name : subflows.duplicateNames()) {
            ctx.report(ExportDiagnostic.warn(
                ExportDiagnostic.DUPLICATE_SUBFLOW,
                "Subflow '" + name + "' is declared more than once; the last declaration is used",
                subflows.get(name).groupId()
            ));
        }
        var byFunction = new HashMap<String, String>();
        for (var subflow : subflows.all()) {
            var previous = byFunction.putIfAbsent(FlowGenerators.functionName(subflow.name()), subflow.name());
            if (previous != null) {
                ctx.report(ExportDiagnostic.warn(
                    ExportDiagnostic.SUBFLOW_NAME_COLLISION,
                    "Subflows '" + previous + "' and '" + subflow.name() + "' map to the same function name",
                    subflow.groupId()
                ));
            }
        }
    }

    private void emitHeader(ScriptEmitter emitter, String workflowName) {
        emitter.section(ScriptSection.HEADER);
        emitter.line("\"\"\"");
        emitter.line("Playwright automation script: " + docstringText(workflowName));
        configuration.timestampClock().ifPresent(clock ->
            emitter.line("Generated on " + LocalDateTime.now(clock).format(TIMESTAMP)));
        emitter.blank();
        emitter.line("Usage:");
        emitter.line("1. Install dependencies: pip install playwright");
        emitter.line("2. Install the browser: playwright install " + configuration.browser());
        emitter.line("3. Run: python this_script.py");
        emitter.blank();
        emitter.line("Notes:");
        emitter.line("- Modules marked TODO have no generated equivalent and must be implemented by hand");
        emitter.line("- Parallel branches of the workflow run sequentially here");
        emitter.line("\"\"\"");
        emitter.blank();
        for (var module : List.of("asyncio", "base64", "getpass", "json", "os", "random", "re", "shutil", "subprocess", "time", "traceback")) {
            emitter.line("import " + module);
        }
        emitter.line("from datetime import datetime");
        emitter.line("from pathlib import Path");
        emitter.line("from typing import Any, Optional");
        emitter.line("from playwright.async_api import async_playwright, Page, BrowserContext, Browser");
        emitter.blank();
        emitter.blank();
        emitter.comment("Global state shared by every generated routine");
        emitter.line("variables: dict = {}");
        emitter.line("page: Optional[Page] = None");
        emitter.line("context: Optional[BrowserContext] = None");
        emitter.line("browser: Optional[Browser] = None");
        emitter.blank();
        emitter.blank();
    }

    private void emitVariables(ScriptEmitter emitter, List<WorkflowVariable> variables) {
        emitter.section(ScriptSection.VARIABLES);
        emitter.block("def init_variables():", () -> {
            emitter.line("\"\"\"Initialise workflow variables.\"\"\"");
            emitter.line("global variables");
            for (var variable : variables) {
                if (variable.name().isBlank()) continue;
                emitter.line(ExpressionResolver.slot(variable.name()) + " = " + initialValue(variable));
            }
        });
        emitter.blank();
        emitter.blank();
    }

    /**
     * Python literal for a declared variable, converted to its declared type the way the editor does.
     */
    static String initialValue(WorkflowVariable variable) {
        var value = variable.value();
        return switch (variable.type()) {
            case NUMBER -> numberLiteral(value);
            case BOOLEAN -> PythonLiterals.bool(value != null
                && List.of("true", "1", "yes").contains(String.valueOf(value).trim().toLowerCase(Locale.ROOT)));
            case ARRAY -> structuredLiteral(value, List.class, "[]");
            case OBJECT -> structuredLiteral(value, Map.class, "{}");
            case STRING -> value == null ? "\"\"" : PythonLiterals.value(value);
        };
    }

    private static String numberLiteral(Object value) {
        if (value instanceof Number number) {
            return PythonLiterals.number(number);
        }
        var text = value == null ? "" : String.valueOf(value).trim();
        try {
            return text.contains(".") ? PythonLiterals.number(Double.parseDouble(text)) : Long.toString(Long.parseLong(text));
        } catch (NumberFormatException ex) {
            return "0";
        }
    }

    private static String structuredLiteral(Object value, Class<?> kind, String empty) {
        var parsed = value;
        if (value instanceof String text) {
            try {
                parsed = JSON.readValue(text, Object.class);
            } catch (JsonProcessingException ex) {
                log.debug("Variable value is not valid JSON, using {}", empty);
                return empty;
            }
        }
        return kind.isInstance(parsed) ? PythonLiterals.value(parsed) : empty;
    }

    private void emitSubflows(ExportContext ctx, SubflowTable subflows) {
        var emitter = ctx.emitter();
        emitter.section(ScriptSection.SUBFLOWS);
        for (var subflow : subflows.all()) {
            emitter.block("async def " + FlowGenerators.functionName(subflow.name()) + "():", () -> {
                emitter.line("\"\"\"Subflow: " + docstringText(subflow.name()) + "\"\"\"");
                emitter.line(GLOBALS);
                ctx.generateProcedure(subflow.memberIds());
            });
            emitter.blank();
            emitter.blank();
        }
    }

    private void emitMain(ExportContext ctx, List<String> mainFlow) {
        var emitter = ctx.emitter();
        emitter.section(ScriptSection.MAIN);
        emitter.block("async def run_workflow():", () -> {
            emitter.line("\"\"\"Run the workflow.\"\"\"");
            emitter.line(GLOBALS);
            emitter.blank();
            emitter.block("async with async_playwright() as p:", () -> {
                emitter.line("browser = await p." + configuration.browser() + ".launch(headless="
                    + PythonLiterals.bool(configuration.headless()) + ")");
                emitter.line("context = await browser.new_context()");
                emitter.line("context.set_default_timeout(" + configuration.defaultTimeout().toMillis() + ")");
                emitter.line("page = await context.new_page()");
                emitter.blank();
                emitter.block("try:", () -> {
                    ctx.generateProcedure(mainFlow);
                    emitter.blank();
                    emitter.line("print(\"Workflow finished\")");
                });
                emitter.block("except Exception as e:", () -> {
                    emitter.line("print(f\"Workflow failed: {e}\")");
                    emitter.line("traceback.print_exc()");
                    emitter.line("raise");
                });
                emitter.block("finally:", () -> {
                    emitter.line("await context.close()");
                    emitter.line("await browser.close()");
                });
            });
        });
        emitter.blank();
    }

    private void emitEntryPoint(ScriptEmitter emitter) {
        emitter.section(ScriptSection.ENTRY_POINT);
        emitter.blank();
        emitter.block("if __name__ == \"__main__\":", () -> {
            emitter.line("init_variables()");
            emitter.line("asyncio.run(run_workflow())");
        });
    }

    private static String docstringText(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\r", " ").replace("\n", " ");
    }
}
