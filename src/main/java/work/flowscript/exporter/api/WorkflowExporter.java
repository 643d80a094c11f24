package work.flowscript.exporter.api;

import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowscript.exporter.compiler.DefaultGenerators;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.WorkflowCompiler;
import work.flowscript.exporter.graph.Workflow;

/**
 * Public entry point for embedding the exporter.
 */
public final class WorkflowExporter {
    private static final Logger log = LoggerFactory.getLogger(WorkflowExporter.class);

    private final WorkflowCompiler compiler;

    public WorkflowExporter() {
        this(ExportConfiguration.defaults());
    }

    public WorkflowExporter(ExportConfiguration configuration) {
        this(DefaultGenerators.create(), configuration);
    }

    public WorkflowExporter(GeneratorRegistry registry, ExportConfiguration configuration) {
        this.compiler = new WorkflowCompiler(registry, configuration);
    }

    /**
     * Compiles an in-memory workflow. Compilation itself degrades instead of failing, so this
     * always succeeds.
     */
    public ExportResult export(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow");
        var started = Instant.now();
        return ExportResult.success(workflow.name(), compiler.compile(workflow), started);
    }

    /**
     * Loads then compiles; loading problems come back as a failed result.
     */
    public ExportResult export(WorkflowSource source) {
        Objects.requireNonNull(source, "source");
        var started = Instant.now();
        try {
            var workflow = WorkflowLoader.load(source);
            return ExportResult.success(source.display(), compiler.compile(workflow), started);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.warn("Could not export {}: {}", source.display(), ex.getMessage());
            log.debug("Export failure", ex);
            return ExportResult.failure(source.display(), ex.getMessage(), started);
        }
    }

    public GeneratorRegistry registry() {
        return compiler.registry();
    }
}
