package work.flowscript.exporter.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowscript.exporter.api.ExportConfiguration;
import work.flowscript.exporter.emit.ScriptEmitter;
import work.flowscript.exporter.graph.GraphIndex;
import work.flowscript.exporter.graph.ScopeCollector;
import work.flowscript.exporter.graph.SubflowExtractor;
import work.flowscript.exporter.graph.SubflowTable;
import work.flowscript.exporter.graph.TopologicalScheduler;

/**
 * State of a single compilation, passed to every generator. Owns the processed-node set, so it
 * must never be shared between compilations.
 */
public final class ExportContext {
    private static final Logger log = LoggerFactory.getLogger(ExportContext.class);

    private final GraphIndex graph;
    private final SubflowTable subflows;
    private final GeneratorRegistry registry;
    private final ScriptEmitter emitter;
    private final ExportConfiguration configuration;
    private final Set<String> processed = new HashSet<>();
    private final Deque<Set<String>> bounds = new ArrayDeque<>();
    private final List<ExportDiagnostic> diagnostics = new ArrayList<>();
    private final TopologicalScheduler scheduler;
    private final ScopeCollector scopes;
    private int loopDepth;

    public ExportContext(
        GraphIndex graph,
        SubflowTable subflows,
        GeneratorRegistry registry,
        ScriptEmitter emitter,
        ExportConfiguration configuration
    ) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.subflows = Objects.requireNonNull(subflows, "subflows");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.scheduler = new TopologicalScheduler(graph);
        this.scopes = new ScopeCollector(graph, processed);
    }

    public GraphIndex graph() {
        return graph;
    }

    public SubflowTable subflows() {
        return subflows;
    }

    public ScriptEmitter emitter() {
        return emitter;
    }

    public ExportConfiguration configuration() {
        return configuration;
    }

    public void report(ExportDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.severity() == ExportDiagnostic.Severity.WARN) {
            log.warn("[{}] {}", diagnostic.code(), diagnostic.message());
        } else {
            log.debug("[{}] {}", diagnostic.code(), diagnostic.message());
        }
    }

    public List<ExportDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Generates a whole procedure body: the given nodes in topological order. Control nodes
     * only collect regions inside this node set.
     */
    public void generateProcedure(Collection<String> nodeIds) {
        var members = new LinkedHashSet<String>(nodeIds);
        int previousLoopDepth = loopDepth;
        loopDepth = 0;
        bounds.push(members);
        try {
            generateOrdered(members);
        } finally {
            bounds.pop();
            loopDepth = previousLoopDepth;
        }
    }

    /**
     * Region of one branch or loop body, limited to the enclosing region. Compute every sibling
     * region before generating any of them: generation grows the processed set.
     */
    public Set<String> collectScope(List<String> frontier, List<String> excluded) {
        return scopes.collect(frontier, excluded, bounds.peek());
    }

    /**
     * Generates a collected region in local topological order and marks all of it processed.
     */
    public void generateScope(Set<String> region) {
        bounds.push(region);
        try {
            generateOrdered(region);
        } finally {
            bounds.pop();
            processed.addAll(region);
        }
    }

    /**
     * Runs {@code body} with loop-control statements ({@code break}/{@code continue}) allowed.
     */
    public void withinLoop(Runnable body) {
        loopDepth++;
        try {
            body.run();
        } finally {
            loopDepth--;
        }
    }

    public boolean inLoop() {
        return loopDepth > 0;
    }

    /**
     * Emits one node: group marker, or header comment plus the dispatched generator's output.
     * A node is marked processed before its generator runs, so recursion cannot re-enter it.
     */
    public void generate(String nodeId) {
        if (nodeId == null || !processed.add(nodeId)) {
            return;
        }
        var node = graph.node(nodeId);
        if (node == null) {
            return;
        }
        if (node.isGroup()) {
            if (SubflowExtractor.isSubflowGroup(node)) {
                emitter.comment("Subflow definition: " + node.label() + " (generated as a separate function)");
            } else {
                emitter.comment("Group: " + node.label());
            }
            return;
        }
        emitter.blank();
        emitter.comment("Node: " + node.label());
        var generator = registry.dispatch(node.moduleType());
        try {
            generator.generate(this, new NodeConfig(node.data()), nodeId);
        } catch (RuntimeException ex) {
            emitter.comment("ERROR: could not generate \"" + node.moduleType() + "\": " + ex.getMessage());
            emitter.line("pass");
            report(ExportDiagnostic.warn(
                ExportDiagnostic.GENERATOR_FAILURE,
                "Generator for '" + node.moduleType() + "' failed: " + ex.getMessage(),
                nodeId
            ));
            log.debug("Generator failure for node {}", nodeId, ex);
        }
    }

    private void generateOrdered(Collection<String> nodeIds) {
        var schedule = scheduler.schedule(nodeIds);
        if (schedule.hasResidue()) {
            report(ExportDiagnostic.warn(
                ExportDiagnostic.CYCLIC_RESIDUE,
                "Nodes on a cycle were appended in document order: " + schedule.residue(),
                null
            ));
        }
        for (var id : schedule.order()) {
            generate(id);
        }
    }
}
