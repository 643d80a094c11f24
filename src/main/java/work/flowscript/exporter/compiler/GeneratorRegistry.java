package work.flowscript.exporter.compiler;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch table from module type to generator. Unknown types resolve to {@link #FALLBACK}.
 */
public final class GeneratorRegistry {
    public static final String UNSUPPORTED_MARKER = "TODO: unsupported module type";

    /**
     * Emits a visible marker plus a no-op statement; never throws.
     */
    public static final NodeGenerator FALLBACK = (ctx, config, nodeId) -> {
        var node = ctx.graph().node(nodeId);
        var moduleType = node == null ? "" : node.moduleType();
        ctx.emitter().comment(UNSUPPORTED_MARKER + " \"" + moduleType + "\", implement manually");
        ctx.emitter().line("pass");
        ctx.report(ExportDiagnostic.info(
            ExportDiagnostic.UNSUPPORTED_MODULE,
            "No generator for module type '" + moduleType + "'",
            nodeId
        ));
    };

    private final Map<String, Entry> generators = new ConcurrentHashMap<>();

    public GeneratorRegistry register(String moduleType, NodeGenerator generator) {
        return register(moduleType, generator, null);
    }

    public GeneratorRegistry register(String moduleType, NodeGenerator generator, String description) {
        generators.put(moduleType, new Entry(moduleType, generator, description));
        return this;
    }

    public Entry get(String moduleType) {
        return moduleType == null ? null : generators.get(moduleType);
    }

    public boolean supports(String moduleType) {
        return get(moduleType) != null;
    }

    public NodeGenerator dispatch(String moduleType) {
        var entry = get(moduleType);
        return entry == null ? FALLBACK : entry.generator();
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(generators);
    }

    public record Entry(String moduleType, NodeGenerator generator, String description) {}
}
