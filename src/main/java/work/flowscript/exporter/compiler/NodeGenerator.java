package work.flowscript.exporter.compiler;

/**
 * Code-generation routine for one module type.
 */
@FunctionalInterface
public interface NodeGenerator {
    void generate(ExportContext ctx, NodeConfig config, String nodeId);
}
