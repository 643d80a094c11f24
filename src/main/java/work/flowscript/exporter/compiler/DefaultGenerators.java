package work.flowscript.exporter.compiler;

import work.flowscript.exporter.core.DataGenerators;
import work.flowscript.exporter.core.FileGenerators;
import work.flowscript.exporter.core.PageGenerators;
import work.flowscript.exporter.core.SystemGenerators;
import work.flowscript.exporter.core.TableGenerators;
import work.flowscript.exporter.flow.FlowGenerators;

/**
 * Shared registry bootstrap so the CLI, the embedding API and tests use the same generator set.
 */
public final class DefaultGenerators {
    private DefaultGenerators() {}

    public static GeneratorRegistry create() {
        var registry = new GeneratorRegistry();
        FlowGenerators.register(registry);
        PageGenerators.register(registry);
        DataGenerators.register(registry);
        TableGenerators.register(registry);
        FileGenerators.register(registry);
        SystemGenerators.register(registry);
        return registry;
    }
}
