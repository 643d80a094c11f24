package work.flowscript.exporter.core;

import work.flowscript.exporter.compiler.ExportContext;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.NodeConfig;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.PythonLiterals;

/**
 * Local file system modules, emitted with {@code pathlib}, {@code open} and {@code shutil}.
 */
public final class FileGenerators {
    private static final String DEFAULT_ENCODING = "utf-8";

    private FileGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register("read_text_file", FileGenerators::readTextFile, "read a whole text file");
        registry.register("write_text_file", FileGenerators::writeTextFile, "write or append text");
        registry.register("file_exists", FileGenerators::fileExists, "whether a path exists");
        registry.register("create_folder", FileGenerators::createFolder, "mkdir with parents");
        registry.register("delete_file", FileGenerators::deleteFile, "remove a file if present");
        registry.register("copy_file", FileGenerators::copyFile, "copy with metadata");
        registry.register("move_file", FileGenerators::moveFile, "move or rename across folders");
        registry.register("rename_file", FileGenerators::rename, "rename inside the same folder");
        registry.register("rename_folder", FileGenerators::rename, "rename inside the same folder");
        registry.register("list_files", FileGenerators::listFiles, "glob a folder");
        registry.register("get_file_info", FileGenerators::getFileInfo, "name, size and kind of a path");
        registry.register("list_export", FileGenerators::listExport, "write a list to a text file");
        return registry;
    }

    private static void readTextFile(ExportContext ctx, NodeConfig config, String nodeId) {
        var open = "with open(" + config.expr("filePath", "") + ", \"r\", encoding=" + encoding(config) + ") as _f:";
        ctx.emitter().block(open, () -> {
            if (config.has("variableName")) {
                ctx.emitter().line(ExpressionResolver.slot(config.string("variableName", "")) + " = _f.read()");
            } else {
                ctx.emitter().line("_f.read()");
            }
        });
    }

    private static void writeTextFile(ExportContext ctx, NodeConfig config, String nodeId) {
        var mode = config.bool("append", false) ? "\"a\"" : "\"w\"";
        var open = "with open(" + config.expr("filePath", "") + ", " + mode + ", encoding=" + encoding(config) + ") as _f:";
        ctx.emitter().block(open, () -> ctx.emitter().line("_f.write(str(" + config.expr("content", "") + "))"));
    }

    private static void fileExists(ExportContext ctx, NodeConfig config, String nodeId) {
        assign(ctx, config, "Path(" + config.expr("filePath", "") + ").exists()");
    }

    private static void createFolder(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("Path(" + config.expr("folderPath", "") + ").mkdir(parents=True, exist_ok=True)");
    }

    private static void deleteFile(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("Path(" + config.expr("filePath", "") + ").unlink(missing_ok=True)");
    }

    private static void copyFile(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("shutil.copy2(" + config.expr("sourcePath", "") + ", " + config.expr("destPath", "") + ")");
    }

    private static void moveFile(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("shutil.move(" + config.expr("sourcePath", "") + ", " + config.expr("destPath", "") + ")");
    }

    private static void rename(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        emitter.line("_source = Path(" + config.expr("sourcePath", "") + ")");
        emitter.line("_new_path = _source.parent / str(" + config.expr("newName", "") + ")");
        emitter.line("_source.rename(_new_path)");
        assign(ctx, config, "str(_new_path)");
    }

    private static void listFiles(ExportContext ctx, NodeConfig config, String nodeId) {
        var walk = config.bool("recursive", false) ? "rglob" : "glob";
        assign(ctx, config, "[str(p) for p in Path(" + config.expr("folderPath", "") + ")." + walk + "("
            + config.expr("pattern", "*") + ")]");
    }

    private static void getFileInfo(ExportContext ctx, NodeConfig config, String nodeId) {
        if (!config.has("variableName")) {
            return;
        }
        var emitter = ctx.emitter();
        var slot = ExpressionResolver.slot(config.string("variableName", ""));
        emitter.line("_path = Path(" + config.expr("filePath", "") + ")");
        emitter.block("if _path.exists():", () -> {
            emitter.line("_stat = _path.stat()");
            emitter.line(slot + " = {");
            emitter.withIndent(() -> {
                emitter.line("\"name\": _path.name,");
                emitter.line("\"path\": str(_path.absolute()),");
                emitter.line("\"size\": _stat.st_size,");
                emitter.line("\"is_file\": _path.is_file(),");
                emitter.line("\"is_dir\": _path.is_dir(),");
                emitter.line("\"extension\": _path.suffix,");
            });
            emitter.line("}");
        });
        emitter.block("else:", () -> emitter.line(slot + " = None"));
    }

    private static void listExport(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var path = config.expr("outputPath", "");
        var mode = config.bool("appendMode", false) ? "\"a\"" : "\"w\"";
        var separator = PythonLiterals.string(config.string("separator", "\n"));
        emitter.line("_list = " + ExpressionResolver.lookup(config.string("listVariable", ""), "[]"));
        emitter.block("with open(" + path + ", " + mode + ", encoding=" + encoding(config) + ") as _f:",
            () -> emitter.line("_f.write(" + separator + ".join(str(x) for x in _list))"));
        emitter.line("print(\"List exported to: \" + str(" + path + "))");
    }

    private static String encoding(NodeConfig config) {
        var encoding = config.string("encoding", DEFAULT_ENCODING).strip();
        return PythonLiterals.string(encoding.isEmpty() ? DEFAULT_ENCODING : encoding);
    }

    private static void assign(ExportContext ctx, NodeConfig config, String value) {
        if (config.has("variableName")) {
            ctx.emitter().line(ExpressionResolver.slot(config.string("variableName", "")) + " = " + value);
        }
    }
}
