package work.flowscript.exporter.core;

import java.util.regex.Pattern;
import work.flowscript.exporter.compiler.ExportContext;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.NodeConfig;
import work.flowscript.exporter.emit.ScriptEmitter;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.PythonLiterals;

/**
 * Variable, string, JSON, list and dictionary modules. All writes go through the sanitized
 * {@code variables} store; a module without a target variable emits nothing it would lose.
 */
public final class DataGenerators {
    private static final Pattern PATH_STEP = Pattern.compile("([^\\[\\]]*)((?:\\[\\d+])*)");
    private static final Pattern PATH_INDEX = Pattern.compile("\\[(\\d+)]");

    private DataGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register("set_variable", DataGenerators::setVariable, "assign a variable");
        registry.register("print_log", DataGenerators::printLog, "print a message");
        registry.register("string_concat", DataGenerators::stringConcat, "concatenate two strings");
        registry.register("string_replace", DataGenerators::stringReplace, "text or regex replace");
        registry.register("string_case", DataGenerators::stringCase, "upper, lower, capitalize or title case");
        registry.register("string_trim", DataGenerators::stringTrim, "strip whitespace");
        registry.register("string_split", DataGenerators::stringSplit, "split on a separator");
        registry.register("string_join", DataGenerators::stringJoin, "join a list with a separator");
        registry.register("string_substring", DataGenerators::stringSubstring, "slice between two indices");
        registry.register("regex_extract", DataGenerators::regexExtract, "first regex match or group");
        registry.register("json_parse", DataGenerators::jsonParse, "parse JSON and follow a simple path");
        registry.register("base64", DataGenerators::base64, "encode or decode text and files");
        registry.register("list_operation", DataGenerators::listOperation, "append, remove or clear");
        registry.register("list_get", DataGenerators::listGet, "element at an index");
        registry.register("list_length", DataGenerators::listLength, "length of a list");
        registry.register("dict_operation", DataGenerators::dictOperation, "set, delete or clear a key");
        registry.register("dict_get", DataGenerators::dictGet, "value for a key");
        registry.register("dict_keys", DataGenerators::dictKeys, "keys, values or items as a list");
        registry.register("random_number", DataGenerators::randomNumber, "random integer in a range");
        registry.register("get_time", DataGenerators::getTime, "formatted current time");
        registry.register("note", DataGenerators::note, "comment only");
        return registry;
    }

    private static void setVariable(ExportContext ctx, NodeConfig config, String nodeId) {
        assign(ctx, config, config.expr("variableValue", ""));
    }

    private static void printLog(ExportContext ctx, NodeConfig config, String nodeId) {
        var prefix = switch (config.string("logLevel", "info")) {
            case "success" -> "[OK]";
            case "warning" -> "[WARN]";
            case "error" -> "[ERROR]";
            default -> "[INFO]";
        };
        ctx.emitter().line("print(" + PythonLiterals.string(prefix + " ") + " + str(" + config.expr("logMessage", "") + "))");
    }

    private static void stringConcat(ExportContext ctx, NodeConfig config, String nodeId) {
        assign(ctx, config, "str(" + config.expr("string1", "") + ") + str(" + config.expr("string2", "") + ")");
    }

    private static void stringReplace(ExportContext ctx, NodeConfig config, String nodeId) {
        var input = "str(" + config.expr("inputText", "") + ")";
        var search = "str(" + config.expr("searchValue", "") + ")";
        var replacement = "str(" + config.expr("replaceValue", "") + ")";
        var all = config.bool("replaceAll", true);
        if ("regex".equals(config.string("replaceMode", "text"))) {
            assign(ctx, config, "re.sub(" + search + ", " + replacement + ", " + input + (all ? "" : ", count=1") + ")");
        } else {
            assign(ctx, config, input + ".replace(" + search + ", " + replacement + (all ? "" : ", 1") + ")");
        }
    }

    private static void stringCase(ExportContext ctx, NodeConfig config, String nodeId) {
        var method = switch (config.string("caseMode", "upper")) {
            case "lower" -> "lower";
            case "capitalize" -> "capitalize";
            case "title" -> "title";
            default -> "upper";
        };
        assign(ctx, config, "str(" + config.expr("inputText", "") + ")." + method + "()");
    }

    private static void stringTrim(ExportContext ctx, NodeConfig config, String nodeId) {
        var input = "str(" + config.expr("inputText", "") + ")";
        var value = switch (config.string("trimMode", "both")) {
            case "start" -> input + ".lstrip()";
            case "end" -> input + ".rstrip()";
            case "all" -> "\"\".join(" + input + ".split())";
            default -> input + ".strip()";
        };
        assign(ctx, config, value);
    }

    private static void stringSplit(ExportContext ctx, NodeConfig config, String nodeId) {
        var call = "str(" + config.expr("inputText", "") + ").split(str(" + config.expr("separator", ",") + ")";
        if (config.has("maxSplit")) {
            call += ", int(" + config.expr("maxSplit", -1) + ")";
        }
        assign(ctx, config, call + ")");
    }

    private static void stringJoin(ExportContext ctx, NodeConfig config, String nodeId) {
        if (!config.has("variableName")) {
            return;
        }
        ctx.emitter().line("_list = " + ExpressionResolver.lookup(config.string("listVariable", ""), "[]"));
        assign(ctx, config, "str(" + config.expr("separator", "") + ").join(str(x) for x in _list)");
    }

    private static void stringSubstring(ExportContext ctx, NodeConfig config, String nodeId) {
        var end = config.has("endIndex") ? "int(" + config.expr("endIndex", "") + ")" : "";
        assign(ctx, config, "str(" + config.expr("inputText", "") + ")[int(" + config.expr("startIndex", 0) + "):" + end + "]");
    }

    private static void regexExtract(ExportContext ctx, NodeConfig config, String nodeId) {
        var source = config.has("sourceText") ? config.expr("sourceText", "") : config.expr("inputText", "");
        ctx.emitter().line("_match = re.search(str(" + config.expr("pattern", "") + "), str(" + source + "))");
        assign(ctx, config, "_match.group(1) if _match and _match.groups() else (_match.group(0) if _match else \"\")");
    }

    /**
     * Loads the source variable, decoding it when it holds JSON text, then walks an optional
     * {@code $.key.list[0].key} path. Missing steps yield {@code None}.
     */
    private static void jsonParse(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        emitter.line("_json_data = " + ExpressionResolver.lookup(config.string("sourceVariable", ""), "{}"));
        emitter.block("if isinstance(_json_data, str):", () -> {
            emitter.block("try:", () -> emitter.line("_json_data = json.loads(_json_data)"));
            emitter.block("except (ValueError, TypeError):", () -> emitter.line("pass"));
        });
        if (!config.has("variableName")) {
            return;
        }
        var path = config.string("jsonPath", "").strip();
        if (path.isEmpty()) {
            assign(ctx, config, "_json_data");
            return;
        }
        emitter.comment("JSON path: " + path);
        emitter.line("_result = _json_data");
        var steps = path.startsWith("$") ? path.substring(1) : path;
        for (var step : steps.split("\\.")) {
            if (step.isBlank()) {
                continue;
            }
            var matcher = PATH_STEP.matcher(step.strip());
            boolean structured = matcher.matches();
            var key = structured ? matcher.group(1) : step.strip();
            var indices = structured ? matcher.group(2) : "";
            if (!key.isEmpty()) {
                var literal = PythonLiterals.string(key);
                emitter.line("_result = _result.get(" + literal + ") if isinstance(_result, dict) else None");
            }
            var index = PATH_INDEX.matcher(indices);
            while (index.find()) {
                var i = index.group(1);
                emitter.line("_result = _result[" + i + "] if isinstance(_result, list) and len(_result) > " + i + " else None");
            }
        }
        assign(ctx, config, "_result");
    }

    private static void base64(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        switch (config.string("operation", "encode")) {
            case "decode" -> assign(ctx, config, "base64.b64decode(str(" + config.expr("inputBase64", "") + ")).decode()");
            case "file_to_base64" -> {
                if (config.has("variableName")) {
                    emitter.block("with open(" + config.expr("filePath", "") + ", \"rb\") as _f:",
                        () -> assign(ctx, config, "base64.b64encode(_f.read()).decode()"));
                }
            }
            case "base64_to_file" -> {
                var fileName = config.expr("fileName", "");
                emitter.line("_output_path = " + (config.has("outputPath")
                    ? "os.path.join(" + config.expr("outputPath", "") + ", " + fileName + ")"
                    : fileName));
                emitter.block("with open(_output_path, \"wb\") as _f:",
                    () -> emitter.line("_f.write(base64.b64decode(str(" + config.expr("inputBase64", "") + ")))"));
                assign(ctx, config, "_output_path");
            }
            default -> assign(ctx, config, "base64.b64encode(str(" + config.expr("inputText", "") + ").encode()).decode()");
        }
    }

    private static void listOperation(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var name = config.string("listVariable", "");
        var slot = ExpressionResolver.slot(name);
        var value = config.expr("value", "");
        ensureKey(emitter, name, "[]");
        switch (config.string("operation", "append")) {
            case "remove" -> emitter.block("if " + value + " in " + slot + ":", () -> emitter.line(slot + ".remove(" + value + ")"));
            case "clear" -> emitter.line(slot + " = []");
            default -> emitter.line(slot + ".append(" + value + ")");
        }
    }

    private static void listGet(ExportContext ctx, NodeConfig config, String nodeId) {
        if (!config.has("variableName")) {
            return;
        }
        var emitter = ctx.emitter();
        emitter.line("_list = " + ExpressionResolver.lookup(config.string("listVariable", ""), "[]"));
        emitter.line("_idx = int(" + config.expr("index", 0) + ")");
        assign(ctx, config, "_list[_idx] if -len(_list) <= _idx < len(_list) else None");
    }

    private static void listLength(ExportContext ctx, NodeConfig config, String nodeId) {
        assign(ctx, config, "len(" + ExpressionResolver.lookup(config.string("listVariable", ""), "[]") + ")");
    }

    private static void dictOperation(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var name = config.string("dictVariable", "");
        var slot = ExpressionResolver.slot(name);
        var key = config.expr("dictKey", "");
        ensureKey(emitter, name, "{}");
        switch (config.string("dictAction", "set")) {
            case "delete" -> emitter.line(slot + ".pop(" + key + ", None)");
            case "clear" -> emitter.line(slot + " = {}");
            default -> emitter.line(slot + "[" + key + "] = " + config.expr("dictValue", ""));
        }
    }

    private static void dictGet(ExportContext ctx, NodeConfig config, String nodeId) {
        var source = ExpressionResolver.lookup(config.string("dictVariable", ""), "{}");
        assign(ctx, config, source + ".get(" + config.expr("dictKey", "") + ", " + config.expr("defaultValue", "") + ")");
    }

    private static void dictKeys(ExportContext ctx, NodeConfig config, String nodeId) {
        var method = switch (config.string("keyType", "keys")) {
            case "values" -> "values";
            case "items" -> "items";
            default -> "keys";
        };
        assign(ctx, config, "list(" + ExpressionResolver.lookup(config.string("dictVariable", ""), "{}") + "." + method + "())");
    }

    private static void randomNumber(ExportContext ctx, NodeConfig config, String nodeId) {
        var low = config.expr("minValue", 0);
        var high = config.expr("maxValue", 100);
        assign(ctx, config, "random.randint(int(" + low + "), int(" + high + "))");
    }

    private static void getTime(ExportContext ctx, NodeConfig config, String nodeId) {
        var format = PythonLiterals.string(config.string("format", "%Y-%m-%d %H:%M:%S"));
        assign(ctx, config, "datetime.now().strftime(" + format + ")");
    }

    private static void note(ExportContext ctx, NodeConfig config, String nodeId) {
        var content = config.string("content", "");
        if (content.isBlank()) {
            ctx.emitter().comment("Note");
            return;
        }
        for (var line : content.split("\r?\n", -1)) {
            ctx.emitter().comment(line);
        }
    }

    /**
     * Writes {@code value} to the configured {@code variableName}; no target, no statement.
     */
    private static void assign(ExportContext ctx, NodeConfig config, String value) {
        if (config.has("variableName")) {
            ctx.emitter().line(ExpressionResolver.slot(config.string("variableName", "")) + " = " + value);
        }
    }

    private static void ensureKey(ScriptEmitter emitter, String rawName, String emptyValue) {
        var key = PythonLiterals.string(ExpressionResolver.key(rawName));
        emitter.block("if " + key + " not in variables:", () -> emitter.line(ExpressionResolver.slot(rawName) + " = " + emptyValue));
    }
}
