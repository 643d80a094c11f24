package work.flowscript.exporter.core;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import work.flowscript.exporter.compiler.ExportContext;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.NodeConfig;
import work.flowscript.exporter.emit.ScriptEmitter;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.PythonLiterals;

/**
 * Modules that reach outside the browser: shell commands, HTTP requests, console prompts, the
 * clipboard and desktop notifications. Third-party Python packages are imported where they are used.
 */
public final class SystemGenerators {
    private static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final List<String> DEFAULT_OPTIONS = List.of("Option 1", "Option 2");

    private SystemGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register("run_command", SystemGenerators::runCommand, "run a shell command, keep stdout");
        registry.register("api_request", SystemGenerators::apiRequest, "HTTP request through httpx");
        registry.register("input_prompt", SystemGenerators::inputPrompt, "ask on the console");
        registry.register("set_clipboard", SystemGenerators::setClipboard, "copy text to the clipboard");
        registry.register("get_clipboard", SystemGenerators::getClipboard, "read the clipboard");
        registry.register("system_notification", SystemGenerators::notification, "desktop notification");
        registry.register("play_sound", SystemGenerators::playSound, "system beep");
        return registry;
    }

    private static void runCommand(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("_completed = subprocess.run(str(" + config.expr("command", "") + "), shell=True, capture_output=True, text=True)");
        assign(ctx, config, "_completed.stdout");
    }

    private static void apiRequest(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var method = config.string("requestMethod", "GET").strip().toUpperCase(Locale.ROOT);
        if (!HTTP_METHODS.contains(method)) {
            method = "GET";
        }
        var call = "_response = await _client.request(" + PythonLiterals.string(method) + ", " + config.expr("requestUrl", "")
            + ", headers=_headers";
        var withBody = config.has("body") && BODY_METHODS.contains(method);
        var request = withBody
            ? call + ", json=_body if isinstance(_body, (dict, list)) else None, content=_body if isinstance(_body, str) else None)"
            : call + ")";
        emitter.line("import httpx");
        emitter.block("async with httpx.AsyncClient() as _client:", () -> {
            emitter.line("_headers = " + headers(config.raw("headers")));
            if (withBody) {
                emitter.line("_body = " + config.expr("body", ""));
            }
            emitter.line(request);
            if (config.has("variableName")) {
                var slot = ExpressionResolver.slot(config.string("variableName", ""));
                emitter.block("try:", () -> emitter.line(slot + " = _response.json()"));
                emitter.block("except ValueError:", () -> emitter.line(slot + " = _response.text"));
            }
        });
    }

    /**
     * Header map as a Python dict with templated values; JSON text is decoded at run time.
     */
    static String headers(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            var joiner = new StringJoiner(", ", "{", "}");
            for (var entry : map.entrySet()) {
                joiner.add(PythonLiterals.string(String.valueOf(entry.getKey())) + ": " + ExpressionResolver.resolve(entry.getValue()));
            }
            return joiner.toString();
        }
        if (raw instanceof String text && !text.isBlank()) {
            return "json.loads(" + PythonLiterals.string(text) + ")";
        }
        return "{}";
    }

    private static void inputPrompt(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var prompt = PythonLiterals.string(promptText(config));
        if (!config.has("variableName")) {
            emitter.line("input(" + prompt + ")");
            return;
        }
        var slot = ExpressionResolver.slot(config.string("variableName", ""));
        var fallback = config.expr("defaultValue", "");
        var withDefault = prompt + " + \" (default: \" + str(" + fallback + ") + \"): \"";
        var mode = config.string("inputMode", "single");
        switch (mode) {
            case "multiline" -> {
                readLines(emitter, prompt + " + \" (finish with an empty line):\"");
                emitter.line(slot + " = \"\\n\".join(_lines) if _lines else " + fallback);
            }
            case "list" -> {
                readLines(emitter, prompt + " + \" (one item per line, finish with an empty line):\"");
                emitter.line(slot + " = _lines");
            }
            case "number", "integer" -> {
                var cast = "number".equals(mode) ? "float" : "int";
                emitter.line("_input = input(" + withDefault + ")");
                emitter.block("try:", () -> emitter.line(slot + " = " + cast + "(_input) if _input else " + cast + "(" + fallback + " or 0)"));
                emitter.block("except ValueError:", () -> emitter.line(slot + " = " + cast + "(" + fallback + " or 0)"));
            }
            case "slider_int", "slider_float" -> {
                var cast = "slider_int".equals(mode) ? "int" : "float";
                var low = config.expr("minValue", 0);
                var high = config.expr("maxValue", 100);
                emitter.line("_input = input(" + prompt + " + \" (\" + str(" + low + ") + \"-\" + str(" + high
                    + ") + \", default: \" + str(" + fallback + ") + \"): \")");
                emitter.block("try:", () -> {
                    emitter.line("_value = " + cast + "(_input) if _input else " + cast + "(" + fallback + " or " + low + ")");
                    emitter.line(slot + " = max(" + low + ", min(" + high + ", _value))");
                });
                emitter.block("except ValueError:", () -> emitter.line(slot + " = " + fallback + " or " + low));
            }
            case "password" -> {
                emitter.line("_input = getpass.getpass(" + prompt + " + \": \")");
                emitter.line(slot + " = _input if _input else " + fallback);
            }
            case "checkbox" -> {
                emitter.line("_input = input(" + prompt + " + \" (y/n, default: \" + str(" + fallback + ") + \"): \").strip().lower()");
                emitter.block("if _input:", () -> emitter.line(slot + " = _input in (\"y\", \"yes\", \"true\", \"1\")"));
                emitter.block("else:", () -> emitter.line(slot + " = str(" + fallback + ").lower() in (\"true\", \"1\", \"yes\")"));
            }
            case "file", "folder" -> {
                var dialog = "file".equals(mode) ? "askopenfilename" : "askdirectory";
                emitter.line("print(" + prompt + ")");
                emitter.block("try:", () -> {
                    emitter.line("import tkinter as tk");
                    emitter.line("from tkinter import filedialog");
                    emitter.line("_root = tk.Tk()");
                    emitter.line("_root.withdraw()");
                    emitter.line("_path = filedialog." + dialog + "(title=" + prompt + ")");
                    emitter.line("_root.destroy()");
                    emitter.line(slot + " = _path if _path else " + fallback);
                });
                emitter.block("except Exception:", () -> {
                    emitter.line("_input = input(\"Path (default: \" + str(" + fallback + ") + \"): \")");
                    emitter.line(slot + " = _input if _input else " + fallback);
                });
            }
            case "select_single" -> {
                listOptions(emitter, config, prompt);
                emitter.line("_input = input(\"Option number (default: 1): \")");
                emitter.block("try:", () -> {
                    emitter.line("_idx = int(_input) - 1 if _input else 0");
                    emitter.line(slot + " = _options[_idx] if 0 <= _idx < len(_options) else _options[0]");
                });
                emitter.block("except ValueError:", () -> emitter.line(slot + " = _options[0] if _options else \"\""));
            }
            case "select_multiple" -> {
                listOptions(emitter, config, prompt + " + \" (numbers separated by commas)\"");
                emitter.line("_input = input(\"Option numbers: \")");
                emitter.line("_selected = []");
                emitter.block("for _idx_str in _input.split(\",\"):", () -> {
                    emitter.block("try:", () -> {
                        emitter.line("_idx = int(_idx_str.strip()) - 1");
                        emitter.block("if 0 <= _idx < len(_options):", () -> emitter.line("_selected.append(_options[_idx])"));
                    });
                    emitter.block("except ValueError:", () -> emitter.line("pass"));
                });
                emitter.line(slot + " = _selected");
            }
            default -> {
                emitter.line("_input = input(" + withDefault + ")");
                emitter.line(slot + " = _input if _input else " + fallback);
            }
        }
    }

    static String promptText(NodeConfig config) {
        var parts = new StringJoiner(" - ");
        for (var key : List.of("promptTitle", "promptMessage")) {
            if (config.has(key)) {
                parts.add(config.string(key, "").strip());
            }
        }
        return parts.length() == 0 ? "Input" : parts.toString();
    }

    private static void readLines(ScriptEmitter emitter, String header) {
        emitter.line("print(" + header + ")");
        emitter.line("_lines = []");
        emitter.block("while True:", () -> {
            emitter.line("_line = input()");
            emitter.block("if not _line:", () -> emitter.line("break"));
            emitter.line("_lines.append(_line)");
        });
    }

    private static void listOptions(ScriptEmitter emitter, NodeConfig config, String header) {
        var raw = config.raw("options");
        var options = raw instanceof List<?> list && !list.isEmpty() ? list : DEFAULT_OPTIONS;
        emitter.line("_options = " + PythonLiterals.value(options.stream().map(option -> String.valueOf(option)).toList()));
        emitter.line("print(" + header + ")");
        emitter.block("for _i, _opt in enumerate(_options):", () -> emitter.line("print(f\"  {_i + 1}. {_opt}\")"));
    }

    private static void setClipboard(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("import pyperclip");
        ctx.emitter().line("pyperclip.copy(str(" + config.expr("content", "") + "))");
    }

    private static void getClipboard(ExportContext ctx, NodeConfig config, String nodeId) {
        if (config.has("variableName")) {
            ctx.emitter().line("import pyperclip");
            assign(ctx, config, "pyperclip.paste()");
        }
    }

    private static void notification(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var title = "str(" + config.expr("title", "Notification") + ")";
        var message = "str(" + config.expr("message", "") + ")";
        emitter.block("try:", () -> {
            emitter.line("from plyer import notification");
            emitter.line("notification.notify(title=" + title + ", message=" + message + ", timeout=5)");
        });
        emitter.block("except ImportError:", () -> emitter.line("print(\"Notification: \" + " + title + " + \" - \" + " + message + ")"));
    }

    private static void playSound(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var type = config.string("soundType", "success");
        var beep = switch (type) {
            case "success" -> "winsound.MessageBeep(winsound.MB_OK)";
            case "error" -> "winsound.MessageBeep(winsound.MB_ICONHAND)";
            case "warning" -> "winsound.MessageBeep(winsound.MB_ICONEXCLAMATION)";
            default -> "winsound.MessageBeep()";
        };
        emitter.block("try:", () -> {
            emitter.line("import winsound");
            emitter.line(beep);
        });
        emitter.block("except ImportError:", () -> emitter.line("print(\"\\a\", end=\"\", flush=True)"));
    }

    private static void assign(ExportContext ctx, NodeConfig config, String value) {
        if (config.has("variableName")) {
            ctx.emitter().line(ExpressionResolver.slot(config.string("variableName", "")) + " = " + value);
        }
    }
}
