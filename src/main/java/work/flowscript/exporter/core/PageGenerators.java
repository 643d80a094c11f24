package work.flowscript.exporter.core;

import work.flowscript.exporter.compiler.ExportContext;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.NodeConfig;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.IdentifierSanitizer;
import work.flowscript.exporter.expr.PythonLiterals;
import work.flowscript.exporter.expr.TemplateParser;

/**
 * Browser navigation, interaction and extraction modules. Each emits straight-line Playwright calls
 * against the global {@code page}.
 */
public final class PageGenerators {
    private PageGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register("open_page", PageGenerators::openPage, "navigate to a URL");
        registry.register("click_element", PageGenerators::clickElement, "single, double or right click");
        registry.register("hover_element", PageGenerators::hoverElement, "hover over an element");
        registry.register("input_text", PageGenerators::inputText, "fill a text field");
        registry.register("wait", PageGenerators::waitFixed, "sleep for a duration in milliseconds");
        registry.register("wait_element", PageGenerators::waitElement, "wait for an element state");
        registry.register("close_page", PageGenerators::closePage, "close the page and open a fresh one");
        registry.register("refresh_page", (ctx, config, nodeId) -> ctx.emitter().line("await page.reload()"), "reload the page");
        registry.register("go_back", (ctx, config, nodeId) -> ctx.emitter().line("await page.go_back()"), "history back");
        registry.register("go_forward", (ctx, config, nodeId) -> ctx.emitter().line("await page.go_forward()"), "history forward");
        registry.register("scroll_page", PageGenerators::scrollPage, "scroll the window");
        registry.register("select_dropdown", PageGenerators::selectDropdown, "choose a select option");
        registry.register("set_checkbox", PageGenerators::setCheckbox, "check or uncheck");
        registry.register("upload_file", PageGenerators::uploadFile, "set input files");
        registry.register("drag_element", PageGenerators::dragElement, "drag and drop between selectors");
        registry.register("keyboard_action", PageGenerators::keyboardAction, "press a key sequence");
        registry.register("screenshot", PageGenerators::screenshot, "save a page screenshot");
        registry.register("js_script", PageGenerators::jsScript, "evaluate JavaScript in the page");
        registry.register("get_element_info", PageGenerators::getElementInfo, "read text, HTML, value or an attribute");
        registry.register("download_file", PageGenerators::downloadFile, "save a download from a click or a URL");
        registry.register("handle_dialog", PageGenerators::handleDialog, "accept or dismiss later dialogs");
        return registry;
    }

    private static void openPage(ExportContext ctx, NodeConfig config, String nodeId) {
        var url = config.expr("url", "");
        var waitUntil = PythonLiterals.string(config.string("waitUntil", "load"));
        ctx.emitter().line("await page.goto(" + url + ", wait_until=" + waitUntil + ")");
        ctx.emitter().line("print(f\"Opened page: {page.url}\")");
    }

    private static void clickElement(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var selector = config.expr("selector", "");
        emitter.line("await page.wait_for_selector(" + selector + ", timeout=" + timeout(ctx, config) + ")");
        switch (config.string("clickType", "single")) {
            case "double" -> emitter.line("await page.dblclick(" + selector + ")");
            case "right" -> emitter.line("await page.click(" + selector + ", button=\"right\")");
            default -> emitter.line("await page.click(" + selector + ")");
        }
    }

    private static void hoverElement(ExportContext ctx, NodeConfig config, String nodeId) {
        var selector = config.expr("selector", "");
        ctx.emitter().line("await page.hover(" + selector + ")");
        double duration = config.decimal("hoverDuration", 500);
        if (duration > 0) {
            ctx.emitter().line("await asyncio.sleep(" + PythonLiterals.number(duration / 1000) + ")");
        }
    }

    private static void inputText(ExportContext ctx, NodeConfig config, String nodeId) {
        var selector = config.expr("selector", "");
        var text = config.expr("text", "");
        if (config.bool("clearBefore", true)) {
            ctx.emitter().line("await page.fill(" + selector + ", \"\")");
        }
        ctx.emitter().line("await page.fill(" + selector + ", str(" + text + "))");
    }

    private static void waitFixed(ExportContext ctx, NodeConfig config, String nodeId) {
        var raw = config.raw("duration");
        if (raw instanceof String str && TemplateParser.hasTokens(str)) {
            ctx.emitter().line("await asyncio.sleep(float(" + ExpressionResolver.resolve(str) + ") / 1000)");
            return;
        }
        double millis = config.decimal("duration", 1000);
        ctx.emitter().line("await asyncio.sleep(" + PythonLiterals.number(millis / 1000) + ")");
    }

    private static void waitElement(ExportContext ctx, NodeConfig config, String nodeId) {
        var selector = config.expr("selector", "");
        var state = PythonLiterals.string(config.string("state", "visible"));
        ctx.emitter().line("await page.wait_for_selector(" + selector + ", state=" + state + ", timeout=" + timeout(ctx, config) + ")");
    }

    private static void closePage(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("await page.close()");
        ctx.emitter().line("page = await context.new_page()");
    }

    private static void scrollPage(ExportContext ctx, NodeConfig config, String nodeId) {
        long distance = Math.abs(config.number("distance", 500));
        String delta;
        switch (config.string("direction", "down")) {
            case "up" -> delta = "0, -" + distance;
            case "right" -> delta = distance + ", 0";
            case "left" -> delta = "-" + distance + ", 0";
            default -> delta = "0, " + distance;
        }
        ctx.emitter().line("await page.evaluate(\"window.scrollBy(" + delta + ")\")");
    }

    private static void selectDropdown(ExportContext ctx, NodeConfig config, String nodeId) {
        var selector = config.expr("selector", "");
        var value = config.expr("value", "");
        switch (config.string("selectBy", "value")) {
            case "label" -> ctx.emitter().line("await page.select_option(" + selector + ", label=" + value + ")");
            case "index" -> ctx.emitter().line("await page.select_option(" + selector + ", index=int(" + value + "))");
            default -> ctx.emitter().line("await page.select_option(" + selector + ", value=" + value + ")");
        }
    }

    private static void setCheckbox(ExportContext ctx, NodeConfig config, String nodeId) {
        var selector = config.expr("selector", "");
        var call = config.bool("checked", true) ? "check" : "uncheck";
        ctx.emitter().line("await page." + call + "(" + selector + ")");
    }

    private static void uploadFile(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("await page.set_input_files(" + config.expr("selector", "") + ", " + config.expr("filePath", "") + ")");
    }

    private static void dragElement(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("await page.drag_and_drop(" + config.expr("sourceSelector", "") + ", " + config.expr("targetSelector", "") + ")");
    }

    private static void keyboardAction(ExportContext ctx, NodeConfig config, String nodeId) {
        ctx.emitter().line("await page.keyboard.press(" + config.expr("keySequence", "") + ")");
    }

    private static void screenshot(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        emitter.line("_screenshot_path = " + config.expr("savePath", "screenshot.png"));
        emitter.line("await page.screenshot(path=_screenshot_path, full_page=" + PythonLiterals.bool(config.bool("fullPage", false)) + ")");
        emitter.line("print(f\"Screenshot saved: {_screenshot_path}\")");
        if (config.has("variableName")) {
            emitter.line(ExpressionResolver.slot(config.string("variableName", "")) + " = _screenshot_path");
        }
    }

    private static void jsScript(ExportContext ctx, NodeConfig config, String nodeId) {
        var script = PythonLiterals.string(config.string("script", ""));
        if (config.has("variableName")) {
            var name = config.string("variableName", "");
            var local = IdentifierSanitizer.local(name);
            ctx.emitter().line(local + " = await page.evaluate(" + script + ")");
            ctx.emitter().line(ExpressionResolver.slot(name) + " = " + local);
        } else {
            ctx.emitter().line("await page.evaluate(" + script + ")");
        }
    }

    private static void getElementInfo(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var selector = config.expr("selector", "");
        var name = config.string("variableName", "");
        var local = config.has("variableName") ? IdentifierSanitizer.local(name) : "_element_info";
        var attribute = config.string("attribute", "text");
        String call;
        switch (attribute) {
            case "text" -> call = "page.inner_text(" + selector + ")";
            case "innerHTML" -> call = "page.inner_html(" + selector + ")";
            case "value" -> call = "page.input_value(" + selector + ")";
            default -> call = "page.get_attribute(" + selector + ", " + PythonLiterals.string(attribute) + ")";
        }
        emitter.line(local + " = await " + call);
        if (config.has("variableName")) {
            emitter.line(ExpressionResolver.slot(name) + " = " + local);
        }
        emitter.line("print(f\"Got: {" + local + "}\")");
    }

    /**
     * Click mode waits for the download a click triggers; URL mode fetches the file with httpx.
     * The saved path, or the suggested file name when nothing is saved, goes to {@code variableName}.
     */
    private static void downloadFile(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var folder = config.has("savePath") ? config.expr("savePath", "") : null;
        var fileName = config.has("fileName") ? config.expr("fileName", "") : null;
        if (!"url".equals(config.string("downloadMode", "click"))) {
            emitter.block("async with page.expect_download() as _download_info:",
                () -> emitter.line("await page.click(" + config.expr("triggerSelector", "") + ")"));
            emitter.line("_download = await _download_info.value");
            if (folder == null && fileName == null) {
                emitter.line("print(f\"Downloaded: {_download.suggested_filename}\")");
                assign(ctx, config, "_download.suggested_filename");
                return;
            }
            emitter.line("_save_path = " + (folder == null ? fileName
                : "os.path.join(" + folder + ", " + (fileName == null ? "_download.suggested_filename" : fileName) + ")"));
            emitter.line("await _download.save_as(_save_path)");
            assign(ctx, config, "_save_path");
            return;
        }
        var url = config.expr("downloadUrl", "");
        emitter.line("import httpx");
        emitter.block("async with httpx.AsyncClient(follow_redirects=True) as _client:", () -> {
            emitter.line("_response = await _client.get(" + url + ")");
            emitter.line("_file_name = " + (fileName != null ? fileName
                : "str(" + url + ").split(\"/\")[-1].split(\"?\")[0] or \"downloaded_file\""));
            emitter.line("_save_path = " + (folder == null ? "_file_name" : "os.path.join(" + folder + ", _file_name)"));
            emitter.block("with open(_save_path, \"wb\") as _f:", () -> emitter.line("_f.write(_response.content)"));
            assign(ctx, config, "_save_path");
            emitter.line("print(f\"Downloaded: {_save_path}\")");
        });
    }

    private static void handleDialog(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var accept = !"dismiss".equals(config.string("action", "accept"));
        var reply = accept
            ? "dialog.accept(" + (config.has("promptText") ? config.expr("promptText", "") : "") + ")"
            : "dialog.dismiss()";
        emitter.block("def _handle_dialog(dialog):", () -> emitter.line("asyncio.create_task(" + reply + ")"));
        emitter.line("page.on(\"dialog\", _handle_dialog)");
    }

    private static void assign(ExportContext ctx, NodeConfig config, String value) {
        if (config.has("variableName")) {
            ctx.emitter().line(ExpressionResolver.slot(config.string("variableName", "")) + " = " + value);
        }
    }

    static long timeout(ExportContext ctx, NodeConfig config) {
        return config.number("timeout", ctx.configuration().defaultTimeout().toMillis());
    }
}
