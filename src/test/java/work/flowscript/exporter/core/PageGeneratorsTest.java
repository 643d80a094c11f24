package work.flowscript.exporter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.flowscript.exporter.support.WorkflowFixtures.compile;
import static work.flowscript.exporter.support.WorkflowFixtures.indentOf;
import static work.flowscript.exporter.support.WorkflowFixtures.lineOf;
import static work.flowscript.exporter.support.WorkflowFixtures.node;
import static work.flowscript.exporter.support.WorkflowFixtures.strippedLines;
import static work.flowscript.exporter.support.WorkflowFixtures.workflow;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.flowscript.exporter.graph.WorkflowNode;

class PageGeneratorsTest {
    private static String emit(WorkflowNode node) {
        return compile(workflow(List.of(node), List.of())).code();
    }

    @Test
    void openPageResolvesUrlTemplate() {
        var code = emit(node("o", "open_page", "url", "https://shop.test/{item}", "waitUntil", "networkidle"));
        assertTrue(code.contains(
            "await page.goto(f'https://shop.test/{variables.get(\"item\", \"\")}', wait_until=\"networkidle\")"), code);
    }

    @Test
    void clickVariantsAndTimeout() {
        var code = emit(node("c", "click_element", "selector", "#a", "clickType", "double", "timeout", 1500));
        assertTrue(code.contains("await page.wait_for_selector(\"#a\", timeout=1500)"));
        assertTrue(code.contains("await page.dblclick(\"#a\")"));

        var right = emit(node("c", "click_element", "selector", "#b", "clickType", "right"));
        assertTrue(right.contains("await page.wait_for_selector(\"#b\", timeout=30000)"));
        assertTrue(right.contains("await page.click(\"#b\", button=\"right\")"));
    }

    @Test
    void inputTextCanSkipClearing() {
        var code = emit(node("i", "input_text", "selector", "#q", "text", "{term}", "clearBefore", false));
        assertFalse(code.contains("await page.fill(\"#q\", \"\")"));
        assertTrue(code.contains("await page.fill(\"#q\", str(variables.get(\"term\", \"\")))"));
    }

    @Test
    void waitConvertsMillisecondsToSeconds() {
        assertTrue(emit(node("w", "wait", "duration", 2500)).contains("await asyncio.sleep(2.5)"));
        assertTrue(emit(node("w", "wait", "duration", "{delay}")).contains(
            "await asyncio.sleep(float(variables.get(\"delay\", \"\")) / 1000)"));
    }

    @Test
    void scrollDirections() {
        assertTrue(emit(node("s", "scroll_page", "direction", "up", "distance", 300))
            .contains("await page.evaluate(\"window.scrollBy(0, -300)\")"));
        assertTrue(emit(node("s", "scroll_page", "direction", "left"))
            .contains("await page.evaluate(\"window.scrollBy(-500, 0)\")"));
    }

    @Test
    void selectCheckboxAndUpload() {
        assertTrue(emit(node("d", "select_dropdown", "selector", "#s", "selectBy", "index", "value", "2"))
            .contains("await page.select_option(\"#s\", index=int(\"2\"))"));
        assertTrue(emit(node("c", "set_checkbox", "selector", "#t", "checked", false))
            .contains("await page.uncheck(\"#t\")"));
        assertTrue(emit(node("u", "upload_file", "selector", "#f", "filePath", "/tmp/a.txt"))
            .contains("await page.set_input_files(\"#f\", \"/tmp/a.txt\")"));
    }

    @Test
    void screenshotStoresPathInVariable() {
        var code = emit(node("s", "screenshot", "savePath", "out.png", "fullPage", true, "variableName", "shot path"));
        assertTrue(code.contains("_screenshot_path = \"out.png\""));
        assertTrue(code.contains("await page.screenshot(path=_screenshot_path, full_page=True)"));
        assertTrue(code.contains("variables[\"shot_path\"] = _screenshot_path"));
    }

    @Test
    void jsScriptIsQuotedSafely() {
        var code = emit(node("j", "js_script", "script", "return \"\"\"x\"\"\";", "variableName", "result"));
        assertTrue(code.contains("_v_result = await page.evaluate(\"return \\\"\\\"\\\"x\\\"\\\"\\\";\")"), code);
        assertTrue(code.contains("variables[\"result\"] = _v_result"));
    }

    @Test
    void elementInfoReadsRequestedAttribute() {
        var code = emit(node("g", "get_element_info", "selector", "a.next", "attribute", "href", "variableName", "next url"));
        assertTrue(code.contains("_v_next_url = await page.get_attribute(\"a.next\", \"href\")"));
        assertTrue(code.contains("variables[\"next_url\"] = _v_next_url"));

        var text = emit(node("g", "get_element_info", "selector", "h1"));
        assertTrue(text.contains("_element_info = await page.inner_text(\"h1\")"));
    }

    @Test
    void closePageOpensAFreshOne() {
        var code = emit(node("c", "close_page"));
        assertTrue(code.contains("await page.close()\n"));
        assertTrue(code.contains("page = await context.new_page()"));
    }

    @Test
    void clickDownloadWaitsForTheDownloadEvent() {
        var code = emit(node("d", "download_file", "triggerSelector", "#export", "savePath", "downloads", "variableName", "file"));
        int wait = lineOf(code, "async with page.expect_download() as _download_info:");
        int click = lineOf(code, "await page.click(\"#export\")");
        assertTrue(wait > 0 && click == wait + 1, code);
        assertTrue(indentOf(code, "await page.click(\"#export\")") > indentOf(code, "async with page.expect_download()"));
        assertTrue(code.contains("_save_path = os.path.join(\"downloads\", _download.suggested_filename)"));
        assertTrue(code.contains("await _download.save_as(_save_path)"));
        assertTrue(code.contains("variables[\"file\"] = _save_path"));

        var unsaved = emit(node("d", "download_file", "triggerSelector", "#export", "variableName", "file"));
        assertFalse(unsaved.contains("save_as"));
        assertTrue(unsaved.contains("variables[\"file\"] = _download.suggested_filename"));
    }

    @Test
    void urlDownloadUsesHttpx() {
        var code = emit(node("d", "download_file", "downloadMode", "url", "downloadUrl", "{link}", "fileName", "report.pdf"));
        assertTrue(code.contains("import httpx"));
        assertTrue(code.contains("_response = await _client.get(variables.get(\"link\", \"\"))"));
        assertTrue(code.contains("_file_name = \"report.pdf\""));
        assertTrue(code.contains("_save_path = _file_name"));
        assertTrue(code.contains("_f.write(_response.content)"));
    }

    @Test
    void dialogHandlerIsRegisteredOnThePage() {
        var accept = emit(node("h", "handle_dialog", "promptText", "{answer}"));
        int def = lineOf(accept, "def _handle_dialog(dialog):");
        assertTrue(def > 0, accept);
        assertEquals("asyncio.create_task(dialog.accept(variables.get(\"answer\", \"\")))", strippedLines(accept).get(def + 1));
        assertTrue(lineOf(accept, "page.on(\"dialog\", _handle_dialog)") > def);

        assertTrue(emit(node("h", "handle_dialog", "action", "dismiss")).contains("asyncio.create_task(dialog.dismiss())"));
    }
}
