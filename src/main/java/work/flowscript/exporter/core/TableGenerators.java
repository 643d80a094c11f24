package work.flowscript.exporter.core;

import work.flowscript.exporter.compiler.ExportContext;
import work.flowscript.exporter.compiler.GeneratorRegistry;
import work.flowscript.exporter.compiler.NodeConfig;
import work.flowscript.exporter.emit.ScriptEmitter;
import work.flowscript.exporter.expr.ExpressionResolver;
import work.flowscript.exporter.expr.PythonLiterals;

/**
 * Data table modules. The table is a list of row dictionaries kept under a reserved key of the
 * {@code variables} store; row indices may be negative and count from the end.
 *
 * <p>Excel and CSV export need pandas at script run time. The generated code prints an install
 * hint when it is missing instead of failing the whole run.
 */
public final class TableGenerators {
    static final String TABLE = "variables[\"_table_data\"]";
    private static final String PANDAS_HINT = "print(\"Table export needs pandas and openpyxl: pip install pandas openpyxl\")";

    private TableGenerators() {}

    public static GeneratorRegistry register(GeneratorRegistry registry) {
        registry.register("table_add_row", TableGenerators::addRow, "append a row dictionary");
        registry.register("table_set_cell", TableGenerators::setCell, "write one cell");
        registry.register("table_get_cell", TableGenerators::getCell, "read one cell");
        registry.register("table_delete_row", TableGenerators::deleteRow, "remove a row");
        registry.register("table_clear", (ctx, config, nodeId) -> ctx.emitter().line(TABLE + " = []"), "drop every row");
        registry.register("table_export", TableGenerators::export, "save as CSV or Excel");
        registry.register("read_excel", TableGenerators::readExcel, "load a sheet as row dictionaries");
        return registry;
    }

    private static void addRow(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        emitter.block("if \"_table_data\" not in variables:", () -> emitter.line(TABLE + " = []"));
        if (!config.has("rowData")) {
            emitter.line(TABLE + ".append({})");
            return;
        }
        emitter.line("_row_data = " + config.expr("rowData", ""));
        emitter.block("if isinstance(_row_data, str):", () -> {
            emitter.block("try:", () -> emitter.line("_row_data = json.loads(_row_data)"));
            emitter.block("except (ValueError, TypeError):", () -> emitter.line("_row_data = {}"));
        });
        emitter.line(TABLE + ".append(_row_data if isinstance(_row_data, dict) else {})");
    }

    private static void setCell(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var column = config.expr("columnName", "");
        var value = config.expr("cellValue", "");
        emitter.block("if variables.get(\"_table_data\"):", () -> {
            rowIndex(emitter, config, -1, TABLE);
            emitter.block("if 0 <= _row_idx < len(" + TABLE + "):",
                () -> emitter.line(TABLE + "[_row_idx][" + column + "] = " + value));
        });
    }

    private static void getCell(ExportContext ctx, NodeConfig config, String nodeId) {
        if (!config.has("variableName")) {
            return;
        }
        var emitter = ctx.emitter();
        var slot = ExpressionResolver.slot(config.string("variableName", ""));
        emitter.line("_table = variables.get(\"_table_data\", [])");
        rowIndex(emitter, config, 0, "_table");
        emitter.block("if 0 <= _row_idx < len(_table):",
            () -> emitter.line(slot + " = _table[_row_idx].get(" + config.expr("columnName", "") + ", \"\")"));
        emitter.block("else:", () -> emitter.line(slot + " = \"\""));
    }

    private static void deleteRow(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        emitter.block("if variables.get(\"_table_data\"):", () -> {
            rowIndex(emitter, config, -1, TABLE);
            emitter.block("if 0 <= _row_idx < len(" + TABLE + "):", () -> emitter.line(TABLE + ".pop(_row_idx)"));
        });
    }

    private static void export(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var csv = "csv".equals(config.string("exportFormat", "excel"));
        var extension = PythonLiterals.string(csv ? ".csv" : ".xlsx");
        emitter.block("try:", () -> {
            emitter.line("import pandas as pd");
            emitter.line("_df = pd.DataFrame(variables.get(\"_table_data\", []))");
            emitter.line("_file_name = " + (config.has("fileNamePattern")
                ? "str(" + config.expr("fileNamePattern", "") + ")"
                : "\"data_\" + datetime.now().strftime(\"%Y%m%d_%H%M%S\")"));
            emitter.block("if not _file_name.endswith(" + extension + "):", () -> emitter.line("_file_name += " + extension));
            if (config.has("savePath")) {
                emitter.line("_save_dir = " + config.expr("savePath", ""));
                emitter.line("os.makedirs(_save_dir, exist_ok=True)");
                emitter.line("_full_path = os.path.join(_save_dir, _file_name)");
            } else {
                emitter.line("_full_path = _file_name");
            }
            emitter.line(csv
                ? "_df.to_csv(_full_path, index=False, encoding=\"utf-8-sig\")"
                : "_df.to_excel(_full_path, index=False)");
            emitter.line("print(f\"Table exported to: {_full_path}\")");
            if (config.has("variableName")) {
                emitter.line(ExpressionResolver.slot(config.string("variableName", "")) + " = _full_path");
            }
        });
        emitter.block("except ImportError:", () -> emitter.line(PANDAS_HINT));
    }

    private static void readExcel(ExportContext ctx, NodeConfig config, String nodeId) {
        var emitter = ctx.emitter();
        var sheet = config.has("sheetName") ? ", sheet_name=" + config.expr("sheetName", "") : "";
        emitter.block("try:", () -> {
            emitter.line("import pandas as pd");
            emitter.line("_df = pd.read_excel(" + config.expr("filePath", "") + sheet + ")");
            if (config.has("variableName")) {
                emitter.line(ExpressionResolver.slot(config.string("variableName", "")) + " = _df.to_dict(\"records\")");
            }
        });
        emitter.block("except ImportError:", () -> emitter.line(PANDAS_HINT));
    }

    private static void rowIndex(ScriptEmitter emitter, NodeConfig config, int fallback, String table) {
        emitter.line("_row_idx = int(" + config.expr("rowIndex", fallback) + ")");
        emitter.block("if _row_idx < 0:", () -> emitter.line("_row_idx = len(" + table + ") + _row_idx"));
    }
}
