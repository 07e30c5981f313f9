package com.cfort.cli;

import com.cfort.compiler.TranslationException;
import com.cfort.compiler.ast.SourceLocation;
import com.google.gson.Gson;
import com.google.gson.JsonObject;

import java.io.PrintWriter;

/**
 * 把翻译错误与 I/O 错误输出到标准错误，文本或 JSON 格式
 */
public class DiagnosticsPrinter {

    private final DiagnosticsFormat format;
    private final PrintWriter err;
    private final Gson gson = new Gson();

    public DiagnosticsPrinter(DiagnosticsFormat format, PrintWriter err) {
        this.format = format;
        this.err = err;
    }

    public void report(TranslationException e) {
        if (format == DiagnosticsFormat.TEXT) {
            err.println(e.getMessage());
            err.flush();
            return;
        }
        JsonObject diag = new JsonObject();
        SourceLocation loc = e.getLocation();
        diag.addProperty("file", loc.getFile());
        if (loc.hasLine()) {
            diag.addProperty("line", loc.getLine());
            diag.addProperty("column", loc.getColumn());
        }
        diag.addProperty("stage", e.getStage().getDisplayName());
        diag.addProperty("kind", e.getKind());
        diag.addProperty("message", e.getDetail());
        emit(diag);
    }

    public void reportIo(String path, String message) {
        if (format == DiagnosticsFormat.TEXT) {
            err.println("错误: " + path + ": " + message);
            err.flush();
            return;
        }
        JsonObject diag = new JsonObject();
        diag.addProperty("file", path);
        diag.addProperty("stage", "io");
        diag.addProperty("message", message);
        emit(diag);
    }

    public void reportUsage(String message) {
        if (format == DiagnosticsFormat.TEXT) {
            err.println("错误: " + message);
            err.flush();
            return;
        }
        JsonObject diag = new JsonObject();
        diag.addProperty("stage", "usage");
        diag.addProperty("message", message);
        emit(diag);
    }

    private void emit(JsonObject diag) {
        err.println(gson.toJson(diag));
        err.flush();
    }
}
