package com.ashscreener.output;

import com.ashscreener.model.ScreeningReport;
import com.ashscreener.model.StageResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Funnel report as JSON. Passed stocks carry their display names.
 */
public final class ReportJson {
    private ReportJson() {
    }

    public static JSONObject toJson(ScreeningReport report) {
        JSONObject root = new JSONObject();
        root.put("total_initial", report.totalInitial);
        root.put("final_count", report.finalCount);
        root.put("selected_criteria", new JSONArray(report.selectedCriteria));

        JSONArray stages = new JSONArray();
        for (StageResult stage : report.stages) {
            JSONObject s = new JSONObject();
            s.put("criterion_id", stage.criterionId);
            s.put("criterion", stage.criterion);
            s.put("before", stage.before);
            s.put("after", stage.after);
            s.put("eliminated", stage.eliminated);
            stages.put(s);
        }
        root.put("stages", stages);

        JSONArray passed = new JSONArray();
        Map<String, String> names = report.stockNames;
        for (String code : report.passed) {
            JSONObject p = new JSONObject();
            p.put("code", code);
            p.put("name", names == null ? "" : names.getOrDefault(code, ""));
            passed.put(p);
        }
        root.put("passed", passed);

        JSONObject dates = new JSONObject();
        if (report.dataDates != null) {
            for (Map.Entry<String, String> e : report.dataDates.entrySet()) {
                dates.put(e.getKey(), e.getValue());
            }
        }
        root.put("data_dates", dates);
        return root;
    }

    public static void write(ScreeningReport report, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(report).toString(2), StandardCharsets.UTF_8);
    }
}
