package com.ashscreener.model;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tabular payload: an ordered list of rows keyed by canonical field names.
 */
public final class Table {
    private static final Table EMPTY = new Table(List.of());

    private final List<TableRow> rows;

    private Table(List<TableRow> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Table empty() {
        return EMPTY;
    }

    public static Table of(List<? extends Map<String, ?>> rawRows) {
        if (rawRows == null || rawRows.isEmpty()) {
            return EMPTY;
        }
        List<TableRow> out = new ArrayList<>(rawRows.size());
        for (Map<String, ?> raw : rawRows) {
            if (raw != null) {
                out.add(new TableRow(raw));
            }
        }
        return out.isEmpty() ? EMPTY : new Table(out);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public List<TableRow> rows() {
        return rows;
    }

    public TableRow row(int index) {
        return rows.get(index);
    }

    public String toJson() {
        JSONArray items = new JSONArray();
        for (TableRow row : rows) {
            items.put(new JSONObject(row.toMap()));
        }
        JSONObject root = new JSONObject();
        root.put("rows", items);
        return root.toString();
    }

    /**
     * @throws org.json.JSONException when the text is not a serialized table
     */
    public static Table fromJson(String text) {
        JSONObject root = new JSONObject(text);
        JSONArray items = root.getJSONArray("rows");
        List<Map<String, Object>> rawRows = new ArrayList<>(items.length());
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.getJSONObject(i);
            Map<String, Object> raw = new LinkedHashMap<>();
            for (String key : item.keySet()) {
                Object value = item.opt(key);
                if (value != null && value != JSONObject.NULL) {
                    raw.put(key, value);
                }
            }
            rawRows.add(raw);
        }
        return of(rawRows);
    }
}
