package com.example.gridfill.engine.grid;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only picture of every sheet of a template document.
 */
public final class TemplateSnapshot {
    private final Map<String, SheetSnapshot> sheets;

    private TemplateSnapshot(Map<String, SheetSnapshot> sheets) {
        this.sheets = Collections.unmodifiableMap(sheets);
    }

    public static TemplateSnapshot capture(GridDocument document) {
        Map<String, SheetSnapshot> sheets = new LinkedHashMap<>();
        for (String name : document.getSheetNames()) {
            List<CellContent> cells = document.readAllCells(name);
            Map<Integer, Float> heights = new HashMap<>();
            Map<Integer, Integer> widths = new HashMap<>();
            for (CellContent cell : cells) {
                int row = cell.getRef().getRow();
                int col = cell.getRef().getCol();
                if (!heights.containsKey(row)) {
                    Float height = document.readRowHeight(name, row);
                    if (height != null) {
                        heights.put(row, height);
                    }
                }
                if (!widths.containsKey(col)) {
                    Integer width = document.readColumnWidth(name, col);
                    if (width != null) {
                        widths.put(col, width);
                    }
                }
            }
            sheets.put(name, new SheetSnapshot(name, cells, document.readMergedRegions(name), heights, widths));
        }
        return new TemplateSnapshot(sheets);
    }

    public SheetSnapshot sheet(String name) {
        SheetSnapshot sheet = sheets.get(name);
        if (sheet == null) {
            throw new IllegalArgumentException("Unknown template sheet: " + name);
        }
        return sheet;
    }

    public boolean hasSheet(String name) {
        return sheets.containsKey(name);
    }

    public List<String> getSheetNames() {
        return List.copyOf(sheets.keySet());
    }
}
