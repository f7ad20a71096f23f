package com.example.gridfill.engine.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable copy of one template sheet taken before rendering starts, so the engine can read source cells
 * while it overwrites the same sheet in the output document.
 */
public final class SheetSnapshot {
    private final String name;
    private final NavigableMap<CellRef, CellContent> cells;
    private final List<Region> mergedRegions;
    private final Map<Integer, Float> rowHeights;
    private final Map<Integer, Integer> columnWidths;

    public SheetSnapshot(String name, List<CellContent> cells, List<Region> mergedRegions,
                         Map<Integer, Float> rowHeights, Map<Integer, Integer> columnWidths) {
        this.name = name;
        NavigableMap<CellRef, CellContent> sorted = new TreeMap<>();
        for (CellContent cell : cells) {
            sorted.put(key(cell.getRef().getRow(), cell.getRef().getCol()), cell);
        }
        this.cells = Collections.unmodifiableNavigableMap(sorted);
        this.mergedRegions = List.copyOf(mergedRegions);
        this.rowHeights = Map.copyOf(rowHeights);
        this.columnWidths = Map.copyOf(columnWidths);
    }

    public String getName() {
        return name;
    }

    public CellContent cell(int row, int col) {
        return cells.get(key(row, col));
    }

    public List<CellContent> cellsIn(Region region) {
        List<CellContent> found = new ArrayList<>();
        for (int row = region.getStartRow(); row <= region.getEndRow(); row++) {
            found.addAll(cells.subMap(key(row, region.getStartCol()), true, key(row, region.getEndCol()), true).values());
        }
        return found;
    }

    public List<CellContent> allCells() {
        return new ArrayList<>(cells.values());
    }

    public List<Region> getMergedRegions() {
        return mergedRegions;
    }

    /**
     * The merged region whose top-left cell is (row, col), or null.
     */
    public Region mergeStartingAt(int row, int col) {
        for (Region merged : mergedRegions) {
            if (merged.getStartRow() == row && merged.getStartCol() == col) {
                return merged;
            }
        }
        return null;
    }

    public Float rowHeight(int row) {
        return rowHeights.get(row);
    }

    public Integer columnWidth(int col) {
        return columnWidths.get(col);
    }

    private static CellRef key(int row, int col) {
        return CellRef.of(null, row, col);
    }
}
