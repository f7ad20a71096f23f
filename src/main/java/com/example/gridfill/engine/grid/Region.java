package com.example.gridfill.engine.grid;

import lombok.Value;

/**
 * Rectangle of cells governed by a command: top-left is the anchor cell, bottom-right the declared last cell.
 * Bounds are inclusive and zero-based.
 */
@Value
public class Region {
    String sheet;
    int startRow;
    int startCol;
    int endRow;
    int endCol;

    public static Region of(CellRef anchor, CellRef last) {
        return new Region(anchor.getSheet(), anchor.getRow(), anchor.getCol(), last.getRow(), last.getCol());
    }

    public static Region of(String sheet, int startRow, int startCol, int endRow, int endCol) {
        return new Region(sheet, startRow, startCol, endRow, endCol);
    }

    public int getHeight() {
        return endRow - startRow + 1;
    }

    public int getWidth() {
        return endCol - startCol + 1;
    }

    public boolean isEmpty() {
        return endRow < startRow || endCol < startCol;
    }

    public CellRef getAnchor() {
        return CellRef.of(sheet, startRow, startCol);
    }

    public long getCellCount() {
        return isEmpty() ? 0 : (long) getHeight() * getWidth();
    }

    public Size getSize() {
        return Size.of(getWidth(), getHeight());
    }

    public boolean contains(int row, int col) {
        return row >= startRow && row <= endRow && col >= startCol && col <= endCol;
    }

    public boolean contains(CellRef ref) {
        return sameSheet(ref.getSheet()) && contains(ref.getRow(), ref.getCol());
    }

    public boolean contains(Region other) {
        return sameSheet(other.sheet)
                && other.startRow >= startRow && other.endRow <= endRow
                && other.startCol >= startCol && other.endCol <= endCol;
    }

    public boolean intersects(Region other) {
        return sameSheet(other.sheet)
                && other.startRow <= endRow && other.endRow >= startRow
                && other.startCol <= endCol && other.endCol >= startCol;
    }

    public boolean rowsOverlap(Region other) {
        return other.startRow <= endRow && other.endRow >= startRow;
    }

    public Region withSheet(String sheetName) {
        return new Region(sheetName, startRow, startCol, endRow, endCol);
    }

    /**
     * Same-sized region moved so its anchor sits at {@code anchor}.
     */
    public Region moveTo(CellRef anchor) {
        return new Region(anchor.getSheet(), anchor.getRow(), anchor.getCol(),
                anchor.getRow() + endRow - startRow, anchor.getCol() + endCol - startCol);
    }

    private boolean sameSheet(String other) {
        return sheet == null || other == null || sheet.equals(other);
    }

    @Override
    public String toString() {
        String range = CellRef.of(null, startRow, startCol).toA1() + ":" + CellRef.of(null, endRow, endCol).toA1();
        return sheet == null ? range : CellRef.quoteSheet(sheet) + "!" + range;
    }
}
