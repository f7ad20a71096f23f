package com.example.gridfill.engine.grid;

import java.io.Closeable;
import java.io.OutputStream;
import java.util.List;

/**
 * Read/write access to a spreadsheet document. The engine talks to the document only through this interface;
 * one instance serves exactly one fill and is not shared between threads.
 * Implementations wrap low level failures in {@link com.example.gridfill.exception.GridAdapterException}.
 */
public interface GridDocument extends Closeable {

    List<String> getSheetNames();

    CellContent readCell(CellRef ref);

    /**
     * Populated cells (values, formulas, styled blanks or commented cells) inside the region, row by row.
     */
    List<CellContent> readCells(Region region);

    /**
     * Every populated cell of a sheet, including cells that only carry a comment.
     */
    List<CellContent> readAllCells(String sheet);

    List<Region> readMergedRegions(String sheet);

    /**
     * Custom row height in points, or null when the row uses the sheet default.
     */
    Float readRowHeight(String sheet, int row);

    /**
     * Column width in 1/256 character units, or null when the column uses the sheet default.
     */
    Integer readColumnWidth(String sheet, int col);

    void writeValue(CellRef ref, Object value);

    void writeFormula(CellRef ref, String formula);

    void writeStyle(CellRef ref, int styleIndex);

    void writeComment(CellRef ref, String text);

    void writeHyperlink(CellRef ref, String url, String label);

    /**
     * Remove cells, comments, hyperlinks and merged regions inside the region.
     */
    void clearRegion(Region region);

    void mergeCells(Region region);

    void insertImage(Region region, byte[] data, ImageType type, double scaleX, double scaleY);

    void setRowHeight(String sheet, int row, float points);

    /**
     * Reset the row to automatic height so the spreadsheet application fits it to its content.
     */
    void markRowAutoHeight(String sheet, int row);

    void setColumnWidth(String sheet, int col, int width);

    void createSheet(String name);

    void duplicateSheet(String source, String target);

    void renameSheet(String from, String to);

    void moveSheet(String name, int position);

    void deleteSheet(String name);

    void hideSheet(String name);

    /**
     * A sheet name the document format accepts, derived from an arbitrary candidate.
     */
    String safeSheetName(String candidate);

    void setRecalculateOnOpen(boolean recalculate);

    void write(OutputStream out);
}
