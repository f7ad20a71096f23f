package com.example.gridfill.engine.grid;

import lombok.Value;
import org.apache.poi.ss.util.CellReference;

import java.util.regex.Pattern;

/**
 * Zero-based cell coordinate, optionally qualified by sheet name.
 */
@Value
public class CellRef implements Comparable<CellRef> {
    private static final Pattern A1 = Pattern.compile("^(?:(?:'(?:[^']|'')+'|[^'!]+)!)?\\$?[A-Za-z]{1,3}\\$?\\d+$");

    String sheet;
    int row;
    int col;

    public static CellRef of(String sheet, int row, int col) {
        return new CellRef(sheet, row, col);
    }

    /**
     * Parse an A1-style reference such as {@code C5}, {@code $C$5} or {@code 'Q1 Sales'!C5}.
     * References without a sheet prefix take {@code defaultSheet}.
     *
     * @throws IllegalArgumentException when the text is not a cell reference
     */
    public static CellRef parse(String text, String defaultSheet) {
        String trimmed = text == null ? "" : text.trim();
        if (!A1.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Not a cell reference: '" + text + "'");
        }
        CellReference ref = new CellReference(trimmed);
        String sheet = ref.getSheetName() != null ? ref.getSheetName() : defaultSheet;
        return new CellRef(sheet, ref.getRow(), ref.getCol());
    }

    public CellRef withSheet(String sheetName) {
        return new CellRef(sheetName, row, col);
    }

    public CellRef offset(int rows, int cols) {
        return new CellRef(sheet, row + rows, col + cols);
    }

    /**
     * The reference without sheet prefix, e.g. {@code B4}.
     */
    public String toA1() {
        return toA1(false, false);
    }

    /**
     * The reference without sheet prefix, with {@code $} markers where asked, e.g. {@code $B4}.
     */
    public String toA1(boolean absoluteCol, boolean absoluteRow) {
        return (absoluteCol ? "$" : "") + CellReference.convertNumToColString(col) + (absoluteRow ? "$" : "") + (row + 1);
    }

    @Override
    public int compareTo(CellRef other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public String toString() {
        if (sheet == null) {
            return toA1();
        }
        return quoteSheet(sheet) + "!" + toA1();
    }

    public static String quoteSheet(String sheetName) {
        if (sheetName.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            return sheetName;
        }
        return "'" + sheetName.replace("'", "''") + "'";
    }
}
