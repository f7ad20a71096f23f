package com.example.gridfill.engine.grid.poi;

import com.example.gridfill.engine.grid.CellContent;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.GridDocument;
import com.example.gridfill.engine.grid.ImageType;
import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.exception.GridAdapterException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.formula.FormulaParseException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Drawing;
import org.apache.poi.ss.usermodel.Hyperlink;
import org.apache.poi.ss.usermodel.Picture;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellAddress;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GridDocument} backed by an Apache POI workbook (xlsx or xls).
 */
@Slf4j
public class PoiGridDocument implements GridDocument {
    private final Workbook workbook;

    public PoiGridDocument(Workbook workbook) {
        this.workbook = workbook;
    }

    public static PoiGridDocument open(byte[] content) {
        try {
            return new PoiGridDocument(WorkbookFactory.create(new ByteArrayInputStream(content)));
        } catch (IOException | RuntimeException e) {
            throw new GridAdapterException("Failed to open workbook: " + e.getMessage(), e);
        }
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    @Override
    public List<String> getSheetNames() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return names;
    }

    @Override
    public CellContent readCell(CellRef ref) {
        Sheet sheet = sheet(ref.getSheet());
        Row row = sheet.getRow(ref.getRow());
        Cell cell = row == null ? null : row.getCell(ref.getCol());
        Comment comment = sheet.getCellComment(new CellAddress(ref.getRow(), ref.getCol()));
        if (cell == null && comment == null) {
            return null;
        }
        return toContent(ref, cell, comment);
    }

    @Override
    public List<CellContent> readCells(Region region) {
        List<CellContent> cells = new ArrayList<>();
        for (CellContent cell : readAllCells(region.getSheet())) {
            if (region.contains(cell.getRef().getRow(), cell.getRef().getCol())) {
                cells.add(cell);
            }
        }
        return cells;
    }

    @Override
    public List<CellContent> readAllCells(String sheetName) {
        Sheet sheet = sheet(sheetName);
        Map<CellAddress, Comment> comments = new LinkedHashMap<>(sheet.getCellComments());
        List<CellContent> cells = new ArrayList<>();
        for (Row row : sheet) {
            for (Cell cell : row) {
                CellAddress address = new CellAddress(cell.getRowIndex(), cell.getColumnIndex());
                Comment comment = comments.remove(address);
                cells.add(toContent(CellRef.of(sheetName, cell.getRowIndex(), cell.getColumnIndex()), cell, comment));
            }
        }
        // comments attached to cells that were never created
        for (Map.Entry<CellAddress, Comment> orphan : comments.entrySet()) {
            CellAddress address = orphan.getKey();
            cells.add(toContent(CellRef.of(sheetName, address.getRow(), address.getColumn()), null, orphan.getValue()));
        }
        return cells;
    }

    @Override
    public List<Region> readMergedRegions(String sheetName) {
        List<Region> regions = new ArrayList<>();
        for (CellRangeAddress range : sheet(sheetName).getMergedRegions()) {
            regions.add(Region.of(sheetName, range.getFirstRow(), range.getFirstColumn(), range.getLastRow(), range.getLastColumn()));
        }
        return regions;
    }

    @Override
    public Float readRowHeight(String sheetName, int rowIndex) {
        Sheet sheet = sheet(sheetName);
        Row row = sheet.getRow(rowIndex);
        if (row == null || row.getHeight() == sheet.getDefaultRowHeight()) {
            return null;
        }
        return row.getHeightInPoints();
    }

    @Override
    public Integer readColumnWidth(String sheetName, int col) {
        Sheet sheet = sheet(sheetName);
        int width = sheet.getColumnWidth(col);
        return width == sheet.getDefaultColumnWidth() * 256 ? null : width;
    }

    @Override
    public void writeValue(CellRef ref, Object value) {
        Cell cell = cellAt(ref);
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
        } else if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
        } else if (value instanceof Date) {
            cell.setCellValue((Date) value);
        } else if (value instanceof Calendar) {
            cell.setCellValue((Calendar) value);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    @Override
    public void writeFormula(CellRef ref, String formula) {
        try {
            cellAt(ref).setCellFormula(formula);
        } catch (FormulaParseException e) {
            throw new GridAdapterException("Invalid formula '" + formula + "' at " + ref, e);
        }
    }

    @Override
    public void writeStyle(CellRef ref, int styleIndex) {
        if (styleIndex < 0 || styleIndex >= workbook.getNumCellStyles()) {
            return;
        }
        cellAt(ref).setCellStyle(workbook.getCellStyleAt(styleIndex));
    }

    @Override
    public void writeComment(CellRef ref, String text) {
        Sheet sheet = sheet(ref.getSheet());
        CreationHelper helper = workbook.getCreationHelper();
        Drawing<?> drawing = sheet.createDrawingPatriarch();
        ClientAnchor anchor = helper.createClientAnchor();
        anchor.setCol1(ref.getCol());
        anchor.setCol2(ref.getCol() + 3);
        anchor.setRow1(ref.getRow());
        anchor.setRow2(ref.getRow() + 3);
        Comment comment = drawing.createCellComment(anchor);
        comment.setString(helper.createRichTextString(text));
        cellAt(ref).setCellComment(comment);
    }

    @Override
    public void writeHyperlink(CellRef ref, String url, String label) {
        try {
            Hyperlink link = workbook.getCreationHelper().createHyperlink(HyperlinkType.URL);
            link.setAddress(url);
            Cell cell = cellAt(ref);
            cell.setCellValue(label);
            cell.setHyperlink(link);
        } catch (IllegalArgumentException e) {
            throw new GridAdapterException("Invalid hyperlink address '" + url + "' at " + ref, e);
        }
    }

    @Override
    public void clearRegion(Region region) {
        Sheet sheet = sheet(region.getSheet());
        for (CellAddress address : new ArrayList<>(sheet.getCellComments().keySet())) {
            if (region.contains(address.getRow(), address.getColumn())) {
                Row row = sheet.getRow(address.getRow());
                if (row == null) {
                    row = sheet.createRow(address.getRow());
                }
                Cell cell = row.getCell(address.getColumn(), Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
                cell.removeCellComment();
            }
        }
        for (int r = region.getStartRow(); r <= region.getEndRow(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            for (int c = region.getStartCol(); c <= region.getEndCol(); c++) {
                Cell cell = row.getCell(c);
                if (cell != null) {
                    cell.removeHyperlink();
                    row.removeCell(cell);
                }
            }
        }
        for (int i = sheet.getNumMergedRegions() - 1; i >= 0; i--) {
            CellRangeAddress merged = sheet.getMergedRegion(i);
            if (region.contains(Region.of(region.getSheet(), merged.getFirstRow(), merged.getFirstColumn(),
                    merged.getLastRow(), merged.getLastColumn()))) {
                sheet.removeMergedRegion(i);
            }
        }
    }

    @Override
    public void mergeCells(Region region) {
        try {
            sheet(region.getSheet()).addMergedRegion(new CellRangeAddress(
                    region.getStartRow(), region.getEndRow(), region.getStartCol(), region.getEndCol()));
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new GridAdapterException("Cannot merge " + region + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void insertImage(Region region, byte[] data, ImageType type, double scaleX, double scaleY) {
        Sheet sheet = sheet(region.getSheet());
        int pictureIndex = workbook.addPicture(data, pictureType(type));
        ClientAnchor anchor = workbook.getCreationHelper().createClientAnchor();
        anchor.setAnchorType(ClientAnchor.AnchorType.MOVE_AND_RESIZE);
        anchor.setCol1(region.getStartCol());
        anchor.setRow1(region.getStartRow());
        anchor.setCol2(region.getEndCol() + 1);
        anchor.setRow2(region.getEndRow() + 1);
        Picture picture = sheet.createDrawingPatriarch().createPicture(anchor, pictureIndex);
        if (scaleX != 1.0 || scaleY != 1.0) {
            picture.resize(scaleX, scaleY);
        }
        log.debug("Inserted {} image ({} bytes) at {}", type, data.length, region);
    }

    @Override
    public void setRowHeight(String sheetName, int rowIndex, float points) {
        rowAt(sheet(sheetName), rowIndex).setHeightInPoints(points);
    }

    @Override
    public void markRowAutoHeight(String sheetName, int rowIndex) {
        // -1 drops the explicit height so the application fits the row on open
        rowAt(sheet(sheetName), rowIndex).setHeight((short) -1);
    }

    @Override
    public void setColumnWidth(String sheetName, int col, int width) {
        sheet(sheetName).setColumnWidth(col, width);
    }

    @Override
    public void createSheet(String name) {
        workbook.createSheet(name);
    }

    /**
     * Copies values, formulas, styles, hyperlinks, merged regions, row heights and column widths. Comments and
     * drawings stay behind: cloning a sheet that has comments leaves both sheets sharing one comments part.
     */
    @Override
    public void duplicateSheet(String source, String target) {
        Sheet from = sheet(source);
        Sheet to;
        try {
            to = workbook.createSheet(target);
        } catch (IllegalArgumentException e) {
            throw new GridAdapterException("Cannot copy sheet '" + source + "' to '" + target + "': " + e.getMessage(), e);
        }
        to.setDefaultRowHeight(from.getDefaultRowHeight());
        to.setDefaultColumnWidth(from.getDefaultColumnWidth());
        to.setDisplayGridlines(from.isDisplayGridlines());
        int lastCol = 0;
        for (Row row : from) {
            Row copy = to.createRow(row.getRowNum());
            copy.setHeight(row.getHeight());
            if (row.getZeroHeight()) {
                copy.setZeroHeight(true);
            }
            if (row.isFormatted()) {
                copy.setRowStyle(row.getRowStyle());
            }
            for (Cell cell : row) {
                copyCell(cell, copy.createCell(cell.getColumnIndex()));
                lastCol = Math.max(lastCol, cell.getColumnIndex());
            }
        }
        for (int c = 0; c <= lastCol; c++) {
            to.setColumnWidth(c, from.getColumnWidth(c));
            to.setColumnHidden(c, from.isColumnHidden(c));
        }
        for (CellRangeAddress merged : from.getMergedRegions()) {
            to.addMergedRegion(merged.copy());
        }
    }

    @Override
    public void renameSheet(String from, String to) {
        workbook.setSheetName(sheetIndex(from), to);
    }

    @Override
    public void moveSheet(String name, int position) {
        workbook.setSheetOrder(name, position);
    }

    @Override
    public void deleteSheet(String name) {
        int index = sheetIndex(name);
        boolean wasActive = workbook.getActiveSheetIndex() == index;
        workbook.removeSheetAt(index);
        if (wasActive && workbook.getNumberOfSheets() > 0) {
            activateFirstVisibleSheet();
        }
    }

    @Override
    public void hideSheet(String name) {
        int index = sheetIndex(name);
        workbook.getSheetAt(index).setSelected(false);
        workbook.setSheetHidden(index, true);
        if (workbook.getActiveSheetIndex() == index) {
            activateFirstVisibleSheet();
        }
    }

    @Override
    public String safeSheetName(String candidate) {
        return WorkbookUtil.createSafeSheetName(candidate);
    }

    @Override
    public void setRecalculateOnOpen(boolean recalculate) {
        workbook.setForceFormulaRecalculation(recalculate);
    }

    @Override
    public void write(OutputStream out) {
        try {
            workbook.write(out);
        } catch (IOException e) {
            throw new GridAdapterException("Failed to serialize workbook", e);
        }
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }

    private void activateFirstVisibleSheet() {
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            if (!workbook.isSheetHidden(i) && !workbook.isSheetVeryHidden(i)) {
                workbook.setActiveSheet(i);
                workbook.getSheetAt(i).setSelected(true);
                return;
            }
        }
    }

    private CellContent toContent(CellRef ref, Cell cell, Comment comment) {
        CellContent.CellContentBuilder builder = CellContent.builder().ref(ref);
        if (comment != null && comment.getString() != null) {
            builder.comment(comment.getString().getString());
        }
        if (cell == null) {
            return builder.build();
        }
        builder.styleIndex(cell.getCellStyle().getIndex());
        switch (cell.getCellType()) {
            case STRING:
                builder.value(cell.getStringCellValue());
                break;
            case NUMERIC:
                builder.value(DateUtil.isCellDateFormatted(cell) ? cell.getLocalDateTimeCellValue() : cell.getNumericCellValue());
                break;
            case BOOLEAN:
                builder.value(cell.getBooleanCellValue());
                break;
            case FORMULA:
                builder.formula(cell.getCellFormula());
                break;
            default:
                break;
        }
        return builder.build();
    }

    private int pictureType(ImageType type) {
        switch (type) {
            case PNG:
                return Workbook.PICTURE_TYPE_PNG;
            case JPEG:
                return Workbook.PICTURE_TYPE_JPEG;
            case EMF:
                return Workbook.PICTURE_TYPE_EMF;
            case WMF:
                return Workbook.PICTURE_TYPE_WMF;
            case PICT:
                return Workbook.PICTURE_TYPE_PICT;
            case DIB:
                return Workbook.PICTURE_TYPE_DIB;
            case GIF:
            case BMP:
                if (!(workbook instanceof XSSFWorkbook)) {
                    throw new GridAdapterException(type + " images require an xlsx workbook", null);
                }
                return type == ImageType.GIF ? XSSFWorkbook.PICTURE_TYPE_GIF : XSSFWorkbook.PICTURE_TYPE_BMP;
            default:
                throw new GridAdapterException("Unsupported image type " + type, null);
        }
    }

    private void copyCell(Cell from, Cell to) {
        to.setCellStyle(from.getCellStyle());
        switch (from.getCellType()) {
            case STRING:
                to.setCellValue(from.getRichStringCellValue());
                break;
            case NUMERIC:
                to.setCellValue(from.getNumericCellValue());
                break;
            case BOOLEAN:
                to.setCellValue(from.getBooleanCellValue());
                break;
            case FORMULA:
                to.setCellFormula(from.getCellFormula());
                break;
            case ERROR:
                to.setCellErrorValue(from.getErrorCellValue());
                break;
            default:
                break;
        }
        Hyperlink link = from.getHyperlink();
        if (link != null) {
            Hyperlink copy = workbook.getCreationHelper().createHyperlink(link.getType());
            copy.setAddress(link.getAddress());
            copy.setLabel(link.getLabel());
            to.setHyperlink(copy);
        }
    }

    private Sheet sheet(String name) {
        Sheet sheet = name == null ? workbook.getSheetAt(0) : workbook.getSheet(name);
        if (sheet == null) {
            throw new GridAdapterException("Sheet not found: " + name, null);
        }
        return sheet;
    }

    private int sheetIndex(String name) {
        int index = workbook.getSheetIndex(name);
        if (index < 0) {
            throw new GridAdapterException("Sheet not found: " + name, null);
        }
        return index;
    }

    private Row rowAt(Sheet sheet, int rowIndex) {
        Row row = sheet.getRow(rowIndex);
        return row != null ? row : sheet.createRow(rowIndex);
    }

    private Cell cellAt(CellRef ref) {
        Row row = rowAt(sheet(ref.getSheet()), ref.getRow());
        return row.getCell(ref.getCol(), Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
    }
}
