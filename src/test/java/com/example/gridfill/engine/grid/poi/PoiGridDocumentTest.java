package com.example.gridfill.engine.grid.poi;

import com.example.gridfill.engine.TemplateWorkbook;
import com.example.gridfill.engine.grid.CellContent;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.exception.GridAdapterException;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellAddress;
import org.apache.poi.ss.util.CellRangeAddress;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static com.example.gridfill.engine.TemplateWorkbook.text;
import static org.junit.jupiter.api.Assertions.*;

public class PoiGridDocumentTest {

    private static byte[] template() throws Exception {
        return TemplateWorkbook.create("Sheet1")
                .value("A1", "Title").comment("A1", "jx:area(lastCell=\"C3\")")
                .value("B2", 42)
                .formula("C2", "B2*2")
                .merge("A3:B3")
                .value("E5", "outside")
                .sheet("Other").value("A1", "other")
                .toBytes();
    }

    private static Workbook reopen(PoiGridDocument document) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.write(out);
        return TemplateWorkbook.open(out.toByteArray());
    }

    @Test
    public void testReadsValuesFormulasAndComments() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            assertEquals(Arrays.asList("Sheet1", "Other"), document.getSheetNames());

            CellContent title = document.readCell(CellRef.of("Sheet1", 0, 0));
            assertEquals("Title", title.getValue());
            assertTrue(title.hasComment());
            assertEquals("jx:area(lastCell=\"C3\")", title.getComment());

            assertEquals(42.0, document.readCell(CellRef.of("Sheet1", 1, 1)).getValue());
            CellContent formula = document.readCell(CellRef.of("Sheet1", 1, 2));
            assertTrue(formula.isFormula());
            assertEquals("B2*2", formula.getFormula());
            assertNull(document.readCell(CellRef.of("Sheet1", 9, 9)));

            List<CellContent> inRegion = document.readCells(Region.of("Sheet1", 0, 0, 2, 2));
            assertEquals(3, inRegion.size());
            assertEquals(Arrays.asList(Region.of("Sheet1", 2, 0, 2, 1)), document.readMergedRegions("Sheet1"));
        }
    }

    @Test
    public void testClearRegionLeavesOutsideCells() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            document.clearRegion(Region.of("Sheet1", 0, 0, 2, 2));

            try (Workbook workbook = reopen(document)) {
                Sheet sheet = workbook.getSheet("Sheet1");
                assertNull(text(sheet, "A1"));
                assertNull(text(sheet, "B2"));
                assertNull(sheet.getCellComment(new CellAddress("A1")));
                assertEquals(0, sheet.getNumMergedRegions());
                assertEquals("outside", text(sheet, "E5"));
            }
        }
    }

    @Test
    public void testWritesValuesFormulasAndLinks() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            document.writeValue(CellRef.of("Sheet1", 5, 0), 7);
            document.writeValue(CellRef.of("Sheet1", 5, 1), true);
            document.writeValue(CellRef.of("Sheet1", 5, 2), LocalDate.of(2024, 3, 1));
            document.writeValue(CellRef.of("Sheet1", 5, 3), "text");
            document.writeFormula(CellRef.of("Sheet1", 6, 0), "SUM(A6:A6)");
            document.writeHyperlink(CellRef.of("Sheet1", 7, 0), "https://example.com", "site");
            document.writeComment(CellRef.of("Sheet1", 7, 1), "note");

            try (Workbook workbook = reopen(document)) {
                Sheet sheet = workbook.getSheet("Sheet1");
                assertEquals("7", text(sheet, "A6"));
                assertEquals("true", text(sheet, "B6"));
                assertEquals(LocalDate.of(2024, 3, 1), sheet.getRow(5).getCell(2).getLocalDateTimeCellValue().toLocalDate());
                assertEquals("text", text(sheet, "D6"));
                assertEquals("SUM(A6:A6)", text(sheet, "A7"));
                assertEquals("site", text(sheet, "A8"));
                assertEquals("https://example.com", sheet.getRow(7).getCell(0).getHyperlink().getAddress());
                assertEquals("note", sheet.getCellComment(new CellAddress("B8")).getString().getString());
            }
        }
    }

    @Test
    public void testInvalidFormulaIsRejected() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            assertThrows(GridAdapterException.class, () -> document.writeFormula(CellRef.of("Sheet1", 6, 0), "SUM(A1"));
        }
    }

    @Test
    public void testDuplicateSheetCopiesContentWithoutComments() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            document.duplicateSheet("Sheet1", "Copy");
            document.moveSheet("Copy", 1);
            // the copy has no comments part of its own, so clearing must not touch the original's
            document.clearRegion(Region.of("Copy", 1, 0, 1, 2));

            assertEquals(Arrays.asList("Sheet1", "Copy", "Other"), document.getSheetNames());
            try (Workbook workbook = reopen(document)) {
                Sheet copy = workbook.getSheet("Copy");
                assertEquals("Title", text(copy, "A1"));
                assertNull(copy.getCellComment(new CellAddress("A1")));
                assertNull(text(copy, "B2"));
                assertEquals(CellRangeAddress.valueOf("A3:B3"), copy.getMergedRegion(0));
                assertEquals("outside", text(copy, "E5"));

                Sheet original = workbook.getSheet("Sheet1");
                assertEquals("42", text(original, "B2"));
                assertNotNull(original.getCellComment(new CellAddress("A1")));
            }
        }
    }

    @Test
    public void testDuplicateSheetRejectsTakenName() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            assertThrows(GridAdapterException.class, () -> document.duplicateSheet("Sheet1", "Other"));
        }
    }

    @Test
    public void testSheetManagement() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            document.createSheet("Extra");
            document.renameSheet("Extra", "Renamed");
            document.hideSheet("Other");
            document.deleteSheet("Sheet1");
            document.setRecalculateOnOpen(true);

            assertEquals(Arrays.asList("Other", "Renamed"), document.getSheetNames());
            try (Workbook workbook = reopen(document)) {
                assertTrue(workbook.isSheetHidden(0));
                assertEquals(1, workbook.getActiveSheetIndex());
                assertTrue(workbook.getForceFormulaRecalculation());
            }
        }
    }

    @Test
    public void testRowHeightsAndAutoHeight() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            document.setRowHeight("Sheet1", 1, 40f);
            document.setRowHeight("Sheet1", 2, 30f);
            document.markRowAutoHeight("Sheet1", 2);
            document.setColumnWidth("Sheet1", 3, 5000);

            assertEquals(40f, document.readRowHeight("Sheet1", 1));
            assertNull(document.readRowHeight("Sheet1", 2));
            assertEquals(5000, document.readColumnWidth("Sheet1", 3));
            assertNull(document.readColumnWidth("Sheet1", 4));
        }
    }

    @Test
    public void testSafeSheetName() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            assertEquals("a b", document.safeSheetName("a/b"));
            assertEquals(31, document.safeSheetName("x".repeat(40)).length());
        }
    }

    @Test
    public void testMissingSheetFails() throws Exception {
        try (PoiGridDocument document = PoiGridDocument.open(template())) {
            assertThrows(GridAdapterException.class, () -> document.readAllCells("Nope"));
        }
    }
}
