package com.example.gridfill.engine;

import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.GridDocument;
import com.example.gridfill.engine.transform.FillRun;
import com.example.gridfill.exception.ExpressionEvaluationException;
import com.example.gridfill.exception.GridAdapterException;
import com.example.gridfill.exception.TemplateConfigurationException;
import com.example.gridfill.exception.TemplateParseException;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellAddress;
import org.apache.poi.ss.util.CellRangeAddress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.example.gridfill.engine.TemplateWorkbook.text;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end fills of small templates built in memory.
 */
public class GridFillerTest {

    private final GridFiller filler = new GridFiller();

    @TempDir
    Path tempDir;

    private static Map<String, Object> employee(String name, String dept, int salary) {
        Map<String, Object> e = new HashMap<>();
        e.put("name", name);
        e.put("dept", dept);
        e.put("salary", salary);
        return e;
    }

    private static List<Map<String, Object>> employees() {
        return Arrays.asList(
                employee("Elsa", "sales", 1500),
                employee("Oleg", "it", 2300),
                employee("John", "sales", 2800));
    }

    /**
     * Header row, one each row with a per-row formula, a total row with a SUM formula, and a cell outside the area.
     */
    private static byte[] employeeTemplate() throws Exception {
        return TemplateWorkbook.create("Employees")
                .value("A1", "Name").comment("A1", "jx:area(lastCell=\"C3\")")
                .value("B1", "Salary")
                .value("C1", "Bonus")
                .value("A2", "${e.name}").comment("A2", "jx:each(items=\"employees\" var=\"e\" lastCell=\"C2\")")
                .value("B2", "${e.salary}")
                .formula("C2", "B2*0.1")
                .value("A3", "Total")
                .formula("B3", "SUM(B2)")
                .value("E1", "outside ${untouched}")
                .toBytes();
    }

    private Workbook fill(byte[] template, Map<String, ?> data, FillOptions options) throws Exception {
        FillResult result = filler.fillToBytes(filler.compile("test.xlsx", template), data, options);
        assertNotNull(result.getContent());
        return TemplateWorkbook.open(result.getContent());
    }

    @Test
    public void testEachRepeatsRowsAndShiftsTotals() throws Exception {
        try (Workbook workbook = fill(employeeTemplate(), Map.of("employees", employees()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheet("Employees");

            assertEquals("Name", text(sheet, "A1"));
            assertEquals("Elsa", text(sheet, "A2"));
            assertEquals("Oleg", text(sheet, "A3"));
            assertEquals("John", text(sheet, "A4"));
            assertEquals(2300.0, sheet.getRow(2).getCell(1).getNumericCellValue());
            assertEquals("B2*0.1", text(sheet, "C2"));
            assertEquals("B3*0.1", text(sheet, "C3"));
            assertEquals("B4*0.1", text(sheet, "C4"));
            assertEquals("Total", text(sheet, "A5"));
            assertEquals("SUM(B2:B4)", text(sheet, "B5"));
            assertNull(text(sheet, "A6"));
            // outside the area nothing is touched, placeholders included
            assertEquals("outside ${untouched}", text(sheet, "E1"));
            // command comments do not survive
            assertNull(sheet.getCellComment(new CellAddress("A1")));
            assertNull(sheet.getCellComment(new CellAddress("A2")));
            assertTrue(workbook.getForceFormulaRecalculation());
        }
    }

    @Test
    public void testEmptyCollectionRemovesBlock() throws Exception {
        try (Workbook workbook = fill(employeeTemplate(), Map.of("employees", Collections.emptyList()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheet("Employees");

            assertEquals("Total", text(sheet, "A2"));
            assertEquals("SUM(0)", text(sheet, "B2"));
            assertNull(text(sheet, "A3"));
        }
    }

    @Test
    public void testNestedEachOverGroups() throws Exception {
        byte[] template = TemplateWorkbook.create("Depts")
                .value("A1", "${g.key}").comment("A1", "jx:area(lastCell=\"B2\")",
                        "jx:each(items=\"employees\" var=\"g\" groupBy=\"g.dept\" lastCell=\"B2\")")
                .value("B1", "${size(g.items)} people")
                .value("A2", "${i + 1}. ${e.name}").comment("A2", "jx:each(items=\"g.items\" var=\"e\" varIndex=\"i\" lastCell=\"B2\")")
                .value("B2", "${e.salary}")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("employees", employees()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheet("Depts");

            assertEquals("sales", text(sheet, "A1"));
            assertEquals("2 people", text(sheet, "B1"));
            assertEquals("1. Elsa", text(sheet, "A2"));
            assertEquals("2. John", text(sheet, "A3"));
            assertEquals("2800", text(sheet, "B3"));
            assertEquals("it", text(sheet, "A4"));
            assertEquals("1 people", text(sheet, "B4"));
            assertEquals("1. Oleg", text(sheet, "A5"));
            assertNull(text(sheet, "A6"));
        }
    }

    @Test
    public void testSelectAndOrderBy() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${e.name}").comment("A1", "jx:area(lastCell=\"A1\")",
                        "jx:each(items=\"employees\" var=\"e\" select=\"e.salary > 2000\" orderBy=\"e.salary DESC\" lastCell=\"A1\")")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("employees", employees()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("John", text(sheet, "A1"));
            assertEquals("Oleg", text(sheet, "A2"));
            assertNull(text(sheet, "A3"));
        }
    }

    @Test
    public void testIfElseBranches() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "Name").comment("A1", "jx:area(lastCell=\"B3\")")
                .value("A2", "${e.name}").comment("A2", "jx:each(items=\"employees\" var=\"e\" lastCell=\"B3\")",
                        "jx:if(condition=\"e.salary > 2000\" lastCell=\"B3\" areas=[\"A2:B2\",\"A3:B3\"])")
                .value("B2", "rich")
                .value("A3", "${e.name}")
                .value("B3", "modest")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("employees", employees()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Elsa", text(sheet, "A2"));
            assertEquals("modest", text(sheet, "B2"));
            assertEquals("Oleg", text(sheet, "A3"));
            assertEquals("rich", text(sheet, "B3"));
            assertEquals("John", text(sheet, "A4"));
            assertEquals("rich", text(sheet, "B4"));
            assertNull(text(sheet, "A5"));
        }
    }

    @Test
    public void testFalseIfWithoutElseRemovesItsRows() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "Header").comment("A1", "jx:area(lastCell=\"A3\")")
                .value("A2", "${note}").comment("A2", "jx:if(condition=\"showNote\" lastCell=\"A2\")")
                .value("A3", "Footer")
                .toBytes();

        Map<String, Object> hidden = Map.of("showNote", false, "note", "n");
        try (Workbook workbook = fill(template, hidden, FillOptions.defaults())) {
            assertEquals("Footer", text(workbook.getSheetAt(0), "A2"));
            assertNull(text(workbook.getSheetAt(0), "A3"));
        }
        Map<String, Object> shown = Map.of("showNote", true, "note", "n");
        try (Workbook workbook = fill(template, shown, FillOptions.defaults())) {
            assertEquals("n", text(workbook.getSheetAt(0), "A2"));
            assertEquals("Footer", text(workbook.getSheetAt(0), "A3"));
        }
    }

    @Test
    public void testRightDirectionPushesCellsRight() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${x}").comment("A1", "jx:area(lastCell=\"B1\")",
                        "jx:each(items=\"xs\" var=\"x\" direction=\"RIGHT\" lastCell=\"A1\")")
                .value("B1", "end")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("xs", Arrays.asList("a", "b", "c")), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("a", text(sheet, "A1"));
            assertEquals("b", text(sheet, "B1"));
            assertEquals("c", text(sheet, "C1"));
            assertEquals("end", text(sheet, "D1"));
        }
    }

    @Test
    public void testGridWritesHeadersAndRows() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "").comment("A1", "jx:area(lastCell=\"C3\")",
                        "jx:grid(headers=\"headers\" data=\"employees\" props=\"name,salary\" lastCell=\"A2\")")
                .value("A3", "End")
                .toBytes();
        Map<String, Object> data = Map.of("headers", Arrays.asList("Name", "Salary"), "employees", employees());

        try (Workbook workbook = fill(template, data, FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Name", text(sheet, "A1"));
            assertEquals("Salary", text(sheet, "B1"));
            assertEquals("Elsa", text(sheet, "A2"));
            assertEquals("1500", text(sheet, "B2"));
            assertEquals("John", text(sheet, "A4"));
            assertEquals("End", text(sheet, "A5"));
        }
    }

    @Test
    public void testMergeCellsDeclaresMergedBlock() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${title}").comment("A1", "jx:area(lastCell=\"C2\")",
                        "jx:mergeCells(cols=\"span\" rows=\"1\" lastCell=\"A1\")")
                .value("A2", "body")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("title", "Report", "span", 3), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Report", text(sheet, "A1"));
            assertEquals(1, sheet.getNumMergedRegions());
            assertEquals(CellRangeAddress.valueOf("A1:C1"), sheet.getMergedRegion(0));
        }
        // below minCols nothing is merged
        byte[] guarded = TemplateWorkbook.create("Sheet1")
                .value("A1", "${title}").comment("A1", "jx:area(lastCell=\"C2\")",
                        "jx:mergeCells(cols=\"span\" rows=\"1\" minCols=\"4\" lastCell=\"A1\")")
                .toBytes();
        try (Workbook workbook = fill(guarded, Map.of("title", "Report", "span", 3), FillOptions.defaults())) {
            assertEquals(0, workbook.getSheetAt(0).getNumMergedRegions());
        }
    }

    @Test
    public void testTemplateMergesFollowTheirCells() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${e.name}").comment("A1", "jx:area(lastCell=\"B1\")",
                        "jx:each(items=\"employees\" var=\"e\" lastCell=\"B1\")")
                .merge("A1:B1")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("employees", employees()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals(3, sheet.getNumMergedRegions());
            List<CellRangeAddress> merged = sheet.getMergedRegions();
            assertTrue(merged.contains(CellRangeAddress.valueOf("A3:B3")));
        }
    }

    @Test
    public void testAutoRowHeightRowsAreRendered() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${e.name}").comment("A1", "jx:area(lastCell=\"A1\")",
                        "jx:each(items=\"employees\" var=\"e\" lastCell=\"A1\")",
                        "jx:autoRowHeight(lastCell=\"A1\")")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("employees", employees()), FillOptions.defaults())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Elsa", text(sheet, "A1"));
            assertEquals("John", text(sheet, "A3"));
            assertEquals(sheet.getDefaultRowHeight(), sheet.getRow(2).getHeight());
        }
    }

    @Test
    public void testImageInsertedFromBinaryData() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "Logo").comment("A1", "jx:area(lastCell=\"B3\")")
                .value("A2", "").comment("A2", "jx:image(src=\"logo\" imageType=\"PNG\" lastCell=\"B3\")")
                .toBytes();
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n', 0, 0, 0, 0};

        try (Workbook workbook = fill(template, Map.of("logo", png), FillOptions.defaults())) {
            assertEquals(1, workbook.getAllPictures().size());
        }

        FillResult wrongType = filler.fillToBytes(filler.compile("t.xlsx", template), Map.of("logo", "not bytes"), FillOptions.defaults());
        assertEquals(1, wrongType.getDiagnostics().size());
        assertEquals("TYPE_MISMATCH", wrongType.getDiagnostics().get(0).getCode());

        Map<String, Object> noLogo = new HashMap<>();
        noLogo.put("logo", null);
        FillResult skipped = filler.fillToBytes(filler.compile("t.xlsx", template), noLogo, FillOptions.defaults());
        assertFalse(skipped.hasDiagnostics());
    }

    @Test
    public void testTextFormulaSubstitutesPlaceholders() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${x}").comment("A1", "jx:area(lastCell=\"A2\")",
                        "jx:each(items=\"xs\" var=\"x\" lastCell=\"A1\")")
                .value("A2", "$[SUM(A1)*${rate}]")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("xs", Arrays.asList(1, 2, 3), "rate", 0.5), FillOptions.defaults())) {
            assertEquals("SUM(A1:A3)*0.5", text(workbook.getSheetAt(0), "A4"));
        }
    }

    @Test
    public void testExpressionErrorsBecomeDiagnostics() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${e.name}").comment("A1", "jx:area(lastCell=\"B1\")",
                        "jx:each(items=\"employees\" var=\"e\" lastCell=\"B1\")")
                .value("B1", "${e.name * 2}")
                .toBytes();

        FillResult result = filler.fillToBytes(filler.compile("t.xlsx", template), Map.of("employees", employees()),
                FillOptions.builder().annotateErrors(true).build());

        assertEquals(3, result.getDiagnostics().size());
        Diagnostic first = result.getDiagnostics().get(0);
        assertEquals("TYPE_MISMATCH", first.getCode());
        assertEquals("Sheet1!B1", first.getLocation());
        try (Workbook workbook = TemplateWorkbook.open(result.getContent())) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Oleg", text(sheet, "A2"));
            assertNull(text(sheet, "B2"));
            assertNotNull(sheet.getCellComment(new CellAddress("B2")));
        }
    }

    @Test
    public void testFailFastAbortsWithLocation() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${missing}").comment("A1", "jx:area(lastCell=\"A1\")")
                .toBytes();
        CompiledTemplate compiled = filler.compile("t.xlsx", template);

        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> filler.fillToBytes(compiled, Map.of(), FillOptions.builder().failFast(true).build()));
        assertEquals("UNRESOLVED_VARIABLE", e.getCode());
        assertEquals("Sheet1!A1", e.getLocation());
    }

    @Test
    public void testMultisheetCreatesOneSheetPerItem() throws Exception {
        byte[] template = TemplateWorkbook.create("Template")
                .value("A1", "${d.name}").comment("A1", "jx:area(lastCell=\"B2\")",
                        "jx:each(items=\"departments\" var=\"d\" multisheet=\"sheetNames\" lastCell=\"B2\")")
                .value("A2", "Head: ${d.head}")
                .sheet("Summary").value("A1", "static")
                .toBytes();
        Map<String, Object> data = Map.of(
                "departments", Arrays.asList(Map.of("name", "Sales", "head", "Elsa"), Map.of("name", "IT", "head", "Oleg")),
                "sheetNames", Arrays.asList("Sales", "IT"));

        try (Workbook workbook = fill(template, data, FillOptions.defaults())) {
            assertEquals(3, workbook.getNumberOfSheets());
            assertEquals("Sales", workbook.getSheetName(0));
            assertEquals("IT", workbook.getSheetName(1));
            assertEquals("Summary", workbook.getSheetName(2));
            assertEquals("Head: Oleg", text(workbook.getSheet("IT"), "A2"));
            assertEquals("Sales", text(workbook.getSheet("Sales"), "A1"));
        }

        try (Workbook workbook = fill(template, data, FillOptions.builder().hideTemplateSheet(true).build())) {
            assertEquals("Template", workbook.getSheetName(0));
            assertTrue(workbook.isSheetHidden(0));
            // the kept template is left as it was
            assertEquals("${d.name}", text(workbook.getSheet("Template"), "A1"));
            assertEquals("Sales", workbook.getSheetName(1));
        }
    }

    @Test
    public void testMultisheetNameCountMismatchFails() throws Exception {
        byte[] template = TemplateWorkbook.create("Template")
                .value("A1", "${d}").comment("A1", "jx:area(lastCell=\"A1\")",
                        "jx:each(items=\"departments\" var=\"d\" multisheet=\"sheetNames\" lastCell=\"A1\")")
                .toBytes();
        CompiledTemplate compiled = filler.compile("t.xlsx", template);

        TemplateConfigurationException e = assertThrows(TemplateConfigurationException.class,
                () -> filler.fillToBytes(compiled, Map.of("departments", List.of("a", "b"), "sheetNames", List.of("A")),
                        FillOptions.defaults()));
        assertEquals(FillRun.MULTISHEET_COUNT_MISMATCH, e.getCode());
    }

    @Test
    public void testDuplicateSheetNamesAreMadeUnique() throws Exception {
        byte[] template = TemplateWorkbook.create("Template")
                .value("A1", "${d}").comment("A1", "jx:area(lastCell=\"A1\")",
                        "jx:each(items=\"departments\" var=\"d\" multisheet=\"departments\" lastCell=\"A1\")")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("departments", List.of("Sales", "sales", "")), FillOptions.defaults())) {
            assertEquals("Sales", workbook.getSheetName(0));
            assertEquals("sales (2)", workbook.getSheetName(1));
            assertEquals("Template_3", workbook.getSheetName(2));
        }
    }

    @Test
    public void testCustomNotation() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "{{name}} and ${name}").comment("A1", "jx:area(lastCell=\"A1\")")
                .toBytes();

        try (Workbook workbook = fill(template, Map.of("name", "Elsa"),
                FillOptions.builder().notationBegin("{{").notationEnd("}}").build())) {
            assertEquals("Elsa and ${name}", text(workbook.getSheetAt(0), "A1"));
        }
    }

    @Test
    public void testTemplateWithoutCommandsIsCopied() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1").value("A1", "${not.processed}").toBytes();
        CompiledTemplate compiled = filler.compile("plain.xlsx", template);

        assertFalse(compiled.hasCommands());
        try (Workbook workbook = fill(template, Map.of(), FillOptions.defaults())) {
            assertEquals("${not.processed}", text(workbook.getSheetAt(0), "A1"));
        }
    }

    @Test
    public void testStreamAndPathEntryPoints() throws Exception {
        byte[] template = employeeTemplate();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        FillResult streamed = filler.fill(new ByteArrayInputStream(template), out, Map.of("employees", employees()), null);
        assertNull(streamed.getContent());
        try (Workbook workbook = TemplateWorkbook.open(out.toByteArray())) {
            assertEquals("John", text(workbook.getSheetAt(0), "A4"));
        }

        Path templatePath = tempDir.resolve("employees.xlsx");
        Files.write(templatePath, template);
        Path output = tempDir.resolve("out/nested/report.xlsx");
        filler.fill(templatePath, output, Map.of("employees", employees()), FillOptions.defaults());
        assertTrue(Files.exists(output));
        try (Workbook workbook = TemplateWorkbook.open(Files.readAllBytes(output))) {
            assertEquals("SUM(B2:B4)", text(workbook.getSheetAt(0), "B5"));
        }
    }

    @Test
    public void testFailedFillToPathLeavesNoFile() throws Exception {
        Path templatePath = tempDir.resolve("broken.xlsx");
        Files.write(templatePath, TemplateWorkbook.create("Sheet1")
                .value("A1", "${missing}").comment("A1", "jx:area(lastCell=\"A1\")")
                .toBytes());
        Path output = tempDir.resolve("out/broken-report.xlsx");

        ExpressionEvaluationException e = assertThrows(ExpressionEvaluationException.class,
                () -> filler.fill(templatePath, output, Map.of(), FillOptions.builder().failFast(true).build()));

        assertEquals("Sheet1!A1", e.getLocation());
        assertFalse(Files.exists(output));
    }

    @Test
    public void testCompiledTemplateIsReusable() throws Exception {
        CompiledTemplate compiled = filler.compile("employees.xlsx", employeeTemplate());
        List<FillResult> results = new ArrayList<>();
        results.add(filler.fillToBytes(compiled, Map.of("employees", employees()), FillOptions.defaults()));
        results.add(filler.fillToBytes(compiled, Map.of("employees", employees().subList(0, 1)), FillOptions.defaults()));

        try (Workbook second = TemplateWorkbook.open(results.get(1).getContent())) {
            assertEquals("Total", text(second.getSheetAt(0), "A3"));
            assertEquals("SUM(B2)", text(second.getSheetAt(0), "B3"));
        }
    }

    @Test
    public void testValidateReportsMalformedExpressions() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${e.name +}").comment("A1", "jx:area(lastCell=\"B2\")",
                        "jx:each(items=\"employees\" var=\"e\" select=\"e.salary >\" lastCell=\"B1\")")
                .value("B1", "${e.salary}")
                .toBytes();

        List<Diagnostic> diagnostics = filler.validate(filler.compile("t.xlsx", template), FillOptions.defaults());

        assertEquals(2, diagnostics.size());
        assertTrue(diagnostics.stream().allMatch(d -> "MALFORMED_EXPRESSION".equals(d.getCode())));
        assertTrue(diagnostics.stream().allMatch(d -> "Sheet1!A1".equals(d.getLocation())));
    }

    @Test
    public void testMalformedCommandFailsCompilation() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "x").comment("A1", "jx:area(lastCell=\"B2\"")
                .toBytes();

        TemplateParseException e = assertThrows(TemplateParseException.class, () -> filler.compile("t.xlsx", template));
        assertEquals("Sheet1!A1", e.getLocation());
    }

    @Test
    public void testUnreadableTemplateFails() {
        assertThrows(GridAdapterException.class,
                () -> filler.compile("broken.xlsx", "not a workbook".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testUpdateCellPassesRenderedCellsToUpdater() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "Name").comment("A1", "jx:area(lastCell=\"B2\")")
                .value("A2", "${e.name}").comment("A2", "jx:each(items=\"employees\" var=\"e\" lastCell=\"B2\")",
                        "jx:updateCell(updater=\"upper\" lastCell=\"B2\")")
                .value("B2", "${e.salary}")
                .toBytes();
        CellUpdater upper = (cell, context) -> cell.getValue() instanceof String
                ? ((String) cell.getValue()).toUpperCase() + "/" + ((Map<?, ?>) context.lookup("e")).get("dept")
                : null;
        Map<String, Object> data = new HashMap<>();
        data.put("employees", employees());
        data.put("upper", upper);

        try (Workbook workbook = fill(template, data, FillOptions.defaults())) {
            Sheet sheet = workbook.getSheet("Sheet1");

            assertEquals("Name", text(sheet, "A1"));
            assertEquals("ELSA/sales", text(sheet, "A2"));
            assertEquals("OLEG/it", text(sheet, "A3"));
            assertEquals("JOHN/sales", text(sheet, "A4"));
            assertEquals("2300", text(sheet, "B3"));
        }
    }

    @Test
    public void testUpdateCellWithoutUpdaterRecordsDiagnostic() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${title}").comment("A1", "jx:area(lastCell=\"A1\")",
                        "jx:updateCell(updater=\"title\" lastCell=\"A1\")")
                .toBytes();

        FillResult result = filler.fillToBytes(filler.compile("t.xlsx", template), Map.of("title", "Report"), FillOptions.defaults());

        assertEquals(1, result.getDiagnostics().size());
        assertEquals("TYPE_MISMATCH", result.getDiagnostics().get(0).getCode());
        assertEquals("Sheet1!A1", result.getDiagnostics().get(0).getLocation());
        try (Workbook workbook = TemplateWorkbook.open(result.getContent())) {
            assertEquals("Report", text(workbook.getSheet("Sheet1"), "A1"));
        }
    }

    @Test
    public void testAreaListenerWrapsEveryCopiedCell() throws Exception {
        byte[] template = TemplateWorkbook.create("Sheet1")
                .value("A1", "${title}").comment("A1", "jx:area(lastCell=\"C1\")")
                .value("B1", "draft")
                .value("C1", "internal")
                .toBytes();
        List<String> before = new ArrayList<>();
        List<String> after = new ArrayList<>();
        AreaListener listener = new AreaListener() {
            @Override
            public boolean beforeTransformCell(CellRef source, CellRef target, Context context, GridDocument document) {
                before.add(source.toA1() + "->" + target.toA1());
                return !"C1".equals(source.toA1());
            }

            @Override
            public void afterTransformCell(CellRef source, CellRef target, Context context, GridDocument document) {
                after.add(target.toA1());
                if ("B1".equals(source.toA1())) {
                    document.writeValue(target, context.lookup("title") + " (final)");
                }
            }
        };

        try (Workbook workbook = fill(template, Map.of("title", "Report"),
                FillOptions.builder().areaListener(listener).build())) {
            Sheet sheet = workbook.getSheet("Sheet1");

            assertEquals("Report", text(sheet, "A1"));
            assertEquals("Report (final)", text(sheet, "B1"));
            assertNull(text(sheet, "C1"));
        }
        assertEquals(Arrays.asList("A1->A1", "B1->B1", "C1->C1"), before);
        assertEquals(Arrays.asList("A1", "B1", "C1"), after);
    }

    @Test
    public void testDescribeListsAreasCommandsAndExpressions() throws Exception {
        String tree = filler.describe(filler.compile("test.xlsx", employeeTemplate()));

        assertTrue(tree.startsWith("Template: test.xlsx\n"), tree);
        assertTrue(tree.contains("\nEmployees!A1:C3 jx:area (3x3)\n  Commands:\n"), tree);
        assertTrue(tree.contains("    Employees!A2:C2 jx:each (3x1) items=\"employees\" var=\"e\"\n"), tree);
        assertTrue(tree.contains("      Expressions:\n        A2: ${e.name}\n        B2: ${e.salary}\n"), tree);
        // cells outside every area are not part of the tree
        assertFalse(tree.contains("untouched"), tree);
    }
}
