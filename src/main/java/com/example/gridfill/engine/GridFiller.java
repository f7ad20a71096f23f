package com.example.gridfill.engine;

import com.example.gridfill.engine.command.AreaCommand;
import com.example.gridfill.engine.command.CommandNode;
import com.example.gridfill.engine.command.CommandParser;
import com.example.gridfill.engine.command.CommandTreeBuilder;
import com.example.gridfill.engine.command.FormulaParams;
import com.example.gridfill.engine.command.ParsedAnnotation;
import com.example.gridfill.engine.expression.ExpressionEvaluator;
import com.example.gridfill.engine.grid.CellContent;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.TemplateSnapshot;
import com.example.gridfill.engine.grid.poi.PoiGridDocument;
import com.example.gridfill.engine.transform.FillRun;
import com.example.gridfill.exception.GridAdapterException;
import com.example.gridfill.exception.GridFillException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points of the fill engine. Stateless and thread-safe: every fill opens its own document, and compiled
 * templates and the expression cache are shared read-only.
 * <pre>
 * GridFiller filler = new GridFiller();
 * FillResult result = filler.fillToBytes(Path.of("report.xlsx"), Map.of("employees", employees), FillOptions.defaults());
 * </pre>
 */
@Slf4j
public class GridFiller {
    private final ExpressionEvaluator evaluator;
    private final CommandParser parser = new CommandParser();
    private final CommandTreeBuilder treeBuilder = new CommandTreeBuilder();

    public GridFiller() {
        this(new ExpressionEvaluator());
    }

    public GridFiller(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Parses the template once for any number of later fills.
     *
     * @throws com.example.gridfill.exception.TemplateParseException         for malformed command annotations
     * @throws com.example.gridfill.exception.TemplateConfigurationException for commands that do not nest
     */
    public CompiledTemplate compile(String name, byte[] content) {
        try (PoiGridDocument document = PoiGridDocument.open(content)) {
            TemplateSnapshot snapshot = TemplateSnapshot.capture(document);
            List<CommandNode> commands = new ArrayList<>();
            Map<CellRef, FormulaParams> formulaParams = new HashMap<>();
            for (String sheetName : snapshot.getSheetNames()) {
                for (CellContent cell : snapshot.sheet(sheetName).allCells()) {
                    if (!cell.hasComment()) {
                        continue;
                    }
                    CellRef anchor = CellRef.of(sheetName, cell.getRef().getRow(), cell.getRef().getCol());
                    ParsedAnnotation parsed = parser.parse(cell.getComment(), anchor);
                    commands.addAll(parsed.getCommands());
                    if (parsed.getFormulaParams() != null) {
                        formulaParams.put(anchor, parsed.getFormulaParams());
                    }
                }
            }
            List<AreaCommand> areas = treeBuilder.build(commands);
            log.info("Compiled template '{}': {} sheet(s), {} command(s), {} area(s)",
                    name, snapshot.getSheetNames().size(), commands.size(), areas.size());
            return new CompiledTemplate(name, content, snapshot, areas, formulaParams);
        } catch (IOException e) {
            throw new GridAdapterException("Failed to close template '" + name + "'", e);
        }
    }

    public CompiledTemplate compile(String name, InputStream in) {
        return compile(name, readAll(in, name));
    }

    public CompiledTemplate compile(Path template) {
        try {
            return compile(template.getFileName().toString(), Files.readAllBytes(template));
        } catch (IOException e) {
            throw new GridAdapterException("Failed to read template " + template, e);
        }
    }

    /**
     * Fills the template at {@code template} and writes the result to {@code output}. Nothing is written when
     * the fill fails.
     */
    public FillResult fill(Path template, Path output, Map<String, ?> data, FillOptions options) {
        FillResult filled = fillToBytes(compile(template), data, options);
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.write(output, filled.getContent());
            return new FillResult(null, filled.getDiagnostics());
        } catch (IOException e) {
            throw new GridAdapterException("Failed to write " + output, e);
        }
    }

    /**
     * Fills the template at {@code template}; the result carries the output bytes.
     */
    public FillResult fillToBytes(Path template, Map<String, ?> data, FillOptions options) {
        return fillToBytes(compile(template), data, options);
    }

    public FillResult fillToBytes(CompiledTemplate template, Map<String, ?> data, FillOptions options) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        FillResult result = fill(template, out, data, options);
        return new FillResult(out.toByteArray(), result.getDiagnostics());
    }

    /**
     * Reads a template from {@code in} and writes the filled document to {@code out}. Neither stream is closed.
     */
    public FillResult fill(InputStream in, OutputStream out, Map<String, ?> data, FillOptions options) {
        return fill(compile("stream", in), out, data, options);
    }

    public FillResult fill(CompiledTemplate template, OutputStream out, Map<String, ?> data, FillOptions options) {
        FillOptions effective = options == null ? FillOptions.defaults() : options;
        long start = System.currentTimeMillis();
        log.info("Filling template '{}' ({} area(s))", template.getName(), template.getAreas().size());
        try (PoiGridDocument document = PoiGridDocument.open(template.getContent())) {
            FillRun run = new FillRun(document, template.getSnapshot(), template.getAreas(),
                    template.getFormulaParams(), evaluator, effective);
            List<Diagnostic> diagnostics;
            try {
                diagnostics = run.execute(data);
                document.write(out);
            } catch (GridFillException e) {
                log.error("Fill of template '{}' failed: {}", template.getName(), e.getMessage());
                throw e.withDiagnostics(run.getDiagnostics());
            }
            log.info("Filled template '{}' in {} ms with {} diagnostic(s)",
                    template.getName(), System.currentTimeMillis() - start, diagnostics.size());
            return new FillResult(null, diagnostics);
        } catch (IOException e) {
            throw new GridAdapterException("Failed to close output document for '" + template.getName() + "'", e);
        }
    }

    /**
     * Syntax check of every expression in the template, without data.
     *
     * @return one diagnostic per malformed expression; empty when the template is clean
     */
    public List<Diagnostic> validate(CompiledTemplate template, FillOptions options) {
        FillOptions effective = options == null ? FillOptions.defaults() : options;
        return new TemplateValidator(evaluator, effective.notation()).validate(template);
    }

    public List<Diagnostic> validate(Path template, FillOptions options) {
        return validate(compile(template), options);
    }

    /**
     * Human readable tree of the areas, commands and placeholder cells of a template, for debugging templates.
     */
    public String describe(CompiledTemplate template, FillOptions options) {
        FillOptions effective = options == null ? FillOptions.defaults() : options;
        return new TemplateDescriber(effective.getNotationBegin()).describe(template);
    }

    public String describe(CompiledTemplate template) {
        return describe(template, null);
    }

    public String describe(Path template) {
        return describe(compile(template));
    }

    private static byte[] readAll(InputStream in, String name) {
        try {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new GridAdapterException("Failed to read template '" + name + "'", e);
        }
    }
}
