package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.Diagnostic;
import com.example.gridfill.engine.FillOptions;
import com.example.gridfill.engine.command.AreaCommand;
import com.example.gridfill.engine.command.CommandNode;
import com.example.gridfill.engine.command.EachCommand;
import com.example.gridfill.engine.command.FormulaParams;
import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.expression.Coercions;
import com.example.gridfill.engine.expression.ExpressionEvaluator;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.GridDocument;
import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.engine.grid.TemplateSnapshot;
import com.example.gridfill.exception.ExpressionEvaluationException;
import com.example.gridfill.exception.TemplateConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One fill of a template into a document opened from it. Each area is rendered in place, or, when it holds a
 * multisheet each, once per item onto a copy of its sheet inserted after the template sheet.
 */
@Slf4j
public class FillRun {
    public static final String MULTISHEET_COUNT_MISMATCH = "MULTISHEET_COUNT_MISMATCH";

    private final FillSession session;
    private final GridDocument document;
    private final List<AreaCommand> areas;
    private final Set<String> templateSheets = new LinkedHashSet<>();

    /**
     * @param document      output document, opened from the same bytes the snapshot was taken from
     * @param formulaParams {@code jx:params} options by formula cell
     */
    public FillRun(GridDocument document, TemplateSnapshot snapshot, List<AreaCommand> areas,
                   Map<CellRef, FormulaParams> formulaParams, ExpressionEvaluator evaluator, FillOptions options) {
        this.session = new FillSession(document, snapshot, evaluator, options, formulaParams);
        this.document = document;
        this.areas = areas;
    }

    /**
     * Renders every area against {@code data}.
     *
     * @return diagnostics recorded while rendering
     */
    public List<Diagnostic> execute(Map<String, ?> data) {
        Context root = Context.root(data);
        for (AreaCommand area : areas) {
            EachCommand multisheet = findMultisheet(area);
            if (multisheet == null) {
                fillInPlace(area, root);
            } else {
                fillSheets(area, multisheet, root);
            }
        }
        disposeTemplateSheets();
        document.setRecalculateOnOpen(session.getOptions().isRecalculateOnOpen());
        return getDiagnostics();
    }

    /**
     * Diagnostics recorded so far, also when {@link #execute(Map)} failed.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(session.getDiagnostics());
    }

    private void fillInPlace(AreaCommand area, Context root) {
        Region region = area.getRegion();
        document.clearRegion(region);
        TargetGrid targets = new TargetGrid(region.getSheet());
        new TransformEngine(session, targets).render(area, new RenderFrame(region.getAnchor(), root, IterationPath.ROOT));
        finishPass(region, targets);
    }

    private void fillSheets(AreaCommand area, EachCommand multisheet, Context root) {
        Region region = area.getRegion();
        String templateSheet = region.getSheet();
        CellRef anchor = multisheet.getRegion().getAnchor();
        List<Object> items = new CollectionResolver(session).resolve(multisheet, root);
        List<Object> names = sheetNames(multisheet, root);
        if (names.size() != items.size()) {
            throw new TemplateConfigurationException(MULTISHEET_COUNT_MISMATCH,
                    "multisheet '" + multisheet.getMultisheet() + "' lists " + names.size()
                            + " sheet name(s) for " + items.size() + " item(s)", anchor.toString());
        }
        int position = document.getSheetNames().indexOf(templateSheet);
        for (int i = 0; i < items.size(); i++) {
            String name = uniqueSheetName(names.get(i), templateSheet, i);
            document.duplicateSheet(templateSheet, name);
            document.moveSheet(name, position + 1 + i);
            Region target = region.withSheet(name);
            document.clearRegion(target);
            TargetGrid targets = new TargetGrid(name);
            new TransformEngine(session, targets, multisheet, items.get(i), i)
                    .render(area, new RenderFrame(target.getAnchor(), root, IterationPath.ROOT));
            finishPass(region, targets);
            log.debug("Rendered sheet '{}' for item {} of {}", name, i, multisheet.describe());
        }
        templateSheets.add(templateSheet);
    }

    private void finishPass(Region area, TargetGrid targets) {
        new FormulaProcessor(session).process(area, targets);
        for (int row : targets.getAutoHeightRows()) {
            document.markRowAutoHeight(targets.getSheet(), row);
        }
    }

    private List<Object> sheetNames(EachCommand multisheet, Context root) {
        try {
            return Coercions.toList(session.evaluate(multisheet.getMultisheet(), root));
        } catch (ExpressionEvaluationException e) {
            session.recover(e, multisheet.getRegion().getAnchor(), null);
            return Collections.emptyList();
        }
    }

    private String uniqueSheetName(Object candidate, String templateSheet, int index) {
        String text = Coercions.toText(candidate).trim();
        String base = document.safeSheetName(text.isEmpty() ? templateSheet + "_" + (index + 1) : text);
        List<String> taken = new ArrayList<>();
        for (String existing : document.getSheetNames()) {
            taken.add(existing.toLowerCase(Locale.ROOT));
        }
        String name = base;
        for (int n = 2; taken.contains(name.toLowerCase(Locale.ROOT)); n++) {
            String suffix = " (" + n + ")";
            name = document.safeSheetName(base.substring(0, Math.min(base.length(), 31 - suffix.length())) + suffix);
        }
        return name;
    }

    private void disposeTemplateSheets() {
        for (String sheet : templateSheets) {
            FillOptions options = session.getOptions();
            if (options.isKeepTemplateSheet() || options.isHideTemplateSheet()) {
                if (options.isHideTemplateSheet()) {
                    document.hideSheet(sheet);
                }
            } else if (document.getSheetNames().size() > 1) {
                document.deleteSheet(sheet);
            } else {
                log.warn("Template sheet '{}' kept: a document needs at least one sheet", sheet);
            }
        }
    }

    /**
     * The multisheet each of an area, or null. The tree builder guarantees there is at most one.
     */
    static EachCommand findMultisheet(CommandNode node) {
        for (CommandNode child : node.getChildren()) {
            if (child instanceof EachCommand && ((EachCommand) child).isMultisheet()) {
                return (EachCommand) child;
            }
            EachCommand nested = findMultisheet(child);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }
}
