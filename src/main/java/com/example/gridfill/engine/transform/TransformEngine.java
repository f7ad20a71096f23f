package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.AreaListener;
import com.example.gridfill.engine.CellUpdater;
import com.example.gridfill.engine.command.AreaCommand;
import com.example.gridfill.engine.command.AutoRowHeightCommand;
import com.example.gridfill.engine.command.CommandNode;
import com.example.gridfill.engine.command.CommandVisitor;
import com.example.gridfill.engine.command.Direction;
import com.example.gridfill.engine.command.EachCommand;
import com.example.gridfill.engine.command.GridCommand;
import com.example.gridfill.engine.command.IfCommand;
import com.example.gridfill.engine.command.ImageCommand;
import com.example.gridfill.engine.command.MergeCellsCommand;
import com.example.gridfill.engine.command.UpdateCellCommand;
import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.expression.Coercions;
import com.example.gridfill.engine.expression.HyperlinkValue;
import com.example.gridfill.engine.expression.PropertyAccess;
import com.example.gridfill.engine.expression.TemplateText;
import com.example.gridfill.engine.expression.ValueKind;
import com.example.gridfill.engine.grid.CellContent;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.GridDocument;
import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.engine.grid.SheetSnapshot;
import com.example.gridfill.engine.grid.Size;
import com.example.gridfill.exception.ExpressionEvaluationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-first interpreter of a command tree. Every visit renders one command at the cursor of its
 * {@link RenderFrame} and returns the size it produced; the caller moves later siblings by the difference
 * between that size and the command's template size.
 * <p>
 * A block is rendered in horizontal bands: rows holding no command are copied as they are, and every run of
 * rows spanned by commands is rendered command by command, left to right. A band that also holds plain
 * template cells keeps at least its template height, so those cells are never lost when its commands shrink.
 */
@Slf4j
class TransformEngine implements CommandVisitor<Size, RenderFrame> {
    private static final String FORMULA_BEGIN = "$[";
    private static final String FORMULA_END = "]";

    private final FillSession session;
    private final GridDocument document;
    private final TargetGrid targets;
    private final CollectionResolver collections;
    private final EachCommand pinnedEach;
    private final Object pinnedItem;
    private final int pinnedIndex;

    TransformEngine(FillSession session, TargetGrid targets) {
        this(session, targets, null, null, -1);
    }

    /**
     * Engine for one sheet of a multisheet area: {@code pinnedEach} renders its block once, for
     * {@code pinnedItem} only.
     */
    TransformEngine(FillSession session, TargetGrid targets, EachCommand pinnedEach, Object pinnedItem, int pinnedIndex) {
        this.session = session;
        this.document = session.getDocument();
        this.targets = targets;
        this.collections = new CollectionResolver(session);
        this.pinnedEach = pinnedEach;
        this.pinnedItem = pinnedItem;
        this.pinnedIndex = pinnedIndex;
    }

    Size render(AreaCommand area, RenderFrame frame) {
        return area.accept(this, frame);
    }

    @Override
    public Size visitArea(AreaCommand area, RenderFrame frame) {
        Size size = renderBlock(area.getRegion(), area.getChildren(), frame);
        log.debug("Rendered {} into {} at {}", area.describe(), size, frame.getCursor());
        return size;
    }

    @Override
    public Size visitEach(EachCommand each, RenderFrame frame) {
        if (each == pinnedEach) {
            return renderIteration(each, pinnedItem, pinnedIndex, frame);
        }
        List<Object> items = collections.resolve(each, frame.getContext());
        CellRef cursor = frame.getCursor();
        int width = 0;
        int height = 0;
        for (int i = 0; i < items.size(); i++) {
            Size copy = renderIteration(each, items.get(i), i, frame.at(cursor));
            if (each.getDirection() == Direction.DOWN) {
                cursor = cursor.offset(copy.getHeight(), 0);
                height += copy.getHeight();
                width = Math.max(width, copy.getWidth());
            } else {
                cursor = cursor.offset(0, copy.getWidth());
                width += copy.getWidth();
                height = Math.max(height, copy.getHeight());
            }
        }
        log.debug("{} emitted {} cop{} at {}", each.describe(), items.size(), items.size() == 1 ? "y" : "ies", frame.getCursor());
        return items.isEmpty() ? Size.ZERO : Size.of(width, height);
    }

    private Size renderIteration(EachCommand each, Object item, int index, RenderFrame frame) {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put(each.getVar(), item);
        if (each.getVarIndex() != null) {
            bindings.put(each.getVarIndex(), index);
        }
        try (Context scope = frame.getContext().push(bindings)) {
            return renderBlock(each.getRegion(), each.getChildren(),
                    frame.with(frame.getCursor(), scope, frame.getPath().enter(each, index)));
        }
    }

    @Override
    public Size visitIf(IfCommand ifCommand, RenderFrame frame) {
        boolean holds;
        try {
            holds = Coercions.toCondition(session.evaluate(ifCommand.getCondition(), frame.getContext()));
        } catch (ExpressionEvaluationException e) {
            session.recover(e, ifCommand.getRegion().getAnchor(), null);
            holds = false;
        }
        Region active = holds ? ifCommand.getThenRegion() : ifCommand.getElseRegion();
        if (active == null) {
            log.debug("{} is false, block removed", ifCommand.describe());
            return Size.ZERO;
        }
        List<CommandNode> children = new ArrayList<>();
        for (CommandNode child : ifCommand.getChildren()) {
            if (active.contains(child.getRegion())) {
                children.add(child);
            }
        }
        return renderBlock(active, children, frame);
    }

    @Override
    public Size visitGrid(GridCommand grid, RenderFrame frame) {
        Region region = grid.getRegion();
        CellRef anchor = region.getAnchor();
        List<Object> headers = evaluateSequence(grid.getHeaders(), frame, anchor);
        List<Object> records = evaluateSequence(grid.getData(), frame, anchor);
        SheetSnapshot sheet = session.getSnapshot().sheet(region.getSheet());
        int headerStyle = styleOf(sheet.cell(region.getStartRow(), region.getStartCol()));
        int dataStyle = region.getHeight() > 1 ? styleOf(sheet.cell(region.getStartRow() + 1, region.getStartCol())) : headerStyle;

        CellRef cursor = frame.getCursor();
        int rows = 0;
        int width = 0;
        if (!headers.isEmpty()) {
            for (int col = 0; col < headers.size(); col++) {
                writeGridCell(cursor.offset(0, col), headers.get(col), headerStyle, anchor);
            }
            width = headers.size();
            rows = 1;
        }
        for (Object record : records) {
            List<Object> values = rowValues(record, grid.getProps(), anchor);
            for (int col = 0; col < values.size(); col++) {
                writeGridCell(cursor.offset(rows, col), values.get(col), dataStyle, anchor);
            }
            width = Math.max(width, values.size());
            rows++;
        }
        log.debug("{} wrote {} row(s) x {} column(s)", grid.describe(), rows, width);
        return rows == 0 ? Size.ZERO : Size.of(width, rows);
    }

    @Override
    public Size visitImage(ImageCommand image, RenderFrame frame) {
        Size size = renderBlock(image.getRegion(), Collections.emptyList(), frame);
        CellRef anchor = image.getRegion().getAnchor();
        Object source;
        try {
            source = session.evaluate(image.getSrc(), frame.getContext());
        } catch (ExpressionEvaluationException e) {
            session.recover(e, anchor, null);
            return size;
        }
        if (source == null) {
            log.debug("{} has no image data, skipped", image.describe());
            return size;
        }
        if (ValueKind.of(source) != ValueKind.BINARY) {
            session.recover(new ExpressionEvaluationException(Coercions.TYPE_MISMATCH,
                    "Image source must be binary data but was " + Coercions.describe(source)), anchor, null);
            return size;
        }
        document.insertImage(image.getRegion().moveTo(frame.getCursor()), (byte[]) source, image.getImageType(),
                image.getScaleX(), image.getScaleY());
        return size;
    }

    @Override
    public Size visitMergeCells(MergeCellsCommand mergeCells, RenderFrame frame) {
        Size size = renderBlock(mergeCells.getRegion(), Collections.emptyList(), frame);
        CellRef anchor = mergeCells.getRegion().getAnchor();
        Integer cols = evaluateCount(mergeCells.getCols(), frame, anchor);
        Integer rows = evaluateCount(mergeCells.getRows(), frame, anchor);
        if (cols == null || rows == null || cols < 1 || rows < 1) {
            return size;
        }
        Integer minCols = mergeCells.getMinCols() == null ? null : evaluateCount(mergeCells.getMinCols(), frame, anchor);
        Integer minRows = mergeCells.getMinRows() == null ? null : evaluateCount(mergeCells.getMinRows(), frame, anchor);
        if ((minCols != null && cols < minCols) || (minRows != null && rows < minRows) || cols * rows == 1) {
            return size;
        }
        CellRef cursor = frame.getCursor();
        Region merged = Region.of(cursor.getSheet(), cursor.getRow(), cursor.getCol(),
                cursor.getRow() + rows - 1, cursor.getCol() + cols - 1);
        if (targets.claimMerge(merged)) {
            document.mergeCells(merged);
        } else {
            log.debug("{} skipped: {} overlaps an existing merge", mergeCells.describe(), merged);
        }
        return size;
    }

    @Override
    public Size visitAutoRowHeight(AutoRowHeightCommand autoRowHeight, RenderFrame frame) {
        Size size = renderBlock(autoRowHeight.getRegion(), Collections.emptyList(), frame);
        for (int row = 0; row < size.getHeight(); row++) {
            targets.markAutoHeight(frame.getCursor().getRow() + row);
        }
        return size;
    }

    @Override
    public Size visitUpdateCell(UpdateCellCommand updateCell, RenderFrame frame) {
        Size size = renderBlock(updateCell.getRegion(), Collections.emptyList(), frame);
        CellRef anchor = updateCell.getRegion().getAnchor();
        Object updater;
        try {
            updater = session.evaluate(updateCell.getUpdater(), frame.getContext());
        } catch (ExpressionEvaluationException e) {
            session.recover(e, anchor, null);
            return size;
        }
        if (!(updater instanceof CellUpdater)) {
            session.recover(new ExpressionEvaluationException(Coercions.TYPE_MISMATCH,
                    "Updater '" + updateCell.getUpdater() + "' must be a CellUpdater but was " + Coercions.describe(updater)),
                    anchor, null);
            return size;
        }
        CellRef cursor = frame.getCursor();
        for (int row = 0; row < size.getHeight(); row++) {
            for (int col = 0; col < size.getWidth(); col++) {
                CellRef target = cursor.offset(row, col);
                CellContent current = document.readCell(target);
                if (current == null) {
                    current = CellContent.builder().ref(target).styleIndex(-1).build();
                }
                Object updated = ((CellUpdater) updater).update(current, frame.getContext());
                if (updated != null) {
                    targets.markWritten(target);
                    writeResult(target, updated, anchor);
                }
            }
        }
        return size;
    }

    /**
     * Renders template rows {@code source} with the commands nested in them at the frame cursor.
     */
    private Size renderBlock(Region source, List<CommandNode> children, RenderFrame frame) {
        SheetSnapshot sheet = session.getSnapshot().sheet(source.getSheet());
        CellRef origin = frame.getCursor();
        List<Band> bands = Band.split(children);
        int rowShift = 0;
        int maxGrowth = 0;
        int next = 0;
        int row = source.getStartRow();
        while (row <= source.getEndRow()) {
            int targetRow = origin.getRow() + (row - source.getStartRow()) + rowShift;
            Band band = next < bands.size() ? bands.get(next) : null;
            if (band != null && band.startRow == row) {
                int[] rendered = renderBand(band, source, sheet, frame, targetRow);
                rowShift += rendered[0] - band.getHeight();
                maxGrowth = Math.max(maxGrowth, rendered[1]);
                row = band.endRow + 1;
                next++;
            } else {
                for (CellContent cell : sheet.cellsIn(Region.of(source.getSheet(), row, source.getStartCol(), row, source.getEndCol()))) {
                    copyCell(cell, CellRef.of(origin.getSheet(), targetRow, origin.getCol() + cell.getRef().getCol() - source.getStartCol()), frame);
                }
                row++;
            }
        }
        return Size.of(source.getWidth() + maxGrowth, Math.max(0, source.getHeight() + rowShift));
    }

    /**
     * @return output height of the band and the total horizontal growth of its commands
     */
    private int[] renderBand(Band band, Region source, SheetSnapshot sheet, RenderFrame frame, int targetRow) {
        CellRef origin = frame.getCursor();
        List<CommandNode> byColumn = new ArrayList<>(band.children);
        byColumn.sort(Comparator.comparingInt((CommandNode c) -> c.getRegion().getStartCol())
                .thenComparingInt(c -> c.getRegion().getStartRow()));
        int height = 0;
        int growth = 0;
        int[] growthAfter = new int[byColumn.size()];
        for (int i = 0; i < byColumn.size(); i++) {
            CommandNode child = byColumn.get(i);
            Region region = child.getRegion();
            CellRef cursor = CellRef.of(origin.getSheet(), targetRow + region.getStartRow() - band.startRow,
                    origin.getCol() + region.getStartCol() - source.getStartCol() + growth);
            Size out = child.accept(this, frame.at(cursor));
            height = Math.max(height, region.getStartRow() - band.startRow + out.getHeight());
            growth += Math.max(0, out.getWidth() - region.getWidth());
            growthAfter[i] = growth;
        }
        boolean hasPlainCells = (long) band.getHeight() * source.getWidth() > band.cellCount();
        if (hasPlainCells) {
            height = Math.max(height, band.getHeight());
        }
        for (int row = band.startRow; row <= band.endRow; row++) {
            for (CellContent cell : sheet.cellsIn(Region.of(source.getSheet(), row, source.getStartCol(), row, source.getEndCol()))) {
                int col = cell.getRef().getCol();
                if (band.covers(row, col)) {
                    continue;
                }
                int shift = 0;
                for (int i = 0; i < byColumn.size(); i++) {
                    if (byColumn.get(i).getRegion().getEndCol() < col) {
                        shift = growthAfter[i];
                    }
                }
                CellRef target = CellRef.of(origin.getSheet(), targetRow + row - band.startRow,
                        origin.getCol() + col - source.getStartCol() + shift);
                if (!targets.isWritten(target)) {
                    copyCell(cell, target, frame);
                }
            }
        }
        return new int[]{height, growth};
    }

    private void copyCell(CellContent cell, CellRef target, RenderFrame frame) {
        CellRef source = cell.getRef();
        targets.record(source, target, frame.getPath());
        List<AreaListener> listeners = session.getOptions().getAreaListeners();
        boolean transform = true;
        for (AreaListener listener : listeners) {
            if (!listener.beforeTransformCell(source, target, frame.getContext(), document)) {
                transform = false;
                break;
            }
        }
        if (transform) {
            transformCell(cell, target, frame);
        }
        for (AreaListener listener : listeners) {
            listener.afterTransformCell(source, target, frame.getContext(), document);
        }
    }

    private void transformCell(CellContent cell, CellRef target, RenderFrame frame) {
        CellRef source = cell.getRef();
        copyDimensions(source, target);
        document.writeStyle(target, cell.getStyleIndex());
        Object value = cell.getValue();
        if (cell.isFormula()) {
            addFormula(cell.getFormula(), source, target, frame);
        } else if (value instanceof String) {
            String text = (String) value;
            String formula = formulaTemplate(text);
            if (formula != null) {
                addFormula(formula, source, target, frame);
            } else {
                TemplateText parsed = TemplateText.parse(text, session.getNotation());
                if (parsed.hasExpressions()) {
                    writeExpression(parsed, source, target, frame);
                } else {
                    document.writeValue(target, text);
                }
            }
        } else {
            document.writeValue(target, value);
        }
        Region merged = session.getSnapshot().sheet(source.getSheet()).mergeStartingAt(source.getRow(), source.getCol());
        if (merged != null) {
            Region copy = merged.moveTo(target);
            if (targets.claimMerge(copy)) {
                document.mergeCells(copy);
            }
        }
    }

    private void writeExpression(TemplateText text, CellRef source, CellRef target, RenderFrame frame) {
        Object result;
        try {
            result = session.getEvaluator().evaluateText(text, frame.getContext());
        } catch (ExpressionEvaluationException e) {
            document.writeValue(target, null);
            session.recover(e, source, target);
            return;
        }
        writeResult(target, result, source);
    }

    private void writeResult(CellRef target, Object value, CellRef source) {
        if (value instanceof HyperlinkValue) {
            HyperlinkValue link = (HyperlinkValue) value;
            document.writeHyperlink(target, link.getUrl(), link.getDisplayText());
        } else if (ValueKind.of(value) == ValueKind.BINARY) {
            document.writeValue(target, null);
            session.recover(new ExpressionEvaluationException(Coercions.TYPE_MISMATCH,
                    "Binary data cannot be written to a cell; use jx:image"), source, target);
        } else {
            document.writeValue(target, value);
        }
    }

    private void addFormula(String formula, CellRef source, CellRef target, RenderFrame frame) {
        TemplateText parsed = TemplateText.parse(formula, session.getNotation());
        String substituted = formula;
        if (parsed.hasExpressions()) {
            StringBuilder out = new StringBuilder();
            for (TemplateText.Segment segment : parsed.getSegments()) {
                if (!segment.isExpression()) {
                    out.append(segment.getText());
                    continue;
                }
                try {
                    out.append(Coercions.toText(session.getEvaluator().evaluate(segment.getText(), frame.getContext())));
                } catch (ExpressionEvaluationException e) {
                    session.recover(e, source, target);
                    out.append(session.formulaParams(source).getDefaultValue());
                }
            }
            substituted = out.toString();
        }
        targets.addFormula(new TargetGrid.FormulaCell(source, target, substituted, frame.getPath()));
    }

    private void copyDimensions(CellRef source, CellRef target) {
        SheetSnapshot sheet = session.getSnapshot().sheet(source.getSheet());
        Float height = sheet.rowHeight(source.getRow());
        if (height != null && targets.claimRowHeight(target.getRow())) {
            document.setRowHeight(target.getSheet(), target.getRow(), height);
        }
        Integer width = sheet.columnWidth(source.getCol());
        if (width != null && targets.claimColumnWidth(target.getCol())) {
            document.setColumnWidth(target.getSheet(), target.getCol(), width);
        }
    }

    private void writeGridCell(CellRef target, Object value, int style, CellRef source) {
        targets.markWritten(target);
        if (style >= 0) {
            document.writeStyle(target, style);
        }
        writeResult(target, value, source);
    }

    private List<Object> evaluateSequence(String attribute, RenderFrame frame, CellRef anchor) {
        try {
            return Coercions.toList(session.evaluate(attribute, frame.getContext()));
        } catch (ExpressionEvaluationException e) {
            session.recover(e, anchor, null);
            return Collections.emptyList();
        }
    }

    private List<Object> rowValues(Object record, List<String> props, CellRef anchor) {
        if (!props.isEmpty()) {
            List<Object> values = new ArrayList<>(props.size());
            for (String prop : props) {
                Object value = record;
                try {
                    for (String part : prop.split("\\.")) {
                        value = PropertyAccess.get(value, part);
                    }
                } catch (ExpressionEvaluationException e) {
                    session.recover(e, anchor, null);
                    value = null;
                }
                values.add(value);
            }
            return values;
        }
        switch (ValueKind.of(record)) {
            case SEQUENCE:
                return Coercions.toList(record);
            case MAPPING:
                return new ArrayList<>(((Map<?, ?>) record).values());
            default:
                return Collections.singletonList(record);
        }
    }

    private Integer evaluateCount(String attribute, RenderFrame frame, CellRef anchor) {
        String text = attribute.trim();
        if (text.matches("-?\\d+")) {
            return Integer.parseInt(text);
        }
        try {
            Object value = session.evaluate(text, frame.getContext());
            if (value instanceof Number) {
                return ((Number) value).intValue();
            }
            throw new ExpressionEvaluationException(Coercions.TYPE_MISMATCH,
                    "Expected a number for '" + attribute + "' but got " + Coercions.describe(value));
        } catch (ExpressionEvaluationException e) {
            session.recover(e, anchor, null);
            return null;
        }
    }

    private static int styleOf(CellContent cell) {
        return cell == null ? -1 : cell.getStyleIndex();
    }

    /**
     * Formula text of a {@code $[...]} cell, which may embed placeholders a real formula cell cannot hold.
     */
    static String formulaTemplate(String text) {
        String trimmed = text.trim();
        if (trimmed.length() <= FORMULA_BEGIN.length() + FORMULA_END.length()
                || !trimmed.startsWith(FORMULA_BEGIN) || !trimmed.endsWith(FORMULA_END)) {
            return null;
        }
        String formula = trimmed.substring(FORMULA_BEGIN.length(), trimmed.length() - FORMULA_END.length()).trim();
        return formula.startsWith("=") ? formula.substring(1) : formula;
    }

    /**
     * Commands whose row ranges overlap, rendered together.
     */
    private static final class Band {
        private final List<CommandNode> children = new ArrayList<>();
        private int startRow;
        private int endRow;

        static List<Band> split(List<CommandNode> children) {
            List<CommandNode> byRow = new ArrayList<>(children);
            byRow.sort(Comparator.comparingInt((CommandNode c) -> c.getRegion().getStartRow())
                    .thenComparingInt(c -> c.getRegion().getStartCol()));
            List<Band> bands = new ArrayList<>();
            Band current = null;
            for (CommandNode child : byRow) {
                Region region = child.getRegion();
                if (current == null || region.getStartRow() > current.endRow) {
                    current = new Band();
                    current.startRow = region.getStartRow();
                    current.endRow = region.getEndRow();
                    bands.add(current);
                } else {
                    current.endRow = Math.max(current.endRow, region.getEndRow());
                }
                current.children.add(child);
            }
            return bands;
        }

        int getHeight() {
            return endRow - startRow + 1;
        }

        long cellCount() {
            long count = 0;
            for (CommandNode child : children) {
                count += child.getRegion().getCellCount();
            }
            return count;
        }

        boolean covers(int row, int col) {
            for (CommandNode child : children) {
                if (child.getRegion().contains(row, col)) {
                    return true;
                }
            }
            return false;
        }
    }
}
