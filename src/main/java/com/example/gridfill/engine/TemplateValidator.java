package com.example.gridfill.engine;

import com.example.gridfill.engine.command.AreaCommand;
import com.example.gridfill.engine.command.CommandNode;
import com.example.gridfill.engine.command.EachCommand;
import com.example.gridfill.engine.command.GridCommand;
import com.example.gridfill.engine.command.IfCommand;
import com.example.gridfill.engine.command.ImageCommand;
import com.example.gridfill.engine.command.MergeCellsCommand;
import com.example.gridfill.engine.command.SortKey;
import com.example.gridfill.engine.command.UpdateCellCommand;
import com.example.gridfill.engine.expression.ExpressionEvaluator;
import com.example.gridfill.engine.expression.Notation;
import com.example.gridfill.engine.expression.TemplateText;
import com.example.gridfill.engine.grid.CellContent;
import com.example.gridfill.engine.grid.SheetSnapshot;
import com.example.gridfill.exception.ExpressionEvaluationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks the syntax of every expression in a compiled template without any data: cell placeholders, formula
 * placeholders and the expression attributes of commands. Problems come back as diagnostics.
 */
@Slf4j
class TemplateValidator {
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private final ExpressionEvaluator evaluator;
    private final Notation notation;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    TemplateValidator(ExpressionEvaluator evaluator, Notation notation) {
        this.evaluator = evaluator;
        this.notation = notation;
    }

    List<Diagnostic> validate(CompiledTemplate template) {
        for (String sheetName : template.getSnapshot().getSheetNames()) {
            SheetSnapshot sheet = template.getSnapshot().sheet(sheetName);
            for (CellContent cell : sheet.allCells()) {
                String location = cell.getRef().toString();
                if (cell.isFormula()) {
                    checkText(cell.getFormula(), location);
                } else if (cell.getValue() instanceof String) {
                    checkText((String) cell.getValue(), location);
                }
            }
        }
        for (AreaCommand area : template.getAreas()) {
            checkCommand(area);
        }
        log.debug("Validated template '{}': {} problem(s)", template.getName(), diagnostics.size());
        return diagnostics;
    }

    private void checkCommand(CommandNode command) {
        String location = command.getRegion().getAnchor().toString();
        if (command instanceof EachCommand) {
            EachCommand each = (EachCommand) command;
            checkAttribute(each.getItems(), location);
            checkAttribute(each.getSelect(), location);
            checkAttribute(each.getGroupBy(), location);
            checkAttribute(each.getMultisheet(), location);
            for (SortKey key : each.getSortKeys()) {
                checkAttribute(key.getExpression(), location);
            }
        } else if (command instanceof IfCommand) {
            checkAttribute(((IfCommand) command).getCondition(), location);
        } else if (command instanceof GridCommand) {
            checkAttribute(((GridCommand) command).getHeaders(), location);
            checkAttribute(((GridCommand) command).getData(), location);
        } else if (command instanceof ImageCommand) {
            checkAttribute(((ImageCommand) command).getSrc(), location);
        } else if (command instanceof MergeCellsCommand) {
            MergeCellsCommand merge = (MergeCellsCommand) command;
            for (String size : new String[]{merge.getCols(), merge.getRows(), merge.getMinCols(), merge.getMinRows()}) {
                if (size != null && !INTEGER.matcher(size.trim()).matches()) {
                    checkAttribute(size, location);
                }
            }
        } else if (command instanceof UpdateCellCommand) {
            checkAttribute(((UpdateCellCommand) command).getUpdater(), location);
        }
        for (CommandNode child : command.getChildren()) {
            checkCommand(child);
        }
    }

    private void checkText(String text, String location) {
        TemplateText parsed = TemplateText.parse(text, notation);
        for (TemplateText.Segment segment : parsed.getSegments()) {
            if (segment.isExpression()) {
                check(segment.getText(), location);
            }
        }
    }

    private void checkAttribute(String attribute, String location) {
        if (attribute != null && !attribute.isBlank()) {
            check(TemplateText.unwrapAttribute(attribute, notation), location);
        }
    }

    private void check(String expression, String location) {
        try {
            evaluator.parse(expression);
        } catch (ExpressionEvaluationException e) {
            diagnostics.add(new Diagnostic(e.getCode(), location, e.getDescription()));
        }
    }
}
