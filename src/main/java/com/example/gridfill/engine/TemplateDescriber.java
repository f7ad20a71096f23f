package com.example.gridfill.engine;

import com.example.gridfill.engine.command.AreaCommand;
import com.example.gridfill.engine.command.CommandNode;
import com.example.gridfill.engine.command.CommandType;
import com.example.gridfill.engine.grid.CellContent;
import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.engine.grid.TemplateSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the structure of a compiled template as an indented tree: every area and command with its region,
 * size and attributes, and the placeholder cells that belong directly to it.
 */
@Slf4j
class TemplateDescriber {
    private final String notationBegin;
    private final StringBuilder out = new StringBuilder();

    TemplateDescriber(String notationBegin) {
        this.notationBegin = notationBegin;
    }

    String describe(CompiledTemplate template) {
        out.append("Template: ").append(template.getName()).append('\n');
        for (AreaCommand area : template.getAreas()) {
            describeNode(area, template.getSnapshot(), 0);
        }
        log.debug("Described template '{}' ({} area(s))", template.getName(), template.getAreas().size());
        return out.toString();
    }

    private void describeNode(CommandNode node, TemplateSnapshot snapshot, int depth) {
        String indent = "  ".repeat(depth);
        Region region = node.getRegion();
        out.append(indent).append(region).append(" jx:").append(node.getType().getCommandName())
                .append(" (").append(region.getWidth()).append('x').append(region.getHeight()).append(')');
        for (Map.Entry<String, String> attribute : node.getAttributes().entrySet()) {
            if (!CommandType.LAST_CELL.equals(attribute.getKey())) {
                out.append(' ').append(attribute.getKey()).append("=\"").append(attribute.getValue()).append('"');
            }
        }
        out.append('\n');

        List<String> expressions = new ArrayList<>();
        for (CellContent cell : snapshot.sheet(region.getSheet()).cellsIn(region)) {
            if (coveredByChild(node, cell)) {
                continue;
            }
            String text = cell.isFormula() ? "=" + cell.getFormula()
                    : cell.getValue() instanceof String ? (String) cell.getValue() : null;
            if (text != null && text.contains(notationBegin)) {
                expressions.add(cell.getRef().toA1() + ": " + text);
            }
        }
        if (!expressions.isEmpty()) {
            out.append(indent).append("  Expressions:\n");
            for (String expression : expressions) {
                out.append(indent).append("    ").append(expression).append('\n');
            }
        }
        if (!node.getChildren().isEmpty()) {
            out.append(indent).append("  Commands:\n");
            for (CommandNode child : node.getChildren()) {
                describeNode(child, snapshot, depth + 2);
            }
        }
    }

    private static boolean coveredByChild(CommandNode node, CellContent cell) {
        for (CommandNode child : node.getChildren()) {
            if (child.getRegion().contains(cell.getRef().getRow(), cell.getRef().getCol())) {
                return true;
            }
        }
        return false;
    }
}
