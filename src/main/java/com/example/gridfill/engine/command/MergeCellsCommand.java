package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;
import lombok.Getter;

import java.util.Map;

/**
 * Declares a {@code cols} x {@code rows} merged block at the anchor cell. Each size is an integer literal or an
 * expression; {@code minCols}/{@code minRows} suppress the merge when the evaluated size is smaller.
 */
@Getter
public class MergeCellsCommand extends CommandNode {
    private final String cols;
    private final String rows;
    private final String minCols;
    private final String minRows;

    MergeCellsCommand(Region region, Map<String, String> attributes) {
        super(CommandType.MERGE_CELLS, region, attributes);
        this.cols = attributes.get("cols");
        this.rows = attributes.get("rows");
        this.minCols = EachCommand.blankToNull(attributes.get("minCols"));
        this.minRows = EachCommand.blankToNull(attributes.get("minRows"));
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitMergeCells(this, arg);
    }
}
