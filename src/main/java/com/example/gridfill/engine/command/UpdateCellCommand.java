package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;
import lombok.Getter;

import java.util.Map;

/**
 * Renders its region, then hands every output cell to the {@link com.example.gridfill.engine.CellUpdater}
 * that {@code updater} evaluates to.
 */
@Getter
public class UpdateCellCommand extends CommandNode {
    private final String updater;

    UpdateCellCommand(Region region, Map<String, String> attributes) {
        super(CommandType.UPDATE_CELL, region, attributes);
        this.updater = attributes.get("updater");
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitUpdateCell(this, arg);
    }
}
