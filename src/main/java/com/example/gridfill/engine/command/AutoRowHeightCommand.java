package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;

import java.util.Map;

/**
 * Flags the output rows of its region for automatic height.
 */
public class AutoRowHeightCommand extends CommandNode {

    AutoRowHeightCommand(Region region, Map<String, String> attributes) {
        super(CommandType.AUTO_ROW_HEIGHT, region, attributes);
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitAutoRowHeight(this, arg);
    }
}
