package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;

import java.util.Map;

/**
 * Root of a command tree: the rectangle processed in one fill pass.
 */
public class AreaCommand extends ContainerCommand {

    AreaCommand(Region region, Map<String, String> attributes) {
        super(CommandType.AREA, region, attributes);
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitArea(this, arg);
    }
}
