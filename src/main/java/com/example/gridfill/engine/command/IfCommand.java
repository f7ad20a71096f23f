package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;
import lombok.Getter;

import java.util.Map;

/**
 * Renders {@code thenRegion} when the condition holds, otherwise {@code elseRegion} or nothing at all.
 * Without an {@code areas} attribute the then-region is the whole command region.
 */
@Getter
public class IfCommand extends ContainerCommand {
    private final String condition;
    private final Region thenRegion;
    private final Region elseRegion;

    IfCommand(Region region, Map<String, String> attributes, Region thenRegion, Region elseRegion) {
        super(CommandType.IF, region, attributes);
        this.condition = attributes.get("condition");
        this.thenRegion = thenRegion == null ? region : thenRegion;
        this.elseRegion = elseRegion;
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitIf(this, arg);
    }
}
