package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Replicates its block once per element of {@code items}, after select, groupBy and orderBy.
 */
@Getter
public class EachCommand extends ContainerCommand {
    private final String items;
    private final String var;
    private final String varIndex;
    private final Direction direction;
    private final String select;
    private final String orderBy;
    private final List<SortKey> sortKeys;
    private final String groupBy;
    private final GroupOrder groupOrder;
    private final String multisheet;

    EachCommand(Region region, Map<String, String> attributes, Direction direction, GroupOrder groupOrder) {
        super(CommandType.EACH, region, attributes);
        this.items = attributes.get("items");
        this.var = attributes.get("var");
        this.varIndex = blankToNull(attributes.get("varIndex"));
        this.direction = direction;
        this.select = blankToNull(attributes.get("select"));
        this.orderBy = blankToNull(attributes.get("orderBy"));
        this.sortKeys = SortKey.parseAll(orderBy);
        this.groupBy = blankToNull(attributes.get("groupBy"));
        this.groupOrder = groupOrder;
        this.multisheet = blankToNull(attributes.get("multisheet"));
    }

    public boolean isMultisheet() {
        return multisheet != null;
    }

    /**
     * Cells per copy along the replication axis.
     */
    public int getBlockSize() {
        return direction == Direction.DOWN ? getRegion().getHeight() : getRegion().getWidth();
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitEach(this, arg);
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
