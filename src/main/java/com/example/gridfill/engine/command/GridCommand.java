package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes a header row followed by one row per data record, starting at the anchor cell.
 */
@Getter
public class GridCommand extends CommandNode {
    private final String headers;
    private final String data;
    private final List<String> props;

    GridCommand(Region region, Map<String, String> attributes) {
        super(CommandType.GRID, region, attributes);
        this.headers = attributes.get("headers");
        this.data = attributes.get("data");
        List<String> names = new ArrayList<>();
        String raw = attributes.get("props");
        if (raw != null) {
            for (String prop : raw.split(",")) {
                if (!prop.isBlank()) {
                    names.add(prop.trim());
                }
            }
        }
        this.props = Collections.unmodifiableList(names);
    }

    @Override
    public <R, A> R accept(CommandVisitor<R, A> visitor, A arg) {
        return visitor.visitGrid(this, arg);
    }
}
