package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Command whose region may hold nested commands. Children are attached by {@link CommandTreeBuilder} and the
 * list is frozen once the tree is complete.
 */
public abstract class ContainerCommand extends CommandNode {
    private List<CommandNode> children = new ArrayList<>();

    protected ContainerCommand(CommandType type, Region region, Map<String, String> attributes) {
        super(type, region, attributes);
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    @Override
    public List<CommandNode> getChildren() {
        return children;
    }

    void addChild(CommandNode child) {
        children.add(child);
    }

    void freeze() {
        List<CommandNode> sorted = new ArrayList<>(children);
        sorted.sort(Comparator.comparingInt((CommandNode c) -> c.getRegion().getStartRow())
                .thenComparingInt(c -> c.getRegion().getStartCol()));
        children = Collections.unmodifiableList(sorted);
    }
}
