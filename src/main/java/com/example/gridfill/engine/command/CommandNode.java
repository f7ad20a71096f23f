package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A command declared in a cell annotation, governing {@link #getRegion()}.
 */
public abstract class CommandNode {
    private final CommandType type;
    private final Region region;
    private final Map<String, String> attributes;

    protected CommandNode(CommandType type, Region region, Map<String, String> attributes) {
        this.type = type;
        this.region = region;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public abstract <R, A> R accept(CommandVisitor<R, A> visitor, A arg);

    public CommandType getType() {
        return type;
    }

    public Region getRegion() {
        return region;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Whether other commands can nest inside this one (area, each, if).
     */
    public boolean isContainer() {
        return false;
    }

    public List<CommandNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Annotation cell and command name, e.g. {@code Sheet1!A2 jx:each}, for log and error messages.
     */
    public String describe() {
        return region.getAnchor() + " jx:" + type.getCommandName();
    }

    @Override
    public String toString() {
        return "jx:" + type.getCommandName() + attributes + " " + region;
    }
}
