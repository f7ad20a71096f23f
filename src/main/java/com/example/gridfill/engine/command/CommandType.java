package com.example.gridfill.engine.command;

import java.util.Arrays;
import java.util.List;

/**
 * The closed set of commands recognised in cell annotations, with the attributes each one requires.
 */
public enum CommandType {
    AREA("area"),
    EACH("each", "items", "var"),
    IF("if", "condition"),
    GRID("grid", "headers", "data"),
    IMAGE("image", "src", "imageType"),
    MERGE_CELLS("mergeCells", "cols", "rows"),
    AUTO_ROW_HEIGHT("autoRowHeight"),
    UPDATE_CELL("updateCell", "updater");

    public static final String LAST_CELL = "lastCell";

    private final String commandName;
    private final List<String> requiredAttributes;

    CommandType(String commandName, String... required) {
        this.commandName = commandName;
        this.requiredAttributes = Arrays.asList(required);
    }

    public String getCommandName() {
        return commandName;
    }

    public List<String> getRequiredAttributes() {
        return requiredAttributes;
    }

    /**
     * @return the command type, or null when the name is not a command
     */
    public static CommandType fromName(String name) {
        for (CommandType type : values()) {
            if (type.commandName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
