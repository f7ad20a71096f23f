package com.example.gridfill.engine.command;

import lombok.Value;

import java.util.List;

/**
 * Everything declared in one cell annotation.
 */
@Value
public class ParsedAnnotation {
    List<CommandNode> commands;
    FormulaParams formulaParams;
}
