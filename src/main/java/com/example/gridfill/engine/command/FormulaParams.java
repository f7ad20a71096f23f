package com.example.gridfill.engine.command;

import lombok.Value;

/**
 * Formula options declared with {@code jx:params} on a formula cell.
 */
@Value
public class FormulaParams {
    public static final FormulaParams DEFAULTS = new FormulaParams(FormulaStrategy.DEFAULT, "0");

    FormulaStrategy strategy;
    String defaultValue;
}
