package com.example.gridfill.engine.command;

/**
 * Which copies of a referenced cell a rewritten formula may point at.
 */
public enum FormulaStrategy {
    /** Every copy, narrowed to the formula's own loop iteration where both share one. */
    DEFAULT,
    /** Only copies in the formula cell's output column. */
    BY_COLUMN,
    /** Only copies in the formula cell's output row. */
    BY_ROW
}
