package com.example.gridfill.engine.grid;

import lombok.Builder;
import lombok.Value;

/**
 * What a template cell holds. {@code value} is a String, Double, Boolean, LocalDateTime or null;
 * {@code formula} is the formula text without the leading '=' when the cell is a formula cell.
 */
@Value
@Builder
public class CellContent {
    CellRef ref;
    Object value;
    String formula;
    int styleIndex;
    String comment;

    public boolean isFormula() {
        return formula != null;
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
