package com.example.gridfill.engine;

import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.grid.CellContent;

/**
 * Custom per-cell processing for {@code jx:updateCell}. Put an implementation into the fill data and name it in
 * the command's {@code updater} attribute.
 */
public interface CellUpdater {

    /**
     * Called once for every output cell of the command's block, after the block has been rendered. Formula
     * cells are written after rendering and are passed without their formula.
     *
     * @param cell    the rendered cell; {@link CellContent#getRef()} is the output position
     * @param context bindings in scope at the command, including loop variables
     * @return the value to write, or null to keep the cell as rendered
     */
    Object update(CellContent cell, Context context);
}
