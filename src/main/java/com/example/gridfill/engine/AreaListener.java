package com.example.gridfill.engine;

import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.GridDocument;

/**
 * Notified around every template cell copied into the output, e.g. for conditional styling.
 * Register with {@code FillOptions.builder().areaListener(...)}.
 */
public interface AreaListener {

    /**
     * @return false to skip the default copy of this cell; after-callbacks still run
     */
    default boolean beforeTransformCell(CellRef source, CellRef target, Context context, GridDocument document) {
        return true;
    }

    default void afterTransformCell(CellRef source, CellRef target, Context context, GridDocument document) {
    }
}
