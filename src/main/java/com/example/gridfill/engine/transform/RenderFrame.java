package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.context.Context;
import com.example.gridfill.engine.grid.CellRef;
import lombok.Value;

/**
 * Where a command renders and with which variables: the output cursor, the scope and the iterations enclosing it.
 */
@Value
public class RenderFrame {
    CellRef cursor;
    Context context;
    IterationPath path;

    public RenderFrame at(CellRef target) {
        return new RenderFrame(target, context, path);
    }

    public RenderFrame with(CellRef target, Context scope, IterationPath iterationPath) {
        return new RenderFrame(target, scope, iterationPath);
    }
}
