package com.example.gridfill.engine.command;

/**
 * Exhaustive dispatch over command kinds. Adding a command kind adds a method here, so every visitor has to
 * decide what to do with it.
 *
 * @param <R> result type
 * @param <A> argument threaded through the walk
 */
public interface CommandVisitor<R, A> {

    R visitArea(AreaCommand area, A arg);

    R visitEach(EachCommand each, A arg);

    R visitIf(IfCommand ifCommand, A arg);

    R visitGrid(GridCommand grid, A arg);

    R visitImage(ImageCommand image, A arg);

    R visitMergeCells(MergeCellsCommand mergeCells, A arg);

    R visitAutoRowHeight(AutoRowHeightCommand autoRowHeight, A arg);

    R visitUpdateCell(UpdateCellCommand updateCell, A arg);
}
