package com.example.gridfill.engine.grid;

import lombok.Value;

/**
 * Width and height, in cells, of a rendered block.
 */
@Value
public class Size {
    public static final Size ZERO = new Size(0, 0);

    int width;
    int height;

    public static Size of(int width, int height) {
        return new Size(width, height);
    }
}
