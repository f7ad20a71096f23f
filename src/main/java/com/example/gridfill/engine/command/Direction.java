package com.example.gridfill.engine.command;

/**
 * Axis along which an each command replicates its block.
 */
public enum Direction {
    DOWN, RIGHT
}
