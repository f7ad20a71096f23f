package com.example.gridfill.engine.transform;

import lombok.Value;

import java.util.List;

/**
 * One group produced by {@code groupBy}, bound to the loop variable in place of a plain item.
 * Templates read {@code g.key}, {@code g.item} (the first member) and {@code g.items}.
 */
@Value
public class GroupData {
    Object key;
    Object item;
    List<Object> items;
}
