package com.example.gridfill.engine.command;

import lombok.Value;

import java.util.Locale;

/**
 * Ordering of groups produced by {@code groupBy}, parsed from values such as {@code asc}, {@code DESC} or
 * {@code desc_ignorecase}.
 */
@Value
public class GroupOrder {
    boolean descending;
    boolean ignoreCase;

    /**
     * @throws IllegalArgumentException when the value names no known ordering
     */
    public static GroupOrder parse(String value) {
        boolean descending = false;
        boolean ignoreCase = false;
        boolean direction = false;
        for (String part : value.trim().toUpperCase(Locale.ROOT).split("[_\\s,]+")) {
            switch (part) {
                case "ASC":
                    direction = true;
                    break;
                case "DESC":
                    descending = true;
                    direction = true;
                    break;
                case "IGNORECASE":
                    ignoreCase = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown group order '" + value + "'");
            }
        }
        if (!direction && !ignoreCase) {
            throw new IllegalArgumentException("Unknown group order '" + value + "'");
        }
        return new GroupOrder(descending, ignoreCase);
    }
}
