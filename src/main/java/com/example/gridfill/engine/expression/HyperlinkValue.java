package com.example.gridfill.engine.expression;

import lombok.Value;

/**
 * Result of {@code hyperlink(url, label)}. Written as a hyperlink cell showing the label.
 */
@Value
public class HyperlinkValue {
    String url;
    String label;

    public String getDisplayText() {
        return label == null || label.isEmpty() ? url : label;
    }

    @Override
    public String toString() {
        return getDisplayText();
    }
}
