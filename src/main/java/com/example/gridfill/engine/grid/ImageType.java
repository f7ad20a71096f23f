package com.example.gridfill.engine.grid;

import java.util.Locale;

public enum ImageType {
    PNG, JPEG, GIF, BMP, EMF, WMF, PICT, DIB;

    /**
     * Resolve an {@code imageType} attribute value. {@code JPG} is accepted as an alias of {@code JPEG}.
     *
     * @throws IllegalArgumentException for an unsupported type
     */
    public static ImageType fromAttribute(String value) {
        if (value == null || value.isBlank()) {
            return PNG;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("JPG".equals(normalized)) {
            return JPEG;
        }
        return ImageType.valueOf(normalized);
    }
}
