package com.unmark.core.worker;

import java.util.Objects;

/** Поиск по закодированным байтам изображения и шаблона; декодирует и уменьшает сам worker. */
public record DetectRasterRequest(String id, byte[] image, byte[] template) implements DetectRequest {

    public DetectRasterRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(template, "template");
    }

    @Override
    public DetectKind kind() {
        return DetectKind.DETECT_RASTER;
    }
}
