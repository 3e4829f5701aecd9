package com.unmark.core.worker;

import com.unmark.core.image.GrayImage;

import java.util.Objects;

/**
 * Поиск по готовым серым буферам. Массивы передаются во владение worker'у:
 * после отправки отправитель их не читает.
 */
public record DetectArrayRequest(String id, GrayImage source, GrayImage template, double scaleToFull)
        implements DetectRequest {

    public DetectArrayRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(template, "template");
        if (!(scaleToFull > 0)) throw new IllegalArgumentException("scaleToFull must be > 0: " + scaleToFull);
    }

    @Override
    public DetectKind kind() {
        return DetectKind.DETECT_ARRAY;
    }
}
