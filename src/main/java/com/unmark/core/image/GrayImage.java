package com.unmark.core.image;

import java.util.Objects;

/**
 * Одноканальное изображение яркости: плотный row-major массив float.
 * Значения условно 0..255, но после инверсии/ресемплинга не клампятся.
 */
public record GrayImage(float[] data, int width, int height) {

    public GrayImage {
        Objects.requireNonNull(data, "data");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid size: " + width + "x" + height);
        }
        if (data.length != width * height) {
            throw new IllegalArgumentException("data.length=" + data.length + " != " + width + "x" + height);
        }
    }

    public float at(int x, int y) {
        return data[y * width + x];
    }

    /** Независимая копия (для передачи в worker: массив туда «уезжает»). */
    public GrayImage copy() {
        return new GrayImage(data.clone(), width, height);
    }
}
