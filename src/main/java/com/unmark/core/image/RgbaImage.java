package com.unmark.core.image;

import java.util.Objects;

/**
 * Полноразмерный пиксельный буфер RGBA (по 4 байта на пиксель, row-major).
 * Инпейнтер пишет в него на месте.
 */
public record RgbaImage(byte[] rgba, int width, int height) {

    public RgbaImage {
        Objects.requireNonNull(rgba, "rgba");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid size: " + width + "x" + height);
        }
        if (rgba.length != 4 * width * height) {
            throw new IllegalArgumentException("rgba.length=" + rgba.length + " != 4*" + width + "x" + height);
        }
    }

    public static RgbaImage blank(int width, int height) {
        return new RgbaImage(new byte[4 * width * height], width, height);
    }

    /** Индекс канала R пикселя (x, y). */
    public int index(int x, int y) {
        return (y * width + x) * 4;
    }

    /** Канал c (0=R..3=A) как беззнаковое значение. */
    public int channel(int x, int y, int c) {
        return rgba[index(x, y) + c] & 0xFF;
    }

    public void setRgba(int x, int y, int r, int g, int b, int a) {
        int i = index(x, y);
        rgba[i] = (byte) r;
        rgba[i + 1] = (byte) g;
        rgba[i + 2] = (byte) b;
        rgba[i + 3] = (byte) a;
    }

    public RgbaImage copy() {
        return new RgbaImage(rgba.clone(), width, height);
    }
}
