package com.unmark.core.image;

/**
 * RGBA → яркость с фиксированными весами 0.299/0.587/0.114 (альфа игнорируется),
 * плюс инверсия s → 255 - s для поиска метки обратной полярности.
 */
public final class Grayscale {

    private Grayscale() {}

    public static GrayImage toGray(RgbaImage img) {
        return toGray(img.rgba(), img.width(), img.height());
    }

    public static GrayImage toGray(byte[] rgba, int width, int height) {
        float[] out = new float[rgba.length / 4];
        for (int i = 0, j = 0; i < rgba.length; i += 4, j++) {
            int r = rgba[i] & 0xFF;
            int g = rgba[i + 1] & 0xFF;
            int b = rgba[i + 2] & 0xFF;
            out[j] = (float) (0.299 * r + 0.587 * g + 0.114 * b);
        }
        return new GrayImage(out, width, height);
    }

    public static GrayImage invert(GrayImage src) {
        float[] in = src.data();
        float[] out = new float[in.length];
        for (int i = 0; i < in.length; i++) {
            out[i] = 255f - in[i];
        }
        return new GrayImage(out, src.width(), src.height());
    }
}
