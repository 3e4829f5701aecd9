package com.unmark.core.match;

import com.unmark.core.image.GrayImage;

import java.util.Objects;

/**
 * Шаблон из готового серого массива: ближайший сосед, без растеризации.
 * Работает там, где OpenCV недоступен.
 */
public final class ArrayTemplateScaler implements TemplateScaler {

    private final GrayImage template;

    public ArrayTemplateScaler(GrayImage template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    @Override
    public int nativeWidth() {
        return template.width();
    }

    @Override
    public int nativeHeight() {
        return template.height();
    }

    @Override
    public GrayImage scale(int width, int height) {
        int tw = template.width(), th = template.height();
        if (width == tw && height == th) return template;
        float[] src = template.data();
        float[] out = new float[width * height];
        int[] xMap = new int[width];
        for (int x = 0; x < width; x++) {
            xMap[x] = Math.min(tw - 1, (int) ((x + 0.5) * tw / width));
        }
        for (int y = 0; y < height; y++) {
            int sy = Math.min(th - 1, (int) ((y + 0.5) * th / height));
            int srcRow = sy * tw;
            int dstRow = y * width;
            for (int x = 0; x < width; x++) {
                out[dstRow + x] = src[srcRow + xMap[x]];
            }
        }
        return new GrayImage(out, width, height);
    }
}
