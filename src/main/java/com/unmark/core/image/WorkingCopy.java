package com.unmark.core.image;

/**
 * Уменьшенная рабочая копия изображения для поиска метки.
 * Ширина ограничена maxWidth, чтобы стоимость поиска не росла с разрешением;
 * scaleToFull переводит координаты найденной метки обратно в полное разрешение.
 */
public record WorkingCopy(RgbaImage image, GrayImage gray, double scaleToFull) {

    public static WorkingCopy of(RgbaImage full, int maxWidth) {
        if (maxWidth <= 0) throw new IllegalArgumentException("maxWidth must be > 0: " + maxWidth);
        double scale = full.width() > maxWidth ? maxWidth / (double) full.width() : 1.0;
        int w = Math.max(1, (int) Math.round(full.width() * scale));
        int h = Math.max(1, (int) Math.round(full.height() * scale));
        RgbaImage small = (w == full.width() && h == full.height()) ? full : areaResample(full, w, h);
        return new WorkingCopy(small, Grayscale.toGray(small), 1.0 / scale);
    }

    public int width() {
        return image.width();
    }

    public int height() {
        return image.height();
    }

    /** Усреднение по площади (аналог INTER_AREA): каждый целевой пиксель = среднее своего блока. */
    static RgbaImage areaResample(RgbaImage src, int w, int h) {
        int W = src.width(), H = src.height();
        byte[] in = src.rgba();
        byte[] out = new byte[4 * w * h];
        for (int dy = 0; dy < h; dy++) {
            int sy0 = (int) ((long) dy * H / h);
            int sy1 = Math.max(sy0 + 1, (int) ((long) (dy + 1) * H / h));
            for (int dx = 0; dx < w; dx++) {
                int sx0 = (int) ((long) dx * W / w);
                int sx1 = Math.max(sx0 + 1, (int) ((long) (dx + 1) * W / w));
                long r = 0, g = 0, b = 0, a = 0;
                int n = 0;
                for (int sy = sy0; sy < sy1; sy++) {
                    int row = sy * W;
                    for (int sx = sx0; sx < sx1; sx++) {
                        int i = (row + sx) * 4;
                        r += in[i] & 0xFF;
                        g += in[i + 1] & 0xFF;
                        b += in[i + 2] & 0xFF;
                        a += in[i + 3] & 0xFF;
                        n++;
                    }
                }
                int o = (dy * w + dx) * 4;
                out[o] = (byte) Math.round(r / (double) n);
                out[o + 1] = (byte) Math.round(g / (double) n);
                out[o + 2] = (byte) Math.round(b / (double) n);
                out[o + 3] = (byte) Math.round(a / (double) n);
            }
        }
        return new RgbaImage(out, w, h);
    }
}
