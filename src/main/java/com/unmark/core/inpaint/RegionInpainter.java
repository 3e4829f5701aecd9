package com.unmark.core.inpaint;

import com.unmark.core.image.RgbaImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Заливка прямоугольника по соседним пикселям.
 * <ol>
 *   <li>Дисперсия цвета узкой полосы слева и справа от прямоугольника.</li>
 *   <li>Донор — более ровная сторона (при равенстве левая).</li>
 *   <li>Каждая строка прямоугольника заливается цветом соседнего с ним столбца донора (только RGB).</li>
 *   <li>Сглаживание 3x3 (центр 2, остальные 1, /10) по кольцу на 1px шире, включая альфу.</li>
 * </ol>
 * Синхронно, без уступок; все индексы ограничены границами буфера.
 */
public final class RegionInpainter {
    private static final Logger log = LoggerFactory.getLogger(RegionInpainter.class);

    private static final int[] KERNEL = {
            1, 1, 1,
            1, 2, 1,
            1, 1, 1,
    };
    private static final int KERNEL_SUM = 10;

    private final int stripWidth;   // ширина полосы для оценки дисперсии, px
    private final int stripRowPad;  // полоса выше/ниже прямоугольника, px

    public RegionInpainter() {
        this(6, 2);
    }

    public RegionInpainter(int stripWidth, int stripRowPad) {
        if (stripWidth <= 0 || stripRowPad < 0) {
            throw new IllegalArgumentException("stripWidth=" + stripWidth + " stripRowPad=" + stripRowPad);
        }
        this.stripWidth = stripWidth;
        this.stripRowPad = stripRowPad;
    }

    public enum Side { LEFT, RIGHT, NONE }

    /** Заливает region на месте. Возвращает выбранную сторону-донор. */
    public Side inpaint(RgbaImage img, Region region) {
        Objects.requireNonNull(img, "img");
        Objects.requireNonNull(region, "region");
        final int W = img.width(), H = img.height();
        // прямоугольник, обрезанный по границам; x1/y1 исключительно
        int x0 = Math.max(0, region.x());
        int y0 = Math.max(0, region.y());
        int x1 = Math.min(W, region.x() + region.w());
        int y1 = Math.min(H, region.y() + region.h());
        if (region.isEmpty() || x1 <= x0 || y1 <= y0) {
            log.debug("Inpaint: empty region {}", region);
            return Side.NONE;
        }
        int w = x1 - x0, h = y1 - y0;

        Side side = chooseDonor(img, x0, y0, w, h);
        if (side != Side.NONE) {
            fillFromColumn(img, x0, y0, w, h, side == Side.LEFT ? x0 - 1 : x1);
        }
        smooth(img, x0, y0, w, h);
        log.info("Inpaint: region=({}, {}, {}, {}) donor={}", x0, y0, w, h, side);
        return side;
    }

    Side chooseDonor(RgbaImage img, int x, int y, int w, int h) {
        final int W = img.width(), H = img.height();
        int sy0 = Math.max(0, y - stripRowPad);
        int sy1 = Math.min(H - 1, y + h + stripRowPad);
        // полосы только снаружи прямоугольника: у края изображения полоса пустая → +inf
        int lx0 = Math.max(0, x - stripWidth), lx1 = x - 1;
        int rx0 = x + w, rx1 = Math.min(W - 1, x + w + stripWidth - 1);
        double leftVar = lx1 >= lx0 ? stripVariance(img, lx0, lx1, sy0, sy1) : Double.POSITIVE_INFINITY;
        double rightVar = rx1 >= rx0 ? stripVariance(img, rx0, rx1, sy0, sy1) : Double.POSITIVE_INFINITY;
        if (log.isDebugEnabled()) {
            log.debug("Inpaint: leftVar={} rightVar={}", leftVar, rightVar);
        }
        if (leftVar == Double.POSITIVE_INFINITY && rightVar == Double.POSITIVE_INFINITY) return Side.NONE;
        return leftVar <= rightVar ? Side.LEFT : Side.RIGHT;
    }

    /**
     * Средняя по каналам R, G, B выборочная дисперсия (онлайн-алгоритм Уэлфорда)
     * в прямоугольнике [x0..x1] x [y0..y1] включительно.
     */
    static double stripVariance(RgbaImage img, int x0, int x1, int y0, int y1) {
        byte[] d = img.rgba();
        int n = 0;
        double mr = 0, mg = 0, mb = 0, vr = 0, vg = 0, vb = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                int i = img.index(x, y);
                int r = d[i] & 0xFF, g = d[i + 1] & 0xFF, b = d[i + 2] & 0xFF;
                n++;
                double dr = r - mr;
                mr += dr / n;
                vr += dr * (r - mr);
                double dg = g - mg;
                mg += dg / n;
                vg += dg * (g - mg);
                double db = b - mb;
                mb += db / n;
                vb += db * (b - mb);
            }
        }
        double denom = Math.max(1, n - 1);
        return (vr / denom + vg / denom + vb / denom) / 3;
    }

    private static void fillFromColumn(RgbaImage img, int x, int y, int w, int h, int srcX) {
        byte[] d = img.rgba();
        for (int yy = y; yy < y + h; yy++) {
            int src = img.index(srcX, yy);
            for (int xx = x; xx < x + w; xx++) {
                int dst = img.index(xx, yy);
                d[dst] = d[src];
                d[dst + 1] = d[src + 1];
                d[dst + 2] = d[src + 2];
            }
        }
    }

    /** Свёртка по снимку буфера после заливки; крайние строки/столбцы изображения не трогаем. */
    private static void smooth(RgbaImage img, int x, int y, int w, int h) {
        final int W = img.width(), H = img.height();
        int bx0 = Math.max(1, x - 1), by0 = Math.max(1, y - 1);
        int bx1 = Math.min(W - 2, x + w + 1), by1 = Math.min(H - 2, y + h + 1);
        if (bx1 < bx0 || by1 < by0) return;
        byte[] d = img.rgba();
        byte[] copy = d.clone();
        for (int yy = by0; yy <= by1; yy++) {
            for (int xx = bx0; xx <= bx1; xx++) {
                int r = 0, g = 0, b = 0, a = 0;
                int ki = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int idx = ((yy + dy) * W + (xx + dx)) * 4;
                        int k = KERNEL[ki++];
                        r += (copy[idx] & 0xFF) * k;
                        g += (copy[idx + 1] & 0xFF) * k;
                        b += (copy[idx + 2] & 0xFF) * k;
                        a += (copy[idx + 3] & 0xFF) * k;
                    }
                }
                int di = (yy * W + xx) * 4;
                d[di] = (byte) Math.round(r / (float) KERNEL_SUM);
                d[di + 1] = (byte) Math.round(g / (float) KERNEL_SUM);
                d[di + 2] = (byte) Math.round(b / (float) KERNEL_SUM);
                d[di + 3] = (byte) Math.round(a / (float) KERNEL_SUM);
            }
        }
    }
}
