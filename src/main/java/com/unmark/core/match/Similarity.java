package com.unmark.core.match;

import com.unmark.core.image.GrayImage;

/**
 * Метрики сходства окна источника (с левым верхним углом x, y) и шаблона того же размера.
 * step — шаг выборки по строкам и столбцам: точность в обмен на скорость.
 */
public final class Similarity {

    static final double VARIANCE_FLOOR = 1e-6;

    private Similarity() {}

    /** Среднее абсолютное отклонение → сходство 0..1. */
    public static double meanToScore(double mean) {
        return 1.0 - mean / 255.0;
    }

    /**
     * MAD с ранним выходом: после каждой строки, если текущее среднее уже хуже порога,
     * соответствующего abortIfBelow, возвращаем частичную оценку.
     */
    public static double mad(GrayImage src, int srcX, int srcY, GrayImage tpl, int step, double abortIfBelow) {
        final float[] s = src.data();
        final float[] t = tpl.data();
        final int srcW = src.width();
        final int tw = tpl.width(), th = tpl.height();
        final double maxMean = (1.0 - abortIfBelow) * 255.0;
        double acc = 0;
        int count = 0;
        for (int y = 0; y < th; y += step) {
            int srcRow = (srcY + y) * srcW + srcX;
            int tplRow = y * tw;
            for (int x = 0; x < tw; x += step) {
                acc += Math.abs(s[srcRow + x] - t[tplRow + x]);
                count++;
            }
            double mean = acc / Math.max(1, count);
            if (mean > maxMean) return meanToScore(mean);
        }
        return meanToScore(acc / Math.max(1, count));
    }

    /** NCC (коэффициент Пирсона), пересчитанный из [-1, 1] в [0, 1]. Без раннего выхода. */
    public static double ncc(GrayImage src, int srcX, int srcY, GrayImage tpl, int step) {
        final float[] s = src.data();
        final float[] t = tpl.data();
        final int srcW = src.width();
        final int tw = tpl.width(), th = tpl.height();
        int n = 0;
        double sumS = 0, sumT = 0, sumS2 = 0, sumT2 = 0, sumST = 0;
        for (int y = 0; y < th; y += step) {
            int sRow = (srcY + y) * srcW + srcX;
            int tRow = y * tw;
            for (int x = 0; x < tw; x += step) {
                double sv = s[sRow + x];
                double tv = t[tRow + x];
                n++;
                sumS += sv;
                sumT += tv;
                sumS2 += sv * sv;
                sumT2 += tv * tv;
                sumST += sv * tv;
            }
        }
        if (n == 0) return 0;
        double meanS = sumS / n;
        double meanT = sumT / n;
        // однородные области: дисперсия не ниже порога, иначе деление на ноль
        double varS = Math.max(VARIANCE_FLOOR, sumS2 - n * meanS * meanS);
        double varT = Math.max(VARIANCE_FLOOR, sumT2 - n * meanT * meanT);
        double cov = sumST - n * meanS * meanT;
        double corr = cov / Math.sqrt(varS * varT);
        return Math.max(0, Math.min(1, (corr + 1) / 2));
    }
}
