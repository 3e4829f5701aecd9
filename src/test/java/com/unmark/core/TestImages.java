package com.unmark.core;

import com.unmark.core.image.GrayImage;
import com.unmark.core.image.Grayscale;
import com.unmark.core.image.ImageCodec;
import com.unmark.core.image.RgbaImage;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Random;

/** Синтетические изображения для тестов: светлый фон и тёмная «метка» 40x20. */
public final class TestImages {

    public static final int BG = 230;
    public static final int INK = 30;
    public static final int TPL_W = 40;
    public static final int TPL_H = 20;

    private TestImages() {}

    /** Метка: прямоугольник, диагональ, вертикальная черта и точка. */
    public static RgbaImage template() {
        RgbaImage t = uniform(TPL_W, TPL_H, BG);
        fill(t, 4, 4, 8, 12, INK);
        for (int i = 0; i < 14; i++) {
            fill(t, 16 + i, 3 + i, 2, 1, INK);
        }
        fill(t, 30, 2, 2, 16, INK);
        fill(t, 34, 8, 2, 2, INK);
        return t;
    }

    public static GrayImage grayTemplate() {
        return Grayscale.toGray(template());
    }

    public static RgbaImage uniform(int w, int h, int v) {
        RgbaImage img = RgbaImage.blank(w, h);
        fill(img, 0, 0, w, h, v);
        return img;
    }

    public static void fill(RgbaImage img, int x, int y, int w, int h, int v) {
        fill(img, x, y, w, h, v, v, v);
    }

    public static void fill(RgbaImage img, int x, int y, int w, int h, int r, int g, int b) {
        for (int yy = y; yy < y + h; yy++) {
            for (int xx = x; xx < x + w; xx++) {
                img.setRgba(xx, yy, r, g, b, 255);
            }
        }
    }

    public static void paste(RgbaImage dst, RgbaImage src, int x, int y) {
        for (int yy = 0; yy < src.height(); yy++) {
            System.arraycopy(src.rgba(), src.index(0, yy), dst.rgba(), dst.index(x, yy + y), 4 * src.width());
        }
    }

    public static GrayImage uniformGray(int w, int h, float v) {
        float[] d = new float[w * h];
        Arrays.fill(d, v);
        return new GrayImage(d, w, h);
    }

    public static GrayImage noiseGray(int w, int h, long seed) {
        Random rnd = new Random(seed);
        float[] d = new float[w * h];
        for (int i = 0; i < d.length; i++) d[i] = rnd.nextInt(256);
        return new GrayImage(d, w, h);
    }

    public static RgbaImage noise(int w, int h, long seed) {
        Random rnd = new Random(seed);
        RgbaImage img = RgbaImage.blank(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                img.setRgba(x, y, rnd.nextInt(256), rnd.nextInt(256), rnd.nextInt(256), 255);
            }
        }
        return img;
    }

    /** Копирует серый шаблон в серое изображение с левым верхним углом (x, y). */
    public static void paste(GrayImage dst, GrayImage src, int x, int y) {
        for (int yy = 0; yy < src.height(); yy++) {
            System.arraycopy(src.data(), yy * src.width(), dst.data(), (yy + y) * dst.width() + x, src.width());
        }
    }

    /** Светлый кадр w x h с меткой в (x, y). */
    public static RgbaImage marked(int w, int h, int x, int y) {
        RgbaImage img = uniform(w, h, BG);
        paste(img, template(), x, y);
        return img;
    }

    public static byte[] png(RgbaImage img) throws IOException {
        return ImageCodec.encodePng(img);
    }

    /** Одноканальный PNG (TYPE_BYTE_GRAY или TYPE_USHORT_GRAY) из канала R; 16 бит: v * 257. */
    public static byte[] grayPng(RgbaImage img, boolean sixteenBit) throws IOException {
        BufferedImage bi = new BufferedImage(img.width(), img.height(),
                sixteenBit ? BufferedImage.TYPE_USHORT_GRAY : BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster r = bi.getRaster();
        for (int y = 0; y < img.height(); y++) {
            for (int x = 0; x < img.width(); x++) {
                int v = img.channel(x, y, 0);
                r.setSample(x, y, 0, sixteenBit ? v * 257 : v);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(bi, "png", out);
        return out.toByteArray();
    }

    /** Шум одного уровня во всех каналах: годится для серых PNG. */
    public static void grayNoise(RgbaImage img, int x, int y, int w, int h, long seed) {
        Random rnd = new Random(seed);
        for (int yy = y; yy < y + h; yy++) {
            for (int xx = x; xx < x + w; xx++) {
                int v = rnd.nextInt(256);
                img.setRgba(xx, yy, v, v, v, 255);
            }
        }
    }
}
