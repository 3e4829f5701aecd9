package com.unmark.core.image;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Декодирование/кодирование через ImageIO (без нативных библиотек).
 * Используется array-путём и конвейером удаления; OpenCV нужен только raster-пути.
 */
public final class ImageCodec {

    private ImageCodec() {}

    public static RgbaImage decode(byte[] encoded) throws IOException {
        if (encoded == null || encoded.length == 0) {
            throw new IOException("Empty image data");
        }
        BufferedImage bi = ImageIO.read(new ByteArrayInputStream(encoded));
        if (bi == null) {
            throw new IOException("Unsupported image format");
        }
        return fromBufferedImage(bi);
    }

    public static RgbaImage read(Path file) throws IOException {
        return decode(Files.readAllBytes(file));
    }

    public static RgbaImage fromBufferedImage(BufferedImage bi) {
        if (bi.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            return fromGrayRaster(bi);
        }
        int w = bi.getWidth(), h = bi.getHeight();
        int[] argb = bi.getRGB(0, 0, w, h, null, 0, w);
        byte[] rgba = new byte[4 * w * h];
        for (int i = 0, o = 0; i < argb.length; i++, o += 4) {
            int p = argb[i];
            rgba[o] = (byte) (p >>> 16);
            rgba[o + 1] = (byte) (p >>> 8);
            rgba[o + 2] = (byte) p;
            rgba[o + 3] = (byte) (p >>> 24);
        }
        return new RgbaImage(rgba, w, h);
    }

    /**
     * Серые изображения читаем из растра напрямую: getRGB переводит линейный серый в sRGB
     * и осветляет каждый пиксель. 16-битные отсчёты сводятся к 8 битам.
     */
    static RgbaImage fromGrayRaster(BufferedImage bi) {
        int w = bi.getWidth(), h = bi.getHeight();
        ColorModel cm = bi.getColorModel();
        Raster r = bi.getRaster();
        boolean alpha = cm.hasAlpha() && r.getNumBands() > 1;
        int grayMax = (1 << cm.getComponentSize(0)) - 1;
        int alphaMax = alpha ? (1 << cm.getComponentSize(1)) - 1 : 255;
        byte[] rgba = new byte[4 * w * h];
        for (int y = 0, o = 0; y < h; y++) {
            for (int x = 0; x < w; x++, o += 4) {
                int g = to8Bit(r.getSample(x, y, 0), grayMax);
                rgba[o] = (byte) g;
                rgba[o + 1] = (byte) g;
                rgba[o + 2] = (byte) g;
                rgba[o + 3] = (byte) (alpha ? to8Bit(r.getSample(x, y, 1), alphaMax) : 255);
            }
        }
        return new RgbaImage(rgba, w, h);
    }

    private static int to8Bit(int sample, int max) {
        return max == 255 ? sample : (int) Math.round(sample * 255.0 / max);
    }

    public static BufferedImage toBufferedImage(RgbaImage img) {
        int w = img.width(), h = img.height();
        byte[] rgba = img.rgba();
        int[] argb = new int[w * h];
        for (int i = 0, o = 0; o < argb.length; i += 4, o++) {
            argb[o] = ((rgba[i + 3] & 0xFF) << 24)
                    | ((rgba[i] & 0xFF) << 16)
                    | ((rgba[i + 1] & 0xFF) << 8)
                    | (rgba[i + 2] & 0xFF);
        }
        BufferedImage bi = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        bi.setRGB(0, 0, w, h, argb, 0, w);
        return bi;
    }

    public static byte[] encodePng(RgbaImage img) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(toBufferedImage(img), "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }
}
