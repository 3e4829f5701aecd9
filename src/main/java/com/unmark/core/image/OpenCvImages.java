package com.unmark.core.image;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raster-путь на OpenCV (JavaCPP): декодирование, ресайз, выгрузка RGBA.
 * Если нативные библиотеки не грузятся — {@link UnsupportedEnvironmentException},
 * вызывающий остаётся на array-пути.
 */
public final class OpenCvImages {
    private static final Logger log = LoggerFactory.getLogger(OpenCvImages.class);

    private static volatile Boolean available;

    private OpenCvImages() {}

    /** Прелоад нужных модулей OpenCV; результат кэшируется на процесс. */
    public static boolean isAvailable() {
        Boolean a = available;
        if (a != null) return a;
        synchronized (OpenCvImages.class) {
            if (available == null) {
                try {
                    Loader.load(opencv_core.class);
                    Loader.load(opencv_imgproc.class);
                    Loader.load(opencv_imgcodecs.class);
                    available = Boolean.TRUE;
                    log.info("OpenCV: natives loaded");
                } catch (Throwable t) {
                    available = Boolean.FALSE;
                    log.warn("OpenCV: natives unavailable: {}", t.toString());
                }
            }
            return available;
        }
    }

    public static void ensureLoaded() {
        if (!isAvailable()) {
            throw new UnsupportedEnvironmentException("OpenCV rasterization not supported in this environment");
        }
    }

    /** Декодирует байты изображения в 4-канальный Mat (порядок RGBA). Освобождает вызывающий. */
    public static Mat decodeRgba(byte[] encoded) {
        ensureLoaded();
        if (encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("Empty image data");
        }
        try (BytePointer bp = new BytePointer(encoded);
             Mat raw = new Mat(1, encoded.length, opencv_core.CV_8UC1, bp);
             Mat decoded = opencv_imgcodecs.imdecode(raw, opencv_imgcodecs.IMREAD_UNCHANGED)) {
            if (decoded == null || decoded.empty()) {
                throw new IllegalArgumentException("OpenCV cannot decode image (" + encoded.length + " bytes)");
            }
            Mat src8 = to8Bit(decoded);
            int code = switch (src8.channels()) {
                case 1 -> opencv_imgproc.COLOR_GRAY2RGBA;
                case 3 -> opencv_imgproc.COLOR_BGR2RGBA;
                case 4 -> opencv_imgproc.COLOR_BGRA2RGBA;
                default -> {
                    if (src8 != decoded) src8.release();
                    throw new IllegalArgumentException("Unsupported channel count: " + decoded.channels());
                }
            };
            Mat rgba = new Mat();
            try {
                opencv_imgproc.cvtColor(src8, rgba, code);
            } finally {
                if (src8 != decoded) src8.release();
            }
            return rgba;
        }
    }

    /** IMREAD_UNCHANGED сохраняет глубину источника: 16-битные PNG/TIFF сводим к 8 битам. */
    private static Mat to8Bit(Mat decoded) {
        int depth = decoded.depth();
        if (depth == opencv_core.CV_8U) return decoded;
        if (depth != opencv_core.CV_16U) {
            throw new IllegalArgumentException("Unsupported image depth: " + depth);
        }
        Mat out = new Mat();
        decoded.convertTo(out, opencv_core.CV_8U, 1 / 257.0, 0);
        return out;
    }

    /** Копия пикселей 4-канального Mat в RgbaImage. */
    public static RgbaImage toRgbaImage(Mat rgba) {
        if (rgba.depth() != opencv_core.CV_8U || rgba.channels() != 4) {
            throw new IllegalArgumentException("Expected 8-bit 4-channel Mat, got depth=" + rgba.depth()
                    + " channels=" + rgba.channels());
        }
        Mat src = rgba.isContinuous() ? rgba : rgba.clone();
        try {
            int w = src.cols(), h = src.rows();
            byte[] buf = new byte[4 * w * h];
            src.data().get(buf);
            return new RgbaImage(buf, w, h);
        } finally {
            if (src != rgba) src.release();
        }
    }

    /** Рабочая копия на OpenCV: INTER_AREA при уменьшении, как делает canvas с imageSmoothingQuality=high. */
    public static WorkingCopy workingCopy(byte[] encoded, int maxWidth) {
        Mat full = decodeRgba(encoded);
        Mat small = new Mat();
        try {
            double scale = full.cols() > maxWidth ? maxWidth / (double) full.cols() : 1.0;
            int w = Math.max(1, (int) Math.round(full.cols() * scale));
            int h = Math.max(1, (int) Math.round(full.rows() * scale));
            if (w == full.cols() && h == full.rows()) {
                full.copyTo(small);
            } else {
                opencv_imgproc.resize(full, small, new Size(w, h), 0, 0, opencv_imgproc.INTER_AREA);
            }
            RgbaImage img = toRgbaImage(small);
            if (log.isDebugEnabled()) {
                log.debug("OpenCV: working copy {}x{} -> {}x{} scale={}", full.cols(), full.rows(), w, h, scale);
            }
            return new WorkingCopy(img, Grayscale.toGray(img), 1.0 / scale);
        } finally {
            release(full, small);
        }
    }

    static void release(Mat... mats) {
        for (Mat m : mats) if (m != null) m.release();
    }
}
