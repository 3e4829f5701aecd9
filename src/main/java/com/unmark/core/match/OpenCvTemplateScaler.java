package com.unmark.core.match;

import com.unmark.core.image.GrayImage;
import com.unmark.core.image.Grayscale;
import com.unmark.core.image.OpenCvImages;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

/**
 * Шаблон из исходного изображения: на каждом масштабе растеризуем заново
 * (resize INTER_LINEAR), затем в серый. Держит нативный Mat, поэтому AutoCloseable.
 */
public final class OpenCvTemplateScaler implements TemplateScaler, AutoCloseable {

    private final Mat rgba;

    private OpenCvTemplateScaler(Mat rgba) {
        this.rgba = rgba;
    }

    /** @throws com.unmark.core.image.UnsupportedEnvironmentException если OpenCV не загружается */
    public static OpenCvTemplateScaler decode(byte[] encodedTemplate) {
        return new OpenCvTemplateScaler(OpenCvImages.decodeRgba(encodedTemplate));
    }

    @Override
    public int nativeWidth() {
        return rgba.cols();
    }

    @Override
    public int nativeHeight() {
        return rgba.rows();
    }

    @Override
    public GrayImage scale(int width, int height) {
        Mat dst = new Mat();
        try {
            if (width == rgba.cols() && height == rgba.rows()) {
                rgba.copyTo(dst);
            } else {
                opencv_imgproc.resize(rgba, dst, new Size(width, height), 0, 0, opencv_imgproc.INTER_LINEAR);
            }
            return Grayscale.toGray(OpenCvImages.toRgbaImage(dst));
        } finally {
            dst.release();
        }
    }

    @Override
    public void close() {
        rgba.release();
    }
}
