package com.unmark.core.image;

import com.unmark.core.TestImages;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

// нужны нативные библиотеки OpenCV; без них тесты пропускаются
class OpenCvImagesTest {

    @BeforeEach
    void requireOpenCv() {
        assumeTrue(OpenCvImages.isAvailable(), "OpenCV natives not available");
    }

    @Test
    void sixteenBitPngIsReducedTo8Bit() throws Exception {
        RgbaImage src = TestImages.uniform(6, 4, 100);
        src.setRgba(5, 3, 200, 200, 200, 255);
        Mat m = OpenCvImages.decodeRgba(TestImages.grayPng(src, true));
        try {
            assertEquals(opencv_core.CV_8U, m.depth());
            RgbaImage img = OpenCvImages.toRgbaImage(m);
            assertEquals(6, img.width());
            assertEquals(100, img.channel(0, 0, 0));
            assertEquals(200, img.channel(5, 3, 1));
            assertEquals(255, img.channel(0, 0, 3));
        } finally {
            m.release();
        }
    }

    @Test
    void rasterAndImageIoAgreeOnGrayPng() throws Exception {
        RgbaImage src = TestImages.uniform(8, 8, 90);
        TestImages.grayNoise(src, 2, 2, 4, 4, 9L);
        byte[] png = TestImages.grayPng(src, false);

        Mat m = OpenCvImages.decodeRgba(png);
        try {
            assertArrayEquals(ImageCodec.decode(png).rgba(), OpenCvImages.toRgbaImage(m).rgba());
        } finally {
            m.release();
        }
    }

    @Test
    void toRgbaImageRejectsWrongLayout() {
        Mat wide = new Mat(2, 2, opencv_core.CV_16UC4);
        Mat three = new Mat(2, 2, opencv_core.CV_8UC3);
        try {
            assertThrows(IllegalArgumentException.class, () -> OpenCvImages.toRgbaImage(wide));
            assertThrows(IllegalArgumentException.class, () -> OpenCvImages.toRgbaImage(three));
        } finally {
            OpenCvImages.release(wide, three);
        }
    }
}
