package com.unmark.core.match;

import com.unmark.core.TestImages;
import com.unmark.core.image.GrayImage;
import com.unmark.core.image.OpenCvImages;
import com.unmark.core.image.WorkingCopy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

// нужны нативные библиотеки OpenCV; без них тесты пропускаются
class OpenCvTemplateScalerTest {

    @BeforeEach
    void requireOpenCv() {
        assumeTrue(OpenCvImages.isAvailable(), "OpenCV natives not available");
    }

    @Test
    void nativeSizeMatchesArrayPath() throws Exception {
        GrayImage expected = TestImages.grayTemplate();
        try (OpenCvTemplateScaler s = OpenCvTemplateScaler.decode(TestImages.png(TestImages.template()))) {
            assertEquals(TestImages.TPL_W, s.nativeWidth());
            assertEquals(TestImages.TPL_H, s.nativeHeight());
            GrayImage g = s.scale(TestImages.TPL_W, TestImages.TPL_H);
            assertArrayEquals(expected.data(), g.data(), 1e-3f);
        }
    }

    @Test
    void resizesToRequestedSize() throws Exception {
        try (OpenCvTemplateScaler s = OpenCvTemplateScaler.decode(TestImages.png(TestImages.template()))) {
            GrayImage g = s.scale(20, 10);
            assertEquals(20, g.width());
            assertEquals(10, g.height());
        }
    }

    @Test
    void rasterWorkingCopyDownscales() throws Exception {
        WorkingCopy wc = OpenCvImages.workingCopy(TestImages.png(TestImages.uniform(1440, 100, 200)), 720);
        assertEquals(720, wc.width());
        assertEquals(50, wc.height());
        assertEquals(2.0, wc.scaleToFull(), 1e-9);
        assertEquals(200f, wc.gray().at(10, 10), 0.5f);
    }

    @Test
    void garbageBytesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> OpenCvImages.decodeRgba(new byte[]{1, 2, 3}));
    }
}
