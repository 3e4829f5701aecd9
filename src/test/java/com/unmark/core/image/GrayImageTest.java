package com.unmark.core.image;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GrayImageTest {

    @Test
    void rejectsMismatchedBuffer() {
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(new float[5], 2, 2));
        assertThrows(IllegalArgumentException.class, () -> new GrayImage(new float[0], 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new RgbaImage(new byte[15], 2, 2));
    }

    @Test
    void copyIsIndependent() {
        GrayImage g = new GrayImage(new float[]{1, 2}, 2, 1);
        GrayImage c = g.copy();
        c.data()[0] = 9;
        assertEquals(1f, g.at(0, 0));
        assertEquals(2f, c.at(1, 0));
    }
}
