package com.fisheye.vision.core.projection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ViewSpecTest {

    @Test
    void valueEquality() {
        assertEquals(new ViewSpec(ViewDirection.NORTH, 90, 45, 1080, 810),
                new ViewSpec(ViewDirection.NORTH, 90, 45, 1080, 810));
        assertNotEquals(new ViewSpec(ViewDirection.NORTH, 90, 45, 1080, 810),
                new ViewSpec(ViewDirection.NORTH, 90, 30, 1080, 810));
    }

    @Test
    void belowTiltIsNormalized() {
        assertEquals(new ViewSpec(ViewDirection.BELOW, 90, 10, 100, 100),
                new ViewSpec(ViewDirection.BELOW, 90, 60, 100, 100));
    }

    @Test
    void rejectsInvalidFieldOfView() {
        assertThrows(IllegalArgumentException.class, () -> new ViewSpec(ViewDirection.EAST, 0, 45, 10, 10));
        assertThrows(IllegalArgumentException.class, () -> new ViewSpec(ViewDirection.EAST, 180, 45, 10, 10));
    }

    @Test
    void directionCodesAreCaseSensitive() {
        assertEquals(ViewDirection.WEST, ViewDirection.fromCode("W"));
        assertFalse(ViewDirection.isValidCode("w"));
        assertThrows(IllegalArgumentException.class, () -> ViewDirection.fromCode("X"));
    }
}
