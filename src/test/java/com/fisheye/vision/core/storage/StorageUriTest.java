package com.fisheye.vision.core.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StorageUriTest {

    @Test
    void parsesObjectUri() {
        StorageUri uri = StorageUri.parse("local://inputs/session1/frame.jpg");
        assertEquals("local", uri.getScheme());
        assertEquals("inputs", uri.getBucket());
        assertEquals("session1/frame.jpg", uri.getKey());
        assertEquals("local://inputs/session1/frame.jpg", uri.toString());
    }

    @Test
    void prefixMayHaveEmptyKey() {
        StorageUri prefix = StorageUri.parsePrefix("local://outputs/");
        assertEquals("", prefix.getKey());
        assertEquals("local://outputs/frame_N.jpg", prefix.resolve("frame_N.jpg").toString());
    }

    @Test
    void resolveAddsSeparator() {
        assertEquals("local://outputs/run1/frame_N.jpg",
                StorageUri.parsePrefix("local://outputs/run1").resolve("frame_N.jpg").toString());
        assertEquals("local://outputs/run1/frame_N.jpg",
                StorageUri.parsePrefix("local://outputs/run1/").resolve("/frame_N.jpg").toString());
    }

    @Test
    void objectUriRequiresKey() {
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("local://inputs"));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("local://inputs/dir/"));
    }

    @Test
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("inputs/frame.jpg"));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("local:///frame.jpg"));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parsePrefix(null));
    }

    @Test
    void equality() {
        assertEquals(StorageUri.parse("local://a/b.jpg"), new StorageUri("local", "a", "b.jpg"));
    }
}
