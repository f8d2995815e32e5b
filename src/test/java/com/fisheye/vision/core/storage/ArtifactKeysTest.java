package com.fisheye.vision.core.storage;

import com.fisheye.vision.core.projection.ViewDirection;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactKeysTest {

    @Test
    void viewKeyInsertsCodeBeforeExtension() {
        assertEquals("session1/frame_N.jpg", ArtifactKeys.viewKey("session1/frame.jpg", ViewDirection.NORTH));
        assertEquals("session1/frame_B.jpg", ArtifactKeys.viewKey("session1/frame.jpg", ViewDirection.BELOW));
    }

    @Test
    void rotatedKey() {
        assertEquals("path/img_rotated.jpg", ArtifactKeys.rotatedKey("path/img.jpg"));
    }

    @Test
    void manifestKeyUsesUtcTimestamp() {
        Instant at = Instant.parse("2026-01-27T14:30:52Z");
        assertEquals("session1/frame_results_20260127_143052.json",
                ArtifactKeys.manifestKey("session1/frame.jpg", at));
    }

    @Test
    void keyWithoutExtensionGetsSuffixAppended() {
        assertEquals("session1/frame_rotated", ArtifactKeys.rotatedKey("session1/frame"));
        assertEquals("session1/frame_results_20260127_143052.json",
                ArtifactKeys.manifestKey("session1/frame", Instant.parse("2026-01-27T14:30:52Z")));
    }

    @Test
    void dotsInDirectoriesAreNotExtensions() {
        assertEquals("v1.2/frame_E", ArtifactKeys.viewKey("v1.2/frame", ViewDirection.EAST));
        assertEquals("a/b.c/img_W.png", ArtifactKeys.viewKey("a/b.c/img.png", ViewDirection.WEST));
    }

    @Test
    void onlyLastExtensionIsReplaced() {
        assertEquals("frame.tar_S.gz", ArtifactKeys.viewKey("frame.tar.gz", ViewDirection.SOUTH));
    }
}
