package com.fisheye.vision.service;

import com.fisheye.vision.config.YamlConfig;
import com.fisheye.vision.core.storage.LocalArtifactStorage;
import com.fisheye.vision.exception.ArtifactNotFoundException;
import com.fisheye.vision.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PromptLibraryServiceTest {

    @TempDir
    Path root;

    private PromptLibraryService library;

    @BeforeEach
    void setUp() {
        YamlConfig config = new YamlConfig();
        config.getPrompts().setLocation("local://config/");
        library = new PromptLibraryService(new LocalArtifactStorage(root, 1, 1), config);
    }

    @Test
    void bundledDefaultPromptIsAvailable() {
        String prompt = library.getDefaultPrompt();
        assertTrue(prompt.contains("number_of_people"));
    }

    @Test
    void pushingDefaultCreatesNextVersionInStorage() {
        Map<String, Object> result = library.save("default", "Count the people.");

        assertEquals("pushed", result.get("action"));
        assertEquals(1, result.get("version"));
        assertEquals(0, result.get("previous_version"));
        assertTrue(Files.exists(root.resolve("config/prompts/prompt_default_1.txt")));
        assertEquals("Count the people.", library.getDefaultPrompt());
        assertTrue(library.getPrompt("default", 0).contains("mood"));
    }

    @Test
    void newNameStartsAtVersionZero() {
        Map<String, Object> created = library.save("lobby_v2", "Describe the lobby.");
        assertEquals("created", created.get("action"));
        assertEquals(0, created.get("version"));
        assertEquals("local://config/prompts/prompt_lobby_v2_0.txt", created.get("uri"));

        Map<String, Object> pushed = library.save("lobby_v2", "Describe the lobby in detail.");
        assertEquals(1, pushed.get("version"));
        assertEquals("Describe the lobby.", library.getPrompt("lobby_v2", 0));
    }

    @Test
    void namesListLatestVersions() {
        library.save("default", "v1");
        library.save("night", "dark scenes");

        List<Map<String, Object>> names = library.getPromptNames();

        assertEquals(2, names.size());
        assertEquals("default", names.get(0).get("name"));
        assertEquals(1, names.get(0).get("latest_version"));
        assertEquals(2, names.get(0).get("version_count"));
        assertEquals("night", names.get(1).get("name"));
    }

    @Test
    void listAllMarksLatestAndSource() {
        library.save("night", "dark scenes");

        List<Map<String, Object>> all = library.listPrompts();

        assertTrue(all.stream().anyMatch(p -> "night".equals(p.get("name"))
                && "storage".equals(p.get("source")) && Boolean.TRUE.equals(p.get("latest"))));
        assertTrue(all.stream().anyMatch(p -> "default".equals(p.get("name"))
                && "bundled".equals(p.get("source"))));
    }

    @Test
    void bundledVersionsStayListedAfterPushingToStorage() {
        library.save("default", "Count the people.");

        List<Map<String, Object>> defaults = library.listPrompts().stream()
                .filter(p -> "default".equals(p.get("name")))
                .collect(Collectors.toList());

        assertEquals(2, defaults.size());
        assertEquals(0, defaults.get(0).get("version"));
        assertEquals("bundled", defaults.get(0).get("source"));
        assertEquals(Boolean.FALSE, defaults.get(0).get("latest"));
        assertEquals(1, defaults.get(1).get("version"));
        assertEquals("storage", defaults.get(1).get("source"));
        assertEquals(Boolean.TRUE, defaults.get(1).get("latest"));
    }

    @Test
    void invalidNamesAreRejected() {
        assertThrows(ValidationException.class, () -> library.save("1st", "x"));
        assertThrows(ValidationException.class, () -> library.save("with-dash", "x"));
        assertThrows(ValidationException.class, () -> library.save("ok", " "));
    }

    @Test
    void unknownPromptIsNotFound() {
        assertThrows(ArtifactNotFoundException.class, () -> library.getPrompt("missing", null));
        assertThrows(ArtifactNotFoundException.class, () -> library.getPrompt("default", 7));
    }
}
