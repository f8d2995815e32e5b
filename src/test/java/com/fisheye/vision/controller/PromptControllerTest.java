package com.fisheye.vision.controller;

import com.fisheye.vision.exception.ArtifactNotFoundException;
import com.fisheye.vision.exception.ValidationException;
import com.fisheye.vision.service.PromptLibraryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PromptControllerTest {

    @Mock
    private PromptLibraryService promptLibrary;

    @InjectMocks
    private PromptController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static Map<String, Object> entry(String name, int latest) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", name);
        entry.put("latest_version", latest);
        return entry;
    }

    @Test
    void listsNames() throws Exception {
        when(promptLibrary.getPromptNames()).thenReturn(List.of(entry("default", 2)));

        mockMvc.perform(get("/api/prompts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prompts[0].name").value("default"))
                .andExpect(jsonPath("$.prompts[0].latest_version").value(2));
    }

    @Test
    void getsSpecificVersion() throws Exception {
        when(promptLibrary.getPrompt("default", 1)).thenReturn("Describe the scene.");

        mockMvc.perform(get("/api/prompts/default/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.content").value("Describe the scene."));
    }

    @Test
    void unknownPromptIsNotFound() throws Exception {
        when(promptLibrary.getPrompt(eq("ghost"), isNull())).thenThrow(new ArtifactNotFoundException("prompt ghost"));

        mockMvc.perform(get("/api/prompts/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void newPromptIsCreated() throws Exception {
        Map<String, Object> saved = new LinkedHashMap<>();
        saved.put("action", "created");
        saved.put("name", "night");
        saved.put("version", 0);
        when(promptLibrary.save("night", "Dark scenes.")).thenReturn(saved);

        mockMvc.perform(post("/api/prompts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"night\",\"content\":\"Dark scenes.\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.action").value("created"))
                .andExpect(jsonPath("$.version").value(0));
    }

    @Test
    void pushedPromptIsOk() throws Exception {
        Map<String, Object> saved = new LinkedHashMap<>();
        saved.put("action", "pushed");
        saved.put("version", 3);
        when(promptLibrary.save("default", "v3")).thenReturn(saved);

        mockMvc.perform(post("/api/prompts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"default\",\"content\":\"v3\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("pushed"));
    }

    @Test
    void invalidNameIsBadRequest() throws Exception {
        when(promptLibrary.save("bad-name", "x")).thenThrow(new ValidationException("Invalid prompt name: bad-name"));

        mockMvc.perform(post("/api/prompts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"bad-name\",\"content\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("validation_error"));
    }
}
