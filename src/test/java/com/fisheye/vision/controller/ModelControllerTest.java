package com.fisheye.vision.controller;

import com.fisheye.vision.config.YamlConfig;
import com.fisheye.vision.core.analysis.VisionModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ModelControllerTest {

    @Spy
    private YamlConfig yamlConfig = new YamlConfig();

    @InjectMocks
    private ModelController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void listsCatalogWithDefault() throws Exception {
        mockMvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.models", hasSize(VisionModel.values().length)))
                .andExpect(jsonPath("$.models[0].id").value("gpt-4o"))
                .andExpect(jsonPath("$.models[0].provider").value("openai"))
                .andExpect(jsonPath("$.default").value("gpt-4o"));
    }
}
