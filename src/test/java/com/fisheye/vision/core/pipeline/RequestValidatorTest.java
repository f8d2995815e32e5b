package com.fisheye.vision.core.pipeline;

import com.fisheye.vision.core.projection.ViewDirection;
import com.fisheye.vision.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private static final String INPUT = "local://inputs/session1/frame.jpg";
    private static final Supplier<String> DEFAULT_PROMPT = () -> "default prompt";

    private final RequestValidator validator = new RequestValidator(PipelineSettings.defaults());

    private static ProcessingRequest.ProcessingRequestBuilder request() {
        return ProcessingRequest.builder().inputReference(INPUT);
    }

    @Test
    @DisplayName("No stage requested is rejected")
    void noStage() {
        assertThrows(ValidationException.class, () -> validator.validate(request().build(), DEFAULT_PROMPT));
    }

    @Test
    void rotateWithoutAngle() {
        assertThrows(ValidationException.class,
                () -> validator.validate(request().rotate(true).build(), DEFAULT_PROMPT));
    }

    @Test
    void rotateWithUnsupportedAngle() {
        assertThrows(ValidationException.class,
                () -> validator.validate(request().rotate(true).rotationAngle(45).build(), DEFAULT_PROMPT));
    }

    @Test
    void unknownView() {
        ProcessingRequest r = request().analyze(true).viewsToAnalyze(Arrays.asList("N", "X")).build();
        ValidationException e = assertThrows(ValidationException.class, () -> validator.validate(r, DEFAULT_PROMPT));
        assertTrue(e.getMessage().contains("X"));
    }

    @Test
    void lowercaseViewIsUnknown() {
        ProcessingRequest r = request().analyze(true).viewsToAnalyze(List.of("n")).build();
        assertThrows(ValidationException.class, () -> validator.validate(r, DEFAULT_PROMPT));
    }

    @Test
    void blankInput() {
        ProcessingRequest r = ProcessingRequest.builder().inputReference(" ").unwarp(true).build();
        assertThrows(ValidationException.class, () -> validator.validate(r, DEFAULT_PROMPT));
    }

    @Test
    void malformedInput() {
        ProcessingRequest r = ProcessingRequest.builder().inputReference("frame.jpg").unwarp(true).build();
        assertThrows(ValidationException.class, () -> validator.validate(r, DEFAULT_PROMPT));
    }

    @Test
    void analyzeDefaultsToNorthAndDefaultPrompt() {
        ProcessingPlan plan = validator.validate(request().analyze(true).build(), DEFAULT_PROMPT);
        assertEquals(List.of(ViewDirection.NORTH), plan.getAnalyzeViews());
        assertEquals("default prompt", plan.getPrompt());
        assertEquals("gpt-4o", plan.getModel());
        assertTrue(plan.getUnwarpViews().isEmpty());
        assertEquals(90, plan.getFov());
        assertEquals(45, plan.getViewAngle());
    }

    @Test
    void defaultPromptIsNotLoadedWhenPromptGiven() {
        ProcessingRequest r = request().analyze(true).prompt("count people").build();
        ProcessingPlan plan = validator.validate(r, () -> {
            throw new AssertionError("default prompt should not be loaded");
        });
        assertEquals("count people", plan.getPrompt());
    }

    @Test
    void unwarpCoversConfiguredAndAnalyzedViews() {
        PipelineSettings settings = PipelineSettings.builder()
                .unwarpViews(List.of(ViewDirection.NORTH, ViewDirection.BELOW))
                .build();
        ProcessingRequest r = request().unwarp(true).analyze(true)
                .viewsToAnalyze(Arrays.asList("E", "N", "E")).build();
        ProcessingPlan plan = new RequestValidator(settings).validate(r, DEFAULT_PROMPT);
        assertEquals(List.of(ViewDirection.NORTH, ViewDirection.BELOW, ViewDirection.EAST), plan.getUnwarpViews());
        assertEquals(List.of(ViewDirection.EAST, ViewDirection.NORTH), plan.getAnalyzeViews());
    }

    @Test
    void rotateOnlyPlan() {
        ProcessingPlan plan = validator.validate(request().rotate(true).rotationAngle(270).build(), DEFAULT_PROMPT);
        assertTrue(plan.has(PipelineStage.ROTATE));
        assertFalse(plan.has(PipelineStage.ANALYZE));
        assertEquals(270, plan.getRotationAngle());
        assertNull(plan.getPrompt());
    }

    @Test
    void outOfRangeGeometry() {
        assertThrows(ValidationException.class,
                () -> validator.validate(request().unwarp(true).fov(180).build(), DEFAULT_PROMPT));
        assertThrows(ValidationException.class,
                () -> validator.validate(request().unwarp(true).viewAngle(-1).build(), DEFAULT_PROMPT));
    }

    @Test
    void invalidOutputLocation() {
        assertThrows(ValidationException.class,
                () -> validator.validate(request().unwarp(true).outputLocation("outputs").build(), DEFAULT_PROMPT));
    }
}
