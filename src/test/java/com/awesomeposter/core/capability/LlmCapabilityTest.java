package com.awesomeposter.core.capability;

import com.awesomeposter.core.hitl.HitlKind;
import com.awesomeposter.core.hitl.HitlPayload;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.llm.LlmParseException;
import com.awesomeposter.core.llm.LlmService;
import com.awesomeposter.core.model.RunMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmCapabilityTest {

    private final LlmService llmService = mock(LlmService.class);

    private final CapabilityRegistration registration = new CapabilityRegistration("generation", "Content generator",
            Set.of("writerBrief"), Set.of("drafts"), List.of(), List.of());

    private final LlmCapability capability = new LlmCapability(registration, "You write posts.", llmService, null);

    private static CapabilityContext context(List<HitlResponse> responses) {
        return new CapabilityContext("RUN-2026-0001", "generation_1", "Announce the spring sale", RunMode.APP,
                Map.of("writerBrief", Map.of("angle", "discount")), responses, "Keep it short");
    }

    @Test
    @DisplayName("maps the model reply to facets, HITL request and metrics")
    void mapsReply() {
        HitlPayload question = new HitlPayload("Which tone?", HitlKind.QUESTION, List.of(), true, null, null);
        when(llmService.structuredCallWithTools(eq("You write posts."), anyString(), eq(LlmCapability.Output.class), anyList()))
                .thenReturn(new LlmCapability.Output(Map.of("drafts", List.of("Hello")), question, Map.of("readability", 0.8)));

        CapabilityResult result = capability.invoke(context(List.of()));

        assertEquals(List.of("Hello"), result.outputs().get("drafts"));
        assertEquals(question, result.hitlRequest());
        assertEquals(0.8, result.metrics().get("readability"));
    }

    @Test
    @DisplayName("an unusable reply becomes a CapabilityException")
    void unusableReply() {
        when(llmService.structuredCallWithTools(anyString(), anyString(), eq(LlmCapability.Output.class), anyList()))
                .thenThrow(new LlmParseException(LlmCapability.Output.class, "bad json", null));

        var e = assertThrows(CapabilityException.class, () -> capability.invoke(context(List.of())));
        assertTrue(e.getMessage().startsWith("generation returned an unusable reply"));
    }

    @Test
    @DisplayName("the user prompt carries objective, note, inputs, answers and allowed outputs")
    void userPrompt() {
        String prompt = capability.buildUserPrompt(context(List.of(HitlResponse.option("req-1", "casual"))));

        assertTrue(prompt.contains("Objective: Announce the spring sale"));
        assertTrue(prompt.contains("Mode: app"));
        assertTrue(prompt.contains("Planner note: Keep it short"));
        assertTrue(prompt.contains("\"angle\" : \"discount\""));
        assertTrue(prompt.contains("- option option=casual"));
        assertTrue(prompt.contains("Return only these output facets: [drafts]"));
    }
}
