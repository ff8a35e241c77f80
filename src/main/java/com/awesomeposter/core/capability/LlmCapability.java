package com.awesomeposter.core.capability;

import com.awesomeposter.core.hitl.HitlPayload;
import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.llm.LlmEmptyResponseException;
import com.awesomeposter.core.llm.LlmParseException;
import com.awesomeposter.core.llm.LlmService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.Map;

/**
 * A capability whose behaviour is a system prompt sent to the model runtime.
 */
public class LlmCapability implements Capability {

    /** Shape the model is asked to reply in. */
    public record Output(
        Map<String, Object> facets,
        HitlPayload hitlRequest,
        Map<String, Double> metrics
    ) {}

    private final CapabilityRegistration registration;
    private final String systemPrompt;
    private final LlmService llmService;
    private final List<ToolCallback> tools;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public LlmCapability(CapabilityRegistration registration, String systemPrompt,
                         LlmService llmService, List<ToolCallback> tools) {
        this.registration = registration;
        this.systemPrompt = systemPrompt;
        this.llmService = llmService;
        this.tools = tools != null ? List.copyOf(tools) : List.of();
    }

    @Override
    public CapabilityRegistration registration() {
        return registration;
    }

    @Override
    public CapabilityResult invoke(CapabilityContext context) {
        Output output;
        try {
            output = llmService.structuredCallWithTools(systemPrompt, buildUserPrompt(context), Output.class, tools);
        } catch (LlmParseException | LlmEmptyResponseException e) {
            throw new CapabilityException(registration.id() + " returned an unusable reply: " + e.getMessage(), e);
        }
        if (output == null) {
            throw new CapabilityException(registration.id() + " returned no output");
        }
        return new CapabilityResult(output.facets(), output.hitlRequest(), output.metrics());
    }

    String buildUserPrompt(CapabilityContext context) {
        var sb = new StringBuilder();
        sb.append("Objective: ").append(context.objective()).append("\n");
        sb.append("Mode: ").append(context.mode().wireName()).append("\n");
        if (context.note() != null && !context.note().isBlank()) {
            sb.append("Planner note: ").append(context.note()).append("\n");
        }
        sb.append("\nInput facets:\n").append(toJson(context.inputs())).append("\n");
        if (!context.hitlResponses().isEmpty()) {
            sb.append("\nAnswers from the human operator:\n");
            for (HitlResponse response : context.hitlResponses()) {
                sb.append("- ").append(response.responseType().wireName());
                if (response.selectedOptionId() != null) {
                    sb.append(" option=").append(response.selectedOptionId());
                }
                if (response.freeformText() != null) {
                    sb.append(" text=").append(response.freeformText());
                }
                sb.append("\n");
            }
        }
        sb.append("\nReturn only these output facets: ").append(registration.outputFacets()).append("\n");
        sb.append("Set hitlRequest only if you cannot continue without a human answer.");
        return sb.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CapabilityException(registration.id() + " inputs are not serializable", e);
        }
    }
}
