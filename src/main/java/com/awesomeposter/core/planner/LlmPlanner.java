package com.awesomeposter.core.planner;

import com.awesomeposter.core.capability.CapabilityRegistration;
import com.awesomeposter.core.llm.LlmEmptyResponseException;
import com.awesomeposter.core.llm.LlmParseException;
import com.awesomeposter.core.llm.LlmService;
import com.awesomeposter.core.model.PlanDelta;
import com.awesomeposter.core.model.PlanStep;
import com.awesomeposter.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Planner backed by the model runtime.
 * <p>
 * If the reply cannot be parsed, a fresh plan gets the fallback sequence and an existing
 * plan is left unchanged.
 */
@Component
public class LlmPlanner implements Planner {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanner.class);

    private static final String SYSTEM_PROMPT = """
            You are the planner of a content generation workflow. You decide which capabilities run
            and in which order to reach the objective.

            Reply with a plan delta:
            - stepsAdd: new steps, each with an id, a capabilityId from the catalogue (or action "finalize"),
              a short label and an optional note for the capability.
            - stepsUpdate: changes to existing steps (id plus note). Never move a step backward.
            - note: one sentence on why.

            Add a finalize step once the outputs satisfy the objective. Return empty lists when the
            current plan already covers the objective.
            """;

    private final LlmService llmService;
    private final PlanDeltaNormalizer normalizer;

    public LlmPlanner(LlmService llmService, PlanDeltaNormalizer normalizer) {
        this.llmService = llmService;
        this.normalizer = normalizer;
    }

    @Override
    public PlanDelta propose(PlannerContext context) {
        Set<String> capabilityIds = context.capabilities().stream()
                .map(CapabilityRegistration::id)
                .collect(Collectors.toSet());
        try {
            PlannerOutput output = llmService.structuredCall(SYSTEM_PROMPT, buildUserPrompt(context), PlannerOutput.class);
            return normalizer.normalize(output, context.plan(), capabilityIds);
        } catch (LlmParseException | LlmEmptyResponseException e) {
            if (context.plan().isEmpty()) {
                log.warn("Planner reply unusable ({}); seeding fallback plan", e.getMessage());
                return normalizer.fallback(capabilityIds);
            }
            log.warn("Planner reply unusable ({}); keeping plan v{}", e.getMessage(), context.plan().version());
            return PlanDelta.empty();
        }
    }

    String buildUserPrompt(PlannerContext context) {
        var sb = new StringBuilder();
        sb.append("Objective: ").append(context.objective()).append("\n");
        sb.append("Mode: ").append(context.mode().wireName()).append("\n\n");

        sb.append("Capability catalogue:\n");
        for (CapabilityRegistration cap : context.capabilities()) {
            sb.append("- ").append(cap.id()).append(" (").append(cap.name()).append(")")
              .append(" reads ").append(cap.inputFacets())
              .append(" writes ").append(cap.outputFacets()).append("\n");
        }

        sb.append("\nCurrent plan (v").append(context.plan().version()).append("):\n");
        if (context.plan().isEmpty()) {
            sb.append("(empty)\n");
        }
        for (PlanStep step : context.plan().steps()) {
            sb.append("- ").append(step.id()).append(" [").append(step.target()).append("] ")
              .append(step.status().wireName());
            if (step.note() != null) {
                sb.append(": ").append(step.note());
            }
            sb.append("\n");
        }

        sb.append("\nAvailable facets: ").append(context.facets().keySet()).append("\n");
        if (!context.history().isEmpty()) {
            sb.append("\nRecent results:\n");
            context.history().stream()
                    .skip(Math.max(0, context.history().size() - 5))
                    .forEach(r -> sb.append("- ").append(r.stepId()).append(" ")
                            .append(r.status().wireName())
                            .append(r.error() != null ? " (" + r.error() + ")" : "")
                            .append("\n"));
        }
        if (context.replanRationale() != null) {
            sb.append("\nReplan requested: ").append(context.replanRationale()).append("\n");
        }
        return sb.toString();
    }
}
