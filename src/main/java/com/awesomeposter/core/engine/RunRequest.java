package com.awesomeposter.core.engine;

import com.awesomeposter.core.hitl.HitlResponse;
import com.awesomeposter.core.model.RunMode;

import java.util.List;
import java.util.Map;

/**
 * A request to run (or resume) an objective.
 *
 * @param objective     what to produce
 * @param mode          app or chat, defaults to app
 * @param threadId      resume key; a stored snapshot under this id is continued
 * @param facets        seed facet values, merged over any stored ones
 * @param policies      runtime policies in raw form; when empty the stored or default policies apply
 * @param hitlResponses answers to pending HITL requests, applied before the loop resumes
 * @param manualTrigger when set, a manual lifecycle event for this step id (blank for run level)
 *                      is evaluated before the loop starts
 */
public record RunRequest(
    String objective,
    RunMode mode,
    String threadId,
    Map<String, Object> facets,
    List<Map<String, Object>> policies,
    List<HitlResponse> hitlResponses,
    String manualTrigger
) {
    public RunRequest {
        mode = mode != null ? mode : RunMode.APP;
        facets = facets != null ? facets : Map.of();
        policies = policies != null ? policies : List.of();
        hitlResponses = hitlResponses != null ? hitlResponses : List.of();
    }

    public static RunRequest of(String objective) {
        return new RunRequest(objective, RunMode.APP, null, null, null, null, null);
    }

    public static RunRequest onThread(String objective, String threadId) {
        return new RunRequest(objective, RunMode.APP, threadId, null, null, null, null);
    }

    public boolean hasThread() {
        return threadId != null && !threadId.isBlank();
    }
}
