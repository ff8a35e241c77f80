package com.awesomeposter.dispatch.api;

import com.awesomeposter.core.hitl.HitlResponse;

import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/v1/runs/stream.
 */
public record RunStreamRequest(
    String objective,
    String mode,
    String threadId,
    Map<String, Object> facets,
    List<Map<String, Object>> policies,
    List<HitlResponse> hitlResponses,
    String manualTrigger
) {}
