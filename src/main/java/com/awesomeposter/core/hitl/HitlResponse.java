package com.awesomeposter.core.hitl;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A human's answer to a {@link HitlRequest}. When {@code responseType} is omitted it is
 * inferred from the other fields.
 */
public record HitlResponse(
    String id,
    String requestId,
    HitlResponseType responseType,
    String selectedOptionId,
    String freeformText,
    Boolean approved,
    String responderId,
    String responderDisplayName,
    Map<String, Object> metadata,
    Instant createdAt
) implements Serializable {

    public HitlResponse {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        metadata = metadata != null ? metadata : Map.of();
        responseType = responseType != null ? responseType : infer(selectedOptionId, freeformText, approved);
    }

    public static HitlResponse approve(String requestId) {
        return new HitlResponse(null, requestId, HitlResponseType.APPROVAL, null, null, true, null, null, null, null);
    }

    public static HitlResponse reject(String requestId, String reason) {
        return new HitlResponse(null, requestId, HitlResponseType.REJECTION, null, reason, false, null, null, null, null);
    }

    public static HitlResponse option(String requestId, String optionId) {
        return new HitlResponse(null, requestId, HitlResponseType.OPTION, optionId, null, null, null, null, null, null);
    }

    /** A rejection, or an approval response that says no. */
    @JsonIgnore
    public boolean isDenial() {
        return responseType == HitlResponseType.REJECTION || Boolean.FALSE.equals(approved);
    }

    @JsonIgnore
    public Optional<HitlDecision> decision() {
        return Optional.ofNullable(HitlDecision.fromAction(metadata.get("action")));
    }

    HitlResponse stamped(String newId, Instant at) {
        return new HitlResponse(id != null ? id : newId, requestId, responseType, selectedOptionId, freeformText,
                approved, responderId, responderDisplayName, metadata, createdAt != null ? createdAt : at);
    }

    private static HitlResponseType infer(String selectedOptionId, String freeformText, Boolean approved) {
        if (approved != null) {
            return approved ? HitlResponseType.APPROVAL : HitlResponseType.REJECTION;
        }
        if (selectedOptionId != null && !selectedOptionId.isBlank()) {
            return HitlResponseType.OPTION;
        }
        return HitlResponseType.FREEFORM;
    }
}
