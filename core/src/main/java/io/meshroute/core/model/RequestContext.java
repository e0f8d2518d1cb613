package io.meshroute.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-supplied attributes of an inbound request. Every field is optional.
 */
@Value
@Builder(toBuilder = true)
public class RequestContext {
    public static final RequestContext EMPTY = RequestContext.builder().build();

    String userId;
    String sessionId;
    String ip;
    String apiKey;

    /**
     * Key used for session affinity: userId, then sessionId, then {@code "default"}.
     */
    public String routingKey() {
        if (userId != null && !userId.isEmpty()) {
            return userId;
        }
        if (sessionId != null && !sessionId.isEmpty()) {
            return sessionId;
        }
        return "default";
    }
}
