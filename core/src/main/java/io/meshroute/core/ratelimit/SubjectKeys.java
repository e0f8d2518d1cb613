package io.meshroute.core.ratelimit;

import io.meshroute.core.model.RequestContext;

/**
 * Builds the subject key a rule is counted against.
 * <p>
 * USER and API_KEY rules without the corresponding identity fall back to the caller
 * address, so anonymous traffic is still limited per client.
 * </p>
 */
public final class SubjectKeys {
    public static final String GLOBAL = "global";
    static final String UNKNOWN_IP = "unknown";

    private SubjectKeys() {
    }

    public static String forRule(RateLimitRule rule, RequestContext context) {
        switch (rule.getScope()) {
            case GLOBAL:
                return GLOBAL;
            case USER:
                return hasText(context.getUserId()) ? "user:" + context.getUserId() : ip(context);
            case API_KEY:
                return hasText(context.getApiKey()) ? "api_key:" + context.getApiKey() : ip(context);
            case IP:
                return ip(context);
            default:
                throw new IllegalArgumentException("Unknown scope " + rule.getScope());
        }
    }

    private static String ip(RequestContext context) {
        return "ip:" + (hasText(context.getIp()) ? context.getIp() : UNKNOWN_IP);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
