package io.meshroute.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Outcome of one auto-scaler evaluation.
 */
@Value
@Builder(toBuilder = true)
@With
public class ScalingDirective {
    /**
     * Scaling action taken.
     */
    Action action;

    /**
     * Healthy instance count the fleet is moving to (if action is SCALE_OUT or SCALE_IN).
     */
    Integer targetReplicas;

    /**
     * Human-readable reason for this directive.
     */
    String reason;

    /**
     * Timestamp when this directive was computed.
     */
    long timestampMs;

    public static ScalingDirective none(String reason, long timestampMs) {
        return ScalingDirective.builder()
                .action(Action.NONE)
                .reason(reason)
                .timestampMs(timestampMs)
                .build();
    }

    public enum Action {
        /**
         * Fleet is within thresholds or a cooldown is active.
         */
        NONE,

        /**
         * One instance provisioned.
         */
        SCALE_OUT,

        /**
         * One instance drained and removed.
         */
        SCALE_IN
    }
}
