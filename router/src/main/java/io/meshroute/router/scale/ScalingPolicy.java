package io.meshroute.router.scale;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Thresholds and pacing of the auto-scaler.
 */
@Value
@Builder(toBuilder = true)
public class ScalingPolicy {
    @Builder.Default
    int minInstances = 1;
    @Builder.Default
    int maxInstances = 10;

    /**
     * Estimated CPU percentage above which the fleet scales out.
     */
    @Builder.Default
    double cpuScaleUpThreshold = 70.0;

    /**
     * Estimated CPU percentage below which the fleet may scale in.
     */
    @Builder.Default
    double cpuScaleDownThreshold = 30.0;

    /**
     * Average response time in seconds; half of it is the scale-in ceiling.
     */
    @Builder.Default
    double responseTimeThreshold = 2.0;

    /**
     * Error rate (0..1); half of it is the scale-in ceiling.
     */
    @Builder.Default
    double errorRateThreshold = 0.05;

    @Builder.Default
    Duration scaleUpCooldown = Duration.ofSeconds(180);
    @Builder.Default
    Duration scaleDownCooldown = Duration.ofSeconds(300);
    @Builder.Default
    Duration drainTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration drainPollInterval = Duration.ofSeconds(1);
    @Builder.Default
    Duration evaluationInterval = Duration.ofSeconds(60);

    public static final ScalingPolicy DEFAULTS = ScalingPolicy.builder().build();

    /**
     * @throws IllegalArgumentException when bounds or thresholds are inconsistent
     */
    public ScalingPolicy validate() {
        Preconditions.checkArgument(minInstances >= 0, "minInstances must not be negative, got %s", minInstances);
        Preconditions.checkArgument(minInstances <= maxInstances,
                "minInstances (%s) must not exceed maxInstances (%s)", minInstances, maxInstances);
        Preconditions.checkArgument(cpuScaleDownThreshold < cpuScaleUpThreshold,
                "cpuScaleDownThreshold must be below cpuScaleUpThreshold");
        Preconditions.checkArgument(responseTimeThreshold > 0, "responseTimeThreshold must be positive");
        Preconditions.checkArgument(errorRateThreshold > 0 && errorRateThreshold <= 1,
                "errorRateThreshold must be in (0, 1]");
        Preconditions.checkArgument(!drainPollInterval.isZero() && !drainPollInterval.isNegative(),
                "drainPollInterval must be positive");
        return this;
    }
}
