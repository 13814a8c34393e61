package com.streamfirst.migration.boot;

import com.streamfirst.migration.domain.BackoffPolicy;
import com.streamfirst.migration.domain.ControllerSettings;
import com.streamfirst.migration.domain.MigrationError;
import com.streamfirst.migration.domain.MigrationId;
import com.streamfirst.migration.domain.MigrationRequest;
import com.streamfirst.migration.domain.Result;
import com.streamfirst.migration.domain.TargetPair;
import com.streamfirst.migration.domain.ThresholdConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binding for everything under {@code migration.*}. Values are plain and unvalidated here;
 * {@link #toRequest()} converts them into the validated domain records.
 *
 * <pre>
 * migration:
 *   id: orders-db-cutover
 *   old-target: blue
 *   new-target: green
 *   thresholds:
 *     max-lag-millis: 5000
 *     max-error-rate-percent: 1.0
 *     min-healthy-fraction: 0.8
 *     required-good-polls: 3
 *     poll-interval: 30s
 *   controller:
 *     step-size: 10
 *     rollback-backoff:
 *       max-retries: 3
 *       base-delay: 1s
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "migration")
public class MigrationProperties {

    /** Identifier of the run; state and audit records are keyed by it */
    private String id;

    private String oldTarget = "blue";

    private String newTarget = "green";

    /** Names of the routing mechanisms traffic is shifted on */
    private List<String> routingMechanisms = new ArrayList<>(List.of("alb", "dns"));

    /** How long shutdown waits for an in-flight rollback */
    private Duration shutdownTimeout = Duration.ofSeconds(60);

    private Thresholds thresholds = new Thresholds();

    private Controller controller = new Controller();

    private Store store = new Store();

    private Audit audit = new Audit();

    @Data
    public static class Thresholds {
        private long maxLagMillis = ThresholdConfig.DEFAULT.maxLagMillis();
        private double maxErrorRatePercent = ThresholdConfig.DEFAULT.maxErrorRatePercent();
        private double minHealthyFraction = ThresholdConfig.DEFAULT.minHealthyFraction();
        private int requiredGoodPolls = ThresholdConfig.DEFAULT.requiredGoodPollsToAdvance();
        private Duration pollInterval = ThresholdConfig.DEFAULT.pollInterval();
    }

    @Data
    public static class Controller {
        private int stepSize = ControllerSettings.DEFAULT.stepSize();
        private Duration metricsTimeout = ControllerSettings.DEFAULT.metricsTimeout();
        private Duration routingTimeout = ControllerSettings.DEFAULT.routingTimeout();
        private int casRetryLimit = ControllerSettings.DEFAULT.casRetryLimit();
        private Backoff rollbackBackoff = new Backoff();
    }

    @Data
    public static class Backoff {
        private int maxRetries = BackoffPolicy.DEFAULT.maxRetries();
        private Duration baseDelay = BackoffPolicy.DEFAULT.baseDelay();
        private double multiplier = BackoffPolicy.DEFAULT.multiplier();
        private Duration maxDelay = BackoffPolicy.DEFAULT.maxDelay();
    }

    @Data
    public static class Store {
        /** {@code memory} or {@code jdbc} */
        private String type = "memory";
        private String url;
        private String username;
        private String password;
        private int maxPoolSize = 4;
    }

    @Data
    public static class Audit {
        /** {@code memory} or {@code jsonl} */
        private String type = "memory";
        private Path file = Path.of("migration-audit.jsonl");
    }

    /**
     * Converts the bound values into a validated request.
     *
     * @return the request, or an INVALID_CONFIGURATION failure naming the first bad value
     */
    public Result<MigrationRequest> toRequest() {
        if (id == null || id.isBlank()) {
            return invalid("migration.id must be set");
        }
        if (oldTarget == null || newTarget == null || oldTarget.equals(newTarget)) {
            return invalid("migration.old-target and migration.new-target must be set and differ, got "
                           + oldTarget + "/" + newTarget);
        }
        if (routingMechanisms == null || routingMechanisms.isEmpty()) {
            return invalid("migration.routing-mechanisms must name at least one mechanism");
        }
        Result<BackoffPolicy> backoff = toBackoff(controller.getRollbackBackoff());
        if (backoff.isFailure()) {
            return Result.failure(backoff.getError().orElseThrow());
        }

        return ThresholdConfig.of(thresholds.getMaxLagMillis(), thresholds.getMaxErrorRatePercent(),
                        thresholds.getMinHealthyFraction(), thresholds.getRequiredGoodPolls(),
                        thresholds.getPollInterval())
                .flatMap(thresholdConfig -> ControllerSettings.of(controller.getStepSize(),
                                controller.getMetricsTimeout(), controller.getRoutingTimeout(),
                                controller.getCasRetryLimit(), backoff.orElseThrow())
                        .map(settings -> new MigrationRequest(new MigrationId(id),
                                new TargetPair(oldTarget, newTarget), thresholdConfig, settings)));
    }

    private static Result<BackoffPolicy> toBackoff(Backoff backoff) {
        if (backoff.getBaseDelay() == null || backoff.getMaxDelay() == null) {
            return invalid("migration.controller.rollback-backoff delays must be set");
        }
        try {
            return Result.success(new BackoffPolicy(backoff.getMaxRetries(), backoff.getBaseDelay(),
                    backoff.getMultiplier(), backoff.getMaxDelay()));
        } catch (IllegalArgumentException e) {
            return invalid("migration.controller.rollback-backoff: " + e.getMessage());
        }
    }

    private static <T> Result<T> invalid(String message) {
        return Result.failure(MigrationError.invalidConfiguration(message));
    }
}
