package com.adlanda.resumetailor.health;

import com.adlanda.resumetailor.exception.ErrorCode;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the tailoring pipeline.
 *
 * Reports the outcome of the last tailoring run. The service goes down only
 * when the AI backend itself was unavailable; rejected requests (bad status,
 * nothing to select) and malformed model output are reported but stay up.
 */
@Component
public class TailoringHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(0, 0, null, null)
    );

    public void recordSuccess() {
        state.updateAndGet(s -> new HealthState(s.succeeded() + 1, s.failed(), null, Instant.now()));
    }

    public void recordFailure(ErrorCode code) {
        state.updateAndGet(s -> new HealthState(s.succeeded(), s.failed() + 1, code, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        Health.Builder builder = current.lastError() == ErrorCode.AI_SERVICE_UNAVAILABLE
                ? Health.down()
                : Health.up();

        builder.withDetail("lastRun", current.timestamp() != null ? current.timestamp().toString() : "never")
               .withDetail("succeeded", current.succeeded())
               .withDetail("failed", current.failed());

        if (current.lastError() != null) {
            builder.withDetail("lastError", current.lastError().name());
        }
        return builder.build();
    }

    private record HealthState(
            long succeeded,
            long failed,
            ErrorCode lastError,
            Instant timestamp
    ) {}
}
