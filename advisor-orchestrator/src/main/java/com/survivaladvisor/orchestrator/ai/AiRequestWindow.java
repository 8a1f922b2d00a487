package com.survivaladvisor.orchestrator.ai;

import java.time.Duration;
import java.time.Instant;

/**
 * Cooldown policy for one AI call, supplied by the caller. The engine keeps no limiter
 * state of its own: whoever owns the user's request history passes the last request time in.
 *
 * @param lastRequestAt when the caller last reached the AI collaborator, null if never
 * @param cooldown      minimum gap between two calls; zero disables the check
 */
public record AiRequestWindow(Instant lastRequestAt, Duration cooldown) {

    public AiRequestWindow {
        cooldown = (cooldown == null || cooldown.isNegative()) ? Duration.ZERO : cooldown;
    }

    public static AiRequestWindow unrestricted() {
        return new AiRequestWindow(null, Duration.ZERO);
    }

    public boolean isOpen(Instant now) {
        return remaining(now).isZero();
    }

    /** Time left until the next call is allowed, never negative. */
    public Duration remaining(Instant now) {
        if (lastRequestAt == null || cooldown.isZero()) {
            return Duration.ZERO;
        }
        Duration left = Duration.between(now, lastRequestAt.plus(cooldown));
        return left.isNegative() ? Duration.ZERO : left;
    }
}
