package com.dealbot.core.scheduler;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads the last recorded completion of a job from shared state. Empty on a fresh deployment.
 */
@FunctionalInterface
public interface LastRunAccessor {

    Optional<Instant> lastRunAt() throws Exception;
}
