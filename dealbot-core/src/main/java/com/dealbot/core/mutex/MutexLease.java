package com.dealbot.core.mutex;

import com.dealbot.common.constants.JobType;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof of holding the job mutex for one provider. The {@code jobId} is what release and renew
 * compare against, so a lease reclaimed by another replica cannot be released by this one.
 */
public record MutexLease(JobType jobType, String spAddress, UUID jobId, String hostname, Instant acquiredAt) {
}
