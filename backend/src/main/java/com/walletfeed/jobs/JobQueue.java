package com.walletfeed.jobs;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Background job queue with delayed delivery and a registry of named
 * pending jobs.
 * <p>
 * A registry key marks a job as scheduled until {@link #release(String)} is
 * called; {@link #scheduleIfAbsent} is the only way to set it and is atomic
 * across concurrent callers.
 */
public interface JobQueue {

    /**
     * Delivers the message to the consumer as soon as possible.
     */
    void enqueue(JobMessage message);

    /**
     * Delivers the message no earlier than {@code runAt}.
     */
    void schedule(JobMessage message, OffsetDateTime runAt);

    /**
     * Registers {@code registryKey} and schedules the message, unless the key
     * is already registered.
     *
     * @return {@code true} when this call registered the key and scheduled the job
     */
    boolean scheduleIfAbsent(String registryKey, JobMessage message, OffsetDateTime runAt);

    boolean isScheduled(String registryKey);

    /**
     * Run time recorded when the key was registered.
     */
    Optional<OffsetDateTime> scheduledAt(String registryKey);

    /**
     * Clears the registry entry. Already scheduled deliveries are unaffected.
     */
    void release(String registryKey);

    void setConsumer(JobConsumer consumer);

    /**
     * Backend currently in use, for health reporting.
     */
    String mode();
}
