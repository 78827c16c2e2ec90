package com.trueform.common.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Connection settings for one TrueNAS endpoint.
 * Produced by {@link SettingsResolver}; consumed by the client, which never
 * reads the environment itself.
 */
@Value
@Builder(toBuilder = true)
public class TrueNasSettings {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_JOB_POLL_INTERVAL = Duration.ofSeconds(2);

    /** Hostname or IP address, optionally with a port. */
    String host;

    /** API key created in the TrueNAS UI. */
    @ToString.Exclude
    String apiKey;

    /** Whether the server certificate is verified. */
    @Builder.Default
    boolean verifySsl = true;

    /** Dial, handshake, write and per-call timeout. */
    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    /** Interval between {@code core.get_jobs} polls. */
    @Builder.Default
    Duration jobPollInterval = DEFAULT_JOB_POLL_INTERVAL;

    /**
     * Timeout, falling back to the default for null or non-positive values.
     */
    public Duration effectiveTimeout() {
        return timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
    }

    /**
     * Poll interval, falling back to the default for null or non-positive values.
     */
    public Duration effectiveJobPollInterval() {
        return jobPollInterval == null || jobPollInterval.isZero() || jobPollInterval.isNegative()
                ? DEFAULT_JOB_POLL_INTERVAL
                : jobPollInterval;
    }
}
