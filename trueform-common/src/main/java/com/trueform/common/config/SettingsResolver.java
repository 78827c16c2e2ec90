package com.trueform.common.config;

import com.trueform.common.infra.EnvUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Merges explicitly configured values with {@code TRUENAS_*} environment
 * variables. Explicit values win; the environment fills the gaps.
 *
 * <pre>
 * TrueNasSettings settings = new SettingsResolver()
 *         .host(null)                // falls back to TRUENAS_HOST
 *         .verifySsl(false)
 *         .resolve();
 * </pre>
 */
@Slf4j
public class SettingsResolver {

    public static final String ENV_HOST = "TRUENAS_HOST";
    public static final String ENV_API_KEY = "TRUENAS_API_KEY";
    public static final String ENV_VERIFY_SSL = "TRUENAS_VERIFY_SSL";
    public static final String ENV_TIMEOUT = "TRUENAS_TIMEOUT";

    private final Function<String, String> env;

    private String host;
    private String apiKey;
    private Boolean verifySsl;
    private Duration timeout;
    private Duration jobPollInterval;

    public SettingsResolver() {
        this(EnvUtils.SYSTEM_ENV);
    }

    /**
     * @param env variable lookup; tests pass a map-backed function
     */
    public SettingsResolver(Function<String, String> env) {
        this.env = env;
    }

    public SettingsResolver host(String host) {
        this.host = host;
        return this;
    }

    public SettingsResolver apiKey(String apiKey) {
        this.apiKey = apiKey;
        return this;
    }

    public SettingsResolver verifySsl(Boolean verifySsl) {
        this.verifySsl = verifySsl;
        return this;
    }

    public SettingsResolver timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public SettingsResolver jobPollInterval(Duration jobPollInterval) {
        this.jobPollInterval = jobPollInterval;
        return this;
    }

    /**
     * Resolve the final settings.
     *
     * @throws SettingsException listing every missing or malformed value
     */
    public TrueNasSettings resolve() throws SettingsException {
        List<String> problems = new ArrayList<>();

        String resolvedHost = firstNonBlank(host, ENV_HOST, false);
        String resolvedKey = firstNonBlank(apiKey, ENV_API_KEY, true);

        if (resolvedHost == null) {
            problems.add("Missing TrueNAS host: set the host value in the configuration or use the "
                    + ENV_HOST + " environment variable.");
        }
        if (resolvedKey == null) {
            problems.add("Missing TrueNAS API key: set the api_key value in the configuration or use the "
                    + ENV_API_KEY + " environment variable.");
        }

        boolean resolvedVerify = true;
        if (verifySsl != null) {
            resolvedVerify = verifySsl;
        } else {
            String raw = EnvUtils.read(env, ENV_VERIFY_SSL);
            if (Boolean.FALSE.equals(EnvUtils.parseBoolean(raw))) {
                resolvedVerify = false;
                EnvUtils.logAcceptedEnvOption(ENV_VERIFY_SSL, raw, "certificate verification", false);
            }
        }

        Duration resolvedTimeout = timeout;
        if (resolvedTimeout == null) {
            String raw = EnvUtils.read(env, ENV_TIMEOUT);
            if (raw != null) {
                try {
                    long seconds = Long.parseLong(raw);
                    if (seconds <= 0) {
                        problems.add(ENV_TIMEOUT + " must be a positive number of seconds, got: " + raw);
                    } else {
                        resolvedTimeout = Duration.ofSeconds(seconds);
                        EnvUtils.logAcceptedEnvOption(ENV_TIMEOUT, raw, "call timeout in seconds", false);
                    }
                } catch (NumberFormatException e) {
                    problems.add(ENV_TIMEOUT + " must be a whole number of seconds, got: " + raw);
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new SettingsException(problems);
        }

        TrueNasSettings settings = TrueNasSettings.builder()
                .host(resolvedHost)
                .apiKey(resolvedKey)
                .verifySsl(resolvedVerify)
                .timeout(resolvedTimeout != null ? resolvedTimeout : TrueNasSettings.DEFAULT_TIMEOUT)
                .jobPollInterval(jobPollInterval != null ? jobPollInterval
                        : TrueNasSettings.DEFAULT_JOB_POLL_INTERVAL)
                .build();
        log.debug("Resolved TrueNAS settings: {}", settings);
        return settings;
    }

    private String firstNonBlank(String explicit, String envKey, boolean secret) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        String fromEnv = EnvUtils.read(env, envKey);
        EnvUtils.logAcceptedEnvOption(envKey, fromEnv, secret ? "API key" : "target host", secret);
        return fromEnv;
    }
}
