package com.trueform.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Environment variable helpers: lookup with trimming, boolean parsing and
 * one-line logging of accepted values.
 */
public final class EnvUtils {

    private EnvUtils() {
    }

    private static final Logger log = LoggerFactory.getLogger(EnvUtils.class);
    private static final Map<String, Boolean> BOOLEAN_SPELLINGS = Map.of(
            "1", true, "true", true, "yes", true, "on", true,
            "0", false, "false", false, "no", false, "off", false);

    private static final int MAX_LOGGED_VALUE = 160;

    /** Lookup backed by the process environment. */
    public static final Function<String, String> SYSTEM_ENV = System::getenv;

    /**
     * Read a variable through {@code env}, trimmed; blank values count as unset.
     *
     * @return the trimmed value, or {@code null}
     */
    public static String read(Function<String, String> env, String key) {
        if (env == null) {
            return null;
        }
        String value = env.apply(key);
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }

    /**
     * Log an accepted environment variable.
     *
     * @param key         env variable name
     * @param value       the value that was accepted
     * @param description what it controls
     * @param redact      whether to hide the value
     */
    public static void logAcceptedEnvOption(String key, String value, String description, boolean redact) {
        if (value == null || value.isBlank()) {
            return;
        }
        String displayValue = redact ? "<redacted>" : formatValue(value);
        log.debug("env: {}={} ({})", key, displayValue, description);
    }

    private static String formatValue(String value) {
        String flat = value.strip().replaceAll("\\s+", " ");
        return flat.length() > MAX_LOGGED_VALUE ? flat.substring(0, MAX_LOGGED_VALUE) + "…" : flat;
    }

    /**
     * Whether {@code value} spells "on": {@code 1}, {@code true}, {@code yes} or {@code on}.
     */
    public static boolean isTruthy(String value) {
        return Boolean.TRUE.equals(parseBoolean(value));
    }

    /**
     * @return {@code TRUE} or {@code FALSE} for the recognised spellings,
     *         {@code null} for blank or anything else
     */
    public static Boolean parseBoolean(String value) {
        if (value == null) {
            return null;
        }
        return BOOLEAN_SPELLINGS.get(value.trim().toLowerCase(Locale.ROOT));
    }
}
