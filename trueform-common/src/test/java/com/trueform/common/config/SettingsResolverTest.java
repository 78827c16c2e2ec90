package com.trueform.common.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsResolverTest {

    private static SettingsResolver resolver(Map<String, String> env) {
        return new SettingsResolver(env::get);
    }

    @Test
    void explicitValues_winOverEnvironment() throws Exception {
        Map<String, String> env = Map.of(
                "TRUENAS_HOST", "env.local",
                "TRUENAS_API_KEY", "env-key",
                "TRUENAS_VERIFY_SSL", "false");

        TrueNasSettings settings = resolver(env)
                .host("nas.example.com")
                .apiKey("1-explicit")
                .verifySsl(true)
                .resolve();

        assertEquals("nas.example.com", settings.getHost());
        assertEquals("1-explicit", settings.getApiKey());
        assertTrue(settings.isVerifySsl());
    }

    @Test
    void environment_fillsMissingValues() throws Exception {
        Map<String, String> env = Map.of(
                "TRUENAS_HOST", " 192.168.1.100 ",
                "TRUENAS_API_KEY", "1-abc",
                "TRUENAS_VERIFY_SSL", "false",
                "TRUENAS_TIMEOUT", "30");

        TrueNasSettings settings = resolver(env).resolve();

        assertEquals("192.168.1.100", settings.getHost());
        assertEquals("1-abc", settings.getApiKey());
        assertFalse(settings.isVerifySsl());
        assertEquals(Duration.ofSeconds(30), settings.getTimeout());
    }

    @Test
    void verifySsl_defaultsToTrue_forUnrecognisedValues() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("TRUENAS_HOST", "nas");
        env.put("TRUENAS_API_KEY", "1-abc");
        env.put("TRUENAS_VERIFY_SSL", "maybe");

        assertTrue(resolver(env).resolve().isVerifySsl());
    }

    @Test
    void defaults_applied() throws Exception {
        TrueNasSettings settings = resolver(Map.of()).host("nas").apiKey("k").resolve();

        assertEquals(TrueNasSettings.DEFAULT_TIMEOUT, settings.getTimeout());
        assertEquals(TrueNasSettings.DEFAULT_JOB_POLL_INTERVAL, settings.getJobPollInterval());
        assertTrue(settings.isVerifySsl());
    }

    @Test
    void missingHostAndKey_reportsBoth() {
        SettingsException e = assertThrows(SettingsException.class, () -> resolver(Map.of()).resolve());

        assertEquals(2, e.getProblems().size());
        assertTrue(e.getMessage().contains("TRUENAS_HOST"));
        assertTrue(e.getMessage().contains("TRUENAS_API_KEY"));
    }

    @Test
    void malformedTimeout_isReported() {
        Map<String, String> env = Map.of("TRUENAS_TIMEOUT", "soon");

        SettingsException e = assertThrows(SettingsException.class,
                () -> resolver(env).host("nas").apiKey("k").resolve());

        assertEquals(1, e.getProblems().size());
        assertTrue(e.getMessage().contains("soon"));
    }

    @Test
    void toString_neverPrintsApiKey() throws Exception {
        TrueNasSettings settings = resolver(Map.of()).host("nas").apiKey("1-supersecret").resolve();

        assertFalse(settings.toString().contains("supersecret"));
        assertTrue(settings.toString().contains("nas"));
    }

    @Test
    void effectiveTimeout_fallsBackForNonPositive() {
        TrueNasSettings settings = TrueNasSettings.builder().host("nas").timeout(Duration.ZERO).build();

        assertEquals(TrueNasSettings.DEFAULT_TIMEOUT, settings.effectiveTimeout());
    }
}
