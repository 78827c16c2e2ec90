package com.trueform.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks API keys and other secrets in text before it reaches a log line.
 */
public final class LogRedact {

    private LogRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    /**
     * A pattern and the capture group that holds the secret. Group 0 masks
     * the whole match.
     */
    private record Rule(Pattern pattern, int secretGroup) {

        static Rule of(String regex, int secretGroup) {
            return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), secretGroup);
        }
    }

    private static final Pattern PEM_BLOCK = Pattern.compile(
            "(-----BEGIN [A-Z ]*PRIVATE KEY-----)[\\s\\S]+?(-----END [A-Z ]*PRIVATE KEY-----)");

    private static final List<Rule> RULES = List.of(
            // TRUENAS_API_KEY=..., DB_PASSWORD: "..."
            Rule.of("\\b[A-Z0-9_]*(?:KEY|TOKEN|SECRET|PASSWORD|PASSWD)\\b\\s*[=:]\\s*[\"']?([^\\s\"'\\\\,}\\]]+)", 1),
            Rule.of("\"(?:api_key|apiKey|key|token|secret|password|passwd|privatekey)\"\\s*:\\s*\"([^\"]+)\"", 1),
            Rule.of("\\bBearer\\s+([A-Za-z0-9._\\-+=]+)", 1),
            // TrueNAS API keys: <key id>-<secret>
            Rule.of("\\b\\d{1,6}-[A-Za-z0-9]{32,}\\b", 0));

    /**
     * Redact every known secret shape in {@code text}.
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = PEM_BLOCK.matcher(text).replaceAll(pem ->
                Matcher.quoteReplacement(pem.group(1) + "\n…redacted…\n" + pem.group(2)));
        for (Rule rule : RULES) {
            result = apply(rule, result);
        }
        return result;
    }

    /**
     * Loggable form of an outbound JSON-RPC frame. Frames of {@code auth.*}
     * methods are reduced to the method name.
     */
    public static String redactFrame(String method, String frame) {
        if (method != null && method.startsWith("auth.")) {
            return method + " <params hidden>";
        }
        return redactSensitiveText(frame);
    }

    /**
     * Keep the first six and last four characters of a long token; short
     * tokens are hidden entirely.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    private static String apply(Rule rule, String text) {
        Matcher matcher = rule.pattern().matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        int copied = 0;
        int group = rule.secretGroup();
        while (matcher.find()) {
            out.append(text, copied, matcher.start(group)).append(maskToken(matcher.group(group)));
            copied = matcher.end(group);
        }
        if (copied == 0) {
            return text;
        }
        return out.append(text, copied, text.length()).toString();
    }
}
