package com.trueform.common.config;

import lombok.Getter;

import java.util.List;

/**
 * Raised when required settings are missing or malformed.
 */
@Getter
public class SettingsException extends Exception {

    /** One human-readable problem per entry. */
    private final List<String> problems;

    public SettingsException(List<String> problems) {
        super(String.join("\n", problems));
        this.problems = List.copyOf(problems);
    }
}
