package org.relay.config;

import java.util.List;

/**
 * Error types for configuration loading.
 */
public sealed interface ConfigError {

    String message();

    /**
     * Configuration source could not be read or is not valid TOML.
     */
    record ParseFailed(String source, Throwable cause) implements ConfigError {
        @Override
        public String message() {
            return "Failed to parse configuration from " + source + ": " + cause.getMessage();
        }
    }

    /**
     * A value has the wrong type or format.
     */
    record InvalidValue(String key, String value, String reason) implements ConfigError {
        @Override
        public String message() {
            return "Invalid value `" + value + "` for " + key + ": " + reason;
        }
    }

    /**
     * Values are well-formed but violate validation rules.
     */
    record ValidationFailed(List<String> errors) implements ConfigError {
        public ValidationFailed {
            errors = List.copyOf(errors);
        }

        @Override
        public String message() {
            return "Configuration validation failed:\n- " + String.join("\n- ", errors);
        }
    }
}
