package org.relay.config;

import java.util.Objects;

/**
 * Raised when configuration cannot be loaded.
 */
public final class ConfigException extends RuntimeException {
    private final ConfigError error;

    public ConfigException(ConfigError error) {
        super(Objects.requireNonNull(error, "error").message(),
              error instanceof ConfigError.ParseFailed parseFailed ? parseFailed.cause() : null);
        this.error = error;
    }

    public ConfigError error() {
        return error;
    }
}
