package org.relay.config;

import org.relay.http.server.HttpServerConfig;

import java.util.ArrayList;

/**
 * Validates HTTP server configuration.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Port must be between 0 and 65535 (0 selects an ephemeral port)</li>
 *   <li>Maximum content length must be positive</li>
 *   <li>Socket backlog must be positive</li>
 * </ul>
 */
public final class ConfigValidator {
    private static final int MAX_PORT = 65535;

    private ConfigValidator() {}

    /**
     * Validate configuration, reporting all violations at once.
     *
     * @throws ConfigException with {@link ConfigError.ValidationFailed} if any rule is violated
     */
    public static HttpServerConfig validate(HttpServerConfig config) {
        var errors = new ArrayList<String>();

        if (config.port() < 0 || config.port() > MAX_PORT) {
            errors.add("Port must be between 0 and " + MAX_PORT + ". Got: " + config.port());
        }
        if (config.maxContentLength() <= 0) {
            errors.add("Maximum content length must be positive. Got: " + config.maxContentLength());
        }
        if (config.socketOptions().soBacklog() <= 0) {
            errors.add("Socket backlog must be positive. Got: " + config.socketOptions().soBacklog());
        }

        if (errors.isEmpty()) {
            return config;
        }
        throw new ConfigException(new ConfigError.ValidationFailed(errors));
    }
}
