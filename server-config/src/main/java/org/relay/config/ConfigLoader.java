package org.relay.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.relay.http.server.HttpServerConfig;
import org.relay.net.SocketOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads HTTP server configuration from TOML.
 *
 * <pre>{@code
 * [server]
 * port = 3000
 * max_content_length = 1048576
 *
 * [server.socket]
 * backlog = 128
 * keepalive = true
 * }</pre>
 *
 * <p>Configuration resolution order (highest priority first):
 * <ol>
 *   <li>Explicit overrides, keyed by dotted name such as {@code server.port}</li>
 *   <li>Values from TOML</li>
 *   <li>Defaults of {@link HttpServerConfig#defaultConfig()}</li>
 * </ol>
 * Loaded configuration is validated with {@link ConfigValidator}.
 */
public final class ConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    public static final String PORT = "server.port";
    public static final String MAX_CONTENT_LENGTH = "server.max_content_length";
    public static final String BACKLOG = "server.socket.backlog";
    public static final String KEEPALIVE = "server.socket.keepalive";

    private ConfigLoader() {}

    /**
     * Load configuration from file path.
     *
     * @throws ConfigException if the file cannot be read, parsed or validated
     */
    public static HttpServerConfig load(Path path) {
        return loadWithOverrides(path, Map.of());
    }

    /**
     * Load configuration from TOML string content.
     *
     * @throws ConfigException if the content cannot be parsed or validated
     */
    public static HttpServerConfig loadFromString(String content) {
        return fromDocument(parse(content, "string"), Map.of());
    }

    /**
     * Load configuration from file path, letting the given overrides win over file values.
     *
     * @throws ConfigException if the file cannot be read, parsed or validated
     */
    public static HttpServerConfig loadWithOverrides(Path path, Map<String, String> overrides) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ConfigException(new ConfigError.ParseFailed(path.toString(), e));
        }
        return fromDocument(parse(content, path.toString()), overrides);
    }

    private static JsonNode parse(String content, String source) {
        try {
            return MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ConfigException(new ConfigError.ParseFailed(source, e));
        }
    }

    private static HttpServerConfig fromDocument(JsonNode document, Map<String, String> overrides) {
        var server = document.path("server");
        var socket = server.path("socket");
        var defaults = HttpServerConfig.defaultConfig();

        var port = intValue(server.path("port"), PORT, defaults.port());
        var maxContentLength = intValue(server.path("max_content_length"), MAX_CONTENT_LENGTH,
                                        defaults.maxContentLength());
        var backlog = intValue(socket.path("backlog"), BACKLOG, defaults.socketOptions().soBacklog());
        var keepalive = booleanValue(socket.path("keepalive"), KEEPALIVE, defaults.socketOptions().soKeepalive());

        // Overrides (highest priority)
        if (overrides.containsKey(PORT)) {
            port = parseInt(PORT, overrides.get(PORT));
        }
        if (overrides.containsKey(MAX_CONTENT_LENGTH)) {
            maxContentLength = parseInt(MAX_CONTENT_LENGTH, overrides.get(MAX_CONTENT_LENGTH));
        }
        if (overrides.containsKey(BACKLOG)) {
            backlog = parseInt(BACKLOG, overrides.get(BACKLOG));
        }
        if (overrides.containsKey(KEEPALIVE)) {
            keepalive = parseBoolean(KEEPALIVE, overrides.get(KEEPALIVE));
        }

        var config = ConfigValidator.validate(
                new HttpServerConfig(port, maxContentLength, SocketOptions.socketOptions(backlog, keepalive)));

        LOG.debug("Loaded server configuration: port {}, max content length {}, backlog {}, keepalive {}",
                  config.port(), config.maxContentLength(), backlog, keepalive);
        return config;
    }

    private static int intValue(JsonNode node, String key, int defaultValue) {
        if (node.isMissingNode()) {
            return defaultValue;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw invalid(key, node.asText(), "expected an integer");
        }
        return node.intValue();
    }

    private static boolean booleanValue(JsonNode node, String key, boolean defaultValue) {
        if (node.isMissingNode()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw invalid(key, node.asText(), "expected true or false");
        }
        return node.booleanValue();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw invalid(key, value, "expected an integer");
        }
    }

    private static boolean parseBoolean(String key, String value) {
        return switch (value.trim().toLowerCase()) {
            case "true" -> true;
            case "false" -> false;
            default -> throw invalid(key, value, "expected true or false");
        };
    }

    private static ConfigException invalid(String key, String value, String reason) {
        return new ConfigException(new ConfigError.InvalidValue(key, value, reason));
    }
}
