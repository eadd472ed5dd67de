package org.relay.http;

import io.netty.handler.codec.http.HttpVersion;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable parsed HTTP request.
 * <p>
 * Produced once per connection by the transport reader and owned by the worker serving that
 * connection.
 *
 * @param method  HTTP method
 * @param uri     request target as received (path and query, still percent-encoded)
 * @param path    request path (without query string, still percent-encoded)
 * @param query   raw query string (may be null)
 * @param version protocol version of the request line
 * @param headers request headers (lower-case keys)
 * @param body    request body bytes
 */
public record Request(
        HttpMethod method,
        String uri,
        String path,
        String query,
        HttpVersion version,
        Map<String, String> headers,
        byte[] body
) {
    private static final byte[] NO_BODY = new byte[0];

    public Request {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? NO_BODY : body;
    }

    /**
     * Create request for the given target, splitting off the query string.
     */
    public static Request request(HttpMethod method, String uri, HttpVersion version,
                                  Map<String, String> headers, byte[] body) {
        var queryIndex = uri.indexOf('?');

        String path;
        String query;
        if (queryIndex >= 0) {
            path = uri.substring(0, queryIndex);
            query = uri.substring(queryIndex + 1);
        } else {
            path = uri;
            query = null;
        }
        return new Request(method, uri, path, query, version, headers, body);
    }

    /**
     * Create body-less HTTP/1.1 request, mostly useful in tests and adapters.
     */
    public static Request request(HttpMethod method, String uri) {
        return request(method, uri, HttpVersion.HTTP_1_1, Map.of(), NO_BODY);
    }

    /**
     * Get header value by name (case-insensitive).
     */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name.toLowerCase()));
    }

    /**
     * Get query parameter value by name.
     */
    public Optional<String> queryParam(String name) {
        if (query == null || query.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(parseQueryParams().get(name));
    }

    /**
     * Get all query parameters as a map.
     */
    public Map<String, String> queryParams() {
        if (query == null || query.isEmpty()) {
            return Collections.emptyMap();
        }
        return parseQueryParams();
    }

    /**
     * Get request body as UTF-8 string.
     */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    private Map<String, String> parseQueryParams() {
        var params = new HashMap<String, String>();

        for (var pair : query.split("&")) {
            var idx = pair.indexOf('=');
            if (idx > 0) {
                var key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                var value = idx < pair.length() - 1
                            ? URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8)
                            : "";
                params.put(key, value);
            } else if (!pair.isEmpty()) {
                params.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            }
        }
        return params;
    }

    @Override
    public String toString() {
        return "Request[" + method + " " + uri + " " + version + "]";
    }
}
