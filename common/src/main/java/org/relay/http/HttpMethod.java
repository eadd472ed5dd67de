package org.relay.http;

/**
 * HTTP request methods.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS,
    TRACE,
    CONNECT;

    /**
     * Parse HTTP method from string.
     *
     * @throws IllegalArgumentException if the method is not one of the known methods
     */
    public static HttpMethod from(String method) {
        return switch (method.toUpperCase()) {
            case "GET" -> GET;
            case "POST" -> POST;
            case "PUT" -> PUT;
            case "DELETE" -> DELETE;
            case "PATCH" -> PATCH;
            case "HEAD" -> HEAD;
            case "OPTIONS" -> OPTIONS;
            case "TRACE" -> TRACE;
            case "CONNECT" -> CONNECT;
            default -> throw new IllegalArgumentException("Unknown HTTP method: " + method);
        };
    }
}
