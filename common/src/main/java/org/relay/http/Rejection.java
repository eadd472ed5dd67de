package org.relay.http;

/**
 * Failure of an {@link Extractor}, renderable as the response sent back to the client.
 * <p>
 * Rejections are expected outcomes rather than faults, so no stack trace is captured.
 */
public abstract class Rejection extends Exception implements IntoResponse {
    protected Rejection(String message) {
        super(message, null, false, false);
    }
}
