package io.hearthwarrio.veilguard.core.host;

/**
 * Thrown by host adapters when an element can no longer be read or written
 * (detached, stale, or otherwise inaccessible).
 */
public class HostAccessException extends RuntimeException {
    public HostAccessException(String message) {
        super(message);
    }

    public HostAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
