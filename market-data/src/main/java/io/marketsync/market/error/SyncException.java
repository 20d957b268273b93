package io.marketsync.market.error;

import java.util.Objects;

/**
 * Base of every failure that is reported against a single ticker.
 */
public class SyncException extends Exception {
    private final FailureKind kind;

    public SyncException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SyncException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() { return kind; }
}
