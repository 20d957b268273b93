package io.marketsync.market.error;

/**
 * A provider call failed in a way that may succeed on a later attempt (network, throttling, bad status).
 */
public class TransientFetchException extends SyncException {
    public TransientFetchException(String message) {
        super(FailureKind.TRANSIENT_FETCH, message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(FailureKind.TRANSIENT_FETCH, message, cause);
    }
}
