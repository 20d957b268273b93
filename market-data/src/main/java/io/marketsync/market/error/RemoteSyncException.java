package io.marketsync.market.error;

import io.marketsync.market.warehouse.SyncStage;

/**
 * Remote failure, tagged with the stage of the staged upsert that was running when it happened.
 */
public class RemoteSyncException extends SyncException {
    private final SyncStage stage;

    public RemoteSyncException(SyncStage stage, String message, Throwable cause) {
        this(FailureKind.REMOTE_IO, stage, message, cause);
    }

    protected RemoteSyncException(FailureKind kind, SyncStage stage, String message, Throwable cause) {
        super(kind, "[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public SyncStage stage() { return stage; }
}
