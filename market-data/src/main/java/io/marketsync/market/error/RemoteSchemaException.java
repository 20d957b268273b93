package io.marketsync.market.error;

import io.marketsync.market.warehouse.SyncStage;

public class RemoteSchemaException extends RemoteSyncException {
    public RemoteSchemaException(String message) {
        super(FailureKind.REMOTE_SCHEMA, SyncStage.SCHEMA_CHECK, message, null);
    }
}
