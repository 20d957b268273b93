package io.marketsync.market.error;

import io.marketsync.market.warehouse.SyncStage;

public class RemoteWriteVerificationException extends RemoteSyncException {
    private final int expectedRows;

    public RemoteWriteVerificationException(String stagingTable, int expectedRows) {
        super(FailureKind.REMOTE_WRITE_VERIFICATION, SyncStage.STAGE_VERIFY,
                "staging table " + stagingTable + " is empty after writing " + expectedRows + " rows", null);
        this.expectedRows = expectedRows;
    }

    public int expectedRows() { return expectedRows; }
}
