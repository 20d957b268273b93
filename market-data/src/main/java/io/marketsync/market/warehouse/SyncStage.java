package io.marketsync.market.warehouse;

/** Steps of one staged upsert, in order. */
public enum SyncStage {
    CONNECT,
    SCHEMA_CHECK,
    STAGE_CREATE,
    STAGE_WRITE,
    STAGE_VERIFY,
    UPSERT,
    CLEANUP,
    DONE
}
