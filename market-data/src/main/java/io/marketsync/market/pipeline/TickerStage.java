package io.marketsync.market.pipeline;

/**
 * Progress of one (ticker, kind) run. Remote stages are skipped when remote sync is off.
 */
public enum TickerStage {
    PENDING,
    FETCHING,
    MERGING,
    LOCAL_SAVED,
    STAGING,
    UPSERTING,
    REMOTE_SYNCED,
    DONE,
    FAILED
}
