package io.marketsync.market.error;

/**
 * Why a ticker failed. Reported per ticker; never aborts other tickers.
 */
public enum FailureKind {
    /** Provider kept failing and the ticker had nothing stored locally to fall back on. */
    TRANSIENT_FETCH,
    LOCAL_READ,
    LOCAL_WRITE,
    /** Remote table is incompatible and holds data, so it is left alone. */
    REMOTE_SCHEMA,
    /** Staging table was empty after the write; nothing was merged. */
    REMOTE_WRITE_VERIFICATION,
    REMOTE_IO,
    UNEXPECTED
}
