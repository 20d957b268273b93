package io.marketsync.market.pipeline;

import io.marketsync.market.error.FailureKind;
import io.marketsync.market.model.DataKind;

/**
 * Outcome of one (ticker, kind) run.
 *
 * @param stage           last stage reached; for failures the stage that was running
 * @param plan            what was asked of the provider
 * @param remoteRowsAdded null when remote sync did not run
 */
public record TickerResult(String ticker,
                           DataKind kind,
                           Status status,
                           TickerStage stage,
                           String plan,
                           int fetched,
                           int total,
                           int added,
                           int duplicatesRemoved,
                           Long remoteRowsAdded,
                           FailureKind failureKind,
                           String error) {

    public enum Status { SUCCEEDED, NO_NEW_DATA, FAILED }

    public static TickerResult failed(String ticker, DataKind kind, TickerStage stage, String plan,
                                      FailureKind failureKind, String error) {
        return new TickerResult(ticker, kind, Status.FAILED, stage, plan, 0, 0, 0, 0, null, failureKind, error);
    }

    public boolean isFailed() { return status == Status.FAILED; }

    public String summaryLine() {
        StringBuilder sb = new StringBuilder()
                .append(ticker).append(" [").append(kind.dirName()).append("] ").append(status);
        if (status == Status.FAILED) {
            return sb.append(" at ").append(stage).append(" (").append(failureKind).append("): ").append(error).toString();
        }
        sb.append(": plan=").append(plan)
                .append(", fetched=").append(fetched)
                .append(", added=").append(added)
                .append(", duplicates=").append(duplicatesRemoved)
                .append(", total=").append(total);
        if (remoteRowsAdded != null) sb.append(", remoteAdded=").append(remoteRowsAdded);
        return sb.toString();
    }
}
