package io.marketsync.market.plan;

import io.marketsync.market.model.FetchInterval;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Decides between skipping, an incremental window and a full-history fetch for a price series.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>forced refresh: full</li>
 *   <li>nothing stored: full</li>
 *   <li>stored history starts on or after the backfill cutoff: full, since it may be missing older bars</li>
 *   <li>next bar after the latest stored one falls on or after today: skip</li>
 *   <li>otherwise: window from that next bar up to today (exclusive)</li>
 * </ol>
 * Rule 3 means a series that really does begin after the cutoff (a recent listing) is fetched in full
 * every run; lower the cutoff to avoid that.
 */
public class IncrementalPlanner {
    private final Clock clock;
    private final LocalDate backfillCutoff;
    private final FetchInterval interval;

    public IncrementalPlanner(Clock clock, LocalDate backfillCutoff, FetchInterval interval) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.backfillCutoff = Objects.requireNonNull(backfillCutoff, "backfillCutoff");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    public FetchPlan plan(SyncState<LocalDate> state, boolean forceFull) {
        if (forceFull) return FetchPlan.full("forced refresh");
        if (state == null || state.isEmpty()) return FetchPlan.full("no local data");
        if (!state.earliest().isBefore(backfillCutoff)) {
            return FetchPlan.full("history starts " + state.earliest() + ", not before cutoff " + backfillCutoff);
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate start = interval.next(state.latest());
        if (!start.isBefore(today)) {
            return FetchPlan.skip("up to date through " + state.latest());
        }
        return FetchPlan.range(start, today);
    }

    public FetchInterval interval() { return interval; }
}
