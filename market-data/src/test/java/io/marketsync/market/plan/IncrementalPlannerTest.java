package io.marketsync.market.plan;

import io.marketsync.market.model.FetchInterval;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IncrementalPlannerTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 10);
    private static final LocalDate CUTOFF = LocalDate.of(2000, 1, 1);

    private final IncrementalPlanner planner = new IncrementalPlanner(
            Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC), CUTOFF, FetchInterval.DAILY);

    private static SyncState<LocalDate> stored(LocalDate min, LocalDate max) {
        return new SyncState<>(100, min, max);
    }

    @Test
    void noLocalDataFetchesFullHistory() {
        assertEquals(FetchPlan.Type.FETCH_FULL, planner.plan(SyncState.empty(), false).type());
    }

    @Test
    void forceAlwaysFetchesFullHistory() {
        FetchPlan plan = planner.plan(stored(LocalDate.of(1990, 1, 2), TODAY.minusDays(1)), true);
        assertEquals(FetchPlan.Type.FETCH_FULL, plan.type());
    }

    @Test
    void historyStartingAfterCutoffIsRefetched() {
        FetchPlan plan = planner.plan(stored(LocalDate.of(2010, 6, 29), LocalDate.of(2024, 6, 1)), false);
        assertEquals(FetchPlan.Type.FETCH_FULL, plan.type());
    }

    @Test
    void historyStartingExactlyOnCutoffIsRefetched() {
        assertEquals(FetchPlan.Type.FETCH_FULL, planner.plan(stored(CUTOFF, LocalDate.of(2024, 6, 1)), false).type());
    }

    @Test
    void historyStartingBeforeCutoffIsExtendedIncrementally() {
        FetchPlan plan = planner.plan(stored(CUTOFF.minusDays(1), LocalDate.of(2024, 6, 5)), false);
        assertEquals(FetchPlan.Type.FETCH_RANGE, plan.type());
        assertEquals(LocalDate.of(2024, 6, 6), plan.start());
        assertEquals(TODAY, plan.end());
    }

    @Test
    void upToDateWhenNextBarWouldBeToday() {
        FetchPlan plan = planner.plan(stored(LocalDate.of(1980, 12, 12), TODAY.minusDays(1)), false);
        assertEquals(FetchPlan.Type.SKIP, plan.type());
    }

    @Test
    void weeklyIntervalStepsAWeek() {
        IncrementalPlanner weekly = new IncrementalPlanner(
                Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC), CUTOFF, FetchInterval.WEEKLY);
        assertEquals(FetchPlan.Type.SKIP, weekly.plan(stored(LocalDate.of(1990, 1, 1), TODAY.minusDays(3)), false).type());
        FetchPlan plan = weekly.plan(stored(LocalDate.of(1990, 1, 1), TODAY.minusDays(10)), false);
        assertEquals(FetchPlan.Type.FETCH_RANGE, plan.type());
        assertEquals(TODAY.minusDays(3), plan.start());
    }
}
