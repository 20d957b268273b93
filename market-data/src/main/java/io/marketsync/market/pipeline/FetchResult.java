package io.marketsync.market.pipeline;

import io.marketsync.core.Outcome;

import java.util.List;

/**
 * @param plan    human-readable description of what was requested
 * @param outcome provider result after retries
 */
public record FetchResult<R>(String plan, Outcome<List<R>> outcome) {

    public List<R> records() {
        return outcome.isSuccess() ? outcome.value() : List.of();
    }
}
