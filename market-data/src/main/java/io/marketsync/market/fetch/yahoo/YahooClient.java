package io.marketsync.market.fetch.yahoo;

import java.util.Map;

/**
 * Raw access to the Yahoo Finance endpoints. Implementations return the response body as-is;
 * parsing lives in {@link YahooMarketDataProvider} so it can be tested with canned payloads.
 */
public interface YahooClient {

    /** v8 chart endpoint; {@code query} carries interval plus either {@code range} or {@code period1/period2}. */
    String chart(String ticker, Map<String, String> query) throws Exception;

    /** v1 search endpoint restricted to news. */
    String news(String ticker, int count) throws Exception;
}
