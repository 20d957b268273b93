package io.marketsync.market.app;

import java.time.Instant;
import java.time.LocalDate;

/**
 * What is stored locally for one ticker.
 */
public record DataSummary(String ticker,
                          boolean hasPriceHistory,
                          int priceRecords,
                          LocalDate firstDate,
                          LocalDate lastDate,
                          boolean hasNews,
                          int newsRecords,
                          Instant latestNews) {

    public String render() {
        StringBuilder sb = new StringBuilder(ticker).append(':');
        if (hasPriceHistory) {
            sb.append(" price-history=").append(priceRecords).append(" bars (").append(firstDate).append("..").append(lastDate).append(')');
        } else {
            sb.append(" price-history=none");
        }
        if (hasNews) {
            sb.append(" news=").append(newsRecords).append(" items (latest ").append(latestNews).append(')');
        } else {
            sb.append(" news=none");
        }
        return sb.toString();
    }
}
