package io.marketsync.market.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One news entry. Unique per (ticker, id), where id is issued by the provider.
 * Every field except ticker and id may be null when the provider omits it.
 */
public record NewsItem(String ticker,
                       String id,
                       String title,
                       String summary,
                       String description,
                       String publisher,
                       String link,
                       Instant publishTime,
                       Instant displayTime,
                       String contentType,
                       String thumbnailUrl,
                       boolean premium,
                       boolean hosted) {

    public NewsItem {
        Objects.requireNonNull(ticker, "ticker");
        Objects.requireNonNull(id, "id");
    }

    public Key key() { return new Key(ticker, id); }

    public record Key(String ticker, String id) {}
}
