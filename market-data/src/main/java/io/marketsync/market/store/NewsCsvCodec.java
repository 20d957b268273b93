package io.marketsync.market.store;

import io.marketsync.market.model.NewsItem;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

public class NewsCsvCodec implements CsvCodec<NewsItem> {
    private static final List<String> HEADER = List.of("TICKER", "ID", "TITLE", "SUMMARY", "DESCRIPTION",
            "PUBLISHER", "LINK", "PUBLISH_TIME", "DISPLAY_TIME", "CONTENT_TYPE", "THUMBNAIL_URL",
            "IS_PREMIUM", "IS_HOSTED");

    @Override
    public List<String> header() { return HEADER; }

    @Override
    public List<String> encode(NewsItem n) {
        return Arrays.asList(n.ticker(), n.id(), n.title(), n.summary(), n.description(), n.publisher(), n.link(),
                time(n.publishTime()), time(n.displayTime()), n.contentType(), n.thumbnailUrl(),
                Boolean.toString(n.premium()), Boolean.toString(n.hosted()));
    }

    @Override
    public NewsItem decode(List<String> c) {
        return new NewsItem(c.get(0), c.get(1), text(c.get(2)), text(c.get(3)), text(c.get(4)), text(c.get(5)),
                text(c.get(6)), instant(c.get(7)), instant(c.get(8)), text(c.get(9)), text(c.get(10)),
                Boolean.parseBoolean(c.get(11)), Boolean.parseBoolean(c.get(12)));
    }

    private static String time(Instant t) { return t == null ? "" : t.toString(); }

    // an empty cell is written for null
    private static String text(String s) { return s.isEmpty() ? null : s; }

    private static Instant instant(String s) { return s.isEmpty() ? null : Instant.parse(s); }
}
