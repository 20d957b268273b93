package io.marketsync.market.fetch.yahoo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketsync.market.error.TransientFetchException;
import io.marketsync.market.fetch.MarketDataProvider;
import io.marketsync.market.fetch.SeriesRequest;
import io.marketsync.market.model.NewsItem;
import io.marketsync.market.model.PriceBar;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps Yahoo Finance chart and search payloads onto {@link PriceBar} and {@link NewsItem}.
 * Bar dates are taken in the exchange's own offset ({@code meta.gmtoffset}) so that a session is never
 * attributed to the neighbouring calendar day.
 */
public class YahooMarketDataProvider implements MarketDataProvider {
    private final YahooClient client;
    private final ObjectMapper mapper;

    public YahooMarketDataProvider(YahooClient client) {
        this(client, new ObjectMapper());
    }

    public YahooMarketDataProvider(YahooClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public List<PriceBar> fetchSeries(SeriesRequest request) throws TransientFetchException, InterruptedException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("interval", request.interval().code());
        if (request.isFullHistory()) {
            query.put("range", request.period());
        } else {
            query.put("period1", Long.toString(request.start().atStartOfDay().toEpochSecond(ZoneOffset.UTC)));
            query.put("period2", Long.toString(request.end().atStartOfDay().toEpochSecond(ZoneOffset.UTC)));
        }
        query.put("includeAdjustedClose", "true");
        query.put("events", "div,splits");

        String body = call("chart " + request, () -> client.chart(request.ticker(), query));
        List<PriceBar> bars = parseChart(request.ticker(), body);
        if (request.isFullHistory()) return bars;
        List<PriceBar> inWindow = new ArrayList<>(bars.size());
        for (PriceBar b : bars) {
            if (!b.date().isBefore(request.start()) && b.date().isBefore(request.end())) inWindow.add(b);
        }
        return inWindow;
    }

    @Override
    public List<NewsItem> fetchNews(String ticker, int maxItems) throws TransientFetchException, InterruptedException {
        if (maxItems <= 0) return List.of();
        String body = call("news " + ticker, () -> client.news(ticker, maxItems));
        List<NewsItem> items = parseNews(ticker, body);
        return items.size() > maxItems ? items.subList(0, maxItems) : items;
    }

    List<PriceBar> parseChart(String ticker, String body) throws TransientFetchException {
        JsonNode root = readTree(body);
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new TransientFetchException("Yahoo chart error for " + ticker + ": " + error.path("description").asText(error.toString()));
        }
        JsonNode result = chart.path("result").path(0);
        JsonNode timestamps = result.path("timestamp");
        if (!timestamps.isArray() || timestamps.isEmpty()) return List.of();

        ZoneOffset offset = ZoneOffset.ofTotalSeconds(result.path("meta").path("gmtoffset").asInt(0));
        JsonNode quote = result.path("indicators").path("quote").path(0);
        JsonNode adj = result.path("indicators").path("adjclose").path(0).path("adjclose");

        List<PriceBar> out = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            Double open = dbl(quote.path("open").path(i));
            Double high = dbl(quote.path("high").path(i));
            Double low = dbl(quote.path("low").path(i));
            Double close = dbl(quote.path("close").path(i));
            if (open == null && high == null && low == null && close == null) continue; // placeholder row
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong()).atOffset(offset).toLocalDate();
            JsonNode vol = quote.path("volume").path(i);
            out.add(new PriceBar(ticker, date, open, high, low, close, dbl(adj.path(i)),
                    vol.isNumber() ? vol.asLong() : null));
        }
        return out;
    }

    List<NewsItem> parseNews(String ticker, String body) throws TransientFetchException {
        JsonNode news = readTree(body).path("news");
        if (!news.isArray()) return List.of();
        List<NewsItem> out = new ArrayList<>(news.size());
        for (JsonNode n : news) {
            String id = n.path("uuid").asText("");
            if (id.isEmpty()) continue;
            JsonNode resolutions = n.path("thumbnail").path("resolutions");
            String thumbnail = resolutions.isArray() && !resolutions.isEmpty()
                    ? text(resolutions.get(resolutions.size() - 1), "url")
                    : null;
            out.add(new NewsItem(ticker, id,
                    text(n, "title"),
                    text(n, "summary"),
                    text(n, "description"),
                    text(n, "publisher"),
                    text(n, "link"),
                    epoch(n.path("providerPublishTime")),
                    epoch(n.path("displayTime")),
                    text(n, "type"),
                    thumbnail,
                    n.path("isPremium").asBoolean(false),
                    n.path("isHosted").asBoolean(false)));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isMissingNode() || v.isNull() ? null : v.asText();
    }

    private JsonNode readTree(String body) throws TransientFetchException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransientFetchException("unparseable Yahoo response: " + e.getOriginalMessage(), e);
        }
    }

    private static String call(String what, YahooCall call) throws TransientFetchException, InterruptedException {
        try {
            return call.get();
        } catch (InterruptedException | TransientFetchException e) {
            throw e;
        } catch (Exception e) {
            throw new TransientFetchException("Yahoo " + what + " failed: " + e, e);
        }
    }

    private static Double dbl(JsonNode n) {
        return n.isNumber() ? n.asDouble() : null;
    }

    private static Instant epoch(JsonNode n) {
        return n.isNumber() && n.asLong() > 0 ? Instant.ofEpochSecond(n.asLong()) : null;
    }

    @FunctionalInterface
    private interface YahooCall {
        String get() throws Exception;
    }
}
