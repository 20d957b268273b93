package io.marketsync.market.fetch.yahoo;

import io.marketsync.market.error.TransientFetchException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link YahooClient} over {@code java.net.http}. One request per call; retrying is left to the caller.
 */
public final class HttpYahooClient implements YahooClient {
    public static final URI DEFAULT_BASE = URI.create("https://query1.finance.yahoo.com");

    private final HttpClient http;
    private final URI base;
    private final Duration timeout;

    public HttpYahooClient() {
        this(DEFAULT_BASE, Duration.ofSeconds(30));
    }

    public HttpYahooClient(URI base, Duration timeout) {
        this.base = base;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String chart(String ticker, Map<String, String> query) throws Exception {
        return get("/v8/finance/chart/" + enc(ticker) + "?" + queryString(query));
    }

    @Override
    public String news(String ticker, int count) throws Exception {
        return get("/v1/finance/search?q=" + enc(ticker) + "&quotesCount=0&newsCount=" + count);
    }

    private String get(String pathAndQuery) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(base.resolve(pathAndQuery))
                .header("User-Agent", "Mozilla/5.0")
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new TransientFetchException("Yahoo request " + pathAndQuery + " failed: HTTP " + resp.statusCode());
        }
        return resp.body();
    }

    private static String queryString(Map<String, String> query) {
        StringJoiner sj = new StringJoiner("&");
        query.forEach((k, v) -> sj.add(enc(k) + "=" + enc(v)));
        return sj.toString();
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
