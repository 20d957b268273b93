package io.marketsync.market.store;

import io.marketsync.market.model.PriceBar;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

public class PriceCsvCodec implements CsvCodec<PriceBar> {
    private static final List<String> HEADER =
            List.of("TICKER", "DATE", "OPEN", "HIGH", "LOW", "CLOSE", "ADJ_CLOSE", "VOLUME");

    @Override
    public List<String> header() { return HEADER; }

    @Override
    public List<String> encode(PriceBar b) {
        return Arrays.asList(b.ticker(), b.date().toString(),
                num(b.open()), num(b.high()), num(b.low()), num(b.close()), num(b.adjClose()),
                b.volume() == null ? "" : b.volume().toString());
    }

    @Override
    public PriceBar decode(List<String> c) {
        return new PriceBar(c.get(0), LocalDate.parse(c.get(1)),
                dbl(c.get(2)), dbl(c.get(3)), dbl(c.get(4)), dbl(c.get(5)), dbl(c.get(6)),
                c.get(7).isEmpty() ? null : Long.valueOf(c.get(7)));
    }

    private static String num(Double d) {
        if (d == null || d.isNaN()) return "";
        return Double.toString(d);
    }

    private static Double dbl(String s) {
        return s.isEmpty() ? null : Double.valueOf(s);
    }
}
