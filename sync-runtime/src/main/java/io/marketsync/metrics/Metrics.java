package io.marketsync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.TreeMap;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Current value of every counter, sorted by name. */
    public Map<String, Long> counterValues() {
        Map<String, Long> out = new TreeMap<>();
        registry.getCounters().forEach((name, c) -> out.put(name, c.getCount()));
        return out;
    }

    /** One-line rendering of all counters, for end-of-run summaries. */
    public String summaryLine() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Long> e : counterValues().entrySet()) {
            if (sb.length() > 0) sb.append(" | ");
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        Timer t = registry.getTimers().get("coordinator.ticker.time");
        if (t != null && t.getCount() > 0) {
            sb.append(" | ticker.p50(ms)=").append(String.format("%.3f", t.getSnapshot().getMedian() / 1_000_000.0));
        }
        return sb.toString();
    }
}
