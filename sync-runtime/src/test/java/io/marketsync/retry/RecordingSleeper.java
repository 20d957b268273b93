package io.marketsync.retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Sleeper that records requested delays instead of blocking. */
public class RecordingSleeper implements Sleeper {
    public final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
        delays.add(duration);
    }

    public List<Long> millis() {
        return delays.stream().map(Duration::toMillis).toList();
    }
}
