package io.marketsync.budget;

import java.util.concurrent.TimeUnit;

/**
 * Naive token bucket shared by all workers. Holds at most one second of burst.
 */
public class TokenBucketBudget implements Budget {
    private final long externalQps;

    private long qpsTokens;
    private long lastQpsRefillNanos;

    public TokenBucketBudget(long externalQps) {
        this.externalQps = Math.max(0, externalQps);
        this.lastQpsRefillNanos = System.nanoTime();
        this.qpsTokens = this.externalQps; // initial burst of 1s
    }

    public long externalQps() { return externalQps; }

    @Override
    public synchronized void acquireExternalOp() throws InterruptedException {
        if (externalQps <= 0) return; // no limit
        while (true) {
            refillQps();
            if (qpsTokens > 0) {
                qpsTokens--;
                return;
            }
            Thread.sleep(1);
        }
    }

    private void refillQps() {
        long now = System.nanoTime();
        long elapsed = now - lastQpsRefillNanos;
        if (elapsed <= 0) return;
        long add = (externalQps * elapsed) / TimeUnit.SECONDS.toNanos(1);
        if (add > 0) {
            qpsTokens = Math.min(externalQps, qpsTokens + add);
            lastQpsRefillNanos = now;
        }
    }
}
