package com.playlistchecker.test;

import com.playlistchecker.api.LivenessProber;
import com.playlistchecker.common.model.ProbeResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prober double: answers from a fixed table (default REACHABLE), optionally sleeps, and records
 * how many probes were in flight at the same time.
 */
public class CountingProber implements LivenessProber {
    private final Map<String, ProbeResult> results = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();
    private final long delayMs;

    public CountingProber(long delayMs) {
        this.delayMs = delayMs;
    }

    public CountingProber answer(String url, ProbeResult result) {
        results.put(url, result);
        return this;
    }

    @Override
    public ProbeResult probe(String url, int timeoutMs) {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        calls.incrementAndGet();
        try {
            if (delayMs > 0) Thread.sleep(delayMs);
            return results.getOrDefault(url, ProbeResult.REACHABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.PROBE_FAILED;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    public int getCalls() {
        return calls.get();
    }
}
