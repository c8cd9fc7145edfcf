package com.example.codescan.metrics;

import com.example.codescan.error.ScanFailureKind;
import com.example.codescan.session.SessionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters for scan sessions.
 *
 * <p>Tags stay low-cardinality: state names, failure codes and symbology tags only.
 * Decoded content never becomes a tag.</p>
 */
public final class ScanSessionMetrics {

    private static final ScanSessionMetrics NOOP = new ScanSessionMetrics(null, false, "codescan");

    private final MeterRegistry registry; // may be null (fail-soft)
    private final boolean enabled;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public ScanSessionMetrics(MeterRegistry registry, boolean enabled, String prefix) {
        this.registry = registry;
        this.enabled = enabled;
        this.prefix = (prefix == null || prefix.isBlank()) ? "codescan" : prefix.trim();
    }

    public static ScanSessionMetrics noop() {
        return NOOP;
    }

    public void transition(SessionState from, SessionState to) {
        count("session.transitions", "from", name(from), "to", name(to));
    }

    public void detection(String symbology) {
        count("detections", "symbology", safeTag(symbology));
    }

    public void failure(ScanFailureKind kind) {
        count("failures", "kind", kind == null ? "none" : kind.code());
    }

    public void batchDropped() {
        count("batches.dropped");
    }

    private void count(String name, String... tags) {
        if (!enabled || registry == null) {
            return;
        }
        String meter = prefix + "." + name;
        String cacheKey = meter + "|" + String.join("|", tags);
        Counter c = counters.computeIfAbsent(cacheKey,
                k -> Counter.builder(meter).tags(tags).register(registry));
        c.increment();
    }

    private static String name(SessionState s) {
        return s == null ? "none" : s.name().toLowerCase(Locale.ROOT);
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 32) {
            s = s.substring(0, 32);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
