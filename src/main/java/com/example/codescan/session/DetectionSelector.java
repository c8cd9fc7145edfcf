package com.example.codescan.session;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks at most one actionable detection per frame tick: the first event, in arrival order,
 * whose type tag passes the symbology filter and whose content is non-empty.
 * An empty filter accepts every symbology.
 */
public class DetectionSelector {

    private final Set<String> accepted;

    public DetectionSelector() {
        this(List.of());
    }

    public DetectionSelector(Collection<String> symbologies) {
        Set<String> s = new LinkedHashSet<>();
        if (symbologies != null) {
            for (String tag : symbologies) {
                String n = Symbology.normalize(tag);
                if (n != null) s.add(n);
            }
        }
        this.accepted = Set.copyOf(s);
    }

    public static DetectionSelector acceptAny() {
        return new DetectionSelector();
    }

    public Set<String> getAcceptedSymbologies() {
        return accepted;
    }

    public boolean acceptsAny() {
        return accepted.isEmpty();
    }

    public boolean qualifies(DetectionEvent event) {
        if (event == null || !event.hasContent()) return false;
        return accepted.isEmpty() || accepted.contains(Symbology.normalize(event.typeTag()));
    }

    /**
     * @return the first qualifying event, or null when none qualify (or the batch is null/empty)
     */
    public DetectionEvent select(List<DetectionEvent> batch) {
        if (batch == null || batch.isEmpty()) return null;
        for (DetectionEvent e : batch) {
            if (qualifies(e)) return e;
        }
        return null;
    }
}
