package com.pagecraft.service;

import jakarta.inject.Singleton;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debounces edits per design. Each edit pushes the design's deadline to
 * {@code now + debounce}; {@link #drainDue()} hands back the designs whose
 * deadline has passed and forgets them.
 */
@Singleton
public class AutosaveQueue {

    private final Map<UUID, Instant> lastEdit = new ConcurrentHashMap<>();
    private final AutosaveConfiguration config;
    private final Clock clock;

    public AutosaveQueue(AutosaveConfiguration config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void markDirty(UUID designId) {
        lastEdit.put(designId, clock.instant());
    }

    public boolean isDirty(UUID designId) {
        return lastEdit.containsKey(designId);
    }

    /** Forget a design, typically because it was just written explicitly. */
    public void clear(UUID designId) {
        lastEdit.remove(designId);
    }

    public List<UUID> drainDue() {
        Instant cutoff = clock.instant().minus(config.getDebounce());
        List<UUID> due = new ArrayList<>();
        for (Map.Entry<UUID, Instant> entry : lastEdit.entrySet()) {
            Instant edited = entry.getValue();
            if (!edited.isAfter(cutoff) && lastEdit.remove(entry.getKey(), edited)) {
                due.add(entry.getKey());
            }
        }
        return due;
    }

    public int pending() {
        return lastEdit.size();
    }
}
