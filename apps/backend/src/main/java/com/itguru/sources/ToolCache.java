package com.itguru.sources;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tool names advertised by one MCP server. Owned by a single client; concurrent
 * refreshes may both run and the last one wins.
 */
public final class ToolCache {

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public boolean needsRefresh() {
        Snapshot s = snapshot.get();
        return s.tools().isEmpty() || s.lastRefresh() == null;
    }

    public boolean isEmpty() {
        return snapshot.get().tools().isEmpty();
    }

    public List<String> tools() {
        return snapshot.get().tools();
    }

    public Optional<Instant> lastRefresh() {
        return Optional.ofNullable(snapshot.get().lastRefresh());
    }

    public void update(List<String> tools, Instant refreshedAt) {
        snapshot.set(new Snapshot(List.copyOf(tools), refreshedAt));
    }

    private record Snapshot(List<String> tools, Instant lastRefresh) {
        static final Snapshot EMPTY = new Snapshot(List.of(), null);
    }
}
