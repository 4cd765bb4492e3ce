package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.ExistingEventRequest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered view of the existing event requests that one sync pass matches against.
 * Fetched once at the start of a pass; {@link #withAdded} and {@link #withReplaced} return new
 * snapshots so that a pass can make its own writes visible to later rows.
 */
public final class EventRequestSnapshot {

    private static final EventRequestSnapshot EMPTY = new EventRequestSnapshot(List.of());

    private final List<SnapshotEntry> entries;

    private EventRequestSnapshot(List<SnapshotEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static EventRequestSnapshot empty() {
        return EMPTY;
    }

    public static EventRequestSnapshot of(Collection<ExistingEventRequest> requests) {
        Objects.requireNonNull(requests, "requests is required");
        return new EventRequestSnapshot(requests.stream().map(SnapshotEntry::of).toList());
    }

    public List<SnapshotEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns a snapshot with the given record appended.
     */
    public EventRequestSnapshot withAdded(ExistingEventRequest request) {
        List<SnapshotEntry> copy = new ArrayList<>(entries);
        copy.add(SnapshotEntry.of(request));
        return new EventRequestSnapshot(copy);
    }

    /**
     * Returns a snapshot in which the record with the same id is replaced, keeping its position.
     * Appends the record if no entry has its id.
     */
    public EventRequestSnapshot withReplaced(ExistingEventRequest request) {
        List<SnapshotEntry> copy = new ArrayList<>(entries);
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).id().equals(request.getId())) {
                copy.set(i, SnapshotEntry.of(request));
                return new EventRequestSnapshot(copy);
            }
        }
        copy.add(SnapshotEntry.of(request));
        return new EventRequestSnapshot(copy);
    }
}
