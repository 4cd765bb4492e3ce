package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.ExistingEventRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory {@link EventRequestStore} preserving creation order. Thread-safe.
 */
public class InMemoryEventRequestStore implements EventRequestStore {

    private final Map<String, ExistingEventRequest> requests = new LinkedHashMap<>();

    public InMemoryEventRequestStore() {
    }

    public InMemoryEventRequestStore(List<ExistingEventRequest> initial) {
        initial.forEach(this::create);
    }

    @Override
    public synchronized List<ExistingEventRequest> findAll() {
        return List.copyOf(new ArrayList<>(requests.values()));
    }

    @Override
    public synchronized Optional<ExistingEventRequest> findById(String id) {
        return Optional.ofNullable(requests.get(id));
    }

    @Override
    public synchronized ExistingEventRequest create(ExistingEventRequest request) {
        if (requests.containsKey(request.getId())) {
            throw new IllegalArgumentException("Event request already exists: " + request.getId());
        }
        requests.put(request.getId(), request);
        return request;
    }

    @Override
    public synchronized ExistingEventRequest update(ExistingEventRequest request) {
        if (!requests.containsKey(request.getId())) {
            throw new IllegalArgumentException("Event request not found: " + request.getId());
        }
        requests.put(request.getId(), request);
        return request;
    }

    @Override
    public synchronized int count() {
        return requests.size();
    }
}
