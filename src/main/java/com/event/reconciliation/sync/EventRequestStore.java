package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.ExistingEventRequest;

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for event requests. The sync only reads all records once per pass,
 * creates new ones and replaces matched ones; it never deletes.
 */
public interface EventRequestStore {

    /**
     * Returns every stored request in a stable order (creation order for the in-memory store).
     */
    List<ExistingEventRequest> findAll();

    Optional<ExistingEventRequest> findById(String id);

    /**
     * Stores a new request.
     *
     * @throws IllegalArgumentException if a request with the same id already exists
     */
    ExistingEventRequest create(ExistingEventRequest request);

    /**
     * Replaces the stored request with the same id.
     *
     * @throws IllegalArgumentException if no request with that id exists
     */
    ExistingEventRequest update(ExistingEventRequest request);

    int count();
}
