package com.saas.insights.repository;

import com.saas.insights.model.Alert;
import com.saas.insights.model.AlertPatch;

import java.util.List;
import java.util.Optional;

/**
 * Persistence surface for alerts.
 */
public interface AlertStore {

    Optional<Alert> findById(String alertId);

    /**
     * The open (unresolved) alert for a source key, if any.
     */
    Optional<Alert> findUnresolvedBySource(String source);

    /**
     * Atomically stores {@code alert} unless an unresolved alert already exists for its source.
     *
     * @return true if the alert was stored, false if another open alert holds the source
     */
    boolean createIfNoneUnresolved(Alert alert);

    /**
     * Atomically stores {@code alert} unless an alert with the same id exists.
     *
     * @return true if stored, false if the id was taken
     */
    boolean createIfAbsent(Alert alert);

    /**
     * Apply lifecycle fields to an existing alert.
     *
     * @return false if no alert has that id
     */
    boolean update(String alertId, AlertPatch patch);

    /**
     * Unresolved alerts, most recently triggered first.
     */
    List<Alert> listUnresolved(int limit);
}
