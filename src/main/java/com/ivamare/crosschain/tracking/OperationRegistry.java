package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationResult;
import com.ivamare.crosschain.model.OperationStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keyed store of operation tracking records.
 *
 * <p>All writes go through {@link #update}, which runs the mutator under the operation's
 * lock and refuses to touch a record that already reached a terminal status.
 */
public interface OperationRegistry {

    /**
     * Register a new PENDING operation.
     *
     * @throws com.ivamare.crosschain.exception.DuplicateOperationException if the ID is already tracked
     */
    void create(String operationId, OperationIntent intent);

    /**
     * Get a detached copy of a tracking record.
     */
    Optional<OperationTracking> get(String operationId);

    /**
     * Atomically read-modify-write a tracking record.
     *
     * @return false if the record was terminal and the mutator was not run
     * @throws com.ivamare.crosschain.exception.OperationNotFoundException if the ID is not tracked
     */
    boolean update(String operationId, Consumer<OperationTracking> mutator);

    /**
     * Public projection; an untracked ID yields an UNKNOWN result.
     */
    OperationResult toPublicResult(String operationId);

    /**
     * Detached copies of every record currently in the given status.
     */
    List<OperationTracking> findByStatus(OperationStatus status);

    /**
     * Number of records per status.
     */
    Map<OperationStatus, Long> countByStatus();

    void addListener(OperationStatusListener listener);

    void removeListener(OperationStatusListener listener);
}
