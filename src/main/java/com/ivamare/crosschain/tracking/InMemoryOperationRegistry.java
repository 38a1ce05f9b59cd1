package com.ivamare.crosschain.tracking;

import com.ivamare.crosschain.exception.DuplicateOperationException;
import com.ivamare.crosschain.exception.OperationNotFoundException;
import com.ivamare.crosschain.model.OperationIntent;
import com.ivamare.crosschain.model.OperationResult;
import com.ivamare.crosschain.model.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Process-local registry with one lock per operation.
 *
 * <p>Records are never evicted; the registry lives as long as the process.
 *
 * <p>Status notifications are queued under the operation's lock and delivered outside it,
 * one thread at a time per operation, so listeners see an operation's results in the
 * order they were applied.
 */
public class InMemoryOperationRegistry implements OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationRegistry.class);

    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<OperationStatusListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryOperationRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void create(String operationId, OperationIntent intent) {
        OperationTracking tracking = new OperationTracking(operationId, intent, clock.instant());
        Entry existing = entries.putIfAbsent(operationId, new Entry(tracking));
        if (existing != null) {
            throw new DuplicateOperationException(operationId);
        }
        log.info("Registered operation {}", operationId);
    }

    @Override
    public Optional<OperationTracking> get(String operationId) {
        Entry entry = entries.get(operationId);
        if (entry == null) {
            return Optional.empty();
        }
        entry.lock.lock();
        try {
            return Optional.of(entry.tracking.copy());
        } finally {
            entry.lock.unlock();
        }
    }

    @Override
    public boolean update(String operationId, Consumer<OperationTracking> mutator) {
        Entry entry = entries.get(operationId);
        if (entry == null) {
            throw new OperationNotFoundException(operationId);
        }

        OperationResult before;
        OperationResult after;
        entry.lock.lock();
        try {
            OperationTracking tracking = entry.tracking;
            if (tracking.isTerminal()) {
                log.debug("Ignoring update for terminal operation {} ({})", operationId, tracking.getStatus());
                return false;
            }
            before = tracking.toResult();
            mutator.accept(tracking);
            if (tracking.isTerminal()) {
                tracking.setAwaitingConfirmationDetails(false);
                tracking.setConfirmationInFlight(false);
                log.info("Operation {} reached {}", operationId, tracking.getStatus());
            }
            tracking.setLastUpdatedAt(clock.instant());
            after = tracking.toResult();
            if (!after.equals(before)) {
                entry.outbox.add(after);
            }
        } finally {
            entry.lock.unlock();
        }

        drain(entry);
        return true;
    }

    @Override
    public OperationResult toPublicResult(String operationId) {
        return get(operationId)
            .map(OperationTracking::toResult)
            .orElseGet(() -> OperationResult.notFound(operationId));
    }

    @Override
    public List<OperationTracking> findByStatus(OperationStatus status) {
        return entries.keySet().stream()
            .map(this::get)
            .flatMap(Optional::stream)
            .filter(tracking -> tracking.getStatus() == status)
            .toList();
    }

    @Override
    public Map<OperationStatus, Long> countByStatus() {
        Map<OperationStatus, Long> counts = new EnumMap<>(OperationStatus.class);
        for (OperationStatus status : OperationStatus.values()) {
            counts.put(status, 0L);
        }
        for (String operationId : entries.keySet()) {
            get(operationId).ifPresent(tracking -> counts.merge(tracking.getStatus(), 1L, Long::sum));
        }
        return counts;
    }

    @Override
    public void addListener(OperationStatusListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(OperationStatusListener listener) {
        listeners.remove(listener);
    }

    // Whoever wins the flag delivers everything queued, including results queued by
    // other threads meanwhile; the re-check covers a result queued after the last poll.
    private void drain(Entry entry) {
        while (!entry.outbox.isEmpty() && entry.draining.compareAndSet(false, true)) {
            try {
                OperationResult next;
                while ((next = entry.outbox.poll()) != null) {
                    notifyListeners(next);
                }
            } finally {
                entry.draining.set(false);
            }
        }
    }

    private void notifyListeners(OperationResult result) {
        for (OperationStatusListener listener : listeners) {
            try {
                listener.onStatusChanged(result);
            } catch (RuntimeException e) {
                log.error("Status listener failed for operation {}", result.operationId(), e);
            }
        }
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private final ConcurrentLinkedQueue<OperationResult> outbox = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final OperationTracking tracking;

        private Entry(OperationTracking tracking) {
            this.tracking = tracking;
        }
    }
}
