package com.ozone.core.registry;

import com.ozone.core.model.ErrorKind;
import com.ozone.core.model.OrchestrationException;
import com.ozone.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * {@link TaskRegistry} backed by a concurrent map with one read/write lock per task.
 */
public class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRegistry.class);

    private final ConcurrentHashMap<UUID, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicInteger reserved = new AtomicInteger();
    private final int maxTasks;
    private final Clock clock;

    public InMemoryTaskRegistry(int maxTasks, Clock clock) {
        if (maxTasks < 1) {
            throw new IllegalArgumentException("maxTasks must be >= 1, got " + maxTasks);
        }
        this.maxTasks = maxTasks;
        this.clock = clock;
    }

    @Override
    public UUID createTask(String objective) {
        if (reserved.incrementAndGet() > maxTasks) {
            reserved.decrementAndGet();
            throw new OrchestrationException(ErrorKind.RESOURCE_EXHAUSTED,
                    "Task registry is full (" + maxTasks + " tasks); evict terminal tasks first");
        }
        UUID id = UUID.randomUUID();
        slots.put(id, new Slot(Task.create(id, objective, clock.instant())));
        log.debug("Created task {} ({} of {} slots in use)", id, reserved.get(), maxTasks);
        return id;
    }

    @Override
    public Task get(UUID taskId) {
        return find(taskId).orElseThrow(() -> OrchestrationException.notFound(taskId));
    }

    @Override
    public Optional<Task> find(UUID taskId) {
        Slot slot = slots.get(taskId);
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.readLock().lock();
        try {
            return slot.evicted ? Optional.empty() : Optional.of(slot.task);
        } finally {
            slot.lock.readLock().unlock();
        }
    }

    @Override
    public Task update(UUID taskId, UnaryOperator<Task> mutator) {
        Slot slot = requireSlot(taskId);
        slot.lock.writeLock().lock();
        try {
            if (slot.evicted) {
                throw OrchestrationException.notFound(taskId);
            }
            Task current = slot.task;
            Task updated = mutator.apply(current);
            if (updated == null) {
                throw new IllegalStateException("Mutator returned null for task " + taskId);
            }
            if (!updated.id().equals(taskId)) {
                throw new IllegalStateException("Mutator changed the id of task " + taskId);
            }
            if (updated != current) {
                slot.task = updated.touchedAt(clock.instant());
            }
            return slot.task;
        } finally {
            slot.lock.writeLock().unlock();
        }
    }

    @Override
    public Stream<UUID> list(TaskFilter filter) {
        TaskFilter effective = filter == null ? TaskFilter.all() : filter;
        return slots.entrySet().stream()
                .filter(e -> {
                    Slot slot = e.getValue();
                    return !slot.evicted && effective.matches(slot.task);
                })
                .map(Map.Entry::getKey);
    }

    @Override
    public Task evict(UUID taskId) {
        Slot slot = requireSlot(taskId);
        slot.lock.writeLock().lock();
        try {
            if (slot.evicted) {
                throw OrchestrationException.notFound(taskId);
            }
            Task task = slot.task;
            if (!task.state().isTerminal()) {
                throw OrchestrationException.invalidTransition(taskId, task.state(), "evict");
            }
            slot.evicted = true;
            slots.remove(taskId, slot);
            reserved.decrementAndGet();
            log.info("Evicted task {} in state {}", taskId, task.state());
            return task;
        } finally {
            slot.lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        return slots.size();
    }

    @Override
    public int capacity() {
        return maxTasks;
    }

    private Slot requireSlot(UUID taskId) {
        Slot slot = slots.get(taskId);
        if (slot == null) {
            throw OrchestrationException.notFound(taskId);
        }
        return slot;
    }

    private static final class Slot {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private volatile Task task;
        private volatile boolean evicted;

        private Slot(Task task) {
            this.task = task;
        }
    }
}
