package com.planwright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers pipeline events to listeners scoped to one run or to every run.
 * <p>
 * Run listeners are dropped when their run publishes a terminal event, so a
 * command watching one run cannot leak its listener past the run. A listener
 * may narrow itself to a set of {@link PipelineEventType}s.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> runListeners = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Listener> globalListeners = new CopyOnWriteArrayList<>();

    /**
     * Delivers to the run's listeners, then to global listeners. A terminal
     * event is the last one the run's listeners see.
     */
    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for run {}", event.type().code(), event.projectId());

        List<Listener> scoped = event.isTerminal()
                ? runListeners.remove(event.projectId())
                : runListeners.get(event.projectId());
        if (scoped != null) {
            scoped.forEach(listener -> listener.deliver(event));
            if (event.isTerminal()) {
                log.debug("Released {} listener(s) of finished run {}", scoped.size(), event.projectId());
            }
        }
        globalListeners.forEach(listener -> listener.deliver(event));
    }

    public Subscription subscribeToRun(String projectId, Consumer<PipelineEvent> consumer) {
        return subscribeToRun(projectId, EnumSet.allOf(PipelineEventType.class), consumer);
    }

    /**
     * Listens to one run until it completes, fails or is cancelled.
     *
     * @return a handle that also detaches the listener early
     */
    public Subscription subscribeToRun(String projectId, Set<PipelineEventType> types,
                                       Consumer<PipelineEvent> consumer) {
        Listener listener = new Listener(copyOf(types), consumer);
        runListeners.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> runListeners.computeIfPresent(projectId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        return subscribeAll(EnumSet.allOf(PipelineEventType.class), consumer);
    }

    public Subscription subscribeAll(Set<PipelineEventType> types, Consumer<PipelineEvent> consumer) {
        Listener listener = new Listener(copyOf(types), consumer);
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    private static Set<PipelineEventType> copyOf(Set<PipelineEventType> types) {
        return types.isEmpty() ? EnumSet.noneOf(PipelineEventType.class) : EnumSet.copyOf(types);
    }

    /** Handle for a listener; closing it unsubscribes. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private record Listener(Set<PipelineEventType> types, Consumer<PipelineEvent> consumer) {

        void deliver(PipelineEvent event) {
            if (!types.contains(event.type())) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for run {}: {}",
                        event.type().code(), event.projectId(), e.getMessage(), e);
            }
        }
    }
}
