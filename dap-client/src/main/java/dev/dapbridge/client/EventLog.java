package dev.dapbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, arrival-ordered record of the events received on a session. When full, the oldest event
 * is dropped. The most recent {@code stopped} event is kept separately and never evicted.
 */
public final class EventLog {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventLog.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<DapEvent> events = new ArrayDeque<>();
    private final List<Consumer<DapEvent>> listeners = new CopyOnWriteArrayList<>();
    private long nextIndex;
    private long stopEpoch;
    private StoppedEvent lastStop;

    public EventLog() {
        this(DEFAULT_CAPACITY);
    }

    public EventLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Records an event and notifies listeners on the calling thread. A failing listener is logged and
     * does not prevent the others from running.
     */
    public DapEvent append(String name, JsonNode body) {
        DapEvent event;
        synchronized (this) {
            event = new DapEvent(nextIndex++, name, body, Instant.now());
            events.addLast(event);
            while (events.size() > capacity) {
                events.removeFirst();
            }
            if (event.is("stopped")) {
                lastStop = StoppedEvent.from(event);
                stopEpoch++;
            }
        }
        LOGGER.debug("Event #{} {}", event.index(), name);
        for (Consumer<DapEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOGGER.error("Event listener failed on {}", name, e);
            }
        }
        return event;
    }

    public synchronized List<DapEvent> snapshot() {
        return List.copyOf(events);
    }

    /** Events whose index is at least {@code fromIndex}, in arrival order. */
    public synchronized List<DapEvent> since(long fromIndex) {
        List<DapEvent> result = new ArrayList<>();
        for (DapEvent event : events) {
            if (event.index() >= fromIndex) {
                result.add(event);
            }
        }
        return result;
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized Optional<StoppedEvent> lastStop() {
        return Optional.ofNullable(lastStop);
    }

    /** Number of {@code stopped} events seen so far. */
    public synchronized long stopEpoch() {
        return stopEpoch;
    }

    /**
     * Runs {@code action} only if no {@code stopped} event arrived since {@code epoch}. Holds the log's
     * lock, so a stop cannot be recorded while the action runs.
     */
    public synchronized boolean runIfNoStopSince(long epoch, Runnable action) {
        if (stopEpoch != epoch) {
            return false;
        }
        action.run();
        return true;
    }

    public synchronized void clear() {
        events.clear();
        lastStop = null;
    }

    /** Registers a listener for every future event. Closing the returned handle removes it. */
    public AutoCloseable subscribe(Consumer<DapEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Returns a future completed by the next event matching {@code predicate}. Events already in the
     * log are not considered. Cancelling the future unregisters it.
     */
    public CompletableFuture<DapEvent> next(Predicate<DapEvent> predicate) {
        CompletableFuture<DapEvent> future = new CompletableFuture<>();
        Consumer<DapEvent> listener = new Consumer<>() {
            @Override
            public void accept(DapEvent event) {
                if (future.isDone()) {
                    listeners.remove(this);
                } else if (predicate.test(event)) {
                    listeners.remove(this);
                    future.complete(event);
                }
            }
        };
        listeners.add(listener);
        future.whenComplete((event, error) -> listeners.remove(listener));
        return future;
    }

    /** Blocks until an event matching {@code predicate} arrives. */
    public DapEvent awaitEvent(Predicate<DapEvent> predicate, Duration timeout)
        throws DapTimeoutException, InterruptedException {
        return await(next(predicate), "event", timeout);
    }

    /** Blocks until the next {@code stopped} event arrives. */
    public StoppedEvent awaitStop(Duration timeout) throws DapTimeoutException, InterruptedException {
        return StoppedEvent.from(await(next(event -> event.is("stopped")), "stopped", timeout));
    }

    static DapEvent await(CompletableFuture<DapEvent> future, String what, Duration timeout)
        throws DapTimeoutException, InterruptedException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new DapTimeoutException(what, timeout,
                "Timed out after " + timeout.toMillis() + " ms waiting for '" + what + "' event");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Event wait failed", e.getCause());
        } catch (InterruptedException e) {
            future.cancel(false);
            throw e;
        }
    }
}
