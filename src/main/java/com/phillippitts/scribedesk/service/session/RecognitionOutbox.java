package com.phillippitts.scribedesk.service.session;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

/**
 * Thread-safe hand-off from background threads to the single consumer that owns session state.
 *
 * <p>Producers only ever {@link #post(SessionEvent)}; the consumer drains in FIFO order.
 */
final class RecognitionOutbox {

    private final Queue<SessionEvent> events = new ConcurrentLinkedQueue<>();

    void post(SessionEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Hands every queued event to {@code consumer}, including events posted while draining.
     *
     * @return number of events drained
     */
    int drain(Consumer<SessionEvent> consumer) {
        int n = 0;
        SessionEvent e;
        while ((e = events.poll()) != null) {
            consumer.accept(e);
            n++;
        }
        return n;
    }

    boolean isEmpty() {
        return events.isEmpty();
    }
}
