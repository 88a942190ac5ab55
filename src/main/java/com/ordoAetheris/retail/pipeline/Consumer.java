package com.ordoAetheris.retail.pipeline;

import com.ordoAetheris.retail.queue.BoundedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Takes envelopes off the queue and appends their payloads to the destination until
 * the end marker shows up. The marker itself is never appended. A destination that
 * refuses an item ({@code add} returns {@code false}) fails the consumer.
 *
 * <p>The destination belongs to the consumer while {@link #run()} is executing; hand it
 * to anyone else only after the consumer has terminated.
 *
 * @param <T> payload type
 */
public final class Consumer<T> {
    private static final Logger log = LoggerFactory.getLogger(Consumer.class);

    private final BoundedQueue<Envelope<T>> queue;
    private final Collection<T> destination;
    private volatile int consumed;

    public Consumer(BoundedQueue<Envelope<T>> queue, Collection<T> destination) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    /**
     * @return number of payload items appended to the destination
     */
    public int run() throws InterruptedException {
        int count = 0;
        while (true) {
            Envelope<T> envelope = queue.get();
            if (envelope == null) {
                // closed without a marker: the producer side gave up
                log.debug("queue closed before end marker, consumer stops after {} items", count);
                return count;
            }
            if (envelope.isEnd()) {
                log.debug("consumer done: {} items", count);
                return count;
            }
            if (!destination.add(envelope.value())) {
                throw new IllegalStateException("destination refused item " + (count + 1) + ": " + envelope.value());
            }
            consumed = ++count;
        }
    }

    /** Items appended so far; readable from any thread. */
    public int consumed() {
        return consumed;
    }
}
