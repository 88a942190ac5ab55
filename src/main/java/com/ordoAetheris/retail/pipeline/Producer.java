package com.ordoAetheris.retail.pipeline;

import com.ordoAetheris.retail.queue.BoundedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Pushes every element of a finite source into the queue, in source order, then
 * pushes the end marker once.
 *
 * <p>The end marker is pushed only when the source was exhausted normally. If the
 * source throws, the exception leaves {@link #run()} untouched and no marker is
 * pushed; whoever runs the producer is responsible for releasing the consumer
 * (see {@link Pipeline}, which closes the queue).
 *
 * @param <T> payload type
 */
public final class Producer<T> {
    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final Iterable<? extends T> source;
    private final BoundedQueue<Envelope<T>> queue;
    private volatile int produced;

    public Producer(Iterable<? extends T> source, BoundedQueue<Envelope<T>> queue) {
        this.source = Objects.requireNonNull(source, "source");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    /**
     * Drains the source into the queue, blocking while the queue is full.
     *
     * @return number of payload items pushed (the end marker is not counted)
     */
    public int run() throws InterruptedException {
        int count = 0;
        for (T item : source) {
            queue.put(Envelope.of(item));
            produced = ++count;
        }
        queue.put(Envelope.end());
        log.debug("producer done: {} items", count);
        return count;
    }

    /** Items pushed so far; readable from any thread. */
    public int produced() {
        return produced;
    }
}
