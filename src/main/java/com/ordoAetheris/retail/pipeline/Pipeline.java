package com.ordoAetheris.retail.pipeline;

import com.ordoAetheris.retail.queue.BoundedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One producer, one consumer, one bounded queue.
 *
 * <p>{@link #run(Iterable, int)} starts a producer thread and a consumer thread that
 * share a fresh {@link BoundedQueue}, joins both, and returns what the consumer
 * collected. From the caller's point of view the call is synchronous.
 *
 * <p>Failure handling: when a worker throws, the failure is recorded and the queue is
 * closed right away, so the other worker cannot stay blocked in {@code put}/{@code get}.
 * Once both threads have terminated, the first recorded failure is thrown as a
 * {@link ProducerFailureException} or {@link ConsumerFailureException}; a later failure
 * of the other worker is attached to it as suppressed. A partial result is never
 * returned.
 */
public final class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    /** Queue capacity used when the caller has no preference. */
    public static final int DEFAULT_CAPACITY = 10;

    private static final AtomicInteger RUN_IDS = new AtomicInteger();

    private Pipeline() {
    }

    /**
     * Moves every element of {@code source} through a queue of the given capacity.
     *
     * @return the elements of {@code source}, in source order
     * @throws IllegalArgumentException if {@code capacity <= 0}
     * @throws ProducerFailureException if iterating the source failed
     * @throws ConsumerFailureException if collecting an element failed
     * @throws InterruptedException if the calling thread is interrupted while waiting;
     *                              both workers are interrupted before this is thrown
     */
    public static <T> List<T> run(Iterable<? extends T> source, int capacity) throws InterruptedException {
        return run(source, capacity, ArrayList::new);
    }

    /**
     * Same as {@link #run(Iterable, int)}, collecting into a container created by
     * {@code destinationFactory}. The container must be an empty list, so that every
     * source element, duplicates included, keeps its position.
     */
    public static <T, C extends List<T>> C run(Iterable<? extends T> source,
                                                    int capacity,
                                                    Supplier<? extends C> destinationFactory) throws InterruptedException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destinationFactory, "destinationFactory");
        BoundedQueue<Envelope<T>> queue = new BoundedQueue<>(capacity);
        C destination = Objects.requireNonNull(destinationFactory.get(), "destination");
        if (!destination.isEmpty()) throw new IllegalArgumentException("destination must be empty");

        int runId = RUN_IDS.incrementAndGet();
        Producer<T> producer = new Producer<>(source, queue);
        Consumer<T> consumer = new Consumer<>(queue, destination);
        Queue<PipelineException> failures = new ConcurrentLinkedQueue<>();

        Thread producerThread = worker("pipeline-" + runId + "-producer", queue, failures,
                producer::run,
                e -> new ProducerFailureException(
                        "producer failed after " + producer.produced() + " items", e));
        Thread consumerThread = worker("pipeline-" + runId + "-consumer", queue, failures,
                consumer::run,
                e -> new ConsumerFailureException(
                        "consumer failed after " + consumer.consumed() + " items", e));

        log.debug("pipeline-{} starting, capacity={}", runId, capacity);
        producerThread.start();
        consumerThread.start();
        try {
            producerThread.join();
            consumerThread.join();
        } catch (InterruptedException e) {
            log.warn("pipeline-{} interrupted while waiting for workers, cancelling", runId);
            queue.close();
            producerThread.interrupt();
            consumerThread.interrupt();
            throw e;
        }

        PipelineException first = failures.poll();
        if (first != null) {
            for (PipelineException next = failures.poll(); next != null; next = failures.poll()) {
                first.addSuppressed(next);
            }
            log.error("pipeline-{} failed: {}", runId, first.getMessage());
            throw first;
        }
        log.debug("pipeline-{} finished, {} items", runId, consumer.consumed());
        return destination;
    }

    private static Thread worker(String name,
                                 BoundedQueue<?> queue,
                                 Queue<PipelineException> failures,
                                 Task task,
                                 Function<Throwable, PipelineException> wrap) {
        Thread thread = new Thread(() -> {
            try {
                task.run();
            } catch (InterruptedException e) {
                // cancelled by the caller, nothing to report
                Thread.currentThread().interrupt();
            } catch (Throwable e) {
                log.warn("{} failed", name, e);
                failures.add(wrap.apply(e));
                queue.close();
            }
        }, name);
        thread.setDaemon(true);
        return thread;
    }

    @FunctionalInterface
    private interface Task {
        int run() throws InterruptedException;
    }
}
