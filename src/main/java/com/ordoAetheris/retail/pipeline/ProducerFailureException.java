package com.ordoAetheris.retail.pipeline;

/**
 * The producer stopped early: the source threw while being iterated, or the queue
 * refused an item because the consumer side had already failed.
 */
public final class ProducerFailureException extends PipelineException {
    public ProducerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
