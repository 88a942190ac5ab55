package com.ordoAetheris.retail.pipeline;

/**
 * Unchecked exception thrown by {@link Pipeline#run} when a worker thread failed.
 * The cause is the original error raised inside the worker.
 */
public abstract class PipelineException extends RuntimeException {
    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
