package com.ordoAetheris.retail.pipeline;

/**
 * The consumer stopped early because appending to the destination threw.
 */
public final class ConsumerFailureException extends PipelineException {
    public ConsumerFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
