package org.imbalance.exceptions;

/**
 * Root of the errors raised by the sampling experiment. Every one of them aborts the run.
 */
public class SamplingException extends RuntimeException {
    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }

    public SamplingException(String message) {
        super(message);
    }
}
