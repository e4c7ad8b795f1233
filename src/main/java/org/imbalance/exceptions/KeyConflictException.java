package org.imbalance.exceptions;

/**
 * A (strategy, label) pair was recorded twice in the same run.
 */
public class KeyConflictException extends SamplingException {
    public KeyConflictException(String message) {
        super(message);
    }
}
