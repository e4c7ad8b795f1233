package org.imbalance.exceptions;

public class DatasetException extends SamplingException {
    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }

    public DatasetException(String message) {
        super(message);
    }
}
