package org.imbalance.exceptions;

public class ConfigurationException extends SamplingException {
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(String message) {
        super(message);
    }
}
