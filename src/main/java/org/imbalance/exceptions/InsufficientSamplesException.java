package org.imbalance.exceptions;

import lombok.Getter;

@Getter
public class InsufficientSamplesException extends SamplingException {

    private final String classLabel;
    private final int available;
    private final int required;

    public InsufficientSamplesException(String classLabel, int available, int required, String reason) {
        super(String.format("Class '%s' has %d samples, %s needs at least %d", classLabel, available, reason, required));
        this.classLabel = classLabel;
        this.available = available;
        this.required = required;
    }
}
