package com.candlesignal.backend.exception;

/**
 * Fewer observations than a calculation's window needs. Detectors treat it as "no verdict".
 */
public class InsufficientDataException extends SignalEngineException {

    private final int required;
    private final int available;

    public InsufficientDataException(String what, int required, int available) {
        super(what + " needs " + required + " values, got " + available);
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
