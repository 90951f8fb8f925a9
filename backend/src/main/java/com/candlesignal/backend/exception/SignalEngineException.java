package com.candlesignal.backend.exception;

public class SignalEngineException extends RuntimeException {
    public SignalEngineException(String message) {
        super(message);
    }

    public SignalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
