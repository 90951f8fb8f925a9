package com.candlesignal.backend.exception;

public class SignalPersistenceException extends SignalEngineException {
    public SignalPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
