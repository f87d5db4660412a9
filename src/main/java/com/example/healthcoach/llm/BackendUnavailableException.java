package com.example.healthcoach.llm;

import com.example.healthcoach.model.BackendId;

/** A backend could not be reached, timed out or returned nothing usable. */
public class BackendUnavailableException extends RuntimeException {

    private final BackendId backend;

    public BackendUnavailableException(BackendId backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendUnavailableException(BackendId backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public BackendId getBackend() {
        return backend;
    }
}
