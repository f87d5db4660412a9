package com.example.healthcoach.model;

/**
 * The interchangeable text-completion services, in fallback priority order.
 */
public enum BackendId {
    REASONING(true),
    VALIDATION(true),
    LOCAL(false);

    private final boolean remote;

    BackendId(boolean remote) {
        this.remote = remote;
    }

    public boolean isRemote() {
        return remote;
    }
}
