package com.example.healthcoach.model;

public enum QueryState {
    CLASSIFY,
    RETRIEVE_CONTEXT,
    ROUTE,
    BUILD_PROMPT,
    INVOKE_BACKEND,
    POSTPROCESS,
    PERSIST_TURN,
    DELIVERED,
    FAILED;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }
}
