package com.example.healthcoach.llm;

import com.example.healthcoach.model.BackendId;

/**
 * Uniform text-completion contract shared by the reasoning, validation and local backends.
 * Implementations block; callers are responsible for time-boxing.
 */
public interface CompletionBackend {

    BackendId id();

    /**
     * @throws BackendUnavailableException when the backend cannot produce an answer
     */
    CompletionResult complete(String systemPrompt, String userPrompt);

    boolean isAvailable();
}
