package com.example.healthcoach.llm;

import com.example.healthcoach.model.BackendId;

public record CompletionResult(BackendId backend, String text, int tokensUsed) {
}
