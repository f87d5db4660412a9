package com.example.healthcoach.llm;

import com.example.healthcoach.model.BackendId;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link CompletionBackend} over a LangChain4j {@link ChatModel}.
 */
@Slf4j
public class ChatModelBackend implements CompletionBackend {

    private final BackendId id;
    private final ChatModel chatModel;
    private final boolean enabled;

    public ChatModelBackend(BackendId id, ChatModel chatModel, boolean enabled) {
        this.id = id;
        this.chatModel = chatModel;
        this.enabled = enabled;
    }

    @Override
    public BackendId id() {
        return id;
    }

    @Override
    public boolean isAvailable() {
        return enabled && chatModel != null;
    }

    @Override
    public CompletionResult complete(String systemPrompt, String userPrompt) {
        if (!isAvailable()) {
            throw new BackendUnavailableException(id, id + " backend is not configured");
        }
        List<ChatMessage> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(userPrompt == null ? "" : userPrompt));

        ChatResponse response;
        try {
            response = chatModel.chat(messages);
        } catch (RuntimeException e) {
            throw new BackendUnavailableException(id, id + " backend call failed: " + e.getMessage(), e);
        }
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new BackendUnavailableException(id, id + " backend returned an empty answer");
        }
        TokenUsage usage = response.tokenUsage();
        int tokens = usage == null || usage.totalTokenCount() == null ? estimateTokens(systemPrompt, userPrompt, text)
                : usage.totalTokenCount();
        log.debug("[{}] completion ok, tokens={}", id, tokens);
        return new CompletionResult(id, text.strip(), tokens);
    }

    /** Rough four-characters-per-token estimate for servers that report no usage. */
    static int estimateTokens(String... parts) {
        int chars = 0;
        for (String p : parts) {
            chars += p == null ? 0 : p.length();
        }
        return (int) Math.ceil(chars / 4.0);
    }
}
