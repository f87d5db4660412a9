package com.example.healthcoach.config;

import com.example.healthcoach.llm.BackendRegistry;
import com.example.healthcoach.llm.ChatModelBackend;
import com.example.healthcoach.llm.CostEstimator;
import com.example.healthcoach.model.BackendId;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the three chat backends, the embedding model and the similar-day store.
 * All backends speak the OpenAI chat protocol; the local one points at an Ollama-style server.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({CoachProperties.class, VectorStoreProperties.class})
public class LangChain4jConfig {

    @Bean
    public BackendRegistry backendRegistry(CoachProperties props) {
        CoachProperties.Backends b = props.getBackends();
        return new BackendRegistry(List.of(
                backend(BackendId.REASONING, b.getReasoning()),
                backend(BackendId.VALIDATION, b.getValidation()),
                backend(BackendId.LOCAL, b.getLocal())));
    }

    @Bean
    public CostEstimator costEstimator(CoachProperties props) {
        CoachProperties.Backends b = props.getBackends();
        Map<BackendId, Double> rates = new EnumMap<>(BackendId.class);
        rates.put(BackendId.REASONING, b.getReasoning().getCostPer1kTokens());
        rates.put(BackendId.VALIDATION, b.getValidation().getCostPer1kTokens());
        return new CostEstimator(rates);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingModel embeddingModel(VectorStoreProperties props) {
        // offline model unless an OpenAI key is configured
        if (props.getOpenAiApiKey() == null || props.getOpenAiApiKey().isBlank()) {
            return new AllMiniLmL6V2EmbeddingModel();
        }
        return OpenAiEmbeddingModel.builder()
                .apiKey(props.getOpenAiApiKey())
                .modelName(props.getOpenAiEmbeddingModel())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingStore<TextSegment> embeddingStore(VectorStoreProperties p) {
        if (p.getStore() == VectorStoreProperties.StoreType.IN_MEMORY) {
            log.info("Using in-memory embedding store");
            return new InMemoryEmbeddingStore<>();
        }
        return PgVectorEmbeddingStore.builder()
                .host(p.getHost())
                .port(p.getPort())
                .database(p.getDatabase())
                .user(p.getUser())
                .password(p.getPassword())
                .table(p.getTable())
                .dimension(p.getDimension())
                .createTable(true)
                .dropTableFirst(false)
                .build();
    }

    private static ChatModelBackend backend(BackendId id, CoachProperties.Backend cfg) {
        boolean enabled = cfg.isEnabled() && cfg.getBaseUrl() != null && !cfg.getBaseUrl().isBlank();
        if (id.isRemote() && (cfg.getApiKey() == null || cfg.getApiKey().isBlank())) {
            log.warn("{} backend has no API key; it will be reported unavailable", id);
            enabled = false;
        }
        ChatModel model = null;
        if (enabled) {
            model = OpenAiChatModel.builder()
                    .baseUrl(cfg.getBaseUrl())
                    // local servers ignore the key but the client requires one
                    .apiKey(cfg.getApiKey() == null || cfg.getApiKey().isBlank() ? "local" : cfg.getApiKey())
                    .modelName(cfg.getModel())
                    .temperature(cfg.getTemperature())
                    .maxTokens(cfg.getMaxTokens())
                    .timeout(cfg.getTimeout())
                    .build();
        }
        return new ChatModelBackend(id, model, enabled);
    }
}
