package com.example.healthcoach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "coach.vector")
public class VectorStoreProperties {

    public enum StoreType { PGVECTOR, IN_MEMORY }

    private StoreType store = StoreType.PGVECTOR;
    private String host = "localhost";
    private int port = 5432;
    private String database = "health_coach";
    private String user;
    private String password;
    private String table = "daily_summaries";
    private int dimension = 384;

    /** OpenAI key for embeddings; the local MiniLM model is used when blank. */
    private String openAiApiKey;
    private String openAiEmbeddingModel = "text-embedding-3-small";
}
