package com.example.healthcoach;

import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class HealthCoachApplicationTests {

    @MockBean
    EmbeddingModel embeddingModel;

    @Test
    void contextLoads() {
    }
}
