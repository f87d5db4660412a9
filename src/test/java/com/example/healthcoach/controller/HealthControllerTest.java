package com.example.healthcoach.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.healthcoach.llm.BackendRegistry;
import com.example.healthcoach.llm.ChatModelBackend;
import com.example.healthcoach.model.BackendId;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class HealthControllerTest {

  @Test
  void reportsConfiguredBackends() {
    BackendRegistry registry = new BackendRegistry(List.of(
        new ChatModelBackend(BackendId.REASONING, mock(ChatModel.class), true),
        new ChatModelBackend(BackendId.VALIDATION, null, false)));

    ResponseEntity<Map<String, Object>> response = new HealthController(registry).health().block();

    assertThat(response).isNotNull();
    assertThat(response.getBody()).containsEntry("status", "up");
    assertThat(response.getBody().get("backends"))
        .isEqualTo(Map.of("REASONING", true, "VALIDATION", false, "LOCAL", false));
  }
}
