package com.example.healthcoach.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.request.AskRequest;
import com.example.healthcoach.request.ScenarioRunRequest;
import com.example.healthcoach.response.ErrorResponse;
import com.example.healthcoach.service.HealthCoachService;
import com.example.healthcoach.validation.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

class CoachControllerTest {

  private final HealthCoachService service = mock(HealthCoachService.class);
  private final CoachController controller = new CoachController(service,
      Clock.fixed(Instant.parse("2026-01-10T08:00:00Z"), ZoneOffset.UTC));

  @Test
  void askReturnsValidationErrors() {
    AskRequest request = new AskRequest().setQuery("   ").setSessionId("s1");
    when(service.answerQuery("   ", "s1"))
        .thenReturn(Mono.error(new ValidationException("User input must not be blank.")));

    ResponseEntity<?> response = controller.ask(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(((ErrorResponse) response.getBody()).errors())
        .containsExactly("User input must not be blank.");
  }

  @Test
  void askHidesUnexpectedErrors() {
    AskRequest request = new AskRequest().setQuery("question").setSessionId("s1");
    when(service.answerQuery("question", "s1")).thenReturn(Mono.error(new IllegalStateException("boom")));

    ResponseEntity<?> response = controller.ask(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(((ErrorResponse) response.getBody()).errors()).containsExactly("Unexpected error occurred.");
  }

  @Test
  void jobsDefaultToClockDate() {
    when(service.scanAlerts(LocalDate.of(2026, 1, 10))).thenReturn(Mono.just(List.of()));
    when(service.weeklyReport(LocalDate.of(2026, 1, 9))).thenReturn(Mono.empty());

    assertThat(controller.scanAlerts(null).block()).isEmpty();
    controller.weeklyReport(null).block();

    verify(service).scanAlerts(LocalDate.of(2026, 1, 10));
    verify(service).weeklyReport(LocalDate.of(2026, 1, 9));
  }

  @Test
  void refreshProfileReturnsNoContent() {
    ResponseEntity<Void> response = controller.refreshProfile().block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(204);
    verify(service).refreshProfile();
  }

  @Test
  void compareScenariosRejectsEmptyList() {
    ResponseEntity<?> response = controller.compareScenarios(List.of()).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(((ErrorResponse) response.getBody()).errors())
        .containsExactly("At least one scenario is required.");
    verify(service, never()).compareScenarios(any());
  }

  @Test
  void compareScenariosReturnsResultsInRequestOrder() {
    List<ScenarioRunRequest> scenarios = List.of(
        new ScenarioRunRequest().setVo2Delta(3.0),
        new ScenarioRunRequest().setSleepDelta(1.0).setStepsDelta(2000.0));
    List<ScenarioResult> results = List.of(
        ScenarioResult.builder().systolicChange(-4.2).build(),
        ScenarioResult.builder().systolicChange(-1.5).build());
    when(service.compareScenarios(scenarios)).thenReturn(Mono.just(results));

    ResponseEntity<?> response = controller.compareScenarios(scenarios).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody()).isEqualTo(results);
    verify(service).compareScenarios(scenarios);
  }
}
