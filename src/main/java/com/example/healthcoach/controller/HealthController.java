package com.example.healthcoach.controller;

import com.example.healthcoach.llm.BackendRegistry;
import com.example.healthcoach.model.BackendId;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Liveness plus which completion backends are configured. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final BackendRegistry backendRegistry;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "up");
        Map<String, Boolean> backends = new LinkedHashMap<>();
        for (BackendId id : BackendId.values()) {
            backends.put(id.name(), backendRegistry.isAvailable(id));
        }
        body.put("backends", backends);
        return Mono.just(ResponseEntity.ok(body));
    }
}
