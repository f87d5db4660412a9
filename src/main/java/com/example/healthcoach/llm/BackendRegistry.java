package com.example.healthcoach.llm;

import com.example.healthcoach.model.BackendId;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the configured backend for a {@link BackendId}.
 */
public class BackendRegistry {

    private final Map<BackendId, CompletionBackend> backends;

    public BackendRegistry(Collection<? extends CompletionBackend> backends) {
        Map<BackendId, CompletionBackend> map = new EnumMap<>(BackendId.class);
        for (CompletionBackend b : backends) {
            map.put(b.id(), b);
        }
        this.backends = Collections.unmodifiableMap(map);
    }

    public Optional<CompletionBackend> find(BackendId id) {
        return Optional.ofNullable(backends.get(id));
    }

    public boolean isAvailable(BackendId id) {
        return find(id).map(CompletionBackend::isAvailable).orElse(false);
    }
}
