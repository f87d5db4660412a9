package com.example.healthcoach.router;

import com.example.healthcoach.model.BackendId;
import com.example.healthcoach.model.QueryComplexity;
import com.example.healthcoach.model.RoutingMetadata;

import java.util.List;

/**
 * Names the backend for a request. Stateless; it never talks to a backend itself.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>sensitive → local, unconditionally</li>
 *   <li>structured output → validation</li>
 *   <li>high complexity → reasoning</li>
 *   <li>medium complexity → validation, or local in cost-constrained mode</li>
 *   <li>otherwise → local</li>
 * </ol>
 */
public class ModelRouter {

    private static final List<BackendId> PRIORITY = List.of(BackendId.REASONING, BackendId.VALIDATION, BackendId.LOCAL);

    private final boolean costConstrained;

    public ModelRouter(boolean costConstrained) {
        this.costConstrained = costConstrained;
    }

    public BackendId select(RoutingMetadata metadata) {
        if (metadata.isSensitive()) {
            return BackendId.LOCAL;
        }
        if (metadata.requiresStructuredOutput()) {
            return BackendId.VALIDATION;
        }
        if (metadata.complexity() == QueryComplexity.HIGH) {
            return BackendId.REASONING;
        }
        if (metadata.complexity() == QueryComplexity.MEDIUM) {
            return costConstrained ? BackendId.LOCAL : BackendId.VALIDATION;
        }
        return BackendId.LOCAL;
    }

    /**
     * Attempt order: the selected backend plus one retry on the next one in priority order.
     * Sensitive requests only ever get the local backend.
     */
    public List<BackendId> fallbackChain(RoutingMetadata metadata) {
        BackendId selected = select(metadata);
        if (metadata.isSensitive()) {
            return List.of(BackendId.LOCAL);
        }
        int idx = PRIORITY.indexOf(selected);
        return List.of(selected, PRIORITY.get((idx + 1) % PRIORITY.size()));
    }

    public boolean isCostConstrained() {
        return costConstrained;
    }
}
