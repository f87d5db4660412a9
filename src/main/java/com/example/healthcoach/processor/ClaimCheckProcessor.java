package com.example.healthcoach.processor;

import com.example.healthcoach.model.Citation;
import com.example.healthcoach.model.QueryContext;
import com.example.healthcoach.model.QueryState;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Lowers confidence for every date or BP figure the evidence does not back. The reply text is
 * left untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimCheckProcessor implements QueryProcessor {

    private static final String NAME = "claim-check";

    static final double PENALTY_PER_CLAIM = 0.15;
    static final double MIN_CONFIDENCE = 0.1;

    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<QueryContext> process(QueryContext ctx) {
        ctx.enter(QueryState.POSTPROCESS);
        int year = ctx.getClassified().scope()
                .map(s -> s.end().getYear())
                .orElseGet(() -> LocalDate.now(clock).getYear());
        List<Citation> citations = ClaimChecker.check(ctx.getAnswer(), ctx.getBundle(), ctx.getScenario(), year);
        long unsupported = ClaimChecker.unsupported(citations);
        ctx.setCitations(citations);
        ctx.setConfidence(penalize(ctx.getConfidence(), unsupported));
        if (unsupported > 0) {
            log.info("[{}] session={} unsupported claims={}", NAME, ctx.getSessionId(), unsupported);
        }
        return Mono.just(ctx.addStep(NAME, "claims=" + citations.size() + ", unsupported=" + unsupported
                + ", confidence=" + ctx.getConfidence()));
    }

    static double penalize(double confidence, long unsupported) {
        double lowered = confidence - PENALTY_PER_CLAIM * unsupported;
        return Math.max(MIN_CONFIDENCE, Math.round(lowered * 100.0) / 100.0);
    }
}
