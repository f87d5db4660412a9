package com.example.healthcoach.service;

import com.example.healthcoach.config.CoachProperties;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.model.UserProfile;
import com.example.healthcoach.scenario.ScenarioEngine;
import com.example.healthcoach.scenario.ScenarioParser;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the configured trial count, seed, horizon and diastolic mode around the
 * {@link ScenarioEngine}.
 */
@Slf4j
public class ScenarioService {

    private final ScenarioEngine engine;
    private final ScenarioParser parser;
    private final CoachProperties.Scenario props;

    public ScenarioService(ScenarioEngine engine, ScenarioParser parser, CoachProperties.Scenario props) {
        this.engine = engine;
        this.parser = parser;
        this.props = props;
    }

    public ScenarioRequest requestFor(Map<LifestyleFactor, ScenarioParser.Change> changes, UserProfile profile) {
        return parser.toRequest(changes, profile, props.getHorizonDays(), diastolicRatio(profile));
    }

    /** Explicit deltas, e.g. from the scenario endpoint. Null deltas are skipped. */
    public ScenarioRequest requestFor(Double vo2Delta, Double sleepDelta, Double stepsDelta, UserProfile profile) {
        Map<LifestyleFactor, Double> deltas = new EnumMap<>(LifestyleFactor.class);
        if (vo2Delta != null) deltas.put(LifestyleFactor.VO2_MAX, vo2Delta);
        if (sleepDelta != null) deltas.put(LifestyleFactor.SLEEP_HOURS, sleepDelta);
        if (stepsDelta != null) deltas.put(LifestyleFactor.STEPS, stepsDelta);
        return new ScenarioRequest(
                ScenarioParser.baselineSystolic(profile),
                profile == null ? null : profile.baseline(HealthMetric.DIASTOLIC).orElse(null),
                deltas,
                props.getHorizonDays(),
                diastolicRatio(profile));
    }

    public ScenarioResult predict(ScenarioRequest request) {
        ScenarioResult result = engine.predict(request, props.getTrials(), props.getSeed());
        log.debug("Scenario {} -> {} mmHg ({})", request.deltas(), result.getSystolicChange(), result.getFeasibility());
        return result;
    }

    public List<ScenarioResult> compare(List<ScenarioRequest> requests) {
        return engine.compare(requests, props.getTrials(), props.getSeed());
    }

    Double diastolicRatio(UserProfile profile) {
        if (props.getDiastolicMode() == CoachProperties.DiastolicMode.PROFILE && profile != null) {
            Double sys = profile.baseline(HealthMetric.SYSTOLIC).orElse(null);
            Double dia = profile.baseline(HealthMetric.DIASTOLIC).orElse(null);
            if (sys != null && dia != null && sys > 0) {
                return dia / sys;
            }
        }
        return props.getDiastolicRatio();
    }
}
