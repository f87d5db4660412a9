package com.example.healthcoach.scenario;

import com.example.healthcoach.model.LifestyleFactor;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.util.HealthFormat;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Plain-text renderings of a {@link ScenarioResult}: a fact sheet for prompts and a short
 * narrative used when no backend can narrate the result.
 */
public final class ScenarioNarrator {

    private ScenarioNarrator() {}

    public static String factSheet(ScenarioResult r) {
        StringBuilder sb = new StringBuilder();
        ScenarioRequest req = r.getRequest();
        sb.append("Changes: ").append(changes(req)).append('\n');
        sb.append("Current systolic: ").append(HealthFormat.num1(req.baselineSystolic())).append(" mmHg\n");
        sb.append("Expected systolic change: ").append(signed(r.getSystolicChange())).append(" mmHg\n");
        sb.append("Predicted systolic: ").append(HealthFormat.num1(r.getPredictedSystolic())).append(" mmHg\n");
        if (r.getPredictedDiastolic() != null) {
            sb.append("Predicted diastolic: ").append(HealthFormat.num1(r.getPredictedDiastolic()))
                    .append(" mmHg (change ").append(signed(r.getDiastolicChange())).append(" mmHg)\n");
        }
        sb.append("95% interval of systolic change: ")
                .append(signed(round1(r.getSystolicChangeInterval().lower()))).append(" to ")
                .append(signed(round1(r.getSystolicChangeInterval().upper()))).append(" mmHg\n");
        sb.append("Feasibility: ").append(r.getFeasibility());
        if (!r.getFeasibilityByFactor().isEmpty()) {
            StringJoiner per = new StringJoiner(", ", " (", ")");
            r.getFeasibilityByFactor().forEach((f, t) -> per.add(f.label() + " " + t));
            sb.append(per);
        }
        sb.append('\n');
        sb.append("Timeline: about ").append(r.getTimeline().totalWeeks()).append(" weeks (")
                .append(r.getTimeline().lagDays()).append(" days before effects show)\n");
        if (!r.getRecommendations().isEmpty()) {
            sb.append("Recommendations:\n");
            r.getRecommendations().forEach(rec -> sb.append("- ").append(rec).append('\n'));
        }
        return sb.toString().strip();
    }

    public static String narrative(ScenarioResult r) {
        ScenarioRequest req = r.getRequest();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT,
                "If you %s, your systolic BP would be expected to change by %s mmHg, from %s to about %s mmHg",
                changes(req), signed(r.getSystolicChange()),
                HealthFormat.num1(req.baselineSystolic()), HealthFormat.num1(r.getPredictedSystolic())));
        if (r.getPredictedDiastolic() != null) {
            sb.append(String.format(Locale.ROOT, " (diastolic about %s mmHg)",
                    HealthFormat.num1(r.getPredictedDiastolic())));
        }
        sb.append(String.format(Locale.ROOT, ". The 95%% range for the change is %s to %s mmHg. ",
                signed(round1(r.getSystolicChangeInterval().lower())),
                signed(round1(r.getSystolicChangeInterval().upper()))));
        sb.append(String.format(Locale.ROOT, "Feasibility over %d days is %s and the full effect would take about %d weeks.",
                req.horizonDays(), r.getFeasibility(), r.getTimeline().totalWeeks()));
        if (!r.getRecommendations().isEmpty()) {
            sb.append("\n\nTo get there:");
            r.getRecommendations().forEach(rec -> sb.append("\n- ").append(rec));
        }
        return sb.toString();
    }

    static String changes(ScenarioRequest req) {
        StringJoiner joiner = new StringJoiner(" and ");
        for (LifestyleFactor f : LifestyleFactor.values()) {
            double d = req.delta(f);
            if (d == 0.0) {
                continue;
            }
            joiner.add((d > 0 ? "raise " : "lower ") + f.label().toLowerCase(Locale.ROOT)
                    + " by " + HealthFormat.num(Math.abs(d)) + " " + f.unit());
        }
        return joiner.length() == 0 ? "keep your habits unchanged" : joiner.toString();
    }

    private static String signed(double v) {
        return (v > 0 ? "+" : "") + HealthFormat.num1(v);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
