package com.example.healthcoach.processor;

import com.example.healthcoach.model.Citation;
import com.example.healthcoach.model.ContextBundle;
import com.example.healthcoach.model.DailyHealthRecord;
import com.example.healthcoach.model.HealthMetric;
import com.example.healthcoach.model.ScenarioRequest;
import com.example.healthcoach.model.ScenarioResult;
import com.example.healthcoach.model.SimilarDay;
import com.example.healthcoach.model.UserProfile;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds dates and mmHg figures in a reply and checks them against the evidence the reply was
 * generated from. Figures match within {@link #TOLERANCE}; changes are compared by magnitude.
 */
public final class ClaimChecker {

    static final double TOLERANCE = 0.5;

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?|"
                    + "sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?"
                    + "(?:,?\\s+(\\d{4}))?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MMHG = Pattern.compile(
            "(?<![\\d.])(\\d{1,3}(?:\\.\\d+)?)(?:\\s*/\\s*(\\d{2,3}(?:\\.\\d+)?))?\\s*mm\\s?hg",
            Pattern.CASE_INSENSITIVE);

    private ClaimChecker() {}

    /**
     * @param referenceYear year for month-day dates that match no evidence date
     */
    public static List<Citation> check(String answer, ContextBundle bundle, ScenarioResult scenario, int referenceYear) {
        List<Citation> out = new ArrayList<>();
        if (answer == null || answer.isBlank()) {
            return out;
        }
        ContextBundle evidence = bundle == null ? ContextBundle.builder().build() : bundle;
        Set<LocalDate> known = evidence.knownDates();
        Set<String> seen = new LinkedHashSet<>();

        Matcher iso = ISO_DATE.matcher(answer);
        while (iso.find()) {
            LocalDate date = parseDate(iso.group(1), iso.group(2), iso.group(3));
            if (date != null && seen.add(iso.group())) {
                out.add(new Citation(iso.group(), date, known.contains(date)));
            }
        }

        Matcher md = MONTH_DAY.matcher(answer);
        while (md.find()) {
            if (!seen.add(md.group().toLowerCase(Locale.ROOT))) {
                continue;
            }
            Month month = month(md.group(1));
            int day = Integer.parseInt(md.group(2));
            if (month == null || day < 1 || day > 31) {
                continue;
            }
            LocalDate match = null;
            if (md.group(3) != null) {
                LocalDate explicit = parseDate(md.group(3), String.valueOf(month.getValue()), md.group(2));
                if (explicit != null && known.contains(explicit)) {
                    match = explicit;
                }
            } else {
                match = known.stream()
                        .filter(d -> d.getMonth() == month && d.getDayOfMonth() == day)
                        .findFirst()
                        .orElse(null);
            }
            if (match != null) {
                out.add(new Citation(md.group(), match, true));
            } else {
                int year = md.group(3) != null ? Integer.parseInt(md.group(3)) : referenceYear;
                out.add(new Citation(md.group(), parseDate(String.valueOf(year),
                        String.valueOf(month.getValue()), md.group(2)), false));
            }
        }

        List<Double> values = evidenceValues(evidence, scenario);
        Matcher mm = MMHG.matcher(answer);
        while (mm.find()) {
            if (!seen.add(mm.group())) {
                continue;
            }
            boolean supported = matches(values, Double.parseDouble(mm.group(1)))
                    && (mm.group(2) == null || matches(values, Double.parseDouble(mm.group(2))));
            out.add(new Citation(mm.group(), null, supported));
        }
        return out;
    }

    public static long unsupported(List<Citation> citations) {
        return citations.stream().filter(c -> !c.supported()).count();
    }

    static List<Double> evidenceValues(ContextBundle bundle, ScenarioResult scenario) {
        List<Double> values = new ArrayList<>();
        for (DailyHealthRecord r : bundle.allRecords()) {
            r.value(HealthMetric.SYSTOLIC).ifPresent(values::add);
            r.value(HealthMetric.DIASTOLIC).ifPresent(values::add);
        }
        for (SimilarDay d : bundle.getSimilarDays()) {
            if (d.summary() == null) {
                continue;
            }
            Matcher m = MMHG.matcher(d.summary());
            while (m.find()) {
                values.add(Double.parseDouble(m.group(1)));
                if (m.group(2) != null) {
                    values.add(Double.parseDouble(m.group(2)));
                }
            }
        }
        UserProfile profile = bundle.getProfile();
        if (profile != null) {
            profile.baseline(HealthMetric.SYSTOLIC).ifPresent(values::add);
            profile.baseline(HealthMetric.DIASTOLIC).ifPresent(values::add);
            profile.goal(HealthMetric.SYSTOLIC).ifPresent(values::add);
            profile.goal(HealthMetric.DIASTOLIC).ifPresent(values::add);
        }
        if (scenario != null) {
            ScenarioRequest req = scenario.getRequest();
            values.add(req.baselineSystolic());
            if (req.baselineDiastolic() != null) {
                values.add(req.baselineDiastolic());
            }
            values.add(Math.abs(scenario.getSystolicChange()));
            values.add(Math.abs(scenario.getDiastolicChange()));
            values.add(scenario.getPredictedSystolic());
            if (scenario.getPredictedDiastolic() != null) {
                values.add(scenario.getPredictedDiastolic());
            }
            values.add(Math.abs(scenario.getSystolicChangeInterval().lower()));
            values.add(Math.abs(scenario.getSystolicChangeInterval().upper()));
        }
        return values;
    }

    private static boolean matches(List<Double> values, double claimed) {
        for (double v : values) {
            if (Math.abs(v - claimed) <= TOLERANCE) {
                return true;
            }
        }
        return false;
    }

    private static Month month(String token) {
        String t = token.toLowerCase(Locale.ROOT);
        for (Month m : Month.values()) {
            if (m.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT).startsWith(t.substring(0, 3))) {
                return m;
            }
        }
        return null;
    }

    private static LocalDate parseDate(String y, String m, String d) {
        try {
            return LocalDate.of(Integer.parseInt(y), Integer.parseInt(m), Integer.parseInt(d));
        } catch (DateTimeException | NumberFormatException e) {
            return null;
        }
    }
}
