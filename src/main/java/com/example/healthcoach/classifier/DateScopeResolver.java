package com.example.healthcoach.classifier;

import com.example.healthcoach.model.DateScope;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns explicit dates and relative phrases into absolute {@link DateScope}s.
 * "Today" is taken from the injected {@link Clock}, so results are reproducible in tests.
 */
public class DateScopeResolver {

    static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");

    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?"
                    + "(?:,?\\s+(\\d{4}))?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LAST_N_DAYS = Pattern.compile(
            "\\b(?:last|past|previous)\\s+(\\d{1,3})\\s+days?\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LAST_WEEKDAY = Pattern.compile(
            "\\blast\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern THIS_WEEK = Pattern.compile("\\bthis\\s+week\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LAST_WEEK = Pattern.compile("\\b(?:last|past|previous)\\s+week\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern THIS_MONTH = Pattern.compile("\\bthis\\s+month\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LAST_MONTH = Pattern.compile("\\b(?:last|previous)\\s+month\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PAST_MONTH = Pattern.compile("\\bpast\\s+month\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern YESTERDAY = Pattern.compile("\\byesterday\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TODAY = Pattern.compile("\\b(?:today|tonight|this morning)\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private final Clock clock;

    public DateScopeResolver(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Resolves the first date expression found, most specific form first. Two explicit dates
     * become an inclusive range.
     */
    public Optional<DateScope> resolve(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        LocalDate today = today();

        List<LocalDate> explicit = new ArrayList<>();
        List<String> phrases = new ArrayList<>();
        Matcher iso = ISO_DATE.matcher(text);
        while (iso.find()) {
            try {
                explicit.add(LocalDate.of(Integer.parseInt(iso.group(1)),
                        Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3))));
                phrases.add(iso.group());
            } catch (DateTimeException ignored) {
                // not a calendar date, e.g. 2026-02-31; leave unresolved
            }
        }
        Matcher md = MONTH_DAY.matcher(text);
        while (md.find()) {
            monthDay(md, today).ifPresent(d -> {
                explicit.add(d);
                phrases.add(md.group());
            });
        }
        if (!explicit.isEmpty()) {
            if (explicit.size() == 1) {
                return Optional.of(DateScope.single(explicit.get(0), phrases.get(0)));
            }
            LocalDate min = explicit.stream().min(LocalDate::compareTo).orElseThrow();
            LocalDate max = explicit.stream().max(LocalDate::compareTo).orElseThrow();
            return Optional.of(DateScope.range(min, max, String.join(" .. ", phrases)));
        }

        Matcher lastN = LAST_N_DAYS.matcher(text);
        if (lastN.find()) {
            int n = Integer.parseInt(lastN.group(1));
            if (n > 0) {
                return Optional.of(lastDays(n, lastN.group()));
            }
        }
        Matcher weekday = LAST_WEEKDAY.matcher(text);
        if (weekday.find()) {
            DayOfWeek dow = DayOfWeek.valueOf(weekday.group(1).toUpperCase(Locale.ROOT));
            return Optional.of(DateScope.single(today.with(TemporalAdjusters.previous(dow)), weekday.group()));
        }
        if (THIS_WEEK.matcher(text).find()) {
            return Optional.of(DateScope.range(today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)), today, "this week"));
        }
        if (LAST_WEEK.matcher(text).find()) {
            return Optional.of(lastDays(7, "last week"));
        }
        if (THIS_MONTH.matcher(text).find()) {
            return Optional.of(DateScope.range(today.withDayOfMonth(1), today, "this month"));
        }
        if (LAST_MONTH.matcher(text).find()) {
            YearMonth prev = YearMonth.from(today).minusMonths(1);
            return Optional.of(DateScope.range(prev.atDay(1), prev.atEndOfMonth(), "last month"));
        }
        if (PAST_MONTH.matcher(text).find()) {
            return Optional.of(lastDays(30, "past month"));
        }
        if (YESTERDAY.matcher(text).find()) {
            return Optional.of(yesterday());
        }
        if (TODAY.matcher(text).find()) {
            return Optional.of(DateScope.single(today, "today"));
        }
        return Optional.empty();
    }

    public DateScope yesterday() {
        return DateScope.single(today().minusDays(1), "yesterday");
    }

    /** The {@code n} full days before today. */
    public DateScope lastDays(int n, String phrase) {
        LocalDate today = today();
        return DateScope.range(today.minusDays(n), today.minusDays(1), phrase);
    }

    private static Optional<LocalDate> monthDay(Matcher m, LocalDate today) {
        String key = m.group(1).toLowerCase(Locale.ROOT);
        Integer month = MONTHS.get(key.substring(0, 3));
        if (month == null) {
            return Optional.empty();
        }
        int day = Integer.parseInt(m.group(2));
        try {
            if (m.group(3) != null) {
                return Optional.of(LocalDate.of(Integer.parseInt(m.group(3)), month, day));
            }
            LocalDate candidate = LocalDate.of(today.getYear(), month, day);
            // a month-day without a year refers to the most recent occurrence
            return Optional.of(candidate.isAfter(today) ? candidate.minusYears(1) : candidate);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
