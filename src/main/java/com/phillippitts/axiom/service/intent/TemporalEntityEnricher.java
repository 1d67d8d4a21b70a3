package com.phillippitts.axiom.service.intent;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies clock-derived entities for the built-in intents:
 * {@code time_of_day} for greetings and farewells, {@code current_time} for time queries and
 * {@code date}, {@code weekday}, {@code formatted_date} for date queries.
 *
 * <p>Reads time only from the injected {@link Clock}, so tests can pin it.
 */
public class TemporalEntityEnricher implements EntityEnricher {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);
    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    private final Clock clock;

    public TemporalEntityEnricher(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Map<String, String> enrich(String intentName, String normalizedText) {
        LocalDateTime now = LocalDateTime.now(clock);
        return switch (intentName) {
            case "greeting", "farewell" -> Map.of("time_of_day", timeOfDay(now.getHour()));
            case "time.query" -> Map.of("current_time", TIME.format(now));
            case "date.query" -> Map.of(
                    "date", now.toLocalDate().toString(),
                    "weekday", now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                    "formatted_date", LONG_DATE.format(now));
            default -> Map.of();
        };
    }

    static String timeOfDay(int hour) {
        if (hour < 12) {
            return "morning";
        }
        return hour < 17 ? "afternoon" : "evening";
    }
}
