package com.phillippitts.axiom.service.intent;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TemporalEntityEnricherTest {

    // Tuesday 2024-03-05 14:07 UTC
    private final TemporalEntityEnricher enricher = new TemporalEntityEnricher(
            Clock.fixed(Instant.parse("2024-03-05T14:07:00Z"), ZoneOffset.UTC));

    @Test
    void greetingGetsTimeOfDay() {
        assertThat(enricher.enrich("greeting", "hello")).containsEntry("time_of_day", "afternoon");
        assertThat(enricher.enrich("farewell", "bye")).containsEntry("time_of_day", "afternoon");
    }

    @Test
    void timeQueryGetsFormattedTime() {
        assertThat(enricher.enrich("time.query", "what time is it")).containsEntry("current_time", "02:07 PM");
    }

    @Test
    void dateQueryGetsDateFields() {
        assertThat(enricher.enrich("date.query", "what day is it"))
                .containsEntry("date", "2024-03-05")
                .containsEntry("weekday", "Tuesday")
                .containsEntry("formatted_date", "March 05, 2024");
    }

    @Test
    void otherIntentsGetNothing() {
        assertThat(enricher.enrich("help.request", "help")).isEmpty();
    }

    @Test
    void timeOfDayBoundaries() {
        assertThat(TemporalEntityEnricher.timeOfDay(0)).isEqualTo("morning");
        assertThat(TemporalEntityEnricher.timeOfDay(11)).isEqualTo("morning");
        assertThat(TemporalEntityEnricher.timeOfDay(12)).isEqualTo("afternoon");
        assertThat(TemporalEntityEnricher.timeOfDay(16)).isEqualTo("afternoon");
        assertThat(TemporalEntityEnricher.timeOfDay(17)).isEqualTo("evening");
    }
}
