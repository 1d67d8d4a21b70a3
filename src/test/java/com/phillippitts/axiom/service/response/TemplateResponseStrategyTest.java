package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;
import com.phillippitts.axiom.service.context.ContextSlots;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateResponseStrategyTest {

    private TemplateResponseStrategy strategy;
    private SessionContext context;

    @BeforeEach
    void setUp() {
        strategy = new TemplateResponseStrategy(Map.of(
                "greeting", List.of("Good {time_of_day}!", "Hello there!", "Hi!"),
                "time.query", List.of("It is {current_time}."),
                Intent.FALLBACK, List.of("Sorry, I did not get that.", "Could you rephrase?")));
        context = new SessionContext("s1", 5);
    }

    @Test
    void picksLowestRenderableVariant() {
        GeneratedResponse response = strategy.respond(
                new Intent("greeting", 1.0, Map.of("time_of_day", "morning")), context);

        assertThat(response.text()).isEqualTo("Good morning!");
        assertThat(response.variantIndex()).isZero();
        assertThat(response.strategy()).isEqualTo(TemplateResponseStrategy.NAME);
    }

    @Test
    void skipsVariantUsedLastTime() {
        context.putSlot(ContextSlots.lastVariant("greeting"), 0);

        GeneratedResponse response = strategy.respond(
                new Intent("greeting", 1.0, Map.of("time_of_day", "morning")), context);

        assertThat(response.text()).isEqualTo("Hello there!");
        assertThat(response.variantIndex()).isEqualTo(1);
    }

    @Test
    void skipsVariantsWithMissingEntities() {
        GeneratedResponse response = strategy.respond(Intent.of("greeting", 1.0), context);

        assertThat(response.text()).isEqualTo("Hello there!");
    }

    @Test
    void singleVariantMayRepeat() {
        context.putSlot(ContextSlots.lastVariant("time.query"), 0);

        GeneratedResponse response = strategy.respond(
                new Intent("time.query", 1.0, Map.of("current_time", "09:30 AM")), context);

        assertThat(response.text()).isEqualTo("It is 09:30 AM.");
    }

    @Test
    void unrenderableIntentFallsBack() {
        GeneratedResponse response = strategy.respond(Intent.of("time.query", 1.0), context);

        assertThat(response.intentName()).isEqualTo(Intent.FALLBACK);
        assertThat(response.text()).isEqualTo("Sorry, I did not get that.");
    }

    @Test
    void unknownIntentFallsBackWithoutRepeating() {
        context.putSlot(ContextSlots.lastVariant(Intent.FALLBACK), 0);

        GeneratedResponse response = strategy.respond(Intent.of("weather.query", 0.9), context);

        assertThat(response.text()).isEqualTo("Could you rephrase?");
    }

    @Test
    void doesNotModifyContext() {
        strategy.respond(Intent.of("greeting", 1.0), context);

        assertThat(context.slots()).isEmpty();
    }

    @Test
    void renderFillsPlaceholdersLiterally() {
        assertThat(TemplateResponseStrategy.render("Paging {role} now", Map.of("role", "$nurse")))
                .contains("Paging $nurse now");
        assertThat(TemplateResponseStrategy.render("Paging {role} now", Map.of())).isEmpty();
    }

    @Test
    void requiresPlainFallbackTemplate() {
        assertThatThrownBy(() -> new TemplateResponseStrategy(Map.of("greeting", List.of("Hi"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TemplateResponseStrategy(Map.of(Intent.FALLBACK, List.of("{x}"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
