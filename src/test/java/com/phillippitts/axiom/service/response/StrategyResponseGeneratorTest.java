package com.phillippitts.axiom.service.response;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.domain.SessionContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyResponseGeneratorTest {

    private final ResponseStrategy dedicated = (intent, ctx) -> new GeneratedResponse("routed", intent.name(), "dedicated", -1);
    private final ResponseStrategy fallback = (intent, ctx) -> new GeneratedResponse("default", intent.name(), "default", 0);

    @Test
    void routesByIntentName() {
        StrategyResponseGenerator generator = new StrategyResponseGenerator(Map.of("help.request", dedicated), fallback);
        SessionContext context = new SessionContext("s1", 5);

        assertThat(generator.generate(Intent.of("help.request", 1.0), context).text()).isEqualTo("routed");
        assertThat(generator.generate(Intent.of("greeting", 1.0), context).text()).isEqualTo("default");
    }
}
