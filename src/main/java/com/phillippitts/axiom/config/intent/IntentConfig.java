package com.phillippitts.axiom.config.intent;

import com.phillippitts.axiom.config.properties.IntentProperties;
import com.phillippitts.axiom.service.intent.IntentDetector;
import com.phillippitts.axiom.service.intent.IntentMatcher;
import com.phillippitts.axiom.service.intent.IntentPatternGroup;
import com.phillippitts.axiom.service.intent.KeywordMatcher;
import com.phillippitts.axiom.service.intent.RegexMatcher;
import com.phillippitts.axiom.service.intent.RuleBasedIntentDetector;
import com.phillippitts.axiom.service.intent.SubstringMatcher;
import com.phillippitts.axiom.service.intent.TemporalEntityEnricher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the {@code axiom.intents.groups} table into a {@link RuleBasedIntentDetector}.
 * Group order is tie-break order.
 */
@Configuration
public class IntentConfig {

    private static final Logger LOG = LogManager.getLogger(IntentConfig.class);

    @Bean
    public IntentDetector intentDetector(IntentProperties properties, Clock clock) {
        List<IntentPatternGroup> groups = new ArrayList<>();
        for (IntentProperties.Group group : properties.getGroups()) {
            groups.add(toPatternGroup(group));
        }
        if (groups.isEmpty()) {
            LOG.warn("No intent groups configured; every input will resolve to the fallback intent");
        } else {
            LOG.info("Intent detector configured with {} groups (min confidence {})",
                    groups.size(), properties.getMinConfidence());
        }
        return new RuleBasedIntentDetector(groups, properties.getMinConfidence(), new TemporalEntityEnricher(clock));
    }

    static IntentPatternGroup toPatternGroup(IntentProperties.Group group) {
        if (group.getName() == null || group.getName().isBlank()) {
            throw new IllegalStateException("axiom.intents.groups entries need a name");
        }
        List<IntentMatcher> matchers = new ArrayList<>();
        group.getPatterns().forEach(p -> matchers.add(new RegexMatcher(p)));
        group.getSubstrings().forEach(s -> matchers.add(new SubstringMatcher(s)));
        if (!group.getKeywords().isEmpty()) {
            matchers.add(new KeywordMatcher(group.getKeywords()));
        }
        if (matchers.isEmpty()) {
            throw new IllegalStateException("Intent group '" + group.getName()
                    + "' needs at least one pattern, substring or keyword");
        }
        return new IntentPatternGroup(group.getName(), matchers);
    }
}
