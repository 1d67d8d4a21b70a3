package com.phillippitts.axiom.service.intent;

import com.phillippitts.axiom.domain.Intent;
import com.phillippitts.axiom.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link IntentDetector} driven by an ordered table of {@link IntentPatternGroup}s.
 *
 * <p><b>Scoring:</b> each group scores the best confidence among its matchers. Groups at or
 * above {@code minConfidence} are returned by descending confidence; equal confidences keep
 * registration order. Entities come from the winning rule plus the {@link EntityEnricher};
 * values captured from the text win over enriched ones.
 *
 * <p><b>Failure handling:</b> a matcher that throws is logged and treated as no match.
 * Unmatched or empty text yields {@link Intent#fallback()}.
 *
 * <p>The table is usually built once at startup from configuration; {@link #addGroup}
 * appends at the lowest tie-break priority.
 */
public class RuleBasedIntentDetector implements IntentDetector {

    private static final Logger LOG = LogManager.getLogger(RuleBasedIntentDetector.class);

    private final List<IntentPatternGroup> groups = new CopyOnWriteArrayList<>();
    private final double minConfidence;
    private final EntityEnricher enricher;

    public RuleBasedIntentDetector(List<IntentPatternGroup> groups, double minConfidence, EntityEnricher enricher) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0, got: " + minConfidence);
        }
        this.minConfidence = minConfidence;
        this.enricher = Objects.requireNonNull(enricher, "enricher must not be null");
        groups.forEach(this::addGroup);
    }

    public RuleBasedIntentDetector(List<IntentPatternGroup> groups, double minConfidence) {
        this(groups, minConfidence, EntityEnricher.NONE);
    }

    public void addGroup(IntentPatternGroup group) {
        Objects.requireNonNull(group, "group must not be null");
        boolean duplicate = groups.stream().anyMatch(g -> g.intentName().equals(group.intentName()));
        if (duplicate) {
            throw new IllegalArgumentException("Duplicate intent pattern group: " + group.intentName());
        }
        groups.add(group);
    }

    public List<String> supportedIntents() {
        return groups.stream().map(IntentPatternGroup::intentName).toList();
    }

    @Override
    public List<Intent> detect(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return List.of(Intent.fallback());
        }
        List<Intent> candidates = new ArrayList<>();
        for (IntentPatternGroup group : groups) {
            bestMatch(group, normalizedText)
                    .filter(m -> m.confidence() > 0.0 && m.confidence() >= minConfidence)
                    .map(m -> toIntent(group.intentName(), m, normalizedText))
                    .ifPresent(candidates::add);
        }
        if (candidates.isEmpty()) {
            LOG.debug("No intent above {} for '{}'", minConfidence, LogSanitizer.preview(normalizedText));
            return List.of(Intent.fallback());
        }
        // List.sort is stable: equal confidences keep registration order
        candidates.sort(Comparator.comparingDouble(Intent::confidence).reversed());
        return List.copyOf(candidates);
    }

    private Optional<RuleMatch> bestMatch(IntentPatternGroup group, String text) {
        RuleMatch best = null;
        for (IntentMatcher matcher : group.matchers()) {
            Optional<RuleMatch> match;
            try {
                match = matcher.match(text);
            } catch (RuntimeException e) {
                LOG.warn("Matcher {} of intent '{}' failed; treating as no match", matcher, group.intentName(), e);
                continue;
            }
            if (match != null && match.isPresent()
                    && (best == null || match.get().confidence() > best.confidence())) {
                best = match.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private Intent toIntent(String name, RuleMatch match, String text) {
        Map<String, String> entities = new LinkedHashMap<>();
        try {
            entities.putAll(enricher.enrich(name, text));
        } catch (RuntimeException e) {
            LOG.warn("Entity enrichment failed for intent '{}'", name, e);
        }
        entities.putAll(match.entities());
        return new Intent(name, match.confidence(), entities);
    }
}
