package com.phillippitts.axiom.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response templates and backend routing.
 *
 * <p>Intent names containing dots need bracket notation:
 * {@code axiom.responses.templates[time.query][0]=It's {current_time}.}
 */
@ConfigurationProperties(prefix = "axiom.responses")
public class ResponseProperties {

    private Map<String, List<String>> templates = new LinkedHashMap<>();

    /**
     * Intents answered by the generation backend instead of templates.
     */
    private List<String> backendIntents = new ArrayList<>();

    /**
     * Committed turns included in backend prompts.
     */
    private int backendHistoryTurns = 4;

    public Map<String, List<String>> getTemplates() {
        return templates;
    }

    public void setTemplates(Map<String, List<String>> templates) {
        this.templates = templates;
    }

    public List<String> getBackendIntents() {
        return backendIntents;
    }

    public void setBackendIntents(List<String> backendIntents) {
        this.backendIntents = backendIntents;
    }

    public int getBackendHistoryTurns() {
        return backendHistoryTurns;
    }

    public void setBackendHistoryTurns(int backendHistoryTurns) {
        this.backendHistoryTurns = backendHistoryTurns;
    }
}
