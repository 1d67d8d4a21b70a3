package com.phillippitts.axiom.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Intent pattern table, in priority order.
 *
 * <p>Example:
 * <pre>
 * axiom.intents.min-confidence=0.1
 * axiom.intents.groups[0].name=greeting
 * axiom.intents.groups[0].patterns[0]=^(hello|hi|hey)\\b
 * axiom.intents.groups[0].keywords=hello,hi,hey
 * </pre>
 */
@ConfigurationProperties(prefix = "axiom.intents")
public class IntentProperties {

    private double minConfidence = 0.1;
    private List<Group> groups = new ArrayList<>();

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public List<Group> getGroups() {
        return groups;
    }

    public void setGroups(List<Group> groups) {
        this.groups = groups;
    }

    /**
     * Rules for one intent name.
     */
    public static class Group {
        private String name;
        private List<String> patterns = new ArrayList<>();
        private List<String> substrings = new ArrayList<>();
        private List<String> keywords = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public List<String> getSubstrings() {
            return substrings;
        }

        public void setSubstrings(List<String> substrings) {
            this.substrings = substrings;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }
    }
}
