package com.phillippitts.axiom.service.intent;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IntentMatchersTest {

    @Test
    void positionalConfidenceDiscountsLateMatches() {
        assertThat(RuleMatch.positional(0, 5, 5, Map.of()).confidence()).isEqualTo(1.0);
        assertThat(RuleMatch.positional(0, 5, 10, Map.of()).confidence()).isEqualTo(0.5);
        assertThat(RuleMatch.positional(5, 10, 10, Map.of()).confidence()).isCloseTo(0.4, within(1e-9));
        assertThat(RuleMatch.positional(0, 0, 0, Map.of()).confidence()).isZero();
    }

    @Test
    void regexCapturesNamedGroups() {
        RegexMatcher matcher = new RegexMatcher("(notify|tell) (my )?(?<role>nurse|doctor)");

        RuleMatch match = matcher.match("please tell my doctor").orElseThrow();

        assertThat(match.entities()).containsExactly(Map.entry("role", "doctor"));
        assertThat(match.confidence()).isLessThan(1.0);
    }

    @Test
    void regexIgnoresEmptyMatches() {
        assertThat(new RegexMatcher("x*").match("abc")).isEmpty();
    }

    @Test
    void substringIsCaseInsensitiveOnPhrase() {
        assertThat(new SubstringMatcher("What Time").match("what time is it")).isPresent();
        assertThat(new SubstringMatcher("what time").match("when is it")).isEmpty();
        assertThatThrownBy(() -> new SubstringMatcher(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keywordConfidenceIsShareOfWords() {
        KeywordMatcher matcher = new KeywordMatcher(List.of("help", "assist"));

        assertThat(matcher.match("help me").orElseThrow().confidence()).isEqualTo(0.5);
        assertThat(matcher.match("helpful things")).isEmpty();
        assertThat(matcher.match("!!!")).isEmpty();
    }

    @Test
    void patternGroupNeedsMatchers() {
        assertThatThrownBy(() -> new IntentPatternGroup("empty", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntentPatternGroup.of(" ", new SubstringMatcher("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
