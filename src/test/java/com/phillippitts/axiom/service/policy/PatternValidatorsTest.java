package com.phillippitts.axiom.service.policy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternValidatorsTest {

    private final SqlInjectionValidator sql = new SqlInjectionValidator();
    private final XssValidator xss = new XssValidator();
    private final PathTraversalValidator path = new PathTraversalValidator();

    @ParameterizedTest
    @ValueSource(strings = {
            "admin'--",
            "1 UNION ALL SELECT name FROM users",
            "x' OR '1'='1",
            "please drop table accounts",
            "DELETE FROM sessions",
            "exec(xp_cmdshell)"
    })
    void detectsSqlInjection(String text) {
        assertThat(sql.validate(text, Direction.INPUT)).containsKey(SqlInjectionValidator.RULE);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "what time is it",
            "I'd like to update my calendar",
            "can you select a song for me"
    })
    void ignoresOrdinaryText(String text) {
        assertThat(sql.validate(text, Direction.INPUT)).isEmpty();
        assertThat(xss.validate(text, Direction.INPUT)).isEmpty();
        assertThat(path.validate(text, Direction.INPUT)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<SCRIPT src=x>",
            "javascript:alert(1)",
            "<img src=x onerror=alert(1)>",
            "<iframe src=evil>"
    })
    void detectsXss(String text) {
        assertThat(xss.validate(text, Direction.INPUT)).containsKey(XssValidator.RULE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"../../etc/passwd", "..\\windows", "%2e%2e%2fsecret"})
    void detectsPathTraversal(String text) {
        assertThat(path.validate(text, Direction.INPUT)).containsKey(PathTraversalValidator.RULE);
    }

    @Test
    void detailNamesPatternIndexNotMatchedText() {
        String detail = xss.validate("<script>steal()</script>", Direction.INPUT).get(XssValidator.RULE);

        assertThat(detail).isEqualTo("Cross-site scripting attempt detected (pattern 1)");
    }

    @Test
    void inputOnlyPatternsSkipOutput() {
        assertThat(sql.validate("DROP TABLE users", Direction.OUTPUT)).isEmpty();
        assertThat(xss.validate("<script>", Direction.OUTPUT)).isEmpty();
    }
}
