package com.phillippitts.axiom.service.policy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleValidatorsTest {

    @Test
    void lengthUsesLimitOfDirection() {
        LengthValidator validator = new LengthValidator(5, 3);

        assertThat(validator.validate("abcde", Direction.INPUT)).isEmpty();
        assertThat(validator.validate("abcdef", Direction.INPUT))
                .containsEntry(LengthValidator.RULE, "length 6 exceeds limit 5");
        assertThat(validator.validate("abcd", Direction.OUTPUT))
                .containsEntry(LengthValidator.RULE, "length 4 exceeds limit 3");
    }

    @Test
    void lengthRejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new LengthValidator(0, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void contentFilterMatchesWholeWordsCaseInsensitively() {
        ContentFilterValidator validator = new ContentFilterValidator(List.of("darn", "Heck", " "));

        assertThat(validator.validate("well DARN it", Direction.OUTPUT))
                .containsEntry(ContentFilterValidator.RULE, "1 blocked term(s) found in output");
        assertThat(validator.validate("darn and heck", Direction.INPUT))
                .containsEntry(ContentFilterValidator.RULE, "2 blocked term(s) found in input");
        assertThat(validator.validate("darned socks", Direction.INPUT)).isEmpty();
    }

    @Test
    void characterSetAllowsWhitespaceControls() {
        CharacterSetValidator validator = new CharacterSetValidator();

        assertThat(validator.validate("line one\nline\ttwo\r\n", Direction.INPUT)).isEmpty();
        assertThat(validator.validate("bell\u0007null\u0000", Direction.INPUT))
                .containsEntry(CharacterSetValidator.RULE, "2 control character(s) not allowed");
        assertThat(validator.validate("bell\u0007", Direction.OUTPUT)).isEmpty();
    }
}
