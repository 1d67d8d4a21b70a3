package com.phillippitts.axiom.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    void trimsCollapsesAndLowerCases() {
        assertThat(TextNormalizer.normalize("  Hello \t  THERE\n")).isEqualTo("hello there");
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }
}
