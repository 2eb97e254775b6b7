package com.atmosight.app;

import com.atmosight.core.model.AnalysisResult;
import com.atmosight.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InsightNarrative}.
 */
class InsightNarrativeTest {

    /** Nine calm years and one spike: exactly 10% of years are extreme. */
    private static final AnalysisResult ONE_SPIKE =
            Fixtures.result(Variable.TEMPERATURE, 20, 20, 20, 20, 20, 20, 20, 20, 20, 30);

    @Test
    @DisplayName("Should describe trend, typical value and extreme share")
    void shouldRenderInsight() {
        String text = new InsightNarrative(0.15).render(ONE_SPIKE);

        assertThat(text)
                .contains("Weather Insight for Faisalabad")
                .contains("On July 05, temperature has shown an increasing pattern over 10 years (1991-2000).")
                .contains("Typical value: 21.00 °C")
                .contains("~10.0% of years")
                .contains("generally stable");
    }

    @Test
    @DisplayName("Should separate lines with a bare newline on every platform")
    void shouldUseUnixLineEndings() {
        String text = new InsightNarrative(0.15).render(ONE_SPIKE);

        assertThat(text).doesNotContain("\r");
        assertThat(text.split("\n")).hasSize(6);
    }

    @Test
    @DisplayName("Should call the day volatile above the threshold")
    void shouldFlagVolatility() {
        InsightNarrative strict = new InsightNarrative(0.05);

        assertThat(strict.isVolatile(ONE_SPIKE.getExtreme())).isTrue();
        assertThat(strict.render(ONE_SPIKE)).contains("more volatile");
        assertThat(new InsightNarrative(0.10).isVolatile(ONE_SPIKE.getExtreme())).isFalse();
    }

    @Test
    @DisplayName("Should list average, maximum and minimum")
    void shouldRenderKeyStatistics() {
        assertThat(new InsightNarrative(0.15).keyStatistics(ONE_SPIKE))
                .isEqualTo("Average: 21.00 °C | Maximum: 30.00 °C | Minimum: 20.00 °C");
    }

    @Test
    @DisplayName("Should reject a threshold outside [0, 1]")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new InsightNarrative(-0.1)).isInstanceOf(IllegalArgumentException.class);
    }
}
