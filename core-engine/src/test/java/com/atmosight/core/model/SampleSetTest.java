package com.atmosight.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SampleSet}.
 */
class SampleSetTest {

    @Test
    @DisplayName("Should sort samples by year")
    void shouldSortByYear() {
        SampleSet set = new SampleSet(Variable.TEMPERATURE, List.of(
                ClimatologicalSample.of(2003, 3.0),
                ClimatologicalSample.of(2001, 1.0),
                ClimatologicalSample.of(2002, 2.0)));

        assertThat(set.years()).containsExactly(2001, 2002, 2003);
        assertThat(set.values()).containsExactly(1.0, 2.0, 3.0);
        assertThat(set.firstYear()).isEqualTo(2001);
        assertThat(set.lastYear()).isEqualTo(2003);
    }

    @Test
    @DisplayName("Fingerprint should ignore input order but not values")
    void fingerprintShouldTrackContent() {
        SampleSet a = new SampleSet(Variable.TEMPERATURE, List.of(
                ClimatologicalSample.of(2001, 1.0), ClimatologicalSample.of(2002, 2.0)));
        SampleSet b = new SampleSet(Variable.TEMPERATURE, List.of(
                ClimatologicalSample.of(2002, 2.0), ClimatologicalSample.of(2001, 1.0)));
        SampleSet changed = new SampleSet(Variable.TEMPERATURE, List.of(
                ClimatologicalSample.of(2001, 1.0), ClimatologicalSample.of(2002, 2.5)));
        SampleSet otherVariable = new SampleSet(Variable.PRECIPITATION, List.of(
                ClimatologicalSample.of(2001, 1.0), ClimatologicalSample.of(2002, 2.0)));

        assertThat(b).isEqualTo(a);
        assertThat(b.getFingerprint()).isEqualTo(a.getFingerprint()).hasSize(64);
        assertThat(changed.sameSamplesAs(a.getFingerprint())).isFalse();
        assertThat(otherVariable.sameSamplesAs(a.getFingerprint())).isFalse();
    }

    @Test
    @DisplayName("Should reject an empty list and repeated years")
    void shouldRejectInvalidSamples() {
        assertThatThrownBy(() -> new SampleSet(Variable.TEMPERATURE, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SampleSet(Variable.TEMPERATURE, List.of(
                ClimatologicalSample.of(2001, 1.0), ClimatologicalSample.of(2001, 2.0))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate sample year: 2001");
    }
}
