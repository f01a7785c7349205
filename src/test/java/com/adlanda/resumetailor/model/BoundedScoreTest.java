package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedScoreTest {

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 50, 99, 100})
    void of_inRange_keepsValue(int value) {
        assertThat(ImpactScore.of(value).value()).isEqualTo(value);
        assertThat(ProficiencyLevel.of(value).value()).isEqualTo(value);
        assertThat(MatchScore.of(value).value()).isEqualTo(value);
    }

    @ParameterizedTest
    @ValueSource(ints = {Integer.MIN_VALUE, -1, 101, 1000, Integer.MAX_VALUE})
    void of_outOfRange_throwsValidationException(int value) {
        assertThatThrownBy(() -> ImpactScore.of(value))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getFieldErrors())
                        .extracting(ValidationException.FieldError::field)
                        .containsExactly("impact_score"));
        assertThatThrownBy(() -> ProficiencyLevel.of(value)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> MatchScore.of(value)).isInstanceOf(ValidationException.class);
    }

    @Test
    void impactScore_thresholds() {
        assertThat(ImpactScore.DEFAULT.value()).isEqualTo(50);
        assertThat(ImpactScore.of(70).isHighImpact()).isTrue();
        assertThat(ImpactScore.of(69).isHighImpact()).isFalse();
        assertThat(ImpactScore.of(39).isLowImpact()).isTrue();
        assertThat(ImpactScore.of(40).isLowImpact()).isFalse();
    }

    @Test
    void matchScore_defaultsToZero() {
        assertThat(MatchScore.ZERO.value()).isZero();
        assertThat(new Resume("user-1", "Backend engineer").getScore()).isEqualTo(MatchScore.ZERO);
    }
}
