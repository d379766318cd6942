package com.eainde.labaudit.scoring;

import com.eainde.labaudit.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringPolicyTest {

    @Test
    @DisplayName("defaults use the documented weights")
    void defaults() {
        ScoringPolicy policy = ScoringPolicy.defaults();

        assertThat(policy.unableCredit()).isEqualTo(0.25);
        assertThat(policy.weightOf(Severity.CRITICAL)).isEqualTo(15);
        assertThat(policy.weightOf(Severity.MAJOR)).isEqualTo(10);
        assertThat(policy.weightOf(Severity.MINOR)).isEqualTo(5);
        assertThat(policy.weightOf(Severity.OBSERVATION)).isEqualTo(2);
        assertThat(policy.weightOf(Severity.UNRATED)).isZero();
    }

    @Test
    @DisplayName("missing weights default to zero")
    void missingWeights() {
        ScoringPolicy policy = new ScoringPolicy(0.5, Map.of(Severity.CRITICAL, 20), 50, 80, 50);

        assertThat(policy.weightOf(Severity.CRITICAL)).isEqualTo(20);
        assertThat(policy.weightOf(Severity.MINOR)).isZero();
    }

    @Test
    @DisplayName("rejects invalid settings")
    void rejectsInvalid() {
        Map<Severity, Integer> weights = ScoringPolicy.defaults().severityWeights();

        assertThatThrownBy(() -> new ScoringPolicy(1.5, weights, 50, 80, 50))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unableCredit");
        assertThatThrownBy(() -> new ScoringPolicy(0.25, weights, 120, 80, 50))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoringPolicy(0.25, weights, 50, 80, 90))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("investigateThreshold");
        assertThatThrownBy(() -> ScoringPolicy.of(15, -1, 5, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
