package com.signalsentinel.core.config;

import com.signalsentinel.core.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignalDetectionConfig} validation.
 */
class SignalDetectionConfigTest {

    @Test
    @DisplayName("Should accept the defaults")
    void shouldAcceptDefaults() {
        assertThatCode(() -> SignalDetectionConfig.defaults().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject tier thresholds that are not strictly descending")
    void shouldRejectUnorderedTiers() {
        SignalDetectionConfig config = SignalDetectionConfig.defaults();
        config.getFusion().setModerateThreshold(0.85);

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("fusion.moderateThreshold");
    }

    @Test
    @DisplayName("Should reject evidence weights that do not sum to one")
    void shouldRejectNonConvexEvidenceWeights() {
        SignalDetectionConfig config = SignalDetectionConfig.defaults();
        config.getFusion().setCausalityWeight(0.2);

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("fusion.evidence weights must sum to 1.0");
    }

    @Test
    @DisplayName("Should reject negative parallelism")
    void shouldRejectNegativeParallelism() {
        SignalDetectionConfig config = SignalDetectionConfig.defaults();
        config.getEngine().setParallelism(-1);

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("engine.parallelism");
    }

    @Test
    @DisplayName("Should reject mismatched frequency steps")
    void shouldRejectMismatchedFrequencySteps() {
        SignalDetectionConfig config = SignalDetectionConfig.defaults();
        config.getLayer2().setFrequencyBreakpoints(List.of(10, 1));

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("same length");
    }

    @Test
    @DisplayName("Should reject negative source priorities")
    void shouldRejectNegativeSourcePriority() {
        SignalDetectionConfig config = SignalDetectionConfig.defaults();
        config.getLayer2().setSourcePriorities(Map.of("faers", -0.1));

        assertThatThrownBy(config::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("layer2.sourcePriorities.faers");
    }

    @Test
    @DisplayName("Should fall back to default sections when set to null")
    void shouldDefaultNullSections() {
        SignalDetectionConfig config = new SignalDetectionConfig();
        config.setFusion(null);

        assertThat(config.getFusion()).isNotNull();
        assertThat(config.getFusion().getLayer1Weight()).isEqualTo(0.40);
    }
}
