package com.ryuqq.flow.adapter.inmemory.store;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SizeEstimatorTest {

    private final SizeEstimator estimator = new SizeEstimator();

    @Test
    void primitivesUseFixedSizes() {
        assertThat(estimator.estimate(null)).isZero();
        assertThat(estimator.estimate("abcd")).isEqualTo(8);
        assertThat(estimator.estimate(3.14)).isEqualTo(8);
        assertThat(estimator.estimate(7L)).isEqualTo(8);
        assertThat(estimator.estimate(Boolean.FALSE)).isEqualTo(4);
    }

    @Test
    void objectsUseJsonLength() {
        // {"a":1} is 7 characters
        assertThat(estimator.estimate(Map.of("a", 1))).isEqualTo(14);
        // [1,2] is 5 characters
        assertThat(estimator.estimate(List.of(1, 2))).isEqualTo(10);
    }

    @Test
    void unserializableObjectsFallBack() {
        // no properties: Jackson refuses empty beans
        assertThat(estimator.estimate(new Object())).isEqualTo(SizeEstimator.FALLBACK_SIZE);
    }
}
