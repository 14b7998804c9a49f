package com.photonlab.backend.service;

import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepParameter;
import com.photonlab.backend.domain.SweepParameterName;
import com.photonlab.backend.domain.SweepPreview;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SweepPlannerTest {

    private final SweepPlanner planner = new SweepPlanner(0.01, 0.7);

    @Test
    void radiusSweepYieldsSixValuesInOrder() {
        SweepConfig request = new SweepConfig(SimulationConfig.defaults(),
                List.of(new SweepParameter(SweepParameterName.R, 0.1, 0.2, 0.02)));

        List<SimulationConfig> configs = planner.expand(request);

        assertThat(configs).extracting(SimulationConfig::radius)
                .containsExactly(0.1, 0.12, 0.14, 0.16, 0.18, 0.2);
    }

    @Test
    void lastSweepVariesFastest() {
        SweepConfig request = new SweepConfig(SimulationConfig.defaults(), List.of(
                new SweepParameter(SweepParameterName.A, 0.4, 0.6, 0.1),
                new SweepParameter(SweepParameterName.R, 0.1, 0.2, 0.05)));

        List<SimulationConfig> configs = planner.expand(request);

        assertThat(planner.totalSimulations(request)).isEqualTo(9);
        assertThat(configs).hasSize(9);
        for (int i = 0; i < configs.size(); i++) {
            assertThat(configs.get(i).latticeConstant()).isCloseTo(0.4 + (i / 3) * 0.1, within(1e-9));
            assertThat(configs.get(i).radius()).isCloseTo(0.1 + (i % 3) * 0.05, within(1e-9));
        }
    }

    @Test
    void endIsAlwaysIncludedAndValuesAreRounded() {
        List<Double> values = planner.valuesOf(new SweepParameter(SweepParameterName.N, 3.0, 3.5, 0.3));

        assertThat(values).containsExactly(3.0, 3.5);
        assertThat(planner.valuesOf(new SweepParameter(SweepParameterName.T, 0.1, 0.2, 0.03)))
                .containsExactly(0.1, 0.133333, 0.166667, 0.2);
    }

    @Test
    void emptySweepRunsTheBaseOnce() {
        SimulationConfig base = SimulationConfig.defaults();
        SweepConfig request = new SweepConfig(base, null);

        assertThat(planner.expand(request)).containsExactly(base);
        assertThat(planner.totalSimulations(request)).isEqualTo(1);
    }

    @Test
    void previewIsIdempotentAndUsesTheCostModel() {
        SweepConfig request = new SweepConfig(SimulationConfig.defaults(),
                List.of(new SweepParameter(SweepParameterName.R, 0.1, 0.2, 0.02)));

        SweepPreview first = planner.preview(request, 4);
        SweepPreview second = planner.preview(request, 4);

        assertThat(first).isEqualTo(second);
        assertThat(first.totalSimulations()).isEqualTo(6);
        assertThat(first.totalWavelengthPoints()).isEqualTo(6L * 401);
        assertThat(first.estimatedTimeSeconds()).isCloseTo(0.01 * 6 * 401 / (4 * 0.7), within(1e-9));
        assertThat(first.sweeps()).singleElement().satisfies(p -> {
            assertThat(p.parameter()).isEqualTo(SweepParameterName.R);
            assertThat(p.numPoints()).isEqualTo(6);
        });
    }

    @Test
    void oversizedSweepIsRejected() {
        SweepParameter wide = new SweepParameter(SweepParameterName.N, 0, 1, 1e-5);
        SweepConfig request = new SweepConfig(SimulationConfig.defaults(), List.of(wide, wide, wide));

        assertThatThrownBy(() -> planner.totalSimulations(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too large");
    }
}
