package com.photonlab.backend.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photonlab.backend.domain.JobStatus;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepParameterName;
import com.photonlab.backend.domain.ValidationError;
import com.photonlab.backend.domain.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JacksonConfigTest {

    private final ObjectMapper om = JacksonConfig.create();

    @Test
    void sweepRequestReadsSnakeCaseAndShortNames() throws Exception {
        String json = "{\"base_config\":{\"lattice_constant\":0.45,\"r\":0.1,\"t\":0.2,\"h\":2,\"n\":3.5,\"k\":0.01,"
                + "\"n_glass\":1.45,\"num_basis\":24,\"excitation\":{\"theta\":10,\"phi\":0,\"s_amplitude\":1,\"p_amplitude\":0},"
                + "\"wavelength\":{\"start\":900,\"end\":1000,\"step\":2},\"compute_power\":true,\"compute_fields\":false,"
                + "\"unknown_field\":42},"
                + "\"sweeps\":[{\"name\":\"t\",\"start\":0.1,\"end\":0.3,\"step\":0.1}]}";

        SweepConfig sweep = om.readValue(json, SweepConfig.class);

        assertThat(sweep.baseConfig().latticeConstant()).isEqualTo(0.45);
        assertThat(sweep.baseConfig().radius()).isEqualTo(0.1);
        assertThat(sweep.baseConfig().nSilicon()).isEqualTo(3.5);
        assertThat(sweep.baseConfig().kSilicon()).isEqualTo(0.01);
        assertThat(sweep.baseConfig().excitation().sAmplitude()).isEqualTo(1.0);
        assertThat(sweep.baseConfig().wavelength().pointCount()).isEqualTo(51);
        assertThat(sweep.sweeps()).singleElement().satisfies(s -> {
            assertThat(s.name()).isEqualTo(SweepParameterName.T);
            assertThat(s.pointCount()).isEqualTo(3);
        });
    }

    @Test
    void missingSweepListBecomesEmpty() throws Exception {
        SweepConfig sweep = om.readValue("{\"base_config\":null}", SweepConfig.class);

        assertThat(sweep.sweeps()).isEmpty();
    }

    @Test
    void enumsAndValidityUseLowercaseWireNames() throws Exception {
        ValidationResult result = ValidationResult.of(List.of(ValidationError.warning("wavelength.step", "many points")));

        JsonNode node = om.readTree(om.writeValueAsString(result));

        assertThat(node.path("is_valid").asBoolean()).isTrue();
        assertThat(node.path("errors").get(0).path("severity").asText()).isEqualTo("warning");
        assertThat(om.writeValueAsString(JobStatus.CANCELLED)).isEqualTo("\"cancelled\"");
        assertThat(om.readValue("\"running\"", JobStatus.class)).isEqualTo(JobStatus.RUNNING);
    }
}
