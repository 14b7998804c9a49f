package com.photonlab.backend.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photonlab.backend.config.JacksonConfig;
import com.photonlab.backend.domain.JobStatus;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;
import com.photonlab.backend.repo.JobRegistry;
import com.photonlab.backend.service.ConfigValidator;
import com.photonlab.backend.service.ProgressBroadcaster;
import com.photonlab.backend.service.SweepPlanner;
import com.photonlab.backend.service.SweepService;
import com.photonlab.backend.service.SweepWorkerPool;
import com.photonlab.backend.service.solver.SpectrumSolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SweepControllerTest {

    private final ObjectMapper mapper = JacksonConfig.create();
    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final ExecutorService solverCalls = Executors.newCachedThreadPool();
    private final CountDownLatch gate = new CountDownLatch(1);
    private SweepService sweeps;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        SpectrumSolver solver = config -> {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new SimulationResult(List.of(800.0), List.of(0.5), List.of(0.5), List.of(0.0), null, null, config);
        };
        ConfigValidator validator = new ConfigValidator();
        ProgressBroadcaster broadcaster = new ProgressBroadcaster();
        SweepWorkerPool pool = new SweepWorkerPool(solver, validator, broadcaster, workers, solverCalls,
                new Semaphore(2), 2, Duration.ZERO);
        sweeps = new SweepService(validator, new SweepPlanner(0.01, 0.7), new JobRegistry(8, Clock.systemUTC()),
                pool, broadcaster, Duration.ofDays(30));

        mvc = MockMvcBuilders.standaloneSetup(new SweepController(sweeps))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new StringHttpMessageConverter(), new MappingJackson2HttpMessageConverter(mapper))
                .build();
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
        workers.shutdownNow();
        solverCalls.shutdownNow();
    }

    private String body(SimulationConfig base, String sweepsJson) throws Exception {
        return "{\"base_config\":" + mapper.writeValueAsString(base) + ",\"sweeps\":" + sweepsJson + "}";
    }

    private String radiusSweep() throws Exception {
        return body(SimulationConfig.defaults(), "[{\"name\":\"r\",\"start\":0.1,\"end\":0.14,\"step\":0.02}]");
    }

    private String start() throws Exception {
        MvcResult result = mvc.perform(post("/api/v1/sweeps").contentType(MediaType.APPLICATION_JSON).content(radiusSweep()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.total_simulations").value(3))
                .andReturn();
        return mapper.readTree(result.getResponse().getContentAsString()).path("job_id").asText();
    }

    private void awaitTerminal(String jobId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!sweeps.getStatus(jobId).status().isTerminal()) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(5);
        }
    }

    @Test
    void startAcceptsShortParameterAliases() throws Exception {
        String legacy = "{\"base_config\":{\"a\":0.5,\"r\":0.15,\"t\":0.16,\"h\":3.0,\"n\":3.68,\"k\":0,"
                + "\"n_glass\":1.535,\"num_basis\":32,"
                + "\"excitation\":{\"theta\":0,\"phi\":0,\"s_amplitude\":0,\"p_amplitude\":1},"
                + "\"wavelength\":{\"start\":800,\"end\":1200,\"step\":1},"
                + "\"compute_power\":true,\"compute_fields\":false},"
                + "\"sweeps\":[{\"name\":\"a\",\"start\":0.4,\"end\":0.6,\"step\":0.1},"
                + "{\"name\":\"r\",\"start\":0.1,\"end\":0.2,\"step\":0.05}]}";

        mvc.perform(post("/api/v1/sweeps").contentType(MediaType.APPLICATION_JSON).content(legacy))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").isString())
                .andExpect(jsonPath("$.total_simulations").value(9));
    }

    @Test
    void resultsBeforeCompletionAreAConflict() throws Exception {
        String jobId = start();

        mvc.perform(get("/api/v1/sweeps/{id}/results", jobId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("JOB_STATE"));

        gate.countDown();
        awaitTerminal(jobId);

        mvc.perform(get("/api/v1/sweeps/{id}/results", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.results.length()").value(3))
                .andExpect(jsonPath("$.results[2].config.radius").value(0.14));
    }

    @Test
    void statusAndCancel() throws Exception {
        String jobId = start();

        mvc.perform(get("/api/v1/sweeps/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value(jobId))
                .andExpect(jsonPath("$.progress.total").value(3));

        mvc.perform(post("/api/v1/sweeps/{id}/cancel", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value(jobId));

        gate.countDown();
        awaitTerminal(jobId);
        assertThat(sweeps.getStatus(jobId).status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void unknownJobIs404() throws Exception {
        mvc.perform(get("/api/v1/sweeps/{id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Job not found: nope"));
    }

    @Test
    void invalidSweepListsFieldErrors() throws Exception {
        String invalid = body(SimulationConfig.defaults().withRadius(0.3),
                "[{\"name\":\"r\",\"start\":0.1,\"end\":0.2,\"step\":0}]");

        mvc.perform(post("/api/v1/sweeps").contentType(MediaType.APPLICATION_JSON).content(invalid))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors[0].field").value("base_config.radius"))
                .andExpect(jsonPath("$.errors[1].field").value("sweeps[0].step"))
                .andExpect(jsonPath("$.errors[1].severity").value("error"));
    }

    @Test
    void unknownSweepParameterIsABadRequest() throws Exception {
        String invalid = body(SimulationConfig.defaults(), "[{\"name\":\"q\",\"start\":0.1,\"end\":0.2,\"step\":0.1}]");

        mvc.perform(post("/api/v1/sweeps").contentType(MediaType.APPLICATION_JSON).content(invalid))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void previewReportsSizes() throws Exception {
        MvcResult result = mvc.perform(post("/api/v1/sweeps/preview").contentType(MediaType.APPLICATION_JSON).content(radiusSweep()))
                .andExpect(status().isOk())
                .andReturn();

        JsonNode node = mapper.readTree(result.getResponse().getContentAsString());
        assertThat(node.path("total_simulations").asInt()).isEqualTo(3);
        assertThat(node.path("total_wavelength_points").asLong()).isEqualTo(3 * 401);
        assertThat(node.path("sweeps").get(0).path("parameter").asText()).isEqualTo("r");
        assertThat(node.path("sweeps").get(0).path("num_points").asInt()).isEqualTo(3);
    }

    @Test
    void progressStreamReplaysFinalStateOfFinishedJob() throws Exception {
        gate.countDown();
        String jobId = start();
        awaitTerminal(jobId);

        MvcResult result = mvc.perform(get("/api/v1/sweeps/{id}/progress", jobId))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(2000);

        String stream = result.getResponse().getContentAsString();
        assertThat(stream).contains("event:progress");
        assertThat(stream).contains("\"status\":\"completed\"");
    }

    @Test
    void progressStreamForUnknownJobIs404() throws Exception {
        mvc.perform(get("/api/v1/sweeps/{id}/progress", "nope"))
                .andExpect(status().isNotFound());
    }
}
