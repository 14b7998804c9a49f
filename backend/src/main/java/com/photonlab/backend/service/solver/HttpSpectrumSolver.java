package com.photonlab.backend.service.solver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Talks to a solver process over HTTP: {@code POST {base-url}/simulate} with the canonical config as JSON.
 */
@Component
public class HttpSpectrumSolver implements SpectrumSolver {

    private static final Logger log = LoggerFactory.getLogger(HttpSpectrumSolver.class);

    private final RestClient client;

    @Autowired
    public HttpSpectrumSolver(PhotonLabProperties properties, ObjectMapper om) {
        this(builderFor(properties.getSolver()), om);
    }

    /**
     * @param builder carries base URL and request factory; only the JSON converter is replaced here
     */
    public HttpSpectrumSolver(RestClient.Builder builder, ObjectMapper om) {
        this.client = builder
                .messageConverters(converters -> {
                    converters.removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
                    converters.add(new MappingJackson2HttpMessageConverter(om));
                })
                .build();
    }

    private static RestClient.Builder builderFor(PhotonLabProperties.Solver cfg) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) cfg.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) cfg.getReadTimeout().toMillis());
        return RestClient.builder()
                .baseUrl(cfg.getBaseUrl())
                .requestFactory(factory);
    }

    @Override
    public SimulationResult simulate(SimulationConfig config) {
        try {
            SimulationResult result = client.post()
                    .uri("/simulate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(config)
                    .retrieve()
                    .body(SimulationResult.class);
            if (result == null) throw new SolverException("Solver returned an empty response");
            return result;
        } catch (RestClientResponseException e) {
            log.debug("solver rejected configuration: {} {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new SolverException("Solver error " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new SolverException("Solver unreachable: " + e.getMessage(), e);
        }
    }
}
