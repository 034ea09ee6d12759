package com.example.obd2live.analysis;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.AnalysisEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Calls the analysis service over HTTP: {@code POST {engine-url}/analyze}.
 * Server errors and unreachable hosts are transient; client errors are not.
 */
@Component
public class WebClientAnalysisEngine implements AnalysisEngine {

    private static final Logger logger = LoggerFactory.getLogger(WebClientAnalysisEngine.class);

    private final WebClient web;
    private final Obd2Properties properties;

    public WebClientAnalysisEngine(WebClient.Builder builder, Obd2Properties properties) {
        this.properties = properties;
        this.web = builder
                .baseUrl(properties.getAnalysis().getEngineUrl())
                .build();
    }

    @Override
    public AnalysisOutcome analyze(AnalysisRequest request) {
        logger.debug("Requesting {} analysis {} for session {}", request.getKind(), request.getAnalysisId(), request.getSessionId());
        AnalysisOutcome outcome;
        try {
            outcome = web.post()
                    .uri("/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(AnalysisOutcome.class)
                    .block(properties.getAnalysis().getTimeout());
        } catch (WebClientResponseException e) {
            boolean transientFailure = e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429;
            throw new AnalysisEngineException("Analysis engine returned " + e.getStatusCode().value()
                    + " for " + request.getAnalysisId(), transientFailure, e);
        } catch (WebClientRequestException e) {
            throw new AnalysisEngineException("Analysis engine unreachable: " + e.getMessage(), true, e);
        } catch (IllegalStateException e) {
            // block(timeout) elapsed
            throw new AnalysisEngineException("Analysis engine timed out after " + properties.getAnalysis().getTimeout(), true, e);
        }
        if (outcome == null) {
            throw new AnalysisEngineException("Analysis engine returned an empty body for " + request.getAnalysisId(), false);
        }
        return outcome;
    }
}
