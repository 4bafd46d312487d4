package com.retinaai.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.retinaai.exception.ExternalServiceException;
import com.retinaai.model.enums.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Scorer client speaking JSON over HTTP.
 *
 * Request: {"image_url": ..., "threshold_config": ...}
 * Response: {"findings": [{"disease": ..., "risk": ..., "confidence": ...}], "heatmap_url": ..., "description": ...}
 */
@Component
@Slf4j
public class RestRetinalScorer implements RetinalScorer {

    private final RestTemplate restTemplate;
    private final String scorerUrl;

    public RestRetinalScorer(
            RestTemplateBuilder restTemplateBuilder,
            @Value("${retina.scorer.url:http://localhost:8090/score}") String scorerUrl,
            @Value("${retina.scorer.timeout-ms:30000}") long timeoutMs) {
        this.restTemplate = restTemplateBuilder
            .setConnectTimeout(Duration.ofMillis(timeoutMs))
            .setReadTimeout(Duration.ofMillis(timeoutMs))
            .build();
        this.scorerUrl = scorerUrl;
    }

    @Override
    public ScoringOutcome score(String imageUrl, String thresholdConfig) {
        ScoreResponse response;
        try {
            log.debug("Calling scorer {} for image {}", scorerUrl, imageUrl);
            response = restTemplate.postForObject(scorerUrl, new ScoreRequest(imageUrl, thresholdConfig), ScoreResponse.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException("Scorer call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ExternalServiceException("Scorer returned an empty response");
        }
        return response.toOutcome();
    }

    record ScoreRequest(
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("threshold_config") String thresholdConfig
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScoreResponse(
        List<FindingPayload> findings,
        @JsonProperty("heatmap_url") String heatmapUrl,
        String description
    ) {

        ScoringOutcome toOutcome() {
            List<DiseaseFinding> converted = findings == null ? List.of() : findings.stream()
                .map(FindingPayload::toFinding)
                .toList();
            return new ScoringOutcome(converted, heatmapUrl, description);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FindingPayload(String disease, String risk, BigDecimal confidence) {

        DiseaseFinding toFinding() {
            try {
                return new DiseaseFinding(disease, RiskLevel.fromValue(risk), confidence);
            } catch (IllegalArgumentException e) {
                throw new ExternalServiceException("Scorer returned an unknown risk level: " + risk, e);
            }
        }
    }
}
