package com.retinaai.scoring;

import com.retinaai.exception.ExternalServiceException;
import com.retinaai.model.enums.RiskLevel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.client.RestClientTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@RestClientTest(RestRetinalScorer.class)
class RestRetinalScorerTest {

    private static final String SCORER_URL = "http://scorer.test/score";

    @Autowired
    private RestRetinalScorer scorer;

    @Autowired
    private MockRestServiceServer server;

    @Test
    void findingsAreParsed() {
        server.expect(requestTo(SCORER_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.image_url").value("https://images.test/1.png"))
            .andExpect(jsonPath("$.threshold_config").value("{\"dr\":0.5}"))
            .andRespond(withSuccess("""
                {
                  "findings": [
                    {"disease": "diabetic_retinopathy", "risk": "high", "confidence": 0.93},
                    {"disease": "amd", "risk": "LOW", "confidence": 0.2}
                  ],
                  "heatmap_url": "https://heatmaps.test/1.png",
                  "description": "microaneurysms",
                  "model_latency_ms": 812
                }
                """, MediaType.APPLICATION_JSON));

        ScoringOutcome outcome = scorer.score("https://images.test/1.png", "{\"dr\":0.5}");

        assertThat(outcome.findings()).hasSize(2);
        assertThat(outcome.findings().get(0).riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(outcome.findings().get(0).confidence()).isEqualByComparingTo("0.93");
        assertThat(outcome.findings().get(1).riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(outcome.heatmapUrl()).isEqualTo("https://heatmaps.test/1.png");
        assertThat(outcome.description()).isEqualTo("microaneurysms");
        server.verify();
    }

    @Test
    void missingFindingsMeansNoFindings() {
        server.expect(requestTo(SCORER_URL))
            .andRespond(withSuccess("{\"heatmap_url\": \"https://heatmaps.test/2.png\"}", MediaType.APPLICATION_JSON));

        ScoringOutcome outcome = scorer.score("https://images.test/2.png", "{}");

        assertThat(outcome.findings()).isEmpty();
        assertThat(outcome.heatmapUrl()).isEqualTo("https://heatmaps.test/2.png");
    }

    @Test
    void serverErrorBecomesExternalServiceError() {
        server.expect(requestTo(SCORER_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> scorer.score("https://images.test/1.png", "{}"))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessageStartingWith("Scorer call failed");
    }

    @Test
    void unknownRiskLevelIsRejected() {
        server.expect(requestTo(SCORER_URL))
            .andRespond(withSuccess("""
                {"findings": [{"disease": "amd", "risk": "severe", "confidence": 0.7}], "heatmap_url": "h"}
                """, MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> scorer.score("https://images.test/1.png", "{}"))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessageContaining("severe");
    }
}
