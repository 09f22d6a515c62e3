package com.outreach.scoring.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental endpoint or schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Configuration endpoints
        assertThat(paths).containsKey("/api/v1/configurations/validate");
        assertThat(paths).containsKey("/api/v1/configurations/merge");
        assertThat(paths).containsKey("/api/v1/configurations/templates");
        assertThat(paths).containsKey("/api/v1/configurations/templates/{name}");
        assertThat(paths).containsKey("/api/v1/configurations/templates/{name}/apply");

        // Scoring endpoints
        assertThat(paths).containsKey("/api/v1/scoring/score");
        assertThat(paths).containsKey("/api/v1/scoring/batch");
        assertThat(paths).containsKey("/api/v1/scoring/anomalies");
        assertThat(paths).containsKey("/api/v1/scoring/cache");

        // List endpoints
        assertThat(paths).containsKey("/api/v1/lists");
        assertThat(paths).containsKey("/api/v1/lists/bulk-update");
        assertThat(paths).containsKey("/api/v1/lists/{filename}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("ContactRecord");
        assertThat(schemas).containsKey("ScoreResult");
        assertThat(schemas).containsKey("BatchScoringResult");
        assertThat(schemas).containsKey("AnomalyReport");
        assertThat(schemas).containsKey("BulkUpdateRequest");
        assertThat(schemas).containsKey("BulkUpdateResponse");
        assertThat(schemas).containsKey("ListEntry");
    }

    @Test
    void openApiSpec_scoreAndBulkSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> scoreProps = json.read("$.components.schemas.ScoreResult.properties");
        assertThat(scoreProps).containsKey("compositeScore");
        assertThat(scoreProps).containsKey("tier");
        assertThat(scoreProps).containsKey("breakdown");
        assertThat(scoreProps).containsKey("adjustments");
        assertThat(scoreProps).containsKey("anomaly");

        Map<String, Object> bulkProps = json.read("$.components.schemas.BulkUpdateResponse.properties");
        assertThat(bulkProps).containsKey("success");
        assertThat(bulkProps).containsKey("updated");
        assertThat(bulkProps).containsKey("failed");
        assertThat(bulkProps).containsKey("errors");
        assertThat(bulkProps).containsKey("results");
    }
}
