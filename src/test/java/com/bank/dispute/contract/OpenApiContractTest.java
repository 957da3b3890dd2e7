package com.bank.dispute.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental drift in paths and
 * the schemas consumers bind to. Aerospike is mocked; nothing is persisted.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @MockBean
    private AerospikeClient aerospikeClient;

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

        assertThat(paths).containsKey("/api/v1/disputes");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/events");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/network-outcome");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/acknowledge");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/deadlines");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/valid-events");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/audit");
        assertThat(paths).containsKey("/api/v1/disputes/{disputeId}/routing");

        assertThat(paths).containsKey("/api/v1/routing/queues/{queue}");
        assertThat(paths).containsKey("/api/v1/routing/stats");
        assertThat(paths).containsKey("/api/v1/routing/tick");

        assertThat(paths).containsKey("/api/v1/audit");
        assertThat(paths).containsKey("/api/v1/guardrail/scan");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("Dispute");
        assertThat(schemas).containsKey("DisputeEvent");
        assertThat(schemas).containsKey("TransitionResult");
        assertThat(schemas).containsKey("AuditEntry");
        assertThat(schemas).containsKey("RoutedItem");
    }

    @Test
    void openApiSpec_disputeAndEventSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> disputeProps = json.read("$.components.schemas.Dispute.properties");
        assertThat(disputeProps).containsKey("id");
        assertThat(disputeProps).containsKey("status");
        assertThat(disputeProps).containsKey("instrumentClass");
        assertThat(disputeProps).containsKey("deadlines");
        assertThat(disputeProps).containsKey("auditTrail");

        Map<String, Object> eventProps = json.read("$.components.schemas.DisputeEvent.properties");
        assertThat(eventProps).containsKey("type");
        assertThat(eventProps).containsKey("evidenceContent");
        assertThat(eventProps).containsKey("networkOutcome");
    }
}
