package com.phillippitts.lineconsensus.presentation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Round trip over HTTP: extract raw classifications, then reduce them.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ReductionControllerIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private static final String CLASSIFICATION = """
            {"annotations": [{"task": "T0", "value": [
              {"frame": 0, "x1": 10, "y1": 20, "x2": 210, "y2": 20,
               "details": [{"value": "Dear [unclear]Sir[/unclear]"}]}
            ]}]}
            """;

    private static final String SUBJECT = """
            {"subjectId": "subject-1", "extracts": [
              {"userId": "alice", "frames": {"frame0": {"lines": [
                {"x": [10, 210], "y": [20, 20], "text": ["Dear Sir"]}]}}},
              {"userId": "bob", "frames": {"frame0": {"lines": [
                {"x": [11, 211], "y": [21, 21], "text": ["Dear Sir"]},
                {"x": [10, 210], "y": [400, 400], "text": ["Yours faithfully"]}]}}}
            ]}
            """;

    private static final String MALFORMED_SUBJECT = """
            {"subjectId": "subject-2", "extracts": [
              {"userId": "alice", "frames": {"frame0": {"lines": [{"x": [10, 210], "y": [20, 20]}]}}}
            ]}
            """;

    private ResponseEntity<String> post(String path, String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.postForEntity(path, new HttpEntity<>(body, headers), String.class);
    }

    @Test
    void extractsClassification() throws Exception {
        ResponseEntity<String> response = post("/extractors/line-text", CLASSIFICATION);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode frame = objectMapper.readTree(response.getBody()).path("frames").path("frame0");
        assertThat(frame.path("lines").get(0).path("x").get(1).asDouble()).isEqualTo(210.0);
        assertThat(frame.path("lines").get(0).path("text").get(0).asText()).isEqualTo("Dear [unclear]Sir[/unclear]");
        assertThat(frame.path("slopes").get(0).asDouble()).isZero();
    }

    @Test
    void invalidClassificationIsBadRequest() throws Exception {
        ResponseEntity<String> response = post("/extractors/line-text", "{\"annotations\": []}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(objectMapper.readTree(response.getBody()).path("errorCode").asText())
                .isEqualTo("InvalidClassificationException");
    }

    @Test
    void reducesSubject() throws Exception {
        ResponseEntity<String> response = post("/reducers/line-text", SUBJECT);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode root = objectMapper.readTree(response.getBody());
        assertThat(root.path("subjectId").asText()).isEqualTo("subject-1");
        JsonNode lines = root.path("frames").path("frame0");
        assertThat(lines).hasSize(2);

        JsonNode cluster = lines.get(0);
        assertThat(cluster.path("number_views").asInt()).isEqualTo(2);
        assertThat(cluster.path("clusters_x").get(0).asDouble()).isCloseTo(10.5, within(1e-9));
        assertThat(cluster.path("consensus_score").asDouble()).isCloseTo(2.0, within(1e-9));

        JsonNode singleton = lines.get(1);
        assertThat(singleton.path("number_views").asInt()).isEqualTo(1);
        assertThat(singleton.path("clusters_text").get(0).get(0).asText()).isEqualTo("Yours");
        assertThat(singleton.path("consensus_score").asDouble()).isEqualTo(1.0);
    }

    @Test
    void malformedRecordIsUnprocessable() throws Exception {
        ResponseEntity<String> response = post("/reducers/line-text", MALFORMED_SUBJECT);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        JsonNode error = objectMapper.readTree(response.getBody());
        assertThat(error.path("errorCode").asText()).isEqualTo("ReductionException");
        assertThat(error.path("details").asText()).contains("subject: subject-2").contains("frame: frame0");
    }

    @Test
    void batchIsolatesFailingSubject() throws Exception {
        ResponseEntity<String> response = post("/reducers/line-text/batch",
                "[" + SUBJECT + "," + MALFORMED_SUBJECT + "]");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode outcomes = objectMapper.readTree(response.getBody());
        assertThat(outcomes).hasSize(2);
        assertThat(outcomes.get(0).path("succeeded").asBoolean()).isTrue();
        assertThat(outcomes.get(0).path("reduction").path("subjectId").asText()).isEqualTo("subject-1");
        assertThat(outcomes.get(1).path("succeeded").asBoolean()).isFalse();
        assertThat(outcomes.get(1).path("error").asText()).contains("field=text");
    }

    @Test
    void unreadableBodyIsBadRequest() {
        ResponseEntity<String> response = post("/reducers/line-text", "[1, 2");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
