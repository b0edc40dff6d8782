package com.starscape.rapidvariant.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.rapidvariant.common.outbox.OutboxEventRepository;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaRecord;
import com.starscape.rapidvariant.features.finalizemedia.domain.MediaRecordRepository;
import com.starscape.rapidvariant.support.TestImages;
import io.restassured.RestAssured;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end: multipart submit → variants in S3 → media record and outbox event in Postgres.
 */
class MediaUploadFlowIntegrationTest extends BaseIntegrationTest {
    
    @LocalServerPort
    private int port;
    
    @Autowired
    private MediaRecordRepository mediaRecordRepository;
    
    @Autowired
    private OutboxEventRepository outboxEventRepository;
    
    @Autowired
    private ObjectMapper objectMapper;
    
    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
    }
    
    @Test
    void shouldStoreEveryVariantAndCommitRecord() throws Exception {
        String request = "{\"name\":\"Harbour at Dawn\",\"altText\":\"Boats moored in a calm harbour\","
            + "\"caption\":\"Early light\",\"focalPoint\":{\"x\":40,\"y\":60},"
            + "\"crop\":{\"x\":100,\"y\":0,\"width\":900,\"height\":900}}";
        
        Map<String, Object> submitted = given()
                .multiPart("file", "harbour.jpg", TestImages.jpeg(1200, 900), "image/jpeg")
                .multiPart("request", request, "application/json")
                .post("/commands/media-uploads")
                .then()
                .statusCode(202)
                .body("runId", startsWith("run_"))
                .body("uploadId", notNullValue())
                .extract()
                .as(Map.class);
        
        String runId = (String) submitted.get("runId");
        String uploadId = (String) submitted.get("uploadId");
        
        await().atMost(Duration.ofSeconds(60))
                .pollInterval(Duration.ofMillis(500))
                .untilAsserted(() -> given()
                        .get("/queries/media-uploads/" + runId)
                        .then()
                        .statusCode(200)
                        .body("state", equalTo("COMPLETE")));
        
        given()
                .get("/queries/media-uploads/" + runId)
                .then()
                .statusCode(200)
                .body("progress.overall", equalTo(100))
                .body("result.success", equalTo(true))
                .body("result.data.recordId", startsWith("med_"))
                .body("result.data.variants", hasSize(5))
                .body("result.data.variants[0].width", equalTo(900))
                .body("result.data.placeholder", startsWith("data:image/"));
        
        // 900px square crop: lg and md are capped at the crop width, the rest scale down
        List<String> keys = storedKeys(uploadId);
        assertEquals(5, keys.size(), "stored keys: " + keys);
        assertTrue(keys.contains(TEST_PREFIX + "/harbour-at-dawn-" + uploadId + ".jpg"));
        assertTrue(keys.stream().anyMatch(key -> key.startsWith(TEST_PREFIX + "/harbour-at-dawn-xs-" + uploadId)));
        
        MediaRecord record = mediaRecordRepository.findByUploadId(uploadId).orElseThrow();
        assertEquals("Harbour at Dawn", record.getName());
        assertEquals("Boats moored in a calm harbour", record.getAltText());
        JsonNode variants = objectMapper.readTree(record.getVariantsJson());
        assertEquals(5, variants.size());
        assertEquals(40.0, objectMapper.readTree(record.getFocalPointJson()).get("x").asDouble());
        
        await().atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertTrue(outboxEventRepository.findByAggregateId(record.getRecordId())
                        .stream().allMatch(event -> event.isProcessed())));
    }
    
    @Test
    void shouldFailValidationWithoutTouchingStorage() {
        Map<String, Object> submitted = given()
                .multiPart("file", "nameless.jpg", TestImages.jpeg(320, 240), "image/jpeg")
                .multiPart("request", "{\"name\":\"Nameless\"}", "application/json")
                .post("/commands/media-uploads")
                .then()
                .statusCode(202)
                .extract()
                .as(Map.class);
        
        String runId = (String) submitted.get("runId");
        String uploadId = (String) submitted.get("uploadId");
        
        await().atMost(Duration.ofSeconds(20))
                .pollInterval(Duration.ofMillis(250))
                .untilAsserted(() -> given()
                        .get("/queries/media-uploads/" + runId)
                        .then()
                        .statusCode(200)
                        .body("state", equalTo("FAILED"))
                        .body("result.errorType", equalTo("VALIDATION_ERROR"))
                        .body("result.stage", equalTo("VALIDATING")));
        
        assertTrue(storedKeys(uploadId).isEmpty());
        assertTrue(mediaRecordRepository.findByUploadId(uploadId).isEmpty());
    }
    
    @Test
    void shouldReturnNotFoundForUnknownRun() {
        given()
                .get("/queries/media-uploads/run_unknown")
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));
    }
    
    @Test
    void shouldRejectRetryCommitForRunWithoutFailedCommit() {
        Map<String, Object> submitted = given()
                .multiPart("file", "quick.jpg", TestImages.jpeg(64, 64), "image/jpeg")
                .multiPart("request", "{\"name\":\"Quick\",\"altText\":\"Small square\"}", "application/json")
                .post("/commands/media-uploads")
                .then()
                .statusCode(202)
                .extract()
                .as(Map.class);
        String runId = (String) submitted.get("runId");
        
        await().atMost(Duration.ofSeconds(30))
                .untilAsserted(() -> given()
                        .get("/queries/media-uploads/" + runId)
                        .then()
                        .body("state", equalTo("COMPLETE")));
        
        given()
                .post("/commands/media-uploads/" + runId + "/commit")
                .then()
                .statusCode(409);
        given()
                .post("/commands/media-uploads/" + runId + "/cancel")
                .then()
                .statusCode(202);
    }
}
