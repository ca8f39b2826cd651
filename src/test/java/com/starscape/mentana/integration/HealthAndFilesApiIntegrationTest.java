package com.starscape.mentana.integration;

import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

class HealthAndFilesApiIntegrationTest extends BaseApiTest {

    @Test
    void healthReportsEveryComponent() {
        given()
                .get("/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("HEALTHY"))
                .body("components.name", hasItems("user-repository", "file-storage"))
                .body("components.reachable", everyItem(equalTo(true)))
                .body("adapters.backend", everyItem(equalTo("memory")));
    }

    @Test
    void livenessAndReadiness() {
        given().get("/health/live").then().statusCode(200).body("status", equalTo("ALIVE"));
        given().get("/health/ready").then().statusCode(200).body("status", equalTo("HEALTHY"));
    }

    @Test
    void actuatorIncludesAdapterIndicator() {
        given()
                .get("/actuator/health")
                .then()
                .statusCode(200)
                .body("components.adapters.status", equalTo("UP"));
    }

    @Test
    void probeFileUpload() {
        given()
                .post("/files/probe")
                .then()
                .statusCode(201)
                .body("key", matchesPattern("probe-files/probe-[0-9a-f]{8}\\.txt"))
                .body("location", startsWith("memory://test-bucket/"))
                .body("verified", equalTo(true));
    }
}
