package appraiser.adapter.in.rest;

import static appraiser.adapter.in.rest.ApiClient.SAMPLE_HOUSE;
import static appraiser.adapter.in.rest.ApiClient.newToken;
import static appraiser.adapter.in.rest.ApiClient.predict;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import appraiser.core.service.ratelimit.RateLimitService;

@QuarkusTest
@DisplayName("Prediction Log Resource Tests")
class PredictionLogResourceTest {

    @Inject
    RateLimitService rateLimitService;

    private String token;

    @BeforeEach
    void setUp() {
        rateLimitService.resetAll().await().indefinitely();
        token = newToken("auditor");
        predict(token, SAMPLE_HOUSE).statusCode(200);
        predict(token, SAMPLE_HOUSE).statusCode(200);
    }

    @Test
    @DisplayName("should list only the caller's own entries")
    void shouldListOwnLogs() {
        given().header("Authorization", "Bearer " + token)
                .when()
                .get("/logs?limit=1")
                .then()
                .statusCode(200)
                .body("total", equalTo(2))
                .body("logs", hasSize(1))
                .body("limit", equalTo(1))
                .body("logs[0].request_type", equalTo("single"))
                .body("logs[0].input_features.ocean_proximity", equalTo("NEAR BAY"))
                .body("logs[0].response_time_ms", notNullValue());
    }

    @Test
    @DisplayName("should report global and per-key counts")
    void shouldReportStats() {
        given().header("Authorization", "Bearer " + token)
                .when()
                .get("/logs/stats")
                .then()
                .statusCode(200)
                .body("total_predictions", greaterThanOrEqualTo(2))
                .body("predictions_by_user", equalTo(2));
    }

    @Test
    @DisplayName("should refuse another key's entry and report unknown ids")
    void shouldEnforceOwnership() {
        int logId = given().header("Authorization", "Bearer " + token)
                .when()
                .get("/logs")
                .then()
                .extract()
                .path("logs[0].id");

        given().header("Authorization", "Bearer " + token)
                .when()
                .get("/logs/" + logId)
                .then()
                .statusCode(200)
                .body("id", equalTo(logId));

        given().header("Authorization", "Bearer " + newToken("intruder"))
                .when()
                .get("/logs/" + logId)
                .then()
                .statusCode(403)
                .body("detail", equalTo("Not authorized to view this log"));

        given().header("Authorization", "Bearer " + token)
                .when()
                .get("/logs/987654321")
                .then()
                .statusCode(404)
                .body("detail", equalTo("Prediction log not found"));
    }
}
