package appraiser.adapter.in.rest;

import static appraiser.adapter.in.rest.ApiClient.exchange;
import static appraiser.adapter.in.rest.ApiClient.issueKey;
import static appraiser.adapter.in.rest.ApiClient.issueKeySecret;
import static appraiser.adapter.in.rest.ApiClient.tokenFor;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;

import java.util.Map;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import appraiser.core.service.ratelimit.RateLimitService;

@QuarkusTest
@DisplayName("Auth Resource Tests")
class AuthResourceTest {

    @Inject
    RateLimitService rateLimitService;

    @BeforeEach
    void resetRateLimits() {
        rateLimitService.resetAll().await().indefinitely();
    }

    @Nested
    @DisplayName("POST /auth/keys")
    class IssueKeyTests {

        @Test
        @DisplayName("should issue an active key and return the plaintext once")
        void shouldIssueKey() {
            issueKey("Test Key")
                    .statusCode(201)
                    .body("id", notNullValue())
                    .body("name", equalTo("Test Key"))
                    .body("key", matchesPattern("[0-9a-f]{64}"))
                    .body("is_active", equalTo(true))
                    .body("created_at", notNullValue());
        }

        @Test
        @DisplayName("should reject a blank name with a validation problem")
        void shouldRejectBlankName() {
            given().contentType(ContentType.JSON)
                    .body(Map.of("name", ""))
                    .when()
                    .post("/auth/keys")
                    .then()
                    .statusCode(422)
                    .contentType(containsString("application/problem+json"))
                    .body("detail", equalTo("Validation error"))
                    .body("errors", hasItem(startsWith("name: ")))
                    .body("correlation_id", notNullValue());
        }

        @Test
        @DisplayName("should accept a whitespace-only name verbatim")
        void shouldAcceptWhitespaceName() {
            given().contentType(ContentType.JSON)
                    .body(Map.of("name", "   "))
                    .when()
                    .post("/auth/keys")
                    .then()
                    .statusCode(201)
                    .body("name", equalTo("   "));
        }

        @Test
        @DisplayName("should keep an omitted description null")
        void shouldKeepOmittedDescriptionNull() {
            var issued = given().contentType(ContentType.JSON)
                    .body(Map.of("name", "bare"))
                    .when()
                    .post("/auth/keys")
                    .then()
                    .statusCode(201)
                    .body("description", nullValue())
                    .extract()
                    .jsonPath();

            given().header("Authorization", "Bearer " + tokenFor(issued.getString("key")))
                    .when()
                    .get("/auth/keys?limit=1000")
                    .then()
                    .statusCode(200)
                    .body("find { it.id == %d }.description".formatted(issued.getLong("id")), nullValue());
        }

        @Test
        @DisplayName("should throttle key issuance per client")
        void shouldThrottleIssuance() {
            for (int i = 0; i < 10; i++) {
                issueKey("burst-" + i).statusCode(201);
            }

            issueKey("one-too-many")
                    .statusCode(429)
                    .header("Retry-After", notNullValue())
                    .header("X-RateLimit-Limit", equalTo("10"))
                    .header("X-RateLimit-Remaining", equalTo("0"))
                    .body("retry_after", greaterThanOrEqualTo(1));
        }

        @Test
        @DisplayName("should ignore forwarding headers from an untrusted peer")
        void shouldNotLetForwardedForResetTheBudget() {
            for (int i = 0; i < 10; i++) {
                given().contentType(ContentType.JSON)
                        .header("X-Forwarded-For", "203.0.113." + i)
                        .header("Forwarded", "for=198.51.100." + i)
                        .body(Map.of("name", "rotating-" + i))
                        .when()
                        .post("/auth/keys")
                        .then()
                        .statusCode(201);
            }

            given().contentType(ContentType.JSON)
                    .header("X-Forwarded-For", "203.0.113.250")
                    .body(Map.of("name", "rotating-last"))
                    .when()
                    .post("/auth/keys")
                    .then()
                    .statusCode(429);
        }
    }

    @Nested
    @DisplayName("POST /auth/token")
    class TokenTests {

        @Test
        @DisplayName("should exchange a valid key for a bearer token")
        void shouldExchangeKey() {
            exchange(issueKeySecret("token-key"))
                    .statusCode(200)
                    .body("access_token", notNullValue())
                    .body("token_type", equalTo("bearer"))
                    .body("expires_in", equalTo(1800));
        }

        @Test
        @DisplayName("should reject an unknown key with a bearer challenge")
        void shouldRejectUnknownKey() {
            exchange("definitely-not-a-real-key-0000000000000000000")
                    .statusCode(401)
                    .header("WWW-Authenticate", startsWith("Bearer"))
                    .body("detail", equalTo("Invalid API key"))
                    .body("correlation_id", notNullValue());
        }

        @Test
        @DisplayName("should treat a whitespace-only key as invalid credentials")
        void shouldRejectWhitespaceKey() {
            exchange("          ")
                    .statusCode(401)
                    .body("detail", equalTo("Invalid API key"));
            exchange(" ").statusCode(401);
        }

        @Test
        @DisplayName("should reject a missing api_key field")
        void shouldRejectMissingKey() {
            given().contentType(ContentType.JSON)
                    .body("{}")
                    .when()
                    .post("/auth/token")
                    .then()
                    .statusCode(422)
                    .body("errors", hasItem(startsWith("api_key: ")));
        }
    }

    @Nested
    @DisplayName("Key lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should list, deactivate and then refuse the key's token")
        void shouldDeactivateKey() {
            var issued = issueKey("Test Key").statusCode(201).extract().jsonPath();
            var secret = issued.getString("key");
            long id = issued.getLong("id");
            var token = tokenFor(secret);

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .get("/auth/keys?limit=1000")
                    .then()
                    .statusCode(200)
                    .body("id", hasItem((int) id))
                    .body("key", everyItem(nullValue()))
                    .body("secret_hash", everyItem(nullValue()));

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .delete("/auth/keys/" + id)
                    .then()
                    .statusCode(200)
                    .body("message", equalTo("API key deactivated successfully"));

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .get("/auth/keys")
                    .then()
                    .statusCode(401);
            exchange(secret).statusCode(401);
        }

        @Test
        @DisplayName("should soft delete, restore and hard delete a key")
        void shouldDeleteAndRestore() {
            var token = tokenFor(issueKeySecret("admin"));
            long target = ApiClient.issueKeyId("target");

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .delete("/auth/keys/" + target + "/record")
                    .then()
                    .statusCode(200)
                    .body("message", equalTo("API key deleted successfully"));

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .post("/auth/keys/" + target + "/restore")
                    .then()
                    .statusCode(200)
                    .body("id", equalTo((int) target))
                    .body("is_deleted", equalTo(false));

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .post("/auth/keys/" + target + "/restore")
                    .then()
                    .statusCode(404)
                    .body("detail", equalTo("API key not found or not deleted"));

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .delete("/auth/keys/" + target + "/record?hard=true")
                    .then()
                    .statusCode(200)
                    .body("message", equalTo("API key permanently deleted"));

            given().header("Authorization", "Bearer " + token)
                    .when()
                    .delete("/auth/keys/" + target)
                    .then()
                    .statusCode(404)
                    .body("detail", equalTo("API key not found"));
        }

        @Test
        @DisplayName("should require a token for key management")
        void shouldRequireToken() {
            given().when()
                    .get("/auth/keys")
                    .then()
                    .statusCode(401)
                    .header("WWW-Authenticate", startsWith("Bearer"))
                    .body("detail", equalTo("Could not validate credentials"))
                    .body("correlation_id", notNullValue());

            given().header("Authorization", "Bearer not-a-token")
                    .when()
                    .get("/auth/keys")
                    .then()
                    .statusCode(401);
        }

        @Test
        @DisplayName("should validate paging parameters")
        void shouldValidatePaging() {
            given().header("Authorization", "Bearer " + tokenFor(issueKeySecret("pager")))
                    .when()
                    .get("/auth/keys?limit=0")
                    .then()
                    .statusCode(422)
                    .body("errors", hasSize(1));
        }
    }
}
