package appraiser.adapter.in.rest;

import static io.restassured.RestAssured.given;

import java.util.Map;

import io.restassured.http.ContentType;
import io.restassured.response.ValidatableResponse;

/**
 * RestAssured shortcuts shared by the resource tests.
 */
final class ApiClient {

    static final String SAMPLE_HOUSE = """
            {
              "longitude": -122.23,
              "latitude": 37.88,
              "housing_median_age": 41,
              "total_rooms": 880,
              "total_bedrooms": 129,
              "population": 322,
              "households": 126,
              "median_income": 8.3252,
              "ocean_proximity": "NEAR BAY"
            }
            """;

    private ApiClient() {}

    static ValidatableResponse issueKey(String name) {
        return given().contentType(ContentType.JSON)
                .body(Map.of("name", name, "description", "integration test key"))
                .when()
                .post("/auth/keys")
                .then();
    }

    static String issueKeySecret(String name) {
        return issueKey(name).statusCode(201).extract().path("key");
    }

    static long issueKeyId(String name) {
        return issueKey(name).statusCode(201).extract().jsonPath().getLong("id");
    }

    static ValidatableResponse exchange(String apiKey) {
        return given().contentType(ContentType.JSON)
                .body(Map.of("api_key", apiKey))
                .when()
                .post("/auth/token")
                .then();
    }

    static String tokenFor(String apiKey) {
        return exchange(apiKey).statusCode(200).extract().path("access_token");
    }

    static String newToken(String name) {
        return tokenFor(issueKeySecret(name));
    }

    static ValidatableResponse predict(String token, String body) {
        return given().contentType(ContentType.JSON)
                .header("Authorization", "Bearer " + token)
                .body(body)
                .when()
                .post("/predict")
                .then();
    }
}
