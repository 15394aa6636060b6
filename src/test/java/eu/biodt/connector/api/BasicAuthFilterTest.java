package eu.biodt.connector.api;

import eu.biodt.connector.testing.FakeServicesResource;
import io.quarkus.test.common.WithTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;

@QuarkusTest
@TestProfile(BasicAuthFilterTest.WithCredentials.class)
@WithTestResource(FakeServicesResource.class)
class BasicAuthFilterTest {

    public static class WithCredentials implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                    "connector.auth.username", "operator",
                    "connector.auth.password", "s3cret"
            );
        }
    }

    @Test
    void shouldChallengeRequestsWithoutCredentials() {
        given()
                .when().get("/runs")
                .then()
                .statusCode(401)
                .header("WWW-Authenticate", containsString("Basic"));

        given()
                .contentType(ContentType.JSON)
                .body("{\"name\":\"wf-42\"}")
                .when().post("/notifications")
                .then()
                .statusCode(401);
    }

    @Test
    void shouldRejectWrongPassword() {
        given()
                .auth().preemptive().basic("operator", "wrong")
                .when().get("/runs")
                .then()
                .statusCode(401);
    }

    @Test
    void shouldServeRequestsWithValidCredentials() {
        given()
                .auth().preemptive().basic("operator", "s3cret")
                .when().get("/status")
                .then()
                .statusCode(200);
    }
}
