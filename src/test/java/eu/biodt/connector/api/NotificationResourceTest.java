package eu.biodt.connector.api;

import eu.biodt.connector.testing.FakeServicesResource;
import io.quarkus.test.common.WithTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.path.json.JsonPath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTest
@WithTestResource(FakeServicesResource.class)
class NotificationResourceTest {

    @Test
    void shouldAcceptNotificationAndTransferRun() throws InterruptedException {
        given()
                .contentType(ContentType.JSON)
                .body("{\"namespace\":\"argo\",\"name\":\"wf-42\"}")
                .when().post("/notifications")
                .then()
                .statusCode(202)
                .body("status", equalTo("ACCEPTED"))
                .body("namespace", equalTo("argo"))
                .body("name", equalTo("wf-42"));

        JsonPath run = RunPolling.awaitFinished("argo", "wf-42");

        assertEquals("COMPLETED", run.getString("state"));
        assertEquals(6, run.getList("summary.outcomes").size());
        assertEquals(4, run.getInt("summary.stored"));
        assertEquals(1, run.getInt("summary.skipped"));
        assertEquals(1, run.getInt("summary.failed"));
        assertNotNull(run.getString("summary.datasetId"));
        assertNull(run.getString("summary.datasetError"));

        List<Map<String, Object>> outcomes = run.getList("summary.outcomes");
        Map<String, Object> model = outcome(outcomes, "wf-42-1111/tmp/model.tif");
        assertEquals("SKIPPED", model.get("status"));
        assertEquals("SIZE_EXCEEDED", model.get("skipReason"));
        Map<String, Object> rejected = outcome(outcomes, "wf-42-2222/tmp/outputs/reject.txt");
        assertEquals("FAILED", rejected.get("status"));
        assertEquals("SINK_REJECTED", rejected.get("errorKind"));
        Map<String, Object> nested = outcome(outcomes, "wf-42-2222/tmp/outputs/sub/b.txt");
        assertEquals("STORED", nested.get("status"));
        assertTrue(String.valueOf(nested.get("objectId")).startsWith("test/"));
    }

    @Test
    void shouldUseDefaultNamespace() throws InterruptedException {
        given()
                .contentType(ContentType.JSON)
                .body("{\"name\":\"wf-42\"}")
                .when().post("/notifications")
                .then()
                .statusCode(202)
                .body("namespace", equalTo("argo"));

        RunPolling.awaitFinished("argo", "wf-42");
    }

    @Test
    void shouldMarkUnknownRunAsFailed() throws InterruptedException {
        given()
                .contentType(ContentType.JSON)
                .body("{\"namespace\":\"argo\",\"name\":\"wf-99\"}")
                .when().post("/notifications")
                .then()
                .statusCode(202);

        JsonPath run = RunPolling.awaitFinished("argo", "wf-99");

        assertEquals("FAILED", run.getString("state"));
        assertTrue(run.getString("failure").contains("not found"));
        assertNull(run.get("summary"));
    }

    @Test
    void shouldRejectMalformedNotifications() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"namespace\":\"argo\"}")
                .when().post("/notifications")
                .then()
                .statusCode(400)
                .body("error", notNullValue());

        given()
                .contentType(ContentType.JSON)
                .body("{\"namespace\":\"argo\",\"name\":\"Not_A_Valid_Name\"}")
                .when().post("/notifications")
                .then()
                .statusCode(400);

        given()
                .contentType(ContentType.JSON)
                .body("{\"name\":")
                .when().post("/notifications")
                .then()
                .statusCode(400)
                .body("error", notNullValue());
    }

    @Test
    void shouldDescribeUnparseableBodies() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"namespace\":\"argo\",\"name\":")
                .when().post("/notifications")
                .then()
                .statusCode(400)
                .contentType(ContentType.JSON)
                .body("error", startsWith("Malformed JSON body"));

        given()
                .contentType(ContentType.JSON)
                .body("[\"argo\",\"wf-42\"]")
                .when().post("/notifications")
                .then()
                .statusCode(400)
                .body("error", startsWith("Malformed JSON body"));
    }

    @Test
    void shouldAnswerRunQueries() throws InterruptedException {
        given()
                .contentType(ContentType.JSON)
                .body("{\"namespace\":\"argo\",\"name\":\"wf-42\"}")
                .when().post("/notifications")
                .then()
                .statusCode(202);
        RunPolling.awaitFinished("argo", "wf-42");

        given()
                .when().get("/runs")
                .then()
                .statusCode(200)
                .body("run.name", hasItem("wf-42"));

        given()
                .when().get("/runs/argo/never-notified")
                .then()
                .statusCode(404);

        given()
                .when().get("/runs/argo/Bad_Name")
                .then()
                .statusCode(400);
    }

    @Test
    void shouldReportArgoReachable() {
        given()
                .when().get("/status")
                .then()
                .statusCode(200)
                .body("argo.reachable", equalTo(true));
    }

    private static Map<String, Object> outcome(List<Map<String, Object>> outcomes, String name) {
        return outcomes.stream()
                .filter(o -> name.equals(o.get("artifactName")))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No outcome for " + name + " in " + outcomes));
    }
}
