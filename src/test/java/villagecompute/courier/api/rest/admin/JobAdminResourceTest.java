package villagecompute.courier.api.rest.admin;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.courier.TestFixtures;
import villagecompute.courier.data.models.ScheduledJob;
import villagecompute.courier.jobs.FailingTestTemplate;
import villagecompute.courier.jobs.RecordingTestTemplate;
import villagecompute.courier.services.JobRegistryService;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for the job admin endpoints.
 *
 * <p>
 * Tests cover:
 * <ul>
 * <li>Job creation with defaults and validation errors</li>
 * <li>Partial update, enable/disable and delete</li>
 * <li>Manual runs and execution history</li>
 * <li>Template listing</li>
 * </ul>
 */
@QuarkusTest
public class JobAdminResourceTest {

    private static final String BASE = "/admin/api/jobs";

    @Inject
    JobRegistryService registry;

    @Inject
    EntityManager entityManager;

    @BeforeEach
    @Transactional
    public void setupTestData() {
        TestFixtures.cleanDatabase(entityManager);
    }

    @Test
    public void testCreateJob_ReturnsCreatedJob() {
        String body = """
                {
                  "name": "nightly-recorder",
                  "template_type": "test_recording",
                  "parameters": {"limit": 4},
                  "schedule": {"kind": "cron", "expression": "0 3 * * *", "timezone": "Europe/Berlin"},
                  "retry_policy": {"max_retries": 1, "retry_delay_seconds": 30}
                }
                """;

        given().contentType(ContentType.JSON).body(body).queryParam("actor", "ops-team").when().post(BASE).then()
                .statusCode(201).body("id", notNullValue()).body("name", is("nightly-recorder"))
                .body("template_type", is("test_recording")).body("schedule.kind", is("cron"))
                .body("schedule.timezone", is("Europe/Berlin")).body("retry_policy.max_retries", is(1))
                .body("timeout_seconds", is(3600)).body("created_by", is("ops-team")).body("enabled", is(true))
                .body("next_run_at", notNullValue());
    }

    @Test
    public void testCreateJob_InvalidDefinitionsReturn400() {
        registry.createJob(TestFixtures.intervalJob("taken", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 60),
                "tester");

        given().contentType(ContentType.JSON)
                .body("{\"name\":\"taken\",\"template_type\":\"test_recording\","
                        + "\"schedule\":{\"kind\":\"interval\",\"interval_seconds\":60}}")
                .when().post(BASE).then().statusCode(400).body("error", containsString("already exists"));

        given().contentType(ContentType.JSON)
                .body("{\"name\":\"mystery\",\"template_type\":\"no_such_template\","
                        + "\"schedule\":{\"kind\":\"interval\",\"interval_seconds\":60}}")
                .when().post(BASE).then().statusCode(400);

        given().contentType(ContentType.JSON)
                .body("{\"name\":\"bad-cron\",\"template_type\":\"test_recording\","
                        + "\"schedule\":{\"kind\":\"cron\",\"expression\":\"sometimes\"}}")
                .when().post(BASE).then().statusCode(400);
    }

    @Test
    public void testGetJob_UnknownReturns404() {
        given().when().get(BASE + "/999999").then().statusCode(404).body("error", containsString("999999"));
    }

    @Test
    public void testUpdateAndToggleJob() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 60), "tester");

        given().contentType(ContentType.JSON).body("{\"schedule\":{\"kind\":\"interval\",\"interval_seconds\":600}}")
                .when().patch(BASE + "/" + job.id).then().statusCode(200).body("schedule.interval_seconds", is(600));

        given().contentType(ContentType.JSON).body("{\"parameters\":{\"limit\":99}}").when()
                .patch(BASE + "/" + job.id).then().statusCode(400);

        given().contentType(ContentType.JSON).when().post(BASE + "/" + job.id + "/disable").then().statusCode(200)
                .body("enabled", is(false));

        given().queryParam("include_disabled", false).when().get(BASE).then().statusCode(200).body("size()", is(0));
        given().when().get(BASE).then().statusCode(200).body("size()", is(1)).body("[0].name", is("recorder"));

        given().contentType(ContentType.JSON).when().post(BASE + "/" + job.id + "/enable").then().statusCode(200)
                .body("enabled", is(true));
    }

    @Test
    public void testRunJob_ManualRunRecordsExecution() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("recorder", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 3600), "tester");

        given().contentType(ContentType.JSON).queryParam("actor", "ana").when().post(BASE + "/" + job.id + "/run")
                .then().statusCode(200).body("status", is("success")).body("triggered_by", is("manual:ana"))
                .body("attempt", is(1));

        given().when().get(BASE + "/" + job.id + "/executions").then().statusCode(200).body("total", is(1))
                .body("executions[0].status", is("success"));
        given().queryParam("status", "failed").when().get(BASE + "/" + job.id + "/executions").then()
                .statusCode(200).body("total", is(0));
        given().queryParam("status", "exploded").when().get(BASE + "/" + job.id + "/executions").then()
                .statusCode(400);
    }

    @Test
    public void testRunJob_FailureIsReportedNotThrown() {
        ScheduledJob job = registry.createJob(
                TestFixtures.intervalJob("failing", FailingTestTemplate.TEMPLATE_TYPE, Map.of(), 3600), "tester");

        given().contentType(ContentType.JSON).when().post(BASE + "/" + job.id + "/run").then().statusCode(200)
                .body("status", is("failed")).body("errors[0]", is(FailingTestTemplate.ERROR));
    }

    @Test
    public void testDeleteJob() {
        ScheduledJob unused = registry.createJob(
                TestFixtures.intervalJob("unused", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 3600), "tester");
        ScheduledJob used = registry.createJob(
                TestFixtures.intervalJob("used", RecordingTestTemplate.TEMPLATE_TYPE, Map.of(), 3600), "tester");
        given().contentType(ContentType.JSON).when().post(BASE + "/" + used.id + "/run").then().statusCode(200);

        given().when().delete(BASE + "/" + unused.id).then().statusCode(200).body("soft_deleted", is(false));
        given().when().delete(BASE + "/" + used.id).then().statusCode(200).body("soft_deleted", is(true));

        given().when().get(BASE + "/" + used.id).then().statusCode(404);
        given().when().delete(BASE + "/" + used.id).then().statusCode(404);
    }

    @Test
    public void testListTemplates() {
        given().when().get(BASE + "/templates").then().statusCode(200)
                .body("template_type", hasItems("notification_dispatcher", "stuck_notification_recovery",
                        "notification_retention_cleanup", "pending_messages_notifier"));
    }
}
