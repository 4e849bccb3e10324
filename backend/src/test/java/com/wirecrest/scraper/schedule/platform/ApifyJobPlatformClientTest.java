package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.TargetType;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApifyJobPlatformClientTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private SchedulerProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new SchedulerProperties();
        properties.getPlatform().setBaseUrl(server.url("/v2").toString());
        properties.getPlatform().setToken("secret-token");
        properties.getPlatform().setRequestTimeoutSeconds(5);
        properties.getPlatform().setMaxRetries(2);
        properties.getPlatform().setRetryBaseDelayMs(1);
        properties.getPlatform().setRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void createsScheduleWithRunActorAction() throws Exception {
        server.enqueue(json(201, "{\"data\":{\"id\":\"sched-1\"}}"));
        ObjectNode input = objectMapper.createObjectNode();
        input.putArray("placeIds").add("place-1");

        String id = client().createRecurringJob(
            new RecurringJobDefinition("google_reviews_24h", "0 9 * * *", "actor-1", false, input));

        assertThat(id).isEqualTo("sched-1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v2/schedules");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-token");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("name").asText()).isEqualTo("google_reviews_24h");
        assertThat(body.path("cronExpression").asText()).isEqualTo("0 9 * * *");
        assertThat(body.path("isEnabled").asBoolean()).isFalse();
        assertThat(body.path("timezone").asText()).isEqualTo("UTC");
        JsonNode action = body.path("actions").get(0);
        assertThat(action.path("type").asText()).isEqualTo("RUN_ACTOR");
        assertThat(action.path("actorId").asText()).isEqualTo("actor-1");
        JsonNode runInput = objectMapper.readTree(action.path("runInput").path("body").asText());
        assertThat(runInput.path("placeIds").get(0).asText()).isEqualTo("place-1");
    }

    @Test
    void updateReplacesRunInputAndKeepsOtherActionFields() throws Exception {
        server.enqueue(json(200, """
            {"data":{"id":"sched-1","actions":[{"type":"RUN_ACTOR","actorId":"actor-1",
            "runInput":{"body":"{}","contentType":"application/json"},"runOptions":{"memoryMbytes":1024}}]}}
            """));
        server.enqueue(json(200, "{\"data\":{\"id\":\"sched-1\"}}"));
        ObjectNode input = objectMapper.createObjectNode();
        input.putArray("placeIds").add("place-9");

        client().updateRecurringJob("sched-1", input, true);

        assertThat(server.takeRequest().getMethod()).isEqualTo("GET");
        RecordedRequest put = server.takeRequest();
        assertThat(put.getMethod()).isEqualTo("PUT");
        assertThat(put.getPath()).isEqualTo("/v2/schedules/sched-1");
        JsonNode body = objectMapper.readTree(put.getBody().readUtf8());
        assertThat(body.path("isEnabled").asBoolean()).isTrue();
        JsonNode action = body.path("actions").get(0);
        assertThat(action.path("runOptions").path("memoryMbytes").asInt()).isEqualTo(1024);
        assertThat(objectMapper.readTree(action.path("runInput").path("body").asText()).path("placeIds").get(0).asText())
            .isEqualTo("place-9");
    }

    @Test
    void deleteTreatsMissingScheduleAsDeleted() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":{\"type\":\"record-not-found\"}}"));

        client().deleteRecurringJob("gone");

        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void retriesIdempotentRequestOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(json(200, "[{\"placeId\":\"place-1\",\"reviewId\":\"r1\"}]"));

        List<JsonNode> items = client().fetchDatasetItems("dataset-1");

        assertThat(items).hasSize(1);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void profileLookupRunsActorSynchronouslyAndReadsName() throws Exception {
        properties.getPlatform().setProfileLookupTimeoutSecs(90);
        server.enqueue(json(201, "[{\"title\":\"Acme Bakery\",\"placeId\":\"place-7\"}]"));
        JobPlatformProfileLookupClient lookup = new JobPlatformProfileLookupClient(client(), new ActorInputFactory(objectMapper));

        TargetProfile profile = lookup.fetchProfile(TargetType.GOOGLE, "place-7");

        assertThat(profile.displayName()).isEqualTo("Acme Bakery");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath())
            .startsWith("/v2/acts/" + TargetType.GOOGLE.actorId() + "/run-sync-get-dataset-items?")
            .contains("timeout=90");
        JsonNode input = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(input.path("placeIds").get(0).asText()).isEqualTo("place-7");
        assertThat(input.path("maxReviews").asInt()).isEqualTo(1);
    }

    @Test
    void profileLookupWithNoItemsIsNotFound() {
        server.enqueue(json(201, "[]"));
        JobPlatformProfileLookupClient lookup = new JobPlatformProfileLookupClient(client(), new ActorInputFactory(objectMapper));

        assertThatThrownBy(() -> lookup.fetchProfile(TargetType.FACEBOOK, "https://www.facebook.com/closed"))
            .isInstanceOf(JobPlatformException.class)
            .satisfies(e -> assertThat(((JobPlatformException) e).getCode()).isEqualTo("profile_not_found"));
    }

    @Test
    void doesNotRetryRunStart() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(json(201, "{\"data\":{\"id\":\"run-1\"}}"));

        assertThatThrownBy(() -> client().startRun("actor-1", objectMapper.createObjectNode(), List.of()))
            .isInstanceOf(JobPlatformException.class)
            .satisfies(e -> assertThat(((JobPlatformException) e).getStatusCode()).isEqualTo(503));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void startRunPassesWebhooksAsEncodedQueryParameter() throws Exception {
        server.enqueue(json(201, "{\"data\":{\"id\":\"run-1\",\"defaultDatasetId\":\"ds-1\",\"status\":\"READY\"}}"));
        WebhookSpec webhook = new WebhookSpec(List.of("ACTOR.RUN.SUCCEEDED"), "http://scheduler.test/webhooks/apify?token=x", "{}");

        PlatformRun run = client().startRun("actor-1", objectMapper.createObjectNode(), List.of(webhook));

        assertThat(run.id()).isEqualTo("run-1");
        assertThat(run.datasetId()).isEqualTo("ds-1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/v2/acts/actor-1/runs");
        assertThat(request.getRequestUrl().queryParameter("webhooks")).isNotBlank();
    }

    @Test
    void missingTokenFailsWithoutCallingPlatform() {
        properties.getPlatform().setToken(" ");

        assertThatThrownBy(() -> client().getRecurringJob("sched-1"))
            .isInstanceOf(JobPlatformException.class)
            .satisfies(e -> assertThat(((JobPlatformException) e).getCode()).isEqualTo("configuration"));
        assertThat(server.getRequestCount()).isZero();
    }

    private ApifyJobPlatformClient client() {
        return new ApifyJobPlatformClient(properties, objectMapper, executor);
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
