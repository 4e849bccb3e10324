package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wirecrest.scraper.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class ApifyJobPlatformClient implements JobPlatformClient {
    private static final Logger log = LoggerFactory.getLogger(ApifyJobPlatformClient.class);
    private static final int MAX_ERROR_BODY = 500;

    private final SchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public ApifyJobPlatformClient(
        SchedulerProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("platformHttpExecutor") ExecutorService platformHttpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getPlatform().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(platformHttpExecutor)
            .build();
    }

    @Override
    public String createRecurringJob(RecurringJobDefinition definition) {
        SchedulerProperties.Platform platform = properties.getPlatform();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("name", definition.name());
        body.put("cronExpression", definition.cronExpression());
        body.put("isEnabled", definition.enabled());
        body.put("isExclusive", false);
        body.put("timezone", "UTC");
        ObjectNode action = body.putArray("actions").addObject();
        action.put("type", "RUN_ACTOR");
        action.put("actorId", definition.actorId());
        action.set("runInput", runInput(definition.input()));
        ObjectNode runOptions = action.putObject("runOptions");
        runOptions.put("build", platform.getBuild());
        runOptions.put("timeoutSecs", platform.getRunTimeoutSecs());
        runOptions.put("memoryMbytes", platform.getRunMemoryMbytes());

        JsonNode data = data(send("POST", "/schedules", body, false));
        String id = data.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new JobPlatformException("invalid_response", 0, false, "Schedule creation returned no id");
        }
        log.info("Created recurring job {} ({}) cron={}", id, definition.name(), definition.cronExpression());
        return id;
    }

    @Override
    public Optional<RecurringJob> getRecurringJob(String jobId) {
        try {
            JsonNode data = data(send("GET", "/schedules/" + encode(jobId), null, true));
            return Optional.of(new RecurringJob(
                data.path("id").asText(jobId),
                data.path("name").asText(null),
                data.path("cronExpression").asText(null),
                data.path("isEnabled").asBoolean(false),
                parseInstant(data.path("nextRunAt").asText(null))
            ));
        } catch (JobPlatformException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void updateRecurringJob(String jobId, ObjectNode input, boolean enabled) {
        JsonNode current = data(send("GET", "/schedules/" + encode(jobId), null, true));
        ArrayNode actions = objectMapper.createArrayNode();
        for (JsonNode existing : current.path("actions")) {
            if (!existing.isObject()) {
                continue;
            }
            ObjectNode action = ((ObjectNode) existing).deepCopy();
            action.set("runInput", runInput(input));
            actions.add(action);
        }
        if (actions.isEmpty()) {
            throw new JobPlatformException("invalid_response", 0, false, "Recurring job " + jobId + " has no actions");
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("isEnabled", enabled);
        body.set("actions", actions);
        send("PUT", "/schedules/" + encode(jobId), body, true);
    }

    @Override
    public void setRecurringJobEnabled(String jobId, boolean enabled) {
        JsonNode current = data(send("GET", "/schedules/" + encode(jobId), null, true));
        ObjectNode body = objectMapper.createObjectNode();
        body.put("isEnabled", enabled);
        body.set("actions", current.path("actions").deepCopy());
        send("PUT", "/schedules/" + encode(jobId), body, true);
    }

    @Override
    public void deleteRecurringJob(String jobId) {
        try {
            send("DELETE", "/schedules/" + encode(jobId), null, true);
        } catch (JobPlatformException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.info("Recurring job {} already gone", jobId);
        }
    }

    @Override
    public PlatformRun startRun(String actorId, ObjectNode input, List<WebhookSpec> webhooks) {
        SchedulerProperties.Platform platform = properties.getPlatform();
        StringBuilder path = new StringBuilder("/acts/")
            .append(encode(actorId))
            .append("/runs?memory=").append(platform.getRunMemoryMbytes())
            .append("&timeout=").append(platform.getRunTimeoutSecs())
            .append("&build=").append(encode(platform.getBuild()));
        if (webhooks != null && !webhooks.isEmpty()) {
            String encoded = Base64.getEncoder().encodeToString(toJson(webhooks).getBytes(StandardCharsets.UTF_8));
            path.append("&webhooks=").append(encode(encoded));
        }
        JsonNode data = data(send("POST", path.toString(), input, false));
        String runId = data.path("id").asText(null);
        if (runId == null || runId.isBlank()) {
            throw new JobPlatformException("invalid_response", 0, false, "Run start returned no id");
        }
        return new PlatformRun(
            runId,
            data.path("defaultDatasetId").asText(null),
            data.path("status").asText(null),
            parseInstant(data.path("startedAt").asText(null))
        );
    }

    @Override
    public List<JsonNode> fetchDatasetItems(String datasetId) {
        JsonNode body = send("GET", "/datasets/" + encode(datasetId) + "/items?format=json&clean=true", null, true);
        List<JsonNode> items = new ArrayList<>();
        if (body != null && body.isArray()) {
            body.forEach(items::add);
        }
        return items;
    }

    @Override
    public List<JsonNode> runSyncForItems(String actorId, ObjectNode input) {
        SchedulerProperties.Platform platform = properties.getPlatform();
        int timeoutSecs = platform.getProfileLookupTimeoutSecs();
        String path = "/acts/" + encode(actorId)
            + "/run-sync-get-dataset-items?format=json&clean=true"
            + "&memory=" + platform.getRunMemoryMbytes()
            + "&timeout=" + timeoutSecs
            + "&build=" + encode(platform.getBuild());
        // The request has to outlive the run it waits for.
        Duration requestTimeout = Duration.ofSeconds(timeoutSecs + platform.getRequestTimeoutSeconds());
        JsonNode body = executeOnce("POST", path, input, requireToken(), requestTimeout);
        List<JsonNode> items = new ArrayList<>();
        if (body != null && body.isArray()) {
            body.forEach(items::add);
        }
        return items;
    }

    private ObjectNode runInput(ObjectNode input) {
        ObjectNode runInput = objectMapper.createObjectNode();
        runInput.put("body", toJson(input == null ? objectMapper.createObjectNode() : input));
        runInput.put("contentType", "application/json; charset=utf-8");
        return runInput;
    }

    private JsonNode data(JsonNode body) {
        if (body == null || !body.has("data")) {
            throw new JobPlatformException("invalid_response", 0, false, "Response is missing the data envelope");
        }
        return body.get("data");
    }

    private String requireToken() {
        String token = properties.getPlatform().getToken();
        if (token == null || token.isBlank()) {
            throw JobPlatformException.configuration("scheduler.platform.token is not configured");
        }
        return token;
    }

    private JsonNode send(String method, String path, JsonNode body, boolean idempotent) {
        String token = requireToken();
        Duration timeout = Duration.ofSeconds(properties.getPlatform().getRequestTimeoutSeconds());
        int maxAttempts = idempotent ? 1 + properties.getPlatform().getMaxRetries() : 1;
        JobPlatformException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return executeOnce(method, path, body, token, timeout);
            } catch (JobPlatformException e) {
                last = e;
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("Retrying {} {} after {} (attempt {}/{})", method, path, e.getCode(), attempt, maxAttempts);
                if (!sleepBackoff(attempt)) {
                    throw e;
                }
            }
        }
        throw last;
    }

    private JsonNode executeOnce(String method, String path, JsonNode body, String token, Duration timeout) {
        URI uri;
        try {
            uri = URI.create(properties.getPlatform().getBaseUrl().replaceAll("/+$", "") + path);
        } catch (IllegalArgumentException e) {
            throw new JobPlatformException("invalid_url", "Malformed platform URL for " + path, e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Authorization", "Bearer " + token)
            .header("Accept", "application/json");
        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(toJson(body), StandardCharsets.UTF_8);
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        HttpRequest request = builder.method(method, publisher).build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new JobPlatformException("timeout", 0, true, method + " " + path + " timed out");
        } catch (IOException e) {
            throw new JobPlatformException("io_error", 0, true, method + " " + path + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobPlatformException("interrupted", 0, false, method + " " + path + " interrupted");
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 408 || status == 429 || status >= 500;
            throw new JobPlatformException(
                "http_error",
                status,
                retryable,
                method + " " + path + " returned " + status + ": " + truncate(response.body())
            );
        }
        String responseBody = response.body();
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new JobPlatformException("invalid_response", "Unparseable response from " + path, e);
        }
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getPlatform().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getPlatform().getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize platform request", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank() || "null".equals(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY);
    }
}
