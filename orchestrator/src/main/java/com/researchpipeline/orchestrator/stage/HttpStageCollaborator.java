package com.researchpipeline.orchestrator.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage collaborator reached over HTTP: the ingestion connector, the text
 * extractor and the embedding/index service each expose one endpoint.
 *
 * Request (POST, JSON):
 * <pre>
 *   {"taskId": "...", "stage": "process", "attempt": 1,
 *    "parameters": {...}, "priorOutputs": {"ingest": "..."}}
 * </pre>
 * Response: 2xx with {@code {"output": "..."}}. Error responses may carry
 * {@code {"error": "...", "retryable": true}} to declare that nothing was
 * committed. Without that flag, HTTP 429 and 503 and a refused connection
 * count as retryable; everything else does not.
 */
public class HttpStageCollaborator implements StageCollaborator {

    private static final Logger log = LoggerFactory.getLogger(HttpStageCollaborator.class);

    private final String       name;
    private final URI          endpoint;
    private final Duration     requestTimeout;
    private final HttpClient   http;
    private final ObjectMapper json;

    public HttpStageCollaborator(String name, URI endpoint, Duration requestTimeout,
                                 HttpClient http, ObjectMapper json) {
        this.name           = name;
        this.endpoint       = endpoint;
        this.requestTimeout = requestTimeout;
        this.http           = http;
        this.json           = json;
    }

    /** Client shared by all HTTP stages. */
    public static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String invoke(StageInvocation invocation) {
        log.info("Calling {} for stage '{}' (task={}, attempt={})",
                endpoint, name, invocation.taskId(), invocation.attemptNumber());

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(invocation)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (ConnectException e) {
            throw new StageFailureException(name + ": cannot connect to " + endpoint, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageFailureException(name + ": interrupted while waiting for " + endpoint, false, e);
        } catch (IOException e) {
            throw new StageFailureException(name + ": call to " + endpoint + " failed: " + e.getMessage(), false, e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw errorFrom(status, resp.body());
        }
        return outputFrom(resp.body());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String requestBody(StageInvocation invocation) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("taskId",       invocation.taskId().toString());
        body.put("stage",        invocation.stageName());
        body.put("attempt",      invocation.attemptNumber());
        body.put("parameters",   invocation.parameters());
        body.put("priorOutputs", invocation.priorOutputs());
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StageFailureException(name + ": parameters are not JSON-serializable", false, e);
        }
    }

    private String outputFrom(String body) {
        try {
            JsonNode node = json.readTree(body);
            JsonNode output = node == null ? null : node.get("output");
            if (output == null || output.isNull()) {
                throw new StageFailureException(name + ": response has no 'output' field", false);
            }
            return output.isTextual() ? output.asText() : json.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new StageFailureException(name + ": response is not valid JSON", false, e);
        }
    }

    private StageFailureException errorFrom(int status, String body) {
        boolean retryable = status == 429 || status == 503;
        String detail = body;
        try {
            JsonNode node = json.readTree(body);
            if (node != null && node.isObject()) {
                if (node.hasNonNull("error")) detail = node.get("error").asText();
                if (node.has("retryable"))    retryable = node.get("retryable").asBoolean();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body from {} is not JSON; using it verbatim", endpoint);
        }
        return new StageFailureException(name + " failed: HTTP " + status + ": " + detail, retryable);
    }
}
