package com.superintendent.orchestrator.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.superintendent.orchestrator.backend.dto.ExecRequest;
import com.superintendent.orchestrator.backend.dto.ExecResponse;
import com.superintendent.orchestrator.backend.dto.StepExecuteRequest;
import com.superintendent.orchestrator.backend.dto.StepExecuteResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the sandbox executor service.
 *
 * The service owns git worktrees, sandboxes and credentials; this client only
 * forwards step requests and status probes. Calls block, which is fine on the
 * run worker threads.
 */
public class SandboxClient {

    private static final Logger log = LoggerFactory.getLogger(SandboxClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public SandboxClient(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, objectMapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    SandboxClient(String baseUrl, ObjectMapper objectMapper, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = http;
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    /**
     * Execute one workflow step remotely.
     *
     * @throws BackendException on a non-2xx status, I/O failure or unreadable body
     */
    public StepExecuteResponse executeStep(StepExecuteRequest request) {
        log.debug("Executing step '{}' ({}) remotely", request.step_id(), request.action());
        // Sandbox preparation and image pulls can take minutes.
        String respBody = post("/steps/execute", toJson(request),
                "executeStep " + request.step_id(), Duration.ofMinutes(10));
        try {
            return json.readValue(respBody, StepExecuteResponse.class);
        } catch (JsonProcessingException e) {
            throw new BackendException("Failed to parse executeStep response", e);
        }
    }

    // ------------------------------------------------------------------
    // Sandboxes
    // ------------------------------------------------------------------

    /**
     * Run a shell command inside a named sandbox.
     *
     * @throws BackendException on a non-2xx status, I/O failure or unreadable body
     */
    public ExecResponse exec(String sandboxName, String command, int timeoutSec) {
        String path = "/sandboxes/" + URLEncoder.encode(sandboxName, StandardCharsets.UTF_8) + "/exec";
        String respBody = post(path, toJson(new ExecRequest(command, timeoutSec)),
                "exec in " + sandboxName, Duration.ofSeconds(timeoutSec + 30L));
        try {
            return json.readValue(respBody, ExecResponse.class);
        } catch (JsonProcessingException e) {
            throw new BackendException("Failed to parse exec response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new BackendException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (BackendException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new BackendException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new BackendException("JSON serialization failed", e);
        }
    }
}
