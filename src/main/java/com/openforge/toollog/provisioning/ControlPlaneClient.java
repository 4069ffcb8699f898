package com.openforge.toollog.provisioning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toollog.provisioning.model.ConnectionUriResponse;
import com.openforge.toollog.provisioning.model.CreateProjectRequest;
import com.openforge.toollog.provisioning.model.ProjectListResponse;
import com.openforge.toollog.provisioning.model.ProjectResponse;
import com.openforge.toollog.provisioning.model.RemoteProject;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Thin client for the database-hosting control-plane API.
 *
 * Three calls, all synchronous on the caller's thread:
 *
 *   listProjects()        GET  /projects
 *   createProject(name)   POST /projects            (409 → already exists, not an error)
 *   getConnectionUri(id)  GET  /projects/{id}/connection_uri?database_name=&role_name=
 *
 * Raw HttpClient + Jackson only, same as the rest of the outbound HTTP code.
 * Nothing here retries; a circuit breaker makes repeated failures fail fast.
 */
@Slf4j
@Component
public class ControlPlaneClient {

    private static final int HTTP_CONFLICT = 409;

    private final HttpClient             httpClient;
    private final ObjectMapper           objectMapper;
    private final ControlPlaneProperties props;
    private final CircuitBreaker         circuitBreaker;

    public ControlPlaneClient(HttpClient httpClient,
                              ObjectMapper objectMapper,
                              ControlPlaneProperties props,
                              @Qualifier("controlPlaneCircuitBreaker") CircuitBreaker circuitBreaker) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.props          = props;
        this.circuitBreaker = circuitBreaker;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public List<RemoteProject> listProjects() {
        String apiKey = props.requireApiKey();
        HttpRequest request = baseRequest("/projects", apiKey).GET().build();

        log.debug("[ControlPlane] → GET /projects");
        HttpResponse<String> response = execute(request, "list projects", Set.of());
        List<RemoteProject> projects = parse(response, ProjectListResponse.class, "list projects")
                .projectsOrEmpty();
        log.debug("[ControlPlane] ← {} project(s)", projects.size());
        return projects;
    }

    /**
     * Creates a project with the given name.
     *
     * @return the created project, or empty when the control plane reports
     *         that the project already exists (HTTP 409)
     */
    public Optional<RemoteProject> createProject(String name) {
        String apiKey = props.requireApiKey();
        String body = serialize(CreateProjectRequest.named(name));
        HttpRequest request = baseRequest("/projects", apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("[ControlPlane] → POST /projects name={}", name);
        HttpResponse<String> response = execute(request, "create project", Set.of(HTTP_CONFLICT));
        if (response.statusCode() == HTTP_CONFLICT) {
            log.info("[ControlPlane] Project '{}' already exists (HTTP 409).", name);
            return Optional.empty();
        }

        ProjectResponse created = parse(response, ProjectResponse.class, "create project");
        if (created.project() == null || created.project().id() == null) {
            throw new ControlPlaneParseException("Create project response carried no project",
                    response.statusCode(), response.body(), null);
        }
        return Optional.of(created.project());
    }

    public String getConnectionUri(String projectId) {
        String apiKey = props.requireApiKey();
        String path = "/projects/%s/connection_uri?database_name=%s&role_name=%s".formatted(
                encode(projectId), encode(props.databaseName()), encode(props.roleName()));
        HttpRequest request = baseRequest(path, apiKey).GET().build();

        log.debug("[ControlPlane] → GET /projects/{}/connection_uri", projectId);
        HttpResponse<String> response = execute(request, "get connection URI", Set.of());
        String uri = parse(response, ConnectionUriResponse.class, "get connection URI").value();
        if (uri == null || uri.isBlank()) {
            throw new ControlPlaneParseException("Connection URI response carried no URI",
                    response.statusCode(), response.body(), null);
        }
        return uri;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest.Builder baseRequest(String path, String apiKey) {
        return HttpRequest.newBuilder()
                .uri(URI.create(props.normalizedBaseUrl() + path))
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(Duration.ofSeconds(props.timeoutSeconds()));
    }

    /**
     * Sends through the circuit breaker. Statuses outside 2xx and {@code tolerated}
     * become a {@link ProvisioningException} and count as breaker failures.
     */
    private HttpResponse<String> execute(HttpRequest request, String action, Set<Integer> tolerated) {
        try {
            return circuitBreaker.executeSupplier(() -> {
                HttpResponse<String> response = send(request, action);
                int status = response.statusCode();
                if ((status < 200 || status >= 300) && !tolerated.contains(status)) {
                    throw new ProvisioningException(
                            "Control plane failed to %s: HTTP %d: %s".formatted(action, status, response.body()),
                            status, response.body());
                }
                return response;
            });
        } catch (CallNotPermittedException e) {
            throw new ProvisioningException(
                    "Control plane circuit is open; refusing to " + action, e);
        }
    }

    private HttpResponse<String> send(HttpRequest request, String action) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted while trying to " + action, e);
        } catch (IOException e) {
            throw new ProvisioningException("Network error while trying to " + action, e);
        }
    }

    private <T> T parse(HttpResponse<String> response, Class<T> type, String action) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            throw new ControlPlaneParseException("Empty response body from " + action,
                    response.statusCode(), body, null);
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ControlPlaneParseException("Failed to parse response from " + action,
                    response.statusCode(), body, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize control-plane request", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
