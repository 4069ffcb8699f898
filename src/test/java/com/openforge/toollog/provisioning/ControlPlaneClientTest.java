package com.openforge.toollog.provisioning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toollog.config.AppConfig;
import com.openforge.toollog.provisioning.model.RemoteProject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the client against an in-process HTTP server that answers with
 * canned responses per "METHOD path".
 */
class ControlPlaneClientTest {

    private HttpServer server;
    private final Map<String, Canned>  routes   = new ConcurrentHashMap<>();
    private final List<Recorded>       requests = new CopyOnWriteArrayList<>();

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private CircuitBreaker circuitBreaker;

    private record Canned(int status, String body) {}

    private record Recorded(String method, String path, String query, String authorization, String body) {}

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        circuitBreaker = CircuitBreaker.ofDefaults("controlPlaneTest");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void listsProjectsWithBearerToken() {
        routes.put("GET /projects", new Canned(200, """
                {"projects":[{"id":"p-1","name":"db-aaaa","region_id":"aws-us-east-2"}]}"""));

        List<RemoteProject> projects = client("  secret-key  ").listProjects();

        assertThat(projects).containsExactly(new RemoteProject("p-1", "db-aaaa", "aws-us-east-2"));
        assertThat(requests).singleElement()
                .satisfies(r -> assertThat(r.authorization()).isEqualTo("Bearer secret-key"));
    }

    @Test
    void missingProjectListIsEmpty() {
        routes.put("GET /projects", new Canned(200, "{}"));

        assertThat(client("k").listProjects()).isEmpty();
    }

    @Test
    void createsProjectByName() throws Exception {
        routes.put("POST /projects", new Canned(201, """
                {"project":{"id":"p-9","name":"db-bbbb"},"connection_uris":[]}"""));

        Optional<RemoteProject> created = client("k").createProject("db-bbbb");

        assertThat(created).contains(new RemoteProject("p-9", "db-bbbb", null));
        Recorded request = requests.get(0);
        assertThat(objectMapper.readTree(request.body()).at("/project/name").asText()).isEqualTo("db-bbbb");
    }

    @Test
    void conflictOnCreateMeansAlreadyExists() {
        routes.put("POST /projects", new Canned(409, "{\"message\":\"project already exists\"}"));

        assertThat(client("k").createProject("db-bbbb")).isEmpty();
    }

    @Test
    void fetchesConnectionUriForOwnerRole() {
        routes.put("GET /projects/p-1/connection_uri", new Canned(200,
                "{\"uri\":\"postgres://neondb_owner:pw@ep-1.neon.tech/neondb\"}"));

        String uri = client("k").getConnectionUri("p-1");

        assertThat(uri).isEqualTo("postgres://neondb_owner:pw@ep-1.neon.tech/neondb");
        assertThat(requests.get(0).query()).isEqualTo("database_name=neondb&role_name=neondb_owner");
    }

    @Test
    void acceptsLegacyConnectionUriField() {
        routes.put("GET /projects/p-1/connection_uri", new Canned(200,
                "{\"connection_uri\":\"postgres://u:p@h/db\"}"));

        assertThat(client("k").getConnectionUri("p-1")).isEqualTo("postgres://u:p@h/db");
    }

    @Test
    void errorStatusCarriesStatusAndBody() {
        routes.put("GET /projects", new Canned(500, "upstream exploded"));

        assertThatThrownBy(() -> client("k").listProjects())
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("upstream exploded")
                .satisfies(e -> {
                    ProvisioningException pe = (ProvisioningException) e;
                    assertThat(pe.getStatus()).isEqualTo(500);
                    assertThat(pe.getResponseBody()).isEqualTo("upstream exploded");
                });
    }

    @Test
    void malformedBodyIsAParseError() {
        routes.put("GET /projects", new Canned(200, "<html>not json</html>"));

        assertThatThrownBy(() -> client("k").listProjects())
                .isInstanceOf(ControlPlaneParseException.class);
    }

    @Test
    void connectionUriWithoutUriIsAParseError() {
        routes.put("GET /projects/p-1/connection_uri", new Canned(200, "{}"));

        assertThatThrownBy(() -> client("k").getConnectionUri("p-1"))
                .isInstanceOf(ControlPlaneParseException.class);
    }

    @Test
    void missingApiKeyFailsBeforeAnyRequest() {
        ControlPlaneClient client = client("   ");

        assertThatThrownBy(client::listProjects).isInstanceOf(ControlPlaneConfigurationException.class);
        assertThatThrownBy(() -> client.createProject("db-x")).isInstanceOf(ControlPlaneConfigurationException.class);
        assertThatThrownBy(() -> client.getConnectionUri("p-1")).isInstanceOf(ControlPlaneConfigurationException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void openCircuitFailsFastWithoutRequest() {
        circuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> client("k").listProjects())
                .isInstanceOf(ProvisioningException.class)
                .hasCauseInstanceOf(CallNotPermittedException.class);
        assertThat(requests).isEmpty();
    }

    private ControlPlaneClient client(String apiKey) {
        ControlPlaneProperties props = new ControlPlaneProperties(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/",
                apiKey, "neondb", "neondb_owner", 5);
        return new ControlPlaneClient(new AppConfig().httpClient(), objectMapper, props, circuitBreaker);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path   = exchange.getRequestURI().getPath();
        String body   = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(method, path, exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"), body));

        Canned canned = routes.getOrDefault(method + " " + path, new Canned(404, "{\"message\":\"not found\"}"));
        byte[] bytes = canned.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(canned.status(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
