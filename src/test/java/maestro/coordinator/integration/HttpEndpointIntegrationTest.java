package maestro.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.server.CoordinatorNettyServer;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the coordinator through its HTTP and WebSocket endpoints on an ephemeral port.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Dependencies deps;
    private CoordinatorNettyServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withServerHost("127.0.0.1")
                .withServerPort(0);
        deps = Dependencies.create(config);
        server = new CoordinatorNettyServer(deps);
        server.start();
        assertTrue(server.isRunning());
        baseUrl = "http://127.0.0.1:" + server.port();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        assertFalse(server.isRunning());
        deps.close();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .timeout(Duration.ofSeconds(10))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response, int expectedStatus) throws Exception {
        assertEquals(expectedStatus, response.statusCode(), "Body: " + response.body());
        return MAPPER.readTree(response.body());
    }

    private String createProject() throws Exception {
        return json(send("POST", "/api/v1/projects", """
                {"name": "Demo", "workingDir": "/work/demo"}
                """), 201).get("id").asText();
    }

    private String createTask(String projectId, String title) throws Exception {
        return json(send("POST", "/api/v1/tasks", String.format("""
                {"projectId": "%s", "title": "%s"}
                """, projectId, title)), 201).get("id").asText();
    }

    @Test
    @DisplayName("Full HTTP flow: long-poll claim is answered by a push, then completed")
    void queueFlowOverHttp() throws Exception {
        String projectId = createProject();
        String taskId = createTask(projectId, "Build parser");
        String sessionId = json(send("POST", "/api/v1/sessions", String.format("""
                {"projectId": "%s", "name": "worker-1", "strategy": "queue"}
                """, projectId)), 201).get("id").asText();

        CompletableFuture<HttpResponse<String>> claim = httpClient.sendAsync(
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/api/v1/sessions/" + sessionId + "/queue/claim?timeoutMs=5000"))
                        .POST(HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        long deadline = System.currentTimeMillis() + 2000;
        while (deps.queueService().waitingCount(sessionId) == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(claim.isDone());

        JsonNode pushed = json(send("POST", "/api/v1/sessions/" + sessionId + "/queue/push",
                String.format("{\"taskIds\": [\"%s\"]}", taskId)), 200);
        assertEquals(1, pushed.get("stats").get("total").asInt());

        JsonNode claimed = json(claim.get(5, TimeUnit.SECONDS), 200);
        assertTrue(claimed.get("claimed").asBoolean());
        assertEquals(taskId, claimed.get("item").get("taskId").asText());
        assertEquals("processing", claimed.get("item").get("status").asText());

        JsonNode current = json(send("GET", "/api/v1/sessions/" + sessionId + "/queue/current", null), 200);
        assertEquals(taskId, current.get("item").get("taskId").asText());
        JsonNode peek = json(send("GET", "/api/v1/sessions/" + sessionId + "/queue/peek", null), 200);
        assertTrue(peek.path("item").isMissingNode() || peek.get("item").isNull());
        JsonNode queues = json(send("GET", "/api/v1/queues", null), 200);
        assertEquals(1, queues.size());

        JsonNode completed = json(send("POST", "/api/v1/sessions/" + sessionId + "/queue/complete", null), 200);
        assertEquals("completed", completed.get("status").asText());

        JsonNode stats = json(send("GET", "/api/v1/sessions/" + sessionId + "/queue/stats", null), 200);
        assertEquals(1, stats.get("completed").asInt());

        JsonNode task = json(send("GET", "/api/v1/tasks/" + taskId, null), 200);
        assertEquals("completed", task.get("taskSessionStatuses").get(sessionId).asText());
    }

    @Test
    void claimTimesOutWithNoWork() throws Exception {
        String projectId = createProject();
        String sessionId = json(send("POST", "/api/v1/sessions", String.format("""
                {"projectId": "%s", "strategy": "queue"}
                """, projectId)), 201).get("id").asText();

        JsonNode result = json(send("POST", "/api/v1/sessions/" + sessionId + "/queue/claim?timeoutMs=100", null),
                200);

        assertFalse(result.get("claimed").asBoolean());
        assertFalse(result.has("item"));
    }

    @Test
    void taskLifecycleOverHttp() throws Exception {
        String projectId = createProject();
        String taskId = createTask(projectId, "Write docs");

        JsonNode started = json(send("POST", "/api/v1/tasks/" + taskId + "/status",
                "{\"status\": \"in_progress\"}"), 200);
        assertEquals("in_progress", started.get("status").asText());
        assertTrue(started.hasNonNull("startedAt"));

        JsonNode renamed = json(send("PATCH", "/api/v1/tasks/" + taskId, "{\"title\": \"Write more docs\"}"), 200);
        assertEquals("Write more docs", renamed.get("title").asText());

        JsonNode listed = json(send("GET", "/api/v1/tasks?projectId=" + projectId + "&status=in_progress", null),
                200);
        assertEquals(1, listed.size());

        JsonNode deleted = json(send("DELETE", "/api/v1/tasks/" + taskId, null), 200);
        assertEquals(taskId, deleted.get("id").asText());
        json(send("GET", "/api/v1/tasks/" + taskId, null), 404);
    }

    @Test
    void taskListsAndOrderingOverHttp() throws Exception {
        String projectId = createProject();
        String first = createTask(projectId, "First");
        String second = createTask(projectId, "Second");

        String listId = json(send("POST", "/api/v1/task-lists", String.format("""
                {"projectId": "%s", "name": "Sprint", "orderedTaskIds": ["%s"]}
                """, projectId, first)), 201).get("id").asText();

        JsonNode added = json(send("POST", "/api/v1/task-lists/" + listId + "/tasks/" + second, null), 200);
        assertEquals(2, added.get("orderedTaskIds").size());

        JsonNode reordered = json(send("PUT", "/api/v1/task-lists/" + listId + "/reorder",
                String.format("{\"orderedTaskIds\": [\"%s\", \"%s\"]}", second, first)), 200);
        assertEquals(second, reordered.get("orderedTaskIds").get(0).asText());
        json(send("PUT", "/api/v1/task-lists/" + listId + "/reorder", "{}"), 400);

        JsonNode renamed = json(send("PATCH", "/api/v1/task-lists/" + listId, "{\"name\": \"Sprint 2\"}"), 200);
        assertEquals("Sprint 2", renamed.get("name").asText());
        assertEquals(1, json(send("GET", "/api/v1/task-lists?projectId=" + projectId, null), 200).size());

        JsonNode removed = json(send("DELETE", "/api/v1/task-lists/" + listId + "/tasks/" + second, null), 200);
        assertEquals(1, removed.get("orderedTaskIds").size());
        json(send("DELETE", "/api/v1/task-lists/" + listId, null), 200);
        json(send("GET", "/api/v1/task-lists/" + listId, null), 404);

        JsonNode empty = json(send("GET", "/api/v1/ordering/task/" + projectId, null), 200);
        assertEquals(0, empty.get("orderedIds").size());
        JsonNode saved = json(send("PUT", "/api/v1/ordering/task-list/" + projectId,
                "{\"orderedIds\": [\"task_list_x\"]}"), 200);
        assertEquals("task-list", saved.get("entityType").asText());
        JsonNode reloaded = json(send("GET", "/api/v1/ordering/task-list/" + projectId, null), 200);
        assertEquals("task_list_x", reloaded.get("orderedIds").get(0).asText());
        json(send("GET", "/api/v1/ordering/team/" + projectId, null), 400);
    }

    @Test
    @DisplayName("Errors use the uniform {error, code, message, statusCode} body")
    void errorBodies() throws Exception {
        JsonNode missing = json(send("GET", "/api/v1/tasks/task_missing", null), 404);
        assertTrue(missing.get("error").asBoolean());
        assertEquals("NOT_FOUND", missing.get("code").asText());
        assertEquals(404, missing.get("statusCode").asInt());
        assertTrue(missing.get("message").asText().contains("task_missing"));

        JsonNode badJson = json(send("POST", "/api/v1/projects", "{not json"), 400);
        assertEquals("VALIDATION_ERROR", badJson.get("code").asText());

        String projectId = createProject();
        String taskId = createTask(projectId, "t");
        JsonNode badTransition = json(send("POST", "/api/v1/tasks/" + taskId + "/status",
                "{\"status\": \"completed\"}"), 400);
        assertEquals("VALIDATION_ERROR", badTransition.get("code").asText());

        JsonNode busy = json(send("DELETE", "/api/v1/projects/" + projectId, null), 422);
        assertEquals("BUSINESS_RULE_ERROR", busy.get("code").asText());

        JsonNode noRoute = json(send("GET", "/api/v2/nothing", null), 404);
        assertEquals("NOT_FOUND", noRoute.get("code").asText());
    }

    @Test
    void healthReportsCounts() throws Exception {
        createTask(createProject(), "t");

        JsonNode health = json(send("GET", "/api/v1/health", null), 200);

        assertEquals("healthy", health.get("status").asText());
        assertEquals("ok", health.get("database").asText());
        assertEquals(1, health.get("tasks").asInt());
    }

    @Test
    @DisplayName("WebSocket clients receive domain events as JSON frames")
    void webSocketReceivesEvents() throws Exception {
        BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        WebSocket.Listener listener = new WebSocket.Listener() {
            private final StringBuilder partial = new StringBuilder();

            @Override
            public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                partial.append(data);
                if (last) {
                    try {
                        frames.add(MAPPER.readTree(partial.toString()));
                    } catch (Exception e) {
                        fail("unreadable frame: " + partial);
                    }
                    partial.setLength(0);
                }
                webSocket.request(1);
                return null;
            }
        };
        WebSocket socket = httpClient.newWebSocketBuilder()
                .buildAsync(URI.create("ws://127.0.0.1:" + server.port() + "/ws"), listener)
                .get(5, TimeUnit.SECONDS);
        try {
            JsonNode hello = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(hello);
            assertEquals("connected", hello.get("type").asText());

            socket.sendText("{\"type\": \"ping\"}", true).get(5, TimeUnit.SECONDS);
            assertEquals("pong", frames.poll(5, TimeUnit.SECONDS).get("type").asText());

            String projectId = createProject();

            JsonNode event = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(event);
            assertEquals("project:created", event.get("type").asText());
            assertEquals(projectId, event.get("data").get("id").asText());
        } finally {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "done");
        }
    }
}
