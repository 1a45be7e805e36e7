package hu.advjava.stepsudoku.mcp;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.glassfish.grizzly.http.server.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import hu.advjava.stepsudoku.ExamplePuzzle;
import jakarta.json.Json;
import jakarta.json.JsonObject;

public class McpServerHttpTest {

    private static HttpServer server;
    private static URI endpoint;
    private static final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    @BeforeAll
    public static void startServer() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        URI base = URI.create("http://127.0.0.1:" + port + "/");
        server = McpServer.start(new ServerConfig(base));
        endpoint = base.resolve("mcp");
    }

    @AfterAll
    public static void stopServer() {
        if (server != null) server.shutdownNow();
    }

    private static HttpResponse<String> send(HttpRequest.Builder request) throws IOException, InterruptedException {
        return http.send(request.timeout(Duration.ofSeconds(10)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonObject json(String body) {
        return Json.createReader(new StringReader(body)).readObject();
    }

    @Test
    public void postedRequestIsDispatched() throws Exception {
        JsonObject request = Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", 11)
                .add("method", "tools/call")
                .add("params", Json.createObjectBuilder()
                        .add("name", "solve_sudoku")
                        .add("arguments", Json.createObjectBuilder()
                                .add("board", BoardJson.fromGrid(ExamplePuzzle.EASY_1.getBoard()))))
                .build();
        HttpResponse<String> response = send(HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(request.toString())));

        JsonObject envelope = json(response.body());
        String text = envelope.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text");
        assertAll(
            () -> assertEquals(200, response.statusCode()),
            () -> assertEquals(11, envelope.getInt("id")),
            () -> assertArrayEquals(ExamplePuzzle.EASY_1.getSolution(), BoardJson.toGrid(json(text).get("board")))
        );
    }

    @Test
    public void getDescribesTheEndpoint() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(endpoint).header("Accept", "application/json").GET());
        JsonObject body = json(response.body());
        assertAll(
            () -> assertEquals(200, response.statusCode()),
            () -> assertTrue(body.getBoolean("ok")),
            () -> assertEquals("/mcp", body.getString("endpoint")),
            () -> assertEquals(3, body.getJsonArray("tools").size())
        );
    }

    @Test
    public void headAndPreflight() throws Exception {
        HttpResponse<String> head = send(HttpRequest.newBuilder(endpoint)
                .method("HEAD", HttpRequest.BodyPublishers.noBody()));
        HttpResponse<String> preflight = send(HttpRequest.newBuilder(endpoint.resolve("mcp/tools"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody()));
        assertAll(
            () -> assertEquals(200, head.statusCode()),
            () -> assertEquals(204, preflight.statusCode()),
            () -> assertEquals("*", preflight.headers().firstValue("Access-Control-Allow-Origin").orElse("")),
            () -> assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("POST"))
        );
    }
}
