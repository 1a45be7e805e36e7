package hu.advjava.stepsudoku.mcp;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import hu.advjava.stepsudoku.ExamplePuzzle;
import hu.advjava.stepsudoku.SolveResult;
import hu.advjava.stepsudoku.StepRecorder;
import hu.advjava.stepsudoku.SudokuSolver;
import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

/**
 * JSON-RPC 2.0 endpoint exposing the solver as tools ({@code validate_sudoku}, {@code solve_sudoku},
 * {@code solve_sudoku_with_steps}) and the example puzzles as resources.
 */
@Path("/mcp")
public class McpResource {

    private static final Logger log = LogManager.getLogger(McpResource.class);

    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final int SERVER_ERROR = -32000;

    /** Describes the endpoint to clients that check it before posting. */
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Response describe(@Context HttpHeaders headers, @Context UriInfo ui) {
        logRequest("GET", ui, headers);
        JsonObject body = Json.createObjectBuilder()
                .add("ok", true)
                .add("endpoint", ui.getRequestUri().getPath())
                .add("methods", Json.createArrayBuilder()
                        .add("initialize").add("tools/list").add("tools/call")
                        .add("resources/list").add("resources/read"))
                .add("tools", Json.createArrayBuilder()
                        .add("validate_sudoku").add("solve_sudoku").add("solve_sudoku_with_steps"))
                .build();
        return Response.ok(body).build();
    }

    @HEAD
    public Response head(@Context HttpHeaders headers, @Context UriInfo ui) {
        logRequest("HEAD", ui, headers);
        return Response.ok().build();
    }

    // CORS preflight for browser front ends replaying traces
    @OPTIONS
    @Path("{any: .*}")
    public Response preflight(@Context HttpHeaders headers, @Context UriInfo ui) {
        logRequest("OPTIONS", ui, headers);
        return Response.noContent()
                .header("Access-Control-Allow-Origin", "*")
                .header("Access-Control-Allow-Headers", "Content-Type")
                .header("Access-Control-Allow-Methods", "GET,POST,HEAD,OPTIONS")
                .build();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response call(JsonObject request, @Context HttpHeaders headers, @Context UriInfo ui) {
        logRequest("POST", ui, headers);
        return Response.ok(dispatch(request), MediaType.APPLICATION_JSON_TYPE)
                .header("Cache-Control", "no-cache")
                .header("Access-Control-Allow-Origin", "*")
                .build();
    }

    /* -------------------- Core dispatcher -------------------- */

    /** Answers one JSON-RPC request; never throws, failures become error envelopes. */
    public JsonObject dispatch(JsonObject request) {
        String method = request.getString("method", "");
        int id = request.getInt("id", -1);
        log.info("MCP <- {} (id={})", method, id);
        try {
            switch (method) {
            case "initialize":
                return okEnvelope(id, Json.createObjectBuilder()
                        .add("protocolVersion", "2025-06-18")
                        .add("capabilities", Json.createObjectBuilder()
                                .add("tools", Json.createObjectBuilder())
                                .add("resources", Json.createObjectBuilder()))
                        .add("serverInfo", Json.createObjectBuilder()
                                .add("name", "StepSudoku")
                                .add("version", "1.0"))
                        .add("instructions",
                                "This server validates and solves 9x9 sudoku boards (validate_sudoku, solve_sudoku, "
                                + "solve_sudoku_with_steps) and offers example puzzles as resources.")
                        .build());
            case "tools/list":
                return okEnvelope(id, Json.createObjectBuilder().add("tools", Json.createArrayBuilder()
                        .add(tool("validate_sudoku", "Report cells that repeat a digit within a row, column or box."))
                        .add(tool("solve_sudoku", "Solve a 9x9 Sudoku board. Zeros mean blanks."))
                        .add(tool("solve_sudoku_with_steps",
                                "Solve a 9x9 Sudoku board and return every solver step (focus, assign, guess, "
                                + "unassign, backtrack) in order.")))
                        .build());
            case "tools/call":
                return callTool(id, BoardJson.object(request, "params"));
            case "resources/list": {
                JsonArrayBuilder resources = Json.createArrayBuilder();
                for (ExamplePuzzle example : ExamplePuzzle.values()) {
                    resources.add(Json.createObjectBuilder()
                            .add("uri", example.getUri())
                            .add("name", example.getTitle())
                            .add("mimeType", "application/json"));
                }
                return okEnvelope(id, Json.createObjectBuilder().add("resources", resources).build());
            }
            case "resources/read": {
                JsonObject params = BoardJson.object(request, "params");
                String uri = params == null ? "" : params.getString("uri", "");
                var example = ExamplePuzzle.find(uri);
                if (example.isEmpty())
                    return errorEnvelope(id, INVALID_PARAMS, "Unknown resource: " + uri);
                return okEnvelope(id, Json.createObjectBuilder()
                        .add("contents", Json.createArrayBuilder()
                                .add(Json.createObjectBuilder()
                                        .add("uri", uri)
                                        .add("mimeType", "application/json")
                                        .add("text", Json.createObjectBuilder()
                                                .add("board", BoardJson.fromGrid(example.get().getBoard()))
                                                .build()
                                                .toString())))
                        .build());
            }
            default:
                return errorEnvelope(id, METHOD_NOT_FOUND, "Method not found: " + method);
            }
        } catch (IllegalArgumentException e) {
            log.info("Rejected {} (id={}): {}", method, id, e.getMessage());
            return errorEnvelope(id, INVALID_PARAMS, "Invalid params: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to handle {} (id={})", method, id, e);
            return errorEnvelope(id, SERVER_ERROR, "Server error: " + e.getMessage());
        }
    }

    private JsonObject callTool(int id, JsonObject params) {
        if (params == null) throw new IllegalArgumentException("params are required");
        String toolName = params.getString("name", "");
        JsonObject args = BoardJson.object(params, "arguments");
        if (args == null) throw new IllegalArgumentException("arguments are required");

        JsonObject res;
        switch (toolName) {
        case "validate_sudoku":
            res = BoardJson.validation(SudokuSolver.validate(BoardJson.toGrid(args.get("board"))));
            break;
        case "solve_sudoku":
            res = BoardJson.result(SudokuSolver.solve(BoardJson.toGrid(args.get("board")))).build();
            break;
        case "solve_sudoku_with_steps": {
            StepRecorder recorder = new StepRecorder();
            SolveResult result = SudokuSolver.solveWithSteps(BoardJson.toGrid(args.get("board")), recorder);
            JsonArrayBuilder steps = Json.createArrayBuilder();
            recorder.events().forEach(e -> steps.add(BoardJson.event(e)));
            res = BoardJson.result(result).add("steps", steps).build();
            break;
        }
        default:
            return errorEnvelope(id, METHOD_NOT_FOUND, "Unknown tool: " + toolName);
        }
        return okEnvelope(id, Json.createObjectBuilder().add("content",
                Json.createArrayBuilder().add(
                        Json.createObjectBuilder().add("type", "text").add("text", res.toString())))
                .build());
    }

    private static JsonObjectBuilder tool(String name, String description) {
        return Json.createObjectBuilder()
                .add("name", name)
                .add("description", description)
                .add("inputSchema", Json.createObjectBuilder()
                        .add("type", "object")
                        .add("properties", Json.createObjectBuilder()
                                .add("board", Json.createObjectBuilder()
                                        .add("type", "array")
                                        .add("minItems", 9)
                                        .add("maxItems", 9)
                                        .add("items", Json.createObjectBuilder()
                                                .add("type", "array")
                                                .add("minItems", 9)
                                                .add("maxItems", 9)
                                                .add("items", Json.createObjectBuilder()
                                                        .add("type", "integer")
                                                        .add("minimum", 0)
                                                        .add("maximum", 9)))))
                        .add("required", Json.createArrayBuilder().add("board")));
    }

    /* -------------------- JSON helpers -------------------- */

    private JsonObject okEnvelope(int id, JsonObject result) {
        return Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("result", result)
                .build();
    }

    private JsonObject errorEnvelope(int id, int code, String message) {
        return Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("id", id)
                .add("error", Json.createObjectBuilder()
                        .add("code", code)
                        .add("message", message))
                .build();
    }

    private void logRequest(String method, UriInfo ui, HttpHeaders h) {
        log.debug("{} {} Accept={} Content-Type={}", method, ui.getRequestUri(),
                h.getHeaderString("Accept"), h.getHeaderString("Content-Type"));
    }
}
