package hu.advjava.stepsudoku.mcp;

import java.util.Collection;

import hu.advjava.stepsudoku.GridIO;
import hu.advjava.stepsudoku.SolveResult;
import hu.advjava.stepsudoku.StepEvent;
import hu.advjava.stepsudoku.Topology;
import hu.advjava.stepsudoku.Validation;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

/** JSON shapes of boards, validation and solve results, and step events. */
final class BoardJson {

    private BoardJson() {}

    /**
     * Reads a 9x9 array of integers {@code 0..9}.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    static int[] toGrid(JsonValue value) {
        if (value == null || value.getValueType() != JsonValue.ValueType.ARRAY)
            throw new IllegalArgumentException("board must be a 9x9 array");
        JsonArray rows = value.asJsonArray();
        if (rows.size() != Topology.SIZE)
            throw new IllegalArgumentException("board must have 9 rows, got " + rows.size());
        int[][] board = new int[Topology.SIZE][Topology.SIZE];
        for (int r = 0; r < Topology.SIZE; r++) {
            JsonValue rowValue = rows.get(r);
            if (rowValue.getValueType() != JsonValue.ValueType.ARRAY || rowValue.asJsonArray().size() != Topology.SIZE)
                throw new IllegalArgumentException("row " + r + " must be an array of 9 integers");
            JsonArray row = rowValue.asJsonArray();
            for (int c = 0; c < Topology.SIZE; c++) {
                board[r][c] = digit(row.get(c), r, c);
            }
        }
        return GridIO.fromRows(board);
    }

    private static int digit(JsonValue cell, int r, int c) {
        if (cell.getValueType() != JsonValue.ValueType.NUMBER || !((JsonNumber) cell).isIntegral())
            throw new IllegalArgumentException("cell (" + r + "," + c + ") must be an integer");
        int digit;
        try {
            digit = ((JsonNumber) cell).intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("cell (" + r + "," + c + ") must be 0..9, got " + cell, e);
        }
        if (digit < 0 || digit > 9)
            throw new IllegalArgumentException("cell (" + r + "," + c + ") must be 0..9, got " + digit);
        return digit;
    }

    /** The member {@code key} of {@code parent} as an object, or null when absent. */
    static JsonObject object(JsonObject parent, String key) {
        JsonValue value = parent.get(key);
        if (value == null || value.getValueType() == JsonValue.ValueType.NULL) return null;
        if (value.getValueType() != JsonValue.ValueType.OBJECT)
            throw new IllegalArgumentException(key + " must be an object");
        return value.asJsonObject();
    }

    static JsonArray fromGrid(int[] grid) {
        JsonArrayBuilder ab = Json.createArrayBuilder();
        for (int[] row : GridIO.toRows(grid)) {
            JsonArrayBuilder rb = Json.createArrayBuilder();
            for (int v : row) rb.add(v);
            ab.add(rb);
        }
        return ab.build();
    }

    static JsonArray cells(Collection<Integer> cells) {
        JsonArrayBuilder ab = Json.createArrayBuilder();
        cells.forEach(ab::add);
        return ab.build();
    }

    static JsonObject validation(Validation v) {
        return Json.createObjectBuilder()
                .add("ok", v.ok())
                .add("conflicts", cells(v.conflicts()))
                .build();
    }

    static JsonObjectBuilder result(SolveResult result) {
        JsonObjectBuilder ob = Json.createObjectBuilder().add("ok", result.ok());
        result.grid().ifPresent(g -> ob.add("board", fromGrid(g)));
        result.error().ifPresent(e -> ob.add("error", e.name()).add("message", e.getMessage()));
        if (!result.conflicts().isEmpty()) ob.add("conflicts", cells(result.conflicts()));
        return ob;
    }

    static JsonObject event(StepEvent e) {
        JsonObjectBuilder ob = Json.createObjectBuilder()
                .add("type", e.type().label())
                .add("cell", e.cell());
        if (e.value() != 0) ob.add("value", e.value());
        if (e.reason() != null) ob.add("reason", e.reason().label());
        return ob.build();
    }
}
