package hu.advjava.stepsudoku;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Text form of a grid. Whitespace is ignored when reading, so both a single line of 81 digits and
 * 9 lines of 9 space separated digits are accepted; files are written in the latter form.
 */
public final class GridIO {

    private GridIO() {}

    /**
     * @throws IOException if the text, once whitespace is removed, is not exactly 81 digits {@code 0..9}
     */
    public static int[] parse(String text) throws IOException {
        String digits = text.replaceAll("\\s", "");
        if (digits.length() != Topology.CELLS)
            throw new IOException("Expected exactly " + Topology.CELLS + " digits (0-9), found " + digits.length()
                    + " characters");
        int[] grid = new int[Topology.CELLS];
        for (int i = 0; i < digits.length(); i++) {
            char ch = digits.charAt(i);
            if (ch < '0' || ch > '9')
                throw new IOException("Only digits 0-9 allowed, found '" + ch + "' at cell " + i);
            grid[i] = ch - '0';
        }
        return grid;
    }

    public static int[] load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static void save(Path file, int[] grid) throws IOException {
        Validator.requireGrid(grid);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(format(grid));
        }
    }

    /** 9 lines of 9 space separated digits, each line terminated by a newline. */
    public static String format(int[] grid) {
        return Arrays.stream(toRows(grid))
                .map(row -> Arrays.stream(row).mapToObj(String::valueOf).collect(Collectors.joining(" ")))
                .collect(Collectors.joining("\n", "", "\n"));
    }

    /** The 81 digits on one line. */
    public static String toLine(int[] grid) {
        return Arrays.stream(grid).mapToObj(String::valueOf).collect(Collectors.joining());
    }

    public static long countFilledCells(int[] grid) {
        return Arrays.stream(grid).filter(v -> v != 0).count();
    }

    public static int[][] toRows(int[] grid) {
        return IntStream.range(0, Topology.SIZE)
                .mapToObj(r -> Arrays.copyOfRange(grid, r * Topology.SIZE, (r + 1) * Topology.SIZE))
                .toArray(int[][]::new);
    }

    /**
     * @throws IllegalArgumentException unless {@code rows} is 9 rows of 9 cells
     */
    public static int[] fromRows(int[][] rows) {
        if (rows.length != Topology.SIZE || !Arrays.stream(rows).allMatch(row -> row.length == Topology.SIZE))
            throw new IllegalArgumentException("board must be 9 rows of 9 cells");
        return Arrays.stream(rows).flatMapToInt(Arrays::stream).toArray();
    }
}
