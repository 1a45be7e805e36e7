package hu.advjava.stepsudoku;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

/** Duplicate-digit detection over the 27 units. */
public final class Validator {

    private Validator() {}

    /**
     * Reports every cell holding a digit that occurs more than once in one of its units. Total over any
     * 81-cell grid of digits {@code 0..9}; zeros are ignored.
     */
    public static Validation validate(int[] grid) {
        SortedSet<Integer> conflicts = new TreeSet<>();
        int[] seen = new int[10];
        for (int u = 0; u < Topology.unitCount(); u++) {
            int[] unit = Topology.unit(u);
            Arrays.fill(seen, 0);
            for (int cell : unit) seen[grid[cell]]++;
            for (int cell : unit) {
                int v = grid[cell];
                if (v != 0 && seen[v] > 1) conflicts.add(cell);
            }
        }
        return Validation.of(conflicts);
    }

    /** True when no cell is empty and no unit repeats a digit. */
    static boolean isSolved(int[] grid) {
        return Arrays.stream(grid).noneMatch(v -> v == 0) && validate(grid).ok();
    }

    /**
     * Checks the caller's side of the contract: 81 cells, every value in {@code 0..9}.
     *
     * @throws IllegalArgumentException if the grid is null, of the wrong length, or holds an out-of-range value
     */
    public static int[] requireGrid(int[] grid) {
        if (grid == null)
            throw new IllegalArgumentException("grid must not be null");
        if (grid.length != Topology.CELLS)
            throw new IllegalArgumentException("grid must have " + Topology.CELLS + " cells, got " + grid.length);
        for (int i = 0; i < grid.length; i++) {
            if (grid[i] < 0 || grid[i] > 9)
                throw new IllegalArgumentException("cell " + i + " holds " + grid[i] + ", expected 0..9");
        }
        return grid;
    }
}
