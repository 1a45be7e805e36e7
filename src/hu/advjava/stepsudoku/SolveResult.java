package hu.advjava.stepsudoku;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of a solve: either a completed grid, or an {@link ErrorKind} (with the conflicting cells
 * when the kind is {@link ErrorKind#CONFLICTS_FOUND}). Never both.
 */
public final class SolveResult {

    private final int[] grid;
    private final ErrorKind error;
    private final SortedSet<Integer> conflicts;

    private SolveResult(int[] grid, ErrorKind error, SortedSet<Integer> conflicts) {
        this.grid = grid;
        this.error = error;
        this.conflicts = conflicts;
    }

    static SolveResult solved(int[] grid) {
        return new SolveResult(grid.clone(), null, Collections.emptySortedSet());
    }

    static SolveResult failed(ErrorKind error) {
        return failed(error, Collections.emptySortedSet());
    }

    static SolveResult failed(ErrorKind error, SortedSet<Integer> conflicts) {
        return new SolveResult(null, error,
                Collections.unmodifiableSortedSet(new TreeSet<>(conflicts)));
    }

    static SolveResult from(PuzzleException e) {
        return failed(e.getKind(), e.getConflicts());
    }

    public boolean ok() {
        return grid != null;
    }

    /** The completed grid; a fresh copy on every call. Empty when the solve failed. */
    public Optional<int[]> grid() {
        return Optional.ofNullable(grid).map(int[]::clone);
    }

    public Optional<ErrorKind> error() {
        return Optional.ofNullable(error);
    }

    /** Conflicting cells, only ever non-empty for {@link ErrorKind#CONFLICTS_FOUND}. */
    public SortedSet<Integer> conflicts() {
        return conflicts;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SolveResult other
                && Arrays.equals(grid, other.grid)
                && error == other.error
                && conflicts.equals(other.conflicts);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(grid) + (error == null ? 0 : error.hashCode())) + conflicts.hashCode();
    }

    @Override
    public String toString() {
        return ok()
                ? "SolveResult[ok, grid=" + GridIO.toLine(grid) + "]"
                : "SolveResult[" + error + (conflicts.isEmpty() ? "" : ", conflicts=" + conflicts) + "]";
    }
}
