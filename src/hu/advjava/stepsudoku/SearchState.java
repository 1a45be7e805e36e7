package hu.advjava.stepsudoku;

import java.util.Arrays;

/**
 * A grid together with its candidate table. Each search branch works on its own {@link #copy()};
 * nothing is ever shared between a branch and its parent.
 */
public final class SearchState {

    private final int[] grid;
    private final Candidates candidates;

    SearchState(int[] grid, Candidates candidates) {
        this.grid = grid;
        this.candidates = candidates;
    }

    /** Builds the initial state of {@code grid}, working on a private copy of it. */
    public static SearchState of(int[] grid) throws PuzzleException {
        int[] own = grid.clone();
        return new SearchState(own, CandidateBuilder.build(own));
    }

    public SearchState copy() {
        return new SearchState(grid.clone(), candidates.copy());
    }

    int[] grid() {
        return grid;
    }

    public Candidates candidates() {
        return candidates;
    }

    public int value(int cell) {
        return grid[cell];
    }

    public boolean isResolved(int cell) {
        return grid[cell] != 0;
    }

    /** Copy of the grid. */
    public int[] snapshot() {
        return grid.clone();
    }

    public boolean isSolved() {
        return Validator.isSolved(grid);
    }

    @Override
    public String toString() {
        return "SearchState[" + GridIO.toLine(grid) + "]";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SearchState other
                && Arrays.equals(grid, other.grid)
                && candidates.equals(other.candidates);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(grid) + candidates.hashCode();
    }
}
