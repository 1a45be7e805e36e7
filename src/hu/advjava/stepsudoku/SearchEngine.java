package hu.advjava.stepsudoku;

import java.util.Optional;

import hu.advjava.stepsudoku.StepEvent.Reason;

/**
 * Depth-first backtracking over the cell with the fewest candidates (lowest index on ties), trying its
 * digits in ascending order and propagating after every trial placement. Every level places at least one
 * digit, so the recursion is at most 81 deep.
 */
public final class SearchEngine {

    private final StepSink sink;
    private final Propagator propagator;
    private int maxDepth;

    public SearchEngine(StepSink sink) {
        this.sink = sink;
        this.propagator = new Propagator(sink);
    }

    public Propagator propagator() {
        return propagator;
    }

    /**
     * Searches from an already propagated {@code state}, which is left untouched.
     *
     * @return the completed grid, or empty when every branch failed
     */
    public Optional<int[]> search(SearchState state) {
        maxDepth = 0;
        return search(state, 0);
    }

    /** Deepest recursion level reached by the last {@link #search(SearchState)} call. */
    public int maxDepth() {
        return maxDepth;
    }

    private Optional<int[]> search(SearchState state, int depth) {
        maxDepth = Math.max(maxDepth, depth);
        if (state.isSolved()) return Optional.of(state.snapshot());

        int cell = pickMrv(state);
        if (cell < 0) return Optional.empty();
        sink.accept(StepEvent.focus(cell));

        for (int value : state.candidates().digits(cell)) {
            sink.accept(StepEvent.guess(cell, value));
            SearchState branch = state.copy();
            if (propagator.assign(branch, cell, value, Reason.GUESS) && propagator.propagate(branch)) {
                Optional<int[]> solved = search(branch, depth + 1);
                if (solved.isPresent()) return solved;
            }
            sink.accept(StepEvent.unassign(cell));
            sink.accept(StepEvent.backtrack(cell, value));
        }
        return Optional.empty();
    }

    /** Unresolved cell with the smallest candidate set, lowest index first; -1 if every cell is filled. */
    static int pickMrv(SearchState state) {
        int best = -1, bestSize = 10;
        for (int cell = 0; cell < Topology.CELLS; cell++) {
            if (state.isResolved(cell)) continue;
            int size = state.candidates().size(cell);
            if (size < bestSize) {
                best = cell;
                bestSize = size;
            }
        }
        return best;
    }
}
