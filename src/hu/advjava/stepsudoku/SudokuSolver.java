package hu.advjava.stepsudoku;

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the solver: {@link #validate}, {@link #solve} and {@link #solveWithSteps}.
 *
 * Stateless; the only shared data are the read-only {@link Topology} tables, so independent solves may run
 * on different threads. The caller's grid is never modified.
 */
public final class SudokuSolver {

    private static final Logger log = LogManager.getLogger(SudokuSolver.class);

    private SudokuSolver() {}

    /**
     * @throws IllegalArgumentException if {@code grid} is not 81 digits in {@code 0..9}
     */
    public static Validation validate(int[] grid) {
        return Validator.validate(Validator.requireGrid(grid));
    }

    /** Solves {@code grid} without recording a trace. */
    public static SolveResult solve(int[] grid) {
        return solveWithSteps(grid, StepSink.NONE);
    }

    /**
     * Same as {@link #solve(int[])}, additionally handing every step event to {@code sink} before returning.
     *
     * @throws IllegalArgumentException if {@code grid} is not 81 digits in {@code 0..9}
     */
    public static SolveResult solveWithSteps(int[] grid, StepSink sink) {
        Validator.requireGrid(grid);
        if (sink == null) throw new IllegalArgumentException("sink must not be null");

        log.debug("Solving {} ({} clues)", () -> GridIO.toLine(grid), () -> GridIO.countFilledCells(grid));
        SolveResult result = run(grid, sink);
        log.debug("Solve finished: {}", result);
        return result;
    }

    private static SolveResult run(int[] grid, StepSink sink) {
        SearchState state;
        try {
            state = SearchState.of(grid);
        } catch (PuzzleException e) {
            return SolveResult.from(e);
        }

        SearchEngine engine = new SearchEngine(sink);
        if (!engine.propagator().propagate(state))
            return SolveResult.failed(ErrorKind.UNSOLVABLE_PUZZLE);
        if (state.isSolved())
            return SolveResult.solved(state.snapshot());

        Optional<int[]> solved = engine.search(state);
        log.debug("Search reached depth {}", engine.maxDepth());
        return solved.map(SolveResult::solved)
                .orElseGet(() -> SolveResult.failed(ErrorKind.NO_SOLUTION_FOUND));
    }
}
