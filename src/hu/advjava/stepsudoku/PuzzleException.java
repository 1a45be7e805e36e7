package hu.advjava.stepsudoku;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raised while preparing a solve when the grid cannot even be turned into a consistent candidate table.
 * {@link SudokuSolver} turns it into a failed {@link SolveResult}; it never leaves the public API.
 */
public class PuzzleException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final SortedSet<Integer> conflicts;

    public PuzzleException(ErrorKind kind) {
        this(kind, Collections.emptySortedSet());
    }

    public PuzzleException(ErrorKind kind, SortedSet<Integer> conflicts) {
        super(kind.getMessage());
        this.kind = kind;
        this.conflicts = Collections.unmodifiableSortedSet(new TreeSet<>(conflicts));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public SortedSet<Integer> getConflicts() {
        return conflicts;
    }
}
