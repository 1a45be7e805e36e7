package hu.advjava.stepsudoku;

/** Why a solve did not produce a grid. */
public enum ErrorKind {
    /** Some unit already holds the same digit twice; the conflicting cells are reported. */
    CONFLICTS_FOUND("Conflicts found."),
    /** No duplicates, but an empty cell has no legal digit left before any deduction. */
    INVALID_PUZZLE("Invalid puzzle."),
    /** Deduction alone, before any guess, ran into a contradiction. */
    UNSOLVABLE_PUZZLE("Unsolvable puzzle."),
    /** Every branch of the search failed. */
    NO_SOLUTION_FOUND("No solution found.");

    private final String message;

    private ErrorKind(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
