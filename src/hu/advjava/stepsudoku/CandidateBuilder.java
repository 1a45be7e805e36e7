package hu.advjava.stepsudoku;

/** Derives the starting candidate table of a raw grid. */
public final class CandidateBuilder {

    private CandidateBuilder() {}

    /**
     * Filled cells get their own digit, empty cells every digit not already placed on one of their peers.
     *
     * @throws PuzzleException {@link ErrorKind#CONFLICTS_FOUND} when the grid does not validate,
     *         {@link ErrorKind#INVALID_PUZZLE} when an empty cell is left without candidates
     */
    public static Candidates build(int[] grid) throws PuzzleException {
        Validation validation = Validator.validate(grid);
        if (!validation.ok())
            throw new PuzzleException(ErrorKind.CONFLICTS_FOUND, validation.conflicts());

        Candidates cand = Candidates.full();
        for (int cell = 0; cell < Topology.CELLS; cell++) {
            if (grid[cell] != 0) cand.collapse(cell, grid[cell]);
        }
        for (int cell = 0; cell < Topology.CELLS; cell++) {
            int value = grid[cell];
            if (value == 0) continue;
            for (int peer : Topology.peers(cell)) {
                if (grid[peer] != 0) continue;
                cand.remove(peer, value);
                if (cand.isEmpty(peer))
                    throw new PuzzleException(ErrorKind.INVALID_PUZZLE);
            }
        }
        return cand;
    }
}
