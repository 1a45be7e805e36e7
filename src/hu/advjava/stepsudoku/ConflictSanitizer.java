package hu.advjava.stepsudoku;

import java.util.Arrays;
import java.util.Comparator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cleans up a grid produced by an unreliable reader (e.g. digit recognition): while {@link Validator} reports
 * conflicts, the conflicting cell read with the lowest confidence is cleared.
 */
public final class ConflictSanitizer {

    private static final Logger log = LogManager.getLogger(ConflictSanitizer.class);

    static final int MAX_ROUNDS = 60;

    private ConflictSanitizer() {}

    /**
     * @param grid       81 digits {@code 0..9}, not modified
     * @param confidence one score per cell, higher is more trusted; not modified
     * @return a copy of {@code grid} with low-confidence conflicting digits removed. It is conflict free unless
     *         the round limit was hit first.
     */
    public static int[] sanitize(int[] grid, double[] confidence) {
        Validator.requireGrid(grid);
        if (confidence == null || confidence.length != Topology.CELLS)
            throw new IllegalArgumentException("confidence must have " + Topology.CELLS + " entries");

        int[] g = grid.clone();
        double[] conf = confidence.clone();
        for (int round = 0; round < MAX_ROUNDS; round++) {
            Validation v = Validator.validate(g);
            if (v.ok()) return g;

            int victim = v.conflicts().stream()
                    .min(Comparator.<Integer>comparingDouble(i -> conf[i]).thenComparing(Comparator.naturalOrder()))
                    .orElseThrow();
            log.debug("Dropping digit {} at cell {} (confidence {})", g[victim], victim, conf[victim]);
            g[victim] = 0;
            conf[victim] = -1;
        }
        log.warn("Grid still has conflicts after {} rounds: {}", MAX_ROUNDS, Arrays.toString(g));
        return g;
    }
}
