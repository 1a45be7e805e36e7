package hu.advjava.stepsudoku;

import java.util.Arrays;

import hu.advjava.stepsudoku.StepEvent.Reason;

/**
 * Deduction engine: places naked singles and hidden singles until neither rule finds anything more.
 *
 * The order is part of the published trace: one naked-single pass over the cells in ascending order,
 * then one hidden-single pass over the units (rows, columns, boxes) and digits 1..9, and both passes
 * again from the start as long as either placed something. Within a unit the hidden-single positions of
 * all nine digits are taken before the first placement in that unit.
 */
public final class Propagator {

    private final StepSink sink;

    public Propagator(StepSink sink) {
        this.sink = sink;
    }

    /**
     * Places {@code value} in {@code cell} and removes it from the candidates of every unresolved peer.
     *
     * @return false if some peer ran out of candidates; the state must then be discarded
     */
    public boolean assign(SearchState state, int cell, int value, Reason reason) {
        int[] grid = state.grid();
        Candidates cand = state.candidates();
        grid[cell] = value;
        cand.collapse(cell, value);
        sink.accept(StepEvent.assign(cell, value, reason));

        for (int peer : Topology.peers(cell)) {
            if (grid[peer] != 0) continue;
            if (cand.remove(peer, value) && cand.isEmpty(peer)) return false;
        }
        return true;
    }

    /**
     * Runs both passes to a fixed point. The state is changed in place; after a {@code false} result it is
     * left half-updated and must not be reused.
     *
     * @return false on a contradiction
     */
    public boolean propagate(SearchState state) {
        boolean changed = true;
        while (changed) {
            Pass naked = nakedSingles(state);
            if (naked == Pass.CONTRADICTION) return false;
            Pass hidden = hiddenSingles(state);
            if (hidden == Pass.CONTRADICTION) return false;
            changed = naked == Pass.CHANGED || hidden == Pass.CHANGED;
        }
        return true;
    }

    private enum Pass { UNCHANGED, CHANGED, CONTRADICTION }

    private Pass nakedSingles(SearchState state) {
        Candidates cand = state.candidates();
        Pass result = Pass.UNCHANGED;
        for (int cell = 0; cell < Topology.CELLS; cell++) {
            if (state.isResolved(cell) || cand.size(cell) != 1) continue;
            if (!assign(state, cell, cand.first(cell), Reason.NAKED_SINGLE)) return Pass.CONTRADICTION;
            result = Pass.CHANGED;
        }
        return result;
    }

    private Pass hiddenSingles(SearchState state) {
        Candidates cand = state.candidates();
        Pass result = Pass.UNCHANGED;
        int[] spots = new int[10];
        int[] spot = new int[10];
        for (int u = 0; u < Topology.unitCount(); u++) {
            int[] unit = Topology.unit(u);
            // positions are collected once per unit, before any digit of the unit is placed
            Arrays.fill(spots, 0);
            for (int cell : unit) {
                if (state.isResolved(cell)) continue;
                for (int digit : cand.digits(cell)) {
                    spot[digit] = cell;
                    spots[digit]++;
                }
            }
            for (int digit = 1; digit <= 9; digit++) {
                // a lone spot already filled earlier in this unit is left alone
                if (spots[digit] != 1 || state.isResolved(spot[digit])) continue;
                if (!assign(state, spot[digit], digit, Reason.HIDDEN_SINGLE)) return Pass.CONTRADICTION;
                result = Pass.CHANGED;
            }
        }
        return result;
    }
}
