package hu.advjava.stepsudoku;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Per-cell candidate digits as 9-bit masks (bit {@code d-1} set means digit {@code d} is still legal).
 * Copies are a single array clone, which is what every search branch takes before it mutates.
 */
public final class Candidates {

    static final int ALL = 0x1FF;

    private final int[] masks;

    private Candidates(int[] masks) {
        this.masks = masks;
    }

    /** Every cell allows every digit. */
    static Candidates full() {
        int[] masks = new int[Topology.CELLS];
        Arrays.fill(masks, ALL);
        return new Candidates(masks);
    }

    static int bit(int digit) {
        return 1 << (digit - 1);
    }

    public Candidates copy() {
        return new Candidates(masks.clone());
    }

    public boolean contains(int cell, int digit) {
        return (masks[cell] & bit(digit)) != 0;
    }

    public int size(int cell) {
        return Integer.bitCount(masks[cell]);
    }

    public boolean isEmpty(int cell) {
        return masks[cell] == 0;
    }

    /** Smallest candidate of {@code cell}, or 0 when none is left. */
    public int first(int cell) {
        return masks[cell] == 0 ? 0 : Integer.numberOfTrailingZeros(masks[cell]) + 1;
    }

    /** Candidates of {@code cell} in ascending order. */
    public int[] digits(int cell) {
        int mask = masks[cell];
        return IntStream.rangeClosed(1, 9).filter(d -> (mask & bit(d)) != 0).toArray();
    }

    /** Removes {@code digit} from {@code cell}; returns whether it was present. */
    boolean remove(int cell, int digit) {
        int before = masks[cell];
        masks[cell] = before & ~bit(digit);
        return before != masks[cell];
    }

    void collapse(int cell, int digit) {
        masks[cell] = bit(digit);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Candidates other && Arrays.equals(masks, other.masks);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(masks);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Candidates[");
        for (int cell = 0; cell < Topology.CELLS; cell++) {
            if (cell > 0) sb.append(cell % Topology.SIZE == 0 ? " | " : " ");
            if (masks[cell] == 0) sb.append('-');
            else IntStream.of(digits(cell)).forEach(sb::append);
        }
        return sb.append(']').toString();
    }
}
