package hu.advjava.stepsudoku;

import java.util.stream.IntStream;

/**
 * Board geometry of a 9x9 Sudoku: units and peers of the 81 cells.
 *
 * Units are ordered rows 0..8, columns 0..8, boxes 0..8, and the cells of each unit
 * (as well as the peers of each cell) are listed in ascending index order. The tables
 * depend on nothing but the geometry, so they are built once and shared by every solve.
 */
public final class Topology {

    public static final int SIZE = 9;
    public static final int CELLS = SIZE * SIZE;     // 81
    public static final int UNIT_COUNT = 3 * SIZE;   // 27

    private static final int[][] UNITS = buildUnits();
    private static final int[][] PEERS = buildPeers();

    private Topology() {}

    public static int rowOf(int cell) { return cell / SIZE; }
    public static int colOf(int cell) { return cell % SIZE; }
    public static int boxOf(int cell) { return 3 * (rowOf(cell) / 3) + colOf(cell) / 3; }
    public static int index(int row, int col) { return row * SIZE + col; }

    public static int unitCount() {
        return UNIT_COUNT;
    }

    /** Cells of unit {@code u}; do not modify the returned array. */
    static int[] unit(int u) {
        return UNITS[u];
    }

    /** Peers of {@code cell}; do not modify the returned array. */
    static int[] peers(int cell) {
        return PEERS[cell];
    }

    /** Copy of the cells of unit {@code u}, for callers outside the solver. */
    public static int[] unitCells(int u) {
        return UNITS[u].clone();
    }

    /** Copy of the peers of {@code cell}, for callers outside the solver. */
    public static int[] peerCells(int cell) {
        return PEERS[cell].clone();
    }

    private static int[][] buildUnits() {
        int[][] units = new int[UNIT_COUNT][];
        for (int k = 0; k < SIZE; k++) {
            final int line = k;
            units[k] = IntStream.range(0, SIZE).map(col -> index(line, col)).toArray();
            units[SIZE + k] = IntStream.range(0, SIZE).map(row -> index(row, line)).toArray();
            int br = 3 * (k / 3), bc = 3 * (k % 3);
            units[2 * SIZE + k] = IntStream.range(0, SIZE).map(j -> index(br + j / 3, bc + j % 3)).toArray();
        }
        return units;
    }

    private static int[][] buildPeers() {
        return IntStream.range(0, CELLS)
                .mapToObj(cell -> IntStream.range(0, CELLS)
                        .filter(other -> other != cell)
                        .filter(other -> rowOf(other) == rowOf(cell)
                                || colOf(other) == colOf(cell)
                                || boxOf(other) == boxOf(cell))
                        .toArray())
                .toArray(int[][]::new);
    }
}
