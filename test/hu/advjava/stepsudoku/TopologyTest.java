package hu.advjava.stepsudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

public class TopologyTest {

    @Test
    public void coordinates() {
        assertAll(
            () -> assertEquals(4, Topology.rowOf(40)),
            () -> assertEquals(4, Topology.colOf(40)),
            () -> assertEquals(4, Topology.boxOf(40)),
            () -> assertEquals(8, Topology.boxOf(80)),
            () -> assertEquals(2, Topology.boxOf(8)),
            () -> assertEquals(6, Topology.boxOf(72)),
            () -> assertEquals(80, Topology.index(8, 8))
        );
    }

    @Test
    public void unitsAreRowsThenColumnsThenBoxes() {
        assertAll(
            () -> assertEquals(27, Topology.unitCount()),
            () -> assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5, 6, 7, 8}, Topology.unitCells(0)),
            () -> assertArrayEquals(new int[] {72, 73, 74, 75, 76, 77, 78, 79, 80}, Topology.unitCells(8)),
            () -> assertArrayEquals(new int[] {0, 9, 18, 27, 36, 45, 54, 63, 72}, Topology.unitCells(9)),
            () -> assertArrayEquals(new int[] {0, 1, 2, 9, 10, 11, 18, 19, 20}, Topology.unitCells(18)),
            () -> assertArrayEquals(new int[] {60, 61, 62, 69, 70, 71, 78, 79, 80}, Topology.unitCells(26))
        );
    }

    @Test
    public void everyCellBelongsToExactlyThreeUnits() {
        int[] membership = new int[Topology.CELLS];
        IntStream.range(0, Topology.unitCount())
                .flatMap(u -> Arrays.stream(Topology.unitCells(u)))
                .forEach(cell -> membership[cell]++);
        assertTrue(Arrays.stream(membership).allMatch(n -> n == 3));
    }

    @Test
    public void peersAreTwentyDistinctSortedCellsSharingAUnit() {
        IntStream.range(0, Topology.CELLS).forEach(cell -> {
            int[] peers = Topology.peerCells(cell);
            assertAll("cell " + cell,
                () -> assertEquals(20, peers.length),
                () -> assertTrue(Arrays.stream(peers).noneMatch(p -> p == cell)),
                () -> assertArrayEquals(Arrays.stream(peers).sorted().distinct().toArray(), peers),
                () -> assertTrue(Arrays.stream(peers).allMatch(p -> Topology.rowOf(p) == Topology.rowOf(cell)
                        || Topology.colOf(p) == Topology.colOf(cell)
                        || Topology.boxOf(p) == Topology.boxOf(cell)))
            );
        });
    }

    @Test
    public void exposedTablesAreCopies() {
        Topology.peerCells(0)[0] = 99;
        Topology.unitCells(0)[0] = 99;
        assertAll(
            () -> assertEquals(1, Topology.peerCells(0)[0]),
            () -> assertEquals(0, Topology.unitCells(0)[0])
        );
    }
}
