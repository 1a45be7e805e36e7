package hu.advjava.stepsudoku;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import hu.advjava.stepsudoku.StepEvent.Reason;
import hu.advjava.stepsudoku.StepEvent.Type;

public class StepEventTest {

    @Test
    public void describe() {
        assertAll(
            () -> assertEquals("focus 12", StepEvent.focus(12).describe()),
            () -> assertEquals("assign 40=5 naked-single", StepEvent.assign(40, 5, Reason.NAKED_SINGLE).describe()),
            () -> assertEquals("assign 3=1 hidden-single", StepEvent.assign(3, 1, Reason.HIDDEN_SINGLE).describe()),
            () -> assertEquals("assign 7=2 guess", StepEvent.assign(7, 2, Reason.GUESS).describe()),
            () -> assertEquals("guess 7=2", StepEvent.guess(7, 2).describe()),
            () -> assertEquals("unassign 7", StepEvent.unassign(7).describe()),
            () -> assertEquals("backtrack 7=2", StepEvent.backtrack(7, 2).describe())
        );
    }

    @Test
    public void malformedEventsAreRejected() {
        assertAll(
            () -> assertThrows(IllegalArgumentException.class, () -> StepEvent.focus(81)),
            () -> assertThrows(IllegalArgumentException.class, () -> StepEvent.assign(0, 1, null)),
            () -> assertThrows(IllegalArgumentException.class, () -> new StepEvent(Type.GUESS, 0, 1, Reason.GUESS)),
            () -> assertThrows(NullPointerException.class, () -> new StepEvent(null, 0, 1, null))
        );
    }

    @Test
    public void recorderKeepsOrderAndCounts() {
        StepRecorder recorder = new StepRecorder();
        recorder.accept(StepEvent.focus(0));
        recorder.accept(StepEvent.guess(0, 1));
        recorder.accept(StepEvent.assign(0, 1, Reason.GUESS));
        var snapshot = recorder.events();
        recorder.accept(StepEvent.unassign(0));

        Map<Type, Long> summary = recorder.summary();
        assertAll(
            () -> assertEquals(3, snapshot.size()),
            () -> assertThrows(UnsupportedOperationException.class, () -> snapshot.add(StepEvent.focus(1))),
            () -> assertEquals(StepEvent.guess(0, 1), recorder.events().get(1)),
            () -> assertEquals(4, recorder.size()),
            () -> assertEquals(5, summary.size()),
            () -> assertEquals(0L, summary.get(Type.BACKTRACK)),
            () -> assertEquals(1L, summary.get(Type.ASSIGN))
        );
    }

    @Test
    public void noneSinkIgnoresEverything() {
        assertDoesNotThrow(() -> StepSink.NONE.accept(StepEvent.focus(0)));
    }
}
