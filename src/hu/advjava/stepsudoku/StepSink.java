package hu.advjava.stepsudoku;

/** Receives the solver's step events, synchronously and in order. */
@FunctionalInterface
public interface StepSink {

    /** Discards every event; used when no trace is wanted. */
    StepSink NONE = event -> {};

    void accept(StepEvent event);
}
