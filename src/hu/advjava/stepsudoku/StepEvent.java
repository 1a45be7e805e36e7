package hu.advjava.stepsudoku;

import java.util.Objects;

/**
 * One observable action of the solver. {@code value} is 0 for {@link Type#FOCUS} and {@link Type#UNASSIGN};
 * {@code reason} is only set for {@link Type#ASSIGN}.
 */
public record StepEvent(Type type, int cell, int value, Reason reason) {

    public static enum Type {
        FOCUS, ASSIGN, UNASSIGN, GUESS, BACKTRACK;

        public String label() {
            return name().toLowerCase();
        }
    }

    public static enum Reason {
        NAKED_SINGLE("naked-single"),
        HIDDEN_SINGLE("hidden-single"),
        GUESS("guess");

        private final String label;

        private Reason(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public StepEvent {
        Objects.requireNonNull(type, "type");
        if (cell < 0 || cell >= Topology.CELLS)
            throw new IllegalArgumentException("cell out of range: " + cell);
        if ((type == Type.ASSIGN) != (reason != null))
            throw new IllegalArgumentException("reason is required for assign and only for assign");
    }

    public static StepEvent focus(int cell) {
        return new StepEvent(Type.FOCUS, cell, 0, null);
    }

    public static StepEvent assign(int cell, int value, Reason reason) {
        return new StepEvent(Type.ASSIGN, cell, value, reason);
    }

    public static StepEvent unassign(int cell) {
        return new StepEvent(Type.UNASSIGN, cell, 0, null);
    }

    public static StepEvent guess(int cell, int value) {
        return new StepEvent(Type.GUESS, cell, value, null);
    }

    public static StepEvent backtrack(int cell, int value) {
        return new StepEvent(Type.BACKTRACK, cell, value, null);
    }

    /** Stable one-line form, e.g. {@code assign 40=5 naked-single} or {@code focus 12}. */
    public String describe() {
        return switch (type) {
            case FOCUS, UNASSIGN -> type.label() + " " + cell;
            case ASSIGN -> type.label() + " " + cell + "=" + value + " " + reason.label();
            case GUESS, BACKTRACK -> type.label() + " " + cell + "=" + value;
        };
    }
}
