package hu.advjava.stepsudoku;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of {@link Validator#validate(int[])}: the indices of every cell that duplicates a digit within
 * one of its units. The set is sorted and unmodifiable.
 */
public record Validation(boolean ok, SortedSet<Integer> conflicts) {

    public Validation {
        conflicts = Collections.unmodifiableSortedSet(new TreeSet<>(conflicts));
        if (ok != conflicts.isEmpty())
            throw new IllegalArgumentException("ok must be true exactly when there are no conflicts");
    }

    static Validation of(SortedSet<Integer> conflicts) {
        return new Validation(conflicts.isEmpty(), conflicts);
    }
}
