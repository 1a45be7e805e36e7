package hu.advjava.stepsudoku;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** A {@link StepSink} that keeps the whole trace for later replay. Not thread-safe. */
public class StepRecorder implements StepSink {

    private final List<StepEvent> events = new ArrayList<>();

    @Override
    public void accept(StepEvent event) {
        events.add(event);
    }

    /** The events recorded so far, oldest first, as an unmodifiable snapshot. */
    public List<StepEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public long count(StepEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).count();
    }

    /** Number of events per type, every type present (possibly with 0). */
    public Map<StepEvent.Type, Long> summary() {
        Map<StepEvent.Type, Long> counts = new EnumMap<>(StepEvent.Type.class);
        for (StepEvent.Type type : StepEvent.Type.values()) counts.put(type, count(type));
        return counts;
    }

    public int size() {
        return events.size();
    }
}
