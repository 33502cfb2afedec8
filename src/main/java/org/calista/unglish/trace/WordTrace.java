package org.calista.unglish.trace;

import java.util.List;

/** Immutable diagnostics attached to a traced word. */
public final class WordTrace {
    public final List<StageSnapshot> stages;
    public final List<GraphemeDecision> graphemeSelections;
    public final List<RepairEvent> repairs;
    public final List<Decision> decisions;
    public final TraceSummary summary;

    public WordTrace(List<StageSnapshot> stages,
                     List<GraphemeDecision> graphemeSelections,
                     List<RepairEvent> repairs,
                     List<Decision> decisions,
                     TraceSummary summary) {
        this.stages = List.copyOf(stages);
        this.graphemeSelections = List.copyOf(graphemeSelections);
        this.repairs = List.copyOf(repairs);
        this.decisions = List.copyOf(decisions);
        this.summary = summary;
    }

    public StageSnapshot stage(String name) {
        for (StageSnapshot s : stages) {
            if (s.name.equals(name)) return s;
        }
        return null;
    }
}
