package org.calista.unglish.trace;

public final class TraceSummary {
    public final int totalDecisions;
    public final int repairCount;
    public final boolean morphologyApplied;

    public TraceSummary(int totalDecisions, int repairCount, boolean morphologyApplied) {
        this.totalDecisions = totalDecisions;
        this.repairCount = repairCount;
        this.morphologyApplied = morphologyApplied;
    }

    @Override
    public String toString() {
        return "TraceSummary{decisions=" + totalDecisions + ", repairs=" + repairCount + ", morphology=" + morphologyApplied + '}';
    }
}
