package org.calista.unglish.trace;

import org.calista.unglish.language.Phoneme;
import org.calista.unglish.word.Syllable;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call trace sink. Stages hold a nullable reference and record only when it is present,
 * so untraced generation pays nothing. Not thread-safe (one word, one thread).
 */
public final class TraceRecorder {

    public static final String REPAIR_PREFIX = "repair";

    private final List<StageSnapshot> stages = new ArrayList<>();
    private final List<GraphemeDecision> graphemes = new ArrayList<>();
    private final List<RepairEvent> repairs = new ArrayList<>();
    private final List<Decision> decisions = new ArrayList<>();
    private boolean morphologyApplied;

    /** Plain-string copy of a syllable list: stress mark, then onset/nucleus/coda separated by '/'. */
    public static List<String> snapshot(List<Syllable> syllables) {
        List<String> out = new ArrayList<>(syllables.size());
        for (Syllable s : syllables) {
            out.add(s.stress().mark() + join(s.onset()) + "/" + join(s.nucleus()) + "/" + join(s.coda()));
        }
        return out;
    }

    public void stage(String name, List<String> before, List<Syllable> after) {
        stages.add(new StageSnapshot(name, before, snapshot(after)));
    }

    public void grapheme(GraphemeDecision decision) {
        graphemes.add(decision);
    }

    public void repair(String pass, int syllableIndex, Phoneme removed, String detail) {
        repairs.add(new RepairEvent(pass, syllableIndex, removed == null ? "" : removed.render(), detail));
    }

    public void decision(String stage, String what, Object value) {
        decisions.add(new Decision(stage, what, String.valueOf(value)));
    }

    public void morphologyApplied(boolean applied) {
        this.morphologyApplied = applied;
    }

    public WordTrace build() {
        int repairStages = 0;
        for (StageSnapshot s : stages) {
            if (s.name.startsWith(REPAIR_PREFIX) && s.changed()) repairStages++;
        }
        TraceSummary summary = new TraceSummary(graphemes.size() + decisions.size(), repairStages, morphologyApplied);
        return new WordTrace(stages, graphemes, repairs, decisions, summary);
    }

    private static String join(List<Phoneme> segment) {
        StringBuilder sb = new StringBuilder();
        for (Phoneme p : segment) sb.append(p.render());
        return sb.toString();
    }
}
