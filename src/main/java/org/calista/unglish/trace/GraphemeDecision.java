package org.calista.unglish.trace;

import java.util.List;

/**
 * One spelling choice of the orthography writer.
 * {@code roll} is -1 when the choice was deterministic (cluster members).
 */
public final class GraphemeDecision {
    public final String phoneme;
    public final String position;
    public final int syllableIndex;
    /** forms legal in the syllable position */
    public final List<String> candidates;
    /** forms left after the contextual condition filter */
    public final List<String> afterCondition;
    /** forms left after word-position and cluster filters */
    public final List<String> afterPosition;
    public final List<Double> weights;
    public final double roll;
    public final String selected;
    public final boolean cluster;
    public final boolean doubled;

    public GraphemeDecision(String phoneme, String position, int syllableIndex,
                            List<String> candidates, List<String> afterCondition, List<String> afterPosition,
                            List<Double> weights, double roll, String selected, boolean cluster, boolean doubled) {
        this.phoneme = phoneme;
        this.position = position;
        this.syllableIndex = syllableIndex;
        this.candidates = List.copyOf(candidates);
        this.afterCondition = List.copyOf(afterCondition);
        this.afterPosition = List.copyOf(afterPosition);
        this.weights = List.copyOf(weights);
        this.roll = roll;
        this.selected = selected;
        this.cluster = cluster;
        this.doubled = doubled;
    }

    @Override
    public String toString() {
        return "/" + phoneme + "/ -> " + selected + (doubled ? " (doubled)" : "");
    }
}
