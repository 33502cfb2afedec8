package org.calista.unglish.language;

import java.util.Objects;

/**
 * One candidate spelling for a phoneme.
 *
 * <p>Position weights are overrides: {@code null} means unrestricted, {@code 0} means forbidden.</p>
 */
public final class Grapheme {

    public final String phoneme;
    public final String form;
    public final double frequency;

    public final Double onset;
    public final Double nucleus;
    public final Double coda;
    public final Double cluster;

    public final Double startWord;
    public final Double midWord;
    public final Double endWord;

    public final GraphemeCondition condition;

    public Grapheme(String phoneme, String form, double frequency,
                    Double onset, Double nucleus, Double coda, Double cluster,
                    Double startWord, Double midWord, Double endWord,
                    GraphemeCondition condition) {
        this.phoneme = Objects.requireNonNull(phoneme, "phoneme");
        this.form = Objects.requireNonNull(form, "form");
        this.frequency = frequency;
        this.onset = onset;
        this.nucleus = nucleus;
        this.coda = coda;
        this.cluster = cluster;
        this.startWord = startWord;
        this.midWord = midWord;
        this.endWord = endWord;
        this.condition = condition == null ? GraphemeCondition.NONE : condition;
    }

    public boolean allowedIn(Position position) {
        Double w = switch (position) {
            case ONSET -> onset;
            case NUCLEUS -> nucleus;
            case CODA -> coda;
        };
        return unrestrictedOrPositive(w);
    }

    public boolean allowedAt(WordPosition position) {
        Double w = switch (position) {
            case INITIAL -> startWord;
            case MEDIAL -> midWord;
            case FINAL -> endWord;
        };
        return unrestrictedOrPositive(w);
    }

    public boolean allowedInCluster() {
        return unrestrictedOrPositive(cluster);
    }

    private static boolean unrestrictedOrPositive(Double w) {
        return w == null || w > 0.0;
    }

    @Override
    public String toString() {
        return phoneme + "->" + form;
    }
}
