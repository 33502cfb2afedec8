package org.calista.unglish.language;

import java.util.Objects;

/**
 * Immutable sound unit of the inventory.
 *
 * <p>Pronunciation never mutates a phoneme: aspiration and vowel reduction produce flagged copies
 * ({@link #withAspiration()}, {@link #asReductionOf(String)}). {@link #sound()} always returns the base symbol, so
 * phonotactic sets and grapheme lookups keep working on aspirated copies; {@link #render()} adds the mark.</p>
 */
public final class Phoneme {

    public static final String ASPIRATION_MARK = "ʰ";

    private final String sound;
    private final Manner manner;
    private final Place place;
    private final boolean voiced;
    private final boolean tense;

    // positional weights; 0 = not allowed there
    private final double onset;
    private final double nucleus;
    private final double coda;
    private final double startWord;
    private final double midWord;
    private final double endWord;

    private final boolean aspirated;
    private final String reducedFrom; // nullable
    private final boolean placeholder;

    private Phoneme(Builder b) {
        this.sound = Objects.requireNonNull(b.sound, "sound");
        this.manner = Objects.requireNonNull(b.manner, "manner");
        this.place = Objects.requireNonNull(b.place, "place");
        this.voiced = b.voiced;
        this.tense = b.tense;
        this.onset = b.onset;
        this.nucleus = b.nucleus;
        this.coda = b.coda;
        this.startWord = b.startWord;
        this.midWord = b.midWord;
        this.endWord = b.endWord;
        this.aspirated = b.aspirated;
        this.reducedFrom = b.reducedFrom;
        this.placeholder = b.placeholder;
    }

    public static Builder builder(String sound) {
        return new Builder(sound);
    }

    /**
     * Stand-in for an affix sound missing from the inventory: voiced central mid vowel.
     */
    public static Phoneme placeholder(String sound) {
        return builder(sound)
                .manner(Manner.MID_VOWEL)
                .place(Place.CENTRAL)
                .voiced(true)
                .nucleus(1)
                .wordWeights(1, 1, 1)
                .placeholder(true)
                .build();
    }

    // ---------------------------------------------------------------------
    // Derived copies
    // ---------------------------------------------------------------------

    public Phoneme withAspiration() {
        if (aspirated) return this;
        return toBuilder().aspirated(true).build();
    }

    /** Copy of {@code target} flagged as the reduced form of {@code source}. */
    public Phoneme asReductionOf(String source) {
        return toBuilder().reducedFrom(Objects.requireNonNull(source, "source")).build();
    }

    public Builder toBuilder() {
        return new Builder(sound)
                .manner(manner)
                .place(place)
                .voiced(voiced)
                .tense(tense)
                .onset(onset)
                .nucleus(nucleus)
                .coda(coda)
                .wordWeights(startWord, midWord, endWord)
                .aspirated(aspirated)
                .reducedFrom(reducedFrom)
                .placeholder(placeholder);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String sound() { return sound; }
    public Manner manner() { return manner; }
    public Place place() { return place; }
    public boolean voiced() { return voiced; }
    public boolean tense() { return tense; }
    public boolean aspirated() { return aspirated; }
    public boolean reduced() { return reducedFrom != null; }
    public String reducedFrom() { return reducedFrom; }
    public boolean isPlaceholder() { return placeholder; }

    public boolean isVowel() {
        return manner.isVowel();
    }

    public boolean isVoicelessStop() {
        return manner == Manner.STOP && !voiced;
    }

    public double weight(Position position) {
        return switch (position) {
            case ONSET -> onset;
            case NUCLEUS -> nucleus;
            case CODA -> coda;
        };
    }

    public double wordPositionWeight(WordPosition position) {
        return switch (position) {
            case INITIAL -> startWord;
            case MEDIAL -> midWord;
            case FINAL -> endWord;
        };
    }

    /** Symbol as it appears in the pronunciation string. */
    public String render() {
        return aspirated ? sound + ASPIRATION_MARK : sound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Phoneme p)) return false;
        return sound.equals(p.sound)
                && manner == p.manner
                && place == p.place
                && voiced == p.voiced
                && aspirated == p.aspirated
                && placeholder == p.placeholder
                && Objects.equals(reducedFrom, p.reducedFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sound, manner, place, voiced, aspirated, reducedFrom, placeholder);
    }

    @Override
    public String toString() {
        return render();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private final String sound;
        private Manner manner;
        private Place place;
        private boolean voiced;
        private boolean tense;
        private double onset;
        private double nucleus;
        private double coda;
        private double startWord;
        private double midWord;
        private double endWord;
        private boolean aspirated;
        private String reducedFrom;
        private boolean placeholder;

        private Builder(String sound) {
            this.sound = sound;
        }

        public Builder manner(Manner manner) {
            this.manner = manner;
            return this;
        }

        public Builder place(Place place) {
            this.place = place;
            return this;
        }

        public Builder voiced(boolean voiced) {
            this.voiced = voiced;
            return this;
        }

        public Builder tense(boolean tense) {
            this.tense = tense;
            return this;
        }

        public Builder onset(double weight) {
            this.onset = weight;
            return this;
        }

        public Builder nucleus(double weight) {
            this.nucleus = weight;
            return this;
        }

        public Builder coda(double weight) {
            this.coda = weight;
            return this;
        }

        public Builder wordWeights(double startWord, double midWord, double endWord) {
            this.startWord = startWord;
            this.midWord = midWord;
            this.endWord = endWord;
            return this;
        }

        public Builder aspirated(boolean aspirated) {
            this.aspirated = aspirated;
            return this;
        }

        public Builder reducedFrom(String reducedFrom) {
            this.reducedFrom = reducedFrom;
            return this;
        }

        public Builder placeholder(boolean placeholder) {
            this.placeholder = placeholder;
            return this;
        }

        public Phoneme build() {
            return new Phoneme(this);
        }
    }
}
