package org.calista.unglish.generate;

import org.calista.unglish.language.GenerationMode;

import java.util.Objects;

/**
 * Per-call option surface. Immutable; use {@link #builder()} or {@link #defaults()}.
 *
 * <p>{@code seed == null} means non-deterministic generation. {@code vowelReduction == null} inherits the
 * language's own setting.</p>
 */
public final class GenerationOptions {

    public static final String DEFAULT_HYPHEN = "-";

    public final GenerationMode mode;
    public final Long seed;
    public final Integer syllableCount;
    public final boolean morphology;
    public final boolean trace;
    public final Boolean vowelReduction;
    public final String hyphen;

    private GenerationOptions(Builder b) {
        this.mode = b.mode;
        this.seed = b.seed;
        this.syllableCount = b.syllableCount;
        this.morphology = b.morphology;
        this.trace = b.trace;
        this.vowelReduction = b.vowelReduction;
        this.hyphen = b.hyphen;
    }

    public static GenerationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .seed(seed)
                .syllableCount(syllableCount)
                .morphology(morphology)
                .trace(trace)
                .vowelReduction(vowelReduction)
                .hyphen(hyphen);
    }

    public GenerationOptions withSeed(Long seed) {
        return toBuilder().seed(seed).build();
    }

    @Override
    public String toString() {
        return "GenerationOptions{mode=" + mode.key()
                + ", seed=" + seed
                + ", syllableCount=" + syllableCount
                + ", morphology=" + morphology
                + ", trace=" + trace
                + ", vowelReduction=" + vowelReduction + '}';
    }

    public static final class Builder {
        private GenerationMode mode = GenerationMode.LEXICON;
        private Long seed;
        private Integer syllableCount;
        private boolean morphology = true;
        private boolean trace;
        private Boolean vowelReduction;
        private String hyphen = DEFAULT_HYPHEN;

        private Builder() {
        }

        public Builder mode(GenerationMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /** Total syllables of the word, affixes included. {@code null} draws from the mode's table. */
        public Builder syllableCount(Integer syllableCount) {
            if (syllableCount != null && syllableCount < 1) {
                throw new IllegalArgumentException("syllableCount must be >= 1, got " + syllableCount);
            }
            this.syllableCount = syllableCount;
            return this;
        }

        public Builder morphology(boolean morphology) {
            this.morphology = morphology;
            return this;
        }

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public Builder vowelReduction(Boolean vowelReduction) {
            this.vowelReduction = vowelReduction;
            return this;
        }

        public Builder hyphen(String hyphen) {
            this.hyphen = (hyphen == null) ? DEFAULT_HYPHEN : hyphen;
            return this;
        }

        public GenerationOptions build() {
            return new GenerationOptions(this);
        }
    }
}
