package org.calista.unglish.morphology;

import org.calista.unglish.language.Affix;
import org.calista.unglish.language.AllomorphVariant;
import org.calista.unglish.language.MorphologyTemplate;

import java.util.List;
import java.util.Objects;

/**
 * Template and affixes drawn before the root exists; the allomorphs are resolved once the root's boundary
 * phonemes are known.
 */
public final class MorphologyPlan {

    public static final MorphologyPlan BARE = new MorphologyPlan(MorphologyTemplate.BARE, null, null);

    public final MorphologyTemplate template;
    /** null unless the template has a prefix */
    public final Affix prefix;
    /** null unless the template has a suffix */
    public final Affix suffix;

    private Realization prefixRealization;
    private Realization suffixRealization;

    public MorphologyPlan(MorphologyTemplate template, Affix prefix, Affix suffix) {
        this.template = Objects.requireNonNull(template, "template");
        if (template.hasPrefix() != (prefix != null)) throw new IllegalArgumentException("prefix does not fit " + template.key());
        if (template.hasSuffix() != (suffix != null)) throw new IllegalArgumentException("suffix does not fit " + template.key());
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public boolean isBare() {
        return prefix == null && suffix == null;
    }

    /** Syllables the affixes will contribute, from their base forms. */
    public int syllableReduction() {
        int n = 0;
        if (prefix != null) n += prefix.syllableCount;
        if (suffix != null) n += suffix.syllableCount;
        return n;
    }

    /**
     * This plan when its affixes fit in {@code budget} syllables, else the suffix alone, else the prefix alone,
     * else {@link #BARE}.
     */
    public MorphologyPlan within(int budget) {
        if (syllableReduction() <= budget) return this;
        if (suffix != null && suffix.syllableCount <= budget) return new MorphologyPlan(MorphologyTemplate.SUFFIXED, null, suffix);
        if (prefix != null && prefix.syllableCount <= budget) return new MorphologyPlan(MorphologyTemplate.PREFIXED, prefix, null);
        return BARE;
    }

    /** @return resolved prefix form or null (bare / not resolved yet) */
    public Realization prefixRealization() {
        return prefixRealization;
    }

    /** @return resolved suffix form or null (bare / not resolved yet) */
    public Realization suffixRealization() {
        return suffixRealization;
    }

    void resolve(Realization prefixRealization, Realization suffixRealization) {
        this.prefixRealization = prefixRealization;
        this.suffixRealization = suffixRealization;
    }

    @Override
    public String toString() {
        return template.key()
                + (prefix == null ? "" : " " + prefix)
                + (suffix == null ? "" : " " + suffix);
    }

    /**
     * The form an affix takes on one particular root: its base form or a matching allomorph.
     */
    public static final class Realization {
        public final Affix affix;
        /** null for the base form */
        public final AllomorphVariant variant;
        public final List<String> phonemes;
        public final String written;
        public final int syllableCount;

        private Realization(Affix affix, AllomorphVariant variant, List<String> phonemes, String written, int syllableCount) {
            this.affix = affix;
            this.variant = variant;
            this.phonemes = phonemes;
            this.written = written;
            this.syllableCount = syllableCount;
        }

        public static Realization base(Affix affix) {
            return new Realization(affix, null, affix.phonemes, affix.written, affix.syllableCount);
        }

        public static Realization of(Affix affix, AllomorphVariant variant) {
            return new Realization(affix, variant, variant.phonemes, variant.written, variant.syllableCount);
        }

        @Override
        public String toString() {
            return (variant == null ? "base" : variant.condition.key()) + ":" + written;
        }
    }
}
