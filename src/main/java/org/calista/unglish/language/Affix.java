package org.calista.unglish.language;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Prefix or suffix with its base form, allomorphs, stress effect and spelling boundary rules.
 */
public final class Affix {

    public final String id;
    public final AffixKind kind;
    public final List<String> phonemes;
    public final int syllableCount;
    public final String written;
    public final double frequency;
    public final StressEffect stressEffect;
    /** Sorted most specific first. */
    public final List<AllomorphVariant> variants;
    public final Set<BoundaryRule> boundaryRules;

    public Affix(String id,
                 AffixKind kind,
                 List<String> phonemes,
                 int syllableCount,
                 String written,
                 double frequency,
                 StressEffect stressEffect,
                 List<AllomorphVariant> variants,
                 Set<BoundaryRule> boundaryRules) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.phonemes = List.copyOf(phonemes);
        this.syllableCount = syllableCount;
        this.written = Objects.requireNonNull(written, "written");
        this.frequency = frequency;
        this.stressEffect = stressEffect == null ? StressEffect.NONE : stressEffect;
        this.variants = variants.stream()
                .sorted(Comparator.comparingInt((AllomorphVariant v) -> v.condition.specificity()).reversed())
                .toList();
        this.boundaryRules = boundaryRules.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(boundaryRules));
    }

    @Override
    public String toString() {
        return kind == AffixKind.PREFIX ? written + "-" : "-" + written;
    }
}
