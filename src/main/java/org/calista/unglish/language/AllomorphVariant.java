package org.calista.unglish.language;

import java.util.List;
import java.util.Objects;

/**
 * Alternate realization of an affix, chosen when its condition matches the root boundary.
 */
public final class AllomorphVariant {

    public final AllomorphCondition condition;
    public final List<String> phonemes;
    public final String written;
    public final int syllableCount;

    public AllomorphVariant(AllomorphCondition condition, List<String> phonemes, String written, int syllableCount) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.phonemes = List.copyOf(phonemes);
        this.written = Objects.requireNonNull(written, "written");
        this.syllableCount = syllableCount;
    }

    @Override
    public String toString() {
        return condition.key() + ":" + written;
    }
}
