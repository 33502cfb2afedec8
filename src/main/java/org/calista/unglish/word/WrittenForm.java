package org.calista.unglish.word;

import java.util.Objects;

/**
 * Spelling of a word: plain form and a form with syllable (or morpheme) boundaries marked.
 */
public final class WrittenForm {
    public final String clean;
    public final String hyphenated;

    public WrittenForm(String clean, String hyphenated) {
        this.clean = Objects.requireNonNull(clean, "clean");
        this.hyphenated = Objects.requireNonNull(hyphenated, "hyphenated");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WrittenForm w)) return false;
        return clean.equals(w.clean) && hyphenated.equals(w.hyphenated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clean, hyphenated);
    }

    @Override
    public String toString() {
        return clean;
    }
}
