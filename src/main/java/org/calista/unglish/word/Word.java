package org.calista.unglish.word;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.unglish.trace.WordTrace;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finished word: frozen syllables, pronunciation and spelling, plus the optional trace.
 * Equality ignores the trace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"written", "pronunciation", "syllables", "trace"})
public final class Word {

    public final List<Syllable> syllables;
    public final String pronunciation;
    public final WrittenForm written;
    /** null unless tracing was requested */
    public final WordTrace trace;

    public Word(List<Syllable> syllables, String pronunciation, WrittenForm written, WordTrace trace) {
        Objects.requireNonNull(syllables, "syllables");
        if (syllables.isEmpty()) throw new IllegalArgumentException("word without syllables");
        List<Syllable> frozen = new ArrayList<>(syllables.size());
        for (Syllable s : syllables) frozen.add(s.freeze());
        this.syllables = List.copyOf(frozen);
        this.pronunciation = Objects.requireNonNull(pronunciation, "pronunciation");
        this.written = Objects.requireNonNull(written, "written");
        this.trace = trace;
    }

    public int syllableCount() {
        return syllables.size();
    }

    /** @return index of the primary-stressed syllable or -1 (monosyllables) */
    public int primaryStressIndex() {
        for (int i = 0; i < syllables.size(); i++) {
            if (syllables.get(i).stress() == Stress.PRIMARY) return i;
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Word w)) return false;
        return syllables.equals(w.syllables)
                && pronunciation.equals(w.pronunciation)
                && written.equals(w.written);
    }

    @Override
    public int hashCode() {
        return Objects.hash(syllables, pronunciation, written);
    }

    @Override
    public String toString() {
        return written.clean + " /" + pronunciation + "/";
    }
}
