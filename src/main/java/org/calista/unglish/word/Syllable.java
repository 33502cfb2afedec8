package org.calista.unglish.word;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.calista.unglish.language.Phoneme;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Onset / nucleus / coda phoneme lists plus a stress level.
 *
 * <p>Mutable while a word is being generated: every stage edits the lists in place. {@link #freeze()} returns
 * an immutable copy for the finished word; mutating a frozen syllable throws.</p>
 */
@JsonPropertyOrder({"onset", "nucleus", "coda", "stress"})
public final class Syllable {

    private final List<Phoneme> onset;
    private final List<Phoneme> nucleus;
    private final List<Phoneme> coda;
    private Stress stress;
    private final boolean frozen;

    public Syllable() {
        this(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), Stress.NONE, false);
    }

    public Syllable(List<Phoneme> onset, List<Phoneme> nucleus, List<Phoneme> coda) {
        this(new ArrayList<>(onset), new ArrayList<>(nucleus), new ArrayList<>(coda), Stress.NONE, false);
    }

    private Syllable(List<Phoneme> onset, List<Phoneme> nucleus, List<Phoneme> coda, Stress stress, boolean frozen) {
        this.onset = onset;
        this.nucleus = nucleus;
        this.coda = coda;
        this.stress = Objects.requireNonNull(stress, "stress");
        this.frozen = frozen;
    }

    /** Immutable snapshot. A syllable with an empty nucleus cannot be frozen. */
    public Syllable freeze() {
        if (nucleus.isEmpty()) throw new IllegalStateException("syllable without nucleus: " + this);
        if (frozen) return this;
        return new Syllable(List.copyOf(onset), List.copyOf(nucleus), List.copyOf(coda), stress, true);
    }

    /** Mutable deep copy (phonemes are immutable and shared). */
    public Syllable copy() {
        return new Syllable(new ArrayList<>(onset), new ArrayList<>(nucleus), new ArrayList<>(coda), stress, false);
    }

    // ---------------------------------------------------------------------
    // Segments (live lists while mutable)
    // ---------------------------------------------------------------------

    @JsonIgnore
    public List<Phoneme> onset() { return onset; }

    @JsonIgnore
    public List<Phoneme> nucleus() { return nucleus; }

    @JsonIgnore
    public List<Phoneme> coda() { return coda; }

    @JsonProperty("stress")
    public Stress stress() { return stress; }

    public void setStress(Stress stress) {
        if (frozen) throw new UnsupportedOperationException("syllable is frozen");
        this.stress = Objects.requireNonNull(stress, "stress");
    }

    @JsonIgnore
    public boolean isFrozen() {
        return frozen;
    }

    /** Long nucleus or any coda. */
    @JsonIgnore
    public boolean isHeavy() {
        return nucleus.size() > 1 || !coda.isEmpty();
    }

    /** @return first phoneme of the syllable or null */
    @JsonIgnore
    public Phoneme first() {
        if (!onset.isEmpty()) return onset.get(0);
        if (!nucleus.isEmpty()) return nucleus.get(0);
        return coda.isEmpty() ? null : coda.get(0);
    }

    /** @return last phoneme of the syllable or null */
    @JsonIgnore
    public Phoneme last() {
        if (!coda.isEmpty()) return coda.get(coda.size() - 1);
        if (!nucleus.isEmpty()) return nucleus.get(nucleus.size() - 1);
        return onset.isEmpty() ? null : onset.get(onset.size() - 1);
    }

    @JsonIgnore
    public List<Phoneme> phonemes() {
        List<Phoneme> all = new ArrayList<>(onset.size() + nucleus.size() + coda.size());
        all.addAll(onset);
        all.addAll(nucleus);
        all.addAll(coda);
        return all;
    }

    // ---------------------------------------------------------------------
    // Rendering
    // ---------------------------------------------------------------------

    @JsonProperty("onset")
    public List<String> onsetSounds() { return render(onset); }

    @JsonProperty("nucleus")
    public List<String> nucleusSounds() { return render(nucleus); }

    @JsonProperty("coda")
    public List<String> codaSounds() { return render(coda); }

    /** Sounds without any stress or boundary mark. */
    public String sounds() {
        StringBuilder sb = new StringBuilder();
        for (Phoneme p : onset) sb.append(p.render());
        for (Phoneme p : nucleus) sb.append(p.render());
        for (Phoneme p : coda) sb.append(p.render());
        return sb.toString();
    }

    private static List<String> render(List<Phoneme> segment) {
        List<String> out = new ArrayList<>(segment.size());
        for (Phoneme p : segment) out.add(p.render());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Syllable s)) return false;
        return onset.equals(s.onset) && nucleus.equals(s.nucleus) && coda.equals(s.coda) && stress == s.stress;
    }

    @Override
    public int hashCode() {
        return Objects.hash(onset, nucleus, coda, stress);
    }

    @Override
    public String toString() {
        return stress.mark() + sounds();
    }
}
