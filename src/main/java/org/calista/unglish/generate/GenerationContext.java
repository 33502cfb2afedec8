package org.calista.unglish.generate;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.random.PrecomputedWeights;
import org.calista.unglish.random.RandomSource;
import org.calista.unglish.random.Weighted;
import org.calista.unglish.random.WeightedChoice;
import org.calista.unglish.trace.TraceRecorder;
import org.calista.unglish.word.Syllable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State of one generation call, handed through every stage in turn.
 *
 * <p>Owns the syllable list (stages edit it in place), the random source and the optional trace recorder.
 * Never shared between calls or threads.</p>
 */
public final class GenerationContext {

    public final LanguageConfig lang;
    public final GenerationOptions options;

    private final RandomSource rng;
    private final TraceRecorder trace; // nullable
    private final List<Syllable> syllables = new ArrayList<>();

    public GenerationContext(LanguageConfig lang, GenerationOptions options, RandomSource rng, TraceRecorder trace) {
        this.lang = Objects.requireNonNull(lang, "lang");
        this.options = Objects.requireNonNull(options, "options");
        this.rng = Objects.requireNonNull(rng, "rng");
        this.trace = trace;
    }

    public RandomSource rng() {
        return rng;
    }

    /** @return recorder or null when tracing is off */
    public TraceRecorder trace() {
        return trace;
    }

    public boolean tracing() {
        return trace != null;
    }

    public List<Syllable> syllables() {
        return syllables;
    }

    public boolean vowelReductionEnabled() {
        return options.vowelReduction != null ? options.vowelReduction : lang.vowelReduction.enabled;
    }

    // ---------------------------------------------------------------------
    // Sampling shortcuts
    // ---------------------------------------------------------------------

    public <T> T pick(PrecomputedWeights<T> table) {
        return table.pick(rng);
    }

    public <T> T pick(List<Weighted<T>> options) {
        return WeightedChoice.pick(options, rng);
    }

    public boolean chance(double percent) {
        return rng.chance(percent);
    }

    // ---------------------------------------------------------------------
    // Trace shortcuts (no-ops when untraced)
    // ---------------------------------------------------------------------

    public void decision(String stage, String what, Object value) {
        if (trace != null) trace.decision(stage, what, value);
    }

    public List<String> snapshot() {
        return trace == null ? List.of() : TraceRecorder.snapshot(syllables);
    }

    public void stage(String name, List<String> before) {
        if (trace != null) trace.stage(name, before, syllables);
    }
}
