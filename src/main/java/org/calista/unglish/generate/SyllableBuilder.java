package org.calista.unglish.generate;

import org.calista.unglish.language.ConfigurationException;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.language.Position;
import org.calista.unglish.language.SonorityHierarchy;
import org.calista.unglish.language.WordPosition;
import org.calista.unglish.random.Weighted;
import org.calista.unglish.word.Syllable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the unstressed, unrepaired syllable skeleton of a root.
 *
 * <p>Onsets rise in sonority toward the nucleus, codas fall away from it. Exempt sounds (s, z) are neither
 * checked nor used as the reference level. Multi-phoneme clusters must also be a prefix of an attested
 * cluster and must not match an invalid pattern.</p>
 */
public final class SyllableBuilder {

    static final String STAGE = "build";

    /**
     * Appends {@code count} syllables to the context's (empty) syllable list.
     *
     * @param monosyllabicWord true when the finished word will have one syllable (affixes included)
     */
    public void build(GenerationContext ctx, int count, boolean monosyllabicWord) {
        if (count < 1) throw new IllegalArgumentException("syllable count must be >= 1, got " + count);
        List<String> before = ctx.snapshot();
        List<Syllable> out = ctx.syllables();

        for (int i = 0; i < count; i++) {
            Syllable prev = i == 0 ? null : out.get(i - 1);
            boolean last = i == count - 1;
            Syllable s = buildSyllable(ctx, i, prev, last, monosyllabicWord);
            if (prev != null) dropEqualSonorityBoundary(ctx, prev, s, i);
            out.add(s);
        }

        appendFinalS(ctx, out.get(out.size() - 1));
        ctx.stage(STAGE, before);
    }

    // ---------------------------------------------------------------------
    // Syllable
    // ---------------------------------------------------------------------

    private Syllable buildSyllable(GenerationContext ctx, int index, Syllable prev, boolean last, boolean mono) {
        LanguageConfig.Structure st = ctx.lang.structure;
        Syllable s = new Syllable();

        // onset
        int onsetTarget;
        if (mono) onsetTarget = ctx.pick(st.onsetMonosyllabic);
        else if (prev != null && prev.coda().isEmpty()) onsetTarget = ctx.pick(st.onsetFollowingNucleus);
        else onsetTarget = ctx.pick(st.onsetDefault);
        onsetTarget = Math.min(onsetTarget, st.maxOnset);
        if (ctx.tracing()) ctx.decision(STAGE, "onsetLength[" + index + "]", onsetTarget);

        Set<String> ignore = prev == null ? Set.of() : sounds(prev.coda());
        WordPosition onsetPos = index == 0 ? WordPosition.INITIAL : WordPosition.MEDIAL;
        fill(ctx, Position.ONSET, s.onset(), onsetTarget, ignore, onsetPos);

        // nucleus
        WordPosition nucleusPos = (index == 0 && s.onset().isEmpty()) ? WordPosition.INITIAL : WordPosition.MEDIAL;
        fill(ctx, Position.NUCLEUS, s.nucleus(), Math.min(1, st.maxNucleus), Set.of(), nucleusPos);
        if (s.nucleus().isEmpty()) {
            throw new ConfigurationException("no nucleus candidate for syllable " + index + " (" + nucleusPos + ")");
        }

        // coda
        int codaTarget;
        if (mono) codaTarget = ctx.pick(st.codaMonosyllabic(s.onset().size()));
        else codaTarget = ctx.pick(last ? st.codaEndOfWord : st.codaMidWord);
        // a vowel that cannot end a word needs a closing consonant
        if (last && codaTarget == 0 && s.nucleus().get(0).wordPositionWeight(WordPosition.FINAL) <= 0) codaTarget = 1;
        codaTarget = Math.min(codaTarget, st.maxCoda);
        if (ctx.tracing()) ctx.decision(STAGE, "codaLength[" + index + "]", codaTarget);

        fill(ctx, Position.CODA, s.coda(), codaTarget, Set.of(), last ? WordPosition.FINAL : WordPosition.MEDIAL);
        avoidRepetition(ctx, s, last);
        return s;
    }

    private void fill(GenerationContext ctx, Position position, List<Phoneme> cluster, int target,
                      Set<String> ignore, WordPosition wordPosition) {
        List<Phoneme> inventory = ctx.lang.inventory(position);
        while (cluster.size() < target) {
            List<Weighted<Phoneme>> candidates = new ArrayList<>();
            for (Phoneme p : inventory) {
                if (!accepts(ctx.lang, position, cluster, p, ignore, wordPosition)) continue;
                candidates.add(Weighted.of(p, p.weight(position) * p.wordPositionWeight(wordPosition)));
            }
            if (candidates.isEmpty()) break;
            cluster.add(ctx.pick(candidates));
        }
    }

    /**
     * Candidate filter shared by cluster construction and the repetition/final-s edits.
     */
    static boolean accepts(LanguageConfig lang, Position position, List<Phoneme> cluster, Phoneme candidate,
                           Set<String> ignore, WordPosition wordPosition) {
        if (candidate.weight(position) <= 0) return false;
        if (candidate.wordPositionWeight(wordPosition) <= 0) return false;
        if (ignore.contains(candidate.sound())) return false;
        for (Phoneme p : cluster) {
            if (p.sound().equals(candidate.sound())) return false;
        }
        if (position == Position.NUCLEUS) return true;

        if (!sonorityAllows(lang.sonority, position, cluster, candidate)) return false;

        List<String> sounds = new ArrayList<>(cluster.size() + 1);
        StringBuilder joined = new StringBuilder();
        for (Phoneme p : cluster) {
            sounds.add(p.sound());
            joined.append(p.sound());
        }
        sounds.add(candidate.sound());
        joined.append(candidate.sound());

        if (position == Position.ONSET) {
            return lang.clusters.isAttestedOnsetPrefix(sounds) && !lang.clusters.matchesInvalidOnset(joined.toString());
        }
        return lang.clusters.isAttestedCodaPrefix(sounds) && !lang.clusters.matchesInvalidCoda(joined.toString());
    }

    /** Onset: non-decreasing toward the nucleus. Coda: non-increasing away from it. */
    static boolean sonorityAllows(SonorityHierarchy sonority, Position position, List<Phoneme> cluster, Phoneme candidate) {
        if (sonority.isExempt(candidate)) return true;
        Phoneme reference = null;
        for (int i = cluster.size() - 1; i >= 0; i--) {
            if (!sonority.isExempt(cluster.get(i))) {
                reference = cluster.get(i);
                break;
            }
        }
        if (reference == null) return true;
        double level = sonority.levelOf(candidate);
        double ref = sonority.levelOf(reference);
        return position == Position.ONSET ? level >= ref : level <= ref;
    }

    // ---------------------------------------------------------------------
    // Adjustments
    // ---------------------------------------------------------------------

    /** A coda closing on the syllable's own onset sound is replaced by a same-manner sound or dropped. */
    private void avoidRepetition(GenerationContext ctx, Syllable s, boolean last) {
        if (s.onset().isEmpty() || s.coda().isEmpty()) return;
        List<Phoneme> coda = s.coda();
        Phoneme tail = coda.get(coda.size() - 1);
        String repeated = s.onset().get(0).sound();
        if (!tail.sound().equals(repeated)) return;
        if (!ctx.pick(ctx.lang.structure.repeatAvoidance)) return;

        List<Phoneme> head = new ArrayList<>(coda.subList(0, coda.size() - 1));
        WordPosition wp = last ? WordPosition.FINAL : WordPosition.MEDIAL;
        List<Weighted<Phoneme>> alternatives = new ArrayList<>();
        for (Phoneme p : ctx.lang.inventory(Position.CODA)) {
            if (p.manner() != tail.manner() || p.sound().equals(repeated)) continue;
            if (!accepts(ctx.lang, Position.CODA, head, p, Set.of(), wp)) continue;
            alternatives.add(Weighted.of(p, p.weight(Position.CODA)));
        }
        coda.remove(coda.size() - 1);
        if (!alternatives.isEmpty()) {
            Phoneme replacement = ctx.pick(alternatives);
            coda.add(replacement);
            if (ctx.tracing()) ctx.decision(STAGE, "repetition", repeated + "->" + replacement.sound());
        } else {
            if (ctx.tracing()) ctx.decision(STAGE, "repetition", repeated + "->");
        }
    }

    /** Equal sonority across a boundary reads as ambiguous; usually the coda side gives way. */
    private void dropEqualSonorityBoundary(GenerationContext ctx, Syllable prev, Syllable next, int index) {
        if (prev.coda().isEmpty() || next.onset().isEmpty()) return;
        Phoneme codaLast = prev.coda().get(prev.coda().size() - 1);
        Phoneme onsetFirst = next.onset().get(0);
        if (Double.compare(ctx.lang.sonorityOf(codaLast), ctx.lang.sonorityOf(onsetFirst)) != 0) return;

        boolean drop = ctx.pick(ctx.lang.structure.boundaryDrop);
        if (ctx.tracing()) ctx.decision(STAGE, "boundaryDrop[" + index + "]", drop);
        if (drop) prev.coda().remove(prev.coda().size() - 1);
    }

    /** Inflection-like final s after a voiceless coda consonant ("-ts", "-ks"). */
    private void appendFinalS(GenerationContext ctx, Syllable last) {
        LanguageConfig.Structure st = ctx.lang.structure;
        Phoneme s = st.finalSPhoneme;
        if (s == null || last.coda().isEmpty()) return;
        List<Phoneme> coda = last.coda();
        Phoneme tail = coda.get(coda.size() - 1);
        if (tail.voiced() || tail.isVowel()) return;
        if (coda.size() + 1 > st.effectiveMaxCoda(s.sound())) return;
        if (!accepts(ctx.lang, Position.CODA, coda, s, Set.of(), WordPosition.FINAL)) return;

        boolean append = ctx.pick(st.finalS);
        ctx.decision(STAGE, "finalS", append);
        if (append) coda.add(s);
    }

    private static Set<String> sounds(List<Phoneme> segment) {
        if (segment.isEmpty()) return Set.of();
        Set<String> out = new HashSet<>();
        for (Phoneme p : segment) out.add(p.sound());
        return out;
    }
}
