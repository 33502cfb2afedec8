package org.calista.unglish.generate;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.Manner;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.trace.TraceRecorder;
import org.calista.unglish.word.Syllable;

import java.util.List;

/**
 * Hard legality passes run after the probabilistic builder.
 *
 * <p>Every pass only removes phonemes and is scoped to one constraint family:</p>
 * <ol>
 *   <li>cross-syllable clusters: banned (coda-final, onset-initial) pairs, cascading</li>
 *   <li>word-final coda: trailing sounds outside the allowed-final set</li>
 *   <li>cluster shape: over-long onsets/codas, trimmed from the outer onset edge and the inner coda edge</li>
 *   <li>voicing agreement among coda obstruents (last obstruent wins)</li>
 *   <li>homorganic nasal + stop in codas (the nasal goes)</li>
 *   <li>coda cleanup pairs, e.g. ŋ followed by s/z</li>
 * </ol>
 *
 * <p>{@link #repair(GenerationContext)} repeats the sequence until nothing changes, so a later pass can never
 * leave a violation of an earlier one behind and a second run is a no-op.</p>
 */
public final class PhonotacticRepair {

    public static final String CLUSTERS = TraceRecorder.REPAIR_PREFIX + ".clusters";
    public static final String FINAL_CODA = TraceRecorder.REPAIR_PREFIX + ".finalCoda";
    public static final String SHAPE = TraceRecorder.REPAIR_PREFIX + ".shape";
    public static final String VOICING = TraceRecorder.REPAIR_PREFIX + ".voicing";
    public static final String HOMORGANIC = TraceRecorder.REPAIR_PREFIX + ".homorganic";
    public static final String CODA_CLEANUP = TraceRecorder.REPAIR_PREFIX + ".codaCleanup";

    /** All six passes, to a fixed point. */
    public void repair(GenerationContext ctx) {
        run(ctx, "");
    }

    /**
     * The same passes over the joined word after affixes were spliced in. Suffix consonants land in root codas
     * here, so voicing, homorganic and coda-cleanup sequences appear only now. Stages carry a ".boundary" suffix.
     */
    public void repairBoundaries(GenerationContext ctx) {
        run(ctx, ".boundary");
    }

    private static void run(GenerationContext ctx, String suffix) {
        LanguageConfig lang = ctx.lang;
        List<Syllable> syllables = ctx.syllables();
        TraceRecorder trace = ctx.trace();

        // each round removes at least one phoneme, so this bound is never the reason to stop
        int guard = phonemeCount(syllables) + 1;
        for (int round = 0; round < guard; round++) {
            boolean changed = false;
            changed |= pass(ctx, round, CLUSTERS + suffix, () -> repairClusters(lang, syllables, trace));
            changed |= pass(ctx, round, FINAL_CODA + suffix, () -> repairFinalCoda(lang, syllables, trace));
            changed |= pass(ctx, round, SHAPE + suffix, () -> repairClusterShape(lang, syllables, trace));
            changed |= pass(ctx, round, VOICING + suffix, () -> repairVoicing(syllables, trace));
            changed |= pass(ctx, round, HOMORGANIC + suffix, () -> repairHomorganicNasal(lang, syllables, trace));
            changed |= pass(ctx, round, CODA_CLEANUP + suffix, () -> repairCodaCleanup(lang, syllables, trace));
            if (!changed) return;
        }
    }

    private interface Pass {
        boolean run();
    }

    private static boolean pass(GenerationContext ctx, int round, String name, Pass pass) {
        List<String> before = ctx.snapshot();
        boolean changed = pass.run();
        if (round == 0) ctx.stage(name, before);
        else if (changed) ctx.stage(name + "#" + (round + 1), before);
        return changed;
    }

    // ---------------------------------------------------------------------
    // Passes (public for direct use on hand-built syllables)
    // ---------------------------------------------------------------------

    public static boolean repairClusters(LanguageConfig lang, List<Syllable> syllables, TraceRecorder trace) {
        boolean changed = false;
        boolean dropCoda = lang.clusters.boundaryRepair == LanguageConfig.Clusters.BoundaryRepair.DROP_CODA;
        for (int i = 0; i < syllables.size() - 1; i++) {
            List<Phoneme> coda = syllables.get(i).coda();
            List<Phoneme> onset = syllables.get(i + 1).onset();
            while (!coda.isEmpty() && !onset.isEmpty()
                    && lang.clusters.isBannedBoundary(coda.get(coda.size() - 1).sound(), onset.get(0).sound())) {
                String pair = coda.get(coda.size() - 1).sound() + "|" + onset.get(0).sound();
                if (dropCoda) {
                    Phoneme removed = coda.remove(coda.size() - 1);
                    if (trace != null) trace.repair(CLUSTERS, i, removed, "banned boundary " + pair + ", coda dropped");
                } else {
                    Phoneme removed = onset.remove(0);
                    if (trace != null) trace.repair(CLUSTERS, i + 1, removed, "banned boundary " + pair + ", onset dropped");
                }
                changed = true;
            }
        }
        return changed;
    }

    public static boolean repairFinalCoda(LanguageConfig lang, List<Syllable> syllables, TraceRecorder trace) {
        if (syllables.isEmpty()) return false;
        int last = syllables.size() - 1;
        List<Phoneme> coda = syllables.get(last).coda();
        boolean changed = false;
        while (!coda.isEmpty() && !lang.clusters.allowedFinal.contains(coda.get(coda.size() - 1).sound())) {
            Phoneme removed = coda.remove(coda.size() - 1);
            if (trace != null) trace.repair(FINAL_CODA, last, removed, "not allowed word-finally");
            changed = true;
        }
        return changed;
    }

    public static boolean repairClusterShape(LanguageConfig lang, List<Syllable> syllables, TraceRecorder trace) {
        LanguageConfig.Structure st = lang.structure;
        boolean changed = false;
        for (int i = 0; i < syllables.size(); i++) {
            Syllable s = syllables.get(i);
            while (s.onset().size() > st.maxOnset) {
                Phoneme removed = s.onset().remove(0);
                if (trace != null) trace.repair(SHAPE, i, removed, "onset longer than " + st.maxOnset);
                changed = true;
            }
            List<Phoneme> coda = s.coda();
            if (coda.isEmpty()) continue;
            int max = st.effectiveMaxCoda(coda.get(coda.size() - 1).sound());
            while (coda.size() > max) {
                Phoneme removed = coda.remove(0);
                if (trace != null) trace.repair(SHAPE, i, removed, "coda longer than " + max);
                changed = true;
            }
        }
        return changed;
    }

    public static boolean repairVoicing(List<Syllable> syllables, TraceRecorder trace) {
        boolean changed = false;
        for (int i = 0; i < syllables.size(); i++) {
            List<Phoneme> coda = syllables.get(i).coda();
            if (coda.size() < 2) continue;

            int lastObstruent = -1;
            for (int j = coda.size() - 1; j >= 0; j--) {
                if (coda.get(j).manner().isObstruent()) {
                    lastObstruent = j;
                    break;
                }
            }
            if (lastObstruent < 0) continue;
            boolean voiced = coda.get(lastObstruent).voiced();

            for (int j = lastObstruent - 1; j >= 0; j--) {
                Phoneme p = coda.get(j);
                if (p.manner().isObstruent() && p.voiced() != voiced) {
                    coda.remove(j);
                    if (trace != null) trace.repair(VOICING, i, p, "voicing disagrees with final obstruent");
                    changed = true;
                }
            }
        }
        return changed;
    }

    public static boolean repairHomorganicNasal(LanguageConfig lang, List<Syllable> syllables, TraceRecorder trace) {
        boolean changed = false;
        for (int i = 0; i < syllables.size(); i++) {
            List<Phoneme> coda = syllables.get(i).coda();
            for (int j = coda.size() - 2; j >= 0; j--) {
                Phoneme nasal = coda.get(j);
                Phoneme stop = coda.get(j + 1);
                if (nasal.manner() != Manner.NASAL || stop.manner() != Manner.STOP) continue;
                if (lang.clusters.homorganic(nasal.sound(), stop.sound())) continue;
                coda.remove(j);
                if (trace != null) trace.repair(HOMORGANIC, i, nasal, "place differs from " + stop.sound());
                changed = true;
            }
        }
        return changed;
    }

    public static boolean repairCodaCleanup(LanguageConfig lang, List<Syllable> syllables, TraceRecorder trace) {
        boolean changed = false;
        for (List<String> pair : lang.clusters.codaCleanup) {
            String trigger = pair.get(0);
            String stripped = pair.get(1);
            for (int i = 0; i < syllables.size(); i++) {
                List<Phoneme> coda = syllables.get(i).coda();
                int at = indexOf(coda, trigger);
                if (at < 0) continue;
                for (int j = coda.size() - 1; j > at; j--) {
                    if (coda.get(j).sound().equals(stripped)) {
                        Phoneme removed = coda.remove(j);
                        if (trace != null) trace.repair(CODA_CLEANUP, i, removed, "after " + trigger);
                        changed = true;
                    }
                }
            }
        }
        return changed;
    }

    private static int indexOf(List<Phoneme> segment, String sound) {
        for (int i = 0; i < segment.size(); i++) {
            if (segment.get(i).sound().equals(sound)) return i;
        }
        return -1;
    }

    private static int phonemeCount(List<Syllable> syllables) {
        int n = 0;
        for (Syllable s : syllables) n += s.onset().size() + s.nucleus().size() + s.coda().size();
        return n;
    }
}
