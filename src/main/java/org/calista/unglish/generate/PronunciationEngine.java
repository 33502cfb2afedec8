package org.calista.unglish.generate;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.language.Position;
import org.calista.unglish.random.Weighted;
import org.calista.unglish.word.Stress;
import org.calista.unglish.word.Syllable;

import java.util.ArrayList;
import java.util.List;

/**
 * Aspiration, stress and vowel reduction over the whole syllable list, then the phonetic string.
 *
 * <p>Re-entrant: morphology runs it again on the affixed word. An existing primary stress is kept,
 * existing secondary stress suppresses a new secondary draw, aspirated phonemes are not aspirated again
 * and reduced vowels are not reduced again.</p>
 */
public final class PronunciationEngine {

    static final String ASPIRATION = "pronounce.aspiration";
    static final String STRESS = "pronounce.stress";
    static final String REDUCTION = "pronounce.reduction";

    public static final String BOUNDARY_MARK = ".";

    public String pronounce(GenerationContext ctx) {
        // aspiration reads the stress left by an earlier pass; a fresh root has none yet
        List<String> before = ctx.snapshot();
        aspirate(ctx);
        ctx.stage(ASPIRATION, before);

        before = ctx.snapshot();
        assignStress(ctx);
        ctx.stage(STRESS, before);

        if (ctx.vowelReductionEnabled()) {
            before = ctx.snapshot();
            reduceVowels(ctx);
            ctx.stage(REDUCTION, before);
        }
        return render(ctx.syllables());
    }

    /** Stress mark (or '.' for unstressed non-initial syllables) followed by the syllable's sounds. */
    public static String render(List<Syllable> syllables) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < syllables.size(); i++) {
            Syllable s = syllables.get(i);
            if (s.stress().isStressed()) sb.append(s.stress().mark());
            else if (i > 0) sb.append(BOUNDARY_MARK);
            sb.append(s.sounds());
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Aspiration
    // ---------------------------------------------------------------------

    private void aspirate(GenerationContext ctx) {
        LanguageConfig.Aspiration cfg = ctx.lang.aspiration;
        List<Syllable> syllables = ctx.syllables();
        int last = syllables.size() - 1;

        for (int i = 0; i < syllables.size(); i++) {
            Syllable s = syllables.get(i);
            if (s.onset().isEmpty() || !s.onset().get(0).isVoicelessStop()) continue;
            if (s.onset().get(0).aspirated()) continue;

            Syllable prev = i > 0 ? syllables.get(i - 1) : null;
            boolean codaCase = false;
            double percent;
            if (i == 0) {
                percent = cfg.wordInitial;
            } else if (!prev.coda().isEmpty() && "s".equals(prev.coda().get(prev.coda().size() - 1).sound())) {
                percent = cfg.afterS;
            } else if (s.stress().isStressed()) {
                percent = cfg.stressed;
            } else if (prev.stress().isStressed()) {
                percent = cfg.afterStressed;
            } else if (i == last) {
                // word-finally only a lone voiceless stop coda takes the aspiration
                if (s.coda().size() != 1 || !s.coda().get(0).isVoicelessStop() || s.coda().get(0).aspirated()) continue;
                codaCase = true;
                percent = cfg.wordFinal;
            } else {
                percent = cfg.other;
            }

            boolean hit = ctx.chance(percent);
            if (ctx.tracing()) ctx.decision(ASPIRATION, "syllable[" + i + "]", hit);
            if (!hit) continue;
            if (codaCase) s.coda().set(0, s.coda().get(0).withAspiration());
            else s.onset().set(0, s.onset().get(0).withAspiration());
        }
    }

    // ---------------------------------------------------------------------
    // Stress
    // ---------------------------------------------------------------------

    private void assignStress(GenerationContext ctx) {
        List<Syllable> syllables = ctx.syllables();
        if (syllables.size() < 2) {
            for (Syllable s : syllables) s.setStress(Stress.NONE);
            return;
        }
        int primary = assignPrimary(ctx, syllables);
        restoreStressedNucleus(ctx, syllables.get(primary));
        assignSecondary(ctx, syllables, primary);
        assignRhythmic(ctx, syllables);
    }

    private int assignPrimary(GenerationContext ctx, List<Syllable> syllables) {
        int primary = -1;
        for (int i = 0; i < syllables.size(); i++) {
            if (syllables.get(i).stress() != Stress.PRIMARY) continue;
            if (primary < 0) primary = i;
            else syllables.get(i).setStress(Stress.SECONDARY);
        }
        if (primary >= 0) return primary;

        LanguageConfig.Stress cfg = ctx.lang.stress;
        int n = syllables.size();
        List<Weighted<Integer>> options = new ArrayList<>(3);
        if (n == 2) {
            options.add(Weighted.of(0, cfg.disyllabicFirst));
            options.add(Weighted.of(1, cfg.disyllabicSecond));
        } else {
            boolean heavy = syllables.get(n - 2).isHeavy();
            double penult = heavy ? cfg.penultHeavy : cfg.penultLight;
            double ante = heavy ? cfg.antepenultHeavy : cfg.antepenultLight;
            options.add(Weighted.of(n - 2, penult));
            if (n == 3) {
                options.add(Weighted.of(0, ante + cfg.initial));
            } else {
                options.add(Weighted.of(n - 3, ante));
                options.add(Weighted.of(0, cfg.initial));
            }
        }
        primary = ctx.pick(options);
        syllables.get(primary).setStress(Stress.PRIMARY);
        ctx.decision(STRESS, "primary", primary);
        return primary;
    }

    /**
     * A primary-stressed syllable keeps a full vowel: a reduced nucleus gets its source back, a banned one
     * (schwa) is re-drawn.
     */
    private void restoreStressedNucleus(GenerationContext ctx, Syllable s) {
        LanguageConfig lang = ctx.lang;
        List<Phoneme> nucleus = s.nucleus();
        for (int i = 0; i < nucleus.size(); i++) {
            Phoneme v = nucleus.get(i);
            if (v.reduced()) {
                Phoneme source = lang.phoneme(v.reducedFrom());
                if (source != null) {
                    nucleus.set(i, source);
                    v = source;
                }
            }
            if (!lang.stress.stressedNucleusBan.contains(v.sound())) continue;

            List<Weighted<Phoneme>> options = new ArrayList<>();
            for (Phoneme p : lang.inventory(Position.NUCLEUS)) {
                if (lang.stress.stressedNucleusBan.contains(p.sound())) continue;
                options.add(Weighted.of(p, p.weight(Position.NUCLEUS)));
            }
            if (options.isEmpty()) continue;
            Phoneme replacement = ctx.pick(options);
            nucleus.set(i, replacement);
            if (ctx.tracing()) ctx.decision(STRESS, "stressedNucleus", v.sound() + "->" + replacement.sound());
        }
    }

    private void assignSecondary(GenerationContext ctx, List<Syllable> syllables, int primary) {
        for (Syllable s : syllables) {
            if (s.stress() == Stress.SECONDARY) return;
        }
        LanguageConfig.Stress cfg = ctx.lang.stress;
        List<Weighted<Integer>> options = new ArrayList<>(3);
        for (int i = 0; i <= 2 && i < syllables.size(); i++) {
            if (i == primary) continue;
            options.add(Weighted.of(i, syllables.get(i).isHeavy() ? cfg.secondaryHeavy : cfg.secondaryLight));
        }
        if (options.stream().mapToDouble(w -> w.weight).sum() <= 0) return;
        int index = ctx.pick(options);
        boolean apply = ctx.chance(cfg.secondaryChance);
        ctx.decision(STRESS, "secondary", apply ? index : "none");
        if (apply) syllables.get(index).setStress(Stress.SECONDARY);
    }

    private void assignRhythmic(GenerationContext ctx, List<Syllable> syllables) {
        double chance = ctx.lang.stress.rhythmicChance;
        for (int i = 1; i < syllables.size() - 1; i++) {
            if (syllables.get(i - 1).stress().isStressed()
                    || syllables.get(i).stress().isStressed()
                    || syllables.get(i + 1).stress().isStressed()) continue;
            if (ctx.chance(chance)) {
                syllables.get(i).setStress(Stress.SECONDARY);
                ctx.decision(STRESS, "rhythmic", i);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Vowel reduction
    // ---------------------------------------------------------------------

    private void reduceVowels(GenerationContext ctx) {
        LanguageConfig.VowelReduction cfg = ctx.lang.vowelReduction;
        List<Syllable> syllables = ctx.syllables();
        int n = syllables.size();
        if (n <= 1) return;

        for (int si = 0; si < n; si++) {
            Syllable s = syllables.get(si);
            if (s.stress() == Stress.PRIMARY) continue;
            boolean secondary = s.stress() == Stress.SECONDARY;
            if (secondary && !cfg.reduceSecondaryStress) continue;

            double positional = si == 0 ? cfg.wordInitial : (si == n - 1 ? cfg.wordFinal : cfg.wordMedial);
            List<Phoneme> nucleus = s.nucleus();
            for (int i = 0; i < nucleus.size(); i++) {
                Phoneme v = nucleus.get(i);
                if (v.tense() || v.reduced()) continue;
                LanguageConfig.VowelReduction.Rule rule = cfg.rule(v.sound());
                if (rule == null) continue;

                double p = rule.probability * positional;
                if (secondary) p = p * (cfg.secondaryStressProbability / 100.0);
                p = Math.min(100, Math.max(0, Math.round(p)));

                if (ctx.chance(p)) {
                    nucleus.set(i, rule.target.asReductionOf(v.sound()));
                    if (ctx.tracing()) ctx.decision(REDUCTION, "syllable[" + si + "]", v.sound() + "->" + rule.target.sound());
                }
            }
        }
    }
}
