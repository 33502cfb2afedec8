package org.calista.unglish.morphology;

import org.calista.unglish.generate.GenerationContext;
import org.calista.unglish.generate.OrthographyWriter;
import org.calista.unglish.generate.PhonotacticRepair;
import org.calista.unglish.generate.PronunciationEngine;
import org.calista.unglish.language.Affix;
import org.calista.unglish.language.AffixKind;
import org.calista.unglish.language.AllomorphVariant;
import org.calista.unglish.language.BoundaryRule;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.MorphologyTemplate;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.language.StressEffect;
import org.calista.unglish.random.Weighted;
import org.calista.unglish.word.Stress;
import org.calista.unglish.word.Syllable;
import org.calista.unglish.word.WrittenForm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prefix/suffix affixation in two phases.
 *
 * <p>{@link #plan(GenerationContext)} runs before the root is built so the root can be sized to leave room for
 * the affix syllables. {@link #apply(GenerationContext, MorphologyPlan, WrittenForm)} runs on the finished,
 * spelled root: allomorph resolution, spelling boundary rules, splicing, stress effects, boundary repair and
 * a second pronunciation pass over the whole word.</p>
 */
public final class MorphologyEngine {

    static final String STAGE = "morphology";

    private static final Pattern Y_AFTER_CONSONANT = Pattern.compile("([^aeiou])y$");
    private static final Pattern SILENT_E = Pattern.compile("(?<=[^aeiou])e$");
    private static final Pattern SINGLE_VOWEL_CONSONANT = Pattern.compile("(?:^|[^aeiou])[aeiou]([b-df-hj-np-tv-z])$");

    private final PhonotacticRepair repair;
    private final PronunciationEngine pronunciation;

    public MorphologyEngine(PhonotacticRepair repair, PronunciationEngine pronunciation) {
        this.repair = Objects.requireNonNull(repair, "repair");
        this.pronunciation = Objects.requireNonNull(pronunciation, "pronunciation");
    }

    // ---------------------------------------------------------------------
    // Plan
    // ---------------------------------------------------------------------

    public MorphologyPlan plan(GenerationContext ctx) {
        LanguageConfig.Morphology cfg = ctx.lang.morphology;
        if (!ctx.options.morphology || !cfg.enabled) return MorphologyPlan.BARE;

        MorphologyTemplate template = ctx.pick(cfg.templates(ctx.options.mode));
        ctx.decision(STAGE, "template", template.key());
        if (template == MorphologyTemplate.BARE) return MorphologyPlan.BARE;

        Affix prefix = template.hasPrefix() ? drawAffix(ctx, cfg.prefixes) : null;
        Affix suffix = template.hasSuffix() ? drawAffix(ctx, cfg.suffixes) : null;
        if (prefix != null) ctx.decision(STAGE, "prefix", prefix.id);
        if (suffix != null) ctx.decision(STAGE, "suffix", suffix.id);
        return new MorphologyPlan(template, prefix, suffix);
    }

    private static Affix drawAffix(GenerationContext ctx, List<Affix> affixes) {
        List<Weighted<Affix>> options = new ArrayList<>(affixes.size());
        for (Affix a : affixes) options.add(Weighted.of(a, a.frequency));
        return ctx.pick(options);
    }

    // ---------------------------------------------------------------------
    // Apply
    // ---------------------------------------------------------------------

    /**
     * Affixes the root held in {@code ctx.syllables()} in place.
     *
     * @param root spelling of the bare root
     */
    public Result apply(GenerationContext ctx, MorphologyPlan plan, WrittenForm root) {
        if (plan.isBare()) throw new IllegalArgumentException("bare plan has nothing to apply");
        LanguageConfig lang = ctx.lang;
        String hyphen = ctx.options.hyphen;
        List<Syllable> rootSyllables = new ArrayList<>(ctx.syllables());
        Syllable rootLast = rootSyllables.get(rootSyllables.size() - 1);

        // allomorphs
        MorphologyPlan.Realization pre = plan.prefix == null ? null
                : realize(plan.prefix, rootSyllables.get(0).first());
        MorphologyPlan.Realization suf = plan.suffix == null ? null
                : realize(plan.suffix, rootLast.last());
        plan.resolve(pre, suf);
        if (pre != null && ctx.tracing()) ctx.decision(STAGE, "prefixForm", pre.toString());
        if (suf != null && ctx.tracing()) ctx.decision(STAGE, "suffixForm", suf.toString());

        // spelling at the root/suffix joint
        String rootClean = root.clean;
        String rootHyphenated = root.hyphenated;
        if (suf != null) {
            boolean stressedEnd = rootSyllables.size() == 1 || rootLast.stress().isStressed();
            String adjusted = applyBoundaryRules(lang, rootClean, plan.suffix, stressedEnd);
            if (!adjusted.equals(rootClean)) {
                if (ctx.tracing()) ctx.decision(STAGE, "boundary", rootClean + "->" + adjusted);
                rootHyphenated = OrthographyWriter.realign(rootHyphenated, hyphen, rootClean, adjusted);
                rootClean = adjusted;
            }
        }

        // syllables
        List<String> before = ctx.snapshot();
        List<Syllable> prefixSyllables = pre == null ? List.of() : AffixSyllabifier.syllabify(AffixSyllabifier.resolve(lang, pre.phonemes));
        List<Syllable> suffixSyllables = suf == null ? List.of() : AffixSyllabifier.syllabify(AffixSyllabifier.resolve(lang, suf.phonemes));

        boolean prefixMerged = pre != null && mergesIntoRoot(pre, prefixSyllables);
        boolean suffixMerged = suf != null && mergesIntoRoot(suf, suffixSyllables);
        if (prefixMerged) {
            rootSyllables.get(0).onset().addAll(0, flatten(prefixSyllables));
            prefixSyllables = List.of();
        }
        if (suffixMerged) {
            rootLast.coda().addAll(flatten(suffixSyllables));
            suffixSyllables = List.of();
        }

        List<Syllable> word = ctx.syllables();
        word.clear();
        word.addAll(prefixSyllables);
        word.addAll(rootSyllables);
        word.addAll(suffixSyllables);
        ctx.stage(STAGE + ".splice", before);

        // stress
        before = ctx.snapshot();
        if (rootSyllables.size() == 1 && word.size() > 1 && rootSyllables.get(0).stress() != Stress.PRIMARY) {
            // a monosyllabic root carries the word stress unless an affix takes it
            rootSyllables.get(0).setStress(Stress.PRIMARY);
        }
        if (pre != null && !prefixSyllables.isEmpty()) {
            applyStressEffect(word, plan.prefix.stressEffect, 0, AffixKind.PREFIX);
        }
        if (suf != null && !suffixSyllables.isEmpty()) {
            applyStressEffect(word, plan.suffix.stressEffect, prefixSyllables.size() + rootSyllables.size(), AffixKind.SUFFIX);
        }
        int rootStart = prefixSyllables.size();
        fitPrimaryToWindow(ctx, word, rootStart, rootStart + rootSyllables.size());
        ctx.stage(STAGE + ".stress", before);

        repair.repairBoundaries(ctx);
        String pron = pronunciation.pronounce(ctx);

        // spelling of the whole word
        String prefixWritten = pre == null ? "" : pre.written;
        String suffixWritten = suf == null ? "" : suf.written;
        String clean = prefixWritten + rootClean + suffixWritten;
        String hyphenated = joinHyphenated(hyphen, prefixWritten, prefixMerged, rootHyphenated, suffixWritten, suffixMerged);

        String cleaned = OrthographyWriter.cleanup(lang, clean);
        hyphenated = OrthographyWriter.realign(hyphenated, hyphen, clean, cleaned);
        return new Result(new WrittenForm(cleaned, hyphenated), pron);
    }

    /**
     * Syllables the plan's affixes add to the root now held in {@code ctx.syllables()}, once their allomorphs are
     * resolved against it. Forms that merge into a root syllable add none.
     */
    public int addedSyllables(GenerationContext ctx, MorphologyPlan plan) {
        List<Syllable> root = ctx.syllables();
        int n = 0;
        if (plan.prefix != null) n += addedSyllables(ctx.lang, realize(plan.prefix, root.get(0).first()));
        if (plan.suffix != null) n += addedSyllables(ctx.lang, realize(plan.suffix, root.get(root.size() - 1).last()));
        return n;
    }

    private static int addedSyllables(LanguageConfig lang, MorphologyPlan.Realization r) {
        List<Syllable> syllables = AffixSyllabifier.syllabify(AffixSyllabifier.resolve(lang, r.phonemes));
        return mergesIntoRoot(r, syllables) ? 0 : syllables.size();
    }

    /**
     * Words of four or more syllables keep the primary on the penult or antepenult. When the affixes left it
     * elsewhere (a stressed prefix, an unstressed suffix on a long root), a new primary is drawn there with the
     * polysyllabic weights, preferring root syllables; the old one drops to secondary, or to none when adjacent.
     *
     * @param rootStart index of the first root syllable in {@code word}
     * @param rootEnd   index after the last root syllable
     */
    static void fitPrimaryToWindow(GenerationContext ctx, List<Syllable> word, int rootStart, int rootEnd) {
        int n = word.size();
        if (n < 4) return;
        int primary = -1;
        for (int i = 0; i < n; i++) {
            if (word.get(i).stress() == Stress.PRIMARY) {
                primary = i;
                break;
            }
        }
        if (primary == n - 2 || primary == n - 3) return;

        LanguageConfig.Stress cfg = ctx.lang.stress;
        boolean heavy = word.get(n - 2).isHeavy();
        List<Weighted<Integer>> window = List.of(
                Weighted.of(n - 2, heavy ? cfg.penultHeavy : cfg.penultLight),
                Weighted.of(n - 3, heavy ? cfg.antepenultHeavy : cfg.antepenultLight));
        List<Weighted<Integer>> inRoot = new ArrayList<>(2);
        for (Weighted<Integer> w : window) {
            if (w.item >= rootStart && w.item < rootEnd && w.weight > 0) inRoot.add(w);
        }
        int target = ctx.pick(inRoot.isEmpty() ? window : inRoot);

        if (primary >= 0) word.get(primary).setStress(Math.abs(primary - target) == 1 ? Stress.NONE : Stress.SECONDARY);
        word.get(target).setStress(Stress.PRIMARY);
        ctx.decision(STAGE, "primaryRefit", target);
    }

    /** First variant (most specific first) whose condition holds at the boundary, else the base form. */
    static MorphologyPlan.Realization realize(Affix affix, Phoneme boundary) {
        if (boundary != null) {
            for (AllomorphVariant v : affix.variants) {
                if (v.condition.side() == affix.kind && v.condition.matches(boundary)) {
                    return MorphologyPlan.Realization.of(affix, v);
                }
            }
        }
        return MorphologyPlan.Realization.base(affix);
    }

    /**
     * Spelling adjustments of the root before a suffix, in order: y to i, silent e drop, final consonant
     * doubling. Doubling needs a single vowel before the consonant and a stressed (or only) final syllable,
     * and never follows an e drop.
     */
    static String applyBoundaryRules(LanguageConfig lang, String root, Affix suffix, boolean stressedEnd) {
        String out = root;
        if (suffix.boundaryRules.contains(BoundaryRule.Y_TO_I)) {
            out = Y_AFTER_CONSONANT.matcher(out).replaceFirst("$1i");
        }
        boolean dropped = false;
        if (suffix.boundaryRules.contains(BoundaryRule.DROP_SILENT_E) && out.length() > 2) {
            Matcher m = SILENT_E.matcher(out);
            if (m.find()) {
                out = out.substring(0, m.start());
                dropped = true;
            }
        }
        if (suffix.boundaryRules.contains(BoundaryRule.DOUBLE_CONSONANT) && !dropped && stressedEnd) {
            Matcher m = SINGLE_VOWEL_CONSONANT.matcher(out.toLowerCase(Locale.ROOT));
            if (m.find()) {
                String letter = m.group(1);
                if (!lang.orthography.neverDouble.contains(letter)) {
                    String doubled = lang.orthography.doubledForms.getOrDefault(letter, letter + letter);
                    out = out.substring(0, out.length() - 1) + doubled;
                }
            }
        }
        return out;
    }

    static void applyStressEffect(List<Syllable> word, StressEffect effect, int affixStart, AffixKind kind) {
        switch (effect) {
            case NONE -> {
            }
            case PRIMARY -> {
                demotePrimary(word);
                word.get(affixStart).setStress(Stress.PRIMARY);
            }
            case SECONDARY -> {
                if (word.get(affixStart).stress() != Stress.PRIMARY) word.get(affixStart).setStress(Stress.SECONDARY);
            }
            case ATTRACT_PRECEDING -> {
                if (kind != AffixKind.SUFFIX || affixStart == 0) return;
                demotePrimary(word);
                word.get(affixStart - 1).setStress(Stress.PRIMARY);
            }
        }
    }

    private static void demotePrimary(List<Syllable> word) {
        for (Syllable s : word) {
            if (s.stress() == Stress.PRIMARY) s.setStress(Stress.SECONDARY);
        }
    }

    /** Zero-syllable forms (and vowelless ones) join the neighbouring root syllable instead of standing alone. */
    private static boolean mergesIntoRoot(MorphologyPlan.Realization r, List<Syllable> syllables) {
        if (syllables.isEmpty()) return false;
        if (r.syllableCount == 0) return true;
        for (Syllable s : syllables) {
            if (s.nucleus().isEmpty()) return true;
        }
        return false;
    }

    private static List<Phoneme> flatten(List<Syllable> syllables) {
        List<Phoneme> out = new ArrayList<>();
        for (Syllable s : syllables) out.addAll(s.phonemes());
        return out;
    }

    private static String joinHyphenated(String hyphen, String prefix, boolean prefixMerged,
                                         String root, String suffix, boolean suffixMerged) {
        StringBuilder sb = new StringBuilder();
        if (!prefix.isEmpty()) sb.append(prefix).append(prefixMerged ? "" : hyphen);
        sb.append(root);
        if (!suffix.isEmpty()) sb.append(suffixMerged ? "" : hyphen).append(suffix);
        return sb.toString();
    }

    /** Spelling and pronunciation of the affixed word. */
    public static final class Result {
        public final WrittenForm written;
        public final String pronunciation;

        Result(WrittenForm written, String pronunciation) {
            this.written = written;
            this.pronunciation = pronunciation;
        }
    }
}
