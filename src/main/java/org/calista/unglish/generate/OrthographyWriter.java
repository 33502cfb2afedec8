package org.calista.unglish.generate;

import org.calista.unglish.language.ConfigurationException;
import org.calista.unglish.language.Grapheme;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.language.Position;
import org.calista.unglish.language.SpellingRule;
import org.calista.unglish.language.WordPosition;
import org.calista.unglish.random.Weighted;
import org.calista.unglish.random.WeightedChoice;
import org.calista.unglish.trace.GraphemeDecision;
import org.calista.unglish.word.Syllable;
import org.calista.unglish.word.WrittenForm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Phoneme-to-grapheme spelling of a syllable list.
 *
 * <p>Per phoneme: position candidates, contextual condition filter, word-position/cluster filter, then a
 * frequency-weighted draw. Cluster members take the most frequent survivor without a draw. Per syllable the
 * castling rule moves a magic e past trailing consonants. Per word the probabilistic spelling rules run once,
 * then the deterministic cleanups run to a fixed point.</p>
 *
 * <p>The hyphenated form is kept aligned with the clean form through every word-level rewrite.</p>
 */
public final class OrthographyWriter {

    static final String STAGE = "write";

    private static final int MAX_CLEANUP_ROUNDS = 16;

    public WrittenForm write(GenerationContext ctx) {
        return write(ctx, ctx.syllables());
    }

    public WrittenForm write(GenerationContext ctx, List<Syllable> syllables) {
        LanguageConfig lang = ctx.lang;
        List<Slot> slots = flatten(syllables);
        List<StringBuilder> parts = new ArrayList<>(syllables.size());
        for (int i = 0; i < syllables.size(); i++) parts.add(new StringBuilder());

        int doubled = 0;
        for (int k = 0; k < slots.size(); k++) {
            Slot slot = slots.get(k);
            Slot prev = k > 0 ? slots.get(k - 1) : null;
            Slot next = k + 1 < slots.size() ? slots.get(k + 1) : null;
            WordPosition wp = k == 0 ? WordPosition.INITIAL : (next == null ? WordPosition.FINAL : WordPosition.MEDIAL);

            Pick pick = select(ctx, slot, wp, prev, next);
            String form = pick.form;

            String doubledForm = null;
            if (doubled < lang.orthography.doublingMaxPerWord && mayDouble(lang, slot, prev, next, form)) {
                boolean stressed = syllables.size() == 1 || syllables.get(prev.syllableIndex).stress().isStressed();
                double p = lang.orthography.doublingProbability * (stressed ? 1.0 : lang.orthography.doublingUnstressedModifier);
                if (p > 0 && ctx.chance(Math.min(100.0, p))) {
                    doubledForm = lang.orthography.doubledForms.getOrDefault(form, form + form);
                    doubled++;
                }
            }
            if (ctx.tracing()) record(ctx, slot, pick, doubledForm);

            StringBuilder part = parts.get(slot.syllableIndex);
            if (doubledForm != null && slot.position == Position.ONSET && slot.index == 0 && slot.syllableIndex > 0) {
                // cat-ter: the extra letter closes the previous syllable
                parts.get(slot.syllableIndex - 1).append(form);
                part.append(form);
            } else {
                String out = doubledForm != null ? doubledForm : form;
                char last = lastChar(parts, slot.syllableIndex);
                if (last != 0 && !out.isEmpty() && out.charAt(0) == last) out = out.substring(1);
                part.append(out);
            }

            if (next == null || next.syllableIndex != slot.syllableIndex) {
                String castled = applySyllableRules(ctx, part.toString());
                part.setLength(0);
                part.append(castled);
            }
        }

        List<String> pieces = new ArrayList<>(parts.size());
        for (StringBuilder sb : parts) pieces.add(sb.toString());
        String hyphen = ctx.options.hyphen;
        String clean = String.join("", pieces);
        String hyphenated = String.join(hyphen, pieces);

        // probabilistic word rules, each at most once
        for (SpellingRule rule : lang.orthography.spellingRules) {
            if (rule.scope != SpellingRule.Scope.WORD) continue;
            if (!rule.pattern.matcher(clean).find()) continue;
            if (!rule.isDeterministic() && !ctx.chance(rule.probability)) continue;
            String next = rule.apply(clean);
            hyphenated = realign(hyphenated, hyphen, clean, next);
            if (ctx.tracing() && !next.equals(clean)) ctx.decision(STAGE, "rule", rule.name);
            clean = next;
        }

        // deterministic cleanups to a fixed point
        for (int round = 0; round < MAX_CLEANUP_ROUNDS; round++) {
            boolean changed = false;
            for (SpellingRule rule : lang.orthography.cleanups) {
                String next = rule.apply(clean);
                if (next.equals(clean)) continue;
                hyphenated = realign(hyphenated, hyphen, clean, next);
                clean = next;
                changed = true;
            }
            if (!changed) break;
        }
        return new WrittenForm(clean, hyphenated);
    }

    /** Deterministic cleanups applied to a fixed point. Idempotent. */
    public static String cleanup(LanguageConfig lang, String word) {
        String out = word;
        for (int round = 0; round < MAX_CLEANUP_ROUNDS; round++) {
            String before = out;
            for (SpellingRule rule : lang.orthography.cleanups) out = rule.apply(out);
            if (out.equals(before)) break;
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Grapheme selection
    // ---------------------------------------------------------------------

    private Pick select(GenerationContext ctx, Slot slot, WordPosition wp, Slot prev, Slot next) {
        Phoneme p = slot.phoneme;
        List<Grapheme> candidates = ctx.lang.graphemes(slot.position, p.sound());
        if (candidates.isEmpty()) {
            if (p.isPlaceholder()) return new Pick(p.sound(), List.of(), List.of(), List.of(), List.of(), -1);
            throw new ConfigurationException("no grapheme for /" + p.sound() + "/ in " + slot.position);
        }

        String left = prev == null ? null : prev.phoneme.sound();
        String right = next == null ? null : next.phoneme.sound();
        List<Grapheme> afterCondition = new ArrayList<>(candidates.size());
        for (Grapheme g : candidates) {
            if (g.condition.matches(wp, left, right)) afterCondition.add(g);
        }
        List<Grapheme> afterPosition = new ArrayList<>(afterCondition.size());
        for (Grapheme g : afterCondition) {
            if (g.allowedAt(wp) && (!slot.cluster || g.allowedInCluster())) afterPosition.add(g);
        }

        List<Grapheme> pool = !afterPosition.isEmpty() ? afterPosition : (!afterCondition.isEmpty() ? afterCondition : candidates);

        if (slot.cluster) {
            Grapheme best = pool.get(0);
            for (Grapheme g : pool) {
                if (g.frequency > best.frequency) best = g;
            }
            return new Pick(best.form, candidates, afterCondition, afterPosition, pool, -1);
        }
        List<Weighted<Grapheme>> weights = new ArrayList<>(pool.size());
        for (Grapheme g : pool) weights.add(Weighted.of(g, g.frequency));
        WeightedChoice.Draw<Grapheme> draw = WeightedChoice.draw(weights, ctx.rng());
        return new Pick(draw.item.form, candidates, afterCondition, afterPosition, pool, draw.roll);
    }

    private static void record(GenerationContext ctx, Slot slot, Pick pick, String doubledForm) {
        List<Double> weights = new ArrayList<>(pick.pool.size());
        for (Grapheme g : pick.pool) weights.add(g.frequency);
        ctx.trace().grapheme(new GraphemeDecision(slot.phoneme.sound(), slot.position.name().toLowerCase(Locale.ROOT),
                slot.syllableIndex, forms(pick.candidates), forms(pick.afterCondition), forms(pick.afterPosition),
                weights, pick.roll, doubledForm != null ? doubledForm : pick.form, slot.cluster, doubledForm != null));
    }

    private static boolean mayDouble(LanguageConfig lang, Slot slot, Slot prev, Slot next, String form) {
        LanguageConfig.Orthography o = lang.orthography;
        if (!o.doublingEnabled || slot.cluster || slot.position == Position.NUCLEUS) return false;
        if (prev == null || prev.position != Position.NUCLEUS) return false;
        Phoneme vowel = prev.phoneme;
        if (!vowel.isVowel() || vowel.tense() || vowel.reduced()) return false;
        if (form.length() != 1) return false;
        if (o.neverDouble.contains(slot.phoneme.sound()) || o.neverDouble.contains(form)) return false;
        if (next == null) return o.finalDoublingOnly.contains(form);
        return next.phoneme.isVowel();
    }

    // ---------------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------------

    private static String applySyllableRules(GenerationContext ctx, String syllable) {
        LanguageConfig.Orthography o = ctx.lang.orthography;
        String out = syllable;
        if (o.castling != null) out = o.castling.apply(out);
        for (SpellingRule rule : o.spellingRules) {
            if (rule.scope != SpellingRule.Scope.SYLLABLE) continue;
            if (!rule.pattern.matcher(out).find()) continue;
            if (!rule.isDeterministic() && !ctx.chance(rule.probability)) continue;
            out = rule.apply(out);
        }
        return out;
    }

    /**
     * Carries a rewrite of the clean form over to the hyphenated form: the common head and tail keep their
     * hyphens, the rewritten middle is taken from the new clean form.
     */
    public static String realign(String hyphenated, String hyphen, String oldClean, String newClean) {
        if (oldClean.equals(newClean)) return hyphenated;
        if (hyphen.isEmpty()) return newClean;

        int max = Math.min(oldClean.length(), newClean.length());
        int p = 0;
        while (p < max && oldClean.charAt(p) == newClean.charAt(p)) p++;
        int q = 0;
        while (q < max - p && oldClean.charAt(oldClean.length() - 1 - q) == newClean.charAt(newClean.length() - 1 - q)) q++;

        int start = letterStart(hyphenated, hyphen, p);
        int end = letterEnd(hyphenated, hyphen, oldClean.length() - q);
        if (start > end) start = end;
        return hyphenated.substring(0, start) + newClean.substring(p, newClean.length() - q) + hyphenated.substring(end);
    }

    /** Index in {@code hyphenated} of letter {@code n}, after any separators in front of it. */
    private static int letterStart(String hyphenated, String hyphen, int n) {
        int letters = 0;
        int i = 0;
        while (i < hyphenated.length()) {
            if (hyphenated.startsWith(hyphen, i)) {
                i += hyphen.length();
                continue;
            }
            if (letters == n) return i;
            letters++;
            i++;
        }
        return hyphenated.length();
    }

    /** Index in {@code hyphenated} right after letter {@code n - 1}, before any separator. */
    private static int letterEnd(String hyphenated, String hyphen, int n) {
        if (n == 0) return 0;
        int letters = 0;
        int i = 0;
        while (i < hyphenated.length()) {
            if (hyphenated.startsWith(hyphen, i)) {
                i += hyphen.length();
                continue;
            }
            letters++;
            i++;
            if (letters == n) return i;
        }
        return hyphenated.length();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private static final class Pick {
        final String form;
        final List<Grapheme> candidates;
        final List<Grapheme> afterCondition;
        final List<Grapheme> afterPosition;
        final List<Grapheme> pool;
        final double roll;

        Pick(String form, List<Grapheme> candidates, List<Grapheme> afterCondition, List<Grapheme> afterPosition,
             List<Grapheme> pool, double roll) {
            this.form = form;
            this.candidates = candidates;
            this.afterCondition = afterCondition;
            this.afterPosition = afterPosition;
            this.pool = pool;
            this.roll = roll;
        }
    }

    private static final class Slot {
        final Phoneme phoneme;
        final int syllableIndex;
        final Position position;
        final int index;
        final boolean cluster;

        Slot(Phoneme phoneme, int syllableIndex, Position position, int index, int segmentSize) {
            this.phoneme = phoneme;
            this.syllableIndex = syllableIndex;
            this.position = position;
            this.index = index;
            this.cluster = segmentSize > 1 && position != Position.NUCLEUS;
        }
    }

    private static List<Slot> flatten(List<Syllable> syllables) {
        List<Slot> out = new ArrayList<>();
        for (int i = 0; i < syllables.size(); i++) {
            Syllable s = syllables.get(i);
            add(out, s.onset(), i, Position.ONSET);
            add(out, s.nucleus(), i, Position.NUCLEUS);
            add(out, s.coda(), i, Position.CODA);
        }
        return out;
    }

    private static void add(List<Slot> out, List<Phoneme> segment, int syllableIndex, Position position) {
        for (int j = 0; j < segment.size(); j++) {
            out.add(new Slot(segment.get(j), syllableIndex, position, j, segment.size()));
        }
    }

    private static char lastChar(List<StringBuilder> parts, int syllableIndex) {
        for (int i = syllableIndex; i >= 0; i--) {
            StringBuilder sb = parts.get(i);
            if (sb.length() > 0) return sb.charAt(sb.length() - 1);
            if (i < syllableIndex) return 0;
        }
        return 0;
    }

    private static List<String> forms(List<Grapheme> graphemes) {
        List<String> out = new ArrayList<>(graphemes.size());
        for (Grapheme g : graphemes) out.add(g.form);
        return out;
    }
}
