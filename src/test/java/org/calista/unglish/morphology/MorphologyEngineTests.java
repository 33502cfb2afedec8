package org.calista.unglish.morphology;

import org.calista.unglish.generate.GenerationContext;
import org.calista.unglish.generate.GenerationOptions;
import org.calista.unglish.generate.OrthographyWriter;
import org.calista.unglish.generate.PhonotacticRepair;
import org.calista.unglish.generate.PronunciationEngine;
import org.calista.unglish.generate.SyllableBuilder;
import org.calista.unglish.language.Affix;
import org.calista.unglish.language.AffixKind;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.language.MorphologyTemplate;
import org.calista.unglish.language.StressEffect;
import org.calista.unglish.random.impl.Mulberry32;
import org.calista.unglish.word.Stress;
import org.calista.unglish.word.Syllable;
import org.calista.unglish.word.WrittenForm;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MorphologyEngineTests {

    private static LanguageConfig english;

    @BeforeAll
    static void load() {
        english = LanguageLoader.english();
    }

    private static Affix suffix(String id) {
        for (Affix a : english.morphology.suffixes) {
            if (a.id.equals(id)) return a;
        }
        throw new AssertionError("no suffix " + id);
    }

    private static Affix prefix(String id) {
        for (Affix a : english.morphology.prefixes) {
            if (a.id.equals(id)) return a;
        }
        throw new AssertionError("no prefix " + id);
    }

    // ---------------------------------------------------------------------
    // Allomorphs
    // ---------------------------------------------------------------------

    @ParameterizedTest
    @CsvSource({
            "s, p, s, s",
            "s, g, z, s",
            "s, æ, z, s",
            "s, s, ɪz, es",
            "s, tʃ, ɪz, es",
            "ed, k, t, ed",
            "ed, b, d, ed",
            "ed, t, ɪd, ed",
            "ed, d, ɪd, ed"
    })
    void suffixAllomorphFollowsTheRootEnd(String id, String boundary, String sounds, String written) {
        MorphologyPlan.Realization r = MorphologyEngine.realize(suffix(id), english.phoneme(boundary));
        assertEquals(sounds, String.join("", r.phonemes));
        assertEquals(written, r.written);
    }

    @Test
    void prefixAllomorphLooksAtTheRootStart() {
        assertEquals("im", MorphologyEngine.realize(prefix("in"), english.phoneme("p")).written);
        assertEquals("in", MorphologyEngine.realize(prefix("in"), english.phoneme("t")).written);
        assertNull(MorphologyEngine.realize(prefix("in"), english.phoneme("t")).variant);
    }

    @Test
    void aspiratedBoundaryStillSelectsByPlaceAndVoicing() {
        MorphologyPlan.Realization r = MorphologyEngine.realize(suffix("ed"), english.phoneme("t").withAspiration());
        assertEquals(1, r.syllableCount);
    }

    // ---------------------------------------------------------------------
    // Spelling at the joint
    // ---------------------------------------------------------------------

    @ParameterizedTest
    @CsvSource({
            "happy, ness, false, happi",
            "play, ness, false, play",
            "bake, ing, true, bak",
            "be, ing, true, be",
            "stop, ing, true, stopp",
            "stop, ing, false, stop",
            "bak, ing, true, back",
            "fix, ing, true, fix",
            "seat, ing, true, seat",
            "bake, ment, true, bake"
    })
    void boundaryRules(String root, String id, boolean stressedEnd, String expected) {
        assertEquals(expected, MorphologyEngine.applyBoundaryRules(english, root, suffix(id), stressedEnd));
    }

    // ---------------------------------------------------------------------
    // Stress effects
    // ---------------------------------------------------------------------

    private static List<Syllable> word(int n, int primary) {
        List<Syllable> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Syllable s = new Syllable();
            s.nucleus().add(english.phoneme("ə"));
            if (i == primary) s.setStress(Stress.PRIMARY);
            out.add(s);
        }
        return out;
    }

    @Test
    void primaryEffectMovesTheStress() {
        List<Syllable> w = word(3, 1);
        MorphologyEngine.applyStressEffect(w, StressEffect.PRIMARY, 0, AffixKind.PREFIX);
        assertEquals(Stress.PRIMARY, w.get(0).stress());
        assertEquals(Stress.SECONDARY, w.get(1).stress());
    }

    @Test
    void secondaryEffectNeverOverridesPrimary() {
        List<Syllable> w = word(3, 0);
        MorphologyEngine.applyStressEffect(w, StressEffect.SECONDARY, 0, AffixKind.PREFIX);
        assertEquals(Stress.PRIMARY, w.get(0).stress());

        List<Syllable> v = word(3, 2);
        MorphologyEngine.applyStressEffect(v, StressEffect.SECONDARY, 0, AffixKind.PREFIX);
        assertEquals(Stress.SECONDARY, v.get(0).stress());
    }

    @Test
    void attractingSuffixStressesThePrecedingSyllable() {
        List<Syllable> w = word(4, 0);
        MorphologyEngine.applyStressEffect(w, StressEffect.ATTRACT_PRECEDING, 3, AffixKind.SUFFIX);
        assertEquals(Stress.PRIMARY, w.get(2).stress());
        assertEquals(Stress.SECONDARY, w.get(0).stress());
        assertEquals(1, w.stream().filter(s -> s.stress() == Stress.PRIMARY).count());
    }

    @Test
    void stressedPrefixGivesUpThePrimaryOnLongWords() {
        GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(7), null);
        List<Syllable> w = word(5, 0);
        MorphologyEngine.fitPrimaryToWindow(ctx, w, 2, 5);

        int primary = indexOfPrimary(w);
        assertTrue(primary == 2 || primary == 3, "primary at " + primary);
        assertEquals(Stress.SECONDARY, w.get(0).stress());
        assertEquals(1, w.stream().filter(s -> s.stress() == Stress.PRIMARY).count());
    }

    @Test
    void windowPrefersRootSyllables() {
        // a two-syllable suffix occupies the penult, so only the antepenult is root
        for (long seed = 0; seed < 50; seed++) {
            GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(seed), null);
            List<Syllable> w = word(4, 3);
            MorphologyEngine.fitPrimaryToWindow(ctx, w, 0, 2);
            assertEquals(1, indexOfPrimary(w));
            assertEquals(Stress.SECONDARY, w.get(3).stress());
        }
    }

    @Test
    void primaryInsideTheWindowOrShortWordIsLeftAlone() {
        GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(1), null);
        List<Syllable> inWindow = word(5, 2);
        MorphologyEngine.fitPrimaryToWindow(ctx, inWindow, 0, 5);
        assertEquals(2, indexOfPrimary(inWindow));

        List<Syllable> shortWord = word(3, 0);
        MorphologyEngine.fitPrimaryToWindow(ctx, shortWord, 1, 3);
        assertEquals(0, indexOfPrimary(shortWord));
    }

    private static int indexOfPrimary(List<Syllable> w) {
        for (int i = 0; i < w.size(); i++) {
            if (w.get(i).stress() == Stress.PRIMARY) return i;
        }
        return -1;
    }

    // ---------------------------------------------------------------------
    // Plan sizing
    // ---------------------------------------------------------------------

    @Test
    void planShrinksToFitABudget() {
        MorphologyPlan both = new MorphologyPlan(MorphologyTemplate.BOTH, prefix("un"), suffix("ness"));
        assertSame(both, both.within(2));

        MorphologyPlan one = both.within(1);
        assertEquals(MorphologyTemplate.SUFFIXED, one.template);
        assertNull(one.prefix);
        assertEquals("ness", one.suffix.id);

        assertSame(MorphologyPlan.BARE, both.within(0));

        MorphologyPlan plural = new MorphologyPlan(MorphologyTemplate.BOTH, prefix("re"), suffix("s"));
        MorphologyPlan fitted = plural.within(0);
        assertEquals(MorphologyTemplate.SUFFIXED, fitted.template);
        assertEquals("s", fitted.suffix.id);
    }

    @Test
    void addedSyllablesFollowTheResolvedAllomorph() {
        MorphologyEngine engine = new MorphologyEngine(new PhonotacticRepair(), new PronunciationEngine());
        MorphologyPlan past = new MorphologyPlan(MorphologyTemplate.SUFFIXED, null, suffix("ed"));

        GenerationContext afterK = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(1), null);
        afterK.syllables().add(root("k", "æ", "k"));
        assertEquals(0, engine.addedSyllables(afterK, past));

        GenerationContext afterT = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(1), null);
        afterT.syllables().add(root("k", "æ", "t"));
        assertEquals(1, engine.addedSyllables(afterT, past));

        MorphologyPlan both = new MorphologyPlan(MorphologyTemplate.BOTH, prefix("un"), suffix("ed"));
        assertEquals(2, engine.addedSyllables(afterT, both));
    }

    private static Syllable root(String onset, String nucleus, String coda) {
        return new Syllable(
                AffixSyllabifier.resolve(english, List.of(onset)),
                AffixSyllabifier.resolve(english, List.of(nucleus)),
                AffixSyllabifier.resolve(english, List.of(coda)));
    }

    // ---------------------------------------------------------------------
    // End to end on a hand-picked plan
    // ---------------------------------------------------------------------

    @Test
    void applySplicesAffixesAroundTheRoot() {
        PhonotacticRepair repair = new PhonotacticRepair();
        PronunciationEngine pronunciation = new PronunciationEngine();
        MorphologyEngine engine = new MorphologyEngine(repair, pronunciation);

        for (long seed = 0; seed < 200; seed++) {
            GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(seed), null);
            new SyllableBuilder().build(ctx, 2, false);
            repair.repair(ctx);
            pronunciation.pronounce(ctx);
            WrittenForm root = new OrthographyWriter().write(ctx);

            MorphologyPlan plan = new MorphologyPlan(MorphologyTemplate.BOTH, prefix("un"), suffix("ness"));
            MorphologyEngine.Result r = engine.apply(ctx, plan, root);

            assertEquals(4, ctx.syllables().size());
            assertTrue(r.written.clean.startsWith("un"), r.written.clean);
            assertTrue(r.written.clean.endsWith("ness"), r.written.clean);
            assertTrue(r.written.hyphenated.startsWith("un-"), r.written.hyphenated);
            assertTrue(r.written.hyphenated.endsWith("-ness"), r.written.hyphenated);
            assertEquals(1, ctx.syllables().stream().filter(s -> s.stress() == Stress.PRIMARY).count(), r.pronunciation);
        }
    }

    @Test
    void zeroSyllableSuffixJoinsTheLastCoda() {
        PhonotacticRepair repair = new PhonotacticRepair();
        PronunciationEngine pronunciation = new PronunciationEngine();
        MorphologyEngine engine = new MorphologyEngine(repair, pronunciation);

        GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(3), null);
        ctx.syllables().add(new Syllable(
                AffixSyllabifier.resolve(english, List.of("k")),
                AffixSyllabifier.resolve(english, List.of("æ")),
                AffixSyllabifier.resolve(english, List.of("p"))));
        WrittenForm root = new WrittenForm("cap", "cap");

        MorphologyEngine.Result r = engine.apply(ctx, new MorphologyPlan(MorphologyTemplate.SUFFIXED, null, suffix("s")), root);
        assertEquals(1, ctx.syllables().size());
        assertEquals("caps", r.written.clean);
        assertEquals("caps", r.written.hyphenated);
        assertTrue(r.pronunciation.endsWith("ps"), r.pronunciation);
    }

    @Test
    void planIsBareWhenMorphologyIsOff() {
        MorphologyEngine engine = new MorphologyEngine(new PhonotacticRepair(), new PronunciationEngine());
        GenerationOptions off = GenerationOptions.builder().morphology(false).build();
        for (long seed = 0; seed < 50; seed++) {
            GenerationContext ctx = new GenerationContext(english, off, Mulberry32.of(seed), null);
            assertSame(MorphologyPlan.BARE, engine.plan(ctx));
        }
    }

    @Test
    void applyRejectsABarePlan() {
        MorphologyEngine engine = new MorphologyEngine(new PhonotacticRepair(), new PronunciationEngine());
        GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(1), null);
        assertThrows(IllegalArgumentException.class, () -> engine.apply(ctx, MorphologyPlan.BARE, new WrittenForm("a", "a")));
    }
}
