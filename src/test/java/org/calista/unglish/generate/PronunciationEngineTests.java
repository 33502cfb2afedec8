package org.calista.unglish.generate;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.random.impl.Mulberry32;
import org.calista.unglish.word.Stress;
import org.calista.unglish.word.Syllable;
import org.calista.unglish.word.Word;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PronunciationEngineTests {

    private static LanguageConfig english;
    private static WordGenerator generator;

    @BeforeAll
    static void load() {
        english = LanguageLoader.english();
        generator = new WordGenerator(english);
    }

    private static GenerationOptions roots(int syllables, long seed) {
        return GenerationOptions.builder().morphology(false).syllableCount(syllables).seed(seed).build();
    }

    @Test
    void polysyllablesCarryExactlyOnePrimary() {
        for (long seed = 0; seed < 500; seed++) {
            Word w = generator.generate(roots(2 + (int) (seed % 4), seed));
            long primaries = w.syllables.stream().filter(s -> s.stress() == Stress.PRIMARY).count();
            assertEquals(1, primaries, w.pronunciation);
            assertEquals(1, count(w.pronunciation, Stress.PRIMARY.mark()), w.pronunciation);
        }
    }

    @Test
    void monosyllablesAreUnmarked() {
        for (long seed = 0; seed < 200; seed++) {
            Word w = generator.generate(roots(1, seed));
            assertEquals(Stress.NONE, w.syllables.get(0).stress());
            assertFalse(w.pronunciation.contains(Stress.PRIMARY.mark()), w.pronunciation);
        }
    }

    @Test
    void longRootsStressPenultOrAntepenult() {
        int n = 2000;
        int hits = 0;
        for (long seed = 0; seed < n; seed++) {
            int syllables = 4 + (int) (seed % 2);
            Word w = generator.generate(roots(syllables, seed));
            int primary = w.primaryStressIndex();
            if (primary == syllables - 2 || primary == syllables - 3) hits++;
        }
        assertTrue(hits >= 0.95 * n, "penult/antepenult share " + hits + "/" + n);
    }

    @Test
    void longAffixedWordsStressPenultOrAntepenult() {
        int n = 2000;
        int hits = 0;
        int affixed = 0;
        for (long seed = 0; seed < n; seed++) {
            int syllables = 4 + (int) (seed % 2);
            Word w = generator.generate(GenerationOptions.builder().syllableCount(syllables).seed(seed).trace(true).build());
            int primary = w.primaryStressIndex();
            boolean inWindow = primary == syllables - 2 || primary == syllables - 3;
            if (inWindow) hits++;
            if (w.trace.summary.morphologyApplied) {
                affixed++;
                assertTrue(inWindow, w.pronunciation + " " + w.written.hyphenated);
            }
        }
        assertTrue(affixed > n / 10, "only " + affixed + " affixed words");
        assertTrue(hits >= 0.95 * n, "penult/antepenult share " + hits + "/" + n);
    }

    @Test
    void aspirationRunsBeforeStress() {
        Word w = generator.generate(roots(3, 11).toBuilder().trace(true).build());
        List<String> names = new ArrayList<>();
        w.trace.stages.forEach(s -> names.add(s.name));
        int aspiration = names.indexOf(PronunciationEngine.ASPIRATION);
        int stress = names.indexOf(PronunciationEngine.STRESS);
        int reduction = names.indexOf(PronunciationEngine.REDUCTION);
        assertTrue(aspiration >= 0 && aspiration < stress, names.toString());
        assertTrue(stress < reduction, names.toString());
    }

    @Test
    void primaryStressedVowelIsNeverReduced() {
        for (long seed = 0; seed < 1000; seed++) {
            Word w = generator.generate(roots(3, seed));
            Syllable primary = w.syllables.get(w.primaryStressIndex());
            for (Phoneme v : primary.nucleus()) {
                assertFalse(v.reduced(), w.pronunciation);
                assertFalse(english.stress.stressedNucleusBan.contains(v.sound()), w.pronunciation);
            }
        }
    }

    @Test
    void tenseVowelsAreNeverReduced() {
        for (long seed = 0; seed < 1000; seed++) {
            for (Syllable s : generator.generate(roots(3, seed)).syllables) {
                for (Phoneme v : s.nucleus()) {
                    if (v.reduced()) assertFalse(english.phoneme(v.reducedFrom()).tense(), v.reducedFrom());
                }
            }
        }
    }

    @Test
    void reductionCanBeSwitchedOff() {
        GenerationOptions off = GenerationOptions.builder().morphology(false).syllableCount(4).vowelReduction(Boolean.FALSE).build();
        for (long seed = 0; seed < 300; seed++) {
            for (Syllable s : generator.generate(off.withSeed(seed)).syllables) {
                for (Phoneme v : s.nucleus()) assertFalse(v.reduced());
            }
        }
    }

    @Test
    void pronounceKeepsAnExistingPrimary() {
        GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(5), null);
        ctx.syllables().add(Syllables.of(english, "b", "æ", ""));
        ctx.syllables().add(Syllables.of(english, "d", "ɪ", ""));
        ctx.syllables().add(Syllables.of(english, "m", "u", "n"));
        ctx.syllables().get(2).setStress(Stress.PRIMARY);

        new PronunciationEngine().pronounce(ctx);
        assertEquals(Stress.PRIMARY, ctx.syllables().get(2).stress());
        assertNotEquals(Stress.PRIMARY, ctx.syllables().get(0).stress());
        assertNotEquals(Stress.PRIMARY, ctx.syllables().get(1).stress());
    }

    @Test
    void renderMarksBoundaries() {
        Syllable a = Syllables.of(english, "b", "æ", "");
        Syllable b = Syllables.of(english, "n", "ə", "");
        Syllable c = Syllables.of(english, "t", "ɑ", "");
        a.setStress(Stress.PRIMARY);
        assertEquals(Stress.PRIMARY.mark() + "bæ.nə.tɑ", PronunciationEngine.render(List.of(a, b, c)));
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + needle.length())) n++;
        return n;
    }
}
