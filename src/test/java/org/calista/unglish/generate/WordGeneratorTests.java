package org.calista.unglish.generate;

import org.calista.unglish.language.GenerationMode;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.random.impl.Mulberry32;
import org.calista.unglish.trace.TraceRecorder;
import org.calista.unglish.trace.WordTrace;
import org.calista.unglish.word.Stress;
import org.calista.unglish.word.Syllable;
import org.calista.unglish.word.Word;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WordGeneratorTests {

    private static LanguageConfig english;
    private static WordGenerator generator;

    @BeforeAll
    static void load() {
        english = LanguageLoader.english();
        generator = new WordGenerator(english);
    }

    @Test
    void sameSeedSameWord() {
        GenerationOptions o = GenerationOptions.builder().seed(42L).mode(GenerationMode.LEXICON).build();
        Word first = generator.generate(o);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, generator.generate(o));
        }
    }

    @Test
    void separateGeneratorsAgreeOnASeed() {
        WordGenerator other = new WordGenerator(LanguageLoader.english());
        for (long seed = 0; seed < 100; seed++) {
            GenerationOptions o = GenerationOptions.builder().seed(seed).build();
            assertEquals(generator.generate(o), other.generate(o));
        }
    }

    @Test
    void differentSeedsGiveVariety() {
        Set<String> seen = new HashSet<>();
        for (long seed = 0; seed < 200; seed++) {
            seen.add(generator.generate(GenerationOptions.builder().seed(seed).build()).written.clean);
        }
        assertTrue(seen.size() > 150, "only " + seen.size() + " distinct words");
    }

    @Test
    void traceDoesNotChangeTheWord() {
        for (long seed = 0; seed < 100; seed++) {
            GenerationOptions plain = GenerationOptions.builder().seed(seed).build();
            GenerationOptions traced = plain.toBuilder().trace(true).build();
            Word a = generator.generate(plain);
            Word b = generator.generate(traced);
            assertEquals(a, b);
            assertNull(a.trace);
            assertNotNull(b.trace);
        }
    }

    @Test
    void everyWordIsLegal() {
        for (GenerationMode mode : GenerationMode.values()) {
            for (long seed = 0; seed < 1500; seed++) {
                Word w = generator.generate(GenerationOptions.builder().seed(seed).mode(mode).build());
                assertLegal(w);
            }
        }
    }

    @Test
    void unseededGenerationWorks() {
        for (int i = 0; i < 50; i++) {
            assertLegal(generator.generate());
        }
    }

    @Test
    void requestedSyllableCountIsHonouredWithoutMorphology() {
        for (int n = 1; n <= 6; n++) {
            Word w = generator.generate(GenerationOptions.builder().seed(n).syllableCount(n).morphology(false).build());
            assertEquals(n, w.syllableCount());
        }
    }

    @Test
    void requestedSyllableCountIsHonouredWithAffixes() {
        int affixed = 0;
        for (int n = 1; n <= 6; n++) {
            for (long seed = 0; seed < 300; seed++) {
                Word w = generator.generate(GenerationOptions.builder().seed(seed).syllableCount(n).trace(true).build());
                assertEquals(n, w.syllableCount(), w.written.hyphenated + " /" + w.pronunciation + "/");
                assertLegal(w);
                if (w.trace.summary.morphologyApplied) affixed++;
            }
        }
        assertTrue(affixed > 300, "only " + affixed + " affixed words");
    }

    @Test
    void textModeRunsShorterThanLexicon() {
        double text = 0;
        double lexicon = 0;
        int n = 1000;
        for (long seed = 0; seed < n; seed++) {
            text += generator.generate(GenerationOptions.builder().seed(seed).mode(GenerationMode.TEXT).build()).syllableCount();
            lexicon += generator.generate(GenerationOptions.builder().seed(seed).mode(GenerationMode.LEXICON).build()).syllableCount();
        }
        assertTrue(text / n < lexicon / n, "text " + text / n + " vs lexicon " + lexicon / n);
    }

    @Test
    void tracedWordSummarisesItsDecisions() {
        boolean sawMorphology = false;
        for (long seed = 0; seed < 200; seed++) {
            Word w = generator.generate(GenerationOptions.builder().seed(seed).trace(true).build());
            WordTrace t = w.trace;
            assertNotNull(t.stage(SyllableBuilder.STAGE));
            assertNotNull(t.stage(PhonotacticRepair.CLUSTERS));
            assertFalse(t.graphemeSelections.isEmpty());
            assertEquals(t.graphemeSelections.size() + t.decisions.size(), t.summary.totalDecisions);
            boolean affixed = t.decisions.stream().anyMatch(d -> d.what.equals("rootSyllableCount"));
            assertEquals(affixed, t.summary.morphologyApplied);
            sawMorphology |= affixed;
        }
        assertTrue(sawMorphology);
    }

    @Test
    void builderDecisionsAreTracedPerSyllable() {
        GenerationOptions plain = GenerationOptions.builder().seed(9L).syllableCount(3).morphology(false).build();
        Word traced = generator.generate(plain.toBuilder().trace(true).build());
        assertTrue(traced.trace.decisions.stream().anyMatch(d -> d.what.equals("onsetLength[0]")));
        assertTrue(traced.trace.decisions.stream().anyMatch(d -> d.what.equals("codaLength[2]")));
        assertEquals(generator.generate(plain), traced);
    }

    private static void assertLegal(Word w) {
        List<Syllable> syllables = w.syllables;
        assertFalse(syllables.isEmpty());
        assertFalse(w.written.clean.isEmpty(), w.toString());
        assertEquals(w.written.clean, w.written.hyphenated.replace(GenerationOptions.DEFAULT_HYPHEN, ""), w.toString());

        long primaries = syllables.stream().filter(s -> s.stress() == Stress.PRIMARY).count();
        if (syllables.size() > 1) assertEquals(1, primaries, w.pronunciation);

        for (Syllable s : syllables) {
            assertFalse(s.nucleus().isEmpty(), w.toString());
            assertTrue(s.onset().size() <= english.structure.maxOnset, w.toString());
            List<Phoneme> coda = s.coda();
            if (!coda.isEmpty()) {
                assertTrue(coda.size() <= english.structure.effectiveMaxCoda(coda.get(coda.size() - 1).sound()), w.toString());
            }
        }
        for (int i = 0; i + 1 < syllables.size(); i++) {
            List<Phoneme> coda = syllables.get(i).coda();
            List<Phoneme> onset = syllables.get(i + 1).onset();
            if (coda.isEmpty() || onset.isEmpty()) continue;
            assertFalse(english.clusters.isBannedBoundary(coda.get(coda.size() - 1).sound(), onset.get(0).sound()), w.toString());
        }
        List<Phoneme> finalCoda = syllables.get(syllables.size() - 1).coda();
        if (!finalCoda.isEmpty()) {
            assertTrue(english.clusters.allowedFinal.contains(finalCoda.get(finalCoda.size() - 1).sound()), w.toString());
        }

        // a finished word is a fixed point of repair
        GenerationContext again = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(1), null);
        for (Syllable s : syllables) again.syllables().add(s.copy());
        List<String> before = TraceRecorder.snapshot(again.syllables());
        new PhonotacticRepair().repair(again);
        assertEquals(before, TraceRecorder.snapshot(again.syllables()), w.toString());
    }
}
