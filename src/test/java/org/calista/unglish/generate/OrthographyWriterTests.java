package org.calista.unglish.generate;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.random.impl.Mulberry32;
import org.calista.unglish.trace.GraphemeDecision;
import org.calista.unglish.trace.TraceRecorder;
import org.calista.unglish.word.Stress;
import org.calista.unglish.word.Word;
import org.calista.unglish.word.WrittenForm;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrthographyWriterTests {

    private static LanguageConfig english;

    @BeforeAll
    static void load() {
        english = LanguageLoader.english();
    }

    @ParameterizedTest
    @CsvSource({
            "abbbc, abbc",
            "cwick, quick",
            "cxo, xo",
            "bangk, bank",
            "dickt, dict",
            "biy, by",
            "bangx, banks",
            "taeb, tab"
    })
    void cleanupsCollapseKnownSequences(String in, String out) {
        assertEquals(out, OrthographyWriter.cleanup(english, in));
    }

    @Test
    void cleanupIsIdempotent() {
        String[] samples = {"strengkx", "ciwwwy", "qaeiyuw", "bangckt", "xxxx", "cyto", "hello"};
        for (String s : samples) {
            String once = OrthographyWriter.cleanup(english, s);
            assertEquals(once, OrthographyWriter.cleanup(english, once), s);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "bi-yo, biyo, byo, b-yo",
            "bok-s, boks, box, box",
            "cat-ter, catter, cater, cat-er",
            "ba-nav, banav, banave, ba-nave"
    })
    void realignKeepsHyphensOutsideTheRewrite(String hyphenated, String oldClean, String newClean, String expected) {
        assertEquals(expected, OrthographyWriter.realign(hyphenated, "-", oldClean, newClean));
    }

    @Test
    void realignWithEmptyHyphenIsTheCleanForm() {
        assertEquals("box", OrthographyWriter.realign("boks", "", "boks", "box"));
    }

    @Test
    void hyphenatedFormMatchesCleanForm() {
        WordGenerator generator = new WordGenerator(english);
        for (long seed = 0; seed < 1000; seed++) {
            WrittenForm w = generator.generate(GenerationOptions.builder().seed(seed).build()).written;
            assertEquals(w.clean, w.hyphenated.replace(GenerationOptions.DEFAULT_HYPHEN, ""), w.hyphenated);
            assertFalse(w.clean.isEmpty());
        }
    }

    @Test
    void customHyphenIsUsed() {
        WordGenerator generator = new WordGenerator(english);
        GenerationOptions dots = GenerationOptions.builder().hyphen("·").syllableCount(3).morphology(false).build();
        for (long seed = 0; seed < 100; seed++) {
            WrittenForm w = generator.generate(dots.withSeed(seed)).written;
            assertEquals(w.clean, w.hyphenated.replace("·", ""));
        }
    }

    @Test
    void tracedWriteRecordsEveryGrapheme() {
        GenerationContext ctx = new GenerationContext(english, GenerationOptions.defaults(), Mulberry32.of(9), new TraceRecorder());
        ctx.syllables().add(Syllables.of(english, "k", "æ", ""));
        ctx.syllables().add(Syllables.of(english, "t", "ɚ", ""));
        ctx.syllables().get(0).setStress(Stress.PRIMARY);

        WrittenForm written = new OrthographyWriter().write(ctx);
        List<GraphemeDecision> decisions = ctx.trace().build().graphemeSelections;
        assertEquals(4, decisions.size());
        for (GraphemeDecision d : decisions) {
            assertTrue(d.candidates.contains(d.selected) || d.doubled, d.toString());
        }
        assertEquals(written.clean, written.hyphenated.replace("-", ""));
    }

    @Test
    void sameSeedSameSpelling() {
        WordGenerator generator = new WordGenerator(english);
        GenerationOptions o = GenerationOptions.builder().seed(1234L).build();
        Word a = generator.generate(o);
        Word b = generator.generate(o);
        assertEquals(a.written, b.written);
    }
}
