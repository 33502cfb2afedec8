package org.calista.unglish.morphology;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.trace.TraceRecorder;
import org.calista.unglish.word.Syllable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AffixSyllabifierTests {

    private static LanguageConfig english;

    @BeforeAll
    static void load() {
        english = LanguageLoader.english();
    }

    private static List<String> split(String... sounds) {
        return TraceRecorder.snapshot(AffixSyllabifier.syllabify(AffixSyllabifier.resolve(english, List.of(sounds))));
    }

    @Test
    void singleSyllable() {
        assertEquals(List.of("ʃ/ə/n"), split("ʃ", "ə", "n"));
    }

    @Test
    void consonantBetweenVowelsOpensTheNextSyllable() {
        assertEquals(List.of("/ə/", "b/ə/l"), split("ə", "b", "ə", "l"));
        assertEquals(List.of("/ɪ/", "t/i:/"), split("ɪ", "t", "i:"));
    }

    @Test
    void onlyTheLastConsonantMoves() {
        assertEquals(List.of("/ə/n", "t/ɪ/"), split("ə", "n", "t", "ɪ"));
    }

    @Test
    void vowellessSequenceKeepsAnEmptyNucleus() {
        List<Syllable> out = AffixSyllabifier.syllabify(AffixSyllabifier.resolve(english, List.of("d")));
        assertEquals(1, out.size());
        assertTrue(out.get(0).nucleus().isEmpty());
        assertEquals(1, out.get(0).onset().size());
    }

    @Test
    void emptyInputGivesNoSyllables() {
        assertTrue(AffixSyllabifier.syllabify(List.of()).isEmpty());
    }

    @Test
    void unknownSoundsBecomePlaceholders() {
        List<Phoneme> resolved = AffixSyllabifier.resolve(english, List.of("ʀ", "t"));
        assertTrue(resolved.get(0).isPlaceholder());
        assertSame(english.phoneme("t"), resolved.get(1));
    }
}
