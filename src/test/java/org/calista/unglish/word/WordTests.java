package org.calista.unglish.word;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.unglish.generate.GenerationOptions;
import org.calista.unglish.generate.WordGenerator;
import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.LanguageLoader;
import org.calista.unglish.language.Phoneme;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordTests {

    private static LanguageConfig english;
    private static WordGenerator generator;

    @BeforeAll
    static void load() {
        english = LanguageLoader.english();
        generator = new WordGenerator(english);
    }

    @Test
    void syllablesAreFrozen() {
        Word w = generator.generate(GenerationOptions.builder().seed(3L).build());
        Syllable s = w.syllables.get(0);
        assertTrue(s.isFrozen());
        assertThrows(UnsupportedOperationException.class, () -> s.setStress(Stress.PRIMARY));
        assertThrows(UnsupportedOperationException.class, () -> s.nucleus().clear());
        assertThrows(UnsupportedOperationException.class, () -> w.syllables.remove(0));
    }

    @Test
    void emptyNucleusCannotBeFrozen() {
        Syllable s = new Syllable(List.of(english.phoneme("t")), List.of(), List.of());
        assertThrows(IllegalStateException.class, s::freeze);
        assertThrows(IllegalArgumentException.class,
                () -> new Word(List.of(), "", new WrittenForm("", ""), null));
    }

    @Test
    void equalityIgnoresTrace() {
        GenerationOptions plain = GenerationOptions.builder().seed(11L).build();
        Word a = generator.generate(plain);
        Word b = generator.generate(plain.toBuilder().trace(true).build());
        assertNull(a.trace);
        assertNotNull(b.trace);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void primaryStressIndex() {
        Phoneme b = english.phoneme("b");
        Phoneme ae = english.phoneme("æ");
        Phoneme schwa = english.phoneme("ə");
        Syllable first = new Syllable(List.of(b), List.of(ae), List.of());
        Syllable second = new Syllable(List.of(b), List.of(schwa), List.of());
        second.setStress(Stress.PRIMARY);

        Word w = new Word(List.of(first, second), "bæˈbə", new WrittenForm("babba", "ba-bba"), null);
        assertEquals(1, w.primaryStressIndex());
        assertEquals(2, w.syllableCount());
        assertEquals("babba /bæˈbə/", w.toString());

        Word mono = new Word(List.of(new Syllable(List.of(b), List.of(ae), List.of())), "bæ",
                new WrittenForm("ba", "ba"), null);
        assertEquals(-1, mono.primaryStressIndex());
    }

    @Test
    void jsonShape() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Word plain = generator.generate(GenerationOptions.builder().seed(8L).build());
        JsonNode node = mapper.readTree(mapper.writeValueAsString(plain));

        assertEquals(plain.written.clean, node.get("written").get("clean").asText());
        assertEquals(plain.written.hyphenated, node.get("written").get("hyphenated").asText());
        assertEquals(plain.pronunciation, node.get("pronunciation").asText());
        assertFalse(node.has("trace"));

        JsonNode syllables = node.get("syllables");
        assertEquals(plain.syllableCount(), syllables.size());
        JsonNode first = syllables.get(0);
        assertTrue(first.has("onset") && first.has("nucleus") && first.has("coda"));
        assertEquals(plain.syllables.get(0).stress().name(), first.get("stress").asText());
        assertFalse(first.has("heavy"));

        Word traced = generator.generate(GenerationOptions.builder().seed(8L).trace(true).build());
        JsonNode tracedNode = mapper.readTree(mapper.writeValueAsString(traced));
        assertTrue(tracedNode.get("trace").has("summary"));
        assertTrue(tracedNode.get("trace").get("stages").size() > 0);
    }
}
