package org.calista.unglish.language;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanguageConfigTests {

    private LanguageDefinition def;

    @BeforeEach
    void readBundled() throws IOException {
        def = new LanguageLoader().readResource(LanguageLoader.DEFAULT_RESOURCE);
    }

    @Test
    void bundledEnglishLoads() {
        LanguageConfig lang = LanguageLoader.english();
        assertEquals("English", lang.name);
        assertNotNull(lang.phoneme("t"));
        assertNotNull(lang.phoneme("ə"));
        assertFalse(lang.inventory(Position.NUCLEUS).isEmpty());
        assertFalse(lang.clusters.allowedFinal.isEmpty());
        assertFalse(lang.morphology.prefixes.isEmpty());
        assertFalse(lang.morphology.suffixes.isEmpty());
        for (GenerationMode mode : GenerationMode.values()) {
            assertTrue(lang.structure.syllableCounts(mode).size() > 0, mode.key());
        }
    }

    @Test
    void everyPhonemeIsSpellableWhereItMayStand() {
        LanguageConfig lang = LanguageConfig.from(def);
        for (Position pos : Position.values()) {
            for (Phoneme p : lang.inventory(pos)) {
                assertFalse(lang.graphemes(pos, p.sound()).isEmpty(), p.sound() + " in " + pos);
            }
        }
    }

    @Test
    void vowelInOnsetIsRejected() {
        LanguageDefinition.PhonemeDef a = find("æ");
        a.onset = 5;
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void duplicatePhonemeIsRejected() {
        LanguageDefinition.PhonemeDef copy = new LanguageDefinition.PhonemeDef();
        LanguageDefinition.PhonemeDef t = find("t");
        copy.sound = t.sound;
        copy.manner = t.manner;
        copy.place = t.place;
        copy.onset = 1;
        def.phonemes.add(copy);
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void unspellablePhonemeIsRejected() {
        def.graphemes.removeIf(g -> g.phoneme.equals("v"));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
        assertTrue(e.getMessage().contains("/v/"), e.getMessage());
    }

    @Test
    void unknownMannerIsRejected() {
        find("p").manner = "click";
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void missingSyllableCountTableIsRejected() {
        def.structure.syllableCount.remove(GenerationMode.TEXT.key());
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void zeroSumWeightTableIsRejected() {
        def.structure.onsetDefault = new double[][]{{0, 0}, {1, 0}};
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void emptyAllowedFinalIsRejected() {
        def.clusters.allowedFinal = new ArrayList<>();
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void clusterReferencingUnknownSoundIsRejected() {
        def.clusters.attestedOnsets.add(List.of("p", "ʀ"));
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void probabilisticCleanupIsRejected() {
        LanguageDefinition.RuleDef r = new LanguageDefinition.RuleDef();
        r.name = "maybe";
        r.pattern = "q";
        r.replacement = "k";
        r.probability = 50;
        def.orthography.cleanups.add(r);
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void badRegexIsRejected() {
        def.clusters.invalidOnsetPatterns.add("([");
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void suffixTemplateWithoutSuffixesIsRejected() {
        def.morphology.suffixes = new ArrayList<>();
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void prefixOnlyConditionOnSuffixIsRejected() {
        LanguageDefinition.AffixDef s = def.morphology.suffixes.get(0);
        LanguageDefinition.VariantDef v = new LanguageDefinition.VariantDef();
        v.condition = AllomorphCondition.BEFORE_BILABIAL.key();
        v.phonemes = List.of("ɪ", "m");
        v.written = "im";
        s.variants = List.of(v);
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void attractPrecedingOnPrefixIsRejected() {
        def.morphology.prefixes.get(0).stressEffect = StressEffect.ATTRACT_PRECEDING.key();
        assertThrows(ConfigurationException.class, () -> LanguageConfig.from(def));
    }

    @Test
    void generationModeKeysAreForgiving() {
        assertEquals(GenerationMode.TEXT, GenerationMode.fromKey("TEXT"));
        assertEquals(GenerationMode.LEXICON, GenerationMode.fromKey(" "));
        assertEquals(GenerationMode.LEXICON, GenerationMode.fromKey(null));
    }

    private LanguageDefinition.PhonemeDef find(String sound) {
        for (LanguageDefinition.PhonemeDef p : def.phonemes) {
            if (p.sound.equals(sound)) return p;
        }
        throw new AssertionError("no phoneme " + sound);
    }
}
