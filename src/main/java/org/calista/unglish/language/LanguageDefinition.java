package org.calista.unglish.language;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LanguageDefinition: JSON shape of a language (Jackson-bound POJO).
 * - defaults in fields
 * - no logic beyond shape; {@link LanguageConfig#from(LanguageDefinition)} converts and validates
 *
 * Weight tables are written as {@code [[value, weight], ...]}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LanguageDefinition {

    public String name = "unnamed";
    public Sonority sonority = new Sonority();
    public List<PhonemeDef> phonemes = new ArrayList<>();
    public List<GraphemeDef> graphemes = new ArrayList<>();
    public Structure structure = new Structure();
    public Clusters clusters = new Clusters();
    public Stress stress = new Stress();
    public Aspiration aspiration = new Aspiration();
    public VowelReduction vowelReduction = new VowelReduction();
    public Morphology morphology = new Morphology();
    public Orthography orthography = new Orthography();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Sonority {
        public Map<String, Double> manner = new LinkedHashMap<>();
        public Map<String, Double> place = new LinkedHashMap<>();
        public double voicedBonus = 0.5;
        public double tenseBonus = 0.25;
        public List<String> exempt = List.of("s", "z");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PhonemeDef {
        public String sound;
        public String manner;
        public String place;
        public boolean voiced;
        public boolean tense;
        public double onset;
        public double nucleus;
        public double coda;
        public double startWord;
        public double midWord;
        public double endWord;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class GraphemeDef {
        public String phoneme;
        public String form;
        public double frequency = 1;
        public Double onset;
        public Double nucleus;
        public Double coda;
        public Double cluster;
        public Double startWord;
        public Double midWord;
        public Double endWord;
        public ConditionDef condition;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConditionDef {
        public List<String> wordPosition = List.of();
        public List<String> notLeftContext = List.of();
        public List<String> notRightContext = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Structure {
        public int maxOnset = 3;
        public int maxNucleus = 1;
        public int maxCoda = 3;
        /** Sounds that may extend a coda one past maxCoda when they close it. */
        public List<String> codaAppendants = List.of("s", "z");

        /** keyed by mode: lexicon, text */
        public Map<String, double[][]> syllableCount = new LinkedHashMap<>();

        public double[][] onsetMonosyllabic = {{0, 50}, {1, 100}, {2, 200}, {3, 150}};
        public double[][] onsetFollowingNucleus = {{0, 0}, {1, 675}, {2, 125}, {3, 80}};
        public double[][] onsetDefault = {{0, 150}, {1, 675}, {2, 125}, {3, 80}};

        /** keyed by onset length of the monosyllable */
        public Map<String, double[][]> codaMonosyllabicByOnset = new LinkedHashMap<>();
        public double[][] codaMonosyllabicDefault = {{0, 150}, {1, 200}, {2, 30}, {3, 10}};
        public double[][] codaPolysyllabicNonZero = {{1, 3000}, {2, 900}, {3, 100}};
        public double codaZeroEndOfWord = 1200;
        public double codaZeroMidWord = 6000;

        public double boundaryDropChance = 90;
        public double finalSChance = 15;
        public String finalSSound = "s";
        public double repeatAvoidanceChance = 98;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Clusters {
        public List<List<String>> attestedOnsets = new ArrayList<>();
        public List<List<String>> attestedCodas = new ArrayList<>();
        public List<String> invalidOnsetPatterns = new ArrayList<>();
        public List<String> invalidCodaPatterns = new ArrayList<>();
        public List<BannedGroup> bannedBoundary = new ArrayList<>();
        /** drop-coda | drop-onset */
        public String boundaryRepair = "drop-coda";
        public List<String> allowedFinal = new ArrayList<>();
        /** homorganic place groups for nasal + stop codas, e.g. [["m","p","b"],["n","t","d"]] */
        public List<List<String>> homorganicGroups = new ArrayList<>();
        /** coda sequences stripped by the dialect cleanup: [["ŋ","s"],["ŋ","z"]] */
        public List<List<String>> codaCleanup = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BannedGroup {
        public List<String> coda = List.of();
        public List<String> onset = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Stress {
        public double disyllabicFirst = 70;
        public double disyllabicSecond = 30;

        public double penultHeavy = 70;
        public double penultLight = 30;
        public double antepenultHeavy = 27;
        public double antepenultLight = 67;
        public double initial = 2;

        public double secondaryChance = 40;
        public double secondaryHeavy = 70;
        public double secondaryLight = 30;

        public double rhythmicChance = 40;

        public List<String> stressedNucleusBan = List.of("ə");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Aspiration {
        public double wordInitial = 95;
        public double afterS = 5;
        public double stressed = 90;
        public double afterStressed = 50;
        public double wordFinal = 15;
        public double other = 30;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class VowelReduction {
        public boolean enabled = true;
        public List<ReductionRuleDef> rules = new ArrayList<>();
        public boolean reduceSecondaryStress = true;
        public double secondaryStressProbability = 30;
        public double wordInitial = 0.70;
        public double wordMedial = 1.0;
        public double wordFinal = 0.65;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ReductionRuleDef {
        public String source;
        public String target;
        public double probability;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Morphology {
        public boolean enabled = true;
        /** mode -> template -> weight */
        public Map<String, Map<String, Double>> templates = new LinkedHashMap<>();
        public List<AffixDef> prefixes = new ArrayList<>();
        public List<AffixDef> suffixes = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AffixDef {
        public String id;
        public List<String> phonemes = List.of();
        public int syllableCount = 1;
        public String written;
        public double frequency = 1;
        public String stressEffect = "none";
        public List<VariantDef> variants = List.of();
        public List<String> boundaryRules = List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class VariantDef {
        public String condition;
        public List<String> phonemes = List.of();
        public String written;
        public int syllableCount = 1;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Orthography {
        public Doubling doubling = new Doubling();
        /** syllable-scope magic-e castling: long-vowel "Ve" + trailing consonants -> "V" + consonants + "e" */
        public String castlingPattern = "([aiou])e([bcdfghjklmnpqrstvwxz]+)$";
        public String castlingReplacement = "$1$2e";
        /** deterministic word-level collapses, run to a fixed point */
        public List<RuleDef> cleanups = new ArrayList<>();
        /** probabilistic spelling variation, run once before cleanups */
        public List<RuleDef> spellingRules = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Doubling {
        public boolean enabled = true;
        public double probability = 80;
        public double unstressedModifier = 0;
        public int maxPerWord = 1;
        /** phoneme sounds never doubled */
        public List<String> neverDouble = new ArrayList<>();
        /** letters that may double word-finally (staff, bell, kiss, fizz) */
        public List<String> finalDoublingOnly = new ArrayList<>();
        /** letter -> doubled spelling where it is not just the letter twice (k -> ck) */
        public Map<String, String> doubledForms = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RuleDef {
        public String name;
        public String pattern;
        public String replacement = "";
        public double probability = 100;
        /** syllable | word */
        public String scope = "word";
    }
}
