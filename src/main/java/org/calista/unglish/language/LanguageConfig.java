package org.calista.unglish.language;

import org.calista.unglish.random.PrecomputedWeights;
import org.calista.unglish.random.Weighted;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * LanguageConfig: immutable, validated runtime view of a {@link LanguageDefinition}.
 *
 * <p>All lookup structures (inventories per position, grapheme maps, cluster sets, weight tables) are built
 * once here. Instances are read-only and safe to share between threads.</p>
 */
public final class LanguageConfig {

    public final String name;

    private final List<Phoneme> phonemes;
    private final Map<String, Phoneme> bySound;
    private final Map<Position, List<Phoneme>> inventory;
    private final Map<Position, Map<String, List<Grapheme>>> graphemes;

    public final SonorityHierarchy sonority;
    public final Structure structure;
    public final Clusters clusters;
    public final Stress stress;
    public final Aspiration aspiration;
    public final VowelReduction vowelReduction;
    public final Morphology morphology;
    public final Orthography orthography;

    private LanguageConfig(LanguageDefinition d) {
        this.name = (d.name == null || d.name.isBlank()) ? "unnamed" : d.name;

        this.sonority = buildSonority(require(d.sonority, "sonority"));

        List<Phoneme> list = new ArrayList<>();
        Map<String, Phoneme> index = new LinkedHashMap<>();
        for (LanguageDefinition.PhonemeDef pd : require(d.phonemes, "phonemes")) {
            Phoneme p = buildPhoneme(pd);
            if (index.put(p.sound(), p) != null) throw new ConfigurationException("duplicate phoneme: " + p.sound());
            list.add(p);
        }
        if (list.isEmpty()) throw new ConfigurationException("phoneme inventory is empty");
        this.phonemes = List.copyOf(list);
        this.bySound = Collections.unmodifiableMap(index);

        EnumMap<Position, List<Phoneme>> inv = new EnumMap<>(Position.class);
        for (Position pos : Position.values()) {
            List<Phoneme> slot = new ArrayList<>();
            for (Phoneme p : list) {
                if (p.weight(pos) > 0) slot.add(p);
            }
            if (slot.isEmpty()) throw new ConfigurationException("no phoneme may occupy position " + pos);
            inv.put(pos, List.copyOf(slot));
        }
        this.inventory = Collections.unmodifiableMap(inv);

        this.graphemes = buildGraphemes(require(d.graphemes, "graphemes"), index, inv);

        this.structure = new Structure(require(d.structure, "structure"), index);
        this.clusters = new Clusters(require(d.clusters, "clusters"), index);
        this.stress = new Stress(require(d.stress, "stress"), index);
        this.aspiration = new Aspiration(require(d.aspiration, "aspiration"));
        this.vowelReduction = new VowelReduction(require(d.vowelReduction, "vowelReduction"), index);
        this.morphology = new Morphology(require(d.morphology, "morphology"));
        this.orthography = new Orthography(require(d.orthography, "orthography"));
    }

    /**
     * Converts and validates. Throws {@link ConfigurationException} on malformed data.
     */
    public static LanguageConfig from(LanguageDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        return new LanguageConfig(definition);
    }

    // ---------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------

    public List<Phoneme> phonemes() {
        return phonemes;
    }

    /** @return the inventory entry or null */
    public Phoneme phoneme(String sound) {
        return bySound.get(sound);
    }

    /** Phonemes with a positive weight for the position. */
    public List<Phoneme> inventory(Position position) {
        return inventory.get(position);
    }

    /** Candidate spellings of a sound legal in the position (may be empty for affix placeholders). */
    public List<Grapheme> graphemes(Position position, String sound) {
        return graphemes.get(position).getOrDefault(sound, List.of());
    }

    public double sonorityOf(Phoneme p) {
        return sonority.levelOf(p);
    }

    // ---------------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------------

    /** Syllable shape limits and the hot weight tables, precomputed. */
    public static final class Structure {
        public final int maxOnset;
        public final int maxNucleus;
        public final int maxCoda;
        public final Set<String> codaAppendants;

        private final Map<GenerationMode, PrecomputedWeights<Integer>> syllableCounts;
        public final PrecomputedWeights<Integer> onsetMonosyllabic;
        public final PrecomputedWeights<Integer> onsetFollowingNucleus;
        public final PrecomputedWeights<Integer> onsetDefault;
        private final Map<Integer, PrecomputedWeights<Integer>> codaMonosyllabicByOnset;
        public final PrecomputedWeights<Integer> codaMonosyllabicDefault;
        public final PrecomputedWeights<Integer> codaEndOfWord;
        public final PrecomputedWeights<Integer> codaMidWord;

        public final PrecomputedWeights<Boolean> boundaryDrop;
        public final PrecomputedWeights<Boolean> finalS;
        public final PrecomputedWeights<Boolean> repeatAvoidance;
        public final Phoneme finalSPhoneme;

        private Structure(LanguageDefinition.Structure d, Map<String, Phoneme> index) {
            if (d.maxOnset < 0 || d.maxCoda < 0) throw new ConfigurationException("cluster maxima must be >= 0");
            if (d.maxNucleus < 1) throw new ConfigurationException("maxNucleus must be >= 1");
            this.maxOnset = d.maxOnset;
            this.maxNucleus = d.maxNucleus;
            this.maxCoda = d.maxCoda;
            this.codaAppendants = Set.copyOf(orEmpty(d.codaAppendants));

            EnumMap<GenerationMode, PrecomputedWeights<Integer>> counts = new EnumMap<>(GenerationMode.class);
            for (GenerationMode mode : GenerationMode.values()) {
                double[][] table = d.syllableCount == null ? null : d.syllableCount.get(mode.key());
                if (table == null) throw new ConfigurationException("no syllable-count table for mode " + mode.key());
                List<Weighted<Integer>> weights = intTable("syllableCount." + mode.key(), table);
                for (Weighted<Integer> w : weights) {
                    if (w.item < 1) throw new ConfigurationException("syllable counts must be >= 1: " + w.item);
                }
                counts.put(mode, precompute("syllableCount." + mode.key(), weights));
            }
            this.syllableCounts = Collections.unmodifiableMap(counts);

            this.onsetMonosyllabic = precompute("onsetMonosyllabic", intTable("onsetMonosyllabic", d.onsetMonosyllabic));
            this.onsetFollowingNucleus = precompute("onsetFollowingNucleus", intTable("onsetFollowingNucleus", d.onsetFollowingNucleus));
            this.onsetDefault = precompute("onsetDefault", intTable("onsetDefault", d.onsetDefault));

            Map<Integer, PrecomputedWeights<Integer>> byOnset = new HashMap<>();
            if (d.codaMonosyllabicByOnset != null) {
                for (Map.Entry<String, double[][]> e : d.codaMonosyllabicByOnset.entrySet()) {
                    int onsetLength;
                    try {
                        onsetLength = Integer.parseInt(e.getKey().trim());
                    } catch (NumberFormatException ex) {
                        throw new ConfigurationException("codaMonosyllabicByOnset key is not an integer: " + e.getKey(), ex);
                    }
                    String label = "codaMonosyllabicByOnset." + onsetLength;
                    byOnset.put(onsetLength, precompute(label, intTable(label, e.getValue())));
                }
            }
            this.codaMonosyllabicByOnset = Map.copyOf(byOnset);
            this.codaMonosyllabicDefault = precompute("codaMonosyllabicDefault", intTable("codaMonosyllabicDefault", d.codaMonosyllabicDefault));

            List<Weighted<Integer>> nonZero = intTable("codaPolysyllabicNonZero", d.codaPolysyllabicNonZero);
            this.codaEndOfWord = precompute("codaEndOfWord", withZero(d.codaZeroEndOfWord, nonZero));
            this.codaMidWord = precompute("codaMidWord", withZero(d.codaZeroMidWord, nonZero));

            this.boundaryDrop = PrecomputedWeights.chance(d.boundaryDropChance);
            this.finalS = PrecomputedWeights.chance(d.finalSChance);
            this.repeatAvoidance = PrecomputedWeights.chance(d.repeatAvoidanceChance);

            this.finalSPhoneme = d.finalSSound == null ? null : index.get(d.finalSSound);
            if (d.finalSSound != null && finalSPhoneme == null) {
                throw new ConfigurationException("finalSSound is not in the inventory: " + d.finalSSound);
            }
        }

        public PrecomputedWeights<Integer> syllableCounts(GenerationMode mode) {
            return syllableCounts.get(mode);
        }

        public PrecomputedWeights<Integer> codaMonosyllabic(int onsetLength) {
            return codaMonosyllabicByOnset.getOrDefault(onsetLength, codaMonosyllabicDefault);
        }

        /** Coda cap, one longer when the coda closes with an appendant sound. */
        public int effectiveMaxCoda(String lastSound) {
            return codaAppendants.contains(lastSound) ? maxCoda + 1 : maxCoda;
        }

        private static List<Weighted<Integer>> withZero(double zeroWeight, List<Weighted<Integer>> nonZero) {
            List<Weighted<Integer>> out = new ArrayList<>(nonZero.size() + 1);
            out.add(Weighted.of(0, zeroWeight));
            out.addAll(nonZero);
            return out;
        }
    }

    /** Cluster legality data: attested shapes, invalid patterns, banned boundaries, legal finals. */
    public static final class Clusters {

        public enum BoundaryRepair {
            DROP_CODA,
            DROP_ONSET
        }

        private final Set<List<String>> onsetPrefixes;
        private final Set<List<String>> codaPrefixes;
        private final List<Pattern> invalidOnset;
        private final List<Pattern> invalidCoda;
        private final Map<String, Set<String>> bannedBoundary;
        public final BoundaryRepair boundaryRepair;
        public final Set<String> allowedFinal;
        private final Map<String, Integer> homorganicGroup;
        public final List<List<String>> codaCleanup;

        private Clusters(LanguageDefinition.Clusters d, Map<String, Phoneme> index) {
            this.onsetPrefixes = prefixes("attestedOnsets", orEmpty(d.attestedOnsets), index);
            this.codaPrefixes = prefixes("attestedCodas", orEmpty(d.attestedCodas), index);
            this.invalidOnset = patterns(orEmpty(d.invalidOnsetPatterns));
            this.invalidCoda = patterns(orEmpty(d.invalidCodaPatterns));

            Map<String, Set<String>> banned = new HashMap<>();
            for (LanguageDefinition.BannedGroup g : orEmpty(d.bannedBoundary)) {
                for (String coda : orEmpty(g.coda)) {
                    requireSound(index, coda, "bannedBoundary.coda");
                    Set<String> onsets = banned.computeIfAbsent(coda, k -> new HashSet<>());
                    for (String onset : orEmpty(g.onset)) {
                        requireSound(index, onset, "bannedBoundary.onset");
                        onsets.add(onset);
                    }
                }
            }
            Map<String, Set<String>> frozen = new HashMap<>();
            banned.forEach((k, v) -> frozen.put(k, Set.copyOf(v)));
            this.bannedBoundary = Map.copyOf(frozen);

            this.boundaryRepair = switch (d.boundaryRepair == null ? "drop-coda" : d.boundaryRepair) {
                case "drop-coda" -> BoundaryRepair.DROP_CODA;
                case "drop-onset" -> BoundaryRepair.DROP_ONSET;
                default -> throw new ConfigurationException("unknown boundary repair strategy: " + d.boundaryRepair);
            };

            for (String s : orEmpty(d.allowedFinal)) requireSound(index, s, "allowedFinal");
            if (orEmpty(d.allowedFinal).isEmpty()) throw new ConfigurationException("allowedFinal must not be empty");
            this.allowedFinal = Set.copyOf(d.allowedFinal);

            Map<String, Integer> groups = new HashMap<>();
            List<List<String>> homorganic = orEmpty(d.homorganicGroups);
            for (int i = 0; i < homorganic.size(); i++) {
                for (String s : homorganic.get(i)) {
                    requireSound(index, s, "homorganicGroups");
                    groups.put(s, i);
                }
            }
            this.homorganicGroup = Map.copyOf(groups);

            List<List<String>> cleanup = new ArrayList<>();
            for (List<String> seq : orEmpty(d.codaCleanup)) {
                if (seq.size() != 2) throw new ConfigurationException("codaCleanup entries are pairs: " + seq);
                for (String s : seq) requireSound(index, s, "codaCleanup");
                cleanup.add(List.copyOf(seq));
            }
            this.codaCleanup = List.copyOf(cleanup);
        }

        public boolean isBannedBoundary(String codaSound, String onsetSound) {
            Set<String> onsets = bannedBoundary.get(codaSound);
            return onsets != null && onsets.contains(onsetSound);
        }

        /** Multi-phoneme onsets must be a prefix of an attested onset. */
        public boolean isAttestedOnsetPrefix(List<String> sounds) {
            return sounds.size() < 2 || onsetPrefixes.contains(sounds);
        }

        public boolean isAttestedCodaPrefix(List<String> sounds) {
            return sounds.size() < 2 || codaPrefixes.contains(sounds);
        }

        public boolean matchesInvalidOnset(String joined) {
            return anyFind(invalidOnset, joined);
        }

        public boolean matchesInvalidCoda(String joined) {
            return anyFind(invalidCoda, joined);
        }

        /** True when both sounds belong to the same place group; unknown sounds are treated as matching. */
        public boolean homorganic(String nasal, String stop) {
            Integer a = homorganicGroup.get(nasal);
            Integer b = homorganicGroup.get(stop);
            return a == null || b == null || a.equals(b);
        }

        private static boolean anyFind(List<Pattern> patterns, String joined) {
            for (Pattern p : patterns) {
                if (p.matcher(joined).find()) return true;
            }
            return false;
        }

        private static Set<List<String>> prefixes(String label, List<List<String>> clusters, Map<String, Phoneme> index) {
            Set<List<String>> out = new HashSet<>();
            for (List<String> cluster : clusters) {
                for (String s : cluster) requireSound(index, s, label);
                for (int len = 2; len <= cluster.size(); len++) {
                    out.add(List.copyOf(cluster.subList(0, len)));
                }
            }
            return Set.copyOf(out);
        }
    }

    /** Stress placement weights. */
    public static final class Stress {
        public final double disyllabicFirst;
        public final double disyllabicSecond;
        public final double penultHeavy;
        public final double penultLight;
        public final double antepenultHeavy;
        public final double antepenultLight;
        public final double initial;
        public final double secondaryChance;
        public final double secondaryHeavy;
        public final double secondaryLight;
        public final double rhythmicChance;
        public final Set<String> stressedNucleusBan;

        private Stress(LanguageDefinition.Stress d, Map<String, Phoneme> index) {
            this.disyllabicFirst = nonNegative("stress.disyllabicFirst", d.disyllabicFirst);
            this.disyllabicSecond = nonNegative("stress.disyllabicSecond", d.disyllabicSecond);
            if (disyllabicFirst + disyllabicSecond <= 0) throw new ConfigurationException("disyllabic stress weights sum to zero");
            this.penultHeavy = nonNegative("stress.penultHeavy", d.penultHeavy);
            this.penultLight = nonNegative("stress.penultLight", d.penultLight);
            this.antepenultHeavy = nonNegative("stress.antepenultHeavy", d.antepenultHeavy);
            this.antepenultLight = nonNegative("stress.antepenultLight", d.antepenultLight);
            this.initial = nonNegative("stress.initial", d.initial);
            if (penultHeavy + antepenultHeavy + initial <= 0 || penultLight + antepenultLight + initial <= 0) {
                throw new ConfigurationException("polysyllabic stress weights sum to zero");
            }
            this.secondaryChance = percent("stress.secondaryChance", d.secondaryChance);
            this.secondaryHeavy = nonNegative("stress.secondaryHeavy", d.secondaryHeavy);
            this.secondaryLight = nonNegative("stress.secondaryLight", d.secondaryLight);
            if (secondaryHeavy + secondaryLight <= 0) throw new ConfigurationException("secondary stress weights sum to zero");
            this.rhythmicChance = percent("stress.rhythmicChance", d.rhythmicChance);
            for (String s : orEmpty(d.stressedNucleusBan)) requireSound(index, s, "stress.stressedNucleusBan");
            this.stressedNucleusBan = Set.copyOf(orEmpty(d.stressedNucleusBan));
        }
    }

    /** Percent chances of aspirating a voiceless stop by context. */
    public static final class Aspiration {
        public final double wordInitial;
        public final double afterS;
        public final double stressed;
        public final double afterStressed;
        public final double wordFinal;
        public final double other;

        private Aspiration(LanguageDefinition.Aspiration d) {
            this.wordInitial = percent("aspiration.wordInitial", d.wordInitial);
            this.afterS = percent("aspiration.afterS", d.afterS);
            this.stressed = percent("aspiration.stressed", d.stressed);
            this.afterStressed = percent("aspiration.afterStressed", d.afterStressed);
            this.wordFinal = percent("aspiration.wordFinal", d.wordFinal);
            this.other = percent("aspiration.other", d.other);
        }
    }

    /** Unstressed vowel reduction rules keyed by source sound. */
    public static final class VowelReduction {
        public final boolean enabled;
        private final Map<String, Rule> rules;
        public final boolean reduceSecondaryStress;
        public final double secondaryStressProbability;
        public final double wordInitial;
        public final double wordMedial;
        public final double wordFinal;

        private VowelReduction(LanguageDefinition.VowelReduction d, Map<String, Phoneme> index) {
            this.enabled = d.enabled;
            Map<String, Rule> map = new LinkedHashMap<>();
            for (LanguageDefinition.ReductionRuleDef r : orEmpty(d.rules)) {
                Phoneme source = requireSound(index, r.source, "vowelReduction.source");
                Phoneme target = requireSound(index, r.target, "vowelReduction.target");
                if (!source.isVowel() || !target.isVowel()) {
                    throw new ConfigurationException("vowel reduction maps vowels only: " + r.source + " -> " + r.target);
                }
                map.put(r.source, new Rule(r.source, target, percent("vowelReduction.probability", r.probability)));
            }
            this.rules = Collections.unmodifiableMap(map);
            this.reduceSecondaryStress = d.reduceSecondaryStress;
            this.secondaryStressProbability = percent("vowelReduction.secondaryStressProbability", d.secondaryStressProbability);
            this.wordInitial = nonNegative("vowelReduction.wordInitial", d.wordInitial);
            this.wordMedial = nonNegative("vowelReduction.wordMedial", d.wordMedial);
            this.wordFinal = nonNegative("vowelReduction.wordFinal", d.wordFinal);
        }

        /** @return rule for the source sound or null (vowel is immune) */
        public Rule rule(String source) {
            return rules.get(source);
        }

        public Map<String, Rule> rules() {
            return rules;
        }

        public static final class Rule {
            public final String source;
            public final Phoneme target;
            public final double probability;

            Rule(String source, Phoneme target, double probability) {
                this.source = source;
                this.target = target;
                this.probability = probability;
            }
        }
    }

    /** Affix inventory and template weights. */
    public static final class Morphology {
        public final boolean enabled;
        private final Map<GenerationMode, List<Weighted<MorphologyTemplate>>> templates;
        public final List<Affix> prefixes;
        public final List<Affix> suffixes;

        private Morphology(LanguageDefinition.Morphology d) {
            this.enabled = d.enabled;

            EnumMap<GenerationMode, List<Weighted<MorphologyTemplate>>> byMode = new EnumMap<>(GenerationMode.class);
            for (GenerationMode mode : GenerationMode.values()) {
                Map<String, Double> table = d.templates == null ? null : d.templates.get(mode.key());
                List<Weighted<MorphologyTemplate>> weights = new ArrayList<>();
                if (table == null || table.isEmpty()) {
                    weights.add(Weighted.of(MorphologyTemplate.BARE, 1));
                } else {
                    table.forEach((k, v) -> weights.add(Weighted.of(MorphologyTemplate.fromKey(k), nonNegative("templates." + k, v))));
                }
                if (weights.stream().mapToDouble(w -> w.weight).sum() <= 0) {
                    throw new ConfigurationException("morphology templates for " + mode.key() + " sum to zero");
                }
                byMode.put(mode, List.copyOf(weights));
            }
            this.templates = Collections.unmodifiableMap(byMode);

            this.prefixes = affixes(orEmpty(d.prefixes), AffixKind.PREFIX);
            this.suffixes = affixes(orEmpty(d.suffixes), AffixKind.SUFFIX);

            if (enabled) {
                for (List<Weighted<MorphologyTemplate>> t : templates.values()) {
                    for (Weighted<MorphologyTemplate> w : t) {
                        if (w.weight <= 0) continue;
                        if (w.item.hasPrefix() && prefixes.isEmpty()) throw new ConfigurationException("template " + w.item.key() + " needs prefixes");
                        if (w.item.hasSuffix() && suffixes.isEmpty()) throw new ConfigurationException("template " + w.item.key() + " needs suffixes");
                    }
                }
            }
        }

        public List<Weighted<MorphologyTemplate>> templates(GenerationMode mode) {
            return templates.get(mode);
        }

        private static List<Affix> affixes(List<LanguageDefinition.AffixDef> defs, AffixKind kind) {
            List<Affix> out = new ArrayList<>(defs.size());
            for (LanguageDefinition.AffixDef a : defs) {
                if (a.id == null || a.id.isBlank()) throw new ConfigurationException(kind + " without id");
                if (a.written == null) throw new ConfigurationException("affix " + a.id + " has no written form");
                if (a.syllableCount < 0) throw new ConfigurationException("affix " + a.id + " has negative syllableCount");
                if (!(a.frequency > 0)) throw new ConfigurationException("affix " + a.id + " needs a positive frequency");

                List<AllomorphVariant> variants = new ArrayList<>();
                for (LanguageDefinition.VariantDef v : orEmpty(a.variants)) {
                    AllomorphCondition c = AllomorphCondition.fromKey(v.condition);
                    if (c.side() != kind) {
                        throw new ConfigurationException("condition " + c.key() + " does not apply to " + kind + " " + a.id);
                    }
                    variants.add(new AllomorphVariant(c, orEmpty(v.phonemes), v.written == null ? a.written : v.written, v.syllableCount));
                }

                Set<BoundaryRule> rules = EnumSet.noneOf(BoundaryRule.class);
                for (String r : orEmpty(a.boundaryRules)) rules.add(BoundaryRule.fromKey(r));

                StressEffect effect = StressEffect.fromKey(a.stressEffect);
                if (effect == StressEffect.ATTRACT_PRECEDING && kind == AffixKind.PREFIX) {
                    throw new ConfigurationException("attract-preceding is suffix-only: " + a.id);
                }

                out.add(new Affix(a.id, kind, orEmpty(a.phonemes), a.syllableCount, a.written, a.frequency,
                        effect, variants, rules));
            }
            return List.copyOf(out);
        }
    }

    /** Spelling rules and doubling parameters. */
    public static final class Orthography {
        public final boolean doublingEnabled;
        public final double doublingProbability;
        public final double doublingUnstressedModifier;
        public final int doublingMaxPerWord;
        public final Set<String> neverDouble;
        public final Set<String> finalDoublingOnly;
        public final Map<String, String> doubledForms;

        public final SpellingRule castling;
        public final List<SpellingRule> cleanups;
        public final List<SpellingRule> spellingRules;

        private Orthography(LanguageDefinition.Orthography d) {
            LanguageDefinition.Doubling dbl = d.doubling == null ? new LanguageDefinition.Doubling() : d.doubling;
            this.doublingEnabled = dbl.enabled;
            this.doublingProbability = percent("doubling.probability", dbl.probability);
            this.doublingUnstressedModifier = nonNegative("doubling.unstressedModifier", dbl.unstressedModifier);
            this.doublingMaxPerWord = Math.max(0, dbl.maxPerWord);
            this.neverDouble = Set.copyOf(orEmpty(dbl.neverDouble));
            this.finalDoublingOnly = Set.copyOf(orEmpty(dbl.finalDoublingOnly));
            this.doubledForms = dbl.doubledForms == null ? Map.of() : Map.copyOf(dbl.doubledForms);

            this.castling = d.castlingPattern == null || d.castlingPattern.isBlank()
                    ? null
                    : new SpellingRule("castling", compile(d.castlingPattern), d.castlingReplacement == null ? "" : d.castlingReplacement,
                    100, SpellingRule.Scope.SYLLABLE);

            List<SpellingRule> c = new ArrayList<>();
            for (LanguageDefinition.RuleDef r : orEmpty(d.cleanups)) {
                SpellingRule rule = rule(r);
                if (!rule.isDeterministic()) throw new ConfigurationException("cleanup rules must be deterministic: " + r.name);
                c.add(rule);
            }
            this.cleanups = List.copyOf(c);

            List<SpellingRule> s = new ArrayList<>();
            for (LanguageDefinition.RuleDef r : orEmpty(d.spellingRules)) s.add(rule(r));
            this.spellingRules = List.copyOf(s);
        }

        private static SpellingRule rule(LanguageDefinition.RuleDef r) {
            if (r.pattern == null) throw new ConfigurationException("spelling rule without pattern: " + r.name);
            SpellingRule.Scope scope = switch (r.scope == null ? "word" : r.scope) {
                case "word" -> SpellingRule.Scope.WORD;
                case "syllable" -> SpellingRule.Scope.SYLLABLE;
                default -> throw new ConfigurationException("unknown spelling rule scope: " + r.scope);
            };
            return new SpellingRule(r.name == null ? r.pattern : r.name, compile(r.pattern),
                    r.replacement == null ? "" : r.replacement, percent("spellingRule.probability", r.probability), scope);
        }
    }

    // ---------------------------------------------------------------------
    // Builders / validation helpers
    // ---------------------------------------------------------------------

    private static SonorityHierarchy buildSonority(LanguageDefinition.Sonority d) {
        EnumMap<Manner, Double> manners = new EnumMap<>(Manner.class);
        if (d.manner != null) d.manner.forEach((k, v) -> manners.put(Manner.fromKey(k), v));
        EnumMap<Place, Double> places = new EnumMap<>(Place.class);
        if (d.place != null) d.place.forEach((k, v) -> places.put(Place.fromKey(k), v));
        return new SonorityHierarchy(manners, places, d.voicedBonus, d.tenseBonus, Set.copyOf(orEmpty(d.exempt)));
    }

    private static Phoneme buildPhoneme(LanguageDefinition.PhonemeDef d) {
        if (d.sound == null || d.sound.isBlank()) throw new ConfigurationException("phoneme without sound");
        Manner manner = Manner.fromKey(d.manner);
        Place place = Place.fromKey(d.place);
        for (double w : new double[]{d.onset, d.nucleus, d.coda, d.startWord, d.midWord, d.endWord}) {
            nonNegative("phoneme " + d.sound, w);
        }
        if (manner.isVowel() && (d.onset > 0 || d.coda > 0)) {
            throw new ConfigurationException("vowel " + d.sound + " may only occupy the nucleus");
        }
        if (!manner.isVowel() && d.nucleus > 0) {
            throw new ConfigurationException("consonant " + d.sound + " may not occupy the nucleus");
        }
        return Phoneme.builder(d.sound)
                .manner(manner)
                .place(place)
                .voiced(d.voiced)
                .tense(d.tense)
                .onset(d.onset)
                .nucleus(d.nucleus)
                .coda(d.coda)
                .wordWeights(d.startWord, d.midWord, d.endWord)
                .build();
    }

    private static Map<Position, Map<String, List<Grapheme>>> buildGraphemes(List<LanguageDefinition.GraphemeDef> defs,
                                                                           Map<String, Phoneme> index,
                                                                           Map<Position, List<Phoneme>> inventory) {
        EnumMap<Position, Map<String, List<Grapheme>>> maps = new EnumMap<>(Position.class);
        for (Position pos : Position.values()) maps.put(pos, new HashMap<>());

        for (LanguageDefinition.GraphemeDef g : defs) {
            requireSound(index, g.phoneme, "grapheme");
            if (g.form == null || g.form.isEmpty()) throw new ConfigurationException("grapheme for " + g.phoneme + " has no form");
            if (!(g.frequency > 0)) throw new ConfigurationException("grapheme " + g.phoneme + "->" + g.form + " needs a positive frequency");

            GraphemeCondition condition = null;
            if (g.condition != null) {
                EnumSet<WordPosition> positions = EnumSet.noneOf(WordPosition.class);
                for (String wp : orEmpty(g.condition.wordPosition)) positions.add(WordPosition.fromKey(wp));
                condition = new GraphemeCondition(positions, Set.copyOf(orEmpty(g.condition.notLeftContext)),
                        Set.copyOf(orEmpty(g.condition.notRightContext)));
            }

            Grapheme grapheme = new Grapheme(g.phoneme, g.form, g.frequency, g.onset, g.nucleus, g.coda, g.cluster,
                    g.startWord, g.midWord, g.endWord, condition);
            for (Position pos : Position.values()) {
                if (grapheme.allowedIn(pos)) maps.get(pos).computeIfAbsent(g.phoneme, k -> new ArrayList<>()).add(grapheme);
            }
        }

        // every phoneme must be spellable wherever it may stand
        for (Position pos : Position.values()) {
            for (Phoneme p : inventory.get(pos)) {
                if (maps.get(pos).getOrDefault(p.sound(), List.of()).isEmpty()) {
                    throw new ConfigurationException("no grapheme for /" + p.sound() + "/ in " + pos);
                }
            }
        }

        EnumMap<Position, Map<String, List<Grapheme>>> frozen = new EnumMap<>(Position.class);
        maps.forEach((pos, m) -> {
            Map<String, List<Grapheme>> copy = new HashMap<>();
            m.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            frozen.put(pos, Map.copyOf(copy));
        });
        return Collections.unmodifiableMap(frozen);
    }

    private static List<Weighted<Integer>> intTable(String label, double[][] table) {
        if (table == null || table.length == 0) throw new ConfigurationException("weight table " + label + " is empty");
        List<Weighted<Integer>> out = new ArrayList<>(table.length);
        double total = 0;
        for (double[] row : table) {
            if (row == null || row.length != 2) throw new ConfigurationException("weight table " + label + " rows are [value, weight]");
            out.add(Weighted.of((int) row[0], nonNegative(label, row[1])));
            total += row[1];
        }
        if (!(total > 0)) throw new ConfigurationException("weight table " + label + " sums to zero");
        return out;
    }

    private static <T> PrecomputedWeights<T> precompute(String label, List<Weighted<T>> weights) {
        try {
            return PrecomputedWeights.of(weights);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("weight table " + label + ": " + e.getMessage(), e);
        }
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("bad pattern: " + regex, e);
        }
    }

    private static List<Pattern> patterns(List<String> regexes) {
        List<Pattern> out = new ArrayList<>(regexes.size());
        for (String r : regexes) out.add(compile(r));
        return List.copyOf(out);
    }

    private static Phoneme requireSound(Map<String, Phoneme> index, String sound, String where) {
        Phoneme p = sound == null ? null : index.get(sound);
        if (p == null) throw new ConfigurationException(where + " references unknown phoneme: " + sound);
        return p;
    }

    private static double nonNegative(String label, double v) {
        if (!Double.isFinite(v) || v < 0) throw new ConfigurationException(label + " must be a finite weight >= 0, got " + v);
        return v;
    }

    private static double percent(String label, double v) {
        if (!Double.isFinite(v) || v < 0 || v > 100) throw new ConfigurationException(label + " must be within [0, 100], got " + v);
        return v;
    }

    private static <T> T require(T value, String section) {
        if (value == null) throw new ConfigurationException("missing section: " + section);
        return value;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
