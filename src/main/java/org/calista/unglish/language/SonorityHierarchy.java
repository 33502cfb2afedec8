package org.calista.unglish.language;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Sonority levels: manner level + place adjustment + voiced/tense bonuses.
 *
 * <p>Levels are always derived from the declared tables on demand; nothing is cached per phoneme,
 * so a level can never drift from the hierarchy.</p>
 */
public final class SonorityHierarchy {

    private final Map<Manner, Double> mannerLevels;
    private final Map<Place, Double> placeAdjustments;
    private final double voicedBonus;
    private final double tenseBonus;
    private final Set<String> exempt;

    public SonorityHierarchy(Map<Manner, Double> mannerLevels,
                             Map<Place, Double> placeAdjustments,
                             double voicedBonus,
                             double tenseBonus,
                             Set<String> exempt) {
        Objects.requireNonNull(mannerLevels, "mannerLevels");
        Objects.requireNonNull(placeAdjustments, "placeAdjustments");
        for (Manner m : Manner.values()) {
            if (!mannerLevels.containsKey(m)) throw new ConfigurationException("no sonority level for manner " + m.key());
        }
        this.mannerLevels = new EnumMap<>(mannerLevels);
        this.placeAdjustments = placeAdjustments.isEmpty() ? new EnumMap<>(Place.class) : new EnumMap<>(placeAdjustments);
        this.voicedBonus = voicedBonus;
        this.tenseBonus = tenseBonus;
        this.exempt = Set.copyOf(Objects.requireNonNull(exempt, "exempt"));
    }

    public double levelOf(Phoneme p) {
        double level = mannerLevels.get(p.manner());
        level += placeAdjustments.getOrDefault(p.place(), 0.0);
        if (p.voiced()) level += voicedBonus;
        if (p.tense()) level += tenseBonus;
        return level;
    }

    /** Sounds allowed to break monotonic cluster ordering (the s of "st", the s of "ks"). */
    public boolean isExempt(Phoneme p) {
        return exempt.contains(p.sound());
    }

    public Set<String> exemptSounds() {
        return exempt;
    }
}
