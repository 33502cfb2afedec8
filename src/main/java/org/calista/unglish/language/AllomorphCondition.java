package org.calista.unglish.language;

/**
 * Phonological context that selects an allomorph. Evaluated against the root phoneme adjacent to the
 * affix: the root's last phoneme for suffixes, its first phoneme for prefixes.
 */
public enum AllomorphCondition {
    AFTER_VOICELESS("after-voiceless", AffixKind.SUFFIX, 1),
    AFTER_VOICED("after-voiced", AffixKind.SUFFIX, 1),
    /** Sibilants and affricates: judge + s -> judges. */
    AFTER_SIBILANT("after-sibilant", AffixKind.SUFFIX, 2),
    AFTER_ALVEOLAR_STOP("after-alveolar-stop", AffixKind.SUFFIX, 2),
    BEFORE_BILABIAL("before-bilabial", AffixKind.PREFIX, 2);

    private final String key;
    private final AffixKind side;
    private final int specificity;

    AllomorphCondition(String key, AffixKind side, int specificity) {
        this.key = key;
        this.side = side;
        this.specificity = specificity;
    }

    public String key() {
        return key;
    }

    /** Affix kind the condition is meaningful for. */
    public AffixKind side() {
        return side;
    }

    /** Higher wins when several variants match. */
    public int specificity() {
        return specificity;
    }

    public boolean matches(Phoneme boundary) {
        if (boundary == null) return false;
        return switch (this) {
            case AFTER_VOICELESS -> !boundary.voiced();
            case AFTER_VOICED -> boundary.voiced();
            case AFTER_SIBILANT -> boundary.manner() == Manner.SIBILANT || boundary.manner() == Manner.AFFRICATE;
            case AFTER_ALVEOLAR_STOP -> boundary.manner() == Manner.STOP && boundary.place() == Place.ALVEOLAR;
            case BEFORE_BILABIAL -> boundary.place() == Place.BILABIAL;
        };
    }

    public static AllomorphCondition fromKey(String key) {
        for (AllomorphCondition c : values()) {
            if (c.key.equals(key)) return c;
        }
        throw new ConfigurationException("unknown allomorph condition: " + key);
    }
}
