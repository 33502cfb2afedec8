package org.calista.unglish.language;

/** What an affix does to word stress when it is attached. */
public enum StressEffect {
    NONE("none"),
    PRIMARY("primary"),
    SECONDARY("secondary"),
    /** Suffix-only: primary stress moves to the syllable right before the suffix. */
    ATTRACT_PRECEDING("attract-preceding");

    private final String key;

    StressEffect(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static StressEffect fromKey(String key) {
        if (key == null || key.isBlank()) return NONE;
        for (StressEffect e : values()) {
            if (e.key.equals(key)) return e;
        }
        throw new ConfigurationException("unknown stress effect: " + key);
    }
}
