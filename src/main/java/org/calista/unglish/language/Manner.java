package org.calista.unglish.language;

import java.util.Locale;

/**
 * Manner of articulation. Sonority levels per manner live in the language data, not here.
 */
public enum Manner {
    HIGH_VOWEL("highVowel"),
    MID_VOWEL("midVowel"),
    LOW_VOWEL("lowVowel"),
    GLIDE("glide"),
    LIQUID("liquid"),
    NASAL("nasal"),
    SIBILANT("sibilant"),
    FRICATIVE("fricative"),
    AFFRICATE("affricate"),
    STOP("stop");

    private final String key;

    Manner(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isVowel() {
        return this == HIGH_VOWEL || this == MID_VOWEL || this == LOW_VOWEL;
    }

    public boolean isObstruent() {
        return this == STOP || this == FRICATIVE || this == AFFRICATE || this == SIBILANT;
    }

    public static Manner fromKey(String key) {
        if (key != null) {
            for (Manner m : values()) {
                if (m.key.equals(key) || m.name().equals(key.toUpperCase(Locale.ROOT))) return m;
            }
        }
        throw new ConfigurationException("unknown manner of articulation: " + key);
    }
}
