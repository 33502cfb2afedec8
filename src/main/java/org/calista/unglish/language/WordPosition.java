package org.calista.unglish.language;

import java.util.Locale;

/** Where a phoneme sits in the whole word. */
public enum WordPosition {
    INITIAL,
    MEDIAL,
    FINAL;

    public static WordPosition of(boolean startOfWord, boolean endOfWord) {
        if (startOfWord) return INITIAL;
        if (endOfWord) return FINAL;
        return MEDIAL;
    }

    public static WordPosition fromKey(String key) {
        if (key != null) {
            try {
                return valueOf(key.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("unknown word position: " + key, e);
            }
        }
        throw new ConfigurationException("word position must not be null");
    }
}
