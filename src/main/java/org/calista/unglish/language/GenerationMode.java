package org.calista.unglish.language;

import java.util.Locale;

/**
 * Statistics profile a word is generated for. Selects syllable-count and affix-template tables.
 */
public enum GenerationMode {
    /** Dictionary-like distribution: longer words, more affixes. */
    LEXICON,
    /** Running-text distribution: short words dominate. */
    TEXT;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GenerationMode fromKey(String key) {
        if (key == null || key.isBlank()) return LEXICON;
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown generation mode: " + key, e);
        }
    }
}
