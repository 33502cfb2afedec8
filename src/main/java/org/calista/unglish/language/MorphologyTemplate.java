package org.calista.unglish.language;

/** Which affix slots a word fills. */
public enum MorphologyTemplate {
    BARE("bare", false, false),
    SUFFIXED("suffixed", false, true),
    PREFIXED("prefixed", true, false),
    BOTH("both", true, true);

    private final String key;
    private final boolean prefix;
    private final boolean suffix;

    MorphologyTemplate(String key, boolean prefix, boolean suffix) {
        this.key = key;
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public String key() {
        return key;
    }

    public boolean hasPrefix() {
        return prefix;
    }

    public boolean hasSuffix() {
        return suffix;
    }

    public static MorphologyTemplate fromKey(String key) {
        for (MorphologyTemplate t : values()) {
            if (t.key.equals(key)) return t;
        }
        throw new ConfigurationException("unknown morphology template: " + key);
    }
}
