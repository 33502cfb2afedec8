package org.calista.unglish.language;

/** Orthographic adjustment of the root's spelling where a suffix attaches. */
public enum BoundaryRule {
    /** happy + ness -> happiness */
    Y_TO_I("yToI"),
    /** make + ing -> making */
    DROP_SILENT_E("dropSilentE"),
    /** run + ing -> running */
    DOUBLE_CONSONANT("doubleConsonant");

    private final String key;

    BoundaryRule(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static BoundaryRule fromKey(String key) {
        for (BoundaryRule r : values()) {
            if (r.key.equals(key)) return r;
        }
        throw new ConfigurationException("unknown boundary rule: " + key);
    }
}
