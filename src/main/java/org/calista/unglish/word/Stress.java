package org.calista.unglish.word;

/** Stress level of a syllable and its pronunciation mark. */
public enum Stress {
    NONE(""),
    PRIMARY("ˈ"),
    SECONDARY("ˌ");

    private final String mark;

    Stress(String mark) {
        this.mark = mark;
    }

    public String mark() {
        return mark;
    }

    public boolean isStressed() {
        return this != NONE;
    }
}
