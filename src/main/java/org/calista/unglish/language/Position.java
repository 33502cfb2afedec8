package org.calista.unglish.language;

/** Slot of a phoneme inside a syllable. */
public enum Position {
    ONSET,
    NUCLEUS,
    CODA
}
