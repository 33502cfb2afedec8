package org.calista.unglish.language;

public enum AffixKind {
    PREFIX,
    SUFFIX
}
