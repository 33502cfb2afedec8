package org.calista.unglish.trace;

/** A sampling decision outside spelling: syllable count, cluster lengths, stress placement, affixes. */
public final class Decision {
    public final String stage;
    public final String what;
    public final String value;

    public Decision(String stage, String what, String value) {
        this.stage = stage;
        this.what = what;
        this.value = value;
    }

    @Override
    public String toString() {
        return stage + "." + what + "=" + value;
    }
}
