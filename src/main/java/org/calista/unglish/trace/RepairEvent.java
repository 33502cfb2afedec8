package org.calista.unglish.trace;

/** A phoneme removed or replaced by a repair pass. */
public final class RepairEvent {
    public final String pass;
    public final int syllableIndex;
    public final String sound;
    public final String detail;

    public RepairEvent(String pass, int syllableIndex, String sound, String detail) {
        this.pass = pass;
        this.syllableIndex = syllableIndex;
        this.sound = sound;
        this.detail = detail;
    }

    @Override
    public String toString() {
        return pass + "[" + syllableIndex + "] " + sound + ": " + detail;
    }
}
