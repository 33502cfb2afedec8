package org.calista.unglish.trace;

import java.util.List;

/** Syllables before and after one pipeline stage, as plain strings ("ˈst/ɪ/ŋ"). */
public final class StageSnapshot {
    public final String name;
    public final List<String> before;
    public final List<String> after;

    public StageSnapshot(String name, List<String> before, List<String> after) {
        this.name = name;
        this.before = List.copyOf(before);
        this.after = List.copyOf(after);
    }

    public boolean changed() {
        return !before.equals(after);
    }

    @Override
    public String toString() {
        return name + ": " + before + " -> " + after;
    }
}
