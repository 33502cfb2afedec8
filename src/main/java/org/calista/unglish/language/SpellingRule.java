package org.calista.unglish.language;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex rewrite applied to a spelled syllable or word.
 * Probability 100 makes the rule deterministic (used for cleanups).
 */
public final class SpellingRule {

    public enum Scope {
        SYLLABLE,
        WORD
    }

    public final String name;
    public final Pattern pattern;
    public final String replacement;
    public final double probability;
    public final Scope scope;

    public SpellingRule(String name, Pattern pattern, String replacement, double probability, Scope scope) {
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.replacement = Objects.requireNonNull(replacement, "replacement");
        this.probability = probability;
        this.scope = scope == null ? Scope.WORD : scope;
    }

    public boolean isDeterministic() {
        return probability >= 100.0;
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + "{" + pattern.pattern() + " -> " + replacement + ", " + probability + "%}";
    }
}
