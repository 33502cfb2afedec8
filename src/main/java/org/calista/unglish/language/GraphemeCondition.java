package org.calista.unglish.language;

import java.util.EnumSet;
import java.util.Set;

/**
 * Contextual restriction on a spelling: allowed word positions and forbidden neighbouring sounds.
 */
public final class GraphemeCondition {

    public static final GraphemeCondition NONE = new GraphemeCondition(EnumSet.allOf(WordPosition.class), Set.of(), Set.of());

    public final Set<WordPosition> wordPositions;
    public final Set<String> notLeftContext;
    public final Set<String> notRightContext;

    public GraphemeCondition(Set<WordPosition> wordPositions, Set<String> notLeftContext, Set<String> notRightContext) {
        this.wordPositions = wordPositions.isEmpty() ? Set.copyOf(EnumSet.allOf(WordPosition.class)) : Set.copyOf(wordPositions);
        this.notLeftContext = Set.copyOf(notLeftContext);
        this.notRightContext = Set.copyOf(notRightContext);
    }

    /**
     * @param left  sound of the previous phoneme in the word, or null at the word start
     * @param right sound of the next phoneme in the word, or null at the word end
     */
    public boolean matches(WordPosition position, String left, String right) {
        if (!wordPositions.contains(position)) return false;
        if (left != null && notLeftContext.contains(left)) return false;
        return right == null || !notRightContext.contains(right);
    }

    @Override
    public String toString() {
        return "GraphemeCondition{" + wordPositions + ", notLeft=" + notLeftContext + ", notRight=" + notRightContext + '}';
    }
}
