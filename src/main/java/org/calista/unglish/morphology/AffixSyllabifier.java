package org.calista.unglish.morphology;

import org.calista.unglish.language.LanguageConfig;
import org.calista.unglish.language.Phoneme;
import org.calista.unglish.word.Syllable;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an affix's phoneme sequence into syllables around its vowels.
 *
 * <p>Consonants before the first vowel form the onset, consonants after a vowel go to the coda. When another
 * vowel follows, the last of those consonants moves over to open the next syllable (a-ble, i-ty). Sounds
 * missing from the inventory become vowel-like placeholders.</p>
 */
public final class AffixSyllabifier {

    private AffixSyllabifier() {
    }

    public static List<Phoneme> resolve(LanguageConfig lang, List<String> sounds) {
        List<Phoneme> out = new ArrayList<>(sounds.size());
        for (String sound : sounds) {
            Phoneme p = lang.phoneme(sound);
            out.add(p != null ? p : Phoneme.placeholder(sound));
        }
        return out;
    }

    /**
     * @return syllables in order; a sequence without any vowel yields one syllable with an empty nucleus,
     * which callers must merge into a neighbour
     */
    public static List<Syllable> syllabify(List<Phoneme> phonemes) {
        List<Syllable> out = new ArrayList<>();
        if (phonemes.isEmpty()) return out;

        Syllable current = new Syllable();
        for (Phoneme p : phonemes) {
            if (p.isVowel()) {
                if (!current.nucleus().isEmpty()) {
                    Syllable next = new Syllable();
                    List<Phoneme> coda = current.coda();
                    if (!coda.isEmpty()) next.onset().add(coda.remove(coda.size() - 1));
                    out.add(current);
                    current = next;
                }
                current.nucleus().add(p);
            } else if (current.nucleus().isEmpty()) {
                current.onset().add(p);
            } else {
                current.coda().add(p);
            }
        }
        out.add(current);
        return out;
    }
}
