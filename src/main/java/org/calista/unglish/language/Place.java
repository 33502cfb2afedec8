package org.calista.unglish.language;

import java.util.Locale;

/**
 * Place of articulation. Vowels use front/central/back.
 */
public enum Place {
    FRONT("front"),
    CENTRAL("central"),
    BACK("back"),
    BILABIAL("bilabial"),
    LABIODENTAL("labiodental"),
    DENTAL("dental"),
    ALVEOLAR("alveolar"),
    POSTALVEOLAR("postalveolar"),
    PALATAL("palatal"),
    VELAR("velar"),
    LABIAL_VELAR("labial-velar"),
    GLOTTAL("glottal");

    private final String key;

    Place(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Place fromKey(String key) {
        if (key != null) {
            for (Place p : values()) {
                if (p.key.equals(key) || p.name().equals(key.toUpperCase(Locale.ROOT))) return p;
            }
        }
        throw new ConfigurationException("unknown place of articulation: " + key);
    }
}
