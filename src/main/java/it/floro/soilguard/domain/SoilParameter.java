package it.floro.soilguard.domain;

import java.util.Locale;

/**
 * Parametri del suolo misurati dal sensore 7-in-1 e valutati dal motore.
 *
 * L'ordine di dichiarazione è significativo:
 * - è l'ordine fisso delle sequenze di DeficiencyResult (N, P, K, pH, umidità, temperatura)
 * - è la priorità di spareggio quando due carenze hanno la stessa severità (N > P > K > pH > umidità > temperatura)
 *
 * Nessuna conversione di unità: le sorgenti devono già fornire i valori nelle unità canoniche
 * indicate qui sotto.
 */
public enum SoilParameter {

    NITROGEN("nitrogen", "mg/kg"),          // Azoto disponibile
    PHOSPHORUS("phosphorus", "mg/kg"),      // Fosforo disponibile
    POTASSIUM("potassium", "mg/kg"),        // Potassio scambiabile
    PH("pH", "pH"),                         // Reazione del suolo, scala 0-14
    MOISTURE("moisture", "%"),              // Umidità volumetrica del suolo
    TEMPERATURE("temperature", "°C");       // Temperatura del suolo

    private final String key;
    private final String unit;

    SoilParameter(String key, String unit) {
        this.key = key;
        this.unit = unit;
    }

    /**
     * Nome usato nelle motivazioni delle raccomandazioni, nei payload JSON e nell'export.
     */
    public String key() {
        return key;
    }

    /**
     * Unità canonica del parametro.
     */
    public String unit() {
        return unit;
    }

    /**
     * Parsing tollerante: accetta sia il nome dell'enum ("NITROGEN") sia la chiave ("nitrogen", "ph").
     *
     * @param s Stringa da interpretare (case-insensitive)
     * @return Parametro corrispondente
     * @throws IllegalArgumentException se la stringa non corrisponde ad alcun parametro
     */
    public static SoilParameter fromString(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Parametro del suolo mancante");
        }
        String norm = s.trim();
        for (SoilParameter p : values()) {
            if (p.name().equalsIgnoreCase(norm) || p.key.equalsIgnoreCase(norm)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Parametro del suolo sconosciuto: " + s.toLowerCase(Locale.ROOT));
    }
}
