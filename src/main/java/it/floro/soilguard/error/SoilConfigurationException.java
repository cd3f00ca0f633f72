package it.floro.soilguard.error;

/**
 * Radice degli errori di configurazione (tabelle range, pesi, dosaggi).
 *
 * Sono fatali: il motore rifiuta di operare piuttosto che produrre un punteggio fuorviante.
 * Non vanno ritentati.
 */
public class SoilConfigurationException extends RuntimeException {

    public SoilConfigurationException(String message) {
        super(message);
    }
}
