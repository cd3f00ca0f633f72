package it.floro.soilguard.error;

/**
 * Configurazione malformata: pesi che non sommano a 1, range incoerenti, dosi non valide.
 */
public class InvalidConfigurationException extends SoilConfigurationException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
