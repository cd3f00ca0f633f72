package it.floro.soilguard.error;

import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.SoilParameter;

/**
 * Nessun prodotto in tabella fertilizzanti copre il parametro carente nella fase indicata.
 */
public class MissingFertilizerException extends SoilConfigurationException {

    public MissingFertilizerException(SoilParameter parameter, GrowthStage stage) {
        super("Nessun fertilizzante configurato per " + parameter + " in fase " + stage);
    }
}
