package it.floro.soilguard.error;

import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.SoilParameter;

/**
 * Nessuna riga della tabella range per la coppia (parametro, fase).
 */
public class MissingRangeException extends SoilConfigurationException {

    public MissingRangeException(SoilParameter parameter, GrowthStage stage) {
        super("Range nutritivo non configurato per " + parameter + " in fase " + stage);
    }
}
