package it.floro.soilguard.error;

import it.floro.soilguard.domain.GrowthStage;

/**
 * Tentativo di riportare un campo a una fase colturale precedente.
 */
public class StageRegressionException extends SoilReadingRejectedException {

    public StageRegressionException(String fieldId, GrowthStage current, GrowthStage requested) {
        super("STAGE_REGRESSION", String.format(
                "Il campo %s è in fase %s: impossibile tornare a %s", fieldId, current, requested));
    }
}
