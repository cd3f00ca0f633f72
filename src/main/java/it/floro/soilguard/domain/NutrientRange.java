package it.floro.soilguard.domain;

import it.floro.soilguard.error.InvalidConfigurationException;

import java.util.Objects;

/**
 * Riga immutabile della tabella di riferimento: banda ottimale e limiti critici
 * di un parametro per una fase colturale.
 *
 * Invariante strutturale: criticalLow < minOptimal <= maxOptimal < criticalHigh.
 * Una riga che la viola è un errore di configurazione.
 */
public record NutrientRange(
        SoilParameter parameter,
        GrowthStage stage,
        double minOptimal,                  // Limite inferiore della banda ottimale (incluso)
        double maxOptimal,                  // Limite superiore della banda ottimale (incluso)
        double criticalLow,                 // Sotto questo valore la severità è massima
        double criticalHigh                 // Sopra questo valore la severità è massima
) {

    public NutrientRange {
        Objects.requireNonNull(parameter, "parameter");
        Objects.requireNonNull(stage, "stage");
        if (!(criticalLow < minOptimal && minOptimal <= maxOptimal && maxOptimal < criticalHigh)) {
            throw new InvalidConfigurationException(String.format(
                    "Range incoerente per %s/%s: atteso criticalLow < minOptimal <= maxOptimal < criticalHigh, trovato %s < %s <= %s < %s",
                    parameter, stage, criticalLow, minOptimal, maxOptimal, criticalHigh));
        }
    }

    /**
     * @param value Valore misurato
     * @return true se il valore cade nella banda ottimale (estremi inclusi)
     */
    public boolean isOptimal(double value) {
        return value >= minOptimal && value <= maxOptimal;
    }
}
