package it.floro.soilguard.domain;

import it.floro.soilguard.error.InvalidConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Riga della tabella fertilizzanti: prodotto, nutrienti che copre, fasi in cui è ammesso
 * e parametri di dosaggio.
 *
 * Un prodotto con più nutrienti è un composto; con uno solo è un ammendante singolo.
 */
public record FertilizerProduct(
        String name,
        Set<SoilParameter> nutrients,       // Parametri corretti dal prodotto
        Set<GrowthStage> stages,            // Fasi ammesse (vuoto = tutte)
        double dosagePerSeverity,           // Dose per unità di severità
        String unit,                        // Unità della dose (es. kg/ha)
        double applicationStep,             // Passo di arrotondamento della dose
        double minDose,                     // Dose minima efficace
        double maxDose                      // Dose massima sicura
) {

    public FertilizerProduct {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Fertilizzante senza nome");
        }
        if (nutrients == null || nutrients.isEmpty()) {
            throw new InvalidConfigurationException("Fertilizzante " + name + " senza nutrienti");
        }
        if (!(dosagePerSeverity > 0) || !(applicationStep > 0)) {
            throw new InvalidConfigurationException("Fertilizzante " + name + ": dosagePerSeverity e applicationStep devono essere > 0");
        }
        if (!(minDose > 0) || maxDose < minDose) {
            throw new InvalidConfigurationException(String.format(
                    "Fertilizzante %s: dosi non valide (min=%s, max=%s)", name, minDose, maxDose));
        }
        // EnumSet mantiene l'ordine di dichiarazione: iterazione deterministica
        nutrients = Collections.unmodifiableSet(EnumSet.copyOf(nutrients));
        stages = stages == null || stages.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(GrowthStage.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(stages));
        unit = unit == null ? "" : unit;
    }

    public boolean isCompound() {
        return nutrients.size() > 1;
    }

    public boolean appliesTo(GrowthStage stage) {
        return stages.isEmpty() || stages.contains(stage);
    }
}
