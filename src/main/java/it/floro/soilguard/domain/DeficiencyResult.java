package it.floro.soilguard.domain;

/**
 * Esito della classificazione di un singolo parametro.
 *
 * severity è la distanza normalizzata dalla banda ottimale:
 * 0 sul bordo della banda (e al suo interno), 1 sul limite critico o oltre.
 */
public record DeficiencyResult(
        SoilParameter parameter,
        DeficiencyStatus status,
        double severity,                    // Intervallo [0.0 .. 1.0]
        double value                        // Valore misurato che ha prodotto l'esito
) {

    public boolean isDeficient() {
        return status == DeficiencyStatus.DEFICIENT;
    }
}
