package it.floro.soilguard.domain;

/**
 * Fasi del ciclo colturale del pepe nero.
 *
 * L'ordine di dichiarazione è l'ordine cronologico: una fase può solo avanzare,
 * mai regredire (vedi GrowthStageService). La fase determina quali range ottimali si applicano.
 */
public enum GrowthStage {
    PRE_PLANTING,   // Verifica di base prima dell'impianto
    VEGETATIVE,     // Crescita vegetativa
    FLOWERING,      // Fioritura e allegagione
    MATURITY;       // Maturazione delle bacche

    /**
     * @return true per tutte le fasi successive all'impianto
     */
    public boolean isPostPlanting() {
        return this != PRE_PLANTING;
    }

    /**
     * @param other Fase di confronto
     * @return true se questa fase precede strettamente {@code other}
     */
    public boolean isBefore(GrowthStage other) {
        return compareTo(other) < 0;
    }
}
