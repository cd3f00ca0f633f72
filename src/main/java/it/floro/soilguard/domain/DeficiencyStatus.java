package it.floro.soilguard.domain;

/**
 * Stato di un parametro rispetto alla sua banda ottimale.
 */
public enum DeficiencyStatus {
    DEFICIENT,  // Sotto minOptimal
    OPTIMAL,    // Dentro [minOptimal, maxOptimal]
    EXCESS      // Sopra maxOptimal
}
