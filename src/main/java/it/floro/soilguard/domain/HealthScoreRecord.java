package it.floro.soilguard.domain;

import java.time.Instant;
import java.util.List;

/**
 * Evento di valutazione registrato nello storico di un campo.
 *
 * Immutabile: il motore non modifica mai un record passato, ne aggiunge solo di nuovi.
 * Conserva la lettura di origine per ricostruire le serie per parametro.
 */
public record HealthScoreRecord(
        String fieldId,
        Instant timestamp,
        double score,                                       // Punteggio composito [0..100]
        List<DeficiencyResult> contributingDeficiencies,    // 6 esiti in ordine N, P, K, pH, umidità, temperatura
        GrowthStage stage,                                  // Fase in vigore al momento della lettura
        SensorReading reading
) {

    public HealthScoreRecord {
        contributingDeficiencies = List.copyOf(contributingDeficiencies);
    }

    /**
     * Giudizio sintetico per l'agricoltore, derivato dal punteggio.
     */
    public enum Verdict {
        HEALTHY,    // score >= 80
        ATTENTION,  // 50 <= score < 80
        CRITICAL    // score < 50
    }

    public Verdict verdict() {
        if (score >= 80.0) return Verdict.HEALTHY;
        if (score >= 50.0) return Verdict.ATTENTION;
        return Verdict.CRITICAL;
    }
}
