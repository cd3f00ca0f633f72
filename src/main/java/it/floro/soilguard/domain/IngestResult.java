package it.floro.soilguard.domain;

/**
 * Esito completo di un'ingestione: il record registrato e la raccomandazione associata.
 * Non esiste un esito parziale.
 */
public record IngestResult(
        HealthScoreRecord record,
        Recommendation recommendation
) {}
