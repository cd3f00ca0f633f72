package it.floro.soilguard.web.dto;

import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.IngestResult;
import it.floro.soilguard.domain.Recommendation;

import java.time.Instant;
import java.util.List;

/**
 * Risposta dell'endpoint di ingestione: punteggio, giudizio e raccomandazione
 * della lettura appena registrata.
 */
public record IngestResponse(
        String fieldId,
        Instant timestamp,
        GrowthStage stage,
        double score,                               // Punteggio [0..100]
        HealthScoreRecord.Verdict verdict,          // HEALTHY / ATTENTION / CRITICAL
        List<DeficiencyResult> deficiencies,        // Sei esiti in ordine fisso
        Recommendation recommendation
) {

    public static IngestResponse from(IngestResult result) {
        HealthScoreRecord r = result.record();
        return new IngestResponse(
                r.fieldId(),
                r.timestamp(),
                r.stage(),
                r.score(),
                r.verdict(),
                r.contributingDeficiencies(),
                result.recommendation()
        );
    }
}
