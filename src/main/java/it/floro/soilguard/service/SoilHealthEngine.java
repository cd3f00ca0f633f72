package it.floro.soilguard.service;

import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.IngestResult;
import it.floro.soilguard.domain.RawSensorSample;
import it.floro.soilguard.domain.Recommendation;
import it.floro.soilguard.domain.SensorReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Punto di ingresso unico del motore: lettura grezza → (punteggio, raccomandazione).
 *
 * Pipeline:
 * 1. ReadingNormalizer: validazione e forma canonica
 * 2. DeficiencyClassifier: esito per parametro rispetto alla fase corrente
 * 3. HealthScorer e RecommendationEngine: consumano entrambi gli esiti, indipendentemente
 * 4. HistoryTracker: registra il record
 *
 * I passi 2-4 avvengono sotto il monitor del campo: una lettura rifiutata non lascia
 * tracce nello storico e il chiamante riceve o una coppia completa o un errore categorizzato.
 */
@Service
public class SoilHealthEngine {

    private static final Logger logger = LoggerFactory.getLogger(SoilHealthEngine.class);

    private final ReadingNormalizer normalizer;
    private final DeficiencyClassifier classifier;
    private final HealthScorer scorer;
    private final RecommendationEngine recommendations;
    private final HistoryTracker history;
    private final GrowthStageService stages;

    public SoilHealthEngine(ReadingNormalizer normalizer,
                            DeficiencyClassifier classifier,
                            HealthScorer scorer,
                            RecommendationEngine recommendations,
                            HistoryTracker history,
                            GrowthStageService stages) {
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.scorer = scorer;
        this.recommendations = recommendations;
        this.history = history;
        this.stages = stages;
    }

    /**
     * Valida e valuta un campione grezzo.
     *
     * @throws it.floro.soilguard.error.SoilReadingRejectedException se la lettura è rifiutata
     * @throws it.floro.soilguard.error.SoilConfigurationException se la configurazione è incompleta
     */
    public IngestResult ingest(RawSensorSample sample) {
        return ingest(normalizer.normalize(sample));
    }

    /**
     * Valuta una lettura già normalizzata e la registra nello storico del campo.
     */
    public IngestResult ingest(SensorReading reading) {
        String fieldId = reading.fieldId();

        return history.withFieldLock(fieldId, () -> {
            // Rifiuta subito le letture fuori ordine: niente calcoli su dati che non verranno registrati
            history.checkOrder(fieldId, reading.timestamp());

            GrowthStage stage = stages.currentStage(fieldId);
            List<DeficiencyResult> results = classifier.classify(reading, stage);
            double score = scorer.score(results);
            HealthScoreRecord record = new HealthScoreRecord(fieldId, reading.timestamp(), score, results, stage, reading);

            // Storico recente + record corrente, in ordine cronologico
            List<HealthScoreRecord> window = new ArrayList<>(history.recent(fieldId, recommendations.historyWindow() - 1));
            window.add(record);
            Recommendation recommendation = recommendations.recommend(fieldId, reading.timestamp(), results, stage, window);

            history.record(record);

            logger.debug("Campo {} [{}]: score={} → {} {} {}", fieldId, stage, score,
                    recommendation.fertilizerType(), recommendation.quantity(), recommendation.unit());
            return new IngestResult(record, recommendation);
        });
    }

    public List<HealthScoreRecord> getHistory(String fieldId, int n) {
        return history.recent(fieldId, n);
    }

    /**
     * @return Pendenza del punteggio, vuota (indefinita) con meno di due record
     */
    public OptionalDouble getTrend(String fieldId) {
        return history.trend(fieldId);
    }
}
