package it.floro.soilguard.web;

import com.fasterxml.jackson.databind.JsonNode;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.RawSensorSample;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.service.FeedEntryMapper;
import it.floro.soilguard.service.GrowthStageService;
import it.floro.soilguard.service.HistoryTracker;
import it.floro.soilguard.service.SoilHealthEngine;
import it.floro.soilguard.web.dto.IngestResponse;
import it.floro.soilguard.web.dto.ReadingRequest;
import it.floro.soilguard.web.dto.StageRequest;
import it.floro.soilguard.web.dto.StageResponse;
import it.floro.soilguard.web.dto.TrendResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Controller REST che espone il motore di salute del suolo ai collaboratori esterni
 * (gateway dei sensori, app dell'agricoltore, sistemi di notifica).
 *
 * Mapping base: /api/fields
 *
 * Flusso tipico:
 * 1. L'operatore imposta la fase con PUT /api/fields/{fieldId}/stage
 * 2. Il gateway invia le letture con POST /api/fields/{fieldId}/readings
 * 3. L'app consulta storico e trend con GET .../history e GET .../trend
 *
 * Le letture rifiutate diventano 422 con codice di categoria (vedi SoilHealthExceptionHandler).
 */
@RestController
@RequestMapping("/api/fields")
public class SoilHealthController {

    private static final int DEFAULT_HISTORY = 30;

    private final SoilHealthEngine engine;
    private final HistoryTracker history;
    private final GrowthStageService stages;
    private final FeedEntryMapper feedMapper;
    private final FeedEntryMapper.FieldMapping feedMapping;

    public SoilHealthController(SoilHealthEngine engine,
                                HistoryTracker history,
                                GrowthStageService stages,
                                FeedEntryMapper feedMapper,
                                FeedEntryMapper.FieldMapping feedMapping) {
        this.engine = engine;
        this.history = history;
        this.stages = stages;
        this.feedMapper = feedMapper;
        this.feedMapping = feedMapping;
    }

    /**
     * Campi con almeno una lettura registrata.
     */
    @GetMapping
    public List<String> fields() {
        return history.fieldIds();
    }

    // ========================================================================
    // INGESTIONE
    // ========================================================================

    /**
     * Valuta e registra una lettura.
     *
     * Richiesta (JSON):
     * {"timestamp":"2025-06-01T06:00:00Z","nitrogen":90,"phosphorus":30,"potassium":200,
     *  "ph":6.0,"moisture":60,"temperature":27,"humidity":75}
     */
    @PostMapping("/{fieldId}/readings")
    public IngestResponse ingest(@PathVariable String fieldId, @RequestBody ReadingRequest request) {
        return IngestResponse.from(engine.ingest(request.toSample(fieldId)));
    }

    /**
     * Valuta l'ultima voce di un feed di canale IoT (created_at + field1..field8),
     * con il cablaggio dei canali configurato in soilguard.feed.
     *
     * @return 200 con la valutazione, 204 se il canale non ha ancora dati
     */
    @PostMapping("/{fieldId}/feed")
    public ResponseEntity<IngestResponse> ingestFeed(@PathVariable String fieldId, @RequestBody JsonNode feed) {
        Optional<RawSensorSample> latest = feedMapper.mapLatest(fieldId, feed, feedMapping);
        return latest
                .map(sample -> ResponseEntity.ok(IngestResponse.from(engine.ingest(sample))))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // ========================================================================
    // STORICO E TREND
    // ========================================================================

    @GetMapping("/{fieldId}/history")
    public List<HealthScoreRecord> history(@PathVariable String fieldId,
                                           @RequestParam(defaultValue = "" + DEFAULT_HISTORY) int n) {
        return engine.getHistory(fieldId, n);
    }

    @GetMapping("/{fieldId}/trend")
    public TrendResponse trend(@PathVariable String fieldId) {
        return TrendResponse.of(fieldId, engine.getTrend(fieldId), history.size(fieldId),
                history.lastTimestamp(fieldId).orElse(null));
    }

    /**
     * Serie grezza di un parametro (es. /series/nitrogen), per i grafici in tempo reale.
     */
    @GetMapping("/{fieldId}/series/{parameter}")
    public List<Double> series(@PathVariable String fieldId,
                               @PathVariable String parameter,
                               @RequestParam(defaultValue = "" + DEFAULT_HISTORY) int n) {
        return history.parameterSeries(fieldId, SoilParameter.fromString(parameter), n);
    }

    // ========================================================================
    // FASE COLTURALE
    // ========================================================================

    @GetMapping("/{fieldId}/stage")
    public StageResponse stage(@PathVariable String fieldId) {
        return new StageResponse(fieldId, stages.currentStage(fieldId));
    }

    @PutMapping("/{fieldId}/stage")
    public StageResponse advanceStage(@PathVariable String fieldId, @RequestBody StageRequest request) {
        if (request.stage() == null) {
            throw new IllegalArgumentException("Fase mancante");
        }
        GrowthStage stage = stages.advance(fieldId, request.stage());
        return new StageResponse(fieldId, stage);
    }
}
