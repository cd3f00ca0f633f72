package it.floro.soilguard.simulator;

import it.floro.soilguard.config.SoilGuardProperties;
import it.floro.soilguard.domain.IngestResult;
import it.floro.soilguard.domain.RawSensorSample;
import it.floro.soilguard.error.SoilReadingRejectedException;
import it.floro.soilguard.service.SoilHealthEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Modalità simulazione: alimenta periodicamente il motore con letture sintetiche,
 * come farebbe la rete di sensori in campo.
 *
 * Attiva solo con soilguard.simulator.enabled=true; altrimenti il tick non fa nulla.
 */
@Service
public class SimulatedFeedService {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedFeedService.class);

    private final SoilHealthEngine engine;
    private final boolean enabled;
    private final ReadingSimulator simulator;

    public SimulatedFeedService(SoilHealthEngine engine, SoilGuardProperties properties) {
        this.engine = engine;
        SoilGuardProperties.Simulator cfg = properties.getSimulator();
        this.enabled = cfg.isEnabled();
        this.simulator = new ReadingSimulator(cfg.getSeed(), cfg.getFields());
        if (enabled) {
            logger.info("Simulatore attivo su {} campi ogni {} ms", cfg.getFields().size(), cfg.getIntervalMs());
        }
    }

    /**
     * Genera e invia un giro di letture, una per campo.
     *
     * @return Numero di letture accettate
     */
    @Scheduled(fixedRateString = "${soilguard.simulator.interval-ms:10000}")
    public int tick() {
        if (!enabled) return 0;

        int accepted = 0;
        for (RawSensorSample sample : simulator.next(Instant.now())) {
            try {
                IngestResult result = engine.ingest(sample);
                accepted++;
                logger.debug("Simulazione {}: score={} ({})", sample.fieldId(),
                        result.record().score(), result.recommendation().fertilizerType());
            } catch (SoilReadingRejectedException e) {
                // Una lettura rifiutata non deve fermare il giro sugli altri campi
                logger.warn("Simulazione {}: lettura rifiutata [{}] {}", sample.fieldId(), e.getCode(), e.getMessage());
            }
        }
        return accepted;
    }
}
