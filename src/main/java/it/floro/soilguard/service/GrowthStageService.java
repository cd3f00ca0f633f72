package it.floro.soilguard.service;

import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.error.StageRegressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro della fase colturale di ciascun campo.
 *
 * La fase è sempre fornita dall'esterno (operatore o calendario colturale) e non viene
 * mai dedotta dalle letture. Le transizioni sono monotone: avanti o ferma, mai indietro.
 * Un campo mai registrato è in PRE_PLANTING.
 */
@Service
public class GrowthStageService {

    private static final Logger logger = LoggerFactory.getLogger(GrowthStageService.class);

    private final Map<String, GrowthStage> stages = new ConcurrentHashMap<>();

    public GrowthStage currentStage(String fieldId) {
        return stages.getOrDefault(fieldId, GrowthStage.PRE_PLANTING);
    }

    /**
     * Porta il campo alla fase indicata.
     *
     * @param fieldId Campo
     * @param stage Nuova fase (uguale o successiva a quella corrente)
     * @return Fase in vigore dopo la chiamata
     * @throws StageRegressionException se la fase richiesta precede quella corrente
     */
    public GrowthStage advance(String fieldId, GrowthStage stage) {
        GrowthStage updated = stages.compute(fieldId, (id, current) -> {
            GrowthStage from = current == null ? GrowthStage.PRE_PLANTING : current;
            if (stage.isBefore(from)) {
                throw new StageRegressionException(id, from, stage);
            }
            if (stage != from) {
                logger.info("Campo {}: fase {} → {}", id, from, stage);
            }
            return stage;
        });
        return updated;
    }
}
