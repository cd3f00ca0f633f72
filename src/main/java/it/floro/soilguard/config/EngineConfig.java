package it.floro.soilguard.config;

import it.floro.soilguard.domain.FertilizerProduct;
import it.floro.soilguard.domain.NutrientRange;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.service.FeedEntryMapper;
import it.floro.soilguard.service.FertilizerTable;
import it.floro.soilguard.service.NutrientRangeTable;
import it.floro.soilguard.service.PhysicalBounds;
import it.floro.soilguard.service.ScoringWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Costruisce le tabelle immutabili del motore a partire da SoilGuardProperties.
 *
 * Ogni errore di configurazione (range incoerenti o mancanti, pesi che non sommano a 1,
 * fertilizzanti senza copertura) fa fallire l'avvio del contesto: il motore non deve
 * mai produrre un punteggio con tabelle incomplete.
 */
@Configuration
@EnableConfigurationProperties(SoilGuardProperties.class)
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public PhysicalBounds physicalBounds(SoilGuardProperties properties) {
        PhysicalBounds defaults = PhysicalBounds.defaults();
        Map<SoilParameter, PhysicalBounds.Bound> merged = new EnumMap<>(SoilParameter.class);
        for (SoilParameter p : SoilParameter.values()) {
            SoilGuardProperties.Bound configured = properties.getPhysicalBounds().get(p);
            merged.put(p, configured == null ? defaults.of(p) : new PhysicalBounds.Bound(configured.getMin(), configured.getMax()));
        }
        SoilGuardProperties.Bound h = properties.getHumidityBounds();
        PhysicalBounds.Bound humidity = h == null ? defaults.humidity() : new PhysicalBounds.Bound(h.getMin(), h.getMax());
        return new PhysicalBounds(merged, humidity);
    }

    @Bean
    public NutrientRangeTable nutrientRangeTable(SoilGuardProperties properties) {
        List<NutrientRange> rows = properties.getRanges().stream()
                .map(EngineConfig::toRange)
                .toList();
        NutrientRangeTable table = new NutrientRangeTable(rows);
        List<String> missing = table.missingEntries();
        if (!missing.isEmpty()) {
            logger.error("Tabella range incompleta, coppie fase/parametro mancanti: {}", missing);
        }
        table.requireComplete();
        logger.info("Tabella range caricata: {} righe", table.size());
        return table;
    }

    @Bean
    public ScoringWeights scoringWeights(SoilGuardProperties properties) {
        Map<SoilParameter, Double> configured = properties.getScoring().getWeights();
        if (configured == null || configured.isEmpty()) {
            logger.info("Pesi di scoring non configurati: pesatura uniforme");
            return ScoringWeights.equal();
        }
        ScoringWeights weights = new ScoringWeights(configured);
        logger.info("Pesi di scoring: {}", weights.asMap());
        return weights;
    }

    @Bean
    public FertilizerTable fertilizerTable(SoilGuardProperties properties) {
        List<FertilizerProduct> products = properties.getFertilizers().stream()
                .map(EngineConfig::toProduct)
                .toList();
        FertilizerTable table = new FertilizerTable(products);
        table.requireSingleCoverage();
        logger.info("Tabella fertilizzanti caricata: {} prodotti", products.size());
        return table;
    }

    /**
     * Cablaggio dei canali del feed IoT: i canali configurati sostituiscono quelli standard.
     */
    @Bean
    public FeedEntryMapper.FieldMapping feedFieldMapping(SoilGuardProperties properties) {
        Map<SoilParameter, String> channels = new EnumMap<>(FeedEntryMapper.FieldMapping.defaults().channels());
        SoilGuardProperties.Feed feed = properties.getFeed();
        if (feed.getChannels() != null) {
            channels.putAll(feed.getChannels());
        }
        FeedEntryMapper.FieldMapping mapping = new FeedEntryMapper.FieldMapping(channels, feed.getHumidityChannel());
        logger.info("Canali del feed: {} (umidità aria: {})", mapping.channels(), mapping.humidityChannel());
        return mapping;
    }

    // ========== CONVERSIONI ==========

    private static NutrientRange toRange(SoilGuardProperties.Range r) {
        if (r.getParameter() == null || r.getStage() == null) {
            throw new InvalidConfigurationException("Riga range senza parametro o fase");
        }
        return new NutrientRange(r.getParameter(), r.getStage(),
                r.getMinOptimal(), r.getMaxOptimal(), r.getCriticalLow(), r.getCriticalHigh());
    }

    private static FertilizerProduct toProduct(SoilGuardProperties.Fertilizer f) {
        return new FertilizerProduct(f.getName(), f.getNutrients(), f.getStages(),
                f.getDosagePerSeverity(), f.getUnit(), f.getApplicationStep(), f.getMinDose(), f.getMaxDose());
    }
}
