package it.floro.soilguard.config;

import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.SoilParameter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Superficie di configurazione del motore (prefisso "soilguard" in application.yml).
 *
 * Contiene solo dati: tabelle e costanti vengono validate e trasformate in oggetti
 * immutabili da EngineConfig all'avvio.
 */
@ConfigurationProperties(prefix = "soilguard")
public class SoilGuardProperties {

    /** Limiti fisici per parametro; i parametri non indicati usano i limiti del sensore 7-in-1. */
    private Map<SoilParameter, Bound> physicalBounds = new HashMap<>();

    /** Limiti fisici dell'umidità dell'aria (canale facoltativo). */
    private Bound humidityBounds = new Bound(0, 100);

    private Scoring scoring = new Scoring();

    /** Tabella range: una riga per coppia (parametro, fase). */
    private List<Range> ranges = new ArrayList<>();

    /** Tabella fertilizzanti, in ordine di preferenza. */
    private List<Fertilizer> fertilizers = new ArrayList<>();

    private History history = new History();

    private Recommendation recommendation = new Recommendation();

    private Simulator simulator = new Simulator();

    private Feed feed = new Feed();

    // getters/setters
    public Map<SoilParameter, Bound> getPhysicalBounds() { return physicalBounds; }
    public void setPhysicalBounds(Map<SoilParameter, Bound> physicalBounds) { this.physicalBounds = physicalBounds; }

    public Bound getHumidityBounds() { return humidityBounds; }
    public void setHumidityBounds(Bound humidityBounds) { this.humidityBounds = humidityBounds; }

    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }

    public List<Range> getRanges() { return ranges; }
    public void setRanges(List<Range> ranges) { this.ranges = ranges; }

    public List<Fertilizer> getFertilizers() { return fertilizers; }
    public void setFertilizers(List<Fertilizer> fertilizers) { this.fertilizers = fertilizers; }

    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }

    public Recommendation getRecommendation() { return recommendation; }
    public void setRecommendation(Recommendation recommendation) { this.recommendation = recommendation; }

    public Simulator getSimulator() { return simulator; }
    public void setSimulator(Simulator simulator) { this.simulator = simulator; }

    public Feed getFeed() { return feed; }
    public void setFeed(Feed feed) { this.feed = feed; }

    // ========================================================================
    // SEZIONI ANNIDATE
    // ========================================================================

    public static class Bound {
        private double min;
        private double max;

        public Bound() {
        }

        public Bound(double min, double max) {
            this.min = min;
            this.max = max;
        }

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }

        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }
    }

    public static class Scoring {
        /** Pesi per parametro; vuoto = pesatura uniforme (1/6). */
        private Map<SoilParameter, Double> weights = new HashMap<>();

        public Map<SoilParameter, Double> getWeights() { return weights; }
        public void setWeights(Map<SoilParameter, Double> weights) { this.weights = weights; }
    }

    public static class Range {
        private SoilParameter parameter;
        private GrowthStage stage;
        private double minOptimal;
        private double maxOptimal;
        private double criticalLow;
        private double criticalHigh;

        public SoilParameter getParameter() { return parameter; }
        public void setParameter(SoilParameter parameter) { this.parameter = parameter; }

        public GrowthStage getStage() { return stage; }
        public void setStage(GrowthStage stage) { this.stage = stage; }

        public double getMinOptimal() { return minOptimal; }
        public void setMinOptimal(double minOptimal) { this.minOptimal = minOptimal; }

        public double getMaxOptimal() { return maxOptimal; }
        public void setMaxOptimal(double maxOptimal) { this.maxOptimal = maxOptimal; }

        public double getCriticalLow() { return criticalLow; }
        public void setCriticalLow(double criticalLow) { this.criticalLow = criticalLow; }

        public double getCriticalHigh() { return criticalHigh; }
        public void setCriticalHigh(double criticalHigh) { this.criticalHigh = criticalHigh; }
    }

    public static class Fertilizer {
        private String name;
        private Set<SoilParameter> nutrients = new HashSet<>();
        /** Fasi ammesse; vuoto = tutte. */
        private Set<GrowthStage> stages = new HashSet<>();
        private double dosagePerSeverity;
        private String unit = "kg/ha";
        private double applicationStep = 1.0;
        private double minDose;
        private double maxDose;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public Set<SoilParameter> getNutrients() { return nutrients; }
        public void setNutrients(Set<SoilParameter> nutrients) { this.nutrients = nutrients; }

        public Set<GrowthStage> getStages() { return stages; }
        public void setStages(Set<GrowthStage> stages) { this.stages = stages; }

        public double getDosagePerSeverity() { return dosagePerSeverity; }
        public void setDosagePerSeverity(double dosagePerSeverity) { this.dosagePerSeverity = dosagePerSeverity; }

        public String getUnit() { return unit; }
        public void setUnit(String unit) { this.unit = unit; }

        public double getApplicationStep() { return applicationStep; }
        public void setApplicationStep(double applicationStep) { this.applicationStep = applicationStep; }

        public double getMinDose() { return minDose; }
        public void setMinDose(double minDose) { this.minDose = minDose; }

        public double getMaxDose() { return maxDose; }
        public void setMaxDose(double maxDose) { this.maxDose = maxDose; }
    }

    public static class History {
        /** Record conservati per campo (0 = illimitato). */
        private int maxRecordsPerField = 0;

        public int getMaxRecordsPerField() { return maxRecordsPerField; }
        public void setMaxRecordsPerField(int maxRecordsPerField) { this.maxRecordsPerField = maxRecordsPerField; }
    }

    public static class Recommendation {
        /** Record consecutivi post-impianto in calo necessari per il flag di impoverimento. */
        private int depletionMinRecords = 2;

        public int getDepletionMinRecords() { return depletionMinRecords; }
        public void setDepletionMinRecords(int depletionMinRecords) { this.depletionMinRecords = depletionMinRecords; }
    }

    public static class Simulator {
        /** Modalità simulazione: genera letture sintetiche per i campi indicati. */
        private boolean enabled = false;
        private long seed = 42L;
        private long intervalMs = 10_000L;
        private List<String> fields = new ArrayList<>(List.of("P01", "P02", "P03"));

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getSeed() { return seed; }
        public void setSeed(long seed) { this.seed = seed; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public List<String> getFields() { return fields; }
        public void setFields(List<String> fields) { this.fields = fields; }
    }

    public static class Feed {
        /** Canale del feed per parametro; i parametri non indicati usano il cablaggio standard del nodo. */
        private Map<SoilParameter, String> channels = new HashMap<>();
        /** Canale dell'umidità dell'aria; vuoto = non letto. */
        private String humidityChannel = "field7";

        public Map<SoilParameter, String> getChannels() { return channels; }
        public void setChannels(Map<SoilParameter, String> channels) { this.channels = channels; }

        public String getHumidityChannel() { return humidityChannel; }
        public void setHumidityChannel(String humidityChannel) { this.humidityChannel = humidityChannel; }
    }
}
