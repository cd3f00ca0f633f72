package it.floro.soilguard.service;

import it.floro.soilguard.config.SoilGuardProperties;
import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.FertilizerProduct;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.OverDoseClampedWarning;
import it.floro.soilguard.domain.Recommendation;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.error.MissingFertilizerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Traduce le carenze rilevate e la fase colturale in una raccomandazione concreta
 * (prodotto + dose).
 *
 * Procedura:
 * 1. Seleziona i parametri DEFICIENT, ordinati per severità decrescente;
 *    a parità di severità vale la priorità fissa N > P > K > pH > umidità > temperatura
 * 2. Nessuna carenza → "mantieni il regime attuale" con motivazione vuota
 * 3. Cerca un composto che copra il sottoinsieme più severo (i primi k, da tutti a 2);
 *    in mancanza, ammendante singolo per la carenza più severa
 * 4. Dose = severità × dose per unità di severità, arrotondata al passo di applicazione,
 *    mai sotto la dose minima efficace né sopra la dose massima sicura (con avviso)
 * 5. Se lo storico recente mostra un calo continuo dopo l'impianto, la motivazione
 *    riporta il flag di impoverimento post-crescita
 *
 * Deterministico: stessi input producono sempre la stessa raccomandazione
 * (il timestamp arriva dalla lettura, mai dall'orologio).
 */
@Service
public class RecommendationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationEngine.class);

    /**
     * Severità decrescente, poi ordine di dichiarazione di SoilParameter (= priorità di spareggio).
     */
    private static final Comparator<DeficiencyResult> MOST_SEVERE_FIRST =
            Comparator.comparingDouble(DeficiencyResult::severity).reversed()
                    .thenComparing(DeficiencyResult::parameter);

    private final FertilizerTable fertilizers;

    /**
     * Numero minimo di record consecutivi post-impianto, in calo, per segnalare l'impoverimento.
     */
    private final int depletionMinRecords;

    @Autowired
    public RecommendationEngine(FertilizerTable fertilizers, SoilGuardProperties properties) {
        this(fertilizers, properties.getRecommendation().getDepletionMinRecords());
    }

    public RecommendationEngine(FertilizerTable fertilizers, int depletionMinRecords) {
        if (depletionMinRecords < 2) {
            throw new InvalidConfigurationException(
                    "depletion-min-records deve essere almeno 2 (un trend richiede due punti), trovato " + depletionMinRecords);
        }
        this.fertilizers = fertilizers;
        this.depletionMinRecords = depletionMinRecords;
    }

    /**
     * Quanti record recenti (quello corrente incluso) servono per valutare l'impoverimento.
     */
    public int historyWindow() {
        return depletionMinRecords;
    }

    /**
     * @param fieldId Campo valutato
     * @param timestamp Istante della lettura valutata
     * @param results Esiti del classificatore
     * @param stage Fase colturale corrente
     * @param recentHistory Record recenti in ordine cronologico; l'ultimo è quello appena valutato.
     *                      Può essere vuoto o null
     * @return Raccomandazione completa, eventualmente con avvisi di dose
     * @throws MissingFertilizerException se nessun prodotto copre la carenza principale nella fase
     */
    public Recommendation recommend(String fieldId,
                                    Instant timestamp,
                                    List<DeficiencyResult> results,
                                    GrowthStage stage,
                                    List<HealthScoreRecord> recentHistory) {

        // ===== STEP 1: CARENZE ORDINATE =====
        List<DeficiencyResult> deficient = results.stream()
                .filter(DeficiencyResult::isDeficient)
                .sorted(MOST_SEVERE_FIRST)
                .toList();

        // ===== STEP 2: NESSUNA CARENZA =====
        if (deficient.isEmpty()) {
            return Recommendation.maintain(fieldId, timestamp);
        }

        // ===== STEP 3: SCELTA DEL PRODOTTO =====
        Selection selection = select(deficient, stage);
        FertilizerProduct product = selection.product();

        // ===== STEP 4: DOSE =====
        double severity = selection.covered().get(0).severity();
        double raw = severity * product.dosagePerSeverity();
        double quantity = Math.max(product.minDose(), roundToStep(raw, product.applicationStep()));

        List<OverDoseClampedWarning> warnings = new ArrayList<>();
        if (quantity > product.maxDose()) {
            OverDoseClampedWarning w = new OverDoseClampedWarning(product.name(), quantity, product.maxDose(), product.unit());
            logger.warn("Campo {}: {}", fieldId, w.message());
            warnings.add(w);
            quantity = product.maxDose();
        }

        // ===== STEP 5: MOTIVAZIONE =====
        List<String> rationale = new ArrayList<>();
        for (DeficiencyResult r : selection.covered()) {
            rationale.add(r.parameter().key());
        }
        if (depletionDetected(recentHistory)) {
            rationale.add(Recommendation.DEPLETION_FLAG);
        }

        return new Recommendation(fieldId, timestamp, product.name(), quantity, product.unit(), rationale, warnings);
    }

    /**
     * Vero quando gli ultimi {@code depletionMinRecords} record sono tutti post-impianto
     * e il punteggio cala strettamente da ciascuno al successivo.
     */
    boolean depletionDetected(List<HealthScoreRecord> recentHistory) {
        if (recentHistory == null || recentHistory.size() < depletionMinRecords) {
            return false;
        }
        List<HealthScoreRecord> window =
                recentHistory.subList(recentHistory.size() - depletionMinRecords, recentHistory.size());

        for (HealthScoreRecord r : window) {
            if (!r.stage().isPostPlanting()) return false;
        }
        for (int i = 1; i < window.size(); i++) {
            if (!(window.get(i).score() < window.get(i - 1).score())) return false;
        }
        return true;
    }

    // ========== METODI HELPER PRIVATI ==========

    private record Selection(FertilizerProduct product, List<DeficiencyResult> covered) {}

    private Selection select(List<DeficiencyResult> deficient, GrowthStage stage) {
        Set<SoilParameter> allowed = paramsOf(deficient);

        // Composto sul sottoinsieme più severo, dal più ampio al più piccolo
        for (int k = deficient.size(); k >= 2; k--) {
            Set<SoilParameter> required = paramsOf(deficient.subList(0, k));
            Optional<FertilizerProduct> compound = fertilizers.findCompound(required, allowed, stage);
            if (compound.isPresent()) {
                FertilizerProduct p = compound.get();
                List<DeficiencyResult> covered = deficient.stream()
                        .filter(r -> p.nutrients().contains(r.parameter()))
                        .toList();
                return new Selection(p, covered);
            }
        }

        // Ammendante singolo per la carenza principale
        DeficiencyResult top = deficient.get(0);
        FertilizerProduct single = fertilizers.findSingle(top.parameter(), stage)
                .orElseThrow(() -> new MissingFertilizerException(top.parameter(), stage));
        return new Selection(single, List.of(top));
    }

    private static Set<SoilParameter> paramsOf(List<DeficiencyResult> results) {
        Set<SoilParameter> s = EnumSet.noneOf(SoilParameter.class);
        for (DeficiencyResult r : results) {
            s.add(r.parameter());
        }
        return s;
    }

    /**
     * Arrotonda al multiplo più vicino del passo di applicazione (es. 5 kg/ha).
     */
    private static double roundToStep(double value, double step) {
        return Math.round(value / step) * step;
    }
}
