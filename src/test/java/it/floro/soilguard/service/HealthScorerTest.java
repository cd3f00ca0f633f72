package it.floro.soilguard.service;

import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.DeficiencyStatus;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class HealthScorerTest {

    private final HealthScorer scorer = new HealthScorer(ScoringWeights.equal());

    private static List<DeficiencyResult> allWithSeverity(double severity) {
        List<DeficiencyResult> out = new ArrayList<>();
        for (SoilParameter p : SoilParameter.values()) {
            DeficiencyStatus status = severity == 0 ? DeficiencyStatus.OPTIMAL : DeficiencyStatus.DEFICIENT;
            out.add(new DeficiencyResult(p, status, severity, 0.0));
        }
        return out;
    }

    @Test
    void allOptimalScoresOneHundred() {
        assertThat(scorer.score(allWithSeverity(0.0))).isEqualTo(100.0);
    }

    @Test
    void allCriticalWithEqualWeightsScoresZero() {
        assertThat(scorer.score(allWithSeverity(1.0))).isEqualTo(0.0);
    }

    @Test
    void singleDeficiencyLowersScoreByItsWeight() {
        List<DeficiencyResult> results = new ArrayList<>(allWithSeverity(0.0));
        results.set(0, new DeficiencyResult(SoilParameter.NITROGEN, DeficiencyStatus.DEFICIENT, 0.5, 100.0));

        // 100 * (1 - 0.5 / 6)
        assertThat(scorer.score(results)).isEqualTo(91.67);
    }

    @Test
    void scoreIsRoundedToHundredths() {
        List<DeficiencyResult> results = new ArrayList<>(allWithSeverity(0.0));
        results.set(0, new DeficiencyResult(SoilParameter.NITROGEN, DeficiencyStatus.DEFICIENT, 0.0001, 139.99));

        // 100 * (1 - 0.0001 / 6) = 99.9983...
        assertThat(scorer.score(results)).isEqualTo(100.0);
    }

    @Test
    void customWeightsAreApplied() {
        Map<SoilParameter, Double> w = new EnumMap<>(SoilParameter.class);
        w.put(SoilParameter.NITROGEN, 0.5);
        w.put(SoilParameter.PHOSPHORUS, 0.1);
        w.put(SoilParameter.POTASSIUM, 0.1);
        w.put(SoilParameter.PH, 0.1);
        w.put(SoilParameter.MOISTURE, 0.1);
        w.put(SoilParameter.TEMPERATURE, 0.1);
        HealthScorer weighted = new HealthScorer(new ScoringWeights(w));

        List<DeficiencyResult> results = new ArrayList<>(allWithSeverity(0.0));
        results.set(0, new DeficiencyResult(SoilParameter.NITROGEN, DeficiencyStatus.DEFICIENT, 1.0, 10.0));

        assertThat(weighted.score(results)).isEqualTo(50.0);
    }

    @Test
    void scoreAlwaysStaysInRange() {
        Random rnd = new Random(7);
        for (int i = 0; i < 500; i++) {
            List<DeficiencyResult> results = new ArrayList<>();
            for (SoilParameter p : SoilParameter.values()) {
                results.add(new DeficiencyResult(p, DeficiencyStatus.EXCESS, rnd.nextDouble(), 0.0));
            }
            assertThat(scorer.score(results)).isBetween(0.0, 100.0);
        }
    }

    @Test
    void weightsMustSumToOne() {
        Map<SoilParameter, Double> w = new EnumMap<>(SoilParameter.class);
        for (SoilParameter p : SoilParameter.values()) {
            w.put(p, 0.2);
        }
        assertThatThrownBy(() -> new ScoringWeights(w))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("somma");
    }

    @Test
    void everyParameterNeedsANonNegativeWeight() {
        Map<SoilParameter, Double> missing = new EnumMap<>(ScoringWeights.equal().asMap());
        missing.remove(SoilParameter.TEMPERATURE);
        assertThatThrownBy(() -> new ScoringWeights(missing)).isInstanceOf(InvalidConfigurationException.class);

        Map<SoilParameter, Double> negative = new EnumMap<>(SoilParameter.class);
        negative.put(SoilParameter.NITROGEN, 1.2);
        negative.put(SoilParameter.PHOSPHORUS, -0.2);
        negative.put(SoilParameter.POTASSIUM, 0.0);
        negative.put(SoilParameter.PH, 0.0);
        negative.put(SoilParameter.MOISTURE, 0.0);
        negative.put(SoilParameter.TEMPERATURE, 0.0);
        assertThatThrownBy(() -> new ScoringWeights(negative)).isInstanceOf(InvalidConfigurationException.class);
    }
}
