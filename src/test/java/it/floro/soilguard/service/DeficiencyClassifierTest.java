package it.floro.soilguard.service;

import it.floro.soilguard.SoilFixtures;
import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.DeficiencyStatus;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.NutrientRange;
import it.floro.soilguard.domain.SensorReading;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.error.MissingRangeException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DeficiencyClassifierTest {

    private final DeficiencyClassifier classifier = new DeficiencyClassifier(SoilFixtures.rangeTable());
    private final NutrientRange nitrogen = new NutrientRange(SoilParameter.NITROGEN, GrowthStage.PRE_PLANTING, 140, 220, 60, 400);

    @Test
    void valueInsideBandIsOptimal() {
        DeficiencyResult r = classifier.classify(SoilParameter.NITROGEN, 180, nitrogen);
        assertThat(r.status()).isEqualTo(DeficiencyStatus.OPTIMAL);
        assertThat(r.severity()).isZero();
    }

    @Test
    void severityIsZeroExactlyOnOptimalBoundaries() {
        assertThat(classifier.classify(SoilParameter.NITROGEN, 140, nitrogen).severity()).isZero();
        assertThat(classifier.classify(SoilParameter.NITROGEN, 140, nitrogen).status()).isEqualTo(DeficiencyStatus.OPTIMAL);
        assertThat(classifier.classify(SoilParameter.NITROGEN, 220, nitrogen).severity()).isZero();
        assertThat(classifier.classify(SoilParameter.NITROGEN, 220, nitrogen).status()).isEqualTo(DeficiencyStatus.OPTIMAL);
    }

    @Test
    void severityIsOneExactlyOnCriticalBoundaries() {
        DeficiencyResult low = classifier.classify(SoilParameter.NITROGEN, 60, nitrogen);
        assertThat(low.status()).isEqualTo(DeficiencyStatus.DEFICIENT);
        assertThat(low.severity()).isEqualTo(1.0);

        DeficiencyResult high = classifier.classify(SoilParameter.NITROGEN, 400, nitrogen);
        assertThat(high.status()).isEqualTo(DeficiencyStatus.EXCESS);
        assertThat(high.severity()).isEqualTo(1.0);
    }

    @Test
    void severityIsClippedBeyondCriticalBoundaries() {
        assertThat(classifier.classify(SoilParameter.NITROGEN, 10, nitrogen).severity()).isEqualTo(1.0);
        assertThat(classifier.classify(SoilParameter.NITROGEN, 900, nitrogen).severity()).isEqualTo(1.0);
    }

    @Test
    void severityIsLinearBetweenBandAndCriticalLimit() {
        // (140 - 100) / (140 - 60) = 0.5
        assertThat(classifier.classify(SoilParameter.NITROGEN, 100, nitrogen).severity()).isCloseTo(0.5, within(1e-12));
        // (310 - 220) / (400 - 220) = 0.5
        assertThat(classifier.classify(SoilParameter.NITROGEN, 310, nitrogen).severity()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void severityNeverDecreasesMovingAwayFromBand() {
        double previous = 0.0;
        for (double v = 140; v >= 0; v -= 0.5) {
            double s = classifier.classify(SoilParameter.NITROGEN, v, nitrogen).severity();
            assertThat(s).isGreaterThanOrEqualTo(previous).isBetween(0.0, 1.0);
            previous = s;
        }
        previous = 0.0;
        for (double v = 220; v <= 600; v += 0.5) {
            double s = classifier.classify(SoilParameter.NITROGEN, v, nitrogen).severity();
            assertThat(s).isGreaterThanOrEqualTo(previous).isBetween(0.0, 1.0);
            previous = s;
        }
    }

    @Test
    void classifyReturnsSixResultsInFixedOrder() {
        SensorReading reading = new SensorReading("F1", SoilFixtures.T0, 100, 25, 500, 6.0, 60, 27, null);

        List<DeficiencyResult> results = classifier.classify(reading, GrowthStage.VEGETATIVE);

        assertThat(results).extracting(DeficiencyResult::parameter)
                .containsExactly(SoilParameter.values());
        assertThat(results.get(0).status()).isEqualTo(DeficiencyStatus.DEFICIENT);
        assertThat(results.get(2).status()).isEqualTo(DeficiencyStatus.EXCESS);
        assertThat(results.get(2).severity()).isEqualTo(1.0);
        assertThat(results).filteredOn(r -> r.status() == DeficiencyStatus.OPTIMAL).hasSize(4);
    }

    @Test
    void missingRangeIsAConfigurationError() {
        DeficiencyClassifier partial = new DeficiencyClassifier(SoilFixtures.rangeTable(EnumSet.of(GrowthStage.PRE_PLANTING)));
        SensorReading reading = new SensorReading("F1", SoilFixtures.T0, 180, 25, 200, 6.0, 60, 27, null);

        assertThat(partial.classify(reading, GrowthStage.PRE_PLANTING)).hasSize(6);
        assertThatThrownBy(() -> partial.classify(reading, GrowthStage.FLOWERING))
                .isInstanceOf(MissingRangeException.class)
                .hasMessageContaining("FLOWERING");
    }

    @Test
    void incoherentRangeIsRejected() {
        assertThatThrownBy(() -> new NutrientRange(SoilParameter.PH, GrowthStage.MATURITY, 6.5, 5.5, 4.5, 7.8))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new NutrientRange(SoilParameter.PH, GrowthStage.MATURITY, 5.5, 6.5, 5.5, 7.8))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void duplicateRangeRowsAreRejected() {
        NutrientRange row = new NutrientRange(SoilParameter.PH, GrowthStage.MATURITY, 5.5, 6.5, 4.5, 7.8);
        assertThatThrownBy(() -> new NutrientRangeTable(List.of(row, row)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void partialTableReportsMissingEntries() {
        NutrientRangeTable partial = SoilFixtures.rangeTable(EnumSet.of(GrowthStage.PRE_PLANTING));
        assertThat(partial.missingEntries()).hasSize(18).contains("VEGETATIVE/NITROGEN");
        assertThatThrownBy(partial::requireComplete).isInstanceOf(MissingRangeException.class);
        assertThat(SoilFixtures.rangeTable().missingEntries()).isEmpty();
    }
}
