package it.floro.soilguard.service;

import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.DeficiencyStatus;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.NutrientRange;
import it.floro.soilguard.domain.SensorReading;
import it.floro.soilguard.domain.SoilParameter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Confronta una lettura normalizzata con la tabella dei range per la fase colturale corrente.
 *
 * Per ogni parametro:
 * - valore in [minOptimal, maxOptimal] → OPTIMAL, severità 0
 * - valore sotto minOptimal → DEFICIENT, severità = clip((minOptimal - v) / (minOptimal - criticalLow))
 * - valore sopra maxOptimal → EXCESS, severità = clip((v - maxOptimal) / (criticalHigh - maxOptimal))
 *
 * La severità vale 0 sul bordo della banda, 1 sul limite critico e cresce in modo monotono tra i due.
 * L'output ha sempre sei elementi nell'ordine di SoilParameter.
 */
@Service
public class DeficiencyClassifier {

    private final NutrientRangeTable ranges;

    public DeficiencyClassifier(NutrientRangeTable ranges) {
        this.ranges = ranges;
    }

    /**
     * @param reading Lettura validata
     * @param stage Fase colturale del campo
     * @return Sei esiti, ordine N, P, K, pH, umidità, temperatura
     * @throws it.floro.soilguard.error.MissingRangeException se la tabella non copre una coppia (parametro, fase)
     */
    public List<DeficiencyResult> classify(SensorReading reading, GrowthStage stage) {
        List<DeficiencyResult> out = new ArrayList<>(SoilParameter.values().length);
        for (SoilParameter p : SoilParameter.values()) {
            out.add(classify(p, reading.valueOf(p), ranges.require(p, stage)));
        }
        return List.copyOf(out);
    }

    /**
     * Classifica un singolo valore rispetto a una riga della tabella.
     */
    public DeficiencyResult classify(SoilParameter parameter, double value, NutrientRange range) {
        if (range.isOptimal(value)) {
            return new DeficiencyResult(parameter, DeficiencyStatus.OPTIMAL, 0.0, value);
        }
        if (value < range.minOptimal()) {
            double severity = clamp01((range.minOptimal() - value) / (range.minOptimal() - range.criticalLow()));
            return new DeficiencyResult(parameter, DeficiencyStatus.DEFICIENT, severity, value);
        }
        double severity = clamp01((value - range.maxOptimal()) / (range.criticalHigh() - range.maxOptimal()));
        return new DeficiencyResult(parameter, DeficiencyStatus.EXCESS, severity, value);
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
