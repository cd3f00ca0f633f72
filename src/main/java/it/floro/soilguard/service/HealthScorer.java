package it.floro.soilguard.service;

import it.floro.soilguard.domain.DeficiencyResult;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Aggrega gli esiti del classificatore in un unico punteggio di salute del suolo.
 *
 * Formula: score = 100 × (1 − Σ wᵢ·severityᵢ), vincolato in [0, 100] e arrotondato al centesimo.
 *
 * Non ha percorsi di errore: i pesi sono già validati all'avvio da ScoringWeights.
 */
@Service
public class HealthScorer {

    private final ScoringWeights weights;

    public HealthScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    /**
     * @param results Esiti del classificatore (uno per parametro)
     * @return Punteggio composito [0.0 .. 100.0]
     */
    public double score(List<DeficiencyResult> results) {
        double weightedSeverity = 0.0;
        for (DeficiencyResult r : results) {
            weightedSeverity += weights.of(r.parameter()) * r.severity();
        }
        return clamp(100.0 * (1.0 - weightedSeverity));
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        double rounded = Math.round(v * 100.0) / 100.0;   // Assorbe il rumore di somma dei pesi
        return Math.max(0.0, Math.min(100.0, rounded));
    }
}
