package it.floro.soilguard.service;

import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Vettore dei pesi del punteggio composito.
 *
 * Invarianti verificate alla costruzione (quindi all'avvio):
 * - un peso per ciascuno dei sei parametri
 * - nessun peso negativo o non finito
 * - somma pari a 1 (tolleranza 1e-6)
 */
public final class ScoringWeights {

    static final double TOLERANCE = 1e-6;

    private final Map<SoilParameter, Double> weights;

    public ScoringWeights(Map<SoilParameter, Double> weights) {
        EnumMap<SoilParameter, Double> copy = new EnumMap<>(SoilParameter.class);
        double sum = 0.0;
        for (SoilParameter p : SoilParameter.values()) {
            Double w = weights.get(p);
            if (w == null) {
                throw new InvalidConfigurationException("Peso mancante per " + p);
            }
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                throw new InvalidConfigurationException("Peso non valido per " + p + ": " + w);
            }
            copy.put(p, w);
            sum += w;
        }
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new InvalidConfigurationException("La somma dei pesi deve essere 1, trovato " + sum);
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    /**
     * Pesatura uniforme: 1/6 per parametro.
     */
    public static ScoringWeights equal() {
        Map<SoilParameter, Double> m = new EnumMap<>(SoilParameter.class);
        for (SoilParameter p : SoilParameter.values()) {
            m.put(p, 1.0 / SoilParameter.values().length);
        }
        return new ScoringWeights(m);
    }

    public double of(SoilParameter parameter) {
        return weights.get(parameter);
    }

    public Map<SoilParameter, Double> asMap() {
        return weights;
    }
}
