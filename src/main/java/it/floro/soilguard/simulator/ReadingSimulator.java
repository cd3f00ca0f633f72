package it.floro.soilguard.simulator;

import it.floro.soilguard.domain.RawSensorSample;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Simulatore di letture realistiche per suoli coltivati a pepe nero.
 *
 * Responsabilità:
 * - Generare un RawSensorSample per campo a ogni tick
 * - Mantenere profili di campo invarianti (livelli base di NPK, pH, umidità)
 * - Simulare il lento impoverimento dei nutrienti dovuto all'assorbimento della pianta
 *
 * Architettura:
 * - Seed fisso + Random internalizzato: stesso seed, stessa sequenza
 * - Profili di campo generati all'avvio nei range tipici del sensore in campo
 * - Rumore gaussiano di misura su ogni parametro (Box-Muller)
 * - Deriva negativa di NPK per tick (impoverimento post-impianto)
 *
 * Intervalli tipici simulati:
 * - Temperatura [22, 35] °C, umidità suolo [40, 80] %, umidità aria [60, 90] %
 * - N [100, 250], P [10, 60], K [150, 300] mg/kg
 * - pH [5.5, 7.5]
 */
public class ReadingSimulator {

    /**
     * Generatore con seed fisso per riproducibilità.
     */
    private final Random rnd;

    private final List<String> fieldIds;

    // ========================================================================
    // PROFILI CAMPI (Invarianti, salvo deriva NPK)
    // ========================================================================

    private final double[] baseNitrogen;
    private final double[] basePhosphorus;
    private final double[] basePotassium;
    private final double[] basePh;
    private final double[] baseMoisture;

    /**
     * Frazione di NPK assorbita dalla pianta a ogni tick.
     */
    private static final double DEPLETION_PER_TICK = 0.004;

    /**
     * Numero di tick generati finora: guida la deriva.
     */
    private long tick;

    /**
     * @param seed Seed per il generatore Random (stesso seed = stesse letture)
     * @param fieldIds Campi da simulare
     */
    public ReadingSimulator(long seed, List<String> fieldIds) {
        this.rnd = new Random(seed);
        this.fieldIds = List.copyOf(fieldIds);
        int n = fieldIds.size();
        baseNitrogen = new double[n];
        basePhosphorus = new double[n];
        basePotassium = new double[n];
        basePh = new double[n];
        baseMoisture = new double[n];
        initFieldProfiles();
    }

    /**
     * Genera una lettura per ciascun campo con il timestamp indicato.
     *
     * @param timestamp Istante della misura
     * @return Un campione per campo, nell'ordine dei campi
     */
    public List<RawSensorSample> next(Instant timestamp) {
        double depletion = Math.max(0.5, 1.0 - DEPLETION_PER_TICK * tick);
        tick++;

        List<RawSensorSample> out = new ArrayList<>(fieldIds.size());
        for (int f = 0; f < fieldIds.size(); f++) {
            out.add(new RawSensorSample(
                    fieldIds.get(f),
                    timestamp,
                    round0(clamp(gauss(baseNitrogen[f] * depletion, 6), 0, 1999)),
                    round0(clamp(gauss(basePhosphorus[f] * depletion, 2), 0, 1999)),
                    round0(clamp(gauss(basePotassium[f] * depletion, 8), 0, 1999)),
                    round2(clamp(gauss(basePh[f], 0.08), 0, 14)),
                    round1(clamp(gauss(baseMoisture[f], 2.5), 0, 100)),
                    round1(uniform(22.0, 35.0)),
                    round1(uniform(60.0, 90.0))
            ));
        }
        return out;
    }

    public List<String> fieldIds() {
        return fieldIds;
    }

    // ========================================================================
    // METODI HELPER PRIVATI
    // ========================================================================

    private void initFieldProfiles() {
        for (int f = 0; f < fieldIds.size(); f++) {
            baseNitrogen[f]   = uniform(100.0, 250.0);
            basePhosphorus[f] = uniform(10.0, 60.0);
            basePotassium[f]  = uniform(150.0, 300.0);
            basePh[f]         = uniform(5.5, 7.5);
            baseMoisture[f]   = uniform(40.0, 80.0);
        }
    }

    private double uniform(double lo, double hi) {
        return lo + (hi - lo) * rnd.nextDouble();
    }

    /**
     * Numero casuale ~ N(mean, std²) con il metodo di Box-Muller.
     */
    private double gauss(double mean, double std) {
        double u1 = Math.max(1e-9, rnd.nextDouble());  // Evita log(0)
        double u2 = Math.max(1e-9, rnd.nextDouble());
        double z0 = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2 * Math.PI * u2);
        return mean + std * z0;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static double round0(double v) {
        return Math.rint(v);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
