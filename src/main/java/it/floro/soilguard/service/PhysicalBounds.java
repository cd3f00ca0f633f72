package it.floro.soilguard.service;

import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;

import java.util.EnumMap;
import java.util.Map;

/**
 * Limiti fisici di plausibilità dei valori forniti dal sensore.
 *
 * Non vanno confusi con i range agronomici: un valore fuori da questi limiti
 * è una misura impossibile e la lettura viene rifiutata.
 */
public final class PhysicalBounds {

    /**
     * Coppia [min, max] inclusiva.
     */
    public record Bound(double min, double max) {
        public boolean contains(double v) {
            return v >= min && v <= max;
        }
    }

    private final Map<SoilParameter, Bound> bounds;
    private final Bound humidity;

    public PhysicalBounds(Map<SoilParameter, Bound> bounds, Bound humidity) {
        EnumMap<SoilParameter, Bound> copy = new EnumMap<>(SoilParameter.class);
        for (SoilParameter p : SoilParameter.values()) {
            Bound b = bounds.get(p);
            if (b == null) {
                throw new InvalidConfigurationException("Limiti fisici mancanti per " + p);
            }
            copy.put(p, checked(p.key(), b));
        }
        this.bounds = copy;
        this.humidity = checked("humidity", humidity);
    }

    /**
     * Limiti del sensore 7-in-1 usato in campo (NPK 0-1999 mg/kg, pH 0-14,
     * umidità 0-100%, temperatura -40..80 °C).
     */
    public static PhysicalBounds defaults() {
        Map<SoilParameter, Bound> m = new EnumMap<>(SoilParameter.class);
        m.put(SoilParameter.NITROGEN, new Bound(0, 1999));
        m.put(SoilParameter.PHOSPHORUS, new Bound(0, 1999));
        m.put(SoilParameter.POTASSIUM, new Bound(0, 1999));
        m.put(SoilParameter.PH, new Bound(0, 14));
        m.put(SoilParameter.MOISTURE, new Bound(0, 100));
        m.put(SoilParameter.TEMPERATURE, new Bound(-40, 80));
        return new PhysicalBounds(m, new Bound(0, 100));
    }

    public Bound of(SoilParameter parameter) {
        return bounds.get(parameter);
    }

    public Bound humidity() {
        return humidity;
    }

    private static Bound checked(String name, Bound b) {
        if (b == null || !(b.min() < b.max())) {
            throw new InvalidConfigurationException("Limiti fisici non validi per " + name + ": " + b);
        }
        return b;
    }
}
