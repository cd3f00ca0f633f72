package it.floro.soilguard.service;

import it.floro.soilguard.domain.RawSensorSample;
import it.floro.soilguard.domain.SensorReading;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidReadingException;
import it.floro.soilguard.error.MissingFieldException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Valida un campione grezzo e lo trasforma in una SensorReading canonica.
 *
 * Regole:
 * - fieldId, timestamp e i sei parametri valutati sono obbligatori (MissingFieldException)
 * - NaN, infiniti e valori fuori dai limiti fisici vengono rifiutati (InvalidReadingException), mai vincolati
 * - l'umidità dell'aria è facoltativa ma, se presente, deve essere plausibile
 * - nessuna conversione di unità: le sorgenti inviano già le unità di SoilParameter
 *
 * Nessun effetto collaterale oltre al valore restituito.
 */
@Service
public class ReadingNormalizer {

    private final PhysicalBounds bounds;

    public ReadingNormalizer(PhysicalBounds bounds) {
        this.bounds = bounds;
    }

    /**
     * @param raw Campione grezzo
     * @return Lettura validata
     * @throws MissingFieldException se manca un campo obbligatorio
     * @throws InvalidReadingException se un valore non è fisicamente plausibile
     */
    public SensorReading normalize(RawSensorSample raw) {
        if (raw == null) {
            throw new MissingFieldException("sample");
        }
        if (raw.fieldId() == null || raw.fieldId().isBlank()) {
            throw new MissingFieldException("fieldId");
        }
        if (raw.timestamp() == null) {
            throw new MissingFieldException("timestamp");
        }

        // Controlla i parametri nell'ordine fisso: il primo errore è quello riportato
        Map<SoilParameter, Double> values = new EnumMap<>(SoilParameter.class);
        for (SoilParameter p : SoilParameter.values()) {
            Double v = raw.valueOf(p);
            if (v == null) {
                throw new MissingFieldException(p.key());
            }
            values.put(p, checked(p.key(), v, bounds.of(p)));
        }

        Double humidity = raw.humidity() == null
                ? null
                : checked("humidity", raw.humidity(), bounds.humidity());

        return new SensorReading(
                raw.fieldId().trim(),
                raw.timestamp(),
                values.get(SoilParameter.NITROGEN),
                values.get(SoilParameter.PHOSPHORUS),
                values.get(SoilParameter.POTASSIUM),
                values.get(SoilParameter.PH),
                values.get(SoilParameter.MOISTURE),
                values.get(SoilParameter.TEMPERATURE),
                humidity
        );
    }

    private static double checked(String name, double v, PhysicalBounds.Bound b) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new InvalidReadingException(name, "Valore non numerico per " + name + ": " + v);
        }
        if (!b.contains(v)) {
            throw InvalidReadingException.outOfBounds(name, v, b.min(), b.max());
        }
        return v;
    }
}
