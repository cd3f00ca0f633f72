package it.floro.soilguard.web.dto;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Trend del punteggio di un campo. Con meno di due record il trend è indefinito
 * (defined=false, slope=null): non è un errore.
 */
public record TrendResponse(
        String fieldId,
        boolean defined,
        Double slope,               // Punti di punteggio per record, null se indefinito
        int records,                // Record disponibili
        Instant lastReading         // Ultima lettura accettata, null se il campo non ha storico
) {

    public static TrendResponse of(String fieldId, OptionalDouble slope, int records, Instant lastReading) {
        return new TrendResponse(fieldId, slope.isPresent(), slope.isPresent() ? slope.getAsDouble() : null,
                records, lastReading);
    }
}
