package it.floro.soilguard.web.dto;

import it.floro.soilguard.domain.RawSensorSample;

import java.time.Instant;

/**
 * Corpo JSON di una lettura inviata da un nodo sensore.
 * Il fieldId arriva dal path; i valori mancanti restano null e vengono rifiutati dal motore.
 */
public record ReadingRequest(
        Instant timestamp,
        Double nitrogen,
        Double phosphorus,
        Double potassium,
        Double ph,
        Double moisture,
        Double temperature,
        Double humidity
) {

    public RawSensorSample toSample(String fieldId) {
        return new RawSensorSample(fieldId, timestamp, nitrogen, phosphorus, potassium, ph, moisture, temperature, humidity);
    }
}
