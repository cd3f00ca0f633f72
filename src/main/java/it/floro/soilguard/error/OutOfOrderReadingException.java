package it.floro.soilguard.error;

import java.time.Instant;

/**
 * Lettura con timestamp precedente all'ultimo registrato per lo stesso campo.
 * Le letture non vengono mai riordinate: il trend dipende dall'ordine di inserimento.
 */
public class OutOfOrderReadingException extends SoilReadingRejectedException {

    private final String fieldId;
    private final Instant timestamp;
    private final Instant lastRecorded;

    public OutOfOrderReadingException(String fieldId, Instant timestamp, Instant lastRecorded) {
        super("OUT_OF_ORDER_READING", String.format(
                "Lettura fuori ordine per il campo %s: %s precede l'ultima registrata %s",
                fieldId, timestamp, lastRecorded));
        this.fieldId = fieldId;
        this.timestamp = timestamp;
        this.lastRecorded = lastRecorded;
    }

    public String getFieldId() {
        return fieldId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Instant getLastRecorded() {
        return lastRecorded;
    }
}
