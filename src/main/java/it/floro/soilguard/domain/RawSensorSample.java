package it.floro.soilguard.domain;

import java.time.Instant;

/**
 * Campione grezzo così come arriva dai collaboratori esterni (nodo sensore, canale cloud, simulatore).
 *
 * Tutti i valori sono boxed: un valore null indica un parametro non ricevuto
 * e viene segnalato dal ReadingNormalizer con MissingFieldException.
 */
public record RawSensorSample(
        String fieldId,                     // Identificatore del campo
        Instant timestamp,                  // Istante della misura
        Double nitrogen,                    // Azoto: mg/kg
        Double phosphorus,                  // Fosforo: mg/kg
        Double potassium,                   // Potassio: mg/kg
        Double ph,                          // pH: scala [0..14]
        Double moisture,                    // Umidità del suolo: percentuale [0..100]
        Double temperature,                 // Temperatura del suolo: gradi Celsius
        Double humidity                     // Umidità dell'aria (opzionale, non valutata): percentuale [0..100]
) {

    /**
     * Costruttore ausiliario per i sensori privi del canale umidità dell'aria.
     */
    public RawSensorSample(String fieldId, Instant timestamp,
                           Double nitrogen, Double phosphorus, Double potassium,
                           Double ph, Double moisture, Double temperature) {
        this(fieldId, timestamp, nitrogen, phosphorus, potassium, ph, moisture, temperature, null);
    }

    /**
     * @param parameter Parametro richiesto
     * @return Valore grezzo (può essere null)
     */
    public Double valueOf(SoilParameter parameter) {
        return switch (parameter) {
            case NITROGEN -> nitrogen;
            case PHOSPHORUS -> phosphorus;
            case POTASSIUM -> potassium;
            case PH -> ph;
            case MOISTURE -> moisture;
            case TEMPERATURE -> temperature;
        };
    }
}
