package it.floro.soilguard.domain;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Lettura normalizzata e validata: ogni parametro rientra nei limiti fisici dichiarati.
 *
 * Viene prodotta solo dal ReadingNormalizer; a valle nessun componente la modifica.
 */
public record SensorReading(
        // ============ INFORMAZIONI DI TRACCIAMENTO ============
        String fieldId,                     // Identificatore univoco del campo
        Instant timestamp,                  // Istante della misura

        // ============ MACRONUTRIENTI (NPK) ============
        double nitrogen,                    // Azoto: mg/kg
        double phosphorus,                  // Fosforo: mg/kg
        double potassium,                   // Potassio: mg/kg

        // ============ CONDIZIONI DEL SUOLO ============
        double ph,                          // pH: scala [0..14]
        double moisture,                    // Umidità del suolo: percentuale [0..100]
        double temperature,                 // Temperatura del suolo: gradi Celsius

        // ============ EXTRA NON VALUTATI ============
        Double humidity                     // Umidità dell'aria: percentuale [0..100], null se assente
) {

    /**
     * @param parameter Parametro richiesto
     * @return Valore misurato nell'unità canonica del parametro
     */
    public double valueOf(SoilParameter parameter) {
        return switch (parameter) {
            case NITROGEN -> nitrogen;
            case PHOSPHORUS -> phosphorus;
            case POTASSIUM -> potassium;
            case PH -> ph;
            case MOISTURE -> moisture;
            case TEMPERATURE -> temperature;
        };
    }

    public OptionalDouble humidityValue() {
        return humidity == null ? OptionalDouble.empty() : OptionalDouble.of(humidity);
    }
}
