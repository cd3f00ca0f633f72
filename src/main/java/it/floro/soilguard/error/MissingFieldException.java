package it.floro.soilguard.error;

/**
 * Campo obbligatorio assente nel campione grezzo (parametro, fieldId o timestamp).
 */
public class MissingFieldException extends SoilReadingRejectedException {

    private final String field;

    public MissingFieldException(String field) {
        super("MISSING_FIELD", "Campo obbligatorio mancante: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
