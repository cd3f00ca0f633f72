package it.floro.soilguard.error;

/**
 * Valore fuori dal range fisico plausibile, non numerico o non finito.
 * Il valore viene rifiutato, mai vincolato.
 */
public class InvalidReadingException extends SoilReadingRejectedException {

    private final String parameter;

    public InvalidReadingException(String parameter, String message) {
        super("INVALID_READING", message);
        this.parameter = parameter;
    }

    public static InvalidReadingException outOfBounds(String parameter, double value, double min, double max) {
        return new InvalidReadingException(parameter, String.format(
                "Valore %s=%s fuori dal range fisico [%s, %s]", parameter, value, min, max));
    }

    public String getParameter() {
        return parameter;
    }
}
