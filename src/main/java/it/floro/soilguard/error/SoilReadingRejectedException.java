package it.floro.soilguard.error;

/**
 * Radice degli errori di validazione dell'input.
 *
 * Una lettura rifiutata non modifica mai lo storico: il chiamante viene informato
 * con un codice di categoria stabile e può reinviare una lettura corretta.
 */
public abstract class SoilReadingRejectedException extends RuntimeException {

    private final String code;

    protected SoilReadingRejectedException(String code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * Codice di categoria esposto ai client (es. "INVALID_READING").
     */
    public String getCode() {
        return code;
    }
}
