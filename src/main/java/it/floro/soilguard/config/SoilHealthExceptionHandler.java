package it.floro.soilguard.config;

import it.floro.soilguard.error.InvalidReadingException;
import it.floro.soilguard.error.MissingFieldException;
import it.floro.soilguard.error.SoilConfigurationException;
import it.floro.soilguard.error.SoilReadingRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Traduce la tassonomia degli errori del motore in risposte HTTP.
 *
 * - Letture rifiutate → 422 con codice di categoria: il client può correggere e reinviare
 * - Errori di configurazione → 500: il motore si rifiuta di valutare
 * - Richieste malformate → 400
 */
@RestControllerAdvice
@Order(-1) // Alta priorità
public class SoilHealthExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(SoilHealthExceptionHandler.class);

    @ExceptionHandler(SoilReadingRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(SoilReadingRejectedException ex) {
        logger.warn("Lettura rifiutata [{}]: {}", ex.getCode(), ex.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", ex.getCode());
        body.put("message", ex.getMessage());
        if (ex instanceof InvalidReadingException invalid) {
            body.put("parameter", invalid.getParameter());
        } else if (ex instanceof MissingFieldException missing) {
            body.put("parameter", missing.getField());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(SoilConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(SoilConfigurationException ex) {
        logger.error("Errore di configurazione del motore: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "code", "CONFIGURATION_ERROR",
                "message", ex.getMessage()
        ));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        logger.debug("Richiesta non valida: {}", ex.getMessage());
        String msg = ex.getMessage() == null ? "Richiesta non valida" : ex.getMessage();
        return ResponseEntity.badRequest().body(Map.of(
                "code", "BAD_REQUEST",
                "message", msg
        ));
    }
}
