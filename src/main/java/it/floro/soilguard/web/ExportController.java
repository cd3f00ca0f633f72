package it.floro.soilguard.web;

import it.floro.soilguard.domain.DeficiencyResult;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.SensorReading;
import it.floro.soilguard.service.HistoryTracker;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Export CSV dello storico di un campo, compatibile Excel ITA:
 * - Separatore di campo: ';'
 * - Decimali con virgola
 * - BOM UTF-8 per migliorare riconoscimento in Excel
 */
@Controller
public class ExportController {

    private static final char DELIMITER = ';';
    private static final String NEWLINE = "\n";
    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter FILENAME_DATE_FMT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final HistoryTracker history;

    public ExportController(HistoryTracker history) {
        this.history = history;
    }

    @GetMapping("/export/{fieldId}")
    public ResponseEntity<byte[]> exportCsv(@PathVariable String fieldId,
                                            @RequestParam(defaultValue = "1000") int n) {

        // ===== STEP 1: DATI =====
        List<HealthScoreRecord> records = history.recent(fieldId, n);

        // ===== STEP 2: CSV =====
        StringBuilder sb = new StringBuilder(128 + records.size() * 160);

        sb.append(String.join(String.valueOf(DELIMITER),
                "Timestamp (UTC)",
                "Campo",
                "Fase",
                "Azoto (mg/kg)",
                "Fosforo (mg/kg)",
                "Potassio (mg/kg)",
                "pH",
                "Umidità suolo (%)",
                "Temp suolo (°C)",
                "Punteggio",
                "Giudizio",
                "Carenze",
                "Umidità aria (%)"
        )).append(NEWLINE);

        for (HealthScoreRecord r : records) {
            SensorReading reading = r.reading();
            sb.append(TS_FMT.format(r.timestamp()))
                    .append(DELIMITER).append(safe(r.fieldId()))
                    .append(DELIMITER).append(r.stage())
                    .append(DELIMITER).append(numIt(reading.nitrogen()))
                    .append(DELIMITER).append(numIt(reading.phosphorus()))
                    .append(DELIMITER).append(numIt(reading.potassium()))
                    .append(DELIMITER).append(numIt(reading.ph()))
                    .append(DELIMITER).append(numIt(reading.moisture()))
                    .append(DELIMITER).append(numIt(reading.temperature()))
                    .append(DELIMITER).append(numIt(r.score()))
                    .append(DELIMITER).append(r.verdict())
                    .append(DELIMITER).append(deficiencies(r.contributingDeficiencies()))
                    .append(DELIMITER).append(humidity(reading))
                    .append(NEWLINE);
        }

        // ===== STEP 3: NOME FILE =====
        String fieldStr = fieldId.replaceAll("[^A-Za-z0-9_-]", "_");
        String dateStr = records.isEmpty() ? "vuoto" : FILENAME_DATE_FMT.format(records.get(records.size() - 1).timestamp());
        String filename = String.format("storico_%s_%s.csv", fieldStr, dateStr);

        // ===== STEP 4: BYTES + BOM UTF-8 =====
        byte[] bom = new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] csv = sb.toString().getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[bom.length + csv.length];
        System.arraycopy(bom, 0, bytes, 0, bom.length);
        System.arraycopy(csv, 0, bytes, bom.length, csv.length);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("text/csv; charset=UTF-8"))
                .contentLength(bytes.length)
                .body(bytes);
    }

    // ===================== Helpers =====================

    /**
     * Carenze come "nitrogen 0,42 | ph 0,10"; vuoto se nessun parametro è carente.
     */
    private String deficiencies(List<DeficiencyResult> results) {
        return results.stream()
                .filter(DeficiencyResult::isDeficient)
                .map(d -> d.parameter().key() + " " + numIt(d.severity()))
                .collect(Collectors.joining(" | "));
    }

    /**
     * Umidità dell'aria, vuota se il nodo non la fornisce.
     */
    private String humidity(SensorReading reading) {
        OptionalDouble h = reading.humidityValue();
        return h.isPresent() ? numIt(h.getAsDouble()) : "";
    }

    /**
     * Sanitizzazione per campi testuali: niente apici o newline, mitigazione CSV injection.
     */
    private String safe(String s) {
        if (s == null || s.isEmpty()) return "";
        String cleaned = s.replace("\"", "").replace("\r", " ").replace("\n", " ");
        if (!cleaned.isEmpty()) {
            char c = cleaned.charAt(0);
            if (c == '=' || c == '+' || c == '-' || c == '@') {
                cleaned = "'" + cleaned;
            }
        }
        return cleaned;
    }

    /**
     * Formatta con 2 decimali, punto → virgola (locale ITA), senza grouping.
     */
    private String numIt(double v) {
        return String.format(Locale.ROOT, "%.2f", v).replace('.', ',');
    }
}
