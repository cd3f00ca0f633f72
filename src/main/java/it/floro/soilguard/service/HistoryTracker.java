package it.floro.soilguard.service;

import it.floro.soilguard.config.SoilGuardProperties;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.error.OutOfOrderReadingException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Storico append-only dei punteggi, una serie per campo.
 *
 * Responsabilità:
 * - Accodare i record in ordine di timestamp non decrescente (OutOfOrderReadingException altrimenti)
 * - Restituire gli ultimi n record in ordine cronologico
 * - Calcolare il trend come funzione pura dei record memorizzati
 *
 * Concorrenza:
 * - ConcurrentHashMap per l'indice dei campi: campi diversi non si contendono nulla
 * - ogni FieldHistory è il monitor del proprio campo (serializzazione per campo)
 *
 * Nota: la persistenza tra riavvii è responsabilità di un collaboratore esterno;
 * qui vive solo il contratto in memoria.
 */
@Service
public class HistoryTracker {

    /**
     * Indice thread-safe campo → storico.
     */
    private final Map<String, FieldHistory> histories = new ConcurrentHashMap<>();

    /**
     * Limite di record per campo (0 = illimitato). Oltre il limite si scartano i più vecchi.
     */
    private final int maxRecordsPerField;

    public HistoryTracker() {
        this(0);
    }

    /**
     * @throws InvalidConfigurationException se il limite di record non contiene
     *         la finestra usata per il flag di impoverimento
     */
    @Autowired
    public HistoryTracker(SoilGuardProperties properties) {
        this(retention(properties));
    }

    public HistoryTracker(int maxRecordsPerField) {
        if (maxRecordsPerField < 0) {
            throw new IllegalArgumentException("maxRecordsPerField non può essere negativo: " + maxRecordsPerField);
        }
        this.maxRecordsPerField = maxRecordsPerField;
    }

    // ========================================================================
    // SCRITTURA
    // ========================================================================

    /**
     * Accoda un record allo storico del suo campo.
     *
     * @param record Record da registrare
     * @throws OutOfOrderReadingException se il timestamp precede l'ultimo registrato per il campo
     */
    public void record(HealthScoreRecord record) {
        historyOf(record.fieldId()).append(record);
    }

    /**
     * Verifica, senza modificare nulla, che un timestamp sia accettabile per il campo.
     *
     * @throws OutOfOrderReadingException se precede l'ultimo registrato
     */
    public void checkOrder(String fieldId, Instant timestamp) {
        FieldHistory h = histories.get(fieldId);
        if (h != null) {
            h.checkOrder(fieldId, timestamp);
        }
    }

    /**
     * Esegue un'azione tenendo il monitor del campo: le letture dello stesso campo
     * vengono elaborate una alla volta, quelle di campi diversi in parallelo.
     */
    public <T> T withFieldLock(String fieldId, Supplier<T> action) {
        FieldHistory h = historyOf(fieldId);
        synchronized (h) {
            return action.get();
        }
    }

    // ========================================================================
    // LETTURA
    // ========================================================================

    /**
     * @param fieldId Campo richiesto
     * @param n Numero massimo di record
     * @return Ultimi n record in ordine cronologico (meno se lo storico è più corto, vuoto se il campo è sconosciuto)
     * @throws IllegalArgumentException se n è negativo
     */
    public List<HealthScoreRecord> recent(String fieldId, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n non può essere negativo: " + n);
        }
        FieldHistory h = histories.get(fieldId);
        return h == null ? List.of() : h.last(n);
    }

    /**
     * Pendenza ai minimi quadrati del punteggio rispetto all'indice del record (punti per record).
     *
     * Esempio: punteggi [80, 70, 60] → -10.0
     *
     * @param fieldId Campo richiesto
     * @return Pendenza, oppure vuoto (trend indefinito) con meno di due record
     */
    public OptionalDouble trend(String fieldId) {
        FieldHistory h = histories.get(fieldId);
        if (h == null) return OptionalDouble.empty();
        return slope(h.snapshot().stream().mapToDouble(HealthScoreRecord::score).toArray());
    }

    /**
     * Ultimi n valori grezzi di un parametro, in ordine cronologico.
     */
    public List<Double> parameterSeries(String fieldId, SoilParameter parameter, int n) {
        return recent(fieldId, n).stream()
                .map(r -> r.reading().valueOf(parameter))
                .toList();
    }

    public Optional<Instant> lastTimestamp(String fieldId) {
        FieldHistory h = histories.get(fieldId);
        return h == null ? Optional.empty() : h.lastTimestamp();
    }

    /**
     * @return Campi con almeno un record, in ordine alfabetico
     */
    public List<String> fieldIds() {
        return histories.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public int size(String fieldId) {
        FieldHistory h = histories.get(fieldId);
        return h == null ? 0 : h.size();
    }

    // ========== METODI HELPER PRIVATI ==========

    private static int retention(SoilGuardProperties properties) {
        int max = properties.getHistory().getMaxRecordsPerField();
        int window = properties.getRecommendation().getDepletionMinRecords();
        if (max > 0 && max < window) {
            throw new InvalidConfigurationException(String.format(
                    "history.max-records-per-field (%d) deve essere 0 o almeno depletion-min-records (%d)", max, window));
        }
        return max;
    }

    private FieldHistory historyOf(String fieldId) {
        return histories.computeIfAbsent(fieldId, id -> new FieldHistory(maxRecordsPerField));
    }

    /**
     * Pendenza della retta di regressione y = a + b·x con x = 0, 1, ..., n-1.
     */
    static OptionalDouble slope(double[] y) {
        int n = y.length;
        if (n < 2) return OptionalDouble.empty();

        double meanX = (n - 1) / 2.0;
        double meanY = 0.0;
        for (double v : y) meanY += v;
        meanY /= n;

        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            num += dx * (y[i] - meanY);
            den += dx * dx;
        }
        return OptionalDouble.of(num / den);
    }

    /**
     * Serie di un singolo campo. Tutti i metodi sono sincronizzati sull'istanza.
     */
    private static final class FieldHistory {

        private final Deque<HealthScoreRecord> records = new ArrayDeque<>();
        private final int maxRecords;

        /**
         * Ultimo timestamp accettato; sopravvive allo scarto dei record più vecchi.
         */
        private Instant last;

        FieldHistory(int maxRecords) {
            this.maxRecords = maxRecords;
        }

        synchronized void checkOrder(String fieldId, Instant timestamp) {
            if (last != null && timestamp.isBefore(last)) {
                throw new OutOfOrderReadingException(fieldId, timestamp, last);
            }
        }

        synchronized void append(HealthScoreRecord record) {
            checkOrder(record.fieldId(), record.timestamp());
            records.add(record);
            last = record.timestamp();
            if (maxRecords > 0 && records.size() > maxRecords) {
                records.removeFirst();
            }
        }

        synchronized List<HealthScoreRecord> last(int n) {
            int count = Math.min(n, records.size());
            HealthScoreRecord[] out = new HealthScoreRecord[count];
            Iterator<HealthScoreRecord> it = records.descendingIterator();
            for (int i = count - 1; i >= 0; i--) {
                out[i] = it.next();
            }
            return List.of(out);
        }

        synchronized List<HealthScoreRecord> snapshot() {
            return List.copyOf(records);
        }

        synchronized Optional<Instant> lastTimestamp() {
            return Optional.ofNullable(last);
        }

        synchronized boolean isEmpty() {
            return records.isEmpty();
        }

        synchronized int size() {
            return records.size();
        }
    }
}
