package it.floro.soilguard.service;

import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.HealthScoreRecord;
import it.floro.soilguard.domain.SensorReading;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.OutOfOrderReadingException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static it.floro.soilguard.SoilFixtures.T0;
import static org.assertj.core.api.Assertions.*;

class HistoryTrackerTest {

    private final HistoryTracker history = new HistoryTracker();

    private static HealthScoreRecord record(String fieldId, int minute, double score) {
        Instant ts = T0.plusSeconds(60L * minute);
        SensorReading reading = new SensorReading(fieldId, ts, 100 + minute, 25, 200, 6.0, 60, 27, null);
        return new HealthScoreRecord(fieldId, ts, score, List.of(), GrowthStage.VEGETATIVE, reading);
    }

    @Test
    void recentReturnsLatestRecordsInChronologicalOrder() {
        history.record(record("F1", 0, 90));
        history.record(record("F1", 1, 80));
        history.record(record("F1", 2, 70));

        assertThat(history.recent("F1", 2)).extracting(HealthScoreRecord::score).containsExactly(80.0, 70.0);
        assertThat(history.recent("F1", 10)).hasSize(3);
        assertThat(history.recent("F1", 0)).isEmpty();
        assertThat(history.recent("unknown", 5)).isEmpty();
    }

    @Test
    void negativeCountIsRejected() {
        assertThatThrownBy(() -> history.recent("F1", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void earlierTimestampIsRejectedAndHistoryUnchanged() {
        history.record(record("F1", 5, 90));

        assertThatThrownBy(() -> history.record(record("F1", 4, 80)))
                .isInstanceOfSatisfying(OutOfOrderReadingException.class, e -> {
                    assertThat(e.getFieldId()).isEqualTo("F1");
                    assertThat(e.getLastRecorded()).isEqualTo(T0.plusSeconds(300));
                });
        assertThat(history.size("F1")).isEqualTo(1);
    }

    @Test
    void laterAndEqualTimestampsAreAccepted() {
        history.record(record("F1", 5, 90));
        history.record(record("F1", 5, 85));
        history.record(record("F1", 6, 80));

        assertThat(history.size("F1")).isEqualTo(3);
        assertThat(history.lastTimestamp("F1")).contains(T0.plusSeconds(360));
    }

    @Test
    void fieldsAreOrderedIndependently() {
        history.record(record("F1", 10, 90));
        history.record(record("F2", 1, 90));

        assertThat(history.fieldIds()).containsExactly("F1", "F2");
    }

    @Test
    void trendIsUndefinedBelowTwoRecords() {
        assertThat(history.trend("F1")).isEmpty();
        history.record(record("F1", 0, 90));
        assertThat(history.trend("F1")).isEmpty();
    }

    @Test
    void trendIsLeastSquaresSlopePerRecord() {
        history.record(record("F1", 0, 80));
        history.record(record("F1", 1, 70));
        history.record(record("F1", 2, 60));

        assertThat(history.trend("F1").getAsDouble()).isCloseTo(-10.0, within(1e-9));
        assertThat(HistoryTracker.slope(new double[]{50, 60}).getAsDouble()).isCloseTo(10.0, within(1e-9));
        assertThat(HistoryTracker.slope(new double[]{70, 70, 70}).getAsDouble()).isZero();
    }

    @Test
    void parameterSeriesFollowsRecords() {
        history.record(record("F1", 0, 80));
        history.record(record("F1", 1, 70));

        assertThat(history.parameterSeries("F1", SoilParameter.NITROGEN, 30)).containsExactly(100.0, 101.0);
        assertThat(history.parameterSeries("F1", SoilParameter.PH, 1)).containsExactly(6.0);
    }

    @Test
    void retentionCapDropsOldestButKeepsOrdering() {
        HistoryTracker capped = new HistoryTracker(2);
        capped.record(record("F1", 0, 90));
        capped.record(record("F1", 1, 80));
        capped.record(record("F1", 2, 70));

        assertThat(capped.recent("F1", 10)).extracting(HealthScoreRecord::score).containsExactly(80.0, 70.0);
        assertThatThrownBy(() -> capped.record(record("F1", 0, 60))).isInstanceOf(OutOfOrderReadingException.class);
        assertThatThrownBy(() -> new HistoryTracker(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cappedSeriesKeepsSlidingWindow() {
        HistoryTracker capped = new HistoryTracker(3);
        for (int i = 0; i < 50; i++) {
            capped.record(record("F1", i, i));
        }

        assertThat(capped.size("F1")).isEqualTo(3);
        assertThat(capped.recent("F1", 10)).extracting(HealthScoreRecord::score).containsExactly(47.0, 48.0, 49.0);
        assertThat(capped.recent("F1", 2)).extracting(HealthScoreRecord::score).containsExactly(48.0, 49.0);
        assertThat(capped.trend("F1").getAsDouble()).isCloseTo(1.0, within(1e-9));
        assertThat(capped.lastTimestamp("F1")).contains(T0.plusSeconds(60L * 49));
    }

    @Test
    void concurrentFieldsDoNotInterfere() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int f = 0; f < 4; f++) {
            String fieldId = "F" + f;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    history.record(record(fieldId, i, 100 - i * 0.1));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        for (int f = 0; f < 4; f++) {
            assertThat(history.size("F" + f)).isEqualTo(200);
            assertThat(history.trend("F" + f).getAsDouble()).isCloseTo(-0.1, within(1e-9));
        }
    }
}
