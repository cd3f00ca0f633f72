package it.floro.soilguard.service;

import com.fasterxml.jackson.databind.JsonNode;
import it.floro.soilguard.domain.RawSensorSample;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.error.InvalidReadingException;
import it.floro.soilguard.error.MissingFieldException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converte le voci di un canale IoT (formato feed: created_at + field1..field8 come stringhe)
 * in RawSensorSample.
 *
 * Un canale vuoto o mancante non diventa 0:
 * resta null e il ReadingNormalizer lo rifiuta con MissingFieldException.
 */
@Component
public class FeedEntryMapper {

    /**
     * Associazione misura → nome del canale nel feed.
     *
     * @param channels Canale per ciascun parametro valutato
     * @param humidityChannel Canale dell'umidità dell'aria (null o vuoto = non letto)
     */
    public record FieldMapping(Map<SoilParameter, String> channels, String humidityChannel) {

        /**
         * @throws InvalidConfigurationException se un parametro non ha canale
         *         o se due misure condividono lo stesso canale
         */
        public FieldMapping {
            Map<SoilParameter, String> copy = new EnumMap<>(SoilParameter.class);
            Set<String> used = new HashSet<>();
            for (SoilParameter p : SoilParameter.values()) {
                String channel = channels == null ? null : channels.get(p);
                if (channel == null || channel.isBlank()) {
                    throw new InvalidConfigurationException("Canale del feed non configurato per " + p.key());
                }
                channel = channel.trim();
                if (!used.add(channel)) {
                    throw new InvalidConfigurationException("Canale del feed " + channel + " assegnato a più misure");
                }
                copy.put(p, channel);
            }
            if (humidityChannel != null) {
                humidityChannel = humidityChannel.isBlank() ? null : humidityChannel.trim();
            }
            if (humidityChannel != null && !used.add(humidityChannel)) {
                throw new InvalidConfigurationException("Canale del feed " + humidityChannel + " assegnato a più misure");
            }
            channels = Collections.unmodifiableMap(copy);
        }

        /**
         * Cablaggio standard del nodo: field1 temperatura, field2 umidità suolo, field3 N,
         * field4 P, field5 K, field6 pH, field7 umidità aria.
         */
        public static FieldMapping defaults() {
            Map<SoilParameter, String> m = new EnumMap<>(SoilParameter.class);
            m.put(SoilParameter.TEMPERATURE, "field1");
            m.put(SoilParameter.MOISTURE, "field2");
            m.put(SoilParameter.NITROGEN, "field3");
            m.put(SoilParameter.PHOSPHORUS, "field4");
            m.put(SoilParameter.POTASSIUM, "field5");
            m.put(SoilParameter.PH, "field6");
            return new FieldMapping(m, "field7");
        }
    }

    /**
     * Prende l'ultima voce di un feed completo ({"channel": ..., "feeds": [...]}).
     *
     * @return Campione dell'ultima voce, vuoto se il canale non ha ancora dati
     */
    public Optional<RawSensorSample> mapLatest(String fieldId, JsonNode feed, FieldMapping mapping) {
        JsonNode feeds = feed == null ? null : feed.get("feeds");
        if (feeds == null || !feeds.isArray() || feeds.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(map(fieldId, feeds.get(feeds.size() - 1), mapping));
    }

    /**
     * @param fieldId Campo a cui appartiene il nodo
     * @param entry Singola voce del feed
     * @param mapping Associazione misura → canale
     * @throws MissingFieldException se manca created_at
     * @throws InvalidReadingException se un valore o la data non sono interpretabili
     */
    public RawSensorSample map(String fieldId, JsonNode entry, FieldMapping mapping) {
        return new RawSensorSample(
                fieldId,
                timestamp(entry),
                number(entry, mapping.channels().get(SoilParameter.NITROGEN), SoilParameter.NITROGEN.key()),
                number(entry, mapping.channels().get(SoilParameter.PHOSPHORUS), SoilParameter.PHOSPHORUS.key()),
                number(entry, mapping.channels().get(SoilParameter.POTASSIUM), SoilParameter.POTASSIUM.key()),
                number(entry, mapping.channels().get(SoilParameter.PH), SoilParameter.PH.key()),
                number(entry, mapping.channels().get(SoilParameter.MOISTURE), SoilParameter.MOISTURE.key()),
                number(entry, mapping.channels().get(SoilParameter.TEMPERATURE), SoilParameter.TEMPERATURE.key()),
                number(entry, mapping.humidityChannel(), "humidity")
        );
    }

    // ========== METODI HELPER PRIVATI ==========

    private static Instant timestamp(JsonNode entry) {
        JsonNode node = entry == null ? null : entry.get("created_at");
        if (node == null || node.isNull() || node.asText().isBlank()) {
            throw new MissingFieldException("timestamp");
        }
        try {
            return Instant.parse(node.asText().trim());
        } catch (DateTimeParseException e) {
            throw new InvalidReadingException("timestamp", "Data non interpretabile: " + node.asText());
        }
    }

    /**
     * Legge un canale: i feed trasportano i numeri come stringhe, talvolta come numeri JSON.
     */
    private static Double number(JsonNode entry, String channel, String name) {
        if (channel == null || entry == null) return null;
        JsonNode node = entry.get(channel);
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();

        String text = node.asText().trim();
        if (text.isEmpty()) return null;
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new InvalidReadingException(name, "Valore non numerico per " + name + ": " + text);
        }
    }
}
