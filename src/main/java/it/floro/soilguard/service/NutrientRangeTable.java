package it.floro.soilguard.service;

import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.NutrientRange;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.error.MissingRangeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tabella di riferimento immutabile: una riga per coppia (parametro, fase).
 *
 * I valori arrivano dalla configurazione (soilguard.ranges) e possono evolvere
 * senza toccare il codice di classificazione.
 */
public final class NutrientRangeTable {

    private final Map<GrowthStage, Map<SoilParameter, NutrientRange>> rows = new EnumMap<>(GrowthStage.class);

    /**
     * @param ranges Righe della tabella
     * @throws InvalidConfigurationException se la stessa coppia compare due volte
     */
    public NutrientRangeTable(Collection<NutrientRange> ranges) {
        for (NutrientRange r : ranges) {
            Map<SoilParameter, NutrientRange> byParam =
                    rows.computeIfAbsent(r.stage(), s -> new EnumMap<>(SoilParameter.class));
            if (byParam.putIfAbsent(r.parameter(), r) != null) {
                throw new InvalidConfigurationException(
                        "Range duplicato per " + r.parameter() + " in fase " + r.stage());
            }
        }
    }

    public Optional<NutrientRange> find(SoilParameter parameter, GrowthStage stage) {
        Map<SoilParameter, NutrientRange> byParam = rows.get(stage);
        return Optional.ofNullable(byParam == null ? null : byParam.get(parameter));
    }

    /**
     * @throws MissingRangeException se la coppia non è configurata
     */
    public NutrientRange require(SoilParameter parameter, GrowthStage stage) {
        return find(parameter, stage).orElseThrow(() -> new MissingRangeException(parameter, stage));
    }

    /**
     * @return Descrizione delle coppie (fase/parametro) prive di riga, vuota se la tabella è totale
     */
    public List<String> missingEntries() {
        List<String> missing = new ArrayList<>();
        for (GrowthStage stage : GrowthStage.values()) {
            for (SoilParameter p : SoilParameter.values()) {
                if (find(p, stage).isEmpty()) {
                    missing.add(stage + "/" + p);
                }
            }
        }
        return missing;
    }

    /**
     * Verifica di avvio: ogni coppia richiesta dal classificatore deve risolversi.
     *
     * @throws MissingRangeException alla prima coppia mancante
     */
    public void requireComplete() {
        for (GrowthStage stage : GrowthStage.values()) {
            for (SoilParameter p : SoilParameter.values()) {
                require(p, stage);
            }
        }
    }

    public int size() {
        return rows.values().stream().mapToInt(Map::size).sum();
    }
}
