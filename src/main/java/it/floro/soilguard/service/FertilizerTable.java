package it.floro.soilguard.service;

import it.floro.soilguard.domain.FertilizerProduct;
import it.floro.soilguard.domain.GrowthStage;
import it.floro.soilguard.domain.SoilParameter;
import it.floro.soilguard.error.InvalidConfigurationException;
import it.floro.soilguard.error.MissingFertilizerException;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tabella dei fertilizzanti e ammendanti, nell'ordine di configurazione.
 *
 * L'ordine conta: a parità di copertura vince il prodotto elencato per primo.
 */
public final class FertilizerTable {

    private final List<FertilizerProduct> products;

    public FertilizerTable(List<FertilizerProduct> products) {
        Set<String> names = new HashSet<>();
        for (FertilizerProduct p : products) {
            if (!names.add(p.name())) {
                throw new InvalidConfigurationException("Fertilizzante duplicato: " + p.name());
            }
        }
        this.products = List.copyOf(products);
    }

    public List<FertilizerProduct> products() {
        return products;
    }

    /**
     * Primo composto ammesso nella fase che copre tutti i parametri richiesti
     * senza apportare parametri esterni all'insieme consentito.
     *
     * @param required Parametri che il composto deve coprire
     * @param allowed Parametri che il composto può apportare (le carenze correnti)
     * @param stage Fase colturale
     */
    public Optional<FertilizerProduct> findCompound(Set<SoilParameter> required, Set<SoilParameter> allowed, GrowthStage stage) {
        return products.stream()
                .filter(FertilizerProduct::isCompound)
                .filter(p -> p.appliesTo(stage))
                .filter(p -> p.nutrients().containsAll(required))
                .filter(p -> allowed.containsAll(p.nutrients()))
                .findFirst();
    }

    /**
     * Primo ammendante singolo per il parametro nella fase.
     */
    public Optional<FertilizerProduct> findSingle(SoilParameter parameter, GrowthStage stage) {
        return products.stream()
                .filter(p -> !p.isCompound())
                .filter(p -> p.appliesTo(stage))
                .filter(p -> p.nutrients().contains(parameter))
                .findFirst();
    }

    /**
     * Verifica di avvio: ogni parametro deve avere un ammendante singolo in ogni fase,
     * così una carenza isolata trova sempre una risposta.
     *
     * @throws MissingFertilizerException alla prima coppia scoperta
     */
    public void requireSingleCoverage() {
        for (GrowthStage stage : GrowthStage.values()) {
            for (SoilParameter p : SoilParameter.values()) {
                if (findSingle(p, stage).isEmpty()) {
                    throw new MissingFertilizerException(p, stage);
                }
            }
        }
    }
}
