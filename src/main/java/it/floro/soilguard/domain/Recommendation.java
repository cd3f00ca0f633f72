package it.floro.soilguard.domain;

import java.time.Instant;
import java.util.List;

/**
 * Raccomandazione di fertilizzazione per un campo.
 *
 * rationale elenca, in ordine di severità decrescente, i parametri che hanno guidato la scelta;
 * può chiudersi con il flag di impoverimento post-impianto. È vuota per "mantieni il regime attuale".
 */
public record Recommendation(
        String fieldId,
        Instant timestamp,
        String fertilizerType,              // Prodotto o ammendante consigliato
        double quantity,                    // Dose per unità di superficie
        String unit,                        // Unità della dose (es. kg/ha)
        List<String> rationale,
        List<OverDoseClampedWarning> warnings
) {

    /** Tipo usato quando non c'è alcuna carenza. */
    public static final String MAINTAIN_CURRENT_REGIMEN = "Maintain current regimen";

    /** Flag aggiunto alla motivazione quando lo storico mostra un calo dopo l'impianto. */
    public static final String DEPLETION_FLAG = "post-growth nutrient depletion";

    public Recommendation {
        rationale = List.copyOf(rationale);
        warnings = List.copyOf(warnings);
    }

    public static Recommendation maintain(String fieldId, Instant timestamp) {
        return new Recommendation(fieldId, timestamp, MAINTAIN_CURRENT_REGIMEN, 0.0, "", List.of(), List.of());
    }

    public boolean isMaintain() {
        return MAINTAIN_CURRENT_REGIMEN.equals(fertilizerType);
    }

    public boolean flagsDepletion() {
        return rationale.contains(DEPLETION_FLAG);
    }
}
