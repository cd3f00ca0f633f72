package it.floro.soilguard.domain;

/**
 * Avviso non bloccante: la dose calcolata superava la dose massima sicura del prodotto
 * ed è stata ridotta. Il chiamante decide se mostrarlo all'agricoltore.
 */
public record OverDoseClampedWarning(
        String fertilizerType,
        double requestedQuantity,           // Dose calcolata prima del limite
        double clampedQuantity,             // Dose raccomandata (= dose massima sicura)
        String unit
) {

    public String message() {
        return String.format("Dose di %s ridotta da %.1f a %.1f %s (dose massima sicura)",
                fertilizerType, requestedQuantity, clampedQuantity, unit);
    }
}
