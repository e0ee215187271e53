package org.aviator.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public class CrashBetRequest {
    @NotNull(message = "Montant requis")
    @DecimalMin(value = "0.01", message = "La mise doit être > 0")
    public BigDecimal montant;

    @DecimalMin(value = "1.00", inclusive = false, message = "L'encaissement auto doit dépasser 1.00")
    public BigDecimal autoCashoutAt; // null = pas d'encaissement automatique

    public CrashBetRequest() {}

    public CrashBetRequest(BigDecimal montant, BigDecimal autoCashoutAt) {
        this.montant = montant;
        this.autoCashoutAt = autoCashoutAt;
    }
}
