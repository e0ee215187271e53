package org.aviator.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public class CrashCashoutRequest {
    public Long betId;            // optionnel : sinon la mise du joueur sur le round courant
    @NotNull(message = "Multiplicateur requis")
    @DecimalMin(value = "1.00", message = "Multiplicateur invalide")
    public BigDecimal multiplier;

    public CrashCashoutRequest() {}

    public CrashCashoutRequest(Long betId, BigDecimal multiplier) {
        this.betId = betId;
        this.multiplier = multiplier;
    }
}
