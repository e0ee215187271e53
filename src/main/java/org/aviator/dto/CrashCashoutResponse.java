package org.aviator.dto;

import java.math.BigDecimal;

public class CrashCashoutResponse {
    public Long betId;
    public BigDecimal multiplier;
    public BigDecimal payout;     // crédité
    public BigDecimal solde;      // solde après crédit

    public CrashCashoutResponse(Long betId, BigDecimal multiplier, BigDecimal payout, BigDecimal solde) {
        this.betId = betId;
        this.multiplier = multiplier;
        this.payout = payout;
        this.solde = solde;
    }
}
