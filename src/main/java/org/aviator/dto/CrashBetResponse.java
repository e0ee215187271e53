package org.aviator.dto;

import java.math.BigDecimal;

public class CrashBetResponse {
    public Long betId;
    public Long roundNumber;
    public BigDecimal montant;
    public BigDecimal autoCashoutAt;
    public BigDecimal solde;      // solde après débit

    public CrashBetResponse(Long betId, Long roundNumber, BigDecimal montant, BigDecimal autoCashoutAt, BigDecimal solde) {
        this.betId = betId;
        this.roundNumber = roundNumber;
        this.montant = montant;
        this.autoCashoutAt = autoCashoutAt;
        this.solde = solde;
    }
}
