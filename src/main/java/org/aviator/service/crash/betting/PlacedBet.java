package org.aviator.service.crash.betting;

import java.math.BigDecimal;

public record PlacedBet(Long betId, Long roundNumber, BigDecimal amount, BigDecimal autoCashoutAt, BigDecimal solde) {
}
