package org.aviator.service.crash.settlement;

import org.aviator.model.BetStatus;

import java.math.BigDecimal;

public record CashoutResult(Long betId,
                            Long roundNumber,
                            BetStatus status,
                            BigDecimal multiplier,
                            BigDecimal payout,
                            BigDecimal solde) {
}
