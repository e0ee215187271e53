package org.aviator.repo;

import java.math.BigDecimal;

// Projection de l'agrégat d'un round (BetRepository.totalsForRound)
public record RoundTotals(Long totalBets,
                          BigDecimal totalStaked,
                          BigDecimal totalPaidOut,
                          Long uniquePlayers,
                          BigDecimal highestBet) {

    public BigDecimal totalStakedOrZero() {
        return totalStaked == null ? BigDecimal.ZERO : totalStaked;
    }

    public BigDecimal totalPaidOutOrZero() {
        return totalPaidOut == null ? BigDecimal.ZERO : totalPaidOut;
    }

    public BigDecimal highestBetOrZero() {
        return highestBet == null ? BigDecimal.ZERO : highestBet;
    }
}
