package org.aviator.service.crash.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aviator.model.BetStatus;
import org.aviator.model.CrashBet;
import org.aviator.repo.BetRepository;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

// Appelé à chaque tick : encaisse les paris dont la cible auto est atteinte
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoCashoutMonitor {
    private final BetRepository bets;
    private final SettlementService settlement;

    public int tick(Long roundId, BigDecimal currentMultiplier) {
        List<CrashBet> dus = bets.findAutoCashoutDue(roundId, BetStatus.ACTIVE, currentMultiplier);
        int regles = 0;
        for (CrashBet b : dus) {
            try {
                settlement.settleAuto(b.getId(), b.getAutoCashoutAt());
                regles++;
            } catch (CrashException ex) {
                if (ex.getReason() != RejectionReason.BET_NOT_ACTIVE) throw ex;
                log.debug("Pari {} déjà réglé avant l'encaissement auto", b.getId());
            }
        }
        return regles;
    }
}
