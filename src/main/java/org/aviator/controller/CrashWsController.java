package org.aviator.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aviator.dto.CrashBetRequest;
import org.aviator.dto.CrashCashoutRequest;
import org.aviator.model.Utilisateur;
import org.aviator.repo.UtilisateurRepository;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.betting.BettingService;
import org.aviator.service.crash.settlement.SettlementService;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;

// Mêmes commandes que l'API REST ; les refus repartent sur /user/queue/crash/errors
@Slf4j
@Controller
@RequiredArgsConstructor
public class CrashWsController {
    private final UtilisateurRepository utilisateurRepo;
    private final BettingService bettingService;
    private final SettlementService settlementService;
    private final CrashBroadcaster broadcaster;

    @MessageMapping("/crash/bet")
    public void bet(@Payload CrashBetRequest msg, Principal principal) {
        String email = principal.getName();
        try {
            Utilisateur u = utilisateurRepo.findByEmail(email).orElseThrow();
            bettingService.placeBet(u, msg.montant, msg.autoCashoutAt);
        } catch (CrashException e) {
            broadcaster.sendError(email, e.getReason().name(), e.getMessage());
        }
    }

    @MessageMapping("/crash/cashout")
    public void cashout(@Payload CrashCashoutRequest msg, Principal principal) {
        String email = principal.getName();
        try {
            Utilisateur u = utilisateurRepo.findByEmail(email).orElseThrow();
            settlementService.cashOut(u, msg.betId, msg.multiplier);
        } catch (CrashException e) {
            broadcaster.sendError(email, e.getReason().name(), e.getMessage());
        }
    }
}
