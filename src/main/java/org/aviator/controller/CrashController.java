package org.aviator.controller;

import jakarta.validation.Valid;
import org.aviator.dto.CrashBetRequest;
import org.aviator.dto.CrashBetResponse;
import org.aviator.dto.CrashCashoutRequest;
import org.aviator.dto.CrashCashoutResponse;
import org.aviator.model.Utilisateur;
import org.aviator.repo.UtilisateurRepository;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.CrashQueryService;
import org.aviator.service.crash.betting.BettingService;
import org.aviator.service.crash.betting.PlacedBet;
import org.aviator.service.crash.settlement.CashoutResult;
import org.aviator.service.crash.settlement.SettlementService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/crash")
public class CrashController {

    @Autowired private UtilisateurRepository utilisateurRepo;
    @Autowired private BettingService bettingService;
    @Autowired private SettlementService settlementService;
    @Autowired private CrashQueryService queryService;

    // ==================== ÉTAT / HISTORIQUE ====================
    @GetMapping("/state")
    public ResponseEntity<?> state(Authentication auth) {
        Utilisateur u = auth == null ? null : utilisateurRepo.findByEmail(auth.getName()).orElse(null);
        return ResponseEntity.ok(queryService.state(u));
    }

    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(queryService.history(limit));
    }

    // seed et point de crash visibles une fois le round terminé
    @GetMapping("/rounds/{roundNumber}")
    public ResponseEntity<?> round(@PathVariable Long roundNumber) {
        return ResponseEntity.ok(queryService.round(roundNumber));
    }

    // ==================== MISE ====================
    @PostMapping("/bet")
    public ResponseEntity<?> bet(@Valid @RequestBody CrashBetRequest req, Authentication auth) {
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "INVALID_AMOUNT", "message", "Requête vide"));
        Utilisateur u = utilisateurRepo.findByEmail(auth.getName()).orElseThrow();
        try {
            PlacedBet b = bettingService.placeBet(u, req.montant, req.autoCashoutAt);
            return ResponseEntity.ok(new CrashBetResponse(b.betId(), b.roundNumber(), b.amount(), b.autoCashoutAt(), b.solde()));
        } catch (CrashException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getReason().name(), "message", e.getMessage()));
        }
    }

    // ==================== ENCAISSEMENT ====================
    @PostMapping("/cashout")
    public ResponseEntity<?> cashout(@Valid @RequestBody CrashCashoutRequest req, Authentication auth) {
        if (req == null) return ResponseEntity.badRequest().body(Map.of("error", "INVALID_MULTIPLIER", "message", "Requête vide"));
        Utilisateur u = utilisateurRepo.findByEmail(auth.getName()).orElseThrow();
        try {
            CashoutResult r = settlementService.cashOut(u, req.betId, req.multiplier);
            return ResponseEntity.ok(new CrashCashoutResponse(r.betId(), r.multiplier(), r.payout(), r.solde()));
        } catch (CrashException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getReason().name(), "message", e.getMessage()));
        }
    }

    // ==================== JOUEUR ====================
    @GetMapping("/me/bets")
    public ResponseEntity<?> myBets(@RequestParam(defaultValue = "20") int limit, Authentication auth) {
        Utilisateur u = utilisateurRepo.findByEmail(auth.getName()).orElseThrow();
        return ResponseEntity.ok(queryService.myBets(u, limit));
    }

    @GetMapping("/me/stats")
    public ResponseEntity<?> myStats(Authentication auth) {
        Utilisateur u = utilisateurRepo.findByEmail(auth.getName()).orElseThrow();
        return ResponseEntity.ok(queryService.myStats(u));
    }
}
