package org.aviator.controller;

import org.aviator.model.Utilisateur;
import org.aviator.model.Wallet;
import org.aviator.model.WalletTransaction;
import org.aviator.repo.UtilisateurRepository;
import org.aviator.service.WalletService;
import org.aviator.service.WalletSseService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Lecture seule : les mouvements de solde ne passent que par les mises et les gains
@RestController
@RequestMapping("/api/wallet")
public class WalletController {

    @Autowired
    private WalletService walletService;

    @Autowired
    private UtilisateurRepository utilisateurRepo;

    @Autowired
    private WalletSseService walletSseService;

    @GetMapping("/me")
    public ResponseEntity<?> solde(Authentication authentication) {
        Utilisateur u = utilisateurRepo.findByEmail(authentication.getName()).orElseThrow();
        Wallet w = walletService.getWalletParUtilisateur(u);
        return ResponseEntity.ok(Map.of(
                "solde", w.getSolde(),
                "totalMise", w.getTotalMise(),
                "totalGagne", w.getTotalGagne()
        ));
    }

    @GetMapping("/transactions")
    public ResponseEntity<?> transactions(@RequestParam(defaultValue = "20") int limit, Authentication authentication) {
        Utilisateur u = utilisateurRepo.findByEmail(authentication.getName()).orElseThrow();
        List<Map<String, Object>> body = walletService.transactions(u, limit).stream().map(this::toJson).toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stream")
    public SseEmitter stream(Authentication authentication) {
        if (authentication == null) throw new ResponseStatusException(HttpStatus.UNAUTHORIZED);
        return walletSseService.register(authentication.getName());
    }

    private Map<String, Object> toJson(WalletTransaction t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", t.getId());
        m.put("kind", t.getKind().name());
        m.put("amount", t.getAmount());
        m.put("reference", t.getReference());
        m.put("description", t.getDescription());
        m.put("createdAt", t.getCreatedAt());
        return m;
    }
}
