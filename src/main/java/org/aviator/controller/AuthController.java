package org.aviator.controller;

import lombok.extern.slf4j.Slf4j;
import org.aviator.dto.AuthRequest;
import org.aviator.dto.AuthResponse;
import org.aviator.model.Utilisateur;
import org.aviator.repo.UtilisateurRepository;
import org.aviator.security.JwtUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

// Connexion seulement : les comptes sont créés hors de ce service
@Slf4j
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    @Autowired
    private UtilisateurRepository utilisateurRepo;

    @Autowired
    private BCryptPasswordEncoder passwordEncoder;

    @Autowired
    private JwtUtil jwtUtil;

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody AuthRequest req) {
        if (req == null || req.getEmail() == null || req.getMotDePasse() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Email et mot de passe requis"));
        }
        Utilisateur u = utilisateurRepo.findByEmail(req.getEmail().trim()).orElse(null);
        if (u == null || !passwordEncoder.matches(req.getMotDePasse(), u.getMotDePasseHash())) {
            log.info("Échec de connexion pour {}", req.getEmail());
            return ResponseEntity.status(401).body(Map.of("error", "Identifiants invalides"));
        }
        String token = jwtUtil.genererToken(u.getEmail(), u.getRole());
        return ResponseEntity.ok(new AuthResponse(token, u.getEmail(), u.getPseudo(), u.getRole()));
    }
}
