package org.aviator.service;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.aviator.dto.SettingsUpdateRequest;
import org.aviator.model.GameSettings;
import org.aviator.repo.GameSettingsRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Configuration du moteur. Valeurs par défaut lues dans application.properties,
 * écrasées par la ligne game_settings au démarrage. Le scheduler lit un {@link Snapshot}
 * à la création de chaque round : une modification ne touche jamais le round en cours.
 */
@Slf4j
@Service
public class GameSettingsService {

    private static final BigDecimal MAX_HOUSE_EDGE = new BigDecimal("20.00");

    public record Snapshot(BigDecimal houseEdge,
                           int bettingDurationSeconds,
                           int gameIntervalSeconds,
                           BigDecimal minBet,
                           BigDecimal maxBet,
                           BigDecimal maxCashoutMultiplier,
                           int maxFlightSeconds,
                           boolean maintenanceMode) {

        public Duration bettingDuration() { return Duration.ofSeconds(bettingDurationSeconds); }

        public Duration gameInterval() { return Duration.ofSeconds(gameIntervalSeconds); }

        public Duration maxFlight() { return Duration.ofSeconds(maxFlightSeconds); }
    }

    private final GameSettingsRepository repo;
    private volatile Snapshot current;

    public GameSettingsService(GameSettingsRepository repo,
                               @Value("${crash.house-edge:3.00}") BigDecimal houseEdge,
                               @Value("${crash.betting-duration-seconds:10}") int bettingDurationSeconds,
                               @Value("${crash.game-interval-seconds:5}") int gameIntervalSeconds,
                               @Value("${crash.min-bet:1.00}") BigDecimal minBet,
                               @Value("${crash.max-bet:10000.00}") BigDecimal maxBet,
                               @Value("${crash.max-cashout-multiplier:1000.00}") BigDecimal maxCashoutMultiplier,
                               @Value("${crash.max-flight-seconds:30}") int maxFlightSeconds) {
        this.repo = repo;
        this.current = validate(new Snapshot(houseEdge, bettingDurationSeconds, gameIntervalSeconds,
                minBet, maxBet, maxCashoutMultiplier, maxFlightSeconds, false));
    }

    @PostConstruct // au démarrage → la ligne en base fait foi
    public void initFromDb() {
        GameSettings row = repo.findFirstByOrderByIdAsc().orElse(null);
        if (row == null) {
            repo.save(toEntity(current, new GameSettings()));
            log.info("game_settings initialisé avec les valeurs par défaut: {}", current);
            return;
        }
        try {
            current = validate(fromEntity(row));
        } catch (IllegalArgumentException ex) {
            log.error("game_settings invalide en base, valeurs par défaut conservées: {}", ex.getMessage());
        }
    }

    public Snapshot current() {
        return current;
    }

    public synchronized Snapshot update(SettingsUpdateRequest req) {
        Snapshot base = current;
        Snapshot next = validate(new Snapshot(
                req.houseEdge != null ? req.houseEdge : base.houseEdge(),
                req.bettingDurationSeconds != null ? req.bettingDurationSeconds : base.bettingDurationSeconds(),
                req.gameIntervalSeconds != null ? req.gameIntervalSeconds : base.gameIntervalSeconds(),
                req.minBet != null ? req.minBet : base.minBet(),
                req.maxBet != null ? req.maxBet : base.maxBet(),
                req.maxCashoutMultiplier != null ? req.maxCashoutMultiplier : base.maxCashoutMultiplier(),
                req.maxFlightSeconds != null ? req.maxFlightSeconds : base.maxFlightSeconds(),
                req.maintenanceMode != null ? req.maintenanceMode : base.maintenanceMode()));

        GameSettings row = repo.findFirstByOrderByIdAsc().orElseGet(GameSettings::new);
        repo.save(toEntity(next, row));
        current = next;
        return next;
    }

    public synchronized Snapshot setMaintenance(boolean on) {
        SettingsUpdateRequest req = new SettingsUpdateRequest();
        req.maintenanceMode = on;
        return update(req);
    }

    private Snapshot validate(Snapshot s) {
        if (s.houseEdge() == null || s.houseEdge().signum() < 0 || s.houseEdge().compareTo(MAX_HOUSE_EDGE) > 0)
            throw new IllegalArgumentException("Marge maison hors bornes (0-20 %)");
        if (s.bettingDurationSeconds() < 1) throw new IllegalArgumentException("Durée de mise invalide");
        if (s.gameIntervalSeconds() < 0) throw new IllegalArgumentException("Pause entre rounds invalide");
        if (s.minBet() == null || s.minBet().signum() <= 0) throw new IllegalArgumentException("Mise minimum invalide");
        if (s.maxBet() == null || s.maxBet().compareTo(s.minBet()) < 0)
            throw new IllegalArgumentException("Mise maximum inférieure au minimum");
        if (s.maxCashoutMultiplier() == null || s.maxCashoutMultiplier().compareTo(BigDecimal.ONE) <= 0)
            throw new IllegalArgumentException("Multiplicateur d'encaissement maximum invalide");
        if (s.maxFlightSeconds() < 1) throw new IllegalArgumentException("Durée de vol maximum invalide");
        return s;
    }

    private static Snapshot fromEntity(GameSettings g) {
        return new Snapshot(g.getHouseEdge(), g.getBettingDurationSeconds(), g.getGameIntervalSeconds(),
                g.getMinBet(), g.getMaxBet(), g.getMaxCashoutMultiplier(), g.getMaxFlightSeconds(),
                g.isMaintenanceMode());
    }

    private static GameSettings toEntity(Snapshot s, GameSettings g) {
        g.setHouseEdge(s.houseEdge());
        g.setBettingDurationSeconds(s.bettingDurationSeconds());
        g.setGameIntervalSeconds(s.gameIntervalSeconds());
        g.setMinBet(s.minBet());
        g.setMaxBet(s.maxBet());
        g.setMaxCashoutMultiplier(s.maxCashoutMultiplier());
        g.setMaxFlightSeconds(s.maxFlightSeconds());
        g.setMaintenanceMode(s.maintenanceMode());
        g.setUpdatedAt(LocalDateTime.now());
        return g;
    }
}
