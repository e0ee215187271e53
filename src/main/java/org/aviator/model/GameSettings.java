package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

// Ligne unique de configuration du moteur ; appliquée à partir du round suivant
@Entity
@Table(name = "game_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameSettings {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // en pourcentage (3.00 = 3 %)
    @Column(name = "house_edge", nullable = false, precision = 5, scale = 2)
    private BigDecimal houseEdge;

    @Column(name = "betting_duration_seconds", nullable = false)
    private Integer bettingDurationSeconds;

    // pause entre deux rounds
    @Column(name = "game_interval_seconds", nullable = false)
    private Integer gameIntervalSeconds;

    @Column(name = "min_bet", nullable = false, precision = 14, scale = 2)
    private BigDecimal minBet;

    @Column(name = "max_bet", nullable = false, precision = 14, scale = 2)
    private BigDecimal maxBet;

    @Column(name = "max_cashout_multiplier", nullable = false, precision = 10, scale = 2)
    private BigDecimal maxCashoutMultiplier;

    @Column(name = "max_flight_seconds", nullable = false)
    private Integer maxFlightSeconds;

    @Column(name = "maintenance_mode", nullable = false)
    private boolean maintenanceMode;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
