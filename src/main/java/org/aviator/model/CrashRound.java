package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Un cycle mise / vol / crash.
 * {@code crashMultiplier} est fixé une seule fois au passage en FLYING et n'est plus jamais réécrit ;
 * {@code finalMultiplier} est la valeur à laquelle le round s'est réellement terminé
 * (inférieure au point de crash si le round a été forcé).
 */
@Entity
@Table(name = "crash_round",
        uniqueConstraints = @UniqueConstraint(name = "uk_crash_round_number", columnNames = "round_number"),
        indexes = @Index(name = "crash_round_status_idx", columnList = "status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CrashRound {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "round_number", nullable = false)
    private Long roundNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RoundStatus status;

    // révélé seulement une fois le round terminé
    @Column(nullable = false, length = 64)
    private String seed;

    @Column(name = "seed_hash", nullable = false, length = 64)
    private String seedHash;

    // paramètres figés à la création
    @Column(name = "house_edge", nullable = false, precision = 5, scale = 2)
    private BigDecimal houseEdge;

    @Column(name = "min_bet", nullable = false, precision = 14, scale = 2)
    private BigDecimal minBet;

    @Column(name = "max_bet", nullable = false, precision = 14, scale = 2)
    private BigDecimal maxBet;

    @Column(name = "max_cashout_multiplier", nullable = false, precision = 10, scale = 2)
    private BigDecimal maxCashoutMultiplier;

    @Column(name = "max_flight_seconds", nullable = false)
    private Integer maxFlightSeconds;

    @Column(name = "crash_multiplier", precision = 10, scale = 2)
    private BigDecimal crashMultiplier;

    @Column(name = "final_multiplier", precision = 10, scale = 2)
    private BigDecimal finalMultiplier;

    @Column(name = "flight_duration_ms")
    private Long flightDurationMs;

    @Column(name = "betting_window_end", nullable = false)
    private Instant bettingWindowEnd;

    @Column(name = "flight_start")
    private Instant flightStart;

    @Column(name = "crashed_at")
    private Instant crashedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
