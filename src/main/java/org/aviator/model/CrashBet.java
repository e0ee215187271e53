package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "crash_bet",
        uniqueConstraints = @UniqueConstraint(name = "uk_crash_bet_user_round", columnNames = {"utilisateur_id", "round_id"}),
        indexes = {
                @Index(name = "crash_bet_round_status_idx", columnList = "round_id,status"),
                @Index(name = "crash_bet_user_idx", columnList = "utilisateur_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CrashBet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "round_id", nullable = false)
    private CrashRound round;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "utilisateur_id", nullable = false)
    private Utilisateur utilisateur;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(name = "auto_cashout_at", precision = 10, scale = 2)
    private BigDecimal autoCashoutAt;

    // ne quitte ACTIVE qu'une seule fois, via BetRepository.settleIfActive
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BetStatus status = BetStatus.ACTIVE;

    @Column(name = "settled_multiplier", precision = 10, scale = 2)
    private BigDecimal settledMultiplier;

    @Builder.Default
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal payout = BigDecimal.ZERO;

    @Column(name = "placed_at", nullable = false, updatable = false)
    private Instant placedAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @PrePersist
    public void prePersist() {
        if (placedAt == null) placedAt = Instant.now();
    }
}
