package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

// écrit une seule fois, au passage en COMPLETED
@Entity
@Table(name = "round_statistics",
        uniqueConstraints = @UniqueConstraint(name = "uk_round_statistics_round", columnNames = "round_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundStatistics {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "round_id", nullable = false)
    private CrashRound round;

    @Column(name = "total_bets", nullable = false)
    private long totalBets;

    @Column(name = "total_staked", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalStaked;

    @Column(name = "total_paid_out", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalPaidOut;

    @Column(name = "unique_players", nullable = false)
    private long uniquePlayers;

    @Column(name = "highest_bet", nullable = false, precision = 14, scale = 2)
    private BigDecimal highestBet;

    @Column(nullable = false)
    private long winners;

    @Column(nullable = false)
    private long losers;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
