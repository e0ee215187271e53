package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

// Compteurs par joueur, mis à jour uniquement par incréments atomiques (PlayerStatisticsRepository)
@Entity
@Table(name = "player_statistics")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerStatistics {
    @Id
    @Column(name = "utilisateur_id")
    private Long utilisateurId;

    @Builder.Default
    @Column(name = "games_played", nullable = false)
    private long gamesPlayed = 0;

    @Builder.Default
    @Column(name = "games_won", nullable = false)
    private long gamesWon = 0;

    @Builder.Default
    @Column(name = "games_lost", nullable = false)
    private long gamesLost = 0;

    @Builder.Default
    @Column(name = "total_mise", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalMise = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "total_gagne", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalGagne = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "biggest_win", nullable = false, precision = 14, scale = 2)
    private BigDecimal biggestWin = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "highest_multiplier", nullable = false, precision = 10, scale = 2)
    private BigDecimal highestMultiplier = BigDecimal.ZERO;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
