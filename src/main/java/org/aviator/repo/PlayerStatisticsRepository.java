package org.aviator.repo;

import org.aviator.model.PlayerStatistics;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public interface PlayerStatisticsRepository extends JpaRepository<PlayerStatistics, Long> {

    // incrément atomique, pas de lecture-modification-écriture
    @Modifying(flushAutomatically = true)
    @Query("update PlayerStatistics s set s.gamesPlayed = s.gamesPlayed + 1, " +
            "s.gamesWon = s.gamesWon + :won, s.gamesLost = s.gamesLost + :lost, " +
            "s.totalMise = s.totalMise + :mise, s.totalGagne = s.totalGagne + :gain, " +
            "s.biggestWin = case when s.biggestWin < :gain then :gain else s.biggestWin end, " +
            "s.highestMultiplier = case when s.highestMultiplier < :multiplier then :multiplier else s.highestMultiplier end, " +
            "s.updatedAt = :now where s.utilisateurId = :uid")
    int increment(@Param("uid") Long utilisateurId,
                  @Param("won") long won,
                  @Param("lost") long lost,
                  @Param("mise") BigDecimal mise,
                  @Param("gain") BigDecimal gain,
                  @Param("multiplier") BigDecimal multiplier,
                  @Param("now") LocalDateTime now);
}
