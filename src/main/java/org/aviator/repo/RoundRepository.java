package org.aviator.repo;

import org.aviator.model.CrashRound;
import org.aviator.model.RoundStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Les transitions de phase sont des updates conditionnels sur le statut attendu :
 * 0 ligne modifiée = quelqu'un est déjà passé, rien n'est réécrit.
 */
public interface RoundRepository extends JpaRepository<CrashRound, Long> {

    @Query("select max(r.roundNumber) from CrashRound r")
    Long findMaxRoundNumber();

    Optional<CrashRound> findByRoundNumber(Long roundNumber);

    Optional<CrashRound> findFirstByStatusInOrderByRoundNumberDesc(Collection<RoundStatus> statuses);

    List<CrashRound> findByStatusOrderByRoundNumberDesc(RoundStatus status, Pageable pageable);

    List<CrashRound> findByStatusAndCrashedAtBeforeOrderByRoundNumberAsc(RoundStatus status, Instant before);

    List<CrashRound> findByStatusInAndCreatedAtBefore(Collection<RoundStatus> statuses, Instant before);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CrashRound r set r.status = :to, r.crashMultiplier = :crash, r.flightDurationMs = :flightMs, " +
            "r.flightStart = :start where r.id = :id and r.status = :from and r.crashMultiplier is null")
    int startFlight(@Param("id") Long id,
                    @Param("from") RoundStatus from,
                    @Param("to") RoundStatus to,
                    @Param("crash") BigDecimal crashMultiplier,
                    @Param("flightMs") long flightDurationMs,
                    @Param("start") Instant flightStart);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CrashRound r set r.status = :to, r.finalMultiplier = :finalMultiplier, r.crashedAt = :at " +
            "where r.id = :id and r.status = :from")
    int markCrashed(@Param("id") Long id,
                    @Param("from") RoundStatus from,
                    @Param("to") RoundStatus to,
                    @Param("finalMultiplier") BigDecimal finalMultiplier,
                    @Param("at") Instant crashedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CrashRound r set r.status = :to, r.completedAt = :at where r.id = :id and r.status = :from")
    int markCompleted(@Param("id") Long id,
                      @Param("from") RoundStatus from,
                      @Param("to") RoundStatus to,
                      @Param("at") Instant completedAt);
}
