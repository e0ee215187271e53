package org.aviator.repo;

import org.aviator.model.BetStatus;
import org.aviator.model.CrashBet;
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

public interface BetRepository extends JpaRepository<CrashBet, Long> {

    boolean existsByRoundIdAndUtilisateurId(Long roundId, Long utilisateurId);

    Optional<CrashBet> findByRoundIdAndUtilisateurId(Long roundId, Long utilisateurId);

    @Query("select b from CrashBet b join fetch b.round join fetch b.utilisateur where b.id = :id")
    Optional<CrashBet> findWithRound(@Param("id") Long id);

    @Query("select b from CrashBet b join fetch b.utilisateur where b.round.id = :roundId and b.status = :status")
    List<CrashBet> findByRoundAndStatus(@Param("roundId") Long roundId, @Param("status") BetStatus status);

    @Query("select b from CrashBet b join fetch b.utilisateur where b.round.id = :roundId " +
            "and b.status = :status and b.autoCashoutAt is not null and b.autoCashoutAt <= :multiplier " +
            "order by b.autoCashoutAt")
    List<CrashBet> findAutoCashoutDue(@Param("roundId") Long roundId,
                                      @Param("status") BetStatus status,
                                      @Param("multiplier") BigDecimal multiplier);

    @Query("select b from CrashBet b join fetch b.utilisateur where b.round.id = :roundId order by b.placedAt")
    List<CrashBet> findForRound(@Param("roundId") Long roundId, Pageable pageable);

    @Query("select b from CrashBet b join fetch b.round where b.utilisateur.id = :uid order by b.placedAt desc")
    List<CrashBet> findRecentForUtilisateur(@Param("uid") Long utilisateurId, Pageable pageable);

    long countByRoundIdAndStatus(Long roundId, BetStatus status);

    long countByRoundIdAndStatusIn(Long roundId, Collection<BetStatus> statuses);

    /**
     * Porte de règlement : ACTIVE -> état terminal, au plus une fois par pari.
     * Retourne 0 si le pari n'est plus ACTIVE (règlement concurrent déjà passé).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update CrashBet b set b.status = :to, b.settledMultiplier = :multiplier, b.payout = :payout, " +
            "b.settledAt = :at where b.id = :id and b.status = :from")
    int settleIfActive(@Param("id") Long id,
                       @Param("from") BetStatus from,
                       @Param("to") BetStatus to,
                       @Param("multiplier") BigDecimal multiplier,
                       @Param("payout") BigDecimal payout,
                       @Param("at") Instant settledAt);

    @Query("select new org.aviator.repo.RoundTotals(count(b), sum(b.amount), sum(b.payout), " +
            "count(distinct b.utilisateur.id), max(b.amount)) from CrashBet b where b.round.id = :roundId")
    RoundTotals totalsForRound(@Param("roundId") Long roundId);
}
