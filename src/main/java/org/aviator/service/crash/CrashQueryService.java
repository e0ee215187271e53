package org.aviator.service.crash;

import lombok.RequiredArgsConstructor;
import org.aviator.model.*;
import org.aviator.repo.BetRepository;
import org.aviator.repo.PlayerStatisticsRepository;
import org.aviator.repo.RoundRepository;
import org.aviator.repo.RoundStatisticsRepository;
import org.aviator.service.crash.registry.CurrentRoundRegistry;
import org.aviator.service.crash.registry.RoundSnapshot;
import org.aviator.service.crash.util.Payloads;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.*;

// Lectures pour l'API : état courant, historique, détail d'un round, paris et statistiques
@Service
@RequiredArgsConstructor
public class CrashQueryService {
    private static final int ROUND_BETS_LIMIT = 50, RECENT_ROUNDS = 20;

    private final CurrentRoundRegistry registry;
    private final RoundRepository rounds;
    private final BetRepository bets;
    private final RoundStatisticsRepository roundStats;
    private final PlayerStatisticsRepository playerStats;
    private final Payloads payloads;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Map<String, Object> state(Utilisateur u) {
        Instant now = clock.instant();
        Map<String, Object> m = new LinkedHashMap<>();
        RoundSnapshot s = registry.current().orElse(null);
        if (s == null) {
            m.put("round", null);
            m.put("myBet", null);
            m.put("bets", List.of());
        } else {
            BigDecimal live = s.multiplierAt(now);
            m.put("round", payloads.roundState(s, now));
            m.put("myBet", u == null ? null : bets.findByRoundIdAndUtilisateurId(s.roundId(), u.getId())
                    .map(b -> payloads.bet(b, s.status() == RoundStatus.FLYING ? live : null))
                    .orElse(null));
            m.put("bets", bets.findForRound(s.roundId(), PageRequest.of(0, ROUND_BETS_LIMIT)).stream()
                    .map(payloads::publicBet).toList());
        }
        m.put("history", history(RECENT_ROUNDS));
        return m;
    }

    @Transactional(readOnly = true)
    public List<Map<String, Object>> history(int limit) {
        int size = limit <= 0 ? RECENT_ROUNDS : Math.min(limit, 100);
        return rounds.findByStatusOrderByRoundNumberDesc(RoundStatus.COMPLETED, PageRequest.of(0, size)).stream()
                .map(payloads::historyEntry).toList();
    }

    @Transactional(readOnly = true)
    public Map<String, Object> round(Long roundNumber) {
        return rounds.findByRoundNumber(roundNumber)
                .map(payloads::roundDetail)
                .orElseThrow(() -> new NoSuchElementException("Round introuvable"));
    }

    @Transactional(readOnly = true)
    public List<Map<String, Object>> myBets(Utilisateur u, int limit) {
        int size = limit <= 0 ? 20 : Math.min(limit, 100);
        return bets.findRecentForUtilisateur(u.getId(), PageRequest.of(0, size)).stream().map(b -> {
            Map<String, Object> m = payloads.bet(b, null);
            m.put("roundNumber", b.getRound().getRoundNumber());
            m.put("placedAt", b.getPlacedAt());
            return m;
        }).toList();
    }

    @Transactional(readOnly = true)
    public Map<String, Object> myStats(Utilisateur u) {
        PlayerStatistics s = playerStats.findById(u.getId())
                .orElseGet(() -> PlayerStatistics.builder().utilisateurId(u.getId()).build());
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("gamesPlayed", s.getGamesPlayed());
        m.put("gamesWon", s.getGamesWon());
        m.put("gamesLost", s.getGamesLost());
        m.put("totalMise", s.getTotalMise());
        m.put("totalGagne", s.getTotalGagne());
        m.put("biggestWin", s.getBiggestWin());
        m.put("highestMultiplier", s.getHighestMultiplier());
        return m;
    }

    @Transactional(readOnly = true)
    public Map<String, Object> roundStatistics(Long roundNumber) {
        CrashRound r = rounds.findByRoundNumber(roundNumber)
                .orElseThrow(() -> new NoSuchElementException("Round introuvable"));
        RoundStatistics st = roundStats.findByRoundId(r.getId())
                .orElseThrow(() -> new NoSuchElementException("Statistiques indisponibles"));
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("roundNumber", r.getRoundNumber());
        m.put("crashMultiplier", r.getCrashMultiplier());
        m.put("finalMultiplier", r.getFinalMultiplier());
        m.put("totalBets", st.getTotalBets());
        m.put("totalStaked", st.getTotalStaked());
        m.put("totalPaidOut", st.getTotalPaidOut());
        m.put("uniquePlayers", st.getUniquePlayers());
        m.put("highestBet", st.getHighestBet());
        m.put("winners", st.getWinners());
        m.put("losers", st.getLosers());
        m.put("houseProfit", st.getTotalStaked().subtract(st.getTotalPaidOut()));
        return m;
    }
}
