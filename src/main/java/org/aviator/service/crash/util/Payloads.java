package org.aviator.service.crash.util;

import org.aviator.model.BetStatus;
import org.aviator.model.CrashBet;
import org.aviator.model.CrashRound;
import org.aviator.model.RoundStatus;
import org.aviator.service.crash.registry.RoundSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.*;

// Formes JSON envoyées aux clients (REST et STOMP)
@Component
public class Payloads {

    public Map<String, Object> roundState(RoundSnapshot s, Instant now) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", s.roundId());
        m.put("roundNumber", s.roundNumber());
        m.put("status", s.status().name());
        m.put("multiplier", s.multiplierAt(now));
        m.put("bettingWindowEnd", s.bettingWindowEnd());
        m.put("flightStart", s.flightStart());
        m.put("seedHash", s.seedHash());
        // le point de crash ne sort qu'une fois le round terminé
        m.put("finalMultiplier", s.status() == RoundStatus.CRASHED || s.status() == RoundStatus.COMPLETED
                ? s.finalMultiplier() : null);
        m.put("serverTime", now);
        return m;
    }

    public Map<String, Object> bet(CrashBet b, BigDecimal liveMultiplier) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", b.getId());
        m.put("amount", b.getAmount());
        m.put("autoCashoutAt", b.getAutoCashoutAt());
        m.put("status", b.getStatus().name());
        m.put("settledMultiplier", b.getSettledMultiplier());
        m.put("payout", b.getPayout());
        m.put("potentialPayout", b.getStatus() == BetStatus.ACTIVE && liveMultiplier != null
                ? b.getAmount().multiply(liveMultiplier).setScale(2, RoundingMode.DOWN)
                : b.getPayout());
        return m;
    }

    public Map<String, Object> publicBet(CrashBet b) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("pseudo", b.getUtilisateur().getPseudo());
        m.put("amount", b.getAmount());
        m.put("autoCashoutAt", b.getAutoCashoutAt());
        m.put("status", b.getStatus().name());
        m.put("cashoutAt", b.getSettledMultiplier());
        m.put("payout", b.getPayout());
        return m;
    }

    public Map<String, Object> historyEntry(CrashRound r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("roundNumber", r.getRoundNumber());
        m.put("multiplier", r.getFinalMultiplier());
        m.put("crashedAt", r.getCrashedAt());
        return m;
    }

    public Map<String, Object> roundDetail(CrashRound r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", r.getId());
        m.put("roundNumber", r.getRoundNumber());
        m.put("status", r.getStatus().name());
        m.put("seedHash", r.getSeedHash());
        m.put("houseEdge", r.getHouseEdge());
        m.put("bettingWindowEnd", r.getBettingWindowEnd());
        m.put("flightStart", r.getFlightStart());
        m.put("crashedAt", r.getCrashedAt());
        boolean termine = r.getStatus() == RoundStatus.COMPLETED;
        // seed et point de crash révélés seulement après règlement : permet de recalculer le tirage
        m.put("seed", termine ? r.getSeed() : null);
        m.put("crashMultiplier", termine ? r.getCrashMultiplier() : null);
        m.put("finalMultiplier", termine ? r.getFinalMultiplier() : null);
        return m;
    }
}
