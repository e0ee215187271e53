package org.aviator.service.crash.registry;

import org.aviator.model.CrashRound;
import org.aviator.model.RoundStatus;
import org.aviator.service.crash.engine.MultiplierClock;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Vue immuable du round courant, remplacée d'un bloc à chaque transition de phase.
 * {@code crashMultiplier} ne sort jamais vers les clients tant que le round vole.
 */
public record RoundSnapshot(long version,
                            Long roundId,
                            Long roundNumber,
                            RoundStatus status,
                            String seedHash,
                            Instant bettingWindowEnd,
                            Instant flightStart,
                            Duration flightDuration,
                            BigDecimal crashMultiplier,
                            BigDecimal finalMultiplier,
                            Instant crashedAt) {

    public static RoundSnapshot of(CrashRound r, long version) {
        Duration flight = r.getFlightDurationMs() == null ? null : Duration.ofMillis(r.getFlightDurationMs());
        return new RoundSnapshot(version, r.getId(), r.getRoundNumber(), r.getStatus(), r.getSeedHash(),
                r.getBettingWindowEnd(), r.getFlightStart(), flight, r.getCrashMultiplier(),
                r.getFinalMultiplier(), r.getCrashedAt());
    }

    public BigDecimal multiplierAt(Instant now) {
        return switch (status) {
            case FLYING -> MultiplierClock.at(Duration.between(flightStart, now), crashMultiplier, flightDuration);
            case CRASHED, COMPLETED -> finalMultiplier != null ? finalMultiplier : MultiplierClock.ONE;
            default -> MultiplierClock.ONE;
        };
    }

    public boolean acceptsBets(Instant now) {
        return status == RoundStatus.BETTING && bettingWindowEnd != null && now.isBefore(bettingWindowEnd);
    }
}
