package org.aviator.service.crash.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Multiplicateur affiché en fonction du temps de vol écoulé.
 * Fonction pure : appelée à chaque tick et à chaque demande d'encaissement.
 */
public final class MultiplierClock {

    public static final BigDecimal ONE = new BigDecimal("1.00");

    private MultiplierClock() {}

    public static BigDecimal at(Duration elapsed, BigDecimal target, Duration flightDuration) {
        if (target == null || target.compareTo(ONE) <= 0) return ONE;
        if (elapsed == null || elapsed.isNegative() || elapsed.isZero()) return ONE;
        if (flightDuration == null || flightDuration.isZero() || flightDuration.isNegative()
                || elapsed.compareTo(flightDuration) >= 0) {
            return target.setScale(2, RoundingMode.DOWN);
        }
        // 1 + (target - 1) * elapsed / flight, tronqué pour ne jamais dépasser la cible
        BigDecimal progress = BigDecimal.valueOf(elapsed.toNanos())
                .divide(BigDecimal.valueOf(flightDuration.toNanos()), 12, RoundingMode.DOWN);
        BigDecimal value = BigDecimal.ONE.add(target.subtract(BigDecimal.ONE).multiply(progress));
        return value.setScale(2, RoundingMode.DOWN).min(target.setScale(2, RoundingMode.DOWN));
    }
}
