package org.aviator.service.crash.engine;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Random;

/**
 * Tire le point de crash d'un round à partir de sa seed.
 * Même seed + même marge = même résultat (audit) ; la marge déplace les bornes
 * des tranches vers les petits multiplicateurs.
 */
@Component
public class CrashPointGenerator {

    private static final BigDecimal MIN_MULTIPLIER = new BigDecimal("1.00");
    private static final double MIN_FLIGHT_SECONDS = 1.0;

    private final SecureRandom seedSource = new SecureRandom();

    public CrashPoint generate(String seed, BigDecimal houseEdgePercent, Duration maxFlight) {
        if (seed == null || seed.isBlank()) throw new IllegalArgumentException("Seed manquante");
        double edge = houseEdgePercent == null ? 0.0 : houseEdgePercent.doubleValue() / 100.0;

        Random rng = new Random(seedToLong(seed));
        double r = rng.nextDouble();
        double u = rng.nextDouble();

        double multiplier;
        if (r < 0.50 + edge) {
            multiplier = 1.0 + u * 1.5;           // 1.00x - 2.50x
        } else if (r < 0.80 + edge / 2) {
            multiplier = 2.5 + u * 5.0;           // 2.50x - 7.50x
        } else if (r < 0.95 + edge / 4) {
            multiplier = 7.5 + u * 15.0;          // 7.50x - 22.50x
        } else {
            multiplier = 22.5 + u * 77.5;         // 22.50x - 100x
        }

        BigDecimal crash = BigDecimal.valueOf(multiplier).setScale(2, RoundingMode.HALF_UP).max(MIN_MULTIPLIER);
        return new CrashPoint(crash, flightDurationFor(crash, maxFlight));
    }

    /** Durée de vol croissante avec le multiplicateur, bornée par {@code maxFlight}. */
    public Duration flightDurationFor(BigDecimal crashMultiplier, Duration maxFlight) {
        double seconds = Math.max(MIN_FLIGHT_SECONDS, 1.0 + 6.0 * Math.log(crashMultiplier.doubleValue()));
        if (maxFlight != null && !maxFlight.isNegative() && !maxFlight.isZero()) {
            seconds = Math.min(seconds, maxFlight.toMillis() / 1000.0);
        }
        return Duration.ofMillis(Math.max(1L, Math.round(seconds * 1000.0)));
    }

    /** Nouvelle seed aléatoire (32 caractères hex). */
    public String newSeed() {
        byte[] bytes = new byte[16];
        seedSource.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /** Empreinte publiée pendant le round ; la seed n'est révélée qu'à la fin. */
    public static String hash(String seed) {
        return HexFormat.of().formatHex(sha256(seed));
    }

    private static long seedToLong(String seed) {
        return ByteBuffer.wrap(sha256(seed), 0, Long.BYTES).getLong();
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }
}
