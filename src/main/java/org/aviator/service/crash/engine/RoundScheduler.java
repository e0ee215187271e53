package org.aviator.service.crash.engine;

import lombok.extern.slf4j.Slf4j;
import org.aviator.model.*;
import org.aviator.repo.*;
import org.aviator.service.AuditLogService;
import org.aviator.service.GameSettingsService;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.aviator.service.crash.registry.CurrentRoundRegistry;
import org.aviator.service.crash.registry.RoundSnapshot;
import org.aviator.service.crash.settlement.AutoCashoutMonitor;
import org.aviator.service.crash.settlement.SettlementService;
import org.aviator.service.crash.settlement.SettlementSummary;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.aviator.service.crash.util.Payloads;
import org.aviator.service.crash.util.PhaseGate;
import org.aviator.service.crash.util.RoundTimers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Boucle de vie des rounds : BETTING → FLYING → CRASHED → COMPLETED, puis round suivant.
 * Toutes les transitions s'exécutent sur le thread unique de {@link RoundTimers} ;
 * chacune est un update conditionnel sur le statut attendu.
 */
@Slf4j
@Service
public class RoundScheduler {
    static final String T_CREATE = "create";
    static final String T_CLOSE = "close-betting";
    static final String T_TICK = "tick";
    static final String T_FORCE = "force-crash";
    static final String T_SETTLE = "settle-retry";
    static final String T_RESUME = "resume";
    static final String T_RECOVER = "recover-crashed";

    private static final long BACKOFF_MIN_MS = 1_000, BACKOFF_MAX_MS = 30_000;
    private static final long MAINTENANCE_POLL_MS = 5_000;
    private static final int SETTLE_PASSES = 3, SETTLE_RETRIES = 5;
    private static final EnumSet<RoundStatus> UNFINISHED =
            EnumSet.of(RoundStatus.WAITING, RoundStatus.BETTING, RoundStatus.FLYING, RoundStatus.CRASHED);

    private final RoundRepository rounds;
    private final BetRepository bets;
    private final RoundStatisticsRepository roundStats;
    private final PlayerStatisticsRepository playerStats;
    private final CrashPointGenerator generator;
    private final GameSettingsService settings;
    private final CurrentRoundRegistry registry;
    private final SettlementService settlement;
    private final AutoCashoutMonitor autoCashout;
    private final PhaseGate gate;
    private final RoundTimers timers;
    private final CrashBroadcaster broadcaster;
    private final Payloads payloads;
    private final AuditLogService audit;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final long tickMs;
    private final boolean autostart;

    private volatile boolean running;
    private final AtomicInteger creationFailures = new AtomicInteger();
    private final AtomicInteger settleRetries = new AtomicInteger();

    public RoundScheduler(RoundRepository rounds,
                          BetRepository bets,
                          RoundStatisticsRepository roundStats,
                          PlayerStatisticsRepository playerStats,
                          CrashPointGenerator generator,
                          GameSettingsService settings,
                          CurrentRoundRegistry registry,
                          SettlementService settlement,
                          AutoCashoutMonitor autoCashout,
                          PhaseGate gate,
                          RoundTimers timers,
                          CrashBroadcaster broadcaster,
                          Payloads payloads,
                          AuditLogService audit,
                          TransactionTemplate tx,
                          Clock clock,
                          @Value("${crash.tick-ms:100}") long tickMs,
                          @Value("${crash.autostart:true}") boolean autostart) {
        this.rounds = rounds;
        this.bets = bets;
        this.roundStats = roundStats;
        this.playerStats = playerStats;
        this.generator = generator;
        this.settings = settings;
        this.registry = registry;
        this.settlement = settlement;
        this.autoCashout = autoCashout;
        this.gate = gate;
        this.timers = timers;
        this.broadcaster = broadcaster;
        this.payloads = payloads;
        this.audit = audit;
        this.tx = tx;
        this.clock = clock;
        this.tickMs = tickMs;
        this.autostart = autostart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (autostart) start();
    }

    public boolean isRunning() {
        return running;
    }

    // ----- pilotage -----

    public synchronized boolean start() {
        if (running) return false;
        running = true;
        creationFailures.set(0);
        log.info("Moteur crash démarré");
        audit.record(AuditLogService.ENGINE_START, null, "Moteur démarré");
        timers.schedule(T_RESUME, 0, this::resume);
        return true;
    }

    public synchronized boolean stop() {
        if (!running) return false;
        running = false;
        timers.cancel(T_CREATE);
        timers.cancel(T_CLOSE);
        log.info("Arrêt du moteur crash demandé");
        audit.record(AuditLogService.ENGINE_STOP, null, "Moteur arrêté");
        // un round en vol ne reste pas suspendu : il est forcé au multiplicateur courant
        timers.schedule(T_FORCE, 0, this::crashCurrentAtClock);
        return true;
    }

    /** Termine le round en vol au multiplicateur instantané. */
    public BigDecimal forceCrash() {
        RoundSnapshot s = registry.current()
                .filter(r -> r.status() == RoundStatus.FLYING)
                .orElseThrow(() -> new CrashException(RejectionReason.ROUND_NOT_FLYING, "Aucun round en vol"));
        BigDecimal now = s.multiplierAt(clock.instant());
        timers.schedule(T_FORCE, 0, this::crashCurrentAtClock);
        return now;
    }

    // ----- reprise -----

    void resume() {
        CrashRound r = rounds.findFirstByStatusInOrderByRoundNumberDesc(UNFINISHED).orElse(null);
        recoverCrashed(r == null ? null : r.getId(), clock.instant());
        if (r == null) {
            createRound();
            return;
        }
        registry.publish(r);
        log.info("Reprise du round #{} en {}", r.getRoundNumber(), r.getStatus());
        switch (r.getStatus()) {
            case WAITING, BETTING -> {
                long reste = Duration.between(clock.instant(), r.getBettingWindowEnd()).toMillis();
                Long id = r.getId();
                timers.schedule(T_CLOSE, reste, () -> closeBetting(id));
            }
            case FLYING -> crashCurrentAtClock();
            case CRASHED -> settleAndComplete(r.getId());
            default -> createRound();
        }
    }

    // ----- BETTING -----

    void createRound() {
        if (!running) return;
        GameSettingsService.Snapshot cfg = settings.current();
        if (cfg.maintenanceMode()) {
            log.debug("Maintenance active, pas de nouveau round");
            registry.clear();
            timers.schedule(T_CREATE, MAINTENANCE_POLL_MS, this::createRound);
            return;
        }
        CrashRound r;
        try {
            r = tx.execute(status -> {
                Long max = rounds.findMaxRoundNumber();
                String seed = generator.newSeed();
                return rounds.saveAndFlush(CrashRound.builder()
                        .roundNumber(max == null ? 1L : max + 1)
                        .status(RoundStatus.BETTING)
                        .seed(seed)
                        .seedHash(CrashPointGenerator.hash(seed))
                        .houseEdge(cfg.houseEdge())
                        .minBet(cfg.minBet())
                        .maxBet(cfg.maxBet())
                        .maxCashoutMultiplier(cfg.maxCashoutMultiplier())
                        .maxFlightSeconds(cfg.maxFlightSeconds())
                        .bettingWindowEnd(clock.instant().plus(cfg.bettingDuration()))
                        .build());
            });
        } catch (RuntimeException ex) {
            int n = creationFailures.incrementAndGet();
            long delay = backoff(n);
            log.error("Création de round en échec (tentative {}), nouvel essai dans {} ms", n, delay, ex);
            audit.record(AuditLogService.ERROR, null, "Création de round en échec: " + ex.getMessage());
            timers.schedule(T_CREATE, delay, this::createRound);
            return;
        }
        creationFailures.set(0);

        RoundSnapshot snap = registry.publish(r);
        log.info("Round #{} ouvert aux mises jusqu'à {}", r.getRoundNumber(), r.getBettingWindowEnd());
        broadcaster.broadcast("ROUND_START", payloads.roundState(snap, clock.instant()));
        audit.record(AuditLogService.ROUND_START, r.getRoundNumber(), "seedHash=" + r.getSeedHash());

        Long id = r.getId();
        timers.schedule(T_CLOSE, cfg.bettingDuration().toMillis(), () -> closeBetting(id));
    }

    static long backoff(int attempt) {
        long d = BACKOFF_MIN_MS << Math.min(attempt - 1, 5);
        return Math.min(d, BACKOFF_MAX_MS);
    }

    // ----- BETTING → FLYING -----

    void closeBetting(Long roundId) {
        RoundSnapshot snap;
        try {
            // verrou d'écriture : les mises en cours finissent leur commit avant le décollage
            snap = gate.exclusive(() -> {
                CrashRound r = tx.execute(status -> {
                    CrashRound round = rounds.findById(roundId).orElse(null);
                    if (round == null || round.getStatus() != RoundStatus.BETTING) return null;
                    // plafond figé à la création : un réglage modifié pendant les mises vaut pour le round suivant
                    CrashPoint cp = generator.generate(round.getSeed(), round.getHouseEdge(),
                            Duration.ofSeconds(round.getMaxFlightSeconds()));
                    int n = rounds.startFlight(roundId, RoundStatus.BETTING, RoundStatus.FLYING,
                            cp.crashMultiplier(), cp.flightDuration().toMillis(), clock.instant());
                    return n == 0 ? null : rounds.findById(roundId).orElse(null);
                });
                return r == null ? null : registry.publish(r);
            });
        } catch (RuntimeException ex) {
            log.error("Décollage du round {} en échec", roundId, ex);
            audit.record(AuditLogService.ERROR, null, "Décollage en échec: " + ex.getMessage());
            abandonBetting(roundId);
            return;
        }
        if (snap == null) {
            log.warn("Round {} n'était plus en BETTING au décollage", roundId);
            return;
        }

        log.info("Round #{} en vol ({} ms)", snap.roundNumber(), snap.flightDuration().toMillis());
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("roundNumber", snap.roundNumber());
        p.put("flightStart", snap.flightStart());
        p.put("seedHash", snap.seedHash());
        broadcaster.broadcast("FLYING_START", p);
        audit.record(AuditLogService.FLYING_START, snap.roundNumber(),
                "crash=" + snap.crashMultiplier() + " vol=" + snap.flightDuration().toMillis() + "ms");

        scheduleTick(roundId);
    }

    // décollage impossible : le round est clos à 1.00, toutes les mises perdent, la boucle continue
    private void abandonBetting(Long roundId) {
        try {
            Integer n = tx.execute(status -> {
                int started = rounds.startFlight(roundId, RoundStatus.BETTING, RoundStatus.FLYING,
                        MultiplierClock.ONE, 0L, clock.instant());
                return started == 0 ? 0 : 1;
            });
            if (n != null && n > 0) {
                crash(roundId, MultiplierClock.ONE, true);
                return;
            }
        } catch (RuntimeException ex) {
            log.error("Abandon du round {} impossible", roundId, ex);
        }
        scheduleNextRound();
    }

    // ----- FLYING -----

    private void scheduleTick(Long roundId) {
        Runnable tick = new Runnable() {
            @Override
            public void run() {
                RoundSnapshot s = registry.current().orElse(null);
                if (s == null || !roundId.equals(s.roundId()) || s.status() != RoundStatus.FLYING) return;

                Instant now = clock.instant();
                BigDecimal m = s.multiplierAt(now);
                try {
                    autoCashout.tick(roundId, m);
                } catch (RuntimeException ex) {
                    log.error("Encaissements auto en échec au tick x{} (round #{})", m, s.roundNumber(), ex);
                }

                if (m.compareTo(s.crashMultiplier()) >= 0) {
                    crash(roundId, s.crashMultiplier(), false);
                    return;
                }
                Map<String, Object> p = new LinkedHashMap<>();
                p.put("roundNumber", s.roundNumber());
                p.put("multiplier", m);
                p.put("elapsedMs", Duration.between(s.flightStart(), now).toMillis());
                broadcaster.broadcast("MULTIPLIER", p);
                timers.schedule(T_TICK, tickMs, this);
            }
        };
        timers.schedule(T_TICK, tickMs, tick);
    }

    private void crashCurrentAtClock() {
        RoundSnapshot s = registry.current().orElse(null);
        if (s == null || s.status() != RoundStatus.FLYING) return;
        BigDecimal m = s.multiplierAt(clock.instant()).min(s.crashMultiplier());
        log.warn("Crash forcé du round #{} à x{}", s.roundNumber(), m);
        crash(s.roundId(), m, true);
    }

    // ----- FLYING → CRASHED -----

    void crash(Long roundId, BigDecimal finalMultiplier, boolean forced) {
        timers.cancel(T_TICK);
        Instant now = clock.instant();
        CrashRound r;
        try {
            r = tx.execute(status -> {
                int n = rounds.markCrashed(roundId, RoundStatus.FLYING, RoundStatus.CRASHED, finalMultiplier, now);
                return n == 0 ? null : rounds.findById(roundId).orElse(null);
            });
        } catch (RuntimeException ex) {
            log.error("Passage en CRASHED du round {} en échec", roundId, ex);
            audit.record(AuditLogService.ERROR, null, "Crash en échec: " + ex.getMessage());
            timers.schedule(T_FORCE, BACKOFF_MIN_MS, this::crashCurrentAtClock);
            return;
        }
        if (r == null) {
            log.warn("Round {} déjà crashé", roundId);
            return;
        }
        RoundSnapshot snap = registry.publish(r);
        log.info("Round #{} crashé à x{}{}", r.getRoundNumber(), finalMultiplier, forced ? " (forcé)" : "");

        Map<String, Object> p = new LinkedHashMap<>();
        p.put("roundNumber", snap.roundNumber());
        p.put("multiplier", finalMultiplier);
        p.put("forced", forced);
        p.put("crashedAt", snap.crashedAt());
        broadcaster.broadcast("CRASH", p);
        audit.record(forced ? AuditLogService.FORCE_CRASH : AuditLogService.CRASH, r.getRoundNumber(),
                "final=" + finalMultiplier + " crash=" + r.getCrashMultiplier());

        settleAndComplete(roundId);
    }

    // ----- CRASHED → COMPLETED -----

    void settleAndComplete(Long roundId) {
        CrashRound r = rounds.findById(roundId).orElse(null);
        if (r == null || r.getStatus() != RoundStatus.CRASHED) {
            scheduleNextRound();
            return;
        }
        if (!settleAndMarkCompleted(r, true)) {
            int n = settleRetries.incrementAndGet();
            audit.record(AuditLogService.ERROR, r.getRoundNumber(), "Paris non réglés, essai " + n);
            if (n < SETTLE_RETRIES) {
                timers.schedule(T_SETTLE, backoff(n), () -> settleAndComplete(roundId));
                return;
            }
            log.error("Round #{} laissé en CRASHED après {} essais, repris par la surveillance",
                    r.getRoundNumber(), n);
        }
        settleRetries.set(0);
        scheduleNextRound();
    }

    /**
     * Règle les rounds restés en CRASHED derrière le round courant, sans toucher au registre
     * ni à l'enchaînement des rounds. Un round encore en échec sera repris au passage suivant.
     */
    void recoverCrashed(Long excludedRoundId, Instant crashedBefore) {
        for (CrashRound r : rounds.findByStatusAndCrashedAtBeforeOrderByRoundNumberAsc(RoundStatus.CRASHED, crashedBefore)) {
            if (r.getId().equals(excludedRoundId)) continue;
            log.warn("Round #{} resté en CRASHED, reprise du règlement", r.getRoundNumber());
            if (settleAndMarkCompleted(r, false)) {
                audit.record(AuditLogService.SETTLEMENT, r.getRoundNumber(), "Round repris et clôturé");
            }
        }
    }

    // true si le round est COMPLETED en sortie
    private boolean settleAndMarkCompleted(CrashRound r, boolean current) {
        Long roundId = r.getId();
        BigDecimal fin = r.getFinalMultiplier();
        SettlementSummary total = SettlementSummary.empty();
        for (int pass = 0; pass < SETTLE_PASSES; pass++) {
            SettlementSummary s = settlement.settleRemaining(roundId, fin);
            total = total.plus(s);
            if (s.failed() == 0) break;
        }
        audit.record(AuditLogService.SETTLEMENT, r.getRoundNumber(), "gagnés=" + total.won() + " perdus=" + total.lost()
                + " déjà réglés=" + total.alreadySettled() + " payé=" + total.paidOut());

        if (total.failed() > 0 || bets.countByRoundIdAndStatus(roundId, BetStatus.ACTIVE) > 0) {
            log.error("Round #{}: paris encore actifs après règlement", r.getRoundNumber());
            return false;
        }
        try {
            complete(roundId, current);
            return true;
        } catch (RuntimeException ex) {
            log.error("Clôture du round #{} en échec", r.getRoundNumber(), ex);
            audit.record(AuditLogService.ERROR, r.getRoundNumber(), "Clôture en échec: " + ex.getMessage());
            return false;
        }
    }

    private void complete(Long roundId, boolean current) {
        CrashRound done = tx.execute(status -> {
            int n = rounds.markCompleted(roundId, RoundStatus.CRASHED, RoundStatus.COMPLETED, clock.instant());
            if (n == 0) return null;
            CrashRound r = rounds.findById(roundId).orElseThrow();
            writeStatistics(r);
            return r;
        });
        if (done == null) return;
        log.info("Round #{} terminé", done.getRoundNumber());
        if (!current) return;

        RoundSnapshot snap = registry.publish(done);
        RoundStatistics st = roundStats.findByRoundId(roundId).orElse(null);
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("roundNumber", snap.roundNumber());
        p.put("multiplier", snap.finalMultiplier());
        p.put("seed", done.getSeed());
        p.put("totalBets", st == null ? 0 : st.getTotalBets());
        p.put("totalPaidOut", st == null ? BigDecimal.ZERO : st.getTotalPaidOut());
        broadcaster.broadcast("ROUND_COMPLETED", p);
    }

    private void writeStatistics(CrashRound r) {
        Long roundId = r.getId();
        if (!roundStats.existsByRoundId(roundId)) {
            RoundTotals t = bets.totalsForRound(roundId);
            roundStats.save(RoundStatistics.builder()
                    .round(r)
                    .totalBets(t.totalBets() == null ? 0 : t.totalBets())
                    .totalStaked(t.totalStakedOrZero())
                    .totalPaidOut(t.totalPaidOutOrZero())
                    .uniquePlayers(t.uniquePlayers() == null ? 0 : t.uniquePlayers())
                    .highestBet(t.highestBetOrZero())
                    .winners(bets.countByRoundIdAndStatusIn(roundId, EnumSet.of(BetStatus.WON, BetStatus.CASHED_OUT)))
                    .losers(bets.countByRoundIdAndStatus(roundId, BetStatus.LOST))
                    .build());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<CrashBet> all = bets.findForRound(roundId, Pageable.unpaged());
        for (CrashBet b : all) {
            Long uid = b.getUtilisateur().getId();
            if (!playerStats.existsById(uid)) {
                playerStats.saveAndFlush(PlayerStatistics.builder().utilisateurId(uid).updatedAt(now).build());
            }
            boolean won = b.getStatus().isWin();
            playerStats.increment(uid, won ? 1 : 0, won ? 0 : 1, b.getAmount(), b.getPayout(),
                    won && b.getSettledMultiplier() != null ? b.getSettledMultiplier() : BigDecimal.ZERO, now);
        }
    }

    private void scheduleNextRound() {
        if (!running) {
            log.info("Moteur arrêté, pas de round suivant");
            return;
        }
        timers.schedule(T_CREATE, settings.current().gameInterval().toMillis(), this::createRound);
    }

    // ----- surveillance -----

    /**
     * Appelé périodiquement : force un vol qui dépasse sa durée, reprend un round resté CRASHED,
     * relance la création si la boucle n'a plus rien de planifié.
     */
    public void watchdog(Duration grace) {
        if (!running) return;
        Instant now = clock.instant();
        RoundSnapshot s = registry.current().orElse(null);
        if (s != null && s.status() == RoundStatus.FLYING
                && now.isAfter(s.flightStart().plus(s.flightDuration()).plus(grace))) {
            log.warn("Round #{} bloqué en vol, crash forcé", s.roundNumber());
            timers.schedule(T_FORCE, 0, this::crashCurrentAtClock);
            return;
        }
        if (s != null && s.status() == RoundStatus.CRASHED && s.crashedAt() != null
                && now.isAfter(s.crashedAt().plus(grace)) && !timers.isScheduled(T_SETTLE)) {
            log.warn("Round #{} bloqué en CRASHED, reprise du règlement", s.roundNumber());
            Long id = s.roundId();
            timers.schedule(T_SETTLE, 0, () -> settleAndComplete(id));
            return;
        }
        Long currentId = s == null ? null : s.roundId();
        Instant limit = now.minus(grace);
        if (!timers.isScheduled(T_RECOVER) && rounds.findByStatusAndCrashedAtBeforeOrderByRoundNumberAsc(
                RoundStatus.CRASHED, limit).stream().anyMatch(r -> !r.getId().equals(currentId))) {
            timers.schedule(T_RECOVER, 0, () -> recoverCrashed(currentId, limit));
        }
        boolean idle = !timers.isScheduled(T_CREATE) && !timers.isScheduled(T_CLOSE)
                && !timers.isScheduled(T_TICK) && !timers.isScheduled(T_SETTLE) && !timers.isScheduled(T_RESUME);
        if (idle && (s == null || s.status() == RoundStatus.COMPLETED)) {
            log.warn("Boucle du moteur inactive, relance de la création");
            timers.schedule(T_CREATE, 0, this::createRound);
        }
    }
}
