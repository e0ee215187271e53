package org.aviator.service.crash.engine;

import org.aviator.model.*;
import org.aviator.repo.*;
import org.aviator.service.AuditLogService;
import org.aviator.service.GameSettingsService;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.aviator.service.crash.registry.CurrentRoundRegistry;
import org.aviator.service.crash.settlement.AutoCashoutMonitor;
import org.aviator.service.crash.settlement.SettlementService;
import org.aviator.service.crash.settlement.SettlementSummary;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.aviator.service.crash.util.Payloads;
import org.aviator.service.crash.util.PhaseGate;
import org.aviator.service.crash.util.RoundTimers;
import org.aviator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RoundSchedulerTest {

    @Mock RoundRepository rounds;
    @Mock BetRepository bets;
    @Mock RoundStatisticsRepository roundStats;
    @Mock PlayerStatisticsRepository playerStats;
    @Mock CrashPointGenerator generator;
    @Mock GameSettingsService settings;
    @Mock SettlementService settlement;
    @Mock AutoCashoutMonitor autoCashout;
    @Mock RoundTimers timers;
    @Mock CrashBroadcaster broadcaster;
    @Mock Payloads payloads;
    @Mock AuditLogService audit;
    @Mock TransactionTemplate tx;

    private final Instant t0 = Instant.parse("2026-01-01T12:00:00Z");
    private MutableClock clock;
    private CurrentRoundRegistry registry;
    private RoundScheduler scheduler;

    private static final GameSettingsService.Snapshot CFG = new GameSettingsService.Snapshot(
            new BigDecimal("3.00"), 10, 5, new BigDecimal("1.00"), new BigDecimal("10000.00"),
            new BigDecimal("1000.00"), 30, false);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(t0);
        registry = new CurrentRoundRegistry();
        scheduler = new RoundScheduler(rounds, bets, roundStats, playerStats, generator, settings, registry,
                settlement, autoCashout, new PhaseGate(), timers, broadcaster, payloads, audit, tx, clock, 100L, false);

        when(settings.current()).thenReturn(CFG);
        when(tx.execute(any())).thenAnswer(inv -> {
            TransactionCallback<?> cb = inv.getArgument(0);
            return cb.doInTransaction(null);
        });
        when(payloads.roundState(any(), any())).thenReturn(Map.of());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> json(Object body) {
        return (Map<String, Object>) body;
    }

    private CrashRound round(RoundStatus status) {
        return CrashRound.builder()
                .id(7L)
                .roundNumber(42L)
                .status(status)
                .seed("seed")
                .seedHash("hash")
                .houseEdge(new BigDecimal("3.00"))
                .minBet(new BigDecimal("1.00"))
                .maxBet(new BigDecimal("10000.00"))
                .maxCashoutMultiplier(new BigDecimal("1000.00"))
                .maxFlightSeconds(30)
                .bettingWindowEnd(t0.plusSeconds(10))
                .build();
    }

    private CrashRound flying(String crash, long flightMs) {
        CrashRound r = round(RoundStatus.FLYING);
        r.setCrashMultiplier(new BigDecimal(crash));
        r.setFlightDurationMs(flightMs);
        r.setFlightStart(t0);
        return r;
    }

    private void running() {
        scheduler.start();
        clearInvocations(timers);
    }

    // ----- création -----

    @Test
    void createRound_shouldOpenBettingAndScheduleTakeOff() {
        running();
        when(rounds.findMaxRoundNumber()).thenReturn(41L);
        when(generator.newSeed()).thenReturn("seed");
        when(rounds.saveAndFlush(any(CrashRound.class))).thenAnswer(inv -> {
            CrashRound r = inv.getArgument(0);
            r.setId(7L);
            return r;
        });

        scheduler.createRound();

        ArgumentCaptor<CrashRound> captor = ArgumentCaptor.forClass(CrashRound.class);
        verify(rounds).saveAndFlush(captor.capture());
        CrashRound created = captor.getValue();
        assertThat(created.getRoundNumber()).isEqualTo(42L);
        assertThat(created.getStatus()).isEqualTo(RoundStatus.BETTING);
        assertThat(created.getSeedHash()).isEqualTo(CrashPointGenerator.hash("seed"));
        assertThat(created.getCrashMultiplier()).isNull();
        assertThat(created.getBettingWindowEnd()).isEqualTo(t0.plusSeconds(10));
        assertThat(created.getMaxFlightSeconds()).isEqualTo(30);

        assertThat(registry.current()).hasValueSatisfying(s -> assertThat(s.status()).isEqualTo(RoundStatus.BETTING));
        verify(broadcaster).broadcast(eq("ROUND_START"), any());
        verify(timers).schedule(eq(RoundScheduler.T_CLOSE), eq(10_000L), any(Runnable.class));
    }

    @Test
    void createRound_shouldRetryWithGrowingBackoff() {
        running();
        when(rounds.findMaxRoundNumber()).thenThrow(new IllegalStateException("db down"));

        scheduler.createRound();
        scheduler.createRound();

        verify(timers).schedule(eq(RoundScheduler.T_CREATE), eq(1_000L), any(Runnable.class));
        verify(timers).schedule(eq(RoundScheduler.T_CREATE), eq(2_000L), any(Runnable.class));
        verify(audit, times(2)).record(eq(AuditLogService.ERROR), isNull(), anyString());
    }

    @Test
    void backoff_shouldDoubleUpToThirtySeconds() {
        assertThat(RoundScheduler.backoff(1)).isEqualTo(1_000L);
        assertThat(RoundScheduler.backoff(2)).isEqualTo(2_000L);
        assertThat(RoundScheduler.backoff(5)).isEqualTo(16_000L);
        assertThat(RoundScheduler.backoff(6)).isEqualTo(30_000L);
        assertThat(RoundScheduler.backoff(50)).isEqualTo(30_000L);
    }

    @Test
    void createRound_shouldWaitDuringMaintenance() {
        running();
        when(settings.current()).thenReturn(new GameSettingsService.Snapshot(
                new BigDecimal("3.00"), 10, 5, new BigDecimal("1.00"), new BigDecimal("10000.00"),
                new BigDecimal("1000.00"), 30, true));

        scheduler.createRound();

        verify(rounds, never()).saveAndFlush(any());
        verify(timers).schedule(eq(RoundScheduler.T_CREATE), eq(5_000L), any(Runnable.class));
    }

    @Test
    void createRound_shouldDoNothingWhenStopped() {
        scheduler.createRound();

        verifyNoInteractions(rounds);
    }

    // ----- décollage -----

    @Test
    void closeBetting_shouldDrawCrashPointOnceAndStartTicking() {
        CrashRound betting = round(RoundStatus.BETTING);
        registry.publish(betting);
        CrashRound flying = flying("2.50", 6_500L);
        when(rounds.findById(7L)).thenReturn(Optional.of(betting), Optional.of(flying));
        when(generator.generate(eq("seed"), any(), eq(Duration.ofSeconds(30))))
                .thenReturn(new CrashPoint(new BigDecimal("2.50"), Duration.ofMillis(6_500)));
        when(rounds.startFlight(eq(7L), eq(RoundStatus.BETTING), eq(RoundStatus.FLYING),
                eq(new BigDecimal("2.50")), eq(6_500L), eq(t0))).thenReturn(1);

        scheduler.closeBetting(7L);

        verify(generator, times(1)).generate(anyString(), any(), any());
        assertThat(registry.current()).hasValueSatisfying(s -> assertThat(s.status()).isEqualTo(RoundStatus.FLYING));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(broadcaster).broadcast(eq("FLYING_START"), payload.capture());
        // le point de crash ne part pas chez les clients
        assertThat(payload.getValue()).isInstanceOf(Map.class);
        assertThat(json(payload.getValue())).containsOnlyKeys("roundNumber", "flightStart", "seedHash");
        verify(timers).schedule(eq(RoundScheduler.T_TICK), eq(100L), any(Runnable.class));
    }

    @Test
    void closeBetting_shouldKeepFlightCapFrozenAtCreation() {
        CrashRound betting = round(RoundStatus.BETTING);
        registry.publish(betting);
        when(rounds.findById(7L)).thenReturn(Optional.of(betting), Optional.of(flying("1.50", 2_000L)));
        when(generator.generate(anyString(), any(), any()))
                .thenReturn(new CrashPoint(new BigDecimal("1.50"), Duration.ofMillis(2_000)));
        when(rounds.startFlight(anyLong(), any(), any(), any(), anyLong(), any())).thenReturn(1);
        // plafond ramené à 2s pendant les mises
        when(settings.current()).thenReturn(new GameSettingsService.Snapshot(
                new BigDecimal("3.00"), 10, 5, new BigDecimal("1.00"), new BigDecimal("10000.00"),
                new BigDecimal("1000.00"), 2, false));

        scheduler.closeBetting(7L);

        verify(generator).generate(eq("seed"), any(), eq(Duration.ofSeconds(30)));
    }

    @Test
    void closeBetting_shouldIgnoreRoundNoLongerBetting() {
        when(rounds.findById(7L)).thenReturn(Optional.of(flying("2.00", 5_000L)));

        scheduler.closeBetting(7L);

        verify(generator, never()).generate(anyString(), any(), any());
        verify(rounds, never()).startFlight(any(), any(), any(), any(), anyLong(), any());
        verify(timers, never()).schedule(eq(RoundScheduler.T_TICK), anyLong(), any());
    }

    // ----- vol / crash -----

    @Test
    void tick_shouldRunAutoCashoutThenCrashWhenTargetReached() {
        CrashRound r = flying("2.00", 4_000L);
        registry.publish(r);
        when(rounds.findById(7L)).thenReturn(Optional.of(round(RoundStatus.BETTING)), Optional.of(r));
        when(generator.generate(anyString(), any(), any()))
                .thenReturn(new CrashPoint(new BigDecimal("2.00"), Duration.ofMillis(4_000)));
        when(rounds.startFlight(anyLong(), any(), any(), any(), anyLong(), any())).thenReturn(1);
        scheduler.closeBetting(7L);

        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(timers).schedule(eq(RoundScheduler.T_TICK), eq(100L), tick.capture());

        // mi-vol : x1.50, pas de crash
        clock.advance(Duration.ofSeconds(2));
        tick.getValue().run();
        verify(autoCashout).tick(7L, new BigDecimal("1.50"));
        verify(broadcaster).broadcast(eq("MULTIPLIER"), any());
        verify(rounds, never()).markCrashed(any(), any(), any(), any(), any());

        // fin du vol : crash à la valeur tirée
        clock.advance(Duration.ofSeconds(2));
        tick.getValue().run();
        verify(autoCashout).tick(7L, new BigDecimal("2.00"));
        verify(rounds).markCrashed(eq(7L), eq(RoundStatus.FLYING), eq(RoundStatus.CRASHED), eq(new BigDecimal("2.00")), any());
    }

    @Test
    void crash_shouldSettleWriteStatisticsCompleteAndScheduleNextRound() {
        running();
        CrashRound crashed = flying("2.50", 6_500L);
        crashed.setStatus(RoundStatus.CRASHED);
        crashed.setFinalMultiplier(new BigDecimal("2.50"));
        crashed.setCrashedAt(t0.plusMillis(6_500));
        CrashRound completed = flying("2.50", 6_500L);
        completed.setStatus(RoundStatus.COMPLETED);
        completed.setFinalMultiplier(new BigDecimal("2.50"));

        when(rounds.markCrashed(eq(7L), eq(RoundStatus.FLYING), eq(RoundStatus.CRASHED), any(), any())).thenReturn(1);
        when(rounds.markCompleted(eq(7L), eq(RoundStatus.CRASHED), eq(RoundStatus.COMPLETED), any())).thenReturn(1);
        when(rounds.findById(7L)).thenReturn(Optional.of(crashed), Optional.of(crashed), Optional.of(completed));
        when(settlement.settleRemaining(7L, new BigDecimal("2.50")))
                .thenReturn(new SettlementSummary(1, 1, 0, 0, new BigDecimal("25.00")));
        when(bets.countByRoundIdAndStatus(7L, BetStatus.ACTIVE)).thenReturn(0L);
        when(bets.totalsForRound(7L)).thenReturn(new RoundTotals(2L, new BigDecimal("20.00"),
                new BigDecimal("25.00"), 2L, new BigDecimal("10.00")));
        when(bets.countByRoundIdAndStatusIn(eq(7L), any())).thenReturn(1L);
        when(bets.countByRoundIdAndStatus(7L, BetStatus.LOST)).thenReturn(1L);

        Utilisateur a = Utilisateur.builder().id(1L).build();
        Utilisateur b = Utilisateur.builder().id(2L).build();
        CrashBet won = CrashBet.builder().id(1L).utilisateur(a).amount(new BigDecimal("10.00"))
                .status(BetStatus.WON).settledMultiplier(new BigDecimal("2.50")).payout(new BigDecimal("25.00")).build();
        CrashBet lost = CrashBet.builder().id(2L).utilisateur(b).amount(new BigDecimal("10.00"))
                .status(BetStatus.LOST).build();
        when(bets.findForRound(eq(7L), any())).thenReturn(List.of(won, lost));
        when(playerStats.existsById(1L)).thenReturn(true);
        when(playerStats.existsById(2L)).thenReturn(false);

        scheduler.crash(7L, new BigDecimal("2.50"), false);

        verify(broadcaster).broadcast(eq("CRASH"), any());
        verify(audit).record(eq(AuditLogService.CRASH), eq(42L), anyString());

        ArgumentCaptor<RoundStatistics> stats = ArgumentCaptor.forClass(RoundStatistics.class);
        verify(roundStats).save(stats.capture());
        assertThat(stats.getValue().getTotalBets()).isEqualTo(2L);
        assertThat(stats.getValue().getTotalPaidOut()).isEqualByComparingTo("25.00");
        assertThat(stats.getValue().getWinners()).isEqualTo(1L);
        assertThat(stats.getValue().getLosers()).isEqualTo(1L);

        verify(playerStats).saveAndFlush(any(PlayerStatistics.class));
        verify(playerStats).increment(eq(1L), eq(1L), eq(0L), any(), eq(new BigDecimal("25.00")), eq(new BigDecimal("2.50")), any());
        verify(playerStats).increment(eq(2L), eq(0L), eq(1L), any(), any(), eq(BigDecimal.ZERO), any());

        verify(broadcaster).broadcast(eq("ROUND_COMPLETED"), any());
        assertThat(registry.current()).hasValueSatisfying(s -> assertThat(s.status()).isEqualTo(RoundStatus.COMPLETED));
        verify(timers).schedule(eq(RoundScheduler.T_CREATE), eq(5_000L), any(Runnable.class));
    }

    @Test
    void crash_shouldNotCompleteWhileBetsRemainActive() {
        running();
        CrashRound crashed = flying("2.50", 6_500L);
        crashed.setStatus(RoundStatus.CRASHED);
        crashed.setFinalMultiplier(new BigDecimal("2.50"));
        when(rounds.markCrashed(any(), any(), any(), any(), any())).thenReturn(1);
        when(rounds.findById(7L)).thenReturn(Optional.of(crashed));
        when(settlement.settleRemaining(any(), any())).thenReturn(new SettlementSummary(0, 0, 0, 1, BigDecimal.ZERO));

        scheduler.crash(7L, new BigDecimal("2.50"), false);

        verify(settlement, times(3)).settleRemaining(7L, new BigDecimal("2.50"));
        verify(rounds, never()).markCompleted(any(), any(), any(), any());
        verify(timers).schedule(eq(RoundScheduler.T_SETTLE), eq(1_000L), any(Runnable.class));
    }

    @Test
    void roundLeftCrashed_shouldBeSettledByWatchdogWithoutReplacingCurrentRound() {
        running();
        CrashRound crashed = flying("2.50", 6_500L);
        crashed.setStatus(RoundStatus.CRASHED);
        crashed.setFinalMultiplier(new BigDecimal("2.50"));
        crashed.setCrashedAt(t0);
        when(rounds.findById(7L)).thenReturn(Optional.of(crashed));
        when(settlement.settleRemaining(any(), any())).thenReturn(new SettlementSummary(0, 0, 0, 1, BigDecimal.ZERO));

        for (int i = 0; i < 5; i++) {
            scheduler.settleAndComplete(7L);
        }

        verify(timers, times(4)).schedule(eq(RoundScheduler.T_SETTLE), anyLong(), any(Runnable.class));
        verify(timers).schedule(eq(RoundScheduler.T_CREATE), eq(5_000L), any(Runnable.class));
        verify(rounds, never()).markCompleted(any(), any(), any(), any());

        // le round suivant a pris la main
        CrashRound next = round(RoundStatus.BETTING);
        next.setId(8L);
        next.setRoundNumber(43L);
        registry.publish(next);
        clock.advance(Duration.ofMinutes(10));

        when(rounds.findByStatusAndCrashedAtBeforeOrderByRoundNumberAsc(eq(RoundStatus.CRASHED), any()))
                .thenReturn(List.of(crashed));
        when(settlement.settleRemaining(7L, new BigDecimal("2.50")))
                .thenReturn(new SettlementSummary(1, 0, 0, 0, BigDecimal.ZERO));
        when(bets.countByRoundIdAndStatus(7L, BetStatus.ACTIVE)).thenReturn(0L);
        when(rounds.markCompleted(eq(7L), eq(RoundStatus.CRASHED), eq(RoundStatus.COMPLETED), any())).thenReturn(1);
        when(bets.totalsForRound(7L)).thenReturn(new RoundTotals(1L, new BigDecimal("10.00"),
                new BigDecimal("25.00"), 1L, new BigDecimal("10.00")));

        scheduler.watchdog(Duration.ofSeconds(5));

        ArgumentCaptor<Runnable> recover = ArgumentCaptor.forClass(Runnable.class);
        verify(timers).schedule(eq(RoundScheduler.T_RECOVER), eq(0L), recover.capture());
        recover.getValue().run();

        verify(rounds).markCompleted(eq(7L), eq(RoundStatus.CRASHED), eq(RoundStatus.COMPLETED), any());
        verify(roundStats).save(any(RoundStatistics.class));
        assertThat(registry.current()).hasValueSatisfying(s -> {
            assertThat(s.roundId()).isEqualTo(8L);
            assertThat(s.status()).isEqualTo(RoundStatus.BETTING);
        });
        verify(broadcaster, never()).broadcast(eq("ROUND_COMPLETED"), any());
        verify(timers, times(1)).schedule(eq(RoundScheduler.T_CREATE), anyLong(), any(Runnable.class));
    }

    @Test
    void crash_shouldBeIgnoredWhenRoundAlreadyCrashed() {
        when(rounds.markCrashed(any(), any(), any(), any(), any())).thenReturn(0);

        scheduler.crash(7L, new BigDecimal("2.50"), false);

        verifyNoInteractions(settlement, broadcaster);
    }

    // ----- pilotage -----

    @Test
    void forceCrash_shouldRequireAFlyingRound() {
        registry.publish(round(RoundStatus.BETTING));

        assertThatThrownBy(() -> scheduler.forceCrash())
                .isInstanceOf(CrashException.class)
                .extracting(e -> ((CrashException) e).getReason())
                .isEqualTo(RejectionReason.ROUND_NOT_FLYING);
    }

    @Test
    void forceCrash_shouldEndAtCurrentClockValue() {
        registry.publish(flying("5.00", 10_000L));
        clock.advance(Duration.ofSeconds(5));
        when(rounds.markCrashed(any(), any(), any(), any(), any())).thenReturn(0);

        BigDecimal at = scheduler.forceCrash();

        assertThat(at).isEqualByComparingTo("3.00");
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(timers).schedule(eq(RoundScheduler.T_FORCE), eq(0L), task.capture());
        task.getValue().run();
        verify(rounds).markCrashed(eq(7L), eq(RoundStatus.FLYING), eq(RoundStatus.CRASHED), eq(new BigDecimal("3.00")), any());
    }

    @Test
    void startAndStop_shouldBeIdempotent() {
        assertThat(scheduler.start()).isTrue();
        assertThat(scheduler.start()).isFalse();
        assertThat(scheduler.isRunning()).isTrue();

        assertThat(scheduler.stop()).isTrue();
        assertThat(scheduler.stop()).isFalse();
        assertThat(scheduler.isRunning()).isFalse();
        verify(audit).record(eq(AuditLogService.ENGINE_START), isNull(), anyString());
        verify(audit).record(eq(AuditLogService.ENGINE_STOP), isNull(), anyString());
    }

    @Test
    void resume_shouldReopenUnfinishedBettingWindow() {
        running();
        CrashRound betting = round(RoundStatus.BETTING);
        when(rounds.findFirstByStatusInOrderByRoundNumberDesc(any())).thenReturn(Optional.of(betting));
        clock.advance(Duration.ofSeconds(4));

        scheduler.resume();

        verify(timers).schedule(eq(RoundScheduler.T_CLOSE), eq(6_000L), any(Runnable.class));
        verify(rounds, never()).saveAndFlush(any());
    }

    @Test
    void resume_shouldSettleOlderCrashedRoundsBeforeResumingLatest() {
        running();
        CrashRound old = flying("1.20", 800L);
        old.setId(5L);
        old.setRoundNumber(40L);
        old.setStatus(RoundStatus.CRASHED);
        old.setFinalMultiplier(new BigDecimal("1.20"));
        old.setCrashedAt(t0);
        CrashRound betting = round(RoundStatus.BETTING);
        when(rounds.findFirstByStatusInOrderByRoundNumberDesc(any())).thenReturn(Optional.of(betting));
        when(rounds.findByStatusAndCrashedAtBeforeOrderByRoundNumberAsc(eq(RoundStatus.CRASHED), any()))
                .thenReturn(List.of(old));
        when(settlement.settleRemaining(5L, new BigDecimal("1.20"))).thenReturn(new SettlementSummary(0, 1, 0, 0, BigDecimal.ZERO));
        when(rounds.markCompleted(eq(5L), eq(RoundStatus.CRASHED), eq(RoundStatus.COMPLETED), any())).thenReturn(1);
        when(rounds.findById(5L)).thenReturn(Optional.of(old));
        when(roundStats.existsByRoundId(5L)).thenReturn(true);

        scheduler.resume();

        verify(rounds).markCompleted(eq(5L), eq(RoundStatus.CRASHED), eq(RoundStatus.COMPLETED), any());
        assertThat(registry.current()).hasValueSatisfying(s -> assertThat(s.roundId()).isEqualTo(7L));
        verify(timers).schedule(eq(RoundScheduler.T_CLOSE), anyLong(), any(Runnable.class));
    }

    @Test
    void resume_shouldForceCrashRoundLeftFlying() {
        running();
        when(rounds.findFirstByStatusInOrderByRoundNumberDesc(any())).thenReturn(Optional.of(flying("10.00", 20_000L)));
        clock.advance(Duration.ofSeconds(60));
        when(rounds.markCrashed(any(), any(), any(), any(), any())).thenReturn(0);

        scheduler.resume();

        verify(rounds).markCrashed(eq(7L), eq(RoundStatus.FLYING), eq(RoundStatus.CRASHED), eq(new BigDecimal("10.00")), any());
    }

    @Test
    void watchdog_shouldForceCrashOverdueFlight() {
        running();
        registry.publish(flying("2.00", 4_000L));
        clock.advance(Duration.ofSeconds(20));

        scheduler.watchdog(Duration.ofSeconds(5));

        verify(timers).schedule(eq(RoundScheduler.T_FORCE), eq(0L), any(Runnable.class));
    }
}
