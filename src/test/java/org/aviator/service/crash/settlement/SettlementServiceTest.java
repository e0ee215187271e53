package org.aviator.service.crash.settlement;

import org.aviator.model.*;
import org.aviator.repo.BetRepository;
import org.aviator.service.WalletService;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.aviator.service.crash.registry.CurrentRoundRegistry;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.aviator.service.crash.util.Locks;
import org.aviator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettlementServiceTest {

    @Mock BetRepository bets;
    @Mock WalletService wallet;
    @Mock CrashBroadcaster broadcaster;
    @Mock TransactionTemplate tx;

    private final Instant t0 = Instant.parse("2026-01-01T12:00:00Z");
    private MutableClock clock;
    private CurrentRoundRegistry registry;
    private Utilisateur user;
    private CrashRound round;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(t0.plusSeconds(5));
        registry = new CurrentRoundRegistry();
        user = Utilisateur.builder().id(1L).email("joueur@test.com").pseudo("joueur").motDePasseHash("x").build();
        round = CrashRound.builder()
                .id(7L)
                .roundNumber(42L)
                .status(RoundStatus.FLYING)
                .crashMultiplier(new BigDecimal("3.00"))
                .flightStart(t0)
                .flightDurationMs(10_000L)
                .build();
        lenient().when(tx.execute(any())).thenAnswer(inv -> {
            TransactionCallback<?> cb = inv.getArgument(0);
            return cb.doInTransaction(null);
        });
    }

    private SettlementService service(boolean clamp) {
        return new SettlementService(bets, wallet, registry, broadcaster, new Locks(), tx, clock, clamp);
    }

    private CrashBet bet(long id, String amount, String auto) {
        CrashBet b = CrashBet.builder()
                .id(id)
                .round(round)
                .utilisateur(user)
                .amount(new BigDecimal(amount))
                .autoCashoutAt(auto == null ? null : new BigDecimal(auto))
                .build();
        lenient().when(bets.findWithRound(id)).thenReturn(Optional.of(b));
        return b;
    }

    private void givenCredit(String payout, String soldeApres) {
        when(wallet.crediterGain(eq(user), eq(new BigDecimal(payout)), anyString(), anyString()))
                .thenReturn(Wallet.builder().solde(new BigDecimal(soldeApres)).build());
    }

    private static RejectionReason reasonOf(Throwable e) {
        return ((CrashException) e).getReason();
    }

    // --- encaissement manuel ---

    @Test
    void cashOut_shouldPayAmountTimesMultiplier() {
        bet(5L, "20.00", null);
        when(bets.settleIfActive(eq(5L), eq(BetStatus.ACTIVE), eq(BetStatus.CASHED_OUT),
                eq(new BigDecimal("2.00")), eq(new BigDecimal("40.00")), any())).thenReturn(1);
        givenCredit("40.00", "120.00");

        CashoutResult r = service(false).cashOut(5L, new BigDecimal("2.00"));

        assertThat(r.payout()).isEqualByComparingTo("40.00");
        assertThat(r.status()).isEqualTo(BetStatus.CASHED_OUT);
        assertThat(r.solde()).isEqualByComparingTo("120.00");
        verify(wallet).crediterGain(eq(user), eq(new BigDecimal("40.00")), eq("WIN_5"), anyString());
        verify(broadcaster).broadcast(eq("CASHOUT"), any(Map.class));
    }

    @Test
    void cashOut_shouldRoundPayoutDown() {
        bet(6L, "10.01", null);
        when(bets.settleIfActive(eq(6L), any(), any(), any(), eq(new BigDecimal("15.71")), any())).thenReturn(1);
        givenCredit("15.71", "15.71");

        CashoutResult r = service(false).cashOut(6L, new BigDecimal("1.57"));

        assertThat(r.payout()).isEqualByComparingTo("15.71");
    }

    @Test
    void cashOut_shouldRejectWhenAlreadySettled() {
        bet(5L, "20.00", null);
        when(bets.settleIfActive(eq(5L), any(), any(), any(), any(), any())).thenReturn(0);

        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("2.00")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.BET_NOT_ACTIVE);
        verifyNoInteractions(wallet, broadcaster);
    }

    @Test
    void cashOut_shouldRejectWhenBetNoLongerActive() {
        CrashBet b = bet(5L, "20.00", null);
        b.setStatus(BetStatus.LOST);

        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("2.00")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.BET_NOT_ACTIVE);
        verify(bets, never()).settleIfActive(any(), any(), any(), any(), any(), any());
    }

    @Test
    void cashOut_shouldRejectAboveCrashPoint() {
        bet(5L, "20.00", null);

        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("3.01")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.MULTIPLIER_EXCEEDS_CRASH);
        verifyNoInteractions(wallet);
    }

    @Test
    void cashOut_shouldAcceptExactlyTheCrashPoint() {
        bet(5L, "10.00", null);
        when(bets.settleIfActive(eq(5L), any(), any(), eq(new BigDecimal("3.00")), eq(new BigDecimal("30.00")), any()))
                .thenReturn(1);
        givenCredit("30.00", "30.00");

        assertThat(service(false).cashOut(5L, new BigDecimal("3.00")).payout()).isEqualByComparingTo("30.00");
    }

    @Test
    void cashOut_shouldRejectDependingOnRoundPhase() {
        bet(5L, "20.00", null);

        round.setStatus(RoundStatus.CRASHED);
        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("1.50")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.ROUND_ALREADY_CRASHED);

        round.setStatus(RoundStatus.BETTING);
        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("1.50")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.ROUND_NOT_FLYING);
    }

    @Test
    void cashOut_shouldRejectMultiplierBelowOne() {
        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("0.99")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.INVALID_MULTIPLIER);
        verifyNoInteractions(bets);
    }

    @Test
    void cashOut_shouldRejectUnknownBet() {
        when(bets.findWithRound(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service(false).cashOut(404L, new BigDecimal("1.50")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.BET_NOT_FOUND);
    }

    @Test
    void cashOut_shouldHideBetsOfOtherPlayers() {
        bet(5L, "20.00", null);
        Utilisateur autre = Utilisateur.builder().id(2L).email("autre@test.com").build();

        assertThatThrownBy(() -> service(false).cashOut(autre, 5L, new BigDecimal("1.50")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.BET_NOT_FOUND);
    }

    @Test
    void cashOut_withClamp_shouldNotExceedElapsedMultiplier() {
        // 5 s sur 10 s de vol vers x3.00 → x2.00
        bet(5L, "20.00", null);
        when(bets.settleIfActive(eq(5L), any(), any(), eq(new BigDecimal("2.00")), eq(new BigDecimal("40.00")), any()))
                .thenReturn(1);
        givenCredit("40.00", "140.00");

        CashoutResult r = service(true).cashOut(5L, new BigDecimal("2.80"));

        assertThat(r.multiplier()).isEqualByComparingTo("2.00");
    }

    @Test
    void cashOut_shouldReportDuplicateWinJournalAsNotActive() {
        bet(5L, "20.00", null);
        when(bets.settleIfActive(eq(5L), any(), any(), any(), any(), any())).thenReturn(1);
        when(wallet.crediterGain(any(), any(), eq("WIN_5"), anyString()))
                .thenThrow(new DataIntegrityViolationException("WIN_5"));

        assertThatThrownBy(() -> service(false).cashOut(5L, new BigDecimal("2.00")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.BET_NOT_ACTIVE);
        verifyNoInteractions(broadcaster);
    }

    // --- encaissement automatique ---

    @Test
    void settleAuto_shouldMarkBetWonAtItsTarget() {
        bet(8L, "10.00", "2.50");
        when(bets.settleIfActive(eq(8L), eq(BetStatus.ACTIVE), eq(BetStatus.WON),
                eq(new BigDecimal("2.50")), eq(new BigDecimal("25.00")), any())).thenReturn(1);
        givenCredit("25.00", "115.00");

        CashoutResult r = service(false).settleAuto(8L, new BigDecimal("2.50"));

        assertThat(r.status()).isEqualTo(BetStatus.WON);
        assertThat(r.payout()).isEqualByComparingTo("25.00");
    }

    @Test
    void settleAuto_shouldRefuseTargetAboveForcedCrash() {
        bet(8L, "10.00", "2.50");
        round.setStatus(RoundStatus.CRASHED);
        round.setFinalMultiplier(new BigDecimal("1.80"));

        assertThatThrownBy(() -> service(false).settleAuto(8L, new BigDecimal("2.50")))
                .extracting(SettlementServiceTest::reasonOf)
                .isEqualTo(RejectionReason.MULTIPLIER_EXCEEDS_CRASH);
        verifyNoInteractions(wallet);
    }

    // --- balayage de fin de round ---

    @Test
    void settleRemaining_shouldPayReachedTargetsAndCloseTheRest() {
        round.setStatus(RoundStatus.CRASHED);
        round.setFinalMultiplier(new BigDecimal("2.50"));
        CrashBet gagnant = bet(1L, "10.00", "2.50");   // cible atteinte, inclusive
        CrashBet perdant = bet(2L, "10.00", "3.00");
        CrashBet sansAuto = bet(3L, "10.00", null);
        CrashBet dejaRegle = bet(4L, "10.00", null);
        when(bets.findByRoundAndStatus(7L, BetStatus.ACTIVE)).thenReturn(List.of(gagnant, perdant, sansAuto, dejaRegle));

        when(bets.settleIfActive(eq(1L), eq(BetStatus.ACTIVE), eq(BetStatus.WON), any(), any(), any())).thenReturn(1);
        when(bets.settleIfActive(eq(2L), eq(BetStatus.ACTIVE), eq(BetStatus.LOST), isNull(), eq(BigDecimal.ZERO), any())).thenReturn(1);
        when(bets.settleIfActive(eq(3L), eq(BetStatus.ACTIVE), eq(BetStatus.LOST), isNull(), eq(BigDecimal.ZERO), any())).thenReturn(1);
        when(bets.settleIfActive(eq(4L), eq(BetStatus.ACTIVE), eq(BetStatus.LOST), isNull(), eq(BigDecimal.ZERO), any())).thenReturn(0);
        givenCredit("25.00", "125.00");

        SettlementSummary s = service(false).settleRemaining(7L, new BigDecimal("2.50"));

        assertThat(s.won()).isEqualTo(1);
        assertThat(s.lost()).isEqualTo(2);
        assertThat(s.alreadySettled()).isEqualTo(1);
        assertThat(s.failed()).isZero();
        assertThat(s.paidOut()).isEqualByComparingTo("25.00");
        verify(wallet, times(1)).crediterGain(any(), any(), anyString(), anyString());
    }

    @Test
    void settleRemaining_shouldKeepGoingWhenOneBetFails() {
        round.setStatus(RoundStatus.CRASHED);
        round.setFinalMultiplier(new BigDecimal("1.20"));
        CrashBet casse = bet(1L, "10.00", null);
        CrashBet ok = bet(2L, "10.00", null);
        when(bets.findByRoundAndStatus(7L, BetStatus.ACTIVE)).thenReturn(List.of(casse, ok));
        when(bets.settleIfActive(eq(1L), any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("db"));
        when(bets.settleIfActive(eq(2L), any(), any(), any(), any(), any())).thenReturn(1);

        SettlementSummary s = service(false).settleRemaining(7L, new BigDecimal("1.20"));

        assertThat(s.failed()).isEqualTo(1);
        assertThat(s.lost()).isEqualTo(1);
    }
}
