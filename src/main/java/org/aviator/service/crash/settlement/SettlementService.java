package org.aviator.service.crash.settlement;

import lombok.extern.slf4j.Slf4j;
import org.aviator.model.BetStatus;
import org.aviator.model.CrashBet;
import org.aviator.model.CrashRound;
import org.aviator.model.Utilisateur;
import org.aviator.model.Wallet;
import org.aviator.repo.BetRepository;
import org.aviator.service.WalletService;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.aviator.service.crash.engine.MultiplierClock;
import org.aviator.service.crash.registry.CurrentRoundRegistry;
import org.aviator.service.crash.registry.RoundSnapshot;
import org.aviator.service.crash.util.CrashBroadcaster;
import org.aviator.service.crash.util.Locks;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Règlement des paris : encaissement manuel, encaissement automatique et balayage de fin de round.
 * Tous les chemins passent par le même verrou de pari puis par {@link BetRepository#settleIfActive},
 * un pari n'est donc payé qu'une fois quel que soit l'entrelacement.
 */
@Slf4j
@Service
public class SettlementService {
    private static final BigDecimal MIN_MULTIPLIER = new BigDecimal("1.00");

    private final BetRepository bets;
    private final WalletService wallet;
    private final CurrentRoundRegistry registry;
    private final CrashBroadcaster broadcaster;
    private final Locks locks;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final boolean clampToElapsed;

    public SettlementService(BetRepository bets,
                             WalletService wallet,
                             CurrentRoundRegistry registry,
                             CrashBroadcaster broadcaster,
                             Locks locks,
                             TransactionTemplate tx,
                             Clock clock,
                             @Value("${crash.cashout.clamp-to-elapsed:false}") boolean clampToElapsed) {
        this.bets = bets;
        this.wallet = wallet;
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.locks = locks;
        this.tx = tx;
        this.clock = clock;
        this.clampToElapsed = clampToElapsed;
    }

    public CashoutResult cashOut(Long betId, BigDecimal requestedMultiplier) {
        return manuel(betId, requestedMultiplier, null);
    }

    /** Variante joueur : le pari doit lui appartenir ; sans betId, on prend sa mise sur le round courant. */
    public CashoutResult cashOut(Utilisateur u, Long betId, BigDecimal requestedMultiplier) {
        Long id = betId != null ? betId : pariCourant(u);
        return manuel(id, requestedMultiplier, u.getId());
    }

    public CashoutResult settleAuto(Long betId, BigDecimal autoCashoutAt) {
        return executer(betId, () -> {
            CrashBet bet = charger(betId);
            CrashRound r = bet.getRound();
            BigDecimal plafond = r.getFinalMultiplier() != null ? r.getFinalMultiplier() : r.getCrashMultiplier();
            if (plafond == null || autoCashoutAt.compareTo(plafond) > 0)
                throw new CrashException(RejectionReason.MULTIPLIER_EXCEEDS_CRASH, "Cible auto non atteinte");
            return gagner(bet, autoCashoutAt, BetStatus.WON);
        });
    }

    public SettlementSummary settleRemaining(Long roundId, BigDecimal finalMultiplier) {
        List<CrashBet> actifs = bets.findByRoundAndStatus(roundId, BetStatus.ACTIVE);
        int won = 0, lost = 0, deja = 0, failed = 0;
        BigDecimal paid = BigDecimal.ZERO;
        for (CrashBet b : actifs) {
            try {
                BigDecimal auto = b.getAutoCashoutAt();
                if (auto != null && auto.compareTo(finalMultiplier) <= 0) {
                    paid = paid.add(settleAuto(b.getId(), auto).payout());
                    won++;
                } else {
                    perdre(b.getId());
                    lost++;
                }
            } catch (CrashException ex) {
                if (ex.getReason() != RejectionReason.BET_NOT_ACTIVE) throw ex;
                deja++;
            } catch (RuntimeException ex) {
                // le pari reste ACTIVE, repris au passage suivant
                log.error("Règlement du pari {} en échec", b.getId(), ex);
                failed++;
            }
        }
        return new SettlementSummary(won, lost, deja, failed, paid);
    }

    private CashoutResult manuel(Long betId, BigDecimal requested, Long ownerId) {
        if (requested == null || requested.compareTo(MIN_MULTIPLIER) < 0)
            throw new CrashException(RejectionReason.INVALID_MULTIPLIER, "Multiplicateur invalide");
        BigDecimal demande = requested.setScale(2, RoundingMode.DOWN);

        return executer(betId, () -> {
            CrashBet bet = charger(betId);
            if (ownerId != null && !ownerId.equals(bet.getUtilisateur().getId()))
                throw new CrashException(RejectionReason.BET_NOT_FOUND, "Pari introuvable");

            CrashRound round = bet.getRound();
            switch (round.getStatus()) {
                case CRASHED, COMPLETED -> throw new CrashException(RejectionReason.ROUND_ALREADY_CRASHED, "L'avion est déjà parti");
                case WAITING, BETTING -> throw new CrashException(RejectionReason.ROUND_NOT_FLYING, "Le round n'est pas en vol");
                default -> { }
            }
            if (bet.getStatus() != BetStatus.ACTIVE)
                throw new CrashException(RejectionReason.BET_NOT_ACTIVE, "Pari déjà réglé");

            BigDecimal m = demande;
            if (clampToElapsed) {
                Duration elapsed = Duration.between(round.getFlightStart(), clock.instant());
                m = m.min(MultiplierClock.at(elapsed, round.getCrashMultiplier(),
                        Duration.ofMillis(round.getFlightDurationMs())));
            }
            if (m.compareTo(round.getCrashMultiplier()) > 0)
                throw new CrashException(RejectionReason.MULTIPLIER_EXCEEDS_CRASH, "Multiplicateur au-delà du crash");

            return gagner(bet, m, BetStatus.CASHED_OUT);
        });
    }

    private CashoutResult executer(Long betId, Supplier<CashoutResult> unite) {
        CashoutResult res;
        synchronized (locks.ofBet(betId)) {
            try {
                res = tx.execute(status -> unite.get());
            } catch (DataIntegrityViolationException ex) {
                // référence WIN_<id> déjà journalisée : un autre chemin a payé
                log.warn("Double règlement évité pour le pari {}", betId);
                throw new CrashException(RejectionReason.BET_NOT_ACTIVE, "Pari déjà réglé");
            }
        }
        diffuser(res);
        return res;
    }

    private CashoutResult gagner(CrashBet bet, BigDecimal multiplier, BetStatus statut) {
        Long id = bet.getId();
        Long roundNumber = bet.getRound().getRoundNumber();
        Utilisateur user = bet.getUtilisateur();
        BigDecimal payout = bet.getAmount().multiply(multiplier).setScale(2, RoundingMode.DOWN);

        int n = bets.settleIfActive(id, BetStatus.ACTIVE, statut, multiplier, payout, clock.instant());
        if (n == 0) throw new CrashException(RejectionReason.BET_NOT_ACTIVE, "Pari déjà réglé");

        Wallet w = wallet.crediterGain(user, payout, WalletService.winReference(id),
                "Gain crash round #" + roundNumber + " x" + multiplier);
        log.info("Pari {} {} à x{}: gain={} user={}", id, statut, multiplier, payout, user.getId());
        return new CashoutResult(id, roundNumber, statut, multiplier, payout, w.getSolde());
    }

    private void perdre(Long betId) {
        synchronized (locks.ofBet(betId)) {
            Integer n = tx.execute(status -> bets.settleIfActive(betId, BetStatus.ACTIVE, BetStatus.LOST,
                    null, BigDecimal.ZERO, clock.instant()));
            if (n == null || n == 0) throw new CrashException(RejectionReason.BET_NOT_ACTIVE, "Pari déjà réglé");
        }
    }

    private CrashBet charger(Long betId) {
        return bets.findWithRound(betId)
                .orElseThrow(() -> new CrashException(RejectionReason.BET_NOT_FOUND, "Pari introuvable"));
    }

    private Long pariCourant(Utilisateur u) {
        RoundSnapshot snap = registry.current()
                .orElseThrow(() -> new CrashException(RejectionReason.NO_ACTIVE_ROUND, "Aucun round en cours"));
        return bets.findByRoundIdAndUtilisateurId(snap.roundId(), u.getId())
                .map(CrashBet::getId)
                .orElseThrow(() -> new CrashException(RejectionReason.BET_NOT_FOUND, "Aucune mise sur ce round"));
    }

    private void diffuser(CashoutResult r) {
        if (r == null) return;
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("betId", r.betId());
        p.put("roundNumber", r.roundNumber());
        p.put("auto", r.status() == BetStatus.WON);
        p.put("multiplier", r.multiplier());
        p.put("payout", r.payout());
        broadcaster.broadcast("CASHOUT", p);
    }
}
