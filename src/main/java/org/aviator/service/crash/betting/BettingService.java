package org.aviator.service.crash.betting;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aviator.model.CrashBet;
import org.aviator.model.CrashRound;
import org.aviator.model.RoundStatus;
import org.aviator.model.Utilisateur;
import org.aviator.model.Wallet;
import org.aviator.repo.BetRepository;
import org.aviator.repo.RoundRepository;
import org.aviator.repo.UtilisateurRepository;
import org.aviator.service.WalletService;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.aviator.service.crash.registry.CurrentRoundRegistry;
import org.aviator.service.crash.registry.RoundSnapshot;
import org.aviator.service.crash.util.Locks;
import org.aviator.service.crash.util.PhaseGate;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

/**
 * Prise de mise sur le round courant.
 * Vérifications, insertion du pari et débit du wallet forment une seule transaction,
 * exécutée sous le verrou de lecture de {@link PhaseGate} et le verrou du joueur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BettingService {
    private static final BigDecimal MIN_AUTO_CASHOUT = new BigDecimal("1.00");

    private final CurrentRoundRegistry registry;
    private final RoundRepository rounds;
    private final BetRepository bets;
    private final UtilisateurRepository users;
    private final WalletService wallet;
    private final PhaseGate gate;
    private final Locks locks;
    private final TransactionTemplate tx;
    private final Clock clock;

    public PlacedBet placeBet(Utilisateur u, BigDecimal amount, BigDecimal autoCashoutAt) {
        BigDecimal montant = normaliserMontant(amount);
        BigDecimal auto = normaliserAuto(autoCashoutAt);

        RoundSnapshot snap = registry.current()
                .orElseThrow(() -> new CrashException(RejectionReason.NO_ACTIVE_ROUND, "Aucun round en cours"));
        // rejet rapide, revérifié en base sous le verrou
        if (!snap.acceptsBets(clock.instant()))
            throw new CrashException(RejectionReason.ROUND_NOT_ACCEPTING_BETS, "Les mises sont fermées");

        return gate.shared(() -> {
            synchronized (locks.ofUser(u.getId())) {
                try {
                    return tx.execute(status -> placer(snap.roundId(), u.getId(), montant, auto));
                } catch (DataIntegrityViolationException ex) {
                    log.warn("Mise en double refusée user={} round={}", u.getId(), snap.roundNumber());
                    throw new CrashException(RejectionReason.DUPLICATE_BET, "Déjà une mise sur ce round");
                }
            }
        });
    }

    private PlacedBet placer(Long roundId, Long userId, BigDecimal montant, BigDecimal auto) {
        Instant now = clock.instant();
        CrashRound round = rounds.findById(roundId)
                .orElseThrow(() -> new CrashException(RejectionReason.NO_ACTIVE_ROUND, "Round introuvable"));
        if (round.getStatus() != RoundStatus.BETTING || !now.isBefore(round.getBettingWindowEnd()))
            throw new CrashException(RejectionReason.ROUND_NOT_ACCEPTING_BETS, "Les mises sont fermées");

        Utilisateur user = users.findById(userId)
                .orElseThrow(() -> new CrashException(RejectionReason.ACCOUNT_DISABLED, "Utilisateur introuvable"));
        if (!user.isActive()) throw new CrashException(RejectionReason.ACCOUNT_DISABLED, "Compte désactivé");

        if (montant.compareTo(round.getMinBet()) < 0)
            throw new CrashException(RejectionReason.INVALID_AMOUNT, "Mise inférieure au minimum (" + round.getMinBet() + ")");
        if (montant.compareTo(round.getMaxBet()) > 0)
            throw new CrashException(RejectionReason.INVALID_AMOUNT, "Mise supérieure au maximum (" + round.getMaxBet() + ")");
        if (auto != null && auto.compareTo(round.getMaxCashoutMultiplier()) > 0)
            throw new CrashException(RejectionReason.INVALID_MULTIPLIER,
                    "Encaissement auto au-delà du maximum (" + round.getMaxCashoutMultiplier() + ")");

        if (bets.existsByRoundIdAndUtilisateurId(roundId, userId))
            throw new CrashException(RejectionReason.DUPLICATE_BET, "Déjà une mise sur ce round");

        CrashBet bet = bets.saveAndFlush(CrashBet.builder()
                .round(round)
                .utilisateur(user)
                .amount(montant)
                .autoCashoutAt(auto)
                .build());

        // débit en dernier : un solde insuffisant annule aussi l'insertion du pari
        Wallet w = wallet.debiterMise(user, montant, WalletService.betReference(bet.getId()),
                "Mise crash round #" + round.getRoundNumber());

        log.info("Mise {} placée: user={} round={} montant={} auto={}",
                bet.getId(), userId, round.getRoundNumber(), montant, auto);
        return new PlacedBet(bet.getId(), round.getRoundNumber(), montant, auto, w.getSolde());
    }

    private static BigDecimal normaliserMontant(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0)
            throw new CrashException(RejectionReason.INVALID_AMOUNT, "Montant invalide");
        if (amount.stripTrailingZeros().scale() > 2)
            throw new CrashException(RejectionReason.INVALID_AMOUNT, "Deux décimales maximum");
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }

    private static BigDecimal normaliserAuto(BigDecimal autoCashoutAt) {
        if (autoCashoutAt == null) return null;
        if (autoCashoutAt.compareTo(MIN_AUTO_CASHOUT) <= 0)
            throw new CrashException(RejectionReason.INVALID_MULTIPLIER, "L'encaissement auto doit dépasser 1.00");
        if (autoCashoutAt.stripTrailingZeros().scale() > 2)
            throw new CrashException(RejectionReason.INVALID_MULTIPLIER, "Deux décimales maximum");
        return autoCashoutAt.setScale(2, RoundingMode.UNNECESSARY);
    }
}
