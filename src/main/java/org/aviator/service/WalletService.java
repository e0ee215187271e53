package org.aviator.service;

import lombok.RequiredArgsConstructor;
import org.aviator.model.TransactionKind;
import org.aviator.model.Utilisateur;
import org.aviator.model.Wallet;
import org.aviator.model.WalletTransaction;
import org.aviator.repo.WalletRepository;
import org.aviator.repo.WalletTransactionRepository;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.List;

/**
 * Seul point de mutation des soldes. Chaque mouvement écrit sa ligne de journal dans la même
 * transaction ; une référence déjà utilisée fait échouer toute l'unité.
 */
@Service
@RequiredArgsConstructor
public class WalletService {
    private final WalletRepository walletRepo;
    private final WalletTransactionRepository txRepo;
    private final WalletSseService walletSseService;

    @Transactional
    public Wallet getWalletParUtilisateur(Utilisateur u) {
        return walletRepo.findByUtilisateur(u).orElseGet(() -> walletRepo.save(Wallet.builder()
                .utilisateur(u)
                .solde(BigDecimal.ZERO)
                .totalMise(BigDecimal.ZERO)
                .totalGagne(BigDecimal.ZERO)
                .build()));
    }

    @Transactional
    public Wallet debiterMise(Utilisateur u, BigDecimal montant, String reference, String description) {
        requirePositive(montant);
        getWalletParUtilisateur(u);
        journaliser(u, TransactionKind.BET, montant, reference, description);
        int updated = walletRepo.debiterMiseSiSuffisant(u, montant);
        if (updated == 0) throw new CrashException(RejectionReason.INSUFFICIENT_FUNDS, "Solde insuffisant");
        return apresMouvement(u);
    }

    @Transactional
    public Wallet crediterGain(Utilisateur u, BigDecimal montant, String reference, String description) {
        requirePositive(montant);
        getWalletParUtilisateur(u);
        journaliser(u, TransactionKind.WIN, montant, reference, description);
        int updated = walletRepo.crediterGain(u, montant);
        if (updated == 0) throw new IllegalStateException("Wallet introuvable pour " + u.getEmail());
        return apresMouvement(u);
    }

    @Transactional(readOnly = true)
    public List<WalletTransaction> transactions(Utilisateur u, int limit) {
        int size = limit <= 0 ? 20 : Math.min(limit, 100);
        return txRepo.findByUtilisateurIdOrderByCreatedAtDesc(u.getId(), PageRequest.of(0, size));
    }

    public static String betReference(Long betId) { return "BET_" + betId; }

    public static String winReference(Long betId) { return "WIN_" + betId; }

    private void journaliser(Utilisateur u, TransactionKind kind, BigDecimal montant, String reference, String description) {
        // flush immédiat : la contrainte d'unicité sur la référence saute ici, avant le mouvement de solde
        txRepo.saveAndFlush(WalletTransaction.builder()
                .utilisateur(u)
                .kind(kind)
                .amount(montant)
                .reference(reference)
                .description(description)
                .build());
    }

    private Wallet apresMouvement(Utilisateur u) {
        Wallet w = walletRepo.findByUtilisateur(u).orElseThrow();
        notifierApresCommit(u.getEmail(), w.getSolde());
        return w;
    }

    private void notifierApresCommit(String email, BigDecimal solde) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    walletSseService.sendBalanceUpdate(email, solde);
                }
            });
        } else {
            walletSseService.sendBalanceUpdate(email, solde);
        }
    }

    private static void requirePositive(BigDecimal montant) {
        if (montant == null || montant.signum() <= 0)
            throw new CrashException(RejectionReason.INVALID_AMOUNT, "Montant invalide");
    }
}
