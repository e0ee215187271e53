package org.aviator.repo;

import org.aviator.model.Utilisateur;
import org.aviator.model.Wallet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Optional;

public interface WalletRepository extends JpaRepository<Wallet, Long> {
    Optional<Wallet> findByUtilisateur(Utilisateur utilisateur);

    Optional<Wallet> findByUtilisateurId(Long utilisateurId);

    // Les deux updates verrouillent la ligne jusqu'au commit : un seul mouvement à la fois par wallet
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Wallet w set w.solde = w.solde + :amount, w.totalGagne = w.totalGagne + :amount where w.utilisateur = :u")
    int crediterGain(@Param("u") Utilisateur utilisateur, @Param("amount") BigDecimal amount);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Wallet w set w.solde = w.solde - :amount, w.totalMise = w.totalMise + :amount " +
            "where w.utilisateur = :u and w.solde >= :amount")
    int debiterMiseSiSuffisant(@Param("u") Utilisateur utilisateur, @Param("amount") BigDecimal amount);
}
