package org.aviator.repo;

import org.aviator.model.TransactionKind;
import org.aviator.model.WalletTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, Long> {
    boolean existsByReference(String reference);

    long countByReference(String reference);

    List<WalletTransaction> findByUtilisateurIdOrderByCreatedAtDesc(Long utilisateurId, Pageable pageable);

    // null si aucune ligne
    @Query("select sum(t.amount) from WalletTransaction t where t.utilisateur.id = :uid and t.kind = :kind")
    BigDecimal sumByUtilisateurAndKind(@Param("uid") Long utilisateurId, @Param("kind") TransactionKind kind);
}
