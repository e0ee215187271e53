package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Ligne du journal (append-only). Chaque mouvement de solde en a exactement une ;
 * la référence unique ({@code BET_<betId>}, {@code WIN_<betId>}) empêche un double règlement.
 */
@Entity
@Table(name = "wallet_transaction",
        uniqueConstraints = @UniqueConstraint(name = "uk_wallet_tx_reference", columnNames = "reference"),
        indexes = @Index(name = "wallet_tx_user_idx", columnList = "utilisateur_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WalletTransaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "utilisateur_id", nullable = false)
    private Utilisateur utilisateur;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TransactionKind kind;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 100)
    private String reference;

    @Column(length = 255)
    private String description;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
