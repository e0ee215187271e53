package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "wallet")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Wallet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "utilisateur_id", nullable = false, unique = true)
    private Utilisateur utilisateur;

    // jamais négatif : les débits passent par un update conditionnel
    @Builder.Default
    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal solde = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "total_mise", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalMise = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "total_gagne", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalGagne = BigDecimal.ZERO;
}
