package org.aviator.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity // joueur ou admin ; l'inscription est gérée hors du moteur
@Table(name = "utilisateur")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Utilisateur {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = false)
    private String pseudo;

    @Column(nullable = false) // mot de passe haché (BCrypt)
    private String motDePasseHash;

    @Builder.Default
    private LocalDateTime dateCreation = LocalDateTime.now();

    // compte suspendu => plus de mises
    @Builder.Default
    private boolean active = true;

    // USER par défaut, ADMIN pour le pilotage du moteur
    @Builder.Default
    @Column(nullable = false)
    private String role = "USER";
}
