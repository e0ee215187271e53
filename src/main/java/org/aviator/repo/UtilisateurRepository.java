package org.aviator.repo;

import org.aviator.model.Utilisateur;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UtilisateurRepository extends JpaRepository<Utilisateur, Long> {
    // email = identifiant de connexion (sujet du JWT)
    Optional<Utilisateur> findByEmail(String email);
}
