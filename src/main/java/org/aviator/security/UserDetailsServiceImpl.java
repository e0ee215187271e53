package org.aviator.security;

import lombok.RequiredArgsConstructor;
import org.aviator.model.Utilisateur;
import org.aviator.repo.UtilisateurRepository;
import org.springframework.security.core.userdetails.*;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserDetailsServiceImpl implements UserDetailsService {
    private final UtilisateurRepository utilisateurRepo;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        Utilisateur u = utilisateurRepo.findByEmail(username)
                .orElseThrow(() -> new UsernameNotFoundException("Utilisateur non trouvé"));

        String role = (u.getRole() != null && !u.getRole().isBlank()) ? u.getRole() : "USER";

        // un compte désactivé peut encore se connecter et consulter, mais plus miser (BettingService)
        return User.withUsername(u.getEmail())
                .password(u.getMotDePasseHash())
                .roles(role) // Spring préfixe par "ROLE_"
                .build();
    }
}
