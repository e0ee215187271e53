package org.aviator.repo;

import org.aviator.model.GameSettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface GameSettingsRepository extends JpaRepository<GameSettings, Long> {
    Optional<GameSettings> findFirstByOrderByIdAsc();
}
