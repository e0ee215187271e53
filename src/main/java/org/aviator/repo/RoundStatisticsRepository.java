package org.aviator.repo;

import org.aviator.model.RoundStatistics;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RoundStatisticsRepository extends JpaRepository<RoundStatistics, Long> {
    boolean existsByRoundId(Long roundId);

    Optional<RoundStatistics> findByRoundId(Long roundId);
}
