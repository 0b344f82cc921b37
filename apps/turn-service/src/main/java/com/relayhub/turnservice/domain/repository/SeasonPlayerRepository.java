package com.relayhub.turnservice.domain.repository;

import com.relayhub.turnservice.domain.model.SeasonPlayer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 赛季成员 Repository
 */
@Repository
public interface SeasonPlayerRepository extends JpaRepository<SeasonPlayer, UUID> {

    /**
     * 按加入顺序列出成员
     */
    List<SeasonPlayer> findBySeasonIdOrderByJoinedAtAsc(UUID seasonId);

    Optional<SeasonPlayer> findBySeasonIdAndPlayerId(UUID seasonId, UUID playerId);

    boolean existsBySeasonIdAndPlayerId(UUID seasonId, UUID playerId);

    long countBySeasonId(UUID seasonId);
}
