package com.relayhub.turnservice.domain.repository;

import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * 对局 Repository
 */
@Repository
public interface GameRepository extends JpaRepository<Game, UUID> {

    List<Game> findBySeasonIdOrderByCreatedAtAsc(UUID seasonId);

    /**
     * 统计赛季中尚未结束的对局数
     */
    long countBySeasonIdAndStatusNotIn(UUID seasonId, Collection<GameStatus> statuses);

    /**
     * 条件结束对局：仅当对局仍处于 open 状态之一时生效（首次判定完成时翻转）
     * @return 更新行数
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Game g SET g.status = :target, g.completedAt = :now " +
           "WHERE g.id = :id AND g.status IN :open")
    int finish(@Param("id") UUID id,
               @Param("open") Collection<GameStatus> open,
               @Param("target") GameStatus target,
               @Param("now") OffsetDateTime now);

    /**
     * 批量终止赛季下所有未结束的对局
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Game g SET g.status = :target, g.completedAt = :now " +
           "WHERE g.seasonId = :seasonId AND g.status IN :open")
    int finishAllInSeason(@Param("seasonId") UUID seasonId,
                          @Param("open") Collection<GameStatus> open,
                          @Param("target") GameStatus target,
                          @Param("now") OffsetDateTime now);
}
