package com.relayhub.turnservice.domain.repository;

import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.model.Turn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 回合 Repository
 *
 * 所有状态迁移都走下面的条件更新（WHERE status = 期望状态），
 * 返回 0 行即视为前置状态不满足或并发竞争失败。这是引擎唯一的并发正确性边界。
 */
@Repository
public interface TurnRepository extends JpaRepository<Turn, UUID> {

    List<Turn> findByGameIdOrderByTurnNumberAsc(UUID gameId);

    /**
     * 对局中序号最小的 AVAILABLE 回合
     */
    Optional<Turn> findFirstByGameIdAndStatusOrderByTurnNumberAsc(UUID gameId, TurnStatus status);

    /**
     * 对局中最新（序号最大）的回合
     */
    Optional<Turn> findFirstByGameIdOrderByTurnNumberDesc(UUID gameId);

    /**
     * 赛季内所有回合（跨对局），用于选人统计
     */
    @Query("SELECT t FROM Turn t WHERE t.gameId IN (SELECT g.id FROM Game g WHERE g.seasonId = :seasonId)")
    List<Turn> findAllInSeason(@Param("seasonId") UUID seasonId);

    /**
     * 玩家在赛季内处于指定状态的回合数
     */
    @Query("SELECT COUNT(t) FROM Turn t WHERE t.playerId = :playerId AND t.status = :status " +
           "AND t.gameId IN (SELECT g.id FROM Game g WHERE g.seasonId = :seasonId)")
    long countInSeasonByPlayerAndStatus(@Param("seasonId") UUID seasonId,
                                        @Param("playerId") UUID playerId,
                                        @Param("status") TurnStatus status);

    /**
     * 对局中已完成/已跳过回合的玩家（去重）
     */
    @Query("SELECT DISTINCT t.playerId FROM Turn t WHERE t.gameId = :gameId AND t.status IN :statuses " +
           "AND t.playerId IS NOT NULL")
    List<UUID> findPlayerIdsByGameAndStatusIn(@Param("gameId") UUID gameId,
                                              @Param("statuses") Collection<TurnStatus> statuses);

    /**
     * 玩家当前持有的某状态回合（OFFERED/PENDING），用于赛季终止时清理
     */
    @Query("SELECT t FROM Turn t WHERE t.status IN :statuses " +
           "AND t.gameId IN (SELECT g.id FROM Game g WHERE g.seasonId = :seasonId)")
    List<Turn> findInSeasonByStatusIn(@Param("seasonId") UUID seasonId,
                                      @Param("statuses") Collection<TurnStatus> statuses);

    // ===================== 条件状态迁移（CAS） =====================

    /**
     * AVAILABLE → OFFERED。
     * 同局内该玩家已持有非 AVAILABLE 回合时不生效（同局唯一性）。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Turn t SET t.status = com.relayhub.turnservice.domain.enums.TurnStatus.OFFERED, " +
           "t.playerId = :playerId, t.offeredAt = :now, t.updatedAt = :now " +
           "WHERE t.id = :turnId AND t.status = com.relayhub.turnservice.domain.enums.TurnStatus.AVAILABLE " +
           "AND NOT EXISTS (SELECT o.id FROM Turn o WHERE o.gameId = :gameId AND o.playerId = :playerId " +
           "AND o.status <> com.relayhub.turnservice.domain.enums.TurnStatus.AVAILABLE)")
    int markOffered(@Param("turnId") UUID turnId,
                    @Param("gameId") UUID gameId,
                    @Param("playerId") UUID playerId,
                    @Param("now") OffsetDateTime now);

    /**
     * OFFERED → PENDING（仅限被邀请者，或未指定玩家的开放邀请）。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Turn t SET t.status = com.relayhub.turnservice.domain.enums.TurnStatus.PENDING, " +
           "t.playerId = :playerId, t.claimedAt = :now, t.updatedAt = :now " +
           "WHERE t.id = :turnId AND t.status = com.relayhub.turnservice.domain.enums.TurnStatus.OFFERED " +
           "AND (t.playerId = :playerId OR t.playerId IS NULL) " +
           "AND NOT EXISTS (SELECT o.id FROM Turn o WHERE o.gameId = :gameId AND o.playerId = :playerId " +
           "AND o.id <> :turnId AND o.status <> com.relayhub.turnservice.domain.enums.TurnStatus.AVAILABLE)")
    int markClaimed(@Param("turnId") UUID turnId,
                    @Param("gameId") UUID gameId,
                    @Param("playerId") UUID playerId,
                    @Param("now") OffsetDateTime now);

    /**
     * PENDING → COMPLETED，写入内容。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Turn t SET t.status = com.relayhub.turnservice.domain.enums.TurnStatus.COMPLETED, " +
           "t.completedAt = :now, t.textContent = :textContent, t.imageUrl = :imageUrl, t.updatedAt = :now " +
           "WHERE t.id = :turnId AND t.status = com.relayhub.turnservice.domain.enums.TurnStatus.PENDING " +
           "AND t.playerId = :playerId")
    int markCompleted(@Param("turnId") UUID turnId,
                      @Param("playerId") UUID playerId,
                      @Param("textContent") String textContent,
                      @Param("imageUrl") String imageUrl,
                      @Param("now") OffsetDateTime now);

    /**
     * OFFERED → AVAILABLE，清空玩家与邀请时间。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Turn t SET t.status = com.relayhub.turnservice.domain.enums.TurnStatus.AVAILABLE, " +
           "t.playerId = NULL, t.offeredAt = NULL, t.claimedAt = NULL, t.updatedAt = :now " +
           "WHERE t.id = :turnId AND t.status = com.relayhub.turnservice.domain.enums.TurnStatus.OFFERED")
    int markDismissed(@Param("turnId") UUID turnId, @Param("now") OffsetDateTime now);

    /**
     * OFFERED/PENDING → SKIPPED。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Turn t SET t.status = com.relayhub.turnservice.domain.enums.TurnStatus.SKIPPED, " +
           "t.skippedAt = :now, t.updatedAt = :now " +
           "WHERE t.id = :turnId AND t.status = :expected")
    int markSkipped(@Param("turnId") UUID turnId,
                    @Param("expected") TurnStatus expected,
                    @Param("now") OffsetDateTime now);
}
