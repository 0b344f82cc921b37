package com.relayhub.turnservice.domain.repository;

import com.relayhub.turnservice.domain.enums.SeasonStatus;
import com.relayhub.turnservice.domain.model.Season;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * 赛季 Repository
 */
@Repository
public interface SeasonRepository extends JpaRepository<Season, UUID> {

    /**
     * 加锁读取赛季（加入/激活时防止超员或重复激活）
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Season s WHERE s.id = :id")
    Optional<Season> lockById(@Param("id") UUID id);

    /**
     * 条件更新赛季状态（仅当当前状态为 expected 时生效）
     * @return 更新行数，0 表示状态已被其他请求改变
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Season s SET s.status = :target, s.updatedAt = :now WHERE s.id = :id AND s.status = :expected")
    int transition(@Param("id") UUID id,
                   @Param("expected") SeasonStatus expected,
                   @Param("target") SeasonStatus target,
                   @Param("now") OffsetDateTime now);
}
