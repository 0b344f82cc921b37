package com.relayhub.turnservice.domain.repository;

import com.relayhub.turnservice.domain.model.Player;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * 玩家 Repository
 */
@Repository
public interface PlayerRepository extends JpaRepository<Player, UUID> {

    Optional<Player> findByExternalId(String externalId);

    /**
     * 行级写锁读取玩家：同一玩家的认领操作在此串行化，
     * 保证赛季内至多一个 PENDING 回合。
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Player p WHERE p.id = :id")
    Optional<Player> lockById(@Param("id") UUID id);
}
