package com.relayhub.turnservice.service.player;

import com.relayhub.turnservice.domain.model.Player;

import java.util.Optional;

/**
 * 玩家服务
 */
public interface PlayerService {

    /**
     * 按外部平台ID获取玩家，不存在则创建；展示名变化时同步更新
     */
    Player getOrCreate(String externalId, String displayName);

    Optional<Player> findByExternalId(String externalId);
}
