package com.relayhub.turnservice.service.player.impl;

import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.domain.repository.PlayerRepository;
import com.relayhub.turnservice.service.player.PlayerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 玩家服务实现类
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerServiceImpl implements PlayerService {

    private final PlayerRepository playerRepository;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Player getOrCreate(String externalId, String displayName) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId 不能为空");
        }
        String name = (displayName == null || displayName.isBlank()) ? externalId : displayName.trim();

        Optional<Player> existing = playerRepository.findByExternalId(externalId);
        if (existing.isPresent()) {
            Player player = existing.get();
            if (!name.equals(player.getDisplayName())) {
                player.setDisplayName(name);
                log.info("更新玩家展示名: playerId={}, displayName={}", player.getId(), name);
                return playerRepository.save(player);
            }
            return player;
        }

        Player player = playerRepository.save(Player.builder()
                .externalId(externalId)
                .displayName(name)
                .build());
        log.info("创建玩家: externalId={}, playerId={}", externalId, player.getId());
        return player;
    }

    @Override
    public Optional<Player> findByExternalId(String externalId) {
        return playerRepository.findByExternalId(externalId);
    }
}
