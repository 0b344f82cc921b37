package com.relayhub.turnservice.dto.response;

import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.enums.SeasonStatus;
import com.relayhub.turnservice.domain.model.SeasonConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * 赛季读模型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonView {

    private UUID id;
    private String name;
    private SeasonStatus status;
    private UUID creatorId;
    private SeasonConfig config;
    private List<UUID> playerIds;      // 按加入顺序
    private List<GameSummary> games;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameSummary {
        private UUID gameId;
        private GameStatus status;
    }
}
