package com.relayhub.turnservice.dto.response;

import com.relayhub.turnservice.domain.enums.GameStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 对局读模型（含全部回合）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameView {

    private UUID id;
    private UUID seasonId;
    private GameStatus status;
    private OffsetDateTime createdAt;
    private OffsetDateTime completedAt;
    private List<TurnView> turns;
}
