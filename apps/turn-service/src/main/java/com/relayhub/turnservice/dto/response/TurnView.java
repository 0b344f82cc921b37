package com.relayhub.turnservice.dto.response;

import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Turn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * 回合读模型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnView {

    private UUID id;
    private UUID gameId;
    private int turnNumber;
    private TurnType type;
    private TurnStatus status;
    private UUID playerId;
    private OffsetDateTime offeredAt;
    private OffsetDateTime claimedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime skippedAt;
    private String textContent;
    private String imageUrl;

    public static TurnView from(Turn turn) {
        return TurnView.builder()
                .id(turn.getId())
                .gameId(turn.getGameId())
                .turnNumber(turn.getTurnNumber())
                .type(turn.getType())
                .status(turn.getStatus())
                .playerId(turn.getPlayerId())
                .offeredAt(turn.getOfferedAt())
                .claimedAt(turn.getClaimedAt())
                .completedAt(turn.getCompletedAt())
                .skippedAt(turn.getSkippedAt())
                .textContent(turn.getTextContent())
                .imageUrl(turn.getImageUrl())
                .build();
    }
}
