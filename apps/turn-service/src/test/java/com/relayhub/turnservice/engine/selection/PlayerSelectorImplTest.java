package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.SeasonPlayer;
import com.relayhub.turnservice.domain.model.Turn;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerSelectorImplTest {

    private final UUID game = UUID.randomUUID();
    private final UUID otherGame = UUID.randomUUID();
    private final UUID p1 = UUID.randomUUID();
    private final UUID p2 = UUID.randomUUID();

    private Turn turn(UUID gameId, int number, TurnType type, TurnStatus status, UUID playerId) {
        return Turn.builder()
                .id(UUID.randomUUID())
                .gameId(gameId)
                .turnNumber(number)
                .type(type)
                .status(status)
                .playerId(playerId)
                .build();
    }

    private SeasonPlayer member(UUID playerId) {
        return SeasonPlayer.builder().playerId(playerId).build();
    }

    @Test
    void countsAssignedTurnsAcrossTheSeason() {
        List<Turn> turns = List.of(
                turn(game, 1, TurnType.WRITING, TurnStatus.COMPLETED, p1),
                turn(otherGame, 1, TurnType.WRITING, TurnStatus.SKIPPED, p1),
                turn(otherGame, 2, TurnType.DRAWING, TurnStatus.PENDING, p1),
                turn(game, 2, TurnType.DRAWING, TurnStatus.AVAILABLE, null),
                turn(otherGame, 3, TurnType.WRITING, TurnStatus.OFFERED, p2));

        List<PlayerTurnStats> stats = PlayerSelectorImpl.collectStats(List.of(member(p1), member(p2)), turns, game);

        assertThat(stats).containsExactly(
                new PlayerTurnStats(p1, 2, 1, 1, true),
                new PlayerTurnStats(p2, 1, 0, 0, false));
    }

    @Test
    void previousPlayerIsOwnerOfHighestFinishedTurnInGame() {
        List<Turn> turns = List.of(
                turn(game, 1, TurnType.WRITING, TurnStatus.COMPLETED, p1),
                turn(game, 2, TurnType.DRAWING, TurnStatus.SKIPPED, p2),
                turn(game, 3, TurnType.WRITING, TurnStatus.OFFERED, p1),
                turn(otherGame, 7, TurnType.WRITING, TurnStatus.COMPLETED, p1));

        assertThat(PlayerSelectorImpl.previousPlayer(turns, game)).isEqualTo(p2);
    }

    @Test
    void noPreviousPlayerBeforeFirstTurnFinishes() {
        List<Turn> turns = List.of(turn(game, 1, TurnType.WRITING, TurnStatus.OFFERED, p1));

        assertThat(PlayerSelectorImpl.previousPlayer(turns, game)).isNull();
    }
}
