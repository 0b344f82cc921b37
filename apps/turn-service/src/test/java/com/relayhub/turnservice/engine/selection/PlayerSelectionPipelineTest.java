package com.relayhub.turnservice.engine.selection;

import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.engine.selection.rule.AntiRepeatRule;
import com.relayhub.turnservice.engine.selection.rule.MinimumTypeCountRule;
import com.relayhub.turnservice.engine.selection.rule.TypeQuotaRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerSelectionPipelineTest {

    private static final UUID A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID B = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    private static final UUID C = UUID.fromString("00000000-0000-0000-0000-00000000000c");
    private static final UUID GAME = UUID.randomUUID();

    private final PlayerSelectionPipeline pipeline = PlayerSelectionPipeline.standard();

    private static SelectionContext context(TurnType type, int players, UUID previous) {
        return new SelectionContext(GAME, type, players, previous);
    }

    @Test
    @DisplayName("强制规则剔除 C，配额规则会清空集合被跳过，最少写作次数选出 B")
    void selectsPlayerWithFewestWritingTurns() {
        List<PlayerTurnStats> stats = List.of(
                new PlayerTurnStats(A, 2, 1, 0, false),
                new PlayerTurnStats(B, 1, 1, 0, false),
                new PlayerTurnStats(C, 1, 3, 1, false));

        Optional<PlayerTurnStats> chosen = pipeline.select(stats, context(TurnType.WRITING, 3, null));

        assertThat(chosen).map(PlayerTurnStats::playerId).contains(B);
    }

    @Test
    @DisplayName("所有人都已在本局出场时无人可选")
    void emptyWhenEveryonePlayedInGame() {
        List<PlayerTurnStats> stats = List.of(
                new PlayerTurnStats(A, 0, 0, 0, true),
                new PlayerTurnStats(B, 0, 0, 0, true));

        assertThat(pipeline.select(stats, context(TurnType.DRAWING, 2, null))).isEmpty();
    }

    @Test
    @DisplayName("PENDING 规则永不放宽")
    void pendingPlayersNeverChosen() {
        List<PlayerTurnStats> stats = List.of(new PlayerTurnStats(A, 0, 0, 1, false));

        assertThat(pipeline.select(stats, context(TurnType.WRITING, 1, null))).isEmpty();
    }

    @Test
    @DisplayName("完全相同的统计按 playerId 字符串升序取第一个")
    void tieBreakByPlayerIdString() {
        List<PlayerTurnStats> stats = List.of(
                new PlayerTurnStats(C, 0, 0, 0, false),
                new PlayerTurnStats(A, 0, 0, 0, false),
                new PlayerTurnStats(B, 0, 0, 0, false));

        assertThat(pipeline.select(stats, context(TurnType.WRITING, 6, null)))
                .map(PlayerTurnStats::playerId).contains(A);
    }

    @Test
    @DisplayName("上一回合的玩家被避开")
    void avoidsPreviousPlayer() {
        List<PlayerTurnStats> stats = List.of(
                new PlayerTurnStats(A, 0, 0, 0, false),
                new PlayerTurnStats(B, 0, 0, 0, false));

        assertThat(pipeline.select(stats, context(TurnType.WRITING, 6, A)))
                .map(PlayerTurnStats::playerId).contains(B);
    }

    @Test
    @DisplayName("上一回合玩家是唯一候选人时仍然选他")
    void antiRepeatSkippedWhenItWouldEmptySet() {
        List<PlayerTurnStats> stats = List.of(new PlayerTurnStats(A, 0, 0, 0, false));

        assertThat(pipeline.select(stats, context(TurnType.WRITING, 6, A)))
                .map(PlayerTurnStats::playerId).contains(A);
    }

    @Nested
    class Rules {

        @Test
        void quotaExcludesPlayersAtHalfTheSeason() {
            List<PlayerTurnStats> stats = List.of(
                    new PlayerTurnStats(A, 0, 2, 0, false),
                    new PlayerTurnStats(B, 0, 1, 0, false));

            List<PlayerTurnStats> kept = new TypeQuotaRule().apply(stats, context(TurnType.DRAWING, 4, null));

            assertThat(kept).extracting(PlayerTurnStats::playerId).containsExactly(B);
        }

        @Test
        void minimumCountKeepsAllTiedPlayers() {
            List<PlayerTurnStats> stats = List.of(
                    new PlayerTurnStats(A, 1, 0, 0, false),
                    new PlayerTurnStats(B, 1, 5, 0, false),
                    new PlayerTurnStats(C, 2, 0, 0, false));

            List<PlayerTurnStats> kept = new MinimumTypeCountRule().apply(stats, context(TurnType.WRITING, 3, null));

            assertThat(kept).extracting(PlayerTurnStats::playerId).containsExactly(A, B);
        }

        @Test
        void antiRepeatIsNoOpWithoutPreviousTurn() {
            List<PlayerTurnStats> stats = List.of(new PlayerTurnStats(A, 0, 0, 0, false));

            assertThat(new AntiRepeatRule().apply(stats, context(TurnType.WRITING, 1, null))).isEqualTo(stats);
        }

        @Test
        void standardOrderPutsMandatoryRulesFirst() {
            assertThat(PlayerSelectionPipeline.standard().rules())
                    .extracting(r -> r.name() + ":" + r.mandatory())
                    .containsExactly(
                            "not-played-in-game:true",
                            "no-pending-turn:true",
                            "anti-repeat:false",
                            "type-quota:false",
                            "minimum-type-count:false",
                            "fewest-pending:false");
        }
    }
}
