package com.relayhub.turnservice.engine;

import com.relayhub.turnservice.EngineIntegrationSupport;
import com.relayhub.turnservice.application.TurnTimeoutCoordinator;
import com.relayhub.turnservice.domain.enums.ContentType;
import com.relayhub.turnservice.domain.enums.GameStatus;
import com.relayhub.turnservice.domain.enums.SeasonStatus;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.TimeoutPayload;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.engine.core.EngineResult;
import com.relayhub.turnservice.engine.core.GameProgressEvent;
import com.relayhub.turnservice.engine.core.TurnLifecycleEvent;
import com.relayhub.turnservice.engine.offering.OfferReason;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 一个 4 人赛季从开赛跑到结束
 */
@RecordApplicationEvents
class TurnEngineEndToEndTest extends EngineIntegrationSupport {

    @Autowired
    private TurnTimeoutCoordinator timeoutCoordinator;

    @Autowired
    private ApplicationEvents events;

    @Test
    void fourPlayerSeasonRunsToCompletion() {
        Season season = seasonWithPlayers(4, "writing,drawing");
        List<Player> players = members(season);
        UUID lowest = players.stream()
                .map(Player::getId)
                .min(Comparator.comparing(UUID::toString))
                .orElseThrow();

        List<Game> games = seasonService.activateSeason(season.getId());
        assertThat(games).hasSize(4);

        // 第一局第 1 回合：统计全为 0，按 id 取最小的玩家
        Game first = games.get(0);
        Turn turn1 = turnRepository.findByGameIdOrderByTurnNumberAsc(first.getId()).get(0);
        assertThat(turn1.getStatus()).isEqualTo(TurnStatus.OFFERED);
        assertThat(turn1.getPlayerId()).isEqualTo(lowest);

        assertThat(lifecycleManager.claim(turn1.getId(), lowest).isOk()).isTrue();
        assertThat(lifecycleManager.submit(turn1.getId(), lowest, "a cat sitting on the moon", ContentType.TEXT).isOk())
                .isTrue();

        Turn turn2 = turnRepository.findByGameIdOrderByTurnNumberAsc(first.getId()).get(1);
        assertThat(turn2.getType()).isEqualTo(TurnType.DRAWING);
        assertThat(turn2.getStatus()).isEqualTo(TurnStatus.OFFERED);
        assertThat(turn2.getPlayerId()).isNotEqualTo(lowest);

        // 认领超时：撤回后重新邀请
        timeoutCoordinator.handleClaimTimeout(new TimeoutPayload(turn2.getId(), turn2.getPlayerId()));

        assertThat(events.stream(TurnLifecycleEvent.class)
                .filter(e -> e.getEventType() == TurnLifecycleEvent.EventType.DISMISSED)
                .map(TurnLifecycleEvent::getTurnId))
                .containsExactly(turn2.getId());
        Turn reoffered = reload(turn2);
        assertThat(reoffered.getStatus()).isEqualTo(TurnStatus.OFFERED);
        assertThat(reoffered.getPlayerId()).isNotEqualTo(lowest);
        assertThat(jobExists(TimeoutPhase.CLAIM.jobId(turn2.getId()))).isTrue();

        drive(season);

        assertThat(seasonRepository.findById(season.getId()).orElseThrow().getStatus())
                .isEqualTo(SeasonStatus.COMPLETED);
        for (Game game : games) {
            assertThat(gameRepository.findById(game.getId()).orElseThrow().getStatus()).isEqualTo(GameStatus.COMPLETED);
            List<Turn> turns = turnRepository.findByGameIdOrderByTurnNumberAsc(game.getId());
            assertThat(turns).hasSize(4);
            assertThat(turns).extracting(Turn::getStatus).containsOnly(TurnStatus.COMPLETED);
            assertThat(turns).extracting(Turn::getType)
                    .containsExactly(TurnType.WRITING, TurnType.DRAWING, TurnType.WRITING, TurnType.DRAWING);
            assertThat(new HashSet<>(turns.stream().map(Turn::getPlayerId).toList())).hasSize(4);
        }
        assertThat(jobRepository.count()).isZero();
        assertThat(events.stream(GameProgressEvent.class)
                .filter(e -> e.getEventType() == GameProgressEvent.EventType.GAME_COMPLETED))
                .hasSize(4);
        assertThat(events.stream(GameProgressEvent.class)
                .filter(e -> e.getEventType() == GameProgressEvent.EventType.SEASON_COMPLETED))
                .hasSize(1);
    }

    /**
     * 模拟玩家：每轮先补发邀请，再让每个玩家认领一个邀请，最后全部提交
     */
    private void drive(Season season) {
        for (int round = 0; round < 100; round++) {
            if (seasonRepository.findById(season.getId()).orElseThrow().getStatus() == SeasonStatus.COMPLETED) {
                return;
            }
            for (Game game : gameRepository.findBySeasonIdOrderByCreatedAtAsc(season.getId())) {
                List<Turn> turns = turnRepository.findByGameIdOrderByTurnNumberAsc(game.getId());
                boolean held = turns.stream()
                        .anyMatch(t -> t.getStatus() == TurnStatus.OFFERED || t.getStatus() == TurnStatus.PENDING);
                boolean available = turns.stream().anyMatch(t -> t.getStatus() == TurnStatus.AVAILABLE);
                if (!held && available) {
                    orchestrator.offerNext(game.getId(), OfferReason.MANUAL_RECHECK);
                }
            }

            Set<UUID> claimedThisRound = new HashSet<>();
            for (Turn offered : turnsIn(season, TurnStatus.OFFERED)) {
                if (claimedThisRound.add(offered.getPlayerId())) {
                    EngineResult<Turn> claimed = lifecycleManager.claim(offered.getId(), offered.getPlayerId());
                    if (!claimed.isOk()) {
                        claimedThisRound.remove(offered.getPlayerId());
                    }
                }
            }

            for (Turn pending : turnsIn(season, TurnStatus.PENDING)) {
                EngineResult<Turn> submitted = pending.getType() == TurnType.WRITING
                        ? lifecycleManager.submit(pending.getId(), pending.getPlayerId(), "caption " + round, ContentType.TEXT)
                        : lifecycleManager.submit(pending.getId(), pending.getPlayerId(),
                                "https://cdn.example.com/drawing/" + pending.getId() + ".png", ContentType.IMAGE);
                assertThat(submitted.isOk()).as("submit %s: %s", pending.getId(), submitted.message()).isTrue();
            }
        }
    }
}
