package com.relayhub.turnservice.engine;

import com.relayhub.turnservice.EngineIntegrationSupport;
import com.relayhub.turnservice.domain.enums.ContentType;
import com.relayhub.turnservice.domain.enums.TimeoutPhase;
import com.relayhub.turnservice.domain.enums.TurnStatus;
import com.relayhub.turnservice.domain.enums.TurnType;
import com.relayhub.turnservice.domain.model.Game;
import com.relayhub.turnservice.domain.model.Player;
import com.relayhub.turnservice.domain.model.ScheduledJob;
import com.relayhub.turnservice.domain.model.Season;
import com.relayhub.turnservice.domain.model.SeasonConfig;
import com.relayhub.turnservice.domain.model.Turn;
import com.relayhub.turnservice.engine.offering.OfferReason;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 随机操作序列下校验回合不变量：
 * 玩家在赛季内最多一个 PENDING；同局同一玩家最多一个已分配回合；
 * 回合序号连续且类型按序列循环；超时任务与 OFFERED/PENDING 回合一一对应。
 */
class TurnEngineInvariantsTest extends EngineIntegrationSupport {

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 2024L})
    void invariantsHoldUnderRandomOperations(long seed) {
        Random random = new Random(seed);
        Season season = seasonWithPlayers(3, "writing,drawing,drawing");
        List<Player> players = members(season);
        List<Game> games = seasonService.activateSeason(season.getId());
        SeasonConfig config = seasonRepository.findById(season.getId()).orElseThrow().getConfig();

        assertInvariants(season, config);
        for (int step = 0; step < 150; step++) {
            List<Turn> turns = turnRepository.findAllInSeason(season.getId());
            if (turns.isEmpty()) {
                break;
            }
            Turn turn = turns.get(random.nextInt(turns.size()));
            Player player = players.get(random.nextInt(players.size()));
            switch (random.nextInt(6)) {
                case 0 -> lifecycleManager.offer(turn.getId(), player.getId());
                case 1 -> lifecycleManager.claim(turn.getId(),
                        random.nextBoolean() && turn.getPlayerId() != null ? turn.getPlayerId() : player.getId());
                case 2 -> submit(turn, random);
                case 3 -> lifecycleManager.dismiss(turn.getId());
                case 4 -> lifecycleManager.skip(turn.getId());
                default -> orchestrator.offerNext(games.get(random.nextInt(games.size())).getId(),
                        OfferReason.MANUAL_RECHECK);
            }
            assertInvariants(season, config);
        }
    }

    private void submit(Turn turn, Random random) {
        UUID playerId = turn.getPlayerId() == null ? UUID.randomUUID() : turn.getPlayerId();
        if (turn.getType() == TurnType.WRITING) {
            lifecycleManager.submit(turn.getId(), playerId, "line " + random.nextInt(1000), ContentType.TEXT);
        } else {
            lifecycleManager.submit(turn.getId(), playerId, "https://img.example.org/" + random.nextInt(1000),
                    ContentType.IMAGE);
        }
    }

    private void assertInvariants(Season season, SeasonConfig config) {
        List<Turn> turns = turnRepository.findAllInSeason(season.getId());

        Map<UUID, Long> pendingPerPlayer = turns.stream()
                .filter(t -> t.getStatus() == TurnStatus.PENDING)
                .collect(Collectors.groupingBy(Turn::getPlayerId, Collectors.counting()));
        assertThat(pendingPerPlayer.values()).allMatch(c -> c == 1L);

        Map<UUID, List<Turn>> byGame = turns.stream().collect(Collectors.groupingBy(Turn::getGameId));
        for (List<Turn> gameTurns : byGame.values()) {
            Set<UUID> assigned = new HashSet<>();
            for (Turn t : gameTurns) {
                if (TurnStatus.ASSIGNED.contains(t.getStatus())) {
                    assertThat(assigned.add(t.getPlayerId()))
                            .as("player %s assigned twice in game %s", t.getPlayerId(), t.getGameId())
                            .isTrue();
                }
            }

            gameTurns.sort(Comparator.comparingInt(Turn::getTurnNumber));
            for (int i = 0; i < gameTurns.size(); i++) {
                Turn t = gameTurns.get(i);
                assertThat(t.getTurnNumber()).isEqualTo(i + 1);
                assertThat(t.getType()).isEqualTo(config.typeForTurn(i + 1));
            }
        }

        Map<String, ScheduledJob> jobs = new HashMap<>();
        jobRepository.findAll().forEach(j -> jobs.put(j.getId(), j));
        Set<String> expected = new HashSet<>();
        for (Turn t : turns) {
            if (t.getStatus() == TurnStatus.OFFERED) {
                expected.add(TimeoutPhase.CLAIM.jobId(t.getId()));
            } else if (t.getStatus() == TurnStatus.PENDING) {
                expected.add(TimeoutPhase.SUBMISSION.jobId(t.getId()));
            }
        }
        assertThat(jobs.keySet()).isEqualTo(expected);
    }
}
